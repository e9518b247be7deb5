/*-
 * #%L
 * This file is part of IcebergArea.
 * %%
 * Copyright (C) 2024 IcebergArea developers
 * %%
 * IcebergArea is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 * 
 * IcebergArea is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 * 
 * You should have received a copy of the GNU General Public License 
 * along with IcebergArea.  If not, see <https://www.gnu.org/licenses/>.
 * #L%
 */

package icebergarea.lib.roi;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;

import org.junit.jupiter.api.Test;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Geometry;

@SuppressWarnings("javadoc")
public class TestGeometryTools {
	
	@Test
	public void test_largeCoordinatesKeepPrecision() {
		var rect = GeometryTools.createRectangle(512345.125, 7012345.375, 40, 40);
		assertEquals(1600.0, rect.getArea(), 1e-6);
		assertEquals(512345.125, rect.getEnvelopeInternal().getMinX());
	}
	
	@Test
	public void test_union() {
		var a = GeometryTools.createRectangle(0, 0, 10, 10);
		var b = GeometryTools.createRectangle(5, 0, 10, 10);
		assertEquals(150.0, GeometryTools.union(a, b).getArea(), 1e-9);
		assertSame(a, GeometryTools.union(List.of(a)));
		assertTrue(GeometryTools.union(List.of()).isEmpty());
	}
	
	@Test
	public void test_ensurePolygonal() {
		var factory = GeometryTools.getDefaultFactory();
		var polygon = GeometryTools.createRectangle(0, 0, 2, 2);
		var line = factory.createLineString(new Coordinate[] {new Coordinate(0, 0), new Coordinate(5, 5)});
		var collection = factory.createGeometryCollection(new Geometry[] {polygon, line});
		var polygonal = GeometryTools.ensurePolygonal(collection);
		assertEquals(4.0, polygonal.getArea(), 1e-12);
		assertTrue(GeometryTools.ensurePolygonal(line).isEmpty());
	}
	
	@Test
	public void test_maxVertexDistance() {
		assertEquals(5.0, GeometryTools.maxVertexDistance(GeometryTools.createRectangle(0, 0, 3, 4)), 1e-12);
		assertEquals(0.0, GeometryTools.maxVertexDistance(GeometryTools.getDefaultFactory().createPoint(new Coordinate(1, 1))));
	}

}
