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

package icebergarea.lib.io;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.Polygon;

import com.google.gson.JsonParseException;

import icebergarea.lib.roi.GeometryTools;

@SuppressWarnings("javadoc")
public class TestGsonTools {
	
	interface Shape {}
	
	static class Circle implements Shape {
		double radius;
	}
	
	static class Square implements Shape {
		double side;
	}
	
	@Test
	public void test_geometryAsGeoJson() {
		var gson = GsonTools.getInstance();
		var polygon = GeometryTools.createRectangle(500000, 7000000, 40, 40)
				.difference(GeometryTools.createRectangle(500010, 7000010, 10, 10));
		String json = gson.toJson(polygon, Geometry.class);
		assertTrue(json.startsWith("{\"type\":\"Polygon\",\"coordinates\":[[["), json);
		
		var parsed = gson.fromJson(json, Geometry.class);
		assertTrue(parsed instanceof Polygon);
		assertEquals(1, ((Polygon)parsed).getNumInteriorRing());
		assertEquals(polygon.getArea(), parsed.getArea(), 1e-6);
	}
	
	@Test
	public void test_specialFloatingPointValues() {
		var json = GsonTools.getInstance().toJson(new double[] {1.0, Double.NaN});
		assertEquals("[1.0,NaN]", json);
	}
	
	@Test
	public void test_subTypes() {
		var factory = GsonTools.createSubTypeAdapterFactory(Shape.class, "shape_type")
				.registerSubtype(Circle.class, "circle")
				.registerSubtype(Square.class, "square")
				.registerAlias(Square.class, "box");
		var gson = GsonTools.getInstance().newBuilder()
				.registerTypeAdapterFactory(factory)
				.create();
		
		var circle = new Circle();
		circle.radius = 2.5;
		String json = gson.toJson(circle, Shape.class);
		assertEquals("{\"shape_type\":\"circle\",\"radius\":2.5}", json);
		
		var parsed = gson.fromJson(json, Shape.class);
		assertEquals(2.5, ((Circle)parsed).radius);
		
		var square = gson.fromJson("{\"shape_type\": \"box\", \"side\": 3}", Shape.class);
		assertEquals(3.0, ((Square)square).side);
		
		assertThrows(JsonParseException.class, () -> gson.fromJson("{\"shape_type\": \"triangle\"}", Shape.class));
		assertThrows(JsonParseException.class, () -> gson.fromJson("{\"side\": 3}", Shape.class));
	}

}
