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

import java.io.IOException;
import java.io.StringReader;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

@SuppressWarnings("javadoc")
public class TestGeoJsonTools {
	
	private static final String SQUARE = "{\"type\": \"Polygon\", \"coordinates\": [[[0, 0], [10, 0], [10, 10], [0, 10], [0, 0]]]}";
	private static final String OFFSET_SQUARE = "{\"type\": \"Polygon\", \"coordinates\": [[[20, 0], [30, 0], [30, 10], [20, 10], [20, 0]]]}";
	
	@Test
	public void test_bareGeometry() throws IOException {
		var geometry = GeoJsonTools.readPolygonal(new StringReader(SQUARE));
		assertEquals(100.0, geometry.getArea(), 1e-12);
	}
	
	@Test
	public void test_featureCollection(@TempDir Path dir) throws IOException {
		String json = "{\"type\": \"FeatureCollection\", \"features\": ["
				+ "{\"type\": \"Feature\", \"properties\": {}, \"geometry\": " + SQUARE + "},"
				+ "{\"type\": \"Feature\", \"properties\": {}, \"geometry\": null},"
				+ "{\"type\": \"Feature\", \"properties\": {}, \"geometry\": " + OFFSET_SQUARE + "}"
				+ "]}";
		var path = dir.resolve("aoi.geojson");
		Files.writeString(path, json);
		var geometry = GeoJsonTools.readPolygonal(path);
		assertEquals(200.0, geometry.getArea(), 1e-12);
		assertEquals(2, geometry.getNumGeometries());
	}
	
	@Test
	public void test_noPolygons() {
		assertThrows(IOException.class, () -> GeoJsonTools.readPolygonal(new StringReader("{\"type\": \"Point\", \"coordinates\": [1, 2]}")));
		assertThrows(IOException.class, () -> GeoJsonTools.readPolygonal(new StringReader("{\"type\": \"Hexagon\", \"coordinates\": []}")));
		assertThrows(IOException.class, () -> GeoJsonTools.readPolygonal(new StringReader("[1, 2, 3]")));
	}

}
