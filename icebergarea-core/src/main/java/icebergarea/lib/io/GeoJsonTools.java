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

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import org.locationtech.jts.geom.Geometry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;

import icebergarea.lib.roi.GeometryTools;

/**
 * Read areas of interest from GeoJSON.
 * <p>
 * The input may be a bare geometry, a Feature or a FeatureCollection; features without geometry are skipped.
 */
public class GeoJsonTools {
	
	private static final Logger logger = LoggerFactory.getLogger(GeoJsonTools.class);
	
	private GeoJsonTools() {
		throw new AssertionError();
	}
	
	/**
	 * Read a polygonal area from a GeoJSON file.
	 * @param path
	 * @return the union of all polygons in the file
	 * @throws IOException if the file cannot be read or contains no polygons
	 */
	public static Geometry readPolygonal(Path path) throws IOException {
		try (var reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
			return readPolygonal(reader);
		}
	}
	
	/**
	 * Read a polygonal area from GeoJSON.
	 * @param reader
	 * @return the union of all polygons
	 * @throws IOException if the JSON cannot be parsed or contains no polygons
	 */
	public static Geometry readPolygonal(Reader reader) throws IOException {
		JsonElement element;
		try {
			element = GsonTools.getInstance().fromJson(reader, JsonElement.class);
		} catch (JsonParseException e) {
			throw new IOException("Unable to parse GeoJSON: " + e.getLocalizedMessage(), e);
		}
		if (element == null || !element.isJsonObject())
			throw new IOException("GeoJSON must be an object");
		List<Geometry> geometries = new ArrayList<>();
		try {
			collectGeometries(element.getAsJsonObject(), geometries);
		} catch (JsonParseException | IllegalArgumentException | IllegalStateException e) {
			throw new IOException("Invalid GeoJSON: " + e.getLocalizedMessage(), e);
		}
		var polygonal = GeometryTools.ensurePolygonal(GeometryTools.union(geometries));
		if (polygonal.isEmpty())
			throw new IOException("GeoJSON contains no polygons");
		logger.debug("Read {} with area {}", polygonal.getGeometryType(), polygonal.getArea());
		return polygonal;
	}
	
	private static void collectGeometries(JsonObject obj, List<Geometry> geometries) {
		String type = obj.has("type") ? obj.get("type").getAsString() : null;
		if ("FeatureCollection".equals(type)) {
			for (var feature : obj.getAsJsonArray("features"))
				collectGeometries(feature.getAsJsonObject(), geometries);
		} else if ("Feature".equals(type)) {
			var geometry = obj.get("geometry");
			if (geometry != null && geometry.isJsonObject())
				geometries.add(GeoJsonTypeAdapters.parseGeometry(geometry.getAsJsonObject(), GeometryTools.getDefaultFactory()));
		} else {
			geometries.add(GeoJsonTypeAdapters.parseGeometry(obj, GeometryTools.getDefaultFactory()));
		}
	}

}
