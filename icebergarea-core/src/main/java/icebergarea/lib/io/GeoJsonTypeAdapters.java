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
import java.util.Locale;

import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.GeometryCollection;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.LineString;
import org.locationtech.jts.geom.LinearRing;
import org.locationtech.jts.geom.MultiLineString;
import org.locationtech.jts.geom.MultiPoint;
import org.locationtech.jts.geom.MultiPolygon;
import org.locationtech.jts.geom.Point;
import org.locationtech.jts.geom.Polygon;

import com.google.gson.Gson;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.TypeAdapter;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonWriter;

import icebergarea.lib.common.GeneralTools;
import icebergarea.lib.roi.GeometryTools;

/**
 * Read and write JTS geometries as GeoJSON geometry objects.
 */
class GeoJsonTypeAdapters {
	
	static final GeometryTypeAdapter GEOMETRY_ADAPTER_INSTANCE = new GeometryTypeAdapter(3);
	
	private static final Gson gson = new Gson();
	
	
	static class GeometryTypeAdapter extends TypeAdapter<Geometry> {
		
		private final int numDecimalPlaces;
		
		GeometryTypeAdapter(int numDecimalPlaces) {
			this.numDecimalPlaces = numDecimalPlaces;
		}

		@Override
		public void write(JsonWriter out, Geometry geometry) throws IOException {
			writeGeometry(geometry, out, numDecimalPlaces);
		}

		@Override
		public Geometry read(JsonReader in) throws IOException {
			JsonObject obj = gson.fromJson(in, JsonObject.class);
			return parseGeometry(obj, GeometryTools.getDefaultFactory());
		}
		
	}
	
	
	static Geometry parseGeometry(JsonObject obj, GeometryFactory factory) {
		if (!obj.has("type"))
			throw new JsonParseException("GeoJSON geometry has no type: " + obj);
		String type = obj.get("type").getAsString();
		if ("GeometryCollection".equals(type))
			return parseGeometryCollection(obj, factory);
		if (!obj.has("coordinates"))
			throw new JsonParseException("GeoJSON " + type + " has no coordinates");
		JsonArray coordinates = obj.getAsJsonArray("coordinates");
		switch (type) {
		case "Point":
			return factory.createPoint(parseCoordinate(coordinates));
		case "MultiPoint":
			return factory.createMultiPointFromCoords(parseCoordinateArray(coordinates));
		case "LineString":
			return factory.createLineString(parseCoordinateArray(coordinates));
		case "MultiLineString":
			return parseMultiLineString(coordinates, factory);
		case "Polygon":
			return parsePolygon(coordinates, factory);
		case "MultiPolygon":
			return parseMultiPolygon(coordinates, factory);
		default:
			throw new JsonParseException("Unsupported GeoJSON geometry type " + type);
		}
	}

	/**
	 * Parse a coordinate from a JsonArray; any third (z) element is ignored.
	 */
	private static Coordinate parseCoordinate(JsonArray array) {
		return new Coordinate(array.get(0).getAsDouble(), array.get(1).getAsDouble());
	}

	private static Coordinate[] parseCoordinateArray(JsonArray array) {
		Coordinate[] coordinates = new Coordinate[array.size()];
		for (int i = 0; i < array.size(); i++)
			coordinates[i] = parseCoordinate(array.get(i).getAsJsonArray());
		return coordinates;
	}

	private static MultiLineString parseMultiLineString(JsonArray coords, GeometryFactory factory) {
		LineString[] lineStrings = new LineString[coords.size()];
		for (int i = 0; i < coords.size(); i++)
			lineStrings[i] = factory.createLineString(parseCoordinateArray(coords.get(i).getAsJsonArray()));
		return factory.createMultiLineString(lineStrings);
	}

	private static Polygon parsePolygon(JsonArray coords, GeometryFactory factory) {
		int n = coords.size();
		if (n == 0)
			return factory.createPolygon();
		LinearRing shell = factory.createLinearRing(parseCoordinateArray(coords.get(0).getAsJsonArray()));
		LinearRing[] holes = new LinearRing[n-1];
		for (int i = 1; i < n; i++)
			holes[i-1] = factory.createLinearRing(parseCoordinateArray(coords.get(i).getAsJsonArray()));
		return factory.createPolygon(shell, holes);
	}

	private static MultiPolygon parseMultiPolygon(JsonArray coords, GeometryFactory factory) {
		Polygon[] polygons = new Polygon[coords.size()];
		for (int i = 0; i < polygons.length; i++)
			polygons[i] = parsePolygon(coords.get(i).getAsJsonArray(), factory);
		return factory.createMultiPolygon(polygons);
	}

	private static GeometryCollection parseGeometryCollection(JsonObject obj, GeometryFactory factory) {
		JsonArray array = obj.getAsJsonArray("geometries");
		Geometry[] geometries = new Geometry[array == null ? 0 : array.size()];
		for (int i = 0; i < geometries.length; i++)
			geometries[i] = parseGeometry(array.get(i).getAsJsonObject(), factory);
		return factory.createGeometryCollection(geometries);
	}

	/**
	 * Write a geometry as a complete GeoJSON geometry object.
	 */
	static void writeGeometry(Geometry geometry, JsonWriter out, int nDecimals) throws IOException {
		out.beginObject();
		out.name("type");
		out.value(geometry.getGeometryType());
		if (geometry instanceof GeometryCollection && !(geometry instanceof MultiPoint || geometry instanceof MultiLineString || geometry instanceof MultiPolygon)) {
			out.name("geometries");
			out.beginArray();
			for (int i = 0; i < geometry.getNumGeometries(); i++)
				writeGeometry(geometry.getGeometryN(i), out, nDecimals);
			out.endArray();
		} else {
			out.name("coordinates");
			writeCoordinates(geometry, out, nDecimals);
		}
		out.endObject();
	}

	private static void writeCoordinates(Geometry geometry, JsonWriter out, int nDecimals) throws IOException {
		if (geometry instanceof Point) {
			if (geometry.isEmpty()) {
				out.beginArray();
				out.endArray();
			} else
				out.jsonValue(coordinateToString(geometry.getCoordinate(), nDecimals));
		} else if (geometry instanceof LineString || geometry instanceof MultiPoint) {
			out.beginArray();
			for (Coordinate c : geometry.getCoordinates())
				out.jsonValue(coordinateToString(c, nDecimals));
			out.endArray();
		} else if (geometry instanceof Polygon) {
			var polygon = (Polygon)geometry;
			out.beginArray();
			if (!polygon.isEmpty()) {
				writeCoordinates(polygon.getExteriorRing(), out, nDecimals);
				for (int i = 0; i < polygon.getNumInteriorRing(); i++)
					writeCoordinates(polygon.getInteriorRingN(i), out, nDecimals);
			}
			out.endArray();
		} else if (geometry instanceof MultiLineString || geometry instanceof MultiPolygon) {
			out.beginArray();
			for (int i = 0; i < geometry.getNumGeometries(); i++)
				writeCoordinates(geometry.getGeometryN(i), out, nDecimals);
			out.endArray();
		} else
			throw new IllegalArgumentException("Unable to write coordinates for geometry type " + geometry.getGeometryType());
	}

	private static String coordinateToString(Coordinate coord, int nDecimals) {
		return "[" + GeneralTools.formatNumber(Locale.US, coord.x, nDecimals) + ", "
				+ GeneralTools.formatNumber(Locale.US, coord.y, nDecimals) + "]";		
	}

}
