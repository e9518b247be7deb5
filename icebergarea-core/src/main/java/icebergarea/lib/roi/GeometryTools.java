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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;

import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.GeometryCollection;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.Polygon;
import org.locationtech.jts.geom.Polygonal;
import org.locationtech.jts.geom.PrecisionModel;
import org.locationtech.jts.geom.util.AffineTransformation;
import org.locationtech.jts.operation.union.UnaryUnionOp;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Convenience methods for working with Java Topology Suite geometries in map coordinates.
 */
public class GeometryTools {
	
	private static final Logger logger = LoggerFactory.getLogger(GeometryTools.class);
	
	// Map coordinates can be large (e.g. UTM northings), so use full double precision
	private static final GeometryFactory DEFAULT_FACTORY = new GeometryFactory(new PrecisionModel(PrecisionModel.FLOATING));
	
	private GeometryTools() {
		throw new AssertionError();
	}
	
	/**
	 * Get the default GeometryFactory used to construct geometries.
	 * @return
	 */
	public static GeometryFactory getDefaultFactory() {
		return DEFAULT_FACTORY;
	}
	
	/**
	 * Create a rectangular polygon.
	 * @param x
	 * @param y
	 * @param width
	 * @param height
	 * @return
	 */
	public static Polygon createRectangle(double x, double y, double width, double height) {
		var coords = new Coordinate[] {
				new Coordinate(x, y),
				new Coordinate(x + width, y),
				new Coordinate(x + width, y + height),
				new Coordinate(x, y + height),
				new Coordinate(x, y)
		};
		return DEFAULT_FACTORY.createPolygon(coords);
	}
	
	/**
	 * Apply an affine transformation, returning a new normalized geometry.
	 * @param geometry
	 * @param transform
	 * @return
	 */
	public static Geometry transform(Geometry geometry, AffineTransformation transform) {
		if (transform == null || transform.isIdentity())
			return geometry;
		// Transforms with a negative determinant reverse ring orientation
		var transformed = transform.transform(geometry);
		transformed.normalize();
		return transformed;
	}
	
	/**
	 * Calculate the union of multiple Geometry objects.
	 * @param geometries
	 * @return
	 */
	public static Geometry union(Geometry... geometries) {
		return union(Arrays.asList(geometries));
	}
	
	/**
	 * Calculate the union of multiple Geometry objects.
	 * @param geometries
	 * @return the union, or an empty polygon if no geometries are provided
	 */
	public static Geometry union(Collection<? extends Geometry> geometries) {
		if (geometries.isEmpty())
			return DEFAULT_FACTORY.createPolygon();
		if (geometries.size() == 1)
			return geometries.iterator().next();
		try {
			return UnaryUnionOp.union(new ArrayList<>(geometries));
		} catch (RuntimeException e) {
			logger.warn("Geometry union failed - attempting with buffer(0)", e);
			return DEFAULT_FACTORY.buildGeometry(geometries).buffer(0);
		}
	}
	
	/**
	 * Strip non-polygonal parts from a geometry collection (recursively).
	 * @param geometry
	 * @return a geometry containing only polygons, which may be the same as the input or empty
	 */
	public static Geometry ensurePolygonal(Geometry geometry) {
		if (geometry instanceof Polygonal)
			return geometry;
		if (!(geometry instanceof GeometryCollection))
			return geometry.getFactory().createPolygon();
		List<Geometry> keep = new ArrayList<>();
		for (int i = 0; i < geometry.getNumGeometries(); i++) {
			var part = ensurePolygonal(geometry.getGeometryN(i));
			if (!part.isEmpty())
				keep.add(part);
		}
		if (keep.isEmpty())
			return geometry.getFactory().createPolygon();
		return union(keep);
	}
	
	/**
	 * Get the maximum distance between any two vertices of a geometry.
	 * @param geometry
	 * @return the maximum distance, or 0 for geometries with fewer than two vertices
	 */
	public static double maxVertexDistance(Geometry geometry) {
		// Only the convex hull vertices can be extreme
		var coords = geometry.convexHull().getCoordinates();
		double maxDistSq = 0;
		for (int i = 0; i < coords.length; i++) {
			for (int j = i + 1; j < coords.length; j++) {
				double dx = coords[i].x - coords[j].x;
				double dy = coords[i].y - coords[j].y;
				double d = dx*dx + dy*dy;
				if (d > maxDistSq)
					maxDistSq = d;
			}
		}
		return Math.sqrt(maxDistSq);
	}

}
