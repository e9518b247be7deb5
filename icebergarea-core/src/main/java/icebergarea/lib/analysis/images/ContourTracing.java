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

package icebergarea.lib.analysis.images;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import org.locationtech.jts.dissolve.LineDissolver;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.LineString;
import org.locationtech.jts.operation.polygonize.Polygonizer;
import org.locationtech.jts.simplify.DouglasPeuckerSimplifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Static methods to trace the outlines of pixel regions as polygons.
 * <p>
 * Outlines follow pixel edges, so the area of a traced polygon (in pixel units) is exactly 
 * the number of pixels in the region. Holes are retained and regions that touch only diagonally 
 * give multipolygons.
 */
public class ContourTracing {
	
	private static final Logger logger = LoggerFactory.getLogger(ContourTracing.class);
	
	private ContourTracing() {
		throw new AssertionError();
	}
	
	/**
	 * Trace the outline of a single label, in pixel coordinates.
	 * @param image the labeled image
	 * @param label the label to trace
	 * @param factory geometry factory for the output
	 * @return a polygonal geometry, or an empty geometry if the label has no pixels
	 */
	public static Geometry traceLabel(LabeledImage image, int label, GeometryFactory factory) {
		if (label < 1 || label > image.getLabelCount())
			throw new IllegalArgumentException("Label " + label + " out of range (1-" + image.getLabelCount() + ")");
		return createTracedGeometry(image, label, label, image.getBounds(label), factory);
	}
	
	/**
	 * Create a traced geometry from all pixels of a {@link SimpleImage} within a range of values.
	 * 
	 * @param image input image
	 * @param minThresholdInclusive minimum value
	 * @param maxThresholdInclusive maximum value
	 * @param envelope optional bounding box (pixel coordinates) used to restrict the search; may be null
	 * @param factory geometry factory for the output
	 * @return a polygonal geometry in pixel coordinates
	 */
	public static Geometry createTracedGeometry(SimpleImage image, double minThresholdInclusive, double maxThresholdInclusive, 
			Envelope envelope, GeometryFactory factory) {
		Objects.requireNonNull(factory);
		var lines = traceCoordinates(image, minThresholdInclusive, maxThresholdInclusive, envelope);
		return createGeometry(factory, lines);
	}
	
	private static Geometry createGeometry(GeometryFactory factory, Collection<CoordinatePair> lines) {
		if (lines.isEmpty())
			return factory.createEmpty(2);

		var lineStrings = linesFromPairs(factory, lines);
		logger.trace("Created {} lines from {} pixel edges", lineStrings.getNumGeometries(), lines.size());

		var polygonizer = new Polygonizer(true);
		polygonizer.add(lineStrings);
		var geometry = polygonizer.getGeometry();
		geometry.normalize();
		return geometry;
	}
	
	/**
	 * Merge unit edges into the longest possible line strings, noded wherever more than two edges meet.
	 */
	private static Geometry linesFromPairs(GeometryFactory factory, Collection<CoordinatePair> pairs) {
		var dissolver = new LineDissolver();
		for (var p : pairs) {
			dissolver.add(createLineString(p, factory));
		}
		// Zero tolerance only removes collinear vertices
		return DouglasPeuckerSimplifier.simplify(dissolver.getResult(), 0);
	}

	private static LineString createLineString(CoordinatePair pair, GeometryFactory factory) {
		var c1 = pair.c1();
		var c2 = pair.c2();
		return factory.createLineString(new Coordinate[] {
				new Coordinate(c1.getX(), c1.getY()), new Coordinate(c2.getX(), c2.getY())});
	}
	
	/**
	 * Find all the unit pixel edges that separate pixels inside the range from pixels outside it.
	 * Edges are kept at unit length so that every corner where more than two edges meet is a node.
	 */
	private static List<CoordinatePair> traceCoordinates(SimpleImage image, double min, double max, Envelope envelope) {

		int xStart = 0;
		int yStart = 0;
		int xEnd = image.getWidth();
		int yEnd = image.getHeight();
		// Clip searched pixels using the envelope if provided
		if (envelope != null) {
			xStart = Math.max(xStart, (int)Math.floor(envelope.getMinX()-1));
			yStart = Math.max(yStart, (int)Math.floor(envelope.getMinY()-1));
			xEnd = Math.min(xEnd, (int)Math.ceil(envelope.getMaxX())+1);
			yEnd = Math.min(yEnd, (int)Math.ceil(envelope.getMaxY())+1);
		}

		List<CoordinatePair> lines = new ArrayList<>();
		Map<IntPoint, IntPoint> pointCache = new HashMap<>();
		for (int y = yStart; y <= yEnd; y++) {
			for (int x = xStart; x <= xEnd; x++) {
				boolean isOn = inRange(image, x, y, min, max);
				// Edge with the previous row
				if (isOn != inRange(image, x, y-1, min, max))
					lines.add(new CoordinatePair(createCoordinate(x, y, pointCache), createCoordinate(x+1, y, pointCache)));
				// Edge with the previous column
				if (isOn != inRange(image, x-1, y, min, max))
					lines.add(new CoordinatePair(createCoordinate(x, y, pointCache), createCoordinate(x, y+1, pointCache)));
			}
		}
		return lines;
	}

	private static IntPoint createCoordinate(int x, int y, Map<IntPoint, IntPoint> pointCache) {
		return pointCache.computeIfAbsent(new IntPoint(x, y), p -> p);
	}

	private static boolean inRange(SimpleImage image, int x, int y, double min, double max) {
		if (x < 0 || x >= image.getWidth() || y < 0 || y >= image.getHeight())
			return false;
		double val = image.getValue(x, y);
		return val >= min && val <= max;
	}

}
