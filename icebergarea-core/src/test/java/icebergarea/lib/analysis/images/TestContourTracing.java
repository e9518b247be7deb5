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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Random;
import java.util.stream.Stream;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;
import org.locationtech.jts.geom.MultiPolygon;
import org.locationtech.jts.geom.Polygon;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import icebergarea.lib.roi.GeometryTools;

@SuppressWarnings("javadoc")
public class TestContourTracing {
	
	private static final Logger logger = LoggerFactory.getLogger(TestContourTracing.class);
	
	@Test
	public void test_square() {
		var labels = ConnectedComponents.label(TestConnectedComponents.parseMask(
				".....",
				".###.",
				".###.",
				"....."
				), 5, 4);
		var geometry = ContourTracing.traceLabel(labels, 1, GeometryTools.getDefaultFactory());
		assertTrue(geometry instanceof Polygon);
		assertEquals(6.0, geometry.getArea(), 1e-12);
		assertEquals(10.0, geometry.getLength(), 1e-12);
	}
	
	@Test
	public void test_ringKeepsHole() {
		var labels = ConnectedComponents.label(TestConnectedComponents.parseMask(
				"###",
				"#.#",
				"###"
				), 3, 3);
		var geometry = ContourTracing.traceLabel(labels, 1, GeometryTools.getDefaultFactory());
		assertTrue(geometry instanceof Polygon);
		assertEquals(1, ((Polygon)geometry).getNumInteriorRing());
		assertEquals(8.0, geometry.getArea(), 1e-12);
	}
	
	@Test
	public void test_diagonalGivesMultiPolygon() {
		var labels = ConnectedComponents.label(TestConnectedComponents.parseMask(
				"#..",
				".#.",
				"..#"
				), 3, 3);
		assertEquals(1, labels.getLabelCount());
		var geometry = ContourTracing.traceLabel(labels, 1, GeometryTools.getDefaultFactory());
		assertTrue(geometry instanceof MultiPolygon);
		assertEquals(3, geometry.getNumGeometries());
		assertEquals(3.0, geometry.getArea(), 1e-12);
	}
	
	@Test
	public void test_neighbouringLabelsAreSeparate() {
		var labels = ConnectedComponents.label(TestConnectedComponents.parseMask(
				"##..##",
				"##..##"
				), 6, 2);
		var first = ContourTracing.traceLabel(labels, 1, GeometryTools.getDefaultFactory());
		var second = ContourTracing.traceLabel(labels, 2, GeometryTools.getDefaultFactory());
		assertEquals(4.0, first.getArea(), 1e-12);
		assertEquals(4.0, second.getArea(), 1e-12);
		assertEquals(0.0, first.intersection(second).getArea(), 1e-12);
	}
	
	static Stream<Arguments> provideRandomMasks() {
		return Stream.of(
				Arguments.of(20, 15, 0.3, 1L),
				Arguments.of(32, 32, 0.5, 2L),
				Arguments.of(50, 40, 0.6, 3L)
				);
	}
	
	@ParameterizedTest
	@MethodSource("provideRandomMasks")
	public void test_areaMatchesPixelCount(int width, int height, double density, long seed) {
		var random = new Random(seed);
		boolean[] mask = new boolean[width * height];
		for (int i = 0; i < mask.length; i++)
			mask[i] = random.nextDouble() < density;
		var labels = ConnectedComponents.label(mask, width, height);
		logger.debug("Tracing {} labels", labels.getLabelCount());
		for (int label = 1; label <= labels.getLabelCount(); label++) {
			var geometry = ContourTracing.traceLabel(labels, label, GeometryTools.getDefaultFactory());
			assertEquals(labels.getPixelCount(label), geometry.getArea(), 1e-9);
		}
	}
	
	@Test
	public void test_thresholdedImage() {
		float[] values = {
				0, 0, 0, 0,
				0, 5, 6, 0,
				0, 0, 9, 0
		};
		var image = SimpleImages.createFloatImage(values, 4, 3);
		var geometry = ContourTracing.createTracedGeometry(image, 5, 8, null, GeometryTools.getDefaultFactory());
		assertEquals(2.0, geometry.getArea(), 1e-12);
		var all = ContourTracing.createTracedGeometry(image, 1, Double.POSITIVE_INFINITY, null, GeometryTools.getDefaultFactory());
		assertEquals(3.0, all.getArea(), 1e-12);
	}

}
