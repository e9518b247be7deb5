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

package icebergarea.lib.objects;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;
import org.locationtech.jts.geom.Polygon;

import icebergarea.lib.detection.ChannelSettings;
import icebergarea.lib.detection.DetectionMask;
import icebergarea.lib.detection.GammaCfar;
import icebergarea.lib.images.BackscatterRaster;
import icebergarea.lib.images.Channel;
import icebergarea.lib.images.GeoTransform;
import icebergarea.lib.images.SyntheticRasters;

@SuppressWarnings("javadoc")
public class TestBlobExtractor {
	
	static DetectionMask parseMask(Channel channel, String... rows) {
		int w = rows[0].length();
		boolean[] mask = new boolean[w * rows.length];
		for (int y = 0; y < rows.length; y++) {
			for (int x = 0; x < w; x++)
				mask[y * w + x] = rows[y].charAt(x) == '#';
		}
		return DetectionMask.create(channel, mask, w, rows.length);
	}
	
	private static BackscatterRaster rasterFor(DetectionMask mask) {
		return BackscatterRaster.create(mask.getChannel(), 
				SyntheticRasters.uniform(mask.getWidth(), mask.getHeight(), SyntheticRasters.BACKGROUND), 
				mask.getWidth(), mask.getHeight());
	}
	
	@Test
	public void test_singleSquare() throws Exception {
		var raster = SyntheticRasters.squareScene(Channel.HV);
		var mask = GammaCfar.detect(raster, ChannelSettings.getDefault());
		var blobs = BlobExtractor.extractBlobs(mask, raster);
		assertEquals(1, blobs.size());
		var blob = blobs.get(0);
		assertEquals(1, blob.getId());
		assertEquals(Channel.HV, blob.getChannel());
		assertEquals(25, blob.getPixelCount());
		assertEquals(25.0, blob.getAreaCfar(), 1e-12);
		assertEquals(25.0, blob.getOutline().getArea(), 1e-12);
		assertFalse(blob.isTruncated());
		var bounds = blob.getBounds();
		assertEquals(22, bounds.getMinX());
		assertEquals(27, bounds.getMaxX());
		assertEquals(22, bounds.getMinY());
		assertEquals(27, bounds.getMaxY());
	}
	
	@Test
	public void test_mapCoordinates() throws Exception {
		var transform = GeoTransform.create(1000, 5000, 40, -40);
		var raster = BackscatterRaster.builder(Channel.HH, SyntheticRasters.squareSceneValues(), 50, 50)
				.transform(transform)
				.build();
		var blobs = BlobExtractor.extractBlobs(GammaCfar.detect(raster, ChannelSettings.getDefault()), raster);
		assertEquals(1, blobs.size());
		var blob = blobs.get(0);
		assertEquals(25 * 1600.0, blob.getAreaCfar(), 1e-6);
		assertEquals(blob.getAreaCfar(), blob.getOutline().getArea(), 1e-6);
		var envelope = blob.getOutline().getEnvelopeInternal();
		assertEquals(1000 + 22 * 40, envelope.getMinX(), 1e-9);
		assertEquals(1000 + 27 * 40, envelope.getMaxX(), 1e-9);
		assertEquals(5000 - 27 * 40, envelope.getMinY(), 1e-9);
		assertEquals(5000 - 22 * 40, envelope.getMaxY(), 1e-9);
		// Pixel bounds are unaffected by the transform
		assertEquals(22, blob.getBounds().getMinX());
	}
	
	@Test
	public void test_minPixelCount() {
		var mask = parseMask(Channel.HH,
				"#.....",
				"...##.",
				"...##.",
				"......",
				".##..#"
				);
		var raster = rasterFor(mask);
		var all = BlobExtractor.extractBlobs(mask, raster);
		assertEquals(4, all.size());
		assertArrayEquals(new int[] {1, 4, 2, 1}, all.stream().mapToInt(Blob::getPixelCount).toArray());
		
		var filtered = BlobExtractor.extractBlobs(mask, raster, 2);
		assertEquals(2, filtered.size());
		// Ids are consecutive after filtering
		assertEquals(1, filtered.get(0).getId());
		assertEquals(4, filtered.get(0).getPixelCount());
		assertEquals(2, filtered.get(1).getId());
		assertEquals(2, filtered.get(1).getPixelCount());
		
		assertThrows(IllegalArgumentException.class, () -> BlobExtractor.extractBlobs(mask, raster, 0));
	}
	
	@Test
	public void test_truncated() {
		var mask = parseMask(Channel.HH,
				"##....",
				"......",
				"..##..",
				"......",
				".....#"
				);
		var blobs = BlobExtractor.extractBlobs(mask, rasterFor(mask));
		assertEquals(3, blobs.size());
		assertTrue(blobs.get(0).isTruncated());
		assertFalse(blobs.get(1).isTruncated());
		assertTrue(blobs.get(2).isTruncated());
	}
	
	@Test
	public void test_ringKeepsHole() {
		var mask = parseMask(Channel.HV,
				".......",
				".#####.",
				".#...#.",
				".#...#.",
				".#####.",
				"......."
				);
		var blobs = BlobExtractor.extractBlobs(mask, rasterFor(mask));
		assertEquals(1, blobs.size());
		var blob = blobs.get(0);
		assertEquals(14, blob.getPixelCount());
		assertTrue(blob.getOutline() instanceof Polygon);
		assertEquals(1, ((Polygon)blob.getOutline()).getNumInteriorRing());
		assertEquals(blob.getAreaCfar(), blob.getOutline().getArea(), 1e-12);
	}
	
	@Test
	public void test_noDetections() {
		var mask = parseMask(Channel.HH, "....", "....");
		assertTrue(BlobExtractor.extractBlobs(mask, rasterFor(mask)).isEmpty());
	}
	
	@Test
	public void test_sizeMismatch() {
		var mask = parseMask(Channel.HH, "#...", "....");
		var raster = BackscatterRaster.create(Channel.HH, new float[6], 3, 2);
		assertThrows(IllegalArgumentException.class, () -> BlobExtractor.extractBlobs(mask, raster));
	}

}
