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

package icebergarea.io;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.awt.Transparency;
import java.awt.color.ColorSpace;
import java.awt.image.BandedSampleModel;
import java.awt.image.BufferedImage;
import java.awt.image.ComponentColorModel;
import java.awt.image.DataBuffer;
import java.awt.image.DataBufferFloat;
import java.awt.image.Raster;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import javax.imageio.ImageIO;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import icebergarea.io.RasterReaders.RasterOptions;
import icebergarea.lib.images.Channel;
import icebergarea.lib.images.GeoTransform;

@SuppressWarnings("javadoc")
public class TestRasterReaders {
	
	/**
	 * Write a single-band 32-bit float TIFF.
	 */
	public static void writeFloatTiff(Path path, float[] values, int width, int height) throws IOException {
		var sampleModel = new BandedSampleModel(DataBuffer.TYPE_FLOAT, width, height, 1);
		var buffer = new DataBufferFloat(values.clone(), values.length);
		var raster = Raster.createWritableRaster(sampleModel, buffer, null);
		var colorModel = new ComponentColorModel(ColorSpace.getInstance(ColorSpace.CS_GRAY), 
				false, false, Transparency.OPAQUE, DataBuffer.TYPE_FLOAT);
		var img = new BufferedImage(colorModel, raster, false, null);
		if (!ImageIO.write(img, "tiff", path.toFile()))
			throw new IOException("No ImageIO writer available for float TIFF");
	}
	
	@Test
	public void test_readFloatTiff(@TempDir Path dir) throws IOException {
		float[] values = {0.01f, 0.02f, 0.5f, 1.25f, 0f, 3e-4f};
		var path = dir.resolve("hh.tif");
		writeFloatTiff(path, values, 3, 2);
		
		var transform = GeoTransform.create(100, 200, 40, -40);
		var raster = RasterReaders.readBackscatter(path, Channel.HH, new RasterOptions().transform(transform));
		assertEquals(Channel.HH, raster.getChannel());
		assertEquals(3, raster.getWidth());
		assertEquals(2, raster.getHeight());
		assertEquals(transform, raster.getTransform());
		assertEquals(1600.0, raster.getPixelArea(), 1e-12);
		for (int i = 0; i < values.length; i++)
			assertEquals(values[i], raster.getValue(i));
	}
	
	@Test
	public void test_noDataAndDecibels(@TempDir Path dir) throws IOException {
		float[] values = {-20f, -10f, 0f, -9999f};
		var path = dir.resolve("hv.tif");
		writeFloatTiff(path, values, 2, 2);
		
		var raster = RasterReaders.readBackscatter(path, Channel.HV, new RasterOptions()
				.decibels(true)
				.noDataValue(-9999f));
		assertEquals(0.01f, raster.getValue(0), 1e-7);
		assertEquals(0.1f, raster.getValue(1), 1e-6);
		assertEquals(1.0f, raster.getValue(2), 1e-6);
		assertFalse(raster.isValid(3));
		assertEquals(3, raster.countValid());
		
		// Without a nodata value, the same pixel underflows to zero, which is valid
		var rasterNoNodata = RasterReaders.readBackscatter(path, Channel.HV, new RasterOptions().decibels(true));
		assertTrue(rasterNoNodata.isValid(3));
	}
	
	@Test
	public void test_incidenceImage(@TempDir Path dir) throws IOException {
		var path = dir.resolve("incidence.tif");
		writeFloatTiff(path, new float[] {20f, 30f, 40f, 45f}, 4, 1);
		var img = RasterReaders.readSimpleImage(path);
		assertEquals(4, img.getWidth());
		assertEquals(1, img.getHeight());
		assertEquals(40f, img.getValue(2, 0));
	}
	
	@Test
	public void test_invalidFiles(@TempDir Path dir) throws IOException {
		var missing = dir.resolve("missing.tif");
		assertThrows(IOException.class, () -> RasterReaders.readBackscatter(missing, Channel.HH, new RasterOptions()));
		var text = dir.resolve("text.tif");
		Files.writeString(text, "Not an image");
		assertThrows(IOException.class, () -> RasterReaders.readBackscatter(text, Channel.HH, new RasterOptions()));
	}

}
