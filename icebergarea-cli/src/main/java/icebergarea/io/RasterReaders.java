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

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import javax.imageio.ImageIO;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import icebergarea.lib.analysis.images.SimpleImage;
import icebergarea.lib.analysis.images.SimpleImages;
import icebergarea.lib.images.BackscatterRaster;
import icebergarea.lib.images.BackscatterUnits;
import icebergarea.lib.images.Channel;
import icebergarea.lib.images.GeoTransform;

/**
 * Read single-band rasters (usually 32-bit float TIFF) using ImageIO.
 */
public class RasterReaders {
	
	private static final Logger logger = LoggerFactory.getLogger(RasterReaders.class);
	
	private RasterReaders() {
		throw new AssertionError();
	}
	
	/**
	 * Options describing how raster values should be interpreted.
	 */
	public static class RasterOptions {
		
		private GeoTransform transform = GeoTransform.identity();
		private float noDataValue = Float.NaN;
		private boolean decibels = false;
		
		/**
		 * Set the pixel-to-map transform.
		 * @param transform
		 * @return this instance
		 */
		public RasterOptions transform(GeoTransform transform) {
			this.transform = transform;
			return this;
		}
		
		/**
		 * Set the value used for pixels without data. NaN is always treated as nodata.
		 * @param noDataValue
		 * @return this instance
		 */
		public RasterOptions noDataValue(float noDataValue) {
			this.noDataValue = noDataValue;
			return this;
		}
		
		/**
		 * Specify that the raster contains backscatter in decibels, which should be converted to linear units.
		 * @param decibels
		 * @return this instance
		 */
		public RasterOptions decibels(boolean decibels) {
			this.decibels = decibels;
			return this;
		}
		
	}
	
	/**
	 * Read a backscatter raster for one channel.
	 * @param path
	 * @param channel
	 * @param options
	 * @return
	 * @throws IOException if the image cannot be read
	 */
	public static BackscatterRaster readBackscatter(Path path, Channel channel, RasterOptions options) throws IOException {
		var img = readImage(path);
		int width = img.getWidth();
		int height = img.getHeight();
		try {
			BackscatterRaster.checkDimensions(width, height);
		} catch (IllegalArgumentException e) {
			throw new IOException("Unable to read " + path + ": " + e.getLocalizedMessage(), e);
		}
		float[] values = img.getRaster().getSamples(0, 0, width, height, 0, (float[])null);
		
		// Mark nodata first, so that it survives conversion from decibels
		boolean hasNoData = !Float.isNaN(options.noDataValue);
		int nNoData = 0;
		for (int i = 0; i < values.length; i++) {
			if (hasNoData && values[i] == options.noDataValue) {
				values[i] = Float.NaN;
				nNoData++;
			}
		}
		if (options.decibels)
			BackscatterUnits.decibelsToLinearInPlace(values);
		
		var raster = BackscatterRaster.builder(channel, values, width, height)
				.transform(options.transform)
				.build();
		logger.info("Read {} from {} ({} nodata pixels)", raster, path, nNoData);
		return raster;
	}
	
	/**
	 * Read a single-band image, e.g. an incidence angle grid.
	 * @param path
	 * @return
	 * @throws IOException if the image cannot be read
	 */
	public static SimpleImage readSimpleImage(Path path) throws IOException {
		var img = readImage(path);
		float[] values = img.getRaster().getSamples(0, 0, img.getWidth(), img.getHeight(), 0, (float[])null);
		return SimpleImages.createFloatImage(values, img.getWidth(), img.getHeight());
	}
	
	private static BufferedImage readImage(Path path) throws IOException {
		if (!Files.isRegularFile(path))
			throw new IOException("Raster file " + path + " does not exist");
		var img = ImageIO.read(path.toFile());
		if (img == null)
			throw new IOException("Unable to read raster " + path + " - no suitable ImageIO reader found");
		int nBands = img.getRaster().getNumBands();
		if (nBands != 1)
			logger.warn("{} has {} bands, only the first will be used", path, nBands);
		return img;
	}

}
