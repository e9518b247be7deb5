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

package icebergarea.lib.images;

import java.util.Objects;

import icebergarea.lib.analysis.images.SimpleImage;

/**
 * Immutable, calibrated and geocoded backscatter grid for a single polarization channel.
 * <p>
 * Values are linear intensities stored row-wise. A pixel is invalid if it is NaN, infinite, negative, 
 * or equal to the nodata value; invalid pixels are ignored by all later processing.
 */
public class BackscatterRaster implements SimpleImage {
	
	/**
	 * Maximum number of pixels in a raster.
	 * This is limited by the summed area tables used for local statistics, which need one extra row and column.
	 */
	public static final long MAX_PIXEL_COUNT = Integer.MAX_VALUE - 8;
	
	private final Channel channel;
	private final int width;
	private final int height;
	private final float[] values;
	private final float noDataValue;
	private final GeoTransform transform;
	private final double pixelArea;
	
	private BackscatterRaster(Builder builder) {
		this.channel = builder.channel;
		this.width = builder.width;
		this.height = builder.height;
		this.values = builder.values.clone();
		this.noDataValue = builder.noDataValue;
		this.transform = builder.transform;
		this.pixelArea = Double.isNaN(builder.pixelArea) ? transform.getPixelArea() : builder.pixelArea;
	}
	
	/**
	 * Create a raster using the identity transform (unit pixel area) and NaN as nodata.
	 * @param channel
	 * @param values row-wise values; these are copied
	 * @param width
	 * @param height
	 * @return
	 */
	public static BackscatterRaster create(Channel channel, float[] values, int width, int height) {
		return builder(channel, values, width, height).build();
	}
	
	/**
	 * Create a builder for a new raster.
	 * @param channel
	 * @param values row-wise values; these are copied when the raster is built
	 * @param width
	 * @param height
	 * @return
	 */
	public static Builder builder(Channel channel, float[] values, int width, int height) {
		return new Builder(channel, values, width, height);
	}
	
	/**
	 * Check that a raster with the given dimensions can be processed.
	 * @param width
	 * @param height
	 * @throws IllegalArgumentException if either dimension is not positive, or the raster is too large
	 */
	public static void checkDimensions(int width, int height) throws IllegalArgumentException {
		if (width <= 0 || height <= 0)
			throw new IllegalArgumentException("Raster dimensions must be positive, but got " + width + "x" + height);
		if (((long)width + 1) * ((long)height + 1) > MAX_PIXEL_COUNT)
			throw new IllegalArgumentException("Raster " + width + "x" + height + " is too large, the maximum is " + MAX_PIXEL_COUNT + " pixels including a border");
	}
	
	/**
	 * Get the polarization channel.
	 * @return
	 */
	public Channel getChannel() {
		return channel;
	}
	
	@Override
	public int getWidth() {
		return width;
	}
	
	@Override
	public int getHeight() {
		return height;
	}
	
	@Override
	public float getValue(int x, int y) {
		return values[y * width + x];
	}
	
	/**
	 * Get the value at a row-wise pixel index.
	 * @param index
	 * @return
	 */
	public float getValue(int index) {
		return values[index];
	}
	
	/**
	 * Returns true if the pixel holds usable backscatter.
	 * @param x
	 * @param y
	 * @return
	 */
	public boolean isValid(int x, int y) {
		return isValid(y * width + x);
	}
	
	/**
	 * Returns true if the pixel at the row-wise index holds usable backscatter.
	 * @param index
	 * @return
	 */
	public boolean isValid(int index) {
		float v = values[index];
		return Float.isFinite(v) && v >= 0f && v != noDataValue;
	}
	
	/**
	 * Count the number of valid pixels.
	 * @return
	 */
	public long countValid() {
		long count = 0;
		for (int i = 0; i < values.length; i++) {
			if (isValid(i))
				count++;
		}
		return count;
	}
	
	/**
	 * Get the nodata value; NaN pixels are always treated as nodata as well.
	 * @return
	 */
	public float getNoDataValue() {
		return noDataValue;
	}
	
	/**
	 * Get the transform from pixel to map coordinates.
	 * @return
	 */
	public GeoTransform getTransform() {
		return transform;
	}
	
	/**
	 * Area of a single pixel in squared map units (usually m<sup>2</sup>).
	 * @return
	 */
	public double getPixelArea() {
		return pixelArea;
	}
	
	/**
	 * Get a copy of the pixel values.
	 * @return
	 */
	public float[] getValues() {
		return values.clone();
	}
	
	@Override
	public String toString() {
		return String.format("BackscatterRaster[%s, %dx%d, pixel area=%s]", channel, width, height, pixelArea);
	}
	
	
	/**
	 * Builder for {@link BackscatterRaster}.
	 */
	public static class Builder {
		
		private final Channel channel;
		private final float[] values;
		private final int width;
		private final int height;
		private float noDataValue = Float.NaN;
		private GeoTransform transform = GeoTransform.identity();
		private double pixelArea = Double.NaN;
		
		private Builder(Channel channel, float[] values, int width, int height) {
			this.channel = Objects.requireNonNull(channel, "Channel must not be null");
			Objects.requireNonNull(values, "Values must not be null");
			checkDimensions(width, height);
			if ((long)width * height != values.length)
				throw new IllegalArgumentException("Expected " + ((long)width * height) + " values for a " + width + "x" + height + " raster, but got " + values.length);
			this.values = values;
			this.width = width;
			this.height = height;
		}
		
		/**
		 * Set the nodata value.
		 * @param noDataValue
		 * @return this builder
		 */
		public Builder noDataValue(float noDataValue) {
			this.noDataValue = noDataValue;
			return this;
		}
		
		/**
		 * Set the pixel-to-map transform. The pixel area is derived from this unless set explicitly.
		 * @param transform
		 * @return this builder
		 */
		public Builder transform(GeoTransform transform) {
			this.transform = Objects.requireNonNull(transform);
			return this;
		}
		
		/**
		 * Override the pixel area used for area calculations.
		 * @param pixelArea area of one pixel in squared map units; must be positive
		 * @return this builder
		 */
		public Builder pixelArea(double pixelArea) {
			if (!(pixelArea > 0) || !Double.isFinite(pixelArea))
				throw new IllegalArgumentException("Pixel area must be positive and finite, but got " + pixelArea);
			this.pixelArea = pixelArea;
			return this;
		}
		
		/**
		 * Build the raster.
		 * @return
		 */
		public BackscatterRaster build() {
			return new BackscatterRaster(this);
		}
		
	}

}
