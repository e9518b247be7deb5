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

import java.util.Objects;

/**
 * Create {@link SimpleImage SimpleImage} instances for basic pixel processing.
 */
public class SimpleImages {
	
	private SimpleImages() {
		throw new AssertionError();
	}
	
	/**
	 * Create a {@link SimpleImage} backed by an existing float array of pixels.
	 * <p>
	 * Pixels are stored in row-major order. The array is used directly and should not be modified afterwards.
	 * 
	 * @param data
	 * @param width
	 * @param height
	 * @return
	 */
	public static SimpleImage createFloatImage(float[] data, int width, int height) {
		Objects.requireNonNull(data);
		if (width <= 0 || height <= 0 || (long)width * height != data.length)
			throw new IllegalArgumentException("Cannot create " + width + "x" + height + " image from " + data.length + " pixels");
		return new FloatArraySimpleImage(data, width, height);
	}
	
	/**
	 * Check whether two images have the same dimensions.
	 * @param image
	 * @param other
	 * @return
	 */
	public static boolean sameSize(SimpleImage image, SimpleImage other) {
		return image.getWidth() == other.getWidth() && image.getHeight() == other.getHeight();
	}
	
	
	static class FloatArraySimpleImage implements SimpleImage {

		private final float[] data;
		private final int width;
		private final int height;
		
		FloatArraySimpleImage(float[] data, int width, int height) {
			this.data = data;
			this.width = width;
			this.height = height;
		}
		
		@Override
		public float getValue(int x, int y) {
			return data[y * width + x];
		}

		@Override
		public int getWidth() {
			return width;
		}

		@Override
		public int getHeight() {
			return height;
		}

	}
	
}
