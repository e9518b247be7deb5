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

import java.util.Arrays;
import java.util.Random;

/**
 * Synthetic backscatter rasters for tests.
 */
@SuppressWarnings("javadoc")
public class SyntheticRasters {
	
	public static final float BACKGROUND = 0.01f;
	public static final float TARGET = 1.0f;
	
	/**
	 * Create a raster with a uniform background.
	 */
	public static float[] uniform(int width, int height, float value) {
		float[] values = new float[width * height];
		Arrays.fill(values, value);
		return values;
	}
	
	/**
	 * Create a raster with exponentially distributed (single-look) clutter.
	 */
	public static float[] clutter(int width, int height, double mean, long seed) {
		var random = new Random(seed);
		float[] values = new float[width * height];
		for (int i = 0; i < values.length; i++)
			values[i] = (float)(-Math.log(1.0 - random.nextDouble()) * mean);
		return values;
	}
	
	/**
	 * Set a rectangle of pixels to a fixed value.
	 */
	public static float[] fill(float[] values, int width, int x, int y, int w, int h, float value) {
		for (int yy = y; yy < y + h; yy++) {
			for (int xx = x; xx < x + w; xx++)
				values[yy * width + xx] = value;
		}
		return values;
	}
	
	/**
	 * Create a 50x50 raster with a uniform background and a single 5x5 bright square at (22, 22).
	 */
	public static BackscatterRaster squareScene(Channel channel) {
		return BackscatterRaster.create(channel, squareSceneValues(), 50, 50);
	}
	
	public static float[] squareSceneValues() {
		return fill(uniform(50, 50, BACKGROUND), 50, 22, 22, 5, 5, TARGET);
	}

}
