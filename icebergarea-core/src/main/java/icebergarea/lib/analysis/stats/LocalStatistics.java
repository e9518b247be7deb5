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

package icebergarea.lib.analysis.stats;

/**
 * Per-pixel background statistics computed over an annular window.
 * <p>
 * Statistics are NaN where the annulus contains no valid pixels.
 * A pixel is low-confidence if its outer window was clipped at the image border, 
 * or if its annulus contained invalid pixels.
 */
public class LocalStatistics {
	
	static final byte FLAG_CLIPPED = 1;
	static final byte FLAG_NODATA = 2;
	
	private final int width;
	private final int height;
	private final WindowSpec window;
	private final double[] mean;
	private final double[] variance;
	private final int[] count;
	private final byte[] flags;
	
	LocalStatistics(int width, int height, WindowSpec window, double[] mean, double[] variance, int[] count, byte[] flags) {
		this.width = width;
		this.height = height;
		this.window = window;
		this.mean = mean;
		this.variance = variance;
		this.count = count;
		this.flags = flags;
	}
	
	public int getWidth() {
		return width;
	}
	
	public int getHeight() {
		return height;
	}
	
	/**
	 * Get the window used to compute the statistics.
	 * @return
	 */
	public WindowSpec getWindow() {
		return window;
	}
	
	/**
	 * Mean of valid pixels in the annulus.
	 * @param x
	 * @param y
	 * @return the mean, or NaN if undefined
	 */
	public double getMean(int x, int y) {
		return mean[y * width + x];
	}
	
	/**
	 * Mean of valid pixels in the annulus, by row-wise pixel index.
	 * @param index
	 * @return
	 */
	public double getMean(int index) {
		return mean[index];
	}
	
	/**
	 * Population variance of valid pixels in the annulus.
	 * @param x
	 * @param y
	 * @return the variance (never negative), or NaN if undefined
	 */
	public double getVariance(int x, int y) {
		return variance[y * width + x];
	}
	
	/**
	 * Population variance of valid pixels in the annulus, by row-wise pixel index.
	 * @param index
	 * @return
	 */
	public double getVariance(int index) {
		return variance[index];
	}
	
	/**
	 * Number of valid pixels in the annulus.
	 * @param x
	 * @param y
	 * @return
	 */
	public int getCount(int x, int y) {
		return count[y * width + x];
	}
	
	/**
	 * Returns true if the statistics at this pixel are defined.
	 * @param index row-wise pixel index
	 * @return
	 */
	public boolean isDefined(int index) {
		return count[index] > 0;
	}
	
	/**
	 * Returns true if the outer window was clipped, or the annulus contained invalid pixels.
	 * @param x
	 * @param y
	 * @return
	 */
	public boolean isLowConfidence(int x, int y) {
		return flags[y * width + x] != 0;
	}
	
	/**
	 * Returns true if the outer window extends beyond the image border at this pixel.
	 * @param index row-wise pixel index
	 * @return
	 */
	public boolean isClipped(int index) {
		return (flags[index] & FLAG_CLIPPED) != 0;
	}
	
	/**
	 * Count the low-confidence pixels.
	 * @return
	 */
	public int countLowConfidence() {
		int n = 0;
		for (byte f : flags) {
			if (f != 0)
				n++;
		}
		return n;
	}

}
