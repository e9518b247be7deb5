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

package icebergarea.lib.detection;

import icebergarea.lib.analysis.images.SimpleImage;
import icebergarea.lib.analysis.stats.LocalStatistics;

/**
 * Per-pixel adaptive CFAR thresholds.
 * <p>
 * A NaN threshold means the pixel is excluded from detection.
 */
public class ThresholdMap implements SimpleImage {
	
	private final int width;
	private final int height;
	private final double[] thresholds;
	private final LocalStatistics statistics;
	private final int flooredCount;
	
	ThresholdMap(int width, int height, double[] thresholds, LocalStatistics statistics, int flooredCount) {
		this.width = width;
		this.height = height;
		this.thresholds = thresholds;
		this.statistics = statistics;
		this.flooredCount = flooredCount;
	}
	
	/**
	 * Get the threshold for a pixel.
	 * @param x
	 * @param y
	 * @return the threshold, or NaN if the pixel is excluded
	 */
	public double getThreshold(int x, int y) {
		return thresholds[y * width + x];
	}
	
	/**
	 * Get the threshold by row-wise pixel index.
	 * @param index
	 * @return
	 */
	public double getThreshold(int index) {
		return thresholds[index];
	}
	
	/**
	 * Returns true if the pixel cannot be detected.
	 * @param x
	 * @param y
	 * @return
	 */
	public boolean isExcluded(int x, int y) {
		return Double.isNaN(getThreshold(x, y));
	}
	
	/**
	 * Count the pixels that may be detected.
	 * @return
	 */
	public int countIncluded() {
		int n = 0;
		for (double t : thresholds) {
			if (!Double.isNaN(t))
				n++;
		}
		return n;
	}
	
	/**
	 * Number of pixels where the variance floor was applied to stabilize the shape estimate.
	 * @return
	 */
	public int getFlooredCount() {
		return flooredCount;
	}
	
	/**
	 * Get the background statistics used to compute the thresholds.
	 * @return
	 */
	public LocalStatistics getStatistics() {
		return statistics;
	}

	@Override
	public float getValue(int x, int y) {
		return (float)getThreshold(x, y);
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
