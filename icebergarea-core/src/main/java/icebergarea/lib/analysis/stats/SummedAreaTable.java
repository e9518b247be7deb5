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

import icebergarea.lib.images.BackscatterRaster;

/**
 * Summed-area tables (integral images) of valid pixel values, squared values and counts.
 * <p>
 * Tables have one extra row and column, so that the sum over pixels {@code [x0, x1) x [y0, y1)} 
 * is obtained from four lookups. Invalid pixels contribute to none of the tables.
 */
public class SummedAreaTable {
	
	private final int width;
	private final int height;
	private final int stride;
	private final double[] sum;
	private final double[] sumSquares;
	private final int[] count;
	
	private SummedAreaTable(int width, int height) {
		this.width = width;
		this.height = height;
		this.stride = width + 1;
		long size = ((long)width + 1) * ((long)height + 1);
		if (size > BackscatterRaster.MAX_PIXEL_COUNT)
			throw new IllegalArgumentException("Cannot create summed area table for " + width + "x" + height + " raster");
		int n = (int)size;
		this.sum = new double[n];
		this.sumSquares = new double[n];
		this.count = new int[n];
	}
	
	/**
	 * Build tables for the valid pixels of a raster.
	 * @param raster
	 * @return
	 */
	public static SummedAreaTable create(BackscatterRaster raster) {
		int w = raster.getWidth();
		int h = raster.getHeight();
		var table = new SummedAreaTable(w, h);
		for (int y = 0; y < h; y++) {
			double rowSum = 0;
			double rowSumSquares = 0;
			int rowCount = 0;
			int above = y * table.stride;
			int current = (y + 1) * table.stride;
			for (int x = 0; x < w; x++) {
				int ind = y * w + x;
				if (raster.isValid(ind)) {
					double v = raster.getValue(ind);
					rowSum += v;
					rowSumSquares += v * v;
					rowCount++;
				}
				table.sum[current + x + 1] = table.sum[above + x + 1] + rowSum;
				table.sumSquares[current + x + 1] = table.sumSquares[above + x + 1] + rowSumSquares;
				table.count[current + x + 1] = table.count[above + x + 1] + rowCount;
			}
		}
		return table;
	}
	
	/**
	 * Width of the source image.
	 * @return
	 */
	public int getWidth() {
		return width;
	}
	
	/**
	 * Height of the source image.
	 * @return
	 */
	public int getHeight() {
		return height;
	}
	
	/**
	 * Sum of valid values in the rectangle {@code [x0, x1) x [y0, y1)}; coordinates must already be clipped.
	 * @param x0
	 * @param y0
	 * @param x1
	 * @param y1
	 * @return
	 */
	public double getSum(int x0, int y0, int x1, int y1) {
		return sum[y1 * stride + x1] - sum[y0 * stride + x1] - sum[y1 * stride + x0] + sum[y0 * stride + x0];
	}
	
	/**
	 * Sum of squared valid values in the rectangle {@code [x0, x1) x [y0, y1)}; coordinates must already be clipped.
	 * @param x0
	 * @param y0
	 * @param x1
	 * @param y1
	 * @return
	 */
	public double getSumSquares(int x0, int y0, int x1, int y1) {
		return sumSquares[y1 * stride + x1] - sumSquares[y0 * stride + x1] - sumSquares[y1 * stride + x0] + sumSquares[y0 * stride + x0];
	}
	
	/**
	 * Number of valid values in the rectangle {@code [x0, x1) x [y0, y1)}; coordinates must already be clipped.
	 * @param x0
	 * @param y0
	 * @param x1
	 * @param y1
	 * @return
	 */
	public int getCount(int x0, int y0, int x1, int y1) {
		return count[y1 * stride + x1] - count[y0 * stride + x1] - count[y1 * stride + x0] + count[y0 * stride + x0];
	}

}
