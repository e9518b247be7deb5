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

import java.util.Objects;
import java.util.stream.IntStream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import icebergarea.lib.images.BackscatterRaster;

/**
 * Computes local background statistics over an annular window for every pixel of a raster.
 * <p>
 * Each query costs O(1) regardless of window size, using {@link SummedAreaTable}.
 * Windows are clipped at the image border, and clipped pixels are flagged as low-confidence.
 */
public class LocalStatisticsEngine {
	
	private static final Logger logger = LoggerFactory.getLogger(LocalStatisticsEngine.class);
	
	private LocalStatisticsEngine() {
		throw new AssertionError();
	}
	
	/**
	 * Compute local statistics, processing rows in parallel.
	 * @param raster
	 * @param window
	 * @return
	 */
	public static LocalStatistics compute(BackscatterRaster raster, WindowSpec window) {
		return compute(raster, window, true);
	}
	
	/**
	 * Compute local statistics.
	 * @param raster
	 * @param window
	 * @param parallel if true, process rows in parallel; the result is identical either way
	 * @return
	 */
	public static LocalStatistics compute(BackscatterRaster raster, WindowSpec window, boolean parallel) {
		Objects.requireNonNull(raster, "Raster must not be null");
		Objects.requireNonNull(window, "Window must not be null");
		
		long startTime = System.currentTimeMillis();
		int w = raster.getWidth();
		int h = raster.getHeight();
		var table = SummedAreaTable.create(raster);
		
		int n = w * h;
		double[] mean = new double[n];
		double[] variance = new double[n];
		int[] count = new int[n];
		byte[] flags = new byte[n];
		
		var rows = IntStream.range(0, h);
		if (parallel)
			rows = rows.parallel();
		rows.forEach(y -> computeRow(table, window, y, mean, variance, count, flags));
		
		long endTime = System.currentTimeMillis();
		logger.debug("Local statistics for {} with {} computed in {} ms", raster, window, endTime - startTime);
		return new LocalStatistics(w, h, window, mean, variance, count, flags);
	}
	
	private static void computeRow(SummedAreaTable table, WindowSpec window, int y, 
			double[] mean, double[] variance, int[] count, byte[] flags) {
		int w = table.getWidth();
		int h = table.getHeight();
		int ro = window.getOuterRadius();
		int rg = window.getGuardRadius();
		
		int oy0 = Math.max(0, y - ro);
		int oy1 = Math.min(h, y + ro + 1);
		int gy0 = Math.max(0, y - rg);
		int gy1 = Math.min(h, y + rg + 1);
		boolean rowClipped = y - ro < 0 || y + ro >= h;
		
		for (int x = 0; x < w; x++) {
			int ox0 = Math.max(0, x - ro);
			int ox1 = Math.min(w, x + ro + 1);
			int gx0 = Math.max(0, x - rg);
			int gx1 = Math.min(w, x + rg + 1);
			
			int nValid = table.getCount(ox0, oy0, ox1, oy1) - table.getCount(gx0, gy0, gx1, gy1);
			double s = table.getSum(ox0, oy0, ox1, oy1) - table.getSum(gx0, gy0, gx1, gy1);
			double s2 = table.getSumSquares(ox0, oy0, ox1, oy1) - table.getSumSquares(gx0, gy0, gx1, gy1);
			
			int ind = y * w + x;
			byte flag = 0;
			if (rowClipped || x - ro < 0 || x + ro >= w)
				flag |= LocalStatistics.FLAG_CLIPPED;
			int nPixels = (ox1 - ox0) * (oy1 - oy0) - (gx1 - gx0) * (gy1 - gy0);
			if (nValid < nPixels)
				flag |= LocalStatistics.FLAG_NODATA;
			flags[ind] = flag;
			count[ind] = nValid;
			
			if (nValid <= 0) {
				mean[ind] = Double.NaN;
				variance[ind] = Double.NaN;
			} else {
				double m = s / nValid;
				mean[ind] = m;
				// Clamp to avoid small negative values due to rounding
				variance[ind] = Math.max(0.0, s2 / nValid - m * m);
			}
		}
	}

}
