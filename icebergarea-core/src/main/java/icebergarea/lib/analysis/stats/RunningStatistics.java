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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Helper class for computing basic statistics from values as they are added.
 * <p>
 * This is useful when iterating through the pixels of an object, accumulating backscatter statistics.
 * Variance is updated with Welford's method, so values can be added in a single pass.
 * <p>
 * Both the sample and the population variance are available; the population variance of a single value is 0.
 */
public class RunningStatistics {
	
	private static final Logger logger = LoggerFactory.getLogger(RunningStatistics.class);
	
	// Largest integer that can be stored while maintaining accuracy of all smaller integers
	private static final double LARGE_DOUBLE_THRESHOLD = Math.pow(2, 53) - 1;
	
	private long numNaNs = 0;
	
	private long size = 0;
	private double sum = 0;
	private double min = Double.POSITIVE_INFINITY;
	private double max = Double.NEGATIVE_INFINITY;

	private double mean = 0;
	private double m2 = 0;
	
	/**
	 * Default constructor.
	 */
	public RunningStatistics() {}
	
	/**
	 * Get count of the number of non-NaN values added.
	 * @return
	 */
	public long size() {
		return size;
	}
	
	/**
	 * Add another value; NaN values are counted but do not contribute to the statistics.
	 * @param val
	 */
	public void addValue(double val) {
		if (Double.isNaN(val)) {
			numNaNs++;
			return;
		}
		size++;
		sum += val;
		if (val < min)
			min = val;
		if (val > max)
			max = val;
		double delta = val - mean;
		mean += delta / size;
		m2 += delta * (val - mean);
	}
	
	/**
	 * Get count of the number of NaN values added.
	 * @return
	 */
	public long getNumNaNs() {
		return numNaNs;
	}
	
	/**
	 * Get the sum of all non-NaN values that were added.
	 * @return
	 */
	public double getSum() {
		if (Math.abs(sum) > LARGE_DOUBLE_THRESHOLD)
			logger.warn("Sum in {} is particularly large ({}), beware imprecision!", getClass().getSimpleName(), sum);
		return sum;
	}
	
	/**
	 * Get the mean of all non-NaN values that were added.
	 * @return the mean, or NaN if no values are available
	 */
	public double getMean() {
		return size == 0 ? Double.NaN : getSum() / size;
	}
	
	/**
	 * Get the sample variance (denominator n-1).
	 * @return the variance, or NaN if fewer than two values are available
	 */
	public double getVariance() {
		return size <= 1 ? Double.NaN : m2 / (size - 1);
	}
	
	/**
	 * Get the population variance (denominator n).
	 * @return the variance, or NaN if no values are available
	 */
	public double getPopulationVariance() {
		return size == 0 ? Double.NaN : m2 / size;
	}
	
	/**
	 * Get the sample standard deviation.
	 * @return
	 */
	public double getStdDev() {
		return Math.sqrt(getVariance());
	}
	
	/**
	 * Get the population standard deviation.
	 * @return
	 */
	public double getPopulationStdDev() {
		return Math.sqrt(getPopulationVariance());
	}
	
	/**
	 * Get the minimum non-NaN value added.
	 * @return the minimum value, or NaN if no values are available.
	 */
	public double getMin() {
		return size == 0 ? Double.NaN : min;
	}
	
	/**
	 * Get the maximum non-NaN value added.
	 * @return the maximum value, or NaN if no values are available.
	 */
	public double getMax() {
		return size == 0 ? Double.NaN : max;
	}
	
	@Override
	public String toString() {
		return String.format("%s Mean: %.4g, Std.dev: %.4g, Min: %.4g, Max: %.4g", 
				RunningStatistics.class.getSimpleName(), getMean(), getPopulationStdDev(), getMin(), getMax());
	}
	
}
