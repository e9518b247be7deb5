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

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.IntStream;

import org.apache.commons.math3.analysis.solvers.BrentSolver;
import org.apache.commons.math3.exception.MathIllegalArgumentException;
import org.apache.commons.math3.exception.MathIllegalStateException;
import org.apache.commons.math3.special.Gamma;
import org.apache.commons.math3.stat.descriptive.rank.Percentile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import icebergarea.lib.analysis.stats.LocalStatistics;
import icebergarea.lib.analysis.stats.LocalStatisticsEngine;
import icebergarea.lib.analysis.stats.RunningStatistics;
import icebergarea.lib.common.NoValidDataException;
import icebergarea.lib.images.BackscatterRaster;

/**
 * Constant false alarm rate (CFAR) outlier detection assuming gamma-distributed clutter.
 * <p>
 * For each pixel the clutter is modeled as a gamma distribution with the mean of the background annulus.
 * The threshold {@code T} is chosen so that the probability of clutter exceeding it is the requested 
 * probability of false alarm, i.e. {@code Q(shape, T * shape / mean) = pfa} where {@code Q} is the 
 * regularized upper incomplete gamma function.
 * A pixel is detected if its value is strictly greater than its threshold.
 */
public class GammaCfar {
	
	private static final Logger logger = LoggerFactory.getLogger(GammaCfar.class);
	
	private static final int MAX_EVALUATIONS = 1000;
	private static final int MAX_BRACKET_DOUBLINGS = 1100;
	
	private GammaCfar() {
		throw new AssertionError();
	}
	
	/**
	 * Run CFAR detection on a raster, computing local statistics as required.
	 * @param raster
	 * @param settings
	 * @return
	 * @throws NoValidDataException if the raster has no valid pixels
	 */
	public static DetectionMask detect(BackscatterRaster raster, ChannelSettings settings) throws NoValidDataException {
		Objects.requireNonNull(raster, "Raster must not be null");
		Objects.requireNonNull(settings, "Settings must not be null");
		if (raster.countValid() == 0)
			throw new NoValidDataException("Raster for channel " + raster.getChannel() + " contains no valid pixels");
		var stats = LocalStatisticsEngine.compute(raster, settings.getWindow());
		var thresholds = computeThresholds(raster, stats, settings);
		return applyThresholds(raster, thresholds);
	}
	
	/**
	 * Flag pixels whose value strictly exceeds their threshold.
	 * Invalid pixels and pixels with NaN thresholds are never flagged.
	 * @param raster
	 * @param thresholds
	 * @return
	 */
	public static DetectionMask applyThresholds(BackscatterRaster raster, ThresholdMap thresholds) {
		if (raster.getWidth() != thresholds.getWidth() || raster.getHeight() != thresholds.getHeight())
			throw new IllegalArgumentException("Threshold map size does not match raster " + raster);
		int n = raster.getWidth() * raster.getHeight();
		boolean[] mask = new boolean[n];
		int count = 0;
		for (int i = 0; i < n; i++) {
			// NaN comparisons are always false
			if (raster.isValid(i) && raster.getValue(i) > thresholds.getThreshold(i)) {
				mask[i] = true;
				count++;
			}
		}
		logger.debug("{} pixels detected for channel {}", count, raster.getChannel());
		return new DetectionMask(raster.getChannel(), raster.getWidth(), raster.getHeight(), mask, thresholds);
	}
	
	/**
	 * Compute per-pixel thresholds from local background statistics.
	 * @param raster
	 * @param stats local statistics computed for the same raster
	 * @param settings
	 * @return
	 */
	public static ThresholdMap computeThresholds(BackscatterRaster raster, LocalStatistics stats, ChannelSettings settings) {
		int w = raster.getWidth();
		int h = raster.getHeight();
		if (w != stats.getWidth() || h != stats.getHeight())
			throw new IllegalArgumentException("Local statistics size does not match raster " + raster);
		
		long startTime = System.currentTimeMillis();
		double pfa = settings.getPfa();
		double minRelativeVariance = settings.getMinRelativeVariance();
		boolean excludeEdges = settings.getEdgePolicy() == EdgePolicy.EXCLUDE;
		double maxShape = 1.0 / minRelativeVariance;
		var multipliers = new MultiplierTable(pfa, maxShape);
		
		boolean useGlobalEnl = settings.getShapeEstimation() == ShapeEstimation.GLOBAL_ENL;
		double globalMultiplier = Double.NaN;
		if (useGlobalEnl) {
			double enl = estimateEnl(raster, minRelativeVariance);
			globalMultiplier = gammaMultiplier(enl, pfa);
			logger.debug("Global ENL for channel {}: {} (multiplier {})", raster.getChannel(), enl, globalMultiplier);
		}
		double globalMultiplierFinal = globalMultiplier;
		
		double[] thresholds = new double[w * h];
		int floored = IntStream.range(0, h).parallel().map(y -> {
			int nFloored = 0;
			for (int x = 0; x < w; x++) {
				int ind = y * w + x;
				if (!raster.isValid(ind) || !stats.isDefined(ind) || (excludeEdges && stats.isClipped(ind))) {
					thresholds[ind] = Double.NaN;
					continue;
				}
				double mean = stats.getMean(ind);
				if (mean <= 0) {
					thresholds[ind] = 0;
					continue;
				}
				if (useGlobalEnl) {
					thresholds[ind] = mean * globalMultiplierFinal;
					continue;
				}
				double variance = stats.getVariance(ind);
				double minVariance = minRelativeVariance * mean * mean;
				double shape;
				if (variance < minVariance) {
					shape = maxShape;
					nFloored++;
				} else
					shape = mean * mean / variance;
				thresholds[ind] = mean * multipliers.get(shape);
			}
			return nFloored;
		}).sum();
		
		long endTime = System.currentTimeMillis();
		logger.debug("Thresholds for channel {} computed in {} ms ({} multipliers tabulated, variance floor applied to {} pixels)", 
				raster.getChannel(), endTime - startTime, multipliers.size(), floored);
		
		var map = new ThresholdMap(w, h, thresholds, stats, floored);
		if (excludeEdges && map.countIncluded() == 0)
			logger.warn("No pixels of channel {} can be detected with {} - raster is smaller than the outer window", 
					raster.getChannel(), settings.getWindow());
		return map;
	}
	
	/**
	 * Estimate a global equivalent number of looks (ENL) for the clutter in a raster.
	 * <p>
	 * The ENL is computed by the method of moments ({@code mean^2 / variance}) from all valid pixels 
	 * below twice the median, which excludes most bright targets.
	 * @param raster
	 * @param minRelativeVariance minimum variance relative to the squared mean; this caps the ENL
	 * @return the ENL, or {@code 1/minRelativeVariance} if the clutter has no measurable variance
	 */
	public static double estimateEnl(BackscatterRaster raster, double minRelativeVariance) {
		int n = raster.getWidth() * raster.getHeight();
		double[] values = new double[(int)raster.countValid()];
		int k = 0;
		for (int i = 0; i < n; i++) {
			if (raster.isValid(i))
				values[k++] = raster.getValue(i);
		}
		double maxEnl = 1.0 / minRelativeVariance;
		if (values.length == 0)
			return maxEnl;
		double median = new Percentile(50.0).evaluate(values);
		var stats = new RunningStatistics();
		for (double v : values) {
			if (v < median * 2)
				stats.addValue(v);
		}
		double mean = stats.getMean();
		double variance = stats.getPopulationVariance();
		if (!(mean > 0) || !(variance > minRelativeVariance * mean * mean))
			return maxEnl;
		return mean * mean / variance;
	}
	
	/**
	 * Compute the threshold multiplier for gamma-distributed clutter with unit mean.
	 * <p>
	 * This solves {@code Q(shape, x) = pfa} for {@code x} and returns {@code x / shape}, 
	 * so that the threshold is {@code mean * multiplier}.
	 * @param shape gamma shape parameter (or ENL); must be positive and finite
	 * @param pfa probability of false alarm
	 * @return the multiplier, or NaN if no stable solution could be found
	 */
	public static double gammaMultiplier(double shape, double pfa) {
		if (!(shape > 0) || !Double.isFinite(shape))
			throw new IllegalArgumentException("Gamma shape must be positive and finite, but got " + shape);
		if (!(pfa > 0 && pfa < 1))
			throw new IllegalArgumentException("Probability of false alarm must be between 0 and 1, but got " + pfa);
		try {
			// Q is monotonically decreasing from 1 at x=0, so expand until the root is bracketed
			double upper = Math.max(1.0, shape);
			int doublings = 0;
			while (Gamma.regularizedGammaQ(shape, upper) > pfa) {
				upper *= 2;
				if (++doublings > MAX_BRACKET_DOUBLINGS || Double.isInfinite(upper)) {
					logger.debug("Unable to bracket gamma quantile for shape {}, pfa {}", shape, pfa);
					return Double.NaN;
				}
			}
			var solver = new BrentSolver(1e-14, 1e-14, pfa * 1e-9);
			double x = solver.solve(MAX_EVALUATIONS, t -> Gamma.regularizedGammaQ(shape, t) - pfa, 0, upper);
			return x / shape;
		} catch (MathIllegalStateException | MathIllegalArgumentException e) {
			logger.debug("Unable to solve gamma quantile for shape {}, pfa {}: {}", shape, pfa, e.getLocalizedMessage());
			return Double.NaN;
		}
	}
	
	
	/**
	 * Multipliers for one probability of false alarm, tabulated lazily at shapes spaced evenly in {@code ln(shape)}.
	 * <p>
	 * Node {@code k} is at {@code maxShape * exp(-k / NODES_PER_UNIT)}, and multipliers between nodes are 
	 * interpolated linearly in {@code ln(shape)}. 
	 * The multiplier for {@code maxShape} (the shape given by the variance floor) is exact, 
	 * and other multipliers are within a relative error of {@link #TOLERANCE} of {@link GammaCfar#gammaMultiplier(double, double)}.
	 * The number of nodes depends only on the range of shapes, never on the number of distinct shapes.
	 */
	static class MultiplierTable {
		
		static final int NODES_PER_UNIT = 1024;
		
		/**
		 * Maximum relative interpolation error for shapes of at least 0.5.
		 */
		static final double TOLERANCE = 1e-5;
		
		// Shapes below maxShape * exp(-64) are solved directly
		private static final int MAX_NODES = 64 * NODES_PER_UNIT;
		
		private final double pfa;
		private final double maxShape;
		private final Map<Integer, Double> nodes = new ConcurrentHashMap<>();
		
		MultiplierTable(double pfa, double maxShape) {
			this.pfa = pfa;
			this.maxShape = maxShape;
		}
		
		double get(double shape) {
			double pos = Math.log(maxShape / shape) * NODES_PER_UNIT;
			if (Double.isNaN(pos))
				return Double.NaN;
			if (pos <= 0)
				return node(0);
			if (pos >= MAX_NODES)
				return gammaMultiplier(shape, pfa);
			int k = (int)pos;
			double frac = pos - k;
			if (frac == 0)
				return node(k);
			return node(k) * (1 - frac) + node(k + 1) * frac;
		}
		
		private double node(int k) {
			return nodes.computeIfAbsent(k, i -> gammaMultiplier(maxShape * Math.exp(-(double)i / NODES_PER_UNIT), pfa));
		}
		
		int size() {
			return nodes.size();
		}
		
	}

}
