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

package icebergarea.lib.classifiers;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

import icebergarea.lib.analysis.features.FeatureSchema;
import icebergarea.lib.analysis.features.FeatureVector;
import icebergarea.lib.analysis.stats.RunningStatistics;

/**
 * Classifies objects by comparing them with the statistics of known icebergs of the same channel.
 * <p>
 * Two scores are computed, each as the difference from the reference mean divided by the 
 * reference (population) standard deviation:
 * <ul>
 *   <li>the backscatter score compares {@link FeatureSchema#MEAN_DB} with reference icebergs 
 *   whose incidence angle is within the incidence angle tolerance of the object's 
 *   {@link FeatureSchema#INCIDENCE_ANGLE_MEAN}</li>
 *   <li>the perimeter index score compares {@link FeatureSchema#PERIMETER_INDEX} with all reference icebergs</li>
 * </ul>
 * An object is an iceberg if both scores are at least their thresholds.
 * If a score cannot be computed (e.g. without incidence angles) the object is not classified as an iceberg.
 */
public class ReferenceStatisticsClassifier implements IcebergClassifier {
	
	/**
	 * Default minimum score for both backscatter and perimeter index.
	 */
	public static final double DEFAULT_SCORE_THRESHOLD = -2.0;
	
	/**
	 * Default half-width of the incidence angle range of reference icebergs, in degrees.
	 */
	public static final double DEFAULT_INCIDENCE_ANGLE_TOLERANCE = 2.0;
	
	/**
	 * Statistics of one reference iceberg.
	 * 
	 * @param meanDb mean backscatter in the detection channel, in dB
	 * @param incidenceAngle mean incidence angle, in degrees
	 * @param perimeterIndex perimeter index of the outline
	 */
	public record ReferenceIceberg(double meanDb, double incidenceAngle, double perimeterIndex) {}
	
	private final List<ReferenceIceberg> reference;
	private final double backscatterThreshold;
	private final double perimeterIndexThreshold;
	private final double incidenceAngleTolerance;
	
	private ReferenceStatisticsClassifier(List<ReferenceIceberg> reference, double backscatterThreshold, 
			double perimeterIndexThreshold, double incidenceAngleTolerance) {
		this.reference = reference == null ? null : List.copyOf(reference);
		this.backscatterThreshold = backscatterThreshold;
		this.perimeterIndexThreshold = perimeterIndexThreshold;
		this.incidenceAngleTolerance = incidenceAngleTolerance;
		validate();
	}
	
	/**
	 * Create a classifier with default thresholds.
	 * @param reference statistics of known icebergs
	 * @return
	 */
	public static ReferenceStatisticsClassifier create(List<ReferenceIceberg> reference) {
		return create(reference, DEFAULT_SCORE_THRESHOLD, DEFAULT_SCORE_THRESHOLD, DEFAULT_INCIDENCE_ANGLE_TOLERANCE);
	}
	
	/**
	 * Create a classifier.
	 * @param reference statistics of known icebergs
	 * @param backscatterThreshold minimum backscatter score of an iceberg
	 * @param perimeterIndexThreshold minimum perimeter index score of an iceberg
	 * @param incidenceAngleTolerance half-width of the incidence angle range used for the backscatter score
	 * @return
	 */
	public static ReferenceStatisticsClassifier create(List<ReferenceIceberg> reference, double backscatterThreshold, 
			double perimeterIndexThreshold, double incidenceAngleTolerance) {
		return new ReferenceStatisticsClassifier(reference, backscatterThreshold, perimeterIndexThreshold, incidenceAngleTolerance);
	}
	
	/**
	 * Check the classifier is complete; this is needed after deserialization, which bypasses the constructor.
	 * @throws IllegalArgumentException if the classifier is invalid
	 */
	void validate() throws IllegalArgumentException {
		if (reference == null || reference.isEmpty())
			throw new IllegalArgumentException("Reference statistics classifier needs at least one reference iceberg");
		if (reference.contains(null))
			throw new IllegalArgumentException("Reference icebergs must not be null");
		if (!Double.isFinite(backscatterThreshold) || !Double.isFinite(perimeterIndexThreshold))
			throw new IllegalArgumentException("Score thresholds must be finite");
		if (!(incidenceAngleTolerance > 0) || !Double.isFinite(incidenceAngleTolerance))
			throw new IllegalArgumentException("Incidence angle tolerance must be positive, but got " + incidenceAngleTolerance);
	}
	
	/**
	 * Get the reference icebergs.
	 * @return an unmodifiable list
	 */
	public List<ReferenceIceberg> getReference() {
		return Collections.unmodifiableList(reference);
	}
	
	public double getBackscatterThreshold() {
		return backscatterThreshold;
	}
	
	public double getPerimeterIndexThreshold() {
		return perimeterIndexThreshold;
	}
	
	public double getIncidenceAngleTolerance() {
		return incidenceAngleTolerance;
	}

	@Override
	public IcebergClassification classify(FeatureVector features) {
		Objects.requireNonNull(features, "Features must not be null");
		double meanDb = features.get(FeatureSchema.MEAN_DB);
		double angle = features.get(FeatureSchema.INCIDENCE_ANGLE_MEAN);
		double perimeterIndex = features.get(FeatureSchema.PERIMETER_INDEX);
		
		var backscatterStats = new RunningStatistics();
		var perimeterIndexStats = new RunningStatistics();
		for (var iceberg : reference) {
			perimeterIndexStats.addValue(iceberg.perimeterIndex());
			// Comparisons with a NaN angle are false, leaving no reference backscatter
			if (iceberg.incidenceAngle() >= angle - incidenceAngleTolerance && iceberg.incidenceAngle() < angle + incidenceAngleTolerance)
				backscatterStats.addValue(iceberg.meanDb());
		}
		double backscatterScore = score(meanDb, backscatterStats);
		double perimeterIndexScore = score(perimeterIndex, perimeterIndexStats);
		boolean iceberg = backscatterScore >= backscatterThreshold && perimeterIndexScore >= perimeterIndexThreshold;
		return new IcebergClassification(backscatterScore, perimeterIndexScore, iceberg);
	}
	
	private static double score(double value, RunningStatistics stats) {
		if (stats.size() == 0)
			return Double.NaN;
		return (value - stats.getMean()) / stats.getPopulationStdDev();
	}
	
	@Override
	public String toString() {
		return "ReferenceStatisticsClassifier [" + reference.size() + " reference icebergs, thresholds=" 
				+ backscatterThreshold + "/" + perimeterIndexThreshold + ", tolerance=" + incidenceAngleTolerance + "]";
	}

}
