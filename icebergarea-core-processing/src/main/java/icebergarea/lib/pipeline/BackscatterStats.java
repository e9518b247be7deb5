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

package icebergarea.lib.pipeline;

import icebergarea.lib.analysis.features.FeatureSchema;
import icebergarea.lib.analysis.features.FeatureVector;

/**
 * Summary of the backscatter of one object, in linear units except where noted.
 * 
 * @param mean mean backscatter
 * @param std population standard deviation
 * @param min minimum
 * @param max maximum
 * @param clutterMeanDb mean of the local background means, in decibels
 * @param contrastMeanDb object mean minus background mean, in decibels
 */
public record BackscatterStats(double mean, double std, double min, double max, double clutterMeanDb, double contrastMeanDb) {
	
	/**
	 * Extract the backscatter statistics from a feature vector.
	 * @param features features using {@link FeatureSchema#BACKSCATTER_V1}
	 * @return
	 */
	public static BackscatterStats fromFeatures(FeatureVector features) {
		return new BackscatterStats(
				features.get(FeatureSchema.MEAN),
				features.get(FeatureSchema.STD),
				features.get(FeatureSchema.MIN),
				features.get(FeatureSchema.MAX),
				features.get(FeatureSchema.CLUTTER_MEAN_DB),
				features.get(FeatureSchema.CONTRAST_MEAN_DB));
	}

}
