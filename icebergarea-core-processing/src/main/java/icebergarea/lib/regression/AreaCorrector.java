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

package icebergarea.lib.regression;

import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import icebergarea.lib.analysis.features.FeatureVector;

/**
 * Applies an {@link AreaModel} to feature vectors, checking schemas and clamping the output.
 */
public class AreaCorrector {
	
	private static final Logger logger = LoggerFactory.getLogger(AreaCorrector.class);
	
	private AreaCorrector() {
		throw new AssertionError();
	}
	
	/**
	 * Predict a corrected area, clamping negative predictions to 0.
	 * @param features
	 * @param model
	 * @return a non-negative area, or NaN if the model could not make a finite prediction
	 * @throws ModelMismatchException if the model requires a different feature schema
	 */
	public static double predictArea(FeatureVector features, AreaModel model) throws ModelMismatchException {
		return predictArea(features, model, ClampPolicy.ZERO, 0);
	}
	
	/**
	 * Predict a corrected area.
	 * @param features
	 * @param model
	 * @param clampPolicy policy for negative predictions
	 * @param pixelArea area of one pixel, used by {@link ClampPolicy#ONE_PIXEL}
	 * @return a non-negative area, or NaN if the model could not make a finite prediction
	 * @throws ModelMismatchException if the model requires a different feature schema
	 */
	public static double predictArea(FeatureVector features, AreaModel model, ClampPolicy clampPolicy, double pixelArea) throws ModelMismatchException {
		Objects.requireNonNull(features, "Features must not be null");
		Objects.requireNonNull(model, "Model must not be null");
		checkSchema(features, model);
		double prediction = model.predict(features);
		double area = clampPolicy.clamp(prediction, pixelArea);
		if (Double.isNaN(area))
			logger.trace("Prediction {} is unavailable", prediction);
		else if (area != prediction)
			logger.trace("Prediction {} clamped to {}", prediction, area);
		return area;
	}
	
	/**
	 * Check that a model can be applied to a feature vector.
	 * @param features
	 * @param model
	 * @throws ModelMismatchException if the schemas differ
	 */
	public static void checkSchema(FeatureVector features, AreaModel model) throws ModelMismatchException {
		var expected = model.getSchema();
		if (!Objects.equals(expected, features.getSchema()))
			throw new ModelMismatchException(expected, features.getSchema());
	}

}
