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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

import icebergarea.lib.analysis.features.FeatureSchema;
import icebergarea.lib.analysis.features.FeatureVector;

/**
 * Linear regression model {@code intercept + sum(coefficient_i * feature_i)}.
 * <p>
 * Only features with a coefficient contribute; if any of these is NaN, the prediction is NaN.
 * When the target is {@link Target#ROOT_LENGTH} the linear prediction is a root length, 
 * which is squared to give an area. The square is taken whatever the sign of the root length, 
 * so a {@code ROOT_LENGTH} model never predicts a negative area.
 */
public class LinearAreaModel implements AreaModel {
	
	/**
	 * The quantity predicted by the linear function.
	 */
	public enum Target {
		/**
		 * The linear function predicts the area directly.
		 */
		AREA,
		/**
		 * The linear function predicts the square root of the area.
		 */
		ROOT_LENGTH
	}
	
	private final FeatureSchema schema;
	private final Target target;
	private final double intercept;
	private final LinkedHashMap<String, Double> coefficients;
	
	private LinearAreaModel(FeatureSchema schema, Target target, double intercept, Map<String, Double> coefficients) {
		this.schema = Objects.requireNonNull(schema, "Schema must not be null");
		this.target = Objects.requireNonNull(target, "Target must not be null");
		this.intercept = intercept;
		this.coefficients = new LinkedHashMap<>(coefficients);
		validate();
	}
	
	/**
	 * Check that the model is complete and every coefficient refers to a feature of the schema.
	 * This is needed after deserialization, which bypasses the constructor.
	 * @throws IllegalArgumentException if the model is invalid
	 */
	void validate() throws IllegalArgumentException {
		if (schema == null || schema.getFeatureNames() == null)
			throw new IllegalArgumentException("Linear model has no feature schema");
		if (target == null)
			throw new IllegalArgumentException("Linear model has no target");
		if (coefficients == null)
			throw new IllegalArgumentException("Linear model has no coefficients");
		for (var entry : coefficients.entrySet()) {
			if (schema.indexOf(entry.getKey()) < 0)
				throw new IllegalArgumentException("Coefficient " + entry.getKey() + " is not a feature of schema " + schema.getId());
			if (entry.getValue() == null || !Double.isFinite(entry.getValue()))
				throw new IllegalArgumentException("Coefficient " + entry.getKey() + " must be finite");
		}
		if (!Double.isFinite(intercept))
			throw new IllegalArgumentException("Intercept must be finite");
	}
	
	/**
	 * Create a linear model.
	 * @param schema schema of the features the model is applied to
	 * @param target the quantity predicted by the linear function
	 * @param intercept
	 * @param coefficients coefficients by feature name; features without a coefficient are ignored
	 * @return
	 */
	public static LinearAreaModel create(FeatureSchema schema, Target target, double intercept, Map<String, Double> coefficients) {
		return new LinearAreaModel(schema, target, intercept, coefficients);
	}

	@Override
	public FeatureSchema getSchema() {
		return schema;
	}
	
	public Target getTarget() {
		return target;
	}
	
	public double getIntercept() {
		return intercept;
	}
	
	/**
	 * Get the coefficients by feature name.
	 * @return an unmodifiable map
	 */
	public Map<String, Double> getCoefficients() {
		return Collections.unmodifiableMap(coefficients);
	}

	@Override
	public double predict(FeatureVector features) {
		double value = intercept;
		for (var entry : coefficients.entrySet()) {
			value += entry.getValue() * features.get(entry.getKey());
		}
		if (target == Target.ROOT_LENGTH)
			return value * value;
		return value;
	}
	
	@Override
	public String toString() {
		return "LinearAreaModel [schema=" + schema.getId() + ", target=" + target + ", intercept=" + intercept + ", coefficients=" + coefficients + "]";
	}

}
