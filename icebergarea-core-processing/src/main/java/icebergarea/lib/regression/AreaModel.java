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

import icebergarea.lib.analysis.features.FeatureSchema;
import icebergarea.lib.analysis.features.FeatureVector;

/**
 * A trained model that predicts the true area of an object from its features.
 * <p>
 * Implementations must be deterministic and safe to call from multiple threads.
 */
public interface AreaModel {
	
	/**
	 * Get the feature schema that this model requires.
	 * @return
	 */
	FeatureSchema getSchema();
	
	/**
	 * Predict the area of an object.
	 * The result may be negative or NaN; callers are responsible for clamping.
	 * @param features features with the schema returned by {@link #getSchema()}
	 * @return the predicted area, in squared map units
	 */
	double predict(FeatureVector features);

}
