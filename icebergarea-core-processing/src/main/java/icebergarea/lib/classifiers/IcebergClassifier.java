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

import icebergarea.lib.analysis.features.FeatureVector;

/**
 * Decides whether a detected object is likely to be an iceberg, rather than e.g. a ship or sea ice.
 * <p>
 * Like an area model, a classifier is supplied per channel.
 */
public interface IcebergClassifier {
	
	/**
	 * Classify one object.
	 * @param features features of the object
	 * @return
	 * @throws IllegalArgumentException if the features do not include the values the classifier needs
	 */
	IcebergClassification classify(FeatureVector features);

}
