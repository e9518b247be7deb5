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
import icebergarea.lib.common.ErrorKind;
import icebergarea.lib.common.IcebergAreaException;

/**
 * Exception thrown when an area model expects a different feature schema from the one provided.
 */
public class ModelMismatchException extends IcebergAreaException {

	private static final long serialVersionUID = 1L;
	
	private final FeatureSchema expected;
	private final FeatureSchema actual;

	/**
	 * Constructor.
	 * @param expected the schema required by the model
	 * @param actual the schema of the features
	 */
	public ModelMismatchException(FeatureSchema expected, FeatureSchema actual) {
		super(ErrorKind.MODEL_MISMATCH, "Model requires features " + expected + " but got " + actual);
		this.expected = expected;
		this.actual = actual;
	}
	
	/**
	 * Get the schema required by the model.
	 * @return
	 */
	public FeatureSchema getExpected() {
		return expected;
	}
	
	/**
	 * Get the schema of the features that were provided.
	 * @return
	 */
	public FeatureSchema getActual() {
		return actual;
	}

}
