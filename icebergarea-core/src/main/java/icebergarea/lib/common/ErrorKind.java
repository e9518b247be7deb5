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

package icebergarea.lib.common;

/**
 * Kinds of failure that can be reported for a single channel.
 * <p>
 * Per-pixel numerical problems never appear here: they are recovered locally during thresholding.
 */
public enum ErrorKind {
	
	/**
	 * Outer or guard window size is even, non-positive, or the guard is not smaller than the outer window.
	 */
	INVALID_WINDOW_CONFIG(true),
	
	/**
	 * The channel contains no valid pixels.
	 */
	NO_VALID_DATA(true),
	
	/**
	 * Near-zero local variance during gamma parameter estimation.
	 */
	NUMERICAL_INSTABILITY(true),
	
	/**
	 * The feature schema does not match the schema expected by the area model.
	 */
	MODEL_MISMATCH(false),
	
	/**
	 * No area model was supplied for the channel, so corrected areas are unavailable.
	 */
	MISSING_MODEL(false),
	
	/**
	 * The area model returned NaN or an infinite value for at least one object, 
	 * usually because a feature it uses is unavailable.
	 */
	UNAVAILABLE_PREDICTION(false),
	
	/**
	 * Any other unexpected failure while processing the channel.
	 */
	PROCESSING_FAILED(true);
	
	private final boolean fatal;
	
	ErrorKind(boolean fatal) {
		this.fatal = fatal;
	}
	
	/**
	 * Query whether this kind of error prevents a channel from producing objects.
	 * Errors that only affect area correction still allow objects to be reported.
	 * @return
	 */
	public boolean isFatal() {
		return fatal;
	}

}
