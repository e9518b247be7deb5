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

/**
 * Policy for handling negative predictions, which are possible when a model extrapolates.
 * <p>
 * NaN and infinite predictions are not clamped: they mean the area is unavailable, and are returned as NaN.
 */
public enum ClampPolicy {
	
	/**
	 * Replace negative predictions with 0.
	 */
	ZERO,
	
	/**
	 * Replace negative predictions with the area of one pixel.
	 */
	ONE_PIXEL;
	
	/**
	 * Clamp a prediction.
	 * @param prediction the model output
	 * @param pixelArea area of one pixel, used by {@link #ONE_PIXEL}
	 * @return the prediction if it is finite and non-negative, the replacement value if it is negative, 
	 *         or NaN if it is not finite
	 */
	public double clamp(double prediction, double pixelArea) {
		if (!Double.isFinite(prediction))
			return Double.NaN;
		if (prediction >= 0)
			return prediction;
		return this == ONE_PIXEL ? pixelArea : 0.0;
	}

}
