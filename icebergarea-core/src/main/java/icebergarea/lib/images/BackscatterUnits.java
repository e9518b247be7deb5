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

package icebergarea.lib.images;

/**
 * Conversions between linear backscatter intensities and decibels.
 */
public class BackscatterUnits {
	
	private BackscatterUnits() {
		throw new AssertionError();
	}
	
	/**
	 * Convert a linear intensity to decibels.
	 * @param linear
	 * @return the value in dB; NaN for negative or NaN input, negative infinity for zero
	 */
	public static double linearToDecibels(double linear) {
		if (Double.isNaN(linear) || linear < 0)
			return Double.NaN;
		return 10.0 * Math.log10(linear);
	}
	
	/**
	 * Convert decibels to a linear intensity.
	 * @param decibels
	 * @return
	 */
	public static double decibelsToLinear(double decibels) {
		return Math.pow(10.0, decibels / 10.0);
	}
	
	/**
	 * Convert an array of decibel values to linear intensities in place.
	 * NaN values remain NaN.
	 * @param values
	 * @return the same array, for convenience
	 */
	public static float[] decibelsToLinearInPlace(float[] values) {
		for (int i = 0; i < values.length; i++) {
			float v = values[i];
			if (!Float.isNaN(v))
				values[i] = (float)decibelsToLinear(v);
		}
		return values;
	}

}
