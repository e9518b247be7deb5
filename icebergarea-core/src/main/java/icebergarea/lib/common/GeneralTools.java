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

import java.text.NumberFormat;
import java.util.Locale;

/**
 * A collection of generally-useful static methods.
 */
public class GeneralTools {
	
	private GeneralTools() {
		throw new AssertionError();
	}
	
	/**
	 * Return true if the value is odd.
	 * @param value
	 * @return
	 */
	public static boolean isOdd(int value) {
		return (value & 1) == 1;
	}
	
	/**
	 * Format a number with a specified number of decimal places, using the default locale for formatting.
	 * @param value the value to format
	 * @param maxDecimalPlaces maximum number of decimal places
	 * @return
	 * @see #formatNumber(Locale, double, int)
	 */
	public static String formatNumber(double value, int maxDecimalPlaces) {
		return formatNumber(Locale.getDefault(Locale.Category.FORMAT), value, maxDecimalPlaces);
	}
	
	/**
	 * Format a number with a specified number of decimal places, stripping trailing zeros.
	 * @param locale locale used for formatting
	 * @param value the value to format
	 * @param maxDecimalPlaces maximum number of decimal places
	 * @return the formatted string; "NaN" or an infinity symbol for non-finite values
	 */
	public static String formatNumber(Locale locale, double value, int maxDecimalPlaces) {
		if (Double.isNaN(value))
			return "NaN";
		if (Double.isInfinite(value))
			return value > 0 ? "Infinity" : "-Infinity";
		NumberFormat nf = NumberFormat.getInstance(locale);
		nf.setGroupingUsed(false);
		nf.setMinimumFractionDigits(0);
		nf.setMaximumFractionDigits(maxDecimalPlaces);
		return nf.format(value);
	}

}
