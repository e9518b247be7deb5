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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Locale;

import org.junit.jupiter.api.Test;

@SuppressWarnings("javadoc")
public class TestGeneralTools {
	
	@Test
	public void test_formatNumber() {
		assertEquals("1.23", GeneralTools.formatNumber(Locale.US, 1.2345, 2));
		assertEquals("1,23", GeneralTools.formatNumber(Locale.GERMANY, 1.2345, 2));
		assertEquals("2", GeneralTools.formatNumber(Locale.US, 2.0, 3));
		assertEquals("1234567.5", GeneralTools.formatNumber(Locale.US, 1234567.5, 1));
		assertEquals("NaN", GeneralTools.formatNumber(Locale.US, Double.NaN, 2));
		assertEquals("-Infinity", GeneralTools.formatNumber(Locale.US, Double.NEGATIVE_INFINITY, 2));
	}
	
	@Test
	public void test_isOdd() {
		assertTrue(GeneralTools.isOdd(1));
		assertTrue(GeneralTools.isOdd(29));
		assertTrue(GeneralTools.isOdd(-3));
		assertFalse(GeneralTools.isOdd(0));
		assertFalse(GeneralTools.isOdd(20));
	}

}
