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

package icebergarea.lib.analysis.stats;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

@SuppressWarnings("javadoc")
public class TestWindowSpec {
	
	@Test
	public void test_default() {
		var window = WindowSpec.getDefault();
		assertEquals(29, window.getOuterSize());
		assertEquals(21, window.getGuardSize());
		assertEquals(14, window.getOuterRadius());
		assertEquals(10, window.getGuardRadius());
		assertEquals(29*29 - 21*21, window.getAnnulusArea());
		assertEquals(WindowSpec.of(29, 21), window);
	}
	
	@ParameterizedTest
	@CsvSource({
		"21, 29",
		"21, 21",
		"28, 21",
		"29, 20",
		"0, 0",
		"-3, 1",
		"3, -1"
	})
	public void test_invalid(int outer, int guard) {
		assertThrows(InvalidWindowConfigException.class, () -> WindowSpec.of(outer, guard));
	}
	
	@Test
	public void test_invalidIsIllegalArgument() {
		assertThrows(IllegalArgumentException.class, () -> WindowSpec.of(4, 1));
	}

}
