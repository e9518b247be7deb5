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

package icebergarea.lib.analysis.images;

/**
 * A pixel corner with integer coordinates, packed into a single long so that sorting is cheap.
 */
record IntPoint(long value) implements Comparable<IntPoint> {

	IntPoint(int x, int y) {
		this(packLong(x, y));
	}

	static long packLong(int x, int y) {
		return ((long) x << 32) | (y & 0xffffffffL);
	}

	int getX() {
		return (int)(value >> 32);
	}

	int getY() {
		return (int)value;
	}

	@Override
	public int compareTo(IntPoint o) {
		return Long.compare(value, o.value);
	}

}
