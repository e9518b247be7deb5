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
 * A unit-length horizontal or vertical pixel edge.
 * The first point is always the smaller of the two, so equal edges compare as equal regardless of tracing direction.
 */
record CoordinatePair(IntPoint c1, IntPoint c2) implements Comparable<CoordinatePair> {

	CoordinatePair {
		int comp = c1.compareTo(c2);
		if (comp == 0)
			throw new IllegalArgumentException("Coordinates should not be the same!");
		if (comp > 0) {
			var temp = c1;
			c1 = c2;
			c2 = temp;
		}
		boolean horizontal = c1.getY() == c2.getY();
		boolean vertical = c1.getX() == c2.getX();
		if (!horizontal && !vertical)
			throw new IllegalArgumentException("Coordinate pairs should be horizontal or vertical!");
	}

	@Override
	public int compareTo(CoordinatePair other) {
		int comp = c1.compareTo(other.c1);
		return comp == 0 ? c2.compareTo(other.c2) : comp;
	}

}
