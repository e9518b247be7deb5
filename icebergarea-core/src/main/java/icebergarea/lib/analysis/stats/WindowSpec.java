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

import icebergarea.lib.common.GeneralTools;

/**
 * Square annular window used to estimate background statistics around a pixel.
 * <p>
 * The background (annulus) is the outer window minus the guard window, both centered on the pixel.
 * Both sizes must be positive and odd, and the guard must be strictly smaller than the outer window.
 */
public final class WindowSpec {
	
	/**
	 * Default outer window size, in pixels.
	 */
	public static final int DEFAULT_OUTER_SIZE = 29;
	
	/**
	 * Default guard window size, in pixels.
	 */
	public static final int DEFAULT_GUARD_SIZE = 21;
	
	private static final WindowSpec DEFAULT = new WindowSpec(DEFAULT_OUTER_SIZE, DEFAULT_GUARD_SIZE);
	
	private final int outerSize;
	private final int guardSize;
	
	private WindowSpec(int outerSize, int guardSize) {
		if (outerSize <= 0 || guardSize <= 0)
			throw new InvalidWindowConfigException("Window sizes must be positive (outer=" + outerSize + ", guard=" + guardSize + ")");
		if (!GeneralTools.isOdd(outerSize) || !GeneralTools.isOdd(guardSize))
			throw new InvalidWindowConfigException("Window sizes must be odd (outer=" + outerSize + ", guard=" + guardSize + ")");
		if (guardSize >= outerSize)
			throw new InvalidWindowConfigException("Guard window must be smaller than outer window (outer=" + outerSize + ", guard=" + guardSize + ")");
		this.outerSize = outerSize;
		this.guardSize = guardSize;
	}
	
	/**
	 * Create a window specification.
	 * @param outerSize outer window width, in pixels
	 * @param guardSize guard window width, in pixels
	 * @return
	 * @throws InvalidWindowConfigException if the sizes are not valid
	 */
	public static WindowSpec of(int outerSize, int guardSize) throws InvalidWindowConfigException {
		return new WindowSpec(outerSize, guardSize);
	}
	
	/**
	 * Get the default 29/21 window.
	 * @return
	 */
	public static WindowSpec getDefault() {
		return DEFAULT;
	}
	
	/**
	 * Outer window width, in pixels.
	 * @return
	 */
	public int getOuterSize() {
		return outerSize;
	}
	
	/**
	 * Guard window width, in pixels.
	 * @return
	 */
	public int getGuardSize() {
		return guardSize;
	}
	
	/**
	 * Half-width of the outer window, excluding the central pixel.
	 * @return
	 */
	public int getOuterRadius() {
		return outerSize / 2;
	}
	
	/**
	 * Half-width of the guard window, excluding the central pixel.
	 * @return
	 */
	public int getGuardRadius() {
		return guardSize / 2;
	}
	
	/**
	 * Number of pixels in the annulus when the window is fully inside the image.
	 * @return
	 */
	public int getAnnulusArea() {
		return outerSize * outerSize - guardSize * guardSize;
	}

	@Override
	public int hashCode() {
		return 31 * outerSize + guardSize;
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (!(obj instanceof WindowSpec))
			return false;
		var other = (WindowSpec)obj;
		return outerSize == other.outerSize && guardSize == other.guardSize;
	}

	@Override
	public String toString() {
		return "WindowSpec[outer=" + outerSize + ", guard=" + guardSize + "]";
	}

}
