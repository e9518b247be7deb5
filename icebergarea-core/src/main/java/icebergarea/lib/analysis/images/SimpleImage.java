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
 * A minimal interface to provide access to pixel values from a 2D, single-channel image.
 */
public interface SimpleImage {
	
	/**
	 * Get the value of a single pixel.
	 * @param x x-coordinate of the pixel
	 * @param y y-coordinate of the pixel
	 * @return
	 */
	float getValue(int x, int y);
	
	/**
	 * Width of the image, in pixels.
	 * @return
	 */
	int getWidth();
	
	/**
	 * Height of the image, in pixels.
	 * @return
	 */
	int getHeight();

}
