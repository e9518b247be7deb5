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

package icebergarea.lib.detection;

/**
 * Method used to estimate the gamma shape parameter of the clutter.
 */
public enum ShapeEstimation {
	
	/**
	 * Estimate the shape per pixel from the mean and variance of its background window.
	 */
	LOCAL_MOMENTS,
	
	/**
	 * Estimate a single equivalent number of looks (ENL) for the whole channel, 
	 * using valid pixels below twice the median intensity. 
	 * Only the local background mean then varies per pixel.
	 */
	GLOBAL_ENL;

}
