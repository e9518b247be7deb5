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

import icebergarea.lib.images.Channel;

/**
 * Binary outlier mask produced by CFAR detection.
 */
public class DetectionMask {
	
	private final Channel channel;
	private final int width;
	private final int height;
	private final boolean[] mask;
	private final ThresholdMap thresholds;
	
	DetectionMask(Channel channel, int width, int height, boolean[] mask, ThresholdMap thresholds) {
		this.channel = channel;
		this.width = width;
		this.height = height;
		this.mask = mask;
		this.thresholds = thresholds;
	}
	
	/**
	 * Create a mask from a row-wise array of flags, e.g. a reference mask that was not computed by CFAR detection.
	 * @param channel
	 * @param mask detected pixels; this is copied
	 * @param width
	 * @param height
	 * @return a mask without thresholds
	 */
	public static DetectionMask create(Channel channel, boolean[] mask, int width, int height) {
		if (width <= 0 || height <= 0 || mask.length != width * height)
			throw new IllegalArgumentException("Mask length " + mask.length + " does not match size " + width + "x" + height);
		return new DetectionMask(channel, width, height, mask.clone(), null);
	}
	
	public Channel getChannel() {
		return channel;
	}
	
	public int getWidth() {
		return width;
	}
	
	public int getHeight() {
		return height;
	}
	
	/**
	 * Returns true if the pixel was detected as an outlier.
	 * @param x
	 * @param y
	 * @return
	 */
	public boolean isDetected(int x, int y) {
		return mask[y * width + x];
	}
	
	/**
	 * Count the detected pixels.
	 * @return
	 */
	public int countDetected() {
		int n = 0;
		for (boolean b : mask) {
			if (b)
				n++;
		}
		return n;
	}
	
	/**
	 * Get a row-wise copy of the mask.
	 * @return
	 */
	public boolean[] toArray() {
		return mask.clone();
	}
	
	/**
	 * Get the thresholds used to create this mask.
	 * @return the thresholds, or null if the mask was not created by thresholding
	 */
	public ThresholdMap getThresholds() {
		return thresholds;
	}

}
