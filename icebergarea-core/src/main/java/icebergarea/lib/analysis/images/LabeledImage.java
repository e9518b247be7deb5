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

import java.util.List;

import org.locationtech.jts.geom.Envelope;

/**
 * Image of integer labels produced by connected component labeling.
 * <p>
 * Background pixels have label 0; labels are consecutive from 1 to {@link #getLabelCount()}.
 * The pixel indices for each label are stored in ascending row-wise order.
 */
public class LabeledImage implements SimpleImage {
	
	private final int width;
	private final int height;
	private final int[] labels;
	private final List<int[]> pixelsByLabel;
	
	LabeledImage(int width, int height, int[] labels, List<int[]> pixelsByLabel) {
		this.width = width;
		this.height = height;
		this.labels = labels;
		this.pixelsByLabel = pixelsByLabel;
	}
	
	/**
	 * Get the number of labels, excluding the background.
	 * @return
	 */
	public int getLabelCount() {
		return pixelsByLabel.size();
	}
	
	/**
	 * Get the label at a pixel.
	 * @param x
	 * @param y
	 * @return the label, or 0 for background
	 */
	public int getLabel(int x, int y) {
		return labels[y * width + x];
	}
	
	/**
	 * Get the row-wise pixel indices belonging to a label.
	 * @param label label, starting from 1
	 * @return a copy of the sorted indices
	 */
	public int[] getPixelIndices(int label) {
		return pixelsByLabel.get(label - 1).clone();
	}
	
	/**
	 * Get the number of pixels with a label.
	 * @param label label, starting from 1
	 * @return
	 */
	public int getPixelCount(int label) {
		return pixelsByLabel.get(label - 1).length;
	}
	
	/**
	 * Get the bounding box of a label in pixel coordinates.
	 * The envelope covers the full extent of the pixels, so a single pixel at (x, y) gives (x, x+1, y, y+1).
	 * @param label
	 * @return
	 */
	public Envelope getBounds(int label) {
		int minX = Integer.MAX_VALUE, minY = Integer.MAX_VALUE;
		int maxX = Integer.MIN_VALUE, maxY = Integer.MIN_VALUE;
		for (int ind : pixelsByLabel.get(label - 1)) {
			int x = ind % width;
			int y = ind / width;
			if (x < minX)
				minX = x;
			if (x > maxX)
				maxX = x;
			if (y < minY)
				minY = y;
			if (y > maxY)
				maxY = y;
		}
		return new Envelope(minX, maxX + 1, minY, maxY + 1);
	}
	
	/**
	 * Returns true if any pixel with the label lies on the image border.
	 * @param label
	 * @return
	 */
	public boolean touchesBorder(int label) {
		for (int ind : pixelsByLabel.get(label - 1)) {
			int x = ind % width;
			int y = ind / width;
			if (x == 0 || y == 0 || x == width - 1 || y == height - 1)
				return true;
		}
		return false;
	}

	@Override
	public float getValue(int x, int y) {
		return getLabel(x, y);
	}

	@Override
	public int getWidth() {
		return width;
	}

	@Override
	public int getHeight() {
		return height;
	}

}
