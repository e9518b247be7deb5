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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Connected component labeling of binary masks using 8-connectivity.
 * <p>
 * Labels are assigned in raster scan order of the first pixel found for each component, 
 * so the output is deterministic for a given mask.
 */
public class ConnectedComponents {
	
	private static final Logger logger = LoggerFactory.getLogger(ConnectedComponents.class);
	
	private ConnectedComponents() {
		throw new AssertionError();
	}
	
	/**
	 * Label the 8-connected foreground regions of a mask.
	 * @param mask row-wise mask, where true indicates foreground
	 * @param width
	 * @param height
	 * @return
	 */
	public static LabeledImage label(boolean[] mask, int width, int height) {
		if (width <= 0 || height <= 0 || (long)width * height != mask.length)
			throw new IllegalArgumentException("Mask length " + mask.length + " does not match " + width + "x" + height);
		
		long startTime = System.currentTimeMillis();
		int[] labels = new int[mask.length];
		List<int[]> pixelsByLabel = new ArrayList<>();
		IntDequeue queue = new IntDequeue(1024);
		IntDequeue members = new IntDequeue(1024);
		
		for (int i = 0; i < mask.length; i++) {
			if (!mask[i] || labels[i] != 0)
				continue;
			int label = pixelsByLabel.size() + 1;
			labels[i] = label;
			queue.clear();
			members.clear();
			queue.add(i);
			while (!queue.isEmpty()) {
				int ind = queue.remove();
				members.add(ind);
				int x = ind % width;
				int y = ind / width;
				// Test 8-neighbours
				for (int yy = Math.max(0, y-1); yy <= Math.min(height-1, y+1); yy++) {
					for (int xx = Math.max(0, x-1); xx <= Math.min(width-1, x+1); xx++) {
						int ind2 = yy * width + xx;
						if (mask[ind2] && labels[ind2] == 0) {
							labels[ind2] = label;
							queue.add(ind2);
						}
					}
				}
			}
			int[] pixels = members.toArray();
			Arrays.sort(pixels);
			pixelsByLabel.add(pixels);
		}
		
		long endTime = System.currentTimeMillis();
		logger.debug("Labeled {} components in {}x{} mask in {} ms", pixelsByLabel.size(), width, height, endTime - startTime);
		return new LabeledImage(width, height, labels, pixelsByLabel);
	}
	
	
	/**
	 * Minimal growable FIFO queue of ints.
	 */
	static class IntDequeue {
		
		private int[] array;
		private int head = 0; // Location of first element
		private int tail = 0; // Location of *next* insert
		
		IntDequeue(int capacity) {
			array = new int[Math.max(capacity, 16)];
		}
		
		boolean isEmpty() {
			return tail == head;
		}
		
		int size() {
			return tail - head;
		}
		
		void clear() {
			head = 0;
			tail = 0;
		}
		
		/**
		 * Performs no check that the output will be valid (caller should use isEmpty first to check this)
		 * @return
		 */
		int remove() {
			head++;
			return array[head-1];
		}
		
		void add(int val) {
			if (tail == array.length) {
				if (head != 0) {
					// Shift everything back if that's an option
					System.arraycopy(array, head, array, 0, tail-head);
					tail -= head;
					head = 0;
				} else {
					array = Arrays.copyOf(array, array.length * 2);
				}
			}
			array[tail++] = val;
		}
		
		int[] toArray() {
			return Arrays.copyOfRange(array, head, tail);
		}
		
	}

}
