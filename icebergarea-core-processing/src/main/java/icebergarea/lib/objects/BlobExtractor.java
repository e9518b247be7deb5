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

package icebergarea.lib.objects;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import icebergarea.lib.analysis.images.ConnectedComponents;
import icebergarea.lib.analysis.images.ContourTracing;
import icebergarea.lib.detection.DetectionMask;
import icebergarea.lib.images.BackscatterRaster;
import icebergarea.lib.roi.GeometryTools;

/**
 * Groups detected pixels into blobs using 8-connectivity, and traces their outlines in map coordinates.
 */
public class BlobExtractor {
	
	private static final Logger logger = LoggerFactory.getLogger(BlobExtractor.class);
	
	private BlobExtractor() {
		throw new AssertionError();
	}
	
	/**
	 * Extract all blobs from a detection mask.
	 * @param mask
	 * @param raster the raster the mask was computed from, providing the geotransform and pixel area
	 * @return blobs in raster scan order; empty if nothing was detected
	 */
	public static List<Blob> extractBlobs(DetectionMask mask, BackscatterRaster raster) {
		return extractBlobs(mask, raster, 1);
	}
	
	/**
	 * Extract blobs with at least a minimum number of pixels from a detection mask.
	 * Ids are assigned consecutively after the size filter.
	 * @param mask
	 * @param raster the raster the mask was computed from, providing the geotransform and pixel area
	 * @param minPixelCount minimum number of pixels for a blob to be retained
	 * @return blobs in raster scan order; empty if nothing was detected
	 */
	public static List<Blob> extractBlobs(DetectionMask mask, BackscatterRaster raster, int minPixelCount) {
		if (mask.getWidth() != raster.getWidth() || mask.getHeight() != raster.getHeight())
			throw new IllegalArgumentException("Mask size " + mask.getWidth() + "x" + mask.getHeight() + " does not match raster " + raster);
		if (minPixelCount < 1)
			throw new IllegalArgumentException("Minimum pixel count must be at least 1, but got " + minPixelCount);
		
		long startTime = System.currentTimeMillis();
		var labels = ConnectedComponents.label(mask.toArray(), mask.getWidth(), mask.getHeight());
		int nLabels = labels.getLabelCount();
		if (nLabels == 0)
			return Collections.emptyList();
		
		var factory = GeometryTools.getDefaultFactory();
		var transform = raster.getTransform().toAffineTransformation();
		List<Blob> blobs = new ArrayList<>();
		int nSmall = 0;
		for (int label = 1; label <= nLabels; label++) {
			if (labels.getPixelCount(label) < minPixelCount) {
				nSmall++;
				continue;
			}
			var outline = ContourTracing.traceLabel(labels, label, factory);
			outline = GeometryTools.transform(outline, transform);
			blobs.add(new Blob(
					blobs.size() + 1,
					raster.getChannel(),
					labels.getPixelIndices(label),
					outline,
					raster.getPixelArea(),
					labels.getBounds(label),
					labels.touchesBorder(label)));
		}
		long endTime = System.currentTimeMillis();
		logger.debug("Extracted {} blobs for channel {} in {} ms ({} smaller than {} pixels discarded)", 
				blobs.size(), raster.getChannel(), endTime - startTime, nSmall, minPixelCount);
		return blobs;
	}

}
