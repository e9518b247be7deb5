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

package icebergarea.lib.analysis.features;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import icebergarea.lib.analysis.images.SimpleImage;
import icebergarea.lib.analysis.images.SimpleImages;
import icebergarea.lib.analysis.stats.LocalStatistics;
import icebergarea.lib.analysis.stats.RunningStatistics;
import icebergarea.lib.images.BackscatterRaster;
import icebergarea.lib.images.BackscatterUnits;
import icebergarea.lib.objects.Blob;
import icebergarea.lib.roi.GeometryTools;

/**
 * Computes the {@link FeatureSchema#BACKSCATTER_V1} features for blobs.
 * <p>
 * Backscatter features use only the raster of the blob's own channel.
 */
public class FeatureAggregator {
	
	private static final Logger logger = LoggerFactory.getLogger(FeatureAggregator.class);
	
	private FeatureAggregator() {
		throw new AssertionError();
	}
	
	/**
	 * Compute features for a blob, without incidence angles.
	 * @param blob
	 * @param raster the raster the blob was detected in
	 * @param stats local background statistics for the raster
	 * @return
	 */
	public static FeatureVector computeFeatures(Blob blob, BackscatterRaster raster, LocalStatistics stats) {
		return computeFeatures(blob, raster, stats, null);
	}
	
	/**
	 * Compute features for a blob.
	 * @param blob
	 * @param raster the raster the blob was detected in
	 * @param stats local background statistics for the raster
	 * @param incidenceAngles optional incidence angle grid with the same size as the raster; may be null
	 * @return
	 */
	public static FeatureVector computeFeatures(Blob blob, BackscatterRaster raster, LocalStatistics stats, SimpleImage incidenceAngles) {
		if (stats.getWidth() != raster.getWidth() || stats.getHeight() != raster.getHeight())
			throw new IllegalArgumentException("Local statistics size does not match raster " + raster);
		if (!isCompatible(incidenceAngles, raster))
			throw new IllegalArgumentException("Incidence angle grid size " + incidenceAngles.getWidth() + "x" + incidenceAngles.getHeight() + " does not match raster " + raster);
		
		int width = raster.getWidth();
		var backscatter = new RunningStatistics();
		var clutter = new RunningStatistics();
		var incidence = new RunningStatistics();
		for (int ind : blob.getPixelIndices()) {
			backscatter.addValue(raster.getValue(ind));
			clutter.addValue(stats.getMean(ind));
			if (incidenceAngles != null)
				incidence.addValue(incidenceAngles.getValue(ind % width, ind / width));
		}
		
		double area = blob.getAreaCfar();
		double mean = backscatter.getMean();
		double meanDb = BackscatterUnits.linearToDecibels(mean);
		double clutterMeanDb = BackscatterUnits.linearToDecibels(clutter.getMean());
		
		var outline = blob.getOutline();
		double perimeter = outline.getLength();
		double compactness = perimeter > 0 ? perimeter * perimeter / area : Double.NaN;
		double perimeterIndex = perimeter > 0 ? 2 * Math.sqrt(Math.PI * area) / perimeter : Double.NaN;
		double maxLength = GeometryTools.maxVertexDistance(outline);
		double rootLength = Math.sqrt(area);
		
		var features = new FeatureVector(FeatureSchema.BACKSCATTER_V1,
				area,
				rootLength,
				mean,
				backscatter.getPopulationStdDev(),
				backscatter.getMin(),
				backscatter.getMax(),
				meanDb,
				clutterMeanDb,
				meanDb - clutterMeanDb,
				perimeter,
				compactness,
				perimeterIndex,
				maxLength,
				rootLength > 0 ? maxLength / rootLength : Double.NaN,
				incidence.getMean()
				);
		logger.trace("Features for {}: {}", blob, features);
		return features;
	}
	
	/**
	 * Check whether an incidence angle grid can be used with a raster.
	 * @param incidenceAngles
	 * @param raster
	 * @return true if the grid is null or has the same size as the raster
	 */
	public static boolean isCompatible(SimpleImage incidenceAngles, BackscatterRaster raster) {
		return incidenceAngles == null || SimpleImages.sameSize(incidenceAngles, raster);
	}

}
