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

package icebergarea.lib.pipeline;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;

import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.prep.PreparedGeometry;
import org.locationtech.jts.geom.prep.PreparedGeometryFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import icebergarea.lib.analysis.features.FeatureAggregator;
import icebergarea.lib.analysis.images.SimpleImage;
import icebergarea.lib.analysis.stats.LocalStatisticsEngine;
import icebergarea.lib.classifiers.IcebergClassification;
import icebergarea.lib.classifiers.IcebergClassifier;
import icebergarea.lib.common.ErrorKind;
import icebergarea.lib.common.IcebergAreaException;
import icebergarea.lib.common.NoValidDataException;
import icebergarea.lib.common.ThreadTools;
import icebergarea.lib.detection.ChannelSettings;
import icebergarea.lib.detection.DetectionMask;
import icebergarea.lib.detection.GammaCfar;
import icebergarea.lib.images.BackscatterRaster;
import icebergarea.lib.images.Channel;
import icebergarea.lib.objects.Blob;
import icebergarea.lib.objects.BlobExtractor;
import icebergarea.lib.regression.AreaCorrector;
import icebergarea.lib.regression.AreaModel;
import icebergarea.lib.regression.ClampPolicy;
import icebergarea.lib.regression.ModelMismatchException;

/**
 * Entry points for iceberg detection and area estimation.
 * <p>
 * The individual stages can be called on their own, or all stages can be run for several channels 
 * with {@link #runPipeline(Map, PipelineConfig, Map, Geometry)}.
 * Channels are processed independently, and a failure in one channel is reported as a {@link ChannelError} 
 * without affecting the others.
 */
public class IcebergAreaPipeline {
	
	private static final Logger logger = LoggerFactory.getLogger(IcebergAreaPipeline.class);
	
	private IcebergAreaPipeline() {
		throw new AssertionError();
	}
	
	/**
	 * Detect bright outliers in a raster.
	 * @param raster
	 * @param settings
	 * @return
	 * @throws NoValidDataException if the raster contains no valid pixels
	 */
	public static DetectionMask detect(BackscatterRaster raster, ChannelSettings settings) throws NoValidDataException {
		return GammaCfar.detect(raster, settings);
	}
	
	/**
	 * Group detected pixels into blobs.
	 * @param mask
	 * @param raster
	 * @return
	 */
	public static List<Blob> extractBlobs(DetectionMask mask, BackscatterRaster raster) {
		return BlobExtractor.extractBlobs(mask, raster);
	}
	
	/**
	 * Predict the area of a blob using default detection settings for the background statistics.
	 * @param blob
	 * @param raster the raster the blob was detected in
	 * @param model
	 * @return the corrected area, clamped to be non-negative
	 * @throws ModelMismatchException if the model requires different features
	 */
	public static double predictArea(Blob blob, BackscatterRaster raster, AreaModel model) throws ModelMismatchException {
		return predictArea(blob, raster, ChannelSettings.getDefault(), model);
	}
	
	/**
	 * Predict the area of a blob.
	 * <p>
	 * This computes the local statistics of the whole raster, so when predicting areas for many blobs 
	 * it is much more efficient to use {@link #runPipeline(Map, PipelineConfig, Map, Geometry)}.
	 * @param blob
	 * @param raster the raster the blob was detected in
	 * @param settings settings used for detection
	 * @param model
	 * @return the corrected area, clamped to be non-negative
	 * @throws ModelMismatchException if the model requires different features
	 */
	public static double predictArea(Blob blob, BackscatterRaster raster, ChannelSettings settings, AreaModel model) throws ModelMismatchException {
		var stats = LocalStatisticsEngine.compute(raster, settings.getWindow());
		var features = FeatureAggregator.computeFeatures(blob, raster, stats);
		return AreaCorrector.predictArea(features, model, ClampPolicy.ZERO, raster.getPixelArea());
	}
	
	/**
	 * Run the full pipeline for the enabled channels.
	 * @param rasters rasters by channel
	 * @param config
	 * @param models area models by channel; channels without a model are reported without corrected areas
	 * @param aoi optional area of interest in map coordinates; objects that do not intersect it are discarded
	 * @return
	 * @throws InterruptedException if the calling thread is interrupted
	 * @see #runPipeline(Map, PipelineConfig, Map, Geometry, SimpleImage)
	 */
	public static PipelineResult runPipeline(Map<Channel, BackscatterRaster> rasters, PipelineConfig config, 
			Map<Channel, ? extends AreaModel> models, Geometry aoi) throws InterruptedException {
		return runPipeline(rasters, config, models, aoi, null);
	}
	
	/**
	 * Run the full pipeline for the enabled channels, using an incidence angle grid for features.
	 * @param rasters rasters by channel
	 * @param config
	 * @param models area models by channel; channels without a model are reported without corrected areas
	 * @param aoi optional area of interest in map coordinates; objects that do not intersect it are discarded
	 * @param incidenceAngles optional incidence angle grid, in degrees, with the same size as the rasters
	 * @return
	 * @throws InterruptedException if the calling thread is interrupted
	 * @throws IllegalArgumentException if the incidence angle grid does not match the size of an enabled channel's raster
	 */
	public static PipelineResult runPipeline(Map<Channel, BackscatterRaster> rasters, PipelineConfig config, 
			Map<Channel, ? extends AreaModel> models, Geometry aoi, SimpleImage incidenceAngles) throws InterruptedException {
		return runPipeline(rasters, config, models, null, aoi, incidenceAngles);
	}
	
	/**
	 * Run the full pipeline for the enabled channels, optionally classifying the detected objects.
	 * @param rasters rasters by channel
	 * @param config
	 * @param models area models by channel; channels without a model are reported without corrected areas
	 * @param classifiers iceberg classifiers by channel; objects of channels without a classifier are not classified
	 * @param aoi optional area of interest in map coordinates; objects that do not intersect it are discarded
	 * @param incidenceAngles optional incidence angle grid, in degrees, with the same size as the rasters
	 * @return
	 * @throws InterruptedException if the calling thread is interrupted
	 * @throws IllegalArgumentException if the incidence angle grid does not match the size of an enabled channel's raster
	 */
	public static PipelineResult runPipeline(Map<Channel, BackscatterRaster> rasters, PipelineConfig config, 
			Map<Channel, ? extends AreaModel> models, Map<Channel, ? extends IcebergClassifier> classifiers,
			Geometry aoi, SimpleImage incidenceAngles) throws InterruptedException {
		Objects.requireNonNull(rasters, "Rasters must not be null");
		Objects.requireNonNull(config, "Config must not be null");
		Map<Channel, ? extends AreaModel> modelMap = models == null ? Collections.emptyMap() : models;
		Map<Channel, ? extends IcebergClassifier> classifierMap = classifiers == null ? Collections.emptyMap() : classifiers;
		PreparedGeometry preparedAOI = aoi == null ? null : PreparedGeometryFactory.prepare(aoi);
		
		long startTime = System.currentTimeMillis();
		
		// Check everything we can before processing anything
		var results = new EnumMap<Channel, ChannelResult>(Channel.class);
		var toProcess = new ArrayList<Channel>();
		for (var channel : config.getChannels()) {
			var raster = rasters.get(channel);
			if (raster != null && !FeatureAggregator.isCompatible(incidenceAngles, raster))
				throw new IllegalArgumentException("Incidence angle grid does not match the size of raster " + raster);
			var error = validateChannel(channel, raster);
			if (error == null)
				toProcess.add(channel);
			else {
				logger.warn("Unable to process {}: {}", channel, error.message());
				results.put(channel, ChannelResult.failed(error));
			}
		}
		
		if (config.isParallelChannels() && toProcess.size() > 1) {
			var pool = ThreadTools.createFixedThreadPool("iceberg-area", toProcess.size());
			try {
				var futures = new EnumMap<Channel, Future<ChannelResult>>(Channel.class);
				for (var channel : toProcess) {
					futures.put(channel, pool.submit(() -> runChannel(channel, rasters.get(channel), config, modelMap.get(channel), classifierMap.get(channel), preparedAOI, incidenceAngles)));
				}
				for (var entry : futures.entrySet()) {
					results.put(entry.getKey(), getResult(entry.getKey(), entry.getValue()));
				}
			} finally {
				pool.shutdownNow();
			}
		} else {
			for (var channel : toProcess) {
				results.put(channel, runChannel(channel, rasters.get(channel), config, modelMap.get(channel), classifierMap.get(channel), preparedAOI, incidenceAngles));
			}
		}
		
		var hh = results.containsKey(Channel.HH) ? results.get(Channel.HH).getObjects() : List.<IcebergObject>of();
		var hv = results.containsKey(Channel.HV) ? results.get(Channel.HV).getObjects() : List.<IcebergObject>of();
		var merged = ChannelMerger.merge(hh, hv, config.getMergeBuffer());
		
		long endTime = System.currentTimeMillis();
		logger.info("Processed {} channels in {} ms, {} merged objects", config.getChannels().size(), endTime - startTime, merged.size());
		return new PipelineResult(results, merged);
	}
	
	
	private static ChannelResult getResult(Channel channel, Future<ChannelResult> future) throws InterruptedException {
		try {
			return future.get();
		} catch (ExecutionException e) {
			var cause = e.getCause();
			if (cause instanceof InterruptedException)
				throw (InterruptedException)cause;
			logger.error("Processing failed for " + channel + ": " + cause.getLocalizedMessage(), cause);
			return ChannelResult.failed(new ChannelError(channel, ErrorKind.PROCESSING_FAILED, String.valueOf(cause.getLocalizedMessage())));
		}
	}
	
	/**
	 * Check whether a channel can be processed at all.
	 * Rasters smaller than the outer window are processed with clipped windows, or without any detections 
	 * if edges are excluded.
	 * @return an error, or null if the channel can be processed
	 */
	private static ChannelError validateChannel(Channel channel, BackscatterRaster raster) {
		if (raster == null)
			return new ChannelError(channel, ErrorKind.NO_VALID_DATA, "No raster provided for " + channel);
		if (raster.getChannel() != channel)
			logger.warn("Raster {} provided for channel {}", raster, channel);
		return null;
	}
	
	private static void checkInterrupted() throws InterruptedException {
		if (Thread.interrupted())
			throw new InterruptedException("Iceberg area pipeline interrupted");
	}
	
	private static ChannelResult runChannel(Channel channel, BackscatterRaster raster, PipelineConfig config, 
			AreaModel model, IcebergClassifier classifier, PreparedGeometry aoi, SimpleImage incidenceAngles) throws InterruptedException {
		try {
			return processChannel(channel, raster, config, model, classifier, aoi, incidenceAngles);
		} catch (IcebergAreaException e) {
			logger.warn("Unable to process {}: {}", channel, e.getLocalizedMessage());
			return ChannelResult.failed(new ChannelError(channel, e.getKind(), e.getLocalizedMessage()));
		} catch (RuntimeException e) {
			logger.error("Processing failed for " + channel + ": " + e.getLocalizedMessage(), e);
			return ChannelResult.failed(new ChannelError(channel, ErrorKind.PROCESSING_FAILED, String.valueOf(e.getLocalizedMessage())));
		}
	}
	
	private static ChannelResult processChannel(Channel channel, BackscatterRaster raster, PipelineConfig config, 
			AreaModel model, IcebergClassifier classifier, PreparedGeometry aoi, SimpleImage incidenceAngles) throws InterruptedException, IcebergAreaException {
		
		long startTime = System.currentTimeMillis();
		var settings = config.getSettings(channel);
		logger.debug("Processing {} with {}", channel, settings);
		
		if (raster.countValid() == 0)
			throw new NoValidDataException("Raster for channel " + channel + " contains no valid pixels");
		
		var stats = LocalStatisticsEngine.compute(raster, settings.getWindow());
		checkInterrupted();
		
		var thresholds = GammaCfar.computeThresholds(raster, stats, settings);
		var mask = GammaCfar.applyThresholds(raster, thresholds);
		checkInterrupted();
		
		var blobs = BlobExtractor.extractBlobs(mask, raster, config.getMinPixelCount());
		if (aoi != null) {
			int nBefore = blobs.size();
			blobs = blobs.stream().filter(b -> aoi.intersects(b.getOutline())).toList();
			logger.debug("{} of {} objects in {} intersect the area of interest", blobs.size(), nBefore, channel);
		}
		checkInterrupted();
		
		ChannelError correctionError = null;
		if (model == null)
			correctionError = new ChannelError(channel, ErrorKind.MISSING_MODEL, "No area model provided for " + channel);
		
		if (classifier != null && incidenceAngles == null)
			logger.warn("No incidence angles for {}, objects will not be classified as icebergs", channel);
		
		var objects = new ArrayList<IcebergObject>(blobs.size());
		int nUnavailable = 0;
		for (var blob : blobs) {
			var features = FeatureAggregator.computeFeatures(blob, raster, stats, incidenceAngles);
			double area = Double.NaN;
			if (correctionError == null) {
				try {
					area = AreaCorrector.predictArea(features, model, config.getClampPolicy(), raster.getPixelArea());
					if (Double.isNaN(area))
						nUnavailable++;
				} catch (ModelMismatchException e) {
					logger.warn("Area model for {} cannot be applied: {}", channel, e.getLocalizedMessage());
					correctionError = new ChannelError(channel, e.getKind(), e.getLocalizedMessage());
				}
			}
			IcebergClassification classification = classifier == null ? null : classifier.classify(features);
			objects.add(new IcebergObject(blob, features, area, classification));
		}
		if (nUnavailable > 0 && correctionError == null) {
			String message = "Area model for " + channel + " gave no finite prediction for " + nUnavailable + " of " + objects.size() + " objects";
			logger.warn(message);
			correctionError = new ChannelError(channel, ErrorKind.UNAVAILABLE_PREDICTION, message);
		}
		
		long endTime = System.currentTimeMillis();
		logger.info("{}: {} objects detected in {} ms ({} pixels, {} low-confidence)", 
				channel, objects.size(), endTime - startTime, mask.countDetected(), stats.countLowConfidence());
		return ChannelResult.of(channel, objects, correctionError);
	}

}
