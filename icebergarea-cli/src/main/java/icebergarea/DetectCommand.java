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

package icebergarea;

import java.nio.file.Path;
import java.util.EnumMap;
import java.util.concurrent.Callable;

import org.locationtech.jts.geom.Geometry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import icebergarea.io.LogManager;
import icebergarea.io.LogManager.LogLevel;
import icebergarea.io.RasterReaders;
import icebergarea.io.RasterReaders.RasterOptions;
import icebergarea.io.ResultWriter;
import icebergarea.lib.analysis.images.SimpleImage;
import icebergarea.lib.analysis.stats.InvalidWindowConfigException;
import icebergarea.lib.analysis.stats.WindowSpec;
import icebergarea.lib.classifiers.IcebergClassifier;
import icebergarea.lib.classifiers.IcebergClassifiers;
import icebergarea.lib.common.GeneralTools;
import icebergarea.lib.detection.ChannelSettings;
import icebergarea.lib.detection.EdgePolicy;
import icebergarea.lib.detection.ShapeEstimation;
import icebergarea.lib.images.BackscatterRaster;
import icebergarea.lib.images.Channel;
import icebergarea.lib.images.GeoTransform;
import icebergarea.lib.io.GeoJsonTools;
import icebergarea.lib.pipeline.IcebergAreaPipeline;
import icebergarea.lib.pipeline.PipelineConfig;
import icebergarea.lib.regression.AreaModel;
import icebergarea.lib.regression.AreaModels;
import icebergarea.lib.regression.ClampPolicy;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParameterException;
import picocli.CommandLine.Spec;

@Command(name = "detect", description = {
		"Detect icebergs in HH and/or HV backscatter rasters and estimate their areas.",
		"Rasters must be single-band float images, calibrated and geocoded."},
		sortOptions = false)
class DetectCommand implements Callable<Integer> {
	
	private static final Logger logger = LoggerFactory.getLogger(DetectCommand.class);
	
	@Spec
	private CommandSpec spec;
	
	@Option(names = "--hh", description = "HH backscatter raster.", paramLabel = "raster")
	private Path hh;
	
	@Option(names = "--hv", description = "HV backscatter raster.", paramLabel = "raster")
	private Path hv;
	
	@Option(names = "--decibels", description = "Rasters contain backscatter in decibels rather than linear units.")
	private boolean decibels;
	
	@Option(names = "--nodata", description = "Raster value used for pixels without data (NaN is always nodata).", paramLabel = "value")
	private Float noDataValue;
	
	@Option(names = "--pixel-size", description = "Pixel size in map units (e.g. meters). If omitted, pixel coordinates are used.", paramLabel = "size")
	private Double pixelSize;
	
	@Option(names = "--origin-x", description = "Map x-coordinate of the left edge of the raster (default: ${DEFAULT-VALUE}).", defaultValue = "0")
	private double originX;
	
	@Option(names = "--origin-y", description = "Map y-coordinate of the top edge of the raster (default: ${DEFAULT-VALUE}).", defaultValue = "0")
	private double originY;
	
	@Option(names = "--outer", description = "Outer window size in pixels, must be odd (default: ${DEFAULT-VALUE}).", defaultValue = "" + WindowSpec.DEFAULT_OUTER_SIZE)
	private int outer;
	
	@Option(names = "--guard", description = "Guard window size in pixels, must be odd (default: ${DEFAULT-VALUE}).", defaultValue = "" + WindowSpec.DEFAULT_GUARD_SIZE)
	private int guard;
	
	@Option(names = "--pfa", description = "Probability of false alarm (default: ${DEFAULT-VALUE}).", defaultValue = "" + ChannelSettings.DEFAULT_PFA)
	private double pfa;
	
	@Option(names = "--shape", description = {"Clutter shape estimation (default: ${DEFAULT-VALUE}).", "Options: ${COMPLETION-CANDIDATES}"}, defaultValue = "LOCAL_MOMENTS")
	private ShapeEstimation shapeEstimation;
	
	@Option(names = "--edge-policy", description = {"Handling of pixels near the raster border (default: ${DEFAULT-VALUE}).", "Options: ${COMPLETION-CANDIDATES}"}, defaultValue = "CLIP")
	private EdgePolicy edgePolicy;
	
	@Option(names = "--min-relative-variance", description = "Minimum clutter variance relative to the squared mean (default: ${DEFAULT-VALUE}).", 
			defaultValue = "" + ChannelSettings.DEFAULT_MIN_RELATIVE_VARIANCE, hidden = true)
	private double minRelativeVariance;
	
	@Option(names = "--min-pixels", description = "Minimum number of pixels per object (default: ${DEFAULT-VALUE}).", defaultValue = "1")
	private int minPixels;
	
	@Option(names = "--model-hh", description = "Area model for HH (JSON).", paramLabel = "model")
	private Path modelHH;
	
	@Option(names = "--model-hv", description = "Area model for HV (JSON).", paramLabel = "model")
	private Path modelHV;
	
	@Option(names = "--classifier-hh", description = "Iceberg classifier for HH (JSON). Requires --incidence.", paramLabel = "classifier")
	private Path classifierHH;
	
	@Option(names = "--classifier-hv", description = "Iceberg classifier for HV (JSON). Requires --incidence.", paramLabel = "classifier")
	private Path classifierHV;
	
	@Option(names = "--clamp", description = {"Replacement for negative area predictions (default: ${DEFAULT-VALUE}).", "Options: ${COMPLETION-CANDIDATES}"}, defaultValue = "ZERO")
	private ClampPolicy clampPolicy;
	
	@Option(names = "--aoi", description = "Area of interest (GeoJSON) in map coordinates. Objects outside it are discarded.", paramLabel = "geojson")
	private Path aoi;
	
	@Option(names = "--incidence", description = "Incidence angle raster in degrees, with the same size as the backscatter rasters.", paramLabel = "raster")
	private Path incidence;
	
	@Option(names = "--merge-buffer", description = "Distance within which HH and HV objects are merged, in map units (default: ${DEFAULT-VALUE}).", 
			defaultValue = "" + PipelineConfig.DEFAULT_MERGE_BUFFER)
	private double mergeBuffer;
	
	@Option(names = "--serial", description = "Process channels one after the other.")
	private boolean serial;
	
	@Option(names = {"-o", "--output"}, description = "Output JSON file.", required = true, paramLabel = "json")
	private Path output;
	
	@Option(names = {"-l", "--log"}, description = {"Log level (default: ${DEFAULT-VALUE}).", "Options: ${COMPLETION-CANDIDATES}"}, defaultValue = "INFO")
	private LogLevel logLevel;
	
	@Option(names = {"-h", "--help"}, usageHelp = true, description = "Show this help message and exit.")
	private boolean usageHelpRequested;

	@Override
	public Integer call() throws Exception {
		LogManager.setRootLogLevel(logLevel);
		
		if (hh == null && hv == null)
			throw new ParameterException(spec.commandLine(), "At least one of --hh or --hv must be specified");
		
		var settings = createSettings();
		var config = PipelineConfig.builder()
				.channels(hh == null ? new Channel[] {Channel.HV} : hv == null ? new Channel[] {Channel.HH} : Channel.values())
				.settings(settings)
				.minPixelCount(minPixels)
				.clampPolicy(clampPolicy)
				.mergeBuffer(mergeBuffer)
				.parallelChannels(!serial)
				.build();
		logger.debug("Pipeline config: {}", config);
		
		var options = new RasterOptions()
				.transform(createTransform())
				.decibels(decibels);
		if (noDataValue != null)
			options.noDataValue(noDataValue);
		
		var rasters = new EnumMap<Channel, BackscatterRaster>(Channel.class);
		var models = new EnumMap<Channel, AreaModel>(Channel.class);
		var classifiers = new EnumMap<Channel, IcebergClassifier>(Channel.class);
		if (hh != null) {
			rasters.put(Channel.HH, RasterReaders.readBackscatter(hh, Channel.HH, options));
			if (modelHH != null)
				models.put(Channel.HH, AreaModels.readModel(modelHH));
			if (classifierHH != null)
				classifiers.put(Channel.HH, IcebergClassifiers.readClassifier(classifierHH));
		}
		if (hv != null) {
			rasters.put(Channel.HV, RasterReaders.readBackscatter(hv, Channel.HV, options));
			if (modelHV != null)
				models.put(Channel.HV, AreaModels.readModel(modelHV));
			if (classifierHV != null)
				classifiers.put(Channel.HV, IcebergClassifiers.readClassifier(classifierHV));
		}
		for (var channel : config.getChannels()) {
			if (!models.containsKey(channel))
				logger.warn("No area model for {} - corrected areas will not be available", channel);
		}
		
		Geometry aoiGeometry = aoi == null ? null : GeoJsonTools.readPolygonal(aoi);
		SimpleImage incidenceAngles = incidence == null ? null : RasterReaders.readSimpleImage(incidence);
		
		if (!classifiers.isEmpty() && incidenceAngles == null)
			logger.warn("Iceberg classification needs --incidence, objects will not be classified as icebergs");
		
		var result = IcebergAreaPipeline.runPipeline(rasters, config, models, classifiers, aoiGeometry, incidenceAngles);
		ResultWriter.write(result, output);
		
		double totalArea = result.getMergedObjects().stream().mapToDouble(o -> o.getAreaCfar()).sum();
		logger.info("{} objects written to {} (total CFAR area {})", 
				result.getMergedObjects().size(), output, GeneralTools.formatNumber(totalArea, 1));
		for (var error : result.getErrors())
			logger.warn("{}: {} - {}", error.channel(), error.kind(), error.message());
		
		if (result.allFailed()) {
			logger.error("All channels failed");
			return 1;
		}
		return 0;
	}
	
	private ChannelSettings createSettings() {
		try {
			return ChannelSettings.builder()
					.window(outer, guard)
					.pfa(pfa)
					.shapeEstimation(shapeEstimation)
					.edgePolicy(edgePolicy)
					.minRelativeVariance(minRelativeVariance)
					.build();
		} catch (InvalidWindowConfigException e) {
			throw new ParameterException(spec.commandLine(), "Invalid window: " + e.getLocalizedMessage(), e, null, null);
		} catch (IllegalArgumentException e) {
			throw new ParameterException(spec.commandLine(), e.getLocalizedMessage(), e, null, null);
		}
	}
	
	private GeoTransform createTransform() {
		if (pixelSize == null) {
			if (originX != 0 || originY != 0)
				logger.warn("Origin is ignored without --pixel-size");
			return GeoTransform.identity();
		}
		if (!(pixelSize > 0))
			throw new ParameterException(spec.commandLine(), "Pixel size must be positive, but got " + pixelSize);
		// North-up raster, so rows go down in map coordinates
		return GeoTransform.create(originX, originY, pixelSize, -pixelSize);
	}

}
