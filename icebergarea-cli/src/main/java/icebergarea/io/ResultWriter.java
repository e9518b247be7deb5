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

package icebergarea.io;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.locationtech.jts.geom.Geometry;

import com.google.gson.Gson;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonNull;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import com.google.gson.JsonPrimitive;

import icebergarea.lib.io.GsonTools;
import icebergarea.lib.pipeline.ChannelResult;
import icebergarea.lib.pipeline.IcebergObject;
import icebergarea.lib.pipeline.PipelineResult;

/**
 * Write pipeline results as JSON.
 * <p>
 * Outlines are written as GeoJSON geometries in map coordinates. 
 * Values that are not available (NaN) are written as {@code null}.
 */
public class ResultWriter {
	
	private ResultWriter() {
		throw new AssertionError();
	}
	
	/**
	 * Write results to a file.
	 * @param result
	 * @param path
	 * @throws IOException
	 */
	public static void write(PipelineResult result, Path path) throws IOException {
		var parent = path.toAbsolutePath().getParent();
		if (parent != null)
			Files.createDirectories(parent);
		try (var writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
			write(result, writer);
		}
	}
	
	/**
	 * Write results to a writer.
	 * @param result
	 * @param writer
	 * @throws IOException
	 */
	public static void write(PipelineResult result, Writer writer) throws IOException {
		var gson = GsonTools.getInstance(true);
		gson.toJson(toJson(result, gson), writer);
		writer.flush();
	}
	
	/**
	 * Convert results to a JSON tree.
	 * @param result
	 * @return
	 */
	public static JsonObject toJson(PipelineResult result) {
		return toJson(result, GsonTools.getInstance());
	}
	
	private static JsonObject toJson(PipelineResult result, Gson gson) {
		var json = new JsonObject();
		var channels = new JsonObject();
		for (var entry : result.getChannelResults().entrySet()) {
			channels.add(entry.getKey().name(), toJson(entry.getValue(), gson));
		}
		json.add("channels", channels);
		json.add("merged", toJson(result.getMergedObjects(), gson));
		return json;
	}
	
	private static JsonObject toJson(ChannelResult result, Gson gson) {
		var json = new JsonObject();
		json.addProperty("channel", result.getChannel().name());
		var error = result.getError().orElse(null);
		if (error == null)
			json.add("error", JsonNull.INSTANCE);
		else {
			var errorJson = new JsonObject();
			errorJson.addProperty("kind", error.kind().name());
			errorJson.addProperty("message", error.message());
			errorJson.addProperty("fatal", error.isFatal());
			json.add("error", errorJson);
		}
		json.add("objects", toJson(result.getObjects(), gson));
		return json;
	}
	
	private static JsonArray toJson(List<IcebergObject> objects, Gson gson) {
		var array = new JsonArray();
		for (var object : objects)
			array.add(toJson(object, gson));
		return array;
	}
	
	private static JsonObject toJson(IcebergObject object, Gson gson) {
		var json = new JsonObject();
		json.addProperty("id", object.getId());
		json.addProperty("channel", object.getChannel().name());
		json.addProperty("pixel_count", object.getPixelCount());
		json.add("area_cfar", number(object.getAreaCfar()));
		json.add("area_backscatter_rl", number(object.getAreaBackscatterRL()));
		json.addProperty("truncated", object.isTruncated());
		
		var stats = object.getBackscatterStats();
		var statsJson = new JsonObject();
		statsJson.add("mean", number(stats.mean()));
		statsJson.add("std", number(stats.std()));
		statsJson.add("min", number(stats.min()));
		statsJson.add("max", number(stats.max()));
		statsJson.add("clutter_mean_db", number(stats.clutterMeanDb()));
		statsJson.add("contrast_mean_db", number(stats.contrastMeanDb()));
		json.add("backscatter_stats", statsJson);
		
		var features = new JsonObject();
		features.addProperty("schema", object.getFeatures().getSchema().getId());
		for (var entry : object.getFeatures().toMap().entrySet())
			features.add(entry.getKey(), number(entry.getValue()));
		json.add("features", features);
		
		var classification = object.getClassification().orElse(null);
		if (classification == null)
			json.add("classification", JsonNull.INSTANCE);
		else {
			var classificationJson = new JsonObject();
			classificationJson.add("backscatter_score", number(classification.backscatterScore()));
			classificationJson.add("perimeter_index_score", number(classification.perimeterIndexScore()));
			classificationJson.addProperty("is_iceberg", classification.iceberg());
			json.add("classification", classificationJson);
		}
		
		// Geometry coordinates are written as raw values, which a tree writer does not support
		json.add("outline", JsonParser.parseString(gson.toJson(object.getOutline(), Geometry.class)));
		return json;
	}
	
	private static JsonElement number(double value) {
		if (Double.isFinite(value))
			return new JsonPrimitive(value);
		return JsonNull.INSTANCE;
	}

}
