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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.StringWriter;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import com.google.gson.JsonParser;

import icebergarea.lib.analysis.features.FeatureSchema;
import icebergarea.lib.analysis.features.FeatureVector;
import icebergarea.lib.classifiers.ReferenceStatisticsClassifier;
import icebergarea.lib.classifiers.ReferenceStatisticsClassifier.ReferenceIceberg;
import icebergarea.lib.images.BackscatterRaster;
import icebergarea.lib.images.Channel;
import icebergarea.lib.pipeline.IcebergAreaPipeline;
import icebergarea.lib.pipeline.PipelineConfig;
import icebergarea.lib.pipeline.PipelineResult;
import icebergarea.lib.regression.AreaModel;

@SuppressWarnings("javadoc")
public class TestResultWriter {
	
	private static PipelineResult runSquareScene(Map<Channel, AreaModel> models) throws InterruptedException {
		return IcebergAreaPipeline.runPipeline(squareScene(), PipelineConfig.getDefault(), models, null);
	}
	
	private static Map<Channel, BackscatterRaster> squareScene() {
		float[] values = new float[50 * 50];
		for (int i = 0; i < values.length; i++) {
			int x = i % 50;
			int y = i / 50;
			values[i] = x >= 22 && x < 27 && y >= 22 && y < 27 ? 1.0f : 0.01f;
		}
		var rasters = new EnumMap<Channel, BackscatterRaster>(Channel.class);
		rasters.put(Channel.HH, BackscatterRaster.create(Channel.HH, values, 50, 50));
		rasters.put(Channel.HV, BackscatterRaster.create(Channel.HV, new float[50 * 50], 50, 50));
		return rasters;
	}
	
	@Test
	public void test_json() throws Exception {
		var result = runSquareScene(Map.of());
		var json = ResultWriter.toJson(result);
		
		var channels = json.getAsJsonObject("channels");
		assertEquals(2, channels.size());
		var hh = channels.getAsJsonObject("HH");
		assertEquals("MISSING_MODEL", hh.getAsJsonObject("error").get("kind").getAsString());
		assertEquals(false, hh.getAsJsonObject("error").get("fatal").getAsBoolean());
		
		var objects = hh.getAsJsonArray("objects");
		assertEquals(1, objects.size());
		var object = objects.get(0).getAsJsonObject();
		assertEquals(1, object.get("id").getAsInt());
		assertEquals("HH", object.get("channel").getAsString());
		assertEquals(25, object.get("pixel_count").getAsInt());
		assertEquals(25.0, object.get("area_cfar").getAsDouble(), 1e-12);
		assertTrue(object.get("area_backscatter_rl").isJsonNull());
		assertEquals(false, object.get("truncated").getAsBoolean());
		assertEquals(1.0, object.getAsJsonObject("backscatter_stats").get("mean").getAsDouble(), 1e-9);
		assertEquals("backscatter-v1", object.getAsJsonObject("features").get("schema").getAsString());
		assertTrue(object.getAsJsonObject("features").get("incidence_angle_mean").isJsonNull());
		assertEquals(Math.sqrt(2), object.getAsJsonObject("features").get("length_root_length_ratio").getAsDouble(), 1e-9);
		assertTrue(object.get("classification").isJsonNull());
		
		var outline = object.getAsJsonObject("outline");
		assertEquals("Polygon", outline.get("type").getAsString());
		assertTrue(outline.getAsJsonArray("coordinates").get(0).getAsJsonArray().size() >= 5);
		
		// A raster of zeros is valid but has no detections
		var hv = channels.getAsJsonObject("HV");
		assertEquals(0, hv.getAsJsonArray("objects").size());
		
		assertEquals(1, json.getAsJsonArray("merged").size());
	}
	
	@Test
	public void test_write() throws Exception {
		AreaModel model = new AreaModel() {
			@Override
			public FeatureSchema getSchema() {
				return FeatureSchema.BACKSCATTER_V1;
			}
			@Override
			public double predict(FeatureVector features) {
				return 30.0;
			}
		};
		var result = runSquareScene(Map.of(Channel.HH, model, Channel.HV, model));
		var writer = new StringWriter();
		ResultWriter.write(result, writer);
		var json = JsonParser.parseString(writer.toString()).getAsJsonObject();
		assertTrue(json.getAsJsonObject("channels").getAsJsonObject("HH").get("error").isJsonNull());
		var merged = json.getAsJsonArray("merged");
		assertEquals(30.0, merged.get(0).getAsJsonObject().get("area_backscatter_rl").getAsDouble(), 1e-12);
	}
	
	@Test
	public void test_classification() throws Exception {
		var first = runSquareScene(Map.of()).getChannelResult(Channel.HH).getObjects().get(0);
		double perimeterIndex = first.getFeatures().get(FeatureSchema.PERIMETER_INDEX);
		var classifier = ReferenceStatisticsClassifier.create(List.of(
				new ReferenceIceberg(-5, 30, perimeterIndex - 0.1),
				new ReferenceIceberg(-3, 30, perimeterIndex + 0.1)));
		
		var result = IcebergAreaPipeline.runPipeline(squareScene(), PipelineConfig.getDefault(), null, Map.of(Channel.HH, classifier), null, null);
		var object = ResultWriter.toJson(result)
				.getAsJsonObject("channels").getAsJsonObject("HH")
				.getAsJsonArray("objects").get(0).getAsJsonObject();
		var classification = object.getAsJsonObject("classification");
		// No incidence angles, so no backscatter score
		assertTrue(classification.get("backscatter_score").isJsonNull());
		assertEquals(0.0, classification.get("perimeter_index_score").getAsDouble(), 1e-9);
		assertEquals(false, classification.get("is_iceberg").getAsBoolean());
	}

}
