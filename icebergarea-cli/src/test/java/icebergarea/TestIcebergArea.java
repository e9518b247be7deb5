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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;

import icebergarea.io.LogManager;
import icebergarea.io.LogManager.LogLevel;
import icebergarea.io.TestRasterReaders;
import icebergarea.lib.analysis.features.FeatureSchema;
import icebergarea.lib.classifiers.IcebergClassifiers;
import icebergarea.lib.classifiers.ReferenceStatisticsClassifier;
import icebergarea.lib.classifiers.ReferenceStatisticsClassifier.ReferenceIceberg;
import icebergarea.lib.regression.AreaModels;
import icebergarea.lib.regression.LinearAreaModel;

@SuppressWarnings("javadoc")
public class TestIcebergArea {
	
	@TempDir
	Path dir;
	
	@AfterEach
	public void resetLogging() {
		LogManager.setRootLogLevel(LogLevel.INFO);
	}
	
	private Path writeScene(String name, float target) throws IOException {
		float[] values = new float[50 * 50];
		Arrays.fill(values, 0.01f);
		for (int y = 22; y < 27; y++) {
			for (int x = 22; x < 27; x++)
				values[y * 50 + x] = target;
		}
		var path = dir.resolve(name);
		TestRasterReaders.writeFloatTiff(path, values, 50, 50);
		return path;
	}
	
	private static JsonObject readJson(Path path) throws IOException {
		return JsonParser.parseString(Files.readString(path, StandardCharsets.UTF_8)).getAsJsonObject();
	}
	
	@Test
	public void test_detect() throws Exception {
		var hh = writeScene("hh.tif", 1.0f);
		var hv = writeScene("hv.tif", 0.5f);
		var model = dir.resolve("model.json");
		AreaModels.writeModel(LinearAreaModel.create(FeatureSchema.BACKSCATTER_V1, LinearAreaModel.Target.AREA, 
				100.0, Map.of(FeatureSchema.AREA_CFAR, 0.5)), model);
		var output = dir.resolve("results").resolve("icebergs.json");
		
		int exitCode = IcebergArea.execute("detect", 
				"--hh", hh.toString(), "--hv", hv.toString(),
				"--pixel-size", "40", "--origin-x", "500000", "--origin-y", "7000000",
				"--model-hh", model.toString(), "--model-hv", model.toString(),
				"--min-pixels", "2", "--edge-policy", "clip", "--shape", "local_moments",
				"--output", output.toString(), "--log", "warn");
		assertEquals(0, exitCode);
		assertTrue(Files.exists(output));
		
		var json = readJson(output);
		var hhObjects = json.getAsJsonObject("channels").getAsJsonObject("HH").getAsJsonArray("objects");
		assertEquals(1, hhObjects.size());
		var object = hhObjects.get(0).getAsJsonObject();
		assertEquals(25 * 1600.0, object.get("area_cfar").getAsDouble(), 1e-6);
		assertEquals(100.0 + 0.5 * 25 * 1600.0, object.get("area_backscatter_rl").getAsDouble(), 1e-6);
		// Equal areas in both channels, so the HH object is kept
		var merged = json.getAsJsonArray("merged");
		assertEquals(1, merged.size());
		assertEquals("HH", merged.get(0).getAsJsonObject().get("channel").getAsString());
	}
	
	@Test
	public void test_classifier() throws Exception {
		var hh = writeScene("hh.tif", 1.0f);
		float[] angles = new float[50 * 50];
		Arrays.fill(angles, 35f);
		var incidence = dir.resolve("incidence.tif");
		TestRasterReaders.writeFloatTiff(incidence, angles, 50, 50);
		
		// A 5x5 square has a perimeter index of sqrt(pi)/2, and the target is 0 dB
		double perimeterIndex = Math.sqrt(Math.PI) / 2;
		var classifier = dir.resolve("classifier.json");
		IcebergClassifiers.writeClassifier(ReferenceStatisticsClassifier.create(List.of(
				new ReferenceIceberg(-1, 34, perimeterIndex - 0.1),
				new ReferenceIceberg(1, 36, perimeterIndex + 0.1))), classifier);
		var output = dir.resolve("classified.json");
		
		int exitCode = IcebergArea.execute("detect", "--hh", hh.toString(), "--incidence", incidence.toString(), 
				"--classifier-hh", classifier.toString(), "--output", output.toString(), "--log", "off");
		assertEquals(0, exitCode);
		var object = readJson(output).getAsJsonArray("merged").get(0).getAsJsonObject();
		var classification = object.getAsJsonObject("classification");
		assertEquals(0.0, classification.get("backscatter_score").getAsDouble(), 1e-4);
		assertEquals(0.0, classification.get("perimeter_index_score").getAsDouble(), 1e-4);
		assertTrue(classification.get("is_iceberg").getAsBoolean());
		
		// Unreadable classifier
		Files.writeString(classifier, "{\"classifier_type\": \"unknown\"}");
		assertEquals(1, IcebergArea.execute("detect", "--hh", hh.toString(), 
				"--classifier-hh", classifier.toString(), "--output", output.toString(), "--log", "off"));
	}
	
	@Test
	public void test_decibelsSingleChannel() throws Exception {
		// 0 dB target on a -20 dB background
		var hv = dir.resolve("hv_db.tif");
		float[] values = new float[50 * 50];
		Arrays.fill(values, -20f);
		for (int y = 22; y < 27; y++) {
			for (int x = 22; x < 27; x++)
				values[y * 50 + x] = 0f;
		}
		TestRasterReaders.writeFloatTiff(hv, values, 50, 50);
		var output = dir.resolve("hv.json");
		
		int exitCode = IcebergArea.execute("detect", "--hv", hv.toString(), "--decibels", "-o", output.toString(), "-l", "ERROR");
		assertEquals(0, exitCode);
		var json = readJson(output);
		assertFalse(json.getAsJsonObject("channels").has("HH"));
		var hvResult = json.getAsJsonObject("channels").getAsJsonObject("HV");
		assertEquals("MISSING_MODEL", hvResult.getAsJsonObject("error").get("kind").getAsString());
		assertEquals(1, hvResult.getAsJsonArray("objects").size());
		assertEquals(1, json.getAsJsonArray("merged").size());
	}
	
	@Test
	public void test_allChannelsFailed() throws Exception {
		float[] values = new float[40 * 40];
		Arrays.fill(values, -9999f);
		var hh = dir.resolve("empty.tif");
		TestRasterReaders.writeFloatTiff(hh, values, 40, 40);
		var output = dir.resolve("empty.json");
		
		int exitCode = IcebergArea.execute("detect", "--hh", hh.toString(), "--nodata=-9999", "--output", output.toString(), "--log", "off");
		assertEquals(1, exitCode);
		// Results are still written, including the error
		var error = readJson(output).getAsJsonObject("channels").getAsJsonObject("HH").getAsJsonObject("error");
		assertEquals("NO_VALID_DATA", error.get("kind").getAsString());
	}
	
	@Test
	public void test_invalidArguments() throws Exception {
		var hh = writeScene("hh.tif", 1.0f);
		var output = dir.resolve("out.json").toString();
		// No rasters
		assertEquals(2, IcebergArea.execute("detect", "--output", output, "--log", "off"));
		// Even window size
		assertEquals(2, IcebergArea.execute("detect", "--hh", hh.toString(), "--outer", "28", "--output", output, "--log", "off"));
		// Guard larger than outer window
		assertEquals(2, IcebergArea.execute("detect", "--hh", hh.toString(), "--outer", "21", "--guard", "29", "--output", output, "--log", "off"));
		// Missing output
		assertEquals(2, IcebergArea.execute("detect", "--hh", hh.toString()));
		// Missing raster file
		assertEquals(1, IcebergArea.execute("detect", "--hh", dir.resolve("missing.tif").toString(), "--output", output, "--log", "off"));
		assertFalse(Files.exists(Path.of(output)));
	}
	
	@Test
	public void test_help() {
		assertEquals(0, IcebergArea.execute("--version"));
		assertEquals(0, IcebergArea.execute("detect", "--help"));
		assertEquals(0, IcebergArea.execute());
	}

}
