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

package icebergarea.lib.regression;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.google.gson.JsonParseException;

import icebergarea.lib.analysis.features.FeatureSchema;
import icebergarea.lib.analysis.features.FeatureVector;

@SuppressWarnings("javadoc")
public class TestLinearAreaModel {
	
	private static LinearAreaModel createRootLengthModel() {
		var coefficients = new LinkedHashMap<String, Double>();
		coefficients.put(FeatureSchema.ROOT_LENGTH_CFAR, 0.8);
		coefficients.put(FeatureSchema.CONTRAST_MEAN_DB, -0.5);
		return LinearAreaModel.create(FeatureSchema.BACKSCATTER_V1, LinearAreaModel.Target.ROOT_LENGTH, 2.0, coefficients);
	}
	
	private static FeatureVector createFeatures(double rootLength, double contrast) {
		double[] values = new double[FeatureSchema.BACKSCATTER_V1.size()];
		values[FeatureSchema.BACKSCATTER_V1.indexOf(FeatureSchema.ROOT_LENGTH_CFAR)] = rootLength;
		values[FeatureSchema.BACKSCATTER_V1.indexOf(FeatureSchema.CONTRAST_MEAN_DB)] = contrast;
		values[FeatureSchema.BACKSCATTER_V1.indexOf(FeatureSchema.INCIDENCE_ANGLE_MEAN)] = Double.NaN;
		return new FeatureVector(FeatureSchema.BACKSCATTER_V1, values);
	}
	
	@Test
	public void test_predict() {
		var model = createRootLengthModel();
		// Features without a coefficient are ignored, even if NaN
		double rootLength = 2.0 + 0.8 * 100 - 0.5 * 10;
		assertEquals(rootLength * rootLength, model.predict(createFeatures(100, 10)), 1e-9);
		
		var areaModel = LinearAreaModel.create(FeatureSchema.BACKSCATTER_V1, LinearAreaModel.Target.AREA, -50.0, 
				Map.of(FeatureSchema.ROOT_LENGTH_CFAR, 3.0));
		assertEquals(250.0, areaModel.predict(createFeatures(100, 10)), 1e-9);
		assertEquals(-50.0, areaModel.predict(createFeatures(0, 10)), 1e-9);
	}
	
	@Test
	public void test_negativeRootLength() throws Exception {
		var model = createRootLengthModel();
		// Root length 2 - 0.5 * 100 = -48, squared like any other root length
		assertEquals(48.0 * 48.0, model.predict(createFeatures(0, 100)), 1e-9);
		assertEquals(48.0 * 48.0, AreaCorrector.predictArea(createFeatures(0, 100), model), 1e-9);
	}
	
	@Test
	public void test_missingFeatureValue() throws Exception {
		var model = LinearAreaModel.create(FeatureSchema.BACKSCATTER_V1, LinearAreaModel.Target.ROOT_LENGTH, 1.0, 
				Map.of(FeatureSchema.INCIDENCE_ANGLE_MEAN, 0.1));
		// No incidence angles, so no prediction; this must not be turned into an area of 0
		assertTrue(Double.isNaN(model.predict(createFeatures(10, 1))));
		assertTrue(Double.isNaN(AreaCorrector.predictArea(createFeatures(10, 1), model)));
		assertTrue(Double.isNaN(AreaCorrector.predictArea(createFeatures(10, 1), model, ClampPolicy.ONE_PIXEL, 1600)));
	}
	
	@Test
	public void test_unknownCoefficient() {
		assertThrows(IllegalArgumentException.class, () -> LinearAreaModel.create(FeatureSchema.BACKSCATTER_V1, 
				LinearAreaModel.Target.AREA, 0, Map.of("unknown", 1.0)));
		assertThrows(IllegalArgumentException.class, () -> LinearAreaModel.create(FeatureSchema.BACKSCATTER_V1, 
				LinearAreaModel.Target.AREA, 0, Map.of(FeatureSchema.MEAN, Double.NaN)));
	}
	
	@Test
	public void test_json(@TempDir Path dir) throws IOException {
		var model = createRootLengthModel();
		var json = AreaModels.toJson(model);
		assertTrue(json.contains("\"model_type\": \"linear\""));
		
		var path = dir.resolve("model-hh.json");
		AreaModels.writeModel(model, path);
		var read = AreaModels.readModel(path);
		assertTrue(read instanceof LinearAreaModel);
		var linear = (LinearAreaModel)read;
		assertEquals(FeatureSchema.BACKSCATTER_V1, linear.getSchema());
		assertEquals(LinearAreaModel.Target.ROOT_LENGTH, linear.getTarget());
		assertEquals(2.0, linear.getIntercept());
		assertEquals(model.getCoefficients(), linear.getCoefficients());
		var features = createFeatures(42, 3);
		assertEquals(model.predict(features), read.predict(features), 1e-12);
	}
	
	@Test
	public void test_jsonAlias() {
		String json = "{\"model_type\": \"LinearAreaModel\", "
				+ "\"schema\": {\"name\": \"backscatter\", \"version\": 1, \"features\": " + featureNamesJson() + "}, "
				+ "\"target\": \"AREA\", \"intercept\": 10.0, \"coefficients\": {\"area_cfar\": 0.5}}";
		var model = AreaModels.fromJson(json);
		assertEquals(FeatureSchema.BACKSCATTER_V1, model.getSchema());
		assertEquals(60.0, model.predict(TestAreaCorrector.createFeatures(100)), 1e-12);
	}
	
	@Test
	public void test_invalidJson(@TempDir Path dir) throws IOException {
		assertThrows(JsonParseException.class, () -> AreaModels.fromJson("{\"model_type\": \"forest\"}"));
		assertThrows(JsonParseException.class, () -> AreaModels.fromJson("{\"intercept\": 1.0}"));
		String badCoefficient = "{\"model_type\": \"linear\", "
				+ "\"schema\": {\"name\": \"backscatter\", \"version\": 1, \"features\": " + featureNamesJson() + "}, "
				+ "\"target\": \"AREA\", \"intercept\": 10.0, \"coefficients\": {\"volume\": 0.5}}";
		assertThrows(IllegalArgumentException.class, () -> AreaModels.fromJson(badCoefficient));
		
		var path = dir.resolve("bad.json");
		Files.writeString(path, badCoefficient);
		assertThrows(IOException.class, () -> AreaModels.readModel(path));
		assertThrows(IOException.class, () -> AreaModels.readModel(dir.resolve("missing.json")));
	}
	
	private static String featureNamesJson() {
		var sb = new StringBuilder("[");
		for (var name : FeatureSchema.BACKSCATTER_V1.getFeatureNames()) {
			if (sb.length() > 1)
				sb.append(", ");
			sb.append('"').append(name).append('"');
		}
		return sb.append("]").toString();
	}

}
