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
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.Map;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import icebergarea.lib.analysis.features.FeatureSchema;
import icebergarea.lib.analysis.features.FeatureVector;
import icebergarea.lib.common.ErrorKind;

@SuppressWarnings("javadoc")
public class TestAreaCorrector {
	
	static FeatureVector createFeatures(double areaCfar) {
		double[] values = new double[FeatureSchema.BACKSCATTER_V1.size()];
		values[FeatureSchema.BACKSCATTER_V1.indexOf(FeatureSchema.AREA_CFAR)] = areaCfar;
		values[FeatureSchema.BACKSCATTER_V1.indexOf(FeatureSchema.ROOT_LENGTH_CFAR)] = Math.sqrt(areaCfar);
		return new FeatureVector(FeatureSchema.BACKSCATTER_V1, values);
	}
	
	static AreaModel constantModel(double value) {
		return new AreaModel() {
			@Override
			public FeatureSchema getSchema() {
				return FeatureSchema.BACKSCATTER_V1;
			}
			@Override
			public double predict(FeatureVector features) {
				return value;
			}
		};
	}
	
	@Test
	public void test_prediction() throws Exception {
		var features = createFeatures(3200);
		assertEquals(1234.5, AreaCorrector.predictArea(features, constantModel(1234.5)));
		assertEquals(0.0, AreaCorrector.predictArea(features, constantModel(0)));
	}
	
	@ParameterizedTest
	@CsvSource({
		"-5.0, ZERO, 0.0",
		"NaN, ZERO, NaN",
		"Infinity, ZERO, NaN",
		"-Infinity, ZERO, NaN",
		"-5.0, ONE_PIXEL, 1600.0",
		"NaN, ONE_PIXEL, NaN",
		"Infinity, ONE_PIXEL, NaN",
		"100.0, ONE_PIXEL, 100.0",
		"100.0, ZERO, 100.0"
	})
	public void test_clamping(double prediction, ClampPolicy policy, double expected) throws Exception {
		assertEquals(expected, policy.clamp(prediction, 1600.0));
		assertEquals(expected, AreaCorrector.predictArea(createFeatures(3200), constantModel(prediction), policy, 1600.0));
	}
	
	@Test
	public void test_defaultClampIsZero() throws Exception {
		assertEquals(0.0, AreaCorrector.predictArea(createFeatures(3200), constantModel(-1)));
	}
	
	@Test
	public void test_schemaMismatch() {
		var otherSchema = new FeatureSchema("backscatter", 2, FeatureSchema.BACKSCATTER_V1.getFeatureNames());
		var model = LinearAreaModel.create(otherSchema, LinearAreaModel.Target.AREA, 1.0, Map.of());
		var e = assertThrows(ModelMismatchException.class, () -> AreaCorrector.predictArea(createFeatures(3200), model));
		assertEquals(ErrorKind.MODEL_MISMATCH, e.getKind());
		assertSame(otherSchema, e.getExpected());
		assertEquals(FeatureSchema.BACKSCATTER_V1, e.getActual());
		
		// Same name and version, different features
		var reordered = new FeatureSchema("backscatter", 1, FeatureSchema.AREA_CFAR, FeatureSchema.MEAN);
		assertThrows(ModelMismatchException.class, 
				() -> AreaCorrector.predictArea(createFeatures(3200), LinearAreaModel.create(reordered, LinearAreaModel.Target.AREA, 1.0, Map.of())));
	}

}
