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

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Feature values for one object, ordered according to a {@link FeatureSchema}.
 */
public final class FeatureVector {
	
	private final FeatureSchema schema;
	private final double[] values;
	
	/**
	 * Create a feature vector.
	 * @param schema
	 * @param values one value per schema feature; these are copied
	 */
	public FeatureVector(FeatureSchema schema, double... values) {
		this.schema = Objects.requireNonNull(schema);
		if (values.length != schema.size())
			throw new IllegalArgumentException("Schema " + schema.getId() + " requires " + schema.size() + " values, but got " + values.length);
		this.values = values.clone();
	}
	
	public FeatureSchema getSchema() {
		return schema;
	}
	
	/**
	 * Get a feature value by name.
	 * @param feature
	 * @return
	 * @throws IllegalArgumentException if the feature is not part of the schema
	 */
	public double get(String feature) {
		int ind = schema.indexOf(feature);
		if (ind < 0)
			throw new IllegalArgumentException("Feature " + feature + " is not part of schema " + schema.getId());
		return values[ind];
	}
	
	/**
	 * Get a feature value by index.
	 * @param index
	 * @return
	 */
	public double get(int index) {
		return values[index];
	}
	
	/**
	 * Get a copy of all values, in schema order.
	 * @return
	 */
	public double[] toArray() {
		return values.clone();
	}
	
	/**
	 * Get an ordered map of feature names and values.
	 * @return
	 */
	public Map<String, Double> toMap() {
		var map = new LinkedHashMap<String, Double>();
		var names = schema.getFeatureNames();
		for (int i = 0; i < values.length; i++)
			map.put(names.get(i), values[i]);
		return map;
	}
	
	@Override
	public String toString() {
		return "FeatureVector " + toMap();
	}

}
