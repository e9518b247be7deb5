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

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Named, versioned and ordered list of feature names.
 * <p>
 * An area model is only valid for feature vectors with exactly the schema it was trained on.
 */
public final class FeatureSchema {
	
	/**
	 * Area from CFAR detection, in squared map units.
	 */
	public static final String AREA_CFAR = "area_cfar";
	
	/**
	 * Square root of the CFAR area.
	 */
	public static final String ROOT_LENGTH_CFAR = "root_length_cfar";
	
	/**
	 * Mean linear backscatter of the object pixels.
	 */
	public static final String MEAN = "mean";
	
	/**
	 * Population standard deviation of the linear backscatter of the object pixels.
	 */
	public static final String STD = "std";
	
	/**
	 * Minimum linear backscatter of the object pixels.
	 */
	public static final String MIN = "min";
	
	/**
	 * Maximum linear backscatter of the object pixels.
	 */
	public static final String MAX = "max";
	
	/**
	 * Mean backscatter, in decibels.
	 */
	public static final String MEAN_DB = "mean_db";
	
	/**
	 * Mean of the local background (clutter) means over the object pixels, in decibels.
	 */
	public static final String CLUTTER_MEAN_DB = "clutter_mean_db";
	
	/**
	 * Difference between the object and clutter means, in decibels.
	 */
	public static final String CONTRAST_MEAN_DB = "contrast_mean_db";
	
	/**
	 * Outline length, in map units.
	 */
	public static final String PERIMETER = "perimeter";
	
	/**
	 * Squared perimeter divided by area.
	 */
	public static final String COMPACTNESS = "compactness";
	
	/**
	 * Perimeter of a circle with the same area, divided by the perimeter.
	 */
	public static final String PERIMETER_INDEX = "perimeter_index";
	
	/**
	 * Maximum distance between two outline vertices, in map units.
	 */
	public static final String MAX_LENGTH = "max_length";
	
	/**
	 * Maximum length divided by the root length, which is large for elongated objects.
	 */
	public static final String LENGTH_ROOT_LENGTH_RATIO = "length_root_length_ratio";
	
	/**
	 * Mean incidence angle over the object pixels, in degrees.
	 */
	public static final String INCIDENCE_ANGLE_MEAN = "incidence_angle_mean";
	
	/**
	 * Backscatter and shape features computed for every object.
	 */
	public static final FeatureSchema BACKSCATTER_V1 = new FeatureSchema("backscatter", 1, 
			AREA_CFAR, ROOT_LENGTH_CFAR, 
			MEAN, STD, MIN, MAX, 
			MEAN_DB, CLUTTER_MEAN_DB, CONTRAST_MEAN_DB, 
			PERIMETER, COMPACTNESS, PERIMETER_INDEX, MAX_LENGTH, LENGTH_ROOT_LENGTH_RATIO, 
			INCIDENCE_ANGLE_MEAN);
	
	private final String name;
	private final int version;
	private final List<String> features;
	
	/**
	 * Create a schema.
	 * @param name
	 * @param version
	 * @param features feature names, which must be unique
	 */
	public FeatureSchema(String name, int version, String... features) {
		this(name, version, Arrays.asList(features));
	}
	
	/**
	 * Create a schema.
	 * @param name
	 * @param version
	 * @param features feature names, which must be unique
	 */
	public FeatureSchema(String name, int version, List<String> features) {
		this.name = Objects.requireNonNull(name, "Schema name must not be null");
		this.version = version;
		this.features = List.copyOf(features);
		if (this.features.stream().distinct().count() != this.features.size())
			throw new IllegalArgumentException("Feature names must be unique: " + features);
	}
	
	public String getName() {
		return name;
	}
	
	public int getVersion() {
		return version;
	}
	
	/**
	 * Get a combined identifier, e.g. {@code backscatter-v1}.
	 * @return
	 */
	public String getId() {
		return name + "-v" + version;
	}
	
	/**
	 * Get the ordered, unmodifiable list of feature names.
	 * @return
	 */
	public List<String> getFeatureNames() {
		return features;
	}
	
	/**
	 * Number of features.
	 * @return
	 */
	public int size() {
		return features.size();
	}
	
	/**
	 * Get the index of a feature.
	 * @param feature
	 * @return the index, or -1 if the feature is not part of the schema
	 */
	public int indexOf(String feature) {
		return features.indexOf(feature);
	}

	@Override
	public int hashCode() {
		return Objects.hash(name, version, features);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (!(obj instanceof FeatureSchema))
			return false;
		var other = (FeatureSchema)obj;
		return name.equals(other.name) && version == other.version && features.equals(other.features);
	}

	@Override
	public String toString() {
		return getId() + " " + features;
	}

}
