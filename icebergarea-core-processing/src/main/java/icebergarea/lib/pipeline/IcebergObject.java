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

import java.util.Objects;
import java.util.Optional;

import org.locationtech.jts.geom.Geometry;

import icebergarea.lib.analysis.features.FeatureVector;
import icebergarea.lib.classifiers.IcebergClassification;
import icebergarea.lib.images.Channel;
import icebergarea.lib.objects.Blob;

/**
 * A detected object with its raw and corrected areas.
 * <p>
 * The corrected area is NaN when no usable area model was available for the channel, 
 * and the classification is missing when no classifier was available.
 */
public class IcebergObject {
	
	private final int id;
	private final Channel channel;
	private final Geometry outline;
	private final int pixelCount;
	private final double areaCfar;
	private final BackscatterStats backscatterStats;
	private final FeatureVector features;
	private final boolean truncated;
	private final double areaBackscatterRL;
	private final IcebergClassification classification;
	
	IcebergObject(Blob blob, FeatureVector features, double areaBackscatterRL, IcebergClassification classification) {
		this.id = blob.getId();
		this.channel = blob.getChannel();
		this.outline = blob.getOutline();
		this.pixelCount = blob.getPixelCount();
		this.areaCfar = blob.getAreaCfar();
		this.features = Objects.requireNonNull(features);
		this.backscatterStats = BackscatterStats.fromFeatures(features);
		this.truncated = blob.isTruncated();
		this.areaBackscatterRL = areaBackscatterRL;
		this.classification = classification;
	}
	
	/**
	 * Get the id of the object, unique within its channel.
	 * @return
	 */
	public int getId() {
		return id;
	}
	
	/**
	 * Get the channel in which the object was detected.
	 * @return
	 */
	public Channel getChannel() {
		return channel;
	}
	
	/**
	 * Get the outline, in map coordinates.
	 * @return
	 */
	public Geometry getOutline() {
		return outline;
	}
	
	public int getPixelCount() {
		return pixelCount;
	}
	
	/**
	 * Get the area of the detected pixels.
	 * @return
	 */
	public double getAreaCfar() {
		return areaCfar;
	}
	
	public BackscatterStats getBackscatterStats() {
		return backscatterStats;
	}
	
	/**
	 * Get all features computed for the object.
	 * @return
	 */
	public FeatureVector getFeatures() {
		return features;
	}
	
	/**
	 * Query whether the object touches the raster border, so that it may be incomplete.
	 * @return
	 */
	public boolean isTruncated() {
		return truncated;
	}
	
	/**
	 * Get the area predicted by the area model.
	 * @return the corrected area, or NaN if it is not available
	 */
	public double getAreaBackscatterRL() {
		return areaBackscatterRL;
	}
	
	/**
	 * Query whether a corrected area is available.
	 * @return
	 */
	public boolean hasCorrectedArea() {
		return !Double.isNaN(areaBackscatterRL);
	}

	/**
	 * Get the result of iceberg classification.
	 * @return the classification, or empty if the channel had no classifier
	 */
	public Optional<IcebergClassification> getClassification() {
		return Optional.ofNullable(classification);
	}

	@Override
	public String toString() {
		return "IcebergObject [" + channel + " " + id + ", pixels=" + pixelCount + ", areaCfar=" + areaCfar 
				+ ", areaBackscatterRL=" + areaBackscatterRL + (truncated ? ", truncated" : "") + "]";
	}

}
