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

package icebergarea.lib.objects;

import java.util.Objects;

import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.geom.Geometry;

import icebergarea.lib.images.Channel;

/**
 * A connected group of detected pixels, representing a candidate iceberg.
 */
public class Blob {
	
	private final int id;
	private final Channel channel;
	private final int[] pixelIndices;
	private final Geometry outline;
	private final double pixelArea;
	private final Envelope bounds;
	private final boolean truncated;
	
	Blob(int id, Channel channel, int[] pixelIndices, Geometry outline, double pixelArea, Envelope bounds, boolean truncated) {
		if (pixelIndices.length == 0)
			throw new IllegalArgumentException("Blob must contain at least one pixel");
		this.id = id;
		this.channel = Objects.requireNonNull(channel);
		this.pixelIndices = pixelIndices;
		this.outline = Objects.requireNonNull(outline);
		this.pixelArea = pixelArea;
		this.bounds = bounds;
		this.truncated = truncated;
	}
	
	/**
	 * Identifier, starting at 1 and assigned in raster scan order of the first pixel of each blob.
	 * @return
	 */
	public int getId() {
		return id;
	}
	
	public Channel getChannel() {
		return channel;
	}
	
	/**
	 * Get the row-wise indices of the pixels in this blob, in ascending order.
	 * @return a copy of the indices
	 */
	public int[] getPixelIndices() {
		return pixelIndices.clone();
	}
	
	/**
	 * Number of pixels in the blob; always at least 1.
	 * @return
	 */
	public int getPixelCount() {
		return pixelIndices.length;
	}
	
	/**
	 * Outline of the blob in map coordinates. This may be a MultiPolygon if pixels are only connected diagonally.
	 * @return
	 */
	public Geometry getOutline() {
		return outline;
	}
	
	/**
	 * Area from CFAR detection, i.e. the pixel count multiplied by the pixel area.
	 * @return
	 */
	public double getAreaCfar() {
		return pixelIndices.length * pixelArea;
	}
	
	/**
	 * Area of a single pixel.
	 * @return
	 */
	public double getPixelArea() {
		return pixelArea;
	}
	
	/**
	 * Bounding box in pixel coordinates.
	 * @return
	 */
	public Envelope getBounds() {
		return new Envelope(bounds);
	}
	
	/**
	 * Returns true if the blob touches the raster border, and so may extend beyond the image.
	 * @return
	 */
	public boolean isTruncated() {
		return truncated;
	}
	
	@Override
	public String toString() {
		return "Blob [id=" + id + ", channel=" + channel + ", pixels=" + pixelIndices.length + 
				", area=" + getAreaCfar() + (truncated ? ", truncated" : "") + "]";
	}

}
