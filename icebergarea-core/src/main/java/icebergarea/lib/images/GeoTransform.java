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

package icebergarea.lib.images;

import java.util.Arrays;

import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.util.AffineTransformation;

/**
 * Affine transform from pixel coordinates to map coordinates.
 * <p>
 * Coefficients follow the GDAL ordering {@code (originX, pixelWidth, rowRotation, originY, columnRotation, pixelHeight)}, 
 * so that the top-left corner of pixel {@code (col, row)} maps to
 * <pre>
 *   x = originX + col * pixelWidth + row * rowRotation
 *   y = originY + col * columnRotation + row * pixelHeight
 * </pre>
 * For north-up images {@code pixelHeight} is usually negative.
 */
public final class GeoTransform {
	
	private static final GeoTransform IDENTITY = new GeoTransform(0, 1, 0, 0, 0, 1);
	
	private final double originX;
	private final double pixelWidth;
	private final double rowRotation;
	private final double originY;
	private final double columnRotation;
	private final double pixelHeight;
	
	private GeoTransform(double originX, double pixelWidth, double rowRotation, double originY, double columnRotation, double pixelHeight) {
		this.originX = originX;
		this.pixelWidth = pixelWidth;
		this.rowRotation = rowRotation;
		this.originY = originY;
		this.columnRotation = columnRotation;
		this.pixelHeight = pixelHeight;
		if (getPixelArea() == 0 || !Double.isFinite(getPixelArea()))
			throw new IllegalArgumentException("GeoTransform is degenerate: " + this);
	}
	
	/**
	 * Get the identity transform, where map coordinates are pixel coordinates and each pixel has unit area.
	 * @return
	 */
	public static GeoTransform identity() {
		return IDENTITY;
	}
	
	/**
	 * Create a north-up transform without rotation.
	 * @param originX x coordinate of the top-left corner of the image
	 * @param originY y coordinate of the top-left corner of the image
	 * @param pixelWidth pixel width in map units
	 * @param pixelHeight pixel height in map units (usually negative)
	 * @return
	 */
	public static GeoTransform create(double originX, double originY, double pixelWidth, double pixelHeight) {
		return new GeoTransform(originX, pixelWidth, 0, originY, 0, pixelHeight);
	}
	
	/**
	 * Create a transform from six coefficients using GDAL ordering.
	 * @param coefficients
	 * @return
	 */
	public static GeoTransform fromGdal(double... coefficients) {
		if (coefficients == null || coefficients.length != 6)
			throw new IllegalArgumentException("Six GeoTransform coefficients are required, but got " + Arrays.toString(coefficients));
		return new GeoTransform(coefficients[0], coefficients[1], coefficients[2], coefficients[3], coefficients[4], coefficients[5]);
	}
	
	/**
	 * Get the coefficients using GDAL ordering.
	 * @return a new array of length 6
	 */
	public double[] toGdal() {
		return new double[] {originX, pixelWidth, rowRotation, originY, columnRotation, pixelHeight};
	}
	
	/**
	 * Area covered by a single pixel, in squared map units.
	 * @return
	 */
	public double getPixelArea() {
		return Math.abs(pixelWidth * pixelHeight - rowRotation * columnRotation);
	}
	
	/**
	 * Map x coordinate for a (possibly fractional) pixel location.
	 * @param col
	 * @param row
	 * @return
	 */
	public double toMapX(double col, double row) {
		return originX + col * pixelWidth + row * rowRotation;
	}
	
	/**
	 * Map y coordinate for a (possibly fractional) pixel location.
	 * @param col
	 * @param row
	 * @return
	 */
	public double toMapY(double col, double row) {
		return originY + col * columnRotation + row * pixelHeight;
	}
	
	/**
	 * Map coordinate for a (possibly fractional) pixel location.
	 * @param col
	 * @param row
	 * @return
	 */
	public Coordinate toMap(double col, double row) {
		return new Coordinate(toMapX(col, row), toMapY(col, row));
	}
	
	/**
	 * Convert to a JTS transformation that can be applied to geometries in pixel space.
	 * @return
	 */
	public AffineTransformation toAffineTransformation() {
		return new AffineTransformation(pixelWidth, rowRotation, originX, columnRotation, pixelHeight, originY);
	}
	
	/**
	 * Returns true if this is the identity transform.
	 * @return
	 */
	public boolean isIdentity() {
		return equals(IDENTITY);
	}

	@Override
	public int hashCode() {
		return Arrays.hashCode(toGdal());
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (!(obj instanceof GeoTransform))
			return false;
		return Arrays.equals(toGdal(), ((GeoTransform)obj).toGdal());
	}

	@Override
	public String toString() {
		return "GeoTransform " + Arrays.toString(toGdal());
	}

}
