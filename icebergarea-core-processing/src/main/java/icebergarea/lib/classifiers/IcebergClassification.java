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

package icebergarea.lib.classifiers;

/**
 * Result of classifying one object.
 * 
 * @param backscatterScore standardized backscatter of the object relative to reference icebergs; NaN if unavailable
 * @param perimeterIndexScore standardized perimeter index of the object relative to reference icebergs; NaN if unavailable
 * @param iceberg true if the object is classified as an iceberg
 */
public record IcebergClassification(double backscatterScore, double perimeterIndexScore, boolean iceberg) {

}
