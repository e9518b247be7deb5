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

import java.util.Locale;

/**
 * Polarization channels of a dual-polarized SAR acquisition.
 */
public enum Channel {
	
	/**
	 * Horizontal transmit, horizontal receive (co-polarized).
	 */
	HH,
	
	/**
	 * Horizontal transmit, vertical receive (cross-polarized).
	 */
	HV;
	
	/**
	 * Parse a channel name, ignoring case and surrounding whitespace.
	 * @param name
	 * @return
	 * @throws IllegalArgumentException if the name does not match a channel
	 */
	public static Channel fromString(String name) {
		if (name == null)
			throw new IllegalArgumentException("Channel name must not be null");
		String s = name.strip().toUpperCase(Locale.ROOT);
		for (var channel : values()) {
			if (channel.name().equals(s))
				return channel;
		}
		throw new IllegalArgumentException("Unknown channel '" + name + "'");
	}

}
