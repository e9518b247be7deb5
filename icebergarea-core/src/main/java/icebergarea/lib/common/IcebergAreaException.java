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

package icebergarea.lib.common;

import java.util.Objects;

/**
 * Checked exception for recoverable, channel-level failures.
 */
public class IcebergAreaException extends Exception {

	private static final long serialVersionUID = 1L;
	
	private final ErrorKind kind;

	/**
	 * Constructor.
	 * @param kind the kind of failure
	 * @param message
	 */
	public IcebergAreaException(ErrorKind kind, String message) {
		super(message);
		this.kind = Objects.requireNonNull(kind);
	}
	
	/**
	 * Constructor with a cause.
	 * @param kind the kind of failure
	 * @param message
	 * @param cause
	 */
	public IcebergAreaException(ErrorKind kind, String message, Throwable cause) {
		super(message, cause);
		this.kind = Objects.requireNonNull(kind);
	}
	
	/**
	 * Get the kind of failure.
	 * @return
	 */
	public ErrorKind getKind() {
		return kind;
	}

}
