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

import icebergarea.lib.common.ErrorKind;
import icebergarea.lib.images.Channel;

/**
 * Structured error reported for one channel of a pipeline run.
 * 
 * @param channel the channel that failed
 * @param kind the kind of failure
 * @param message a human-readable description
 */
public record ChannelError(Channel channel, ErrorKind kind, String message) {
	
	/**
	 * Constructor.
	 * @param channel
	 * @param kind
	 * @param message
	 */
	public ChannelError {
		Objects.requireNonNull(channel, "Channel must not be null");
		Objects.requireNonNull(kind, "Error kind must not be null");
	}
	
	/**
	 * Query whether the error prevented the channel from producing objects.
	 * Errors that only affect area correction still allow objects to be reported.
	 * @return
	 */
	public boolean isFatal() {
		return kind.isFatal();
	}

}
