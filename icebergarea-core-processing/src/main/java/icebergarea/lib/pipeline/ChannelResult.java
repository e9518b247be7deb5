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

import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

import icebergarea.lib.images.Channel;

/**
 * Objects and optional error for one channel of a pipeline run.
 */
public class ChannelResult {
	
	private final Channel channel;
	private final List<IcebergObject> objects;
	private final ChannelError error;
	
	private ChannelResult(Channel channel, List<IcebergObject> objects, ChannelError error) {
		this.channel = Objects.requireNonNull(channel);
		this.objects = List.copyOf(objects);
		this.error = error;
	}
	
	/**
	 * Create a result for a channel that was processed.
	 * @param channel
	 * @param objects
	 * @param error optional non-fatal error, e.g. if area correction was unavailable
	 * @return
	 */
	static ChannelResult of(Channel channel, List<IcebergObject> objects, ChannelError error) {
		return new ChannelResult(channel, objects, error);
	}
	
	/**
	 * Create a result for a channel that could not be processed.
	 * @param error
	 * @return
	 */
	static ChannelResult failed(ChannelError error) {
		return new ChannelResult(error.channel(), Collections.emptyList(), error);
	}
	
	public Channel getChannel() {
		return channel;
	}
	
	/**
	 * Get the detected objects, in order of id.
	 * @return an unmodifiable list
	 */
	public List<IcebergObject> getObjects() {
		return objects;
	}
	
	public Optional<ChannelError> getError() {
		return Optional.ofNullable(error);
	}
	
	/**
	 * Query whether the channel failed to produce objects.
	 * @return
	 */
	public boolean isFailed() {
		return error != null && error.isFatal();
	}

	@Override
	public String toString() {
		return "ChannelResult [" + channel + ", " + objects.size() + " objects" + (error == null ? "" : ", " + error) + "]";
	}

}
