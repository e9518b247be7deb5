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
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import icebergarea.lib.images.Channel;

/**
 * Results of a pipeline run: one {@link ChannelResult} per enabled channel and the merged objects.
 */
public class PipelineResult {
	
	private final Map<Channel, ChannelResult> channelResults;
	private final List<IcebergObject> mergedObjects;
	
	PipelineResult(Map<Channel, ChannelResult> channelResults, List<IcebergObject> mergedObjects) {
		this.channelResults = Collections.unmodifiableMap(new EnumMap<>(channelResults));
		this.mergedObjects = List.copyOf(mergedObjects);
	}
	
	/**
	 * Get the results for every enabled channel, in channel order.
	 * @return
	 */
	public Map<Channel, ChannelResult> getChannelResults() {
		return channelResults;
	}
	
	/**
	 * Get the result for one channel.
	 * @param channel
	 * @return the result, or null if the channel was not enabled
	 */
	public ChannelResult getChannelResult(Channel channel) {
		return channelResults.get(channel);
	}
	
	/**
	 * Get the objects remaining after merging overlapping detections from different channels.
	 * @return
	 */
	public List<IcebergObject> getMergedObjects() {
		return mergedObjects;
	}
	
	/**
	 * Get all channel errors, including those that did not prevent objects being reported.
	 * @return
	 */
	public List<ChannelError> getErrors() {
		return channelResults.values().stream()
				.flatMap(r -> r.getError().stream())
				.collect(Collectors.toList());
	}
	
	/**
	 * Query whether every enabled channel failed.
	 * @return true if at least one channel was enabled and all of them failed
	 */
	public boolean allFailed() {
		return !channelResults.isEmpty() && channelResults.values().stream().allMatch(ChannelResult::isFailed);
	}

	@Override
	public String toString() {
		return "PipelineResult [" + channelResults.values() + ", " + mergedObjects.size() + " merged objects]";
	}

}
