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

import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import icebergarea.lib.detection.ChannelSettings;
import icebergarea.lib.images.Channel;
import icebergarea.lib.regression.ClampPolicy;

/**
 * Immutable configuration for {@link IcebergAreaPipeline#runPipeline}.
 * <p>
 * Detection settings are shared by all channels unless overridden for a specific channel.
 */
public final class PipelineConfig {
	
	/**
	 * Default distance within which detections from different channels are considered the same object, in map units.
	 */
	public static final double DEFAULT_MERGE_BUFFER = 20.0;
	
	private final Set<Channel> channels;
	private final ChannelSettings defaultSettings;
	private final Map<Channel, ChannelSettings> channelSettings;
	private final ClampPolicy clampPolicy;
	private final int minPixelCount;
	private final double mergeBuffer;
	private final boolean parallelChannels;
	
	private PipelineConfig(Builder builder) {
		this.channels = Collections.unmodifiableSet(EnumSet.copyOf(builder.channels));
		this.defaultSettings = builder.defaultSettings;
		this.channelSettings = Collections.unmodifiableMap(new EnumMap<>(builder.channelSettings));
		this.clampPolicy = builder.clampPolicy;
		this.minPixelCount = builder.minPixelCount;
		this.mergeBuffer = builder.mergeBuffer;
		this.parallelChannels = builder.parallelChannels;
	}
	
	/**
	 * Get a config with default values for all channels.
	 * @return
	 */
	public static PipelineConfig getDefault() {
		return builder().build();
	}
	
	/**
	 * Create a new builder, initialized with default values.
	 * @return
	 */
	public static Builder builder() {
		return new Builder();
	}
	
	/**
	 * Get the channels that should be processed, in channel order.
	 * @return
	 */
	public Set<Channel> getChannels() {
		return channels;
	}
	
	/**
	 * Get the detection settings used by channels without an override.
	 * @return
	 */
	public ChannelSettings getDefaultSettings() {
		return defaultSettings;
	}
	
	/**
	 * Get the detection settings for a channel.
	 * @param channel
	 * @return the override for the channel if there is one, otherwise the default settings
	 */
	public ChannelSettings getSettings(Channel channel) {
		return channelSettings.getOrDefault(channel, defaultSettings);
	}
	
	public ClampPolicy getClampPolicy() {
		return clampPolicy;
	}
	
	/**
	 * Get the minimum number of pixels an object must have to be reported.
	 * @return
	 */
	public int getMinPixelCount() {
		return minPixelCount;
	}
	
	public double getMergeBuffer() {
		return mergeBuffer;
	}
	
	/**
	 * Query whether channels are processed concurrently.
	 * @return
	 */
	public boolean isParallelChannels() {
		return parallelChannels;
	}
	
	@Override
	public String toString() {
		return "PipelineConfig [channels=" + channels + ", defaultSettings=" + defaultSettings + ", channelSettings="
				+ channelSettings + ", clampPolicy=" + clampPolicy + ", minPixelCount=" + minPixelCount
				+ ", mergeBuffer=" + mergeBuffer + ", parallelChannels=" + parallelChannels + "]";
	}

	@Override
	public int hashCode() {
		return Objects.hash(channelSettings, channels, clampPolicy, defaultSettings, mergeBuffer, minPixelCount, parallelChannels);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (!(obj instanceof PipelineConfig))
			return false;
		PipelineConfig other = (PipelineConfig) obj;
		return Objects.equals(channelSettings, other.channelSettings) && Objects.equals(channels, other.channels)
				&& clampPolicy == other.clampPolicy && Objects.equals(defaultSettings, other.defaultSettings)
				&& Double.doubleToLongBits(mergeBuffer) == Double.doubleToLongBits(other.mergeBuffer)
				&& minPixelCount == other.minPixelCount && parallelChannels == other.parallelChannels;
	}


	/**
	 * Builder for {@link PipelineConfig}.
	 */
	public static class Builder {
		
		private Set<Channel> channels = EnumSet.allOf(Channel.class);
		private ChannelSettings defaultSettings = ChannelSettings.getDefault();
		private Map<Channel, ChannelSettings> channelSettings = new EnumMap<>(Channel.class);
		private ClampPolicy clampPolicy = ClampPolicy.ZERO;
		private int minPixelCount = 1;
		private double mergeBuffer = DEFAULT_MERGE_BUFFER;
		private boolean parallelChannels = true;
		
		private Builder() {}
		
		/**
		 * Set the channels to process.
		 * @param channels
		 * @return this builder
		 */
		public Builder channels(Channel... channels) {
			return channels(channels.length == 0 ? EnumSet.noneOf(Channel.class) : EnumSet.of(channels[0], channels));
		}
		
		/**
		 * Set the channels to process.
		 * @param channels
		 * @return this builder
		 */
		public Builder channels(Collection<Channel> channels) {
			this.channels = channels.isEmpty() ? EnumSet.noneOf(Channel.class) : EnumSet.copyOf(channels);
			return this;
		}
		
		/**
		 * Set the detection settings for all channels without an override.
		 * @param settings
		 * @return this builder
		 */
		public Builder settings(ChannelSettings settings) {
			this.defaultSettings = Objects.requireNonNull(settings, "Settings must not be null");
			return this;
		}
		
		/**
		 * Override the detection settings for one channel.
		 * @param channel
		 * @param settings the settings, or null to remove an existing override
		 * @return this builder
		 */
		public Builder settings(Channel channel, ChannelSettings settings) {
			Objects.requireNonNull(channel, "Channel must not be null");
			if (settings == null)
				this.channelSettings.remove(channel);
			else
				this.channelSettings.put(channel, settings);
			return this;
		}
		
		/**
		 * Set how unusable area predictions should be clamped.
		 * @param clampPolicy
		 * @return this builder
		 */
		public Builder clampPolicy(ClampPolicy clampPolicy) {
			this.clampPolicy = Objects.requireNonNull(clampPolicy, "Clamp policy must not be null");
			return this;
		}
		
		/**
		 * Set the minimum number of pixels an object must have to be reported.
		 * @param minPixelCount must be at least 1
		 * @return this builder
		 */
		public Builder minPixelCount(int minPixelCount) {
			if (minPixelCount < 1)
				throw new IllegalArgumentException("Minimum pixel count must be at least 1, but got " + minPixelCount);
			this.minPixelCount = minPixelCount;
			return this;
		}
		
		/**
		 * Set the distance within which detections from different channels are merged.
		 * @param mergeBuffer distance in map units; must be finite and not negative
		 * @return this builder
		 */
		public Builder mergeBuffer(double mergeBuffer) {
			if (!(mergeBuffer >= 0) || !Double.isFinite(mergeBuffer))
				throw new IllegalArgumentException("Merge buffer must be finite and not negative, but got " + mergeBuffer);
			this.mergeBuffer = mergeBuffer;
			return this;
		}
		
		/**
		 * Set whether channels should be processed concurrently.
		 * @param parallelChannels
		 * @return this builder
		 */
		public Builder parallelChannels(boolean parallelChannels) {
			this.parallelChannels = parallelChannels;
			return this;
		}
		
		/**
		 * Build the config.
		 * @return
		 */
		public PipelineConfig build() {
			return new PipelineConfig(this);
		}
		
	}

}
