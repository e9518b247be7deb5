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

package icebergarea.lib.detection;

import java.util.Objects;

import icebergarea.lib.analysis.stats.WindowSpec;

/**
 * Immutable CFAR detection settings for one polarization channel.
 */
public final class ChannelSettings {
	
	/**
	 * Default probability of false alarm.
	 */
	public static final double DEFAULT_PFA = 1e-6;
	
	/**
	 * Default minimum variance, relative to the squared local mean.
	 * This caps the estimated gamma shape at 100.
	 */
	public static final double DEFAULT_MIN_RELATIVE_VARIANCE = 0.01;
	
	private static final ChannelSettings DEFAULT = builder().build();
	
	private final WindowSpec window;
	private final double pfa;
	private final ShapeEstimation shapeEstimation;
	private final EdgePolicy edgePolicy;
	private final double minRelativeVariance;
	
	private ChannelSettings(Builder builder) {
		this.window = builder.window;
		this.pfa = builder.pfa;
		this.shapeEstimation = builder.shapeEstimation;
		this.edgePolicy = builder.edgePolicy;
		this.minRelativeVariance = builder.minRelativeVariance;
	}
	
	/**
	 * Get the default settings (29/21 window, Pfa 1e-6, local moments, clipped edges).
	 * @return
	 */
	public static ChannelSettings getDefault() {
		return DEFAULT;
	}
	
	/**
	 * Create a new builder initialized with default values.
	 * @return
	 */
	public static Builder builder() {
		return new Builder();
	}
	
	/**
	 * Create a new builder initialized with the values of these settings.
	 * @return
	 */
	public Builder toBuilder() {
		return new Builder()
				.window(window)
				.pfa(pfa)
				.shapeEstimation(shapeEstimation)
				.edgePolicy(edgePolicy)
				.minRelativeVariance(minRelativeVariance);
	}
	
	public WindowSpec getWindow() {
		return window;
	}
	
	/**
	 * Probability of false alarm.
	 * @return
	 */
	public double getPfa() {
		return pfa;
	}
	
	public ShapeEstimation getShapeEstimation() {
		return shapeEstimation;
	}
	
	public EdgePolicy getEdgePolicy() {
		return edgePolicy;
	}
	
	/**
	 * Minimum variance relative to the squared mean, used to stabilize the shape estimate.
	 * @return
	 */
	public double getMinRelativeVariance() {
		return minRelativeVariance;
	}
	
	@Override
	public int hashCode() {
		return Objects.hash(window, pfa, shapeEstimation, edgePolicy, minRelativeVariance);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (!(obj instanceof ChannelSettings))
			return false;
		var other = (ChannelSettings)obj;
		return window.equals(other.window) 
				&& Double.compare(pfa, other.pfa) == 0
				&& shapeEstimation == other.shapeEstimation
				&& edgePolicy == other.edgePolicy
				&& Double.compare(minRelativeVariance, other.minRelativeVariance) == 0;
	}

	@Override
	public String toString() {
		return "ChannelSettings [window=" + window + ", pfa=" + pfa + ", shapeEstimation=" + shapeEstimation
				+ ", edgePolicy=" + edgePolicy + ", minRelativeVariance=" + minRelativeVariance + "]";
	}

	
	/**
	 * Builder for {@link ChannelSettings}.
	 */
	public static class Builder {
		
		private WindowSpec window = WindowSpec.getDefault();
		private double pfa = DEFAULT_PFA;
		private ShapeEstimation shapeEstimation = ShapeEstimation.LOCAL_MOMENTS;
		private EdgePolicy edgePolicy = EdgePolicy.CLIP;
		private double minRelativeVariance = DEFAULT_MIN_RELATIVE_VARIANCE;
		
		private Builder() {}
		
		/**
		 * Set the background window.
		 * @param window
		 * @return this builder
		 */
		public Builder window(WindowSpec window) {
			this.window = Objects.requireNonNull(window, "Window must not be null");
			return this;
		}
		
		/**
		 * Set the background window from outer and guard sizes.
		 * @param outerSize
		 * @param guardSize
		 * @return this builder
		 * @throws icebergarea.lib.analysis.stats.InvalidWindowConfigException if the sizes are invalid
		 */
		public Builder window(int outerSize, int guardSize) {
			return window(WindowSpec.of(outerSize, guardSize));
		}
		
		/**
		 * Set the probability of false alarm.
		 * @param pfa a value strictly between 0 and 1
		 * @return this builder
		 */
		public Builder pfa(double pfa) {
			if (!(pfa > 0 && pfa < 1))
				throw new IllegalArgumentException("Probability of false alarm must be between 0 and 1 (exclusive), but got " + pfa);
			this.pfa = pfa;
			return this;
		}
		
		/**
		 * Set how the clutter shape is estimated.
		 * @param shapeEstimation
		 * @return this builder
		 */
		public Builder shapeEstimation(ShapeEstimation shapeEstimation) {
			this.shapeEstimation = Objects.requireNonNull(shapeEstimation);
			return this;
		}
		
		/**
		 * Set how pixels near the image border are handled.
		 * @param edgePolicy
		 * @return this builder
		 */
		public Builder edgePolicy(EdgePolicy edgePolicy) {
			this.edgePolicy = Objects.requireNonNull(edgePolicy);
			return this;
		}
		
		/**
		 * Set the minimum relative variance.
		 * @param minRelativeVariance a positive value
		 * @return this builder
		 */
		public Builder minRelativeVariance(double minRelativeVariance) {
			if (!(minRelativeVariance > 0) || !Double.isFinite(minRelativeVariance))
				throw new IllegalArgumentException("Minimum relative variance must be positive and finite, but got " + minRelativeVariance);
			this.minRelativeVariance = minRelativeVariance;
			return this;
		}
		
		/**
		 * Build the settings.
		 * @return
		 */
		public ChannelSettings build() {
			return new ChannelSettings(this);
		}
		
	}

}
