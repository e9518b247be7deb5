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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.locationtech.jts.geom.prep.PreparedGeometryFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Merge objects detected independently in the HH and HV channels.
 * <p>
 * Each HH object is compared with the remaining HV objects that intersect its outline buffered by a fixed distance.
 * If the largest of these HV objects has a larger CFAR area than the HH object, it replaces the HH object 
 * and the other intersecting HV objects are discarded. Otherwise the HH object is kept and all intersecting 
 * HV objects are discarded.
 * Objects keep the channel in which they were detected.
 */
public class ChannelMerger {
	
	private static final Logger logger = LoggerFactory.getLogger(ChannelMerger.class);
	
	private ChannelMerger() {
		throw new AssertionError();
	}
	
	/**
	 * Merge HH and HV objects using the default buffer distance.
	 * @param hh objects detected in HH, may be empty
	 * @param hv objects detected in HV, may be empty
	 * @return the merged objects, HH objects first
	 * @see PipelineConfig#DEFAULT_MERGE_BUFFER
	 */
	public static List<IcebergObject> merge(List<IcebergObject> hh, List<IcebergObject> hv) {
		return merge(hh, hv, PipelineConfig.DEFAULT_MERGE_BUFFER);
	}
	
	/**
	 * Merge HH and HV objects.
	 * @param hh objects detected in HH, may be empty
	 * @param hv objects detected in HV, may be empty
	 * @param buffer distance in map units within which objects are considered to be the same
	 * @return the merged objects, HH objects first
	 */
	public static List<IcebergObject> merge(List<IcebergObject> hh, List<IcebergObject> hv, double buffer) {
		if (hh.isEmpty())
			return List.copyOf(hv);
		if (hv.isEmpty())
			return List.copyOf(hh);
		
		var keptHH = new ArrayList<IcebergObject>();
		var remainingHV = new ArrayList<>(hv);
		for (var hhObject : hh) {
			var search = PreparedGeometryFactory.prepare(hhObject.getOutline().buffer(buffer));
			List<IcebergObject> intersecting = new ArrayList<>();
			IcebergObject largest = null;
			for (var hvObject : remainingHV) {
				if (search.intersects(hvObject.getOutline())) {
					intersecting.add(hvObject);
					if (largest == null || hvObject.getAreaCfar() > largest.getAreaCfar())
						largest = hvObject;
				}
			}
			if (largest != null && largest.getAreaCfar() > hhObject.getAreaCfar()) {
				intersecting.remove(largest);
				logger.trace("{} replaced by {}", hhObject, largest);
			} else
				keptHH.add(hhObject);
			remainingHV.removeAll(intersecting);
		}
		
		var merged = new ArrayList<IcebergObject>(keptHH.size() + remainingHV.size());
		merged.addAll(keptHH);
		merged.addAll(remainingHV);
		logger.debug("Merged {} HH and {} HV objects into {} ({} from HH)", hh.size(), hv.size(), merged.size(), keptHH.size());
		return Collections.unmodifiableList(merged);
	}

}
