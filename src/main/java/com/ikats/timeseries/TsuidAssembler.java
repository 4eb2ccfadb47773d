package com.ikats.timeseries;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import com.ikats.model.MetricTags;
import com.ikats.opentsdb.model.UidAssignment;

/**
 * TSUID layout: the metric UID followed by one tag key UID + tag value UID pair per tag, the pairs
 * sorted in ascending order so the result does not depend on the tag iteration order.
 */
public final class TsuidAssembler {

	private TsuidAssembler() {
	}

	public static String assemble(UidAssignment assignment, MetricTags metricTags) {
		return assemble(assignment, metricTags.getMetric(), metricTags.getTags());
	}

	public static String assemble(UidAssignment assignment, String metric, Map<String, String> tags) {
		String metricUid = assignment.metricUid(metric);
		List<String> pairs = new ArrayList<>(tags.size());
		for (Map.Entry<String, String> tag : tags.entrySet()) {
			pairs.add(assignment.tagKeyUid(tag.getKey()) + assignment.tagValueUid(tag.getValue()));
		}
		return assemble(metricUid, pairs);
	}

	public static String assemble(String metricUid, List<String> tagPairs) {
		List<String> sorted = new ArrayList<>(tagPairs);
		Collections.sort(sorted);
		StringBuilder tsuid = new StringBuilder(metricUid);
		sorted.forEach(tsuid::append);
		return tsuid.toString();
	}
}
