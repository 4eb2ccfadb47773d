package com.ikats.store;

import java.io.IOException;
import java.util.Map;

import com.ikats.model.MetricTags;
import com.ikats.opentsdb.model.UidAssignment;

/**
 * Allocation of the metric and tag UIDs a TSUID is built from.
 */
public interface UidAssigner {

	UidAssignment assignUids(String metric, Map<String, String> tags) throws IOException;

	MetricTags metricTagsOf(String tsuid) throws IOException;
}
