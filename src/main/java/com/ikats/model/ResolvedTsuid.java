package com.ikats.model;

/**
 * Detailed result of a TSUID creation: the identifier and the metric/tags it was assigned from.
 */
public class ResolvedTsuid {

	private final String fid;
	private final String tsuid;
	private final MetricTags metricTags;

	public ResolvedTsuid(String fid, String tsuid, MetricTags metricTags) {
		this.fid = fid;
		this.tsuid = tsuid;
		this.metricTags = metricTags;
	}

	public String getFid() {
		return fid;
	}

	public String getTsuid() {
		return tsuid;
	}

	public MetricTags getMetricTags() {
		return metricTags;
	}

	@Override
	public String toString() {
		return fid + " -> " + tsuid + " " + metricTags;
	}
}
