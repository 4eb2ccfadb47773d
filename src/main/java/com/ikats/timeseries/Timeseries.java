package com.ikats.timeseries;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.ikats.model.DataPoint;
import com.ikats.model.MetadataEntry;

/**
 * Local handle on a timeseries. The TSUID is null until the timeseries is saved.
 */
public class Timeseries {

	private String fid;
	private String tsuid;
	private List<DataPoint> data = new ArrayList<>();
	private final Map<String, MetadataEntry> metadata = new LinkedHashMap<>();

	public Timeseries() {
	}

	public Timeseries(String tsuid, String fid) {
		this.tsuid = tsuid;
		this.fid = fid;
	}

	public String getFid() {
		return fid;
	}

	public void setFid(String fid) {
		this.fid = fid;
	}

	public String getTsuid() {
		return tsuid;
	}

	public void setTsuid(String tsuid) {
		this.tsuid = tsuid;
	}

	public List<DataPoint> getData() {
		return data;
	}

	public void setData(List<DataPoint> data) {
		this.data = data == null ? new ArrayList<>() : data;
	}

	public Map<String, MetadataEntry> getMetadata() {
		return metadata;
	}

	public void putMetadata(MetadataEntry entry) {
		metadata.put(entry.getName(), entry);
	}

	public MetadataEntry getMetadata(String name) {
		return metadata.get(name);
	}

	@Override
	public String toString() {
		return "Timeseries [fid=" + fid + ", tsuid=" + tsuid + ", points=" + data.size() + "]";
	}
}
