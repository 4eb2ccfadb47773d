package com.ikats.store;

import java.io.IOException;
import java.util.List;

import com.ikats.model.DataPoint;
import com.ikats.model.ImportSummary;

public interface PointStore {

	/**
	 * Points are expected in ascending timestamp order. A partial write is reported by
	 * {@link ImportSummary#getSuccess()}, not by an exception.
	 */
	ImportSummary writePoints(String tsuid, List<DataPoint> points) throws IOException;

	/**
	 * @param endDate null means now
	 */
	List<DataPoint> fetchPoints(String tsuid, long startDate, Long endDate) throws IOException;

	long countPoints(String tsuid) throws IOException;
}
