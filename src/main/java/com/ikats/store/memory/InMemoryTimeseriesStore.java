package com.ikats.store.memory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.TreeMap;

import com.ikats.exception.IkatsNotFoundException;
import com.ikats.model.DataPoint;
import com.ikats.model.ImportSummary;
import com.ikats.model.MetricTags;
import com.ikats.opentsdb.OpenTsdbClient;
import com.ikats.opentsdb.model.UidAssignment;
import com.ikats.opentsdb.model.UidType;
import com.ikats.store.PointStore;
import com.ikats.store.UidAssigner;
import com.ikats.util.IkatsChecks;

/**
 * Points and UID tables kept in memory. UIDs are allocated sequentially per type, on 6 hexadecimal
 * characters like the OpenTSDB ones.
 */
public class InMemoryTimeseriesStore implements UidAssigner, PointStore {

	private static final int MAX_UID = 0xFFFFFF;

	private final Map<UidType, Map<String, String>> uidByName = new EnumMap<>(UidType.class);
	private final Map<UidType, Map<String, String>> nameByUid = new EnumMap<>(UidType.class);
	private final Map<UidType, Integer> lastUid = new EnumMap<>(UidType.class);
	private final Map<String, NavigableMap<Long, Double>> points = new HashMap<>();

	public InMemoryTimeseriesStore() {
		for (UidType type : UidType.values()) {
			uidByName.put(type, new HashMap<>());
			nameByUid.put(type, new HashMap<>());
			lastUid.put(type, 0);
		}
	}

	@Override
	public UidAssignment assignUids(String metric, Map<String, String> tags) {
		Map<UidType, Map<String, String>> created = new EnumMap<>(UidType.class);
		Map<UidType, Map<String, String>> existing = new EnumMap<>(UidType.class);
		assign(UidType.METRIC, metric, created, existing);
		for (Map.Entry<String, String> tag : tags.entrySet()) {
			assign(UidType.TAGK, tag.getKey(), created, existing);
			assign(UidType.TAGV, tag.getValue(), created, existing);
		}
		return UidAssignment.of(created, existing);
	}

	private void assign(UidType type, String name, Map<UidType, Map<String, String>> created,
			Map<UidType, Map<String, String>> existing) {
		String uid = uidByName.get(type).get(name);
		if (uid != null) {
			existing.computeIfAbsent(type, k -> new LinkedHashMap<>()).put(name, uid);
			return;
		}
		int next = lastUid.get(type) + 1;
		if (next > MAX_UID) {
			throw new IllegalStateException("No more " + type.getValue() + " UID available");
		}
		lastUid.put(type, next);
		uid = String.format("%06X", next);
		uidByName.get(type).put(name, uid);
		nameByUid.get(type).put(uid, name);
		created.computeIfAbsent(type, k -> new LinkedHashMap<>()).put(name, uid);
	}

	@Override
	public MetricTags metricTagsOf(String tsuid) {
		IkatsChecks.checkTsuid(tsuid);
		int length = OpenTsdbClient.UID_LENGTH;
		if (tsuid.length() % length != 0 || (tsuid.length() / length) % 2 == 0) {
			throw new IllegalArgumentException("TSUID incorrect (got: " + tsuid + ")");
		}
		String metric = name(UidType.METRIC, tsuid.substring(0, length));
		Map<String, String> tags = new LinkedHashMap<>();
		for (int i = length; i < tsuid.length(); i += 2 * length) {
			tags.put(name(UidType.TAGK, tsuid.substring(i, i + length)),
					name(UidType.TAGV, tsuid.substring(i + length, i + 2 * length)));
		}
		return new MetricTags(metric, tags);
	}

	private String name(UidType type, String uid) {
		String name = nameByUid.get(type).get(uid);
		if (name == null) {
			throw new IkatsNotFoundException(String.format("UID %s unknown (%s)", uid, type.getValue()));
		}
		return name;
	}

	@Override
	public ImportSummary writePoints(String tsuid, List<DataPoint> newPoints) {
		if (newPoints == null || newPoints.isEmpty()) {
			throw new IllegalArgumentException("No points to write to " + tsuid);
		}
		newPoints.forEach(point -> IkatsChecks.checkEpoch(point.getTimestamp(), "timestamp"));
		metricTagsOf(tsuid);
		NavigableMap<Long, Double> series = points.computeIfAbsent(tsuid, k -> new TreeMap<>());
		for (DataPoint point : newPoints) {
			series.put(point.getTimestamp(), point.getValue());
		}
		return new ImportSummary(newPoints.get(0).getTimestamp(), newPoints.get(newPoints.size() - 1).getTimestamp(),
				newPoints.size(), newPoints.size());
	}

	@Override
	public List<DataPoint> fetchPoints(String tsuid, long startDate, Long endDate) {
		IkatsChecks.checkTsuid(tsuid);
		if (startDate < 0) {
			throw new IllegalArgumentException("sd must be positive (got: " + startDate + ")");
		}
		long ed = endDate == null ? System.currentTimeMillis() : endDate;
		if (ed < startDate) {
			throw new IllegalArgumentException(String.format("ed must be greater than sd (got: %d < %d)", ed, startDate));
		}
		List<DataPoint> result = new ArrayList<>();
		NavigableMap<Long, Double> series = points.get(tsuid);
		if (series != null) {
			series.subMap(startDate, true, ed, true).forEach((t, v) -> result.add(new DataPoint(t, v)));
		}
		return result;
	}

	@Override
	public long countPoints(String tsuid) {
		NavigableMap<Long, Double> series = points.get(tsuid);
		if (series == null) {
			throw new IkatsNotFoundException("No such name for tsuid " + tsuid);
		}
		return series.size();
	}

	public void removeAll(String tsuid) {
		points.remove(tsuid);
	}
}
