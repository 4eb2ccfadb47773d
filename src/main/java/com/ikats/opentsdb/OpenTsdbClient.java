package com.ikats.opentsdb;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.ikats.config.IkatsSession;
import com.ikats.exception.IkatsNotFoundException;
import com.ikats.exception.IkatsServerException;
import com.ikats.exception.MalformedResponseException;
import com.ikats.http.RestClient;
import com.ikats.http.RestResponse;
import com.ikats.http.ServiceGenerator;
import com.ikats.http.StatusChecks;
import com.ikats.model.DataPoint;
import com.ikats.model.ImportSummary;
import com.ikats.model.MetricTags;
import com.ikats.opentsdb.model.PutPoint;
import com.ikats.opentsdb.model.UidAssignment;
import com.ikats.opentsdb.model.UidType;
import com.ikats.store.PointStore;
import com.ikats.store.UidAssigner;
import com.ikats.util.IkatsChecks;

/**
 * Client of the OpenTSDB store holding the points.
 */
public class OpenTsdbClient extends RestClient implements UidAssigner, PointStore {

	private static Logger logger = LoggerFactory.getLogger(OpenTsdbClient.class);

	/** OpenTSDB UIDs are 3 bytes. */
	public static final int UID_LENGTH = 6;

	private static final String NO_SUCH_NAME = "No such name for";
	private static final int MAX_READ_RETRY = 1;

	private final OpenTsdbApi api;
	private final long readRetryDelayMillis;

	public OpenTsdbClient(IkatsSession session, ServiceGenerator generator) {
		this(generator.createService(OpenTsdbApi.class, session.getTsdbUrl()), session.getReadRetryDelayMillis());
	}

	public OpenTsdbClient(OpenTsdbApi api, long readRetryDelayMillis) {
		this.api = api;
		this.readRetryDelayMillis = readRetryDelayMillis;
	}

	@Override
	public UidAssignment assignUids(String metric, Map<String, String> tags) throws IOException {
		String tagKeys = String.join(",", tags.keySet());
		String tagValues = tags.keySet().stream().map(tags::get).collect(Collectors.joining(","));
		RestResponse response = send(api.assignUids(metric, tagKeys, tagValues));
		// names already assigned come with a 400 and the *_errors buckets
		if (!response.getContent().isJson() || response.jsonObject().has("error")) {
			StatusChecks.check(response);
		}
		return new UidAssignment(response.jsonObject());
	}

	@Override
	public MetricTags metricTagsOf(String tsuid) throws IOException {
		IkatsChecks.checkTsuid(tsuid);
		if (tsuid.length() % UID_LENGTH != 0 || (tsuid.length() / UID_LENGTH) % 2 == 0) {
			throw new IllegalArgumentException("TSUID incorrect (got: " + tsuid + ")");
		}
		String metric = uidName(tsuid.substring(0, UID_LENGTH), UidType.METRIC);
		Map<String, String> tags = new LinkedHashMap<>();
		for (int i = UID_LENGTH; i < tsuid.length(); i += 2 * UID_LENGTH) {
			String tagKey = uidName(tsuid.substring(i, i + UID_LENGTH), UidType.TAGK);
			String tagValue = uidName(tsuid.substring(i + UID_LENGTH, i + 2 * UID_LENGTH), UidType.TAGV);
			tags.put(tagKey, tagValue);
		}
		return new MetricTags(metric, tags);
	}

	private String uidName(String uid, UidType type) throws IOException {
		RestResponse response = send(api.getUidMeta(uid, type.getValue()));
		StatusChecks.is404(response, String.format("UID %s unknown (%s)", uid, type.getValue()));
		StatusChecks.check(response);
		JsonElement name = response.jsonObject().get("name");
		if (name == null || name.isJsonNull()) {
			throw new MalformedResponseException("OpenTSDB result not parsable for UID " + uid);
		}
		return name.getAsString();
	}

	@Override
	public ImportSummary writePoints(String tsuid, List<DataPoint> points) throws IOException {
		if (points == null || points.isEmpty()) {
			throw new IllegalArgumentException("No points to write to " + tsuid);
		}
		for (DataPoint point : points) {
			IkatsChecks.checkEpoch(point.getTimestamp(), "timestamp");
		}
		MetricTags metricTags = metricTagsOf(tsuid);
		List<PutPoint> body = new ArrayList<>(points.size());
		for (DataPoint point : points) {
			body.add(new PutPoint(metricTags.getMetric(), point.getTimestamp(), point.getValue(),
					metricTags.getTags()));
		}
		RestResponse response = send(api.putPoints(body));

		int success = points.size();
		JsonElement details = response.getContent().isJson() ? response.json() : null;
		if (details != null && details.isJsonObject() && details.getAsJsonObject().has("success")) {
			success = details.getAsJsonObject().get("success").getAsInt();
		} else {
			StatusChecks.is4xx(response, "Unexpected client error: {code}");
			StatusChecks.is5xx(response, "Unexpected server error: {code}");
		}
		if (success != points.size()) {
			logger.warn("Database wrote only {} points out of {} for {}: {}", success, points.size(), tsuid, details);
		}
		return new ImportSummary(points.get(0).getTimestamp(), points.get(points.size() - 1).getTimestamp(),
				points.size(), success);
	}

	@Override
	public long countPoints(String tsuid) throws IOException {
		IkatsChecks.checkTsuid(tsuid);
		RestResponse response = send(api.countPoints("sum:1y-count:" + tsuid));
		JsonArray results = queryResults(response);
		if (results.size() == 0) {
			return 0;
		}
		long count = 0;
		for (Map.Entry<String, JsonElement> yearCount : dps(results).entrySet()) {
			count += yearCount.getValue().getAsLong();
		}
		return count;
	}

	@Override
	public List<DataPoint> fetchPoints(String tsuid, long startDate, Long endDate) throws IOException {
		IkatsChecks.checkTsuid(tsuid);
		if (startDate < 0) {
			throw new IllegalArgumentException("sd must be positive (got: " + startDate + ")");
		}
		long ed;
		if (endDate == null) {
			ed = System.currentTimeMillis();
			logger.warn("End date missing, 'now' will be used: {}", ed);
		} else {
			ed = endDate;
			if (ed < startDate) {
				throw new IllegalArgumentException(
						String.format("ed must be greater than sd (got: %d < %d)", ed, startDate));
			}
			if (ed == startDate) {
				ed++;
			}
		}

		for (int attempt = 0; attempt <= MAX_READ_RETRY; attempt++) {
			RestResponse response = send(api.extract(startDate, ed, "avg:" + tsuid));
			JsonArray results = queryResults(response);
			if (results.size() == 0) {
				return new ArrayList<>();
			}
			JsonObject dps = dps(results);
			if (dps.size() == 0) {
				// points written just before may not be flushed yet
				if (attempt < MAX_READ_RETRY) {
					logger.debug("No points yet for {}, retrying in {} ms", tsuid, readRetryDelayMillis);
					pause();
				}
				continue;
			}
			List<DataPoint> points = new ArrayList<>(dps.size());
			for (Map.Entry<String, JsonElement> dp : dps.entrySet()) {
				points.add(new DataPoint(Long.parseLong(dp.getKey()), dp.getValue().getAsDouble()));
			}
			points.sort(Comparator.comparingLong(DataPoint::getTimestamp));
			return points;
		}
		throw new IkatsServerException("Backend didn't provide the points of " + tsuid);
	}

	private JsonArray queryResults(RestResponse response) {
		if (response.getContent().isJson() && response.json().isJsonObject()) {
			JsonObject error = response.jsonObject().getAsJsonObject("error");
			if (error != null) {
				String message = error.has("message") ? error.get("message").getAsString() : error.toString();
				if (message.contains(NO_SUCH_NAME)) {
					throw new IkatsNotFoundException("OpenTSDB Error : " + message);
				}
				throw new IkatsServerException("OpenTSDB Error : " + message);
			}
		}
		StatusChecks.check(response);
		return response.jsonArray();
	}

	private static JsonObject dps(JsonArray results) {
		JsonElement first = results.get(0);
		if (!first.isJsonObject()) {
			throw new MalformedResponseException("Unexpected query result: " + first);
		}
		JsonElement dps = first.getAsJsonObject().get("dps");
		return dps != null && dps.isJsonObject() ? dps.getAsJsonObject() : new JsonObject();
	}

	private void pause() throws InterruptedIOException {
		try {
			Thread.sleep(readRetryDelayMillis);
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new InterruptedIOException("Interrupted while waiting for the points");
		}
	}
}
