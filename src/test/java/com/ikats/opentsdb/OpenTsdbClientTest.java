package com.ikats.opentsdb;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import com.ikats.config.IkatsSession;
import com.ikats.exception.IkatsNotFoundException;
import com.ikats.exception.IkatsServerException;
import com.ikats.http.ServiceGenerator;
import com.ikats.model.DataPoint;
import com.ikats.model.ImportSummary;
import com.ikats.model.MetricTags;
import com.ikats.opentsdb.model.UidAssignment;

import okhttp3.HttpUrl;
import okhttp3.logging.HttpLoggingInterceptor;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;

class OpenTsdbClientTest {

	private static final String TSUID = "000001000002000003";

	private MockWebServer server;
	private ServiceGenerator generator;
	private OpenTsdbClient client;

	@BeforeEach
	void setUp() throws IOException {
		server = new MockWebServer();
		server.start();
		IkatsSession session = new IkatsSession("http://localhost", server.getPort());
		session.setReadRetryDelayMillis(0);
		generator = new ServiceGenerator(5, HttpLoggingInterceptor.Level.NONE);
		client = new OpenTsdbClient(session, generator);
	}

	@AfterEach
	void tearDown() throws IOException {
		server.shutdown();
		generator.shutdown();
	}

	private static MockResponse json(int code, String body) {
		return new MockResponse().setResponseCode(code).setHeader("Content-Type", "application/json").setBody(body);
	}

	private void enqueueMetricTags() {
		server.enqueue(json(200, "{\"uid\":\"000001\",\"type\":\"METRIC\",\"name\":\"0563185\"}"));
		server.enqueue(json(200, "{\"uid\":\"000002\",\"type\":\"TAGK\",\"name\":\"import_year\"}"));
		server.enqueue(json(200, "{\"uid\":\"000003\",\"type\":\"TAGV\",\"name\":\"2016\"}"));
	}

	@Test
	@DisplayName("UID assignment sends metric, tag keys and tag values in the same order")
	void testAssignUids() throws Exception {
		server.enqueue(json(400, "{"
				+ "\"metric\": {\"0563185\": \"00002A\"},"
				+ "\"tagk_errors\": {\"import_year\": \"Name already exists with UID: 000001\","
				+ "  \"import_time\": \"Name already exists with UID: 000002\"},"
				+ "\"tagv\": {\"2016\": \"00000B\", \"14_05_35\": \"00000C\"}}"));
		Map<String, String> tags = new LinkedHashMap<>();
		tags.put("import_year", "2016");
		tags.put("import_time", "14_05_35");

		UidAssignment assignment = client.assignUids("0563185", tags);
		assertEquals("00002A", assignment.metricUid("0563185"));
		assertEquals("000002", assignment.tagKeyUid("import_time"));

		HttpUrl url = server.takeRequest().getRequestUrl();
		assertEquals("/opentsdb/api/uid/assign", url.encodedPath());
		assertEquals("0563185", url.queryParameter("metric"));
		assertEquals("import_year,import_time", url.queryParameter("tagk"));
		assertEquals("2016,14_05_35", url.queryParameter("tagv"));
	}

	@Test
	void testAssignUidsServerError() {
		server.enqueue(new MockResponse().setResponseCode(500).setBody("boom"));
		assertThrows(IkatsServerException.class, () -> client.assignUids("m", Map.of("k", "v")));
	}

	@Test
	@DisplayName("Metric and tags are read back UID by UID")
	void testMetricTagsOf() throws Exception {
		enqueueMetricTags();
		MetricTags metricTags = client.metricTagsOf(TSUID);
		assertEquals("0563185", metricTags.getMetric());
		assertEquals(Map.of("import_year", "2016"), metricTags.getTags());

		assertEquals("metric", server.takeRequest().getRequestUrl().queryParameter("type"));
		HttpUrl tagk = server.takeRequest().getRequestUrl();
		assertEquals("000002", tagk.queryParameter("uid"));
		assertEquals("tagk", tagk.queryParameter("type"));
		assertEquals("tagv", server.takeRequest().getRequestUrl().queryParameter("type"));
	}

	@Test
	void testMetricTagsOfUnknownUid() {
		server.enqueue(json(404, "{\"error\":{\"code\":404,\"message\":\"Unable to locate UID\"}}"));
		assertThrows(IkatsNotFoundException.class, () -> client.metricTagsOf(TSUID));
	}

	@Test
	void testMetricTagsOfBadTsuid() {
		assertThrows(IllegalArgumentException.class, () -> client.metricTagsOf("00000100000"));
		assertThrows(IllegalArgumentException.class, () -> client.metricTagsOf("000001000002"));
		assertEquals(0, server.getRequestCount());
	}

	@Test
	@DisplayName("A partial write is reported through the success count")
	void testWritePointsPartial() throws Exception {
		enqueueMetricTags();
		server.enqueue(json(400, "{\"success\":2,\"failed\":1,\"errors\":[]}"));

		List<DataPoint> points = Arrays.asList(new DataPoint(1000, 1.0), new DataPoint(2000, 2.0),
				new DataPoint(3000, 3.0));
		ImportSummary summary = client.writePoints(TSUID, points);
		assertEquals(1000, summary.getStartDate());
		assertEquals(3000, summary.getEndDate());
		assertEquals(3, summary.getSubmitted());
		assertEquals(2, summary.getSuccess());
		assertTrue(summary.isPartial());

		for (int i = 0; i < 3; i++) {
			server.takeRequest();
		}
		RecordedRequest put = server.takeRequest();
		assertEquals("POST", put.getMethod());
		assertEquals("/opentsdb/api/put", put.getRequestUrl().encodedPath());
		assertEquals("true", put.getRequestUrl().queryParameter("ms"));
		JsonArray body = JsonParser.parseString(put.getBody().readUtf8()).getAsJsonArray();
		assertEquals(3, body.size());
		JsonObject first = body.get(0).getAsJsonObject();
		assertEquals("0563185", first.get("metric").getAsString());
		assertEquals("0000000001000", first.get("timestamp").getAsString());
		assertEquals("2016", first.getAsJsonObject("tags").get("import_year").getAsString());
	}

	@Test
	void testWritePointsComplete() throws Exception {
		enqueueMetricTags();
		server.enqueue(json(200, "{\"success\":1,\"failed\":0,\"errors\":[]}"));
		ImportSummary summary = client.writePoints(TSUID, List.of(new DataPoint(5, 1.5)));
		assertEquals(1, summary.getSuccess());
		assertEquals(5, summary.getStartDate());
		assertEquals(5, summary.getEndDate());
	}

	@Test
	void testWriteNoPoints() {
		assertThrows(IllegalArgumentException.class, () -> client.writePoints(TSUID, List.of()));
	}

	@Test
	@DisplayName("Negative timestamps are rejected before any request")
	void testWriteNegativeTimestamp() {
		List<DataPoint> points = Arrays.asList(new DataPoint(1000, 1.0), new DataPoint(-5, 2.0));
		assertThrows(IllegalArgumentException.class, () -> client.writePoints(TSUID, points));
		assertEquals(0, server.getRequestCount());
	}

	@Test
	@DisplayName("Point count sums the yearly counts")
	void testCountPoints() throws Exception {
		server.enqueue(json(200, "[{\"metric\":\"m\",\"tags\":{},\"dps\":{\"1451606400\":3,\"1483228800\":4}}]"));
		assertEquals(7, client.countPoints(TSUID));
		assertEquals("sum:1y-count:" + TSUID, server.takeRequest().getRequestUrl().queryParameter("tsuid"));
	}

	@Test
	void testCountPointsUnknownTsuid() {
		server.enqueue(json(400, "{\"error\":{\"code\":400,\"message\":\"No such name for 'metrics': 'x'\"}}"));
		assertThrows(IkatsNotFoundException.class, () -> client.countPoints(TSUID));

		server.enqueue(json(500, "{\"error\":{\"code\":500,\"message\":\"HBase down\"}}"));
		assertThrows(IkatsServerException.class, () -> client.countPoints(TSUID));
	}

	@Test
	@DisplayName("Points not flushed yet are read again once, then sorted")
	void testFetchPointsRetry() throws Exception {
		server.enqueue(json(200, "[{\"metric\":\"m\",\"dps\":{}}]"));
		server.enqueue(json(200, "[{\"metric\":\"m\",\"dps\":{\"3000\":3.0,\"1000\":1.0,\"2000\":2.5}}]"));

		List<DataPoint> points = client.fetchPoints(TSUID, 1000, 3000L);
		assertEquals(Arrays.asList(new DataPoint(1000, 1.0), new DataPoint(2000, 2.5), new DataPoint(3000, 3.0)),
				points);
		assertEquals(2, server.getRequestCount());

		HttpUrl url = server.takeRequest().getRequestUrl();
		assertEquals("1000", url.queryParameter("start"));
		assertEquals("3000", url.queryParameter("end"));
		assertEquals("avg:" + TSUID, url.queryParameter("tsuid"));
	}

	@Test
	void testFetchPointsStillEmpty() {
		server.enqueue(json(200, "[{\"metric\":\"m\",\"dps\":{}}]"));
		server.enqueue(json(200, "[{\"metric\":\"m\",\"dps\":{}}]"));
		assertThrows(IkatsServerException.class, () -> client.fetchPoints(TSUID, 0, 10L));
		assertEquals(2, server.getRequestCount());
	}

	@Test
	void testFetchPointsNoSeries() throws Exception {
		server.enqueue(json(200, "[]"));
		assertTrue(client.fetchPoints(TSUID, 0, 10L).isEmpty());
	}

	@Test
	@DisplayName("Dates are checked before any request, an empty range is widened by one")
	void testFetchPointsDates() throws Exception {
		assertThrows(IllegalArgumentException.class, () -> client.fetchPoints(TSUID, -1, 10L));
		assertThrows(IllegalArgumentException.class, () -> client.fetchPoints(TSUID, 10, 5L));
		assertEquals(0, server.getRequestCount());

		server.enqueue(json(200, "[{\"metric\":\"m\",\"dps\":{\"10\":1.0}}]"));
		client.fetchPoints(TSUID, 10, 10L);
		assertEquals("11", server.takeRequest().getRequestUrl().queryParameter("end"));
	}
}
