package com.ikats;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.Map;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.ikats.config.IkatsSession;

import okhttp3.mockwebserver.Dispatcher;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;

class IkatsApiTest {

	private static final String FID_PATH = "/datamodel-api/TemporalDataManagerWebApp/webapi/metadata/funcId";

	private MockWebServer server;
	private IkatsApi api;

	/**
	 * Just enough of the datamodel and OpenTSDB to create and look up FIDs.
	 */
	private static class BackendDispatcher extends Dispatcher {

		private final Map<String, String> tsuidByFid = new HashMap<>();

		@Override
		public MockResponse dispatch(RecordedRequest request) {
			String path = request.getRequestUrl().encodedPath();
			if (path.equals(FID_PATH) && "POST".equals(request.getMethod())) {
				String fid = request.getBody().readUtf8().substring("funcIds=".length());
				String tsuid = tsuidByFid.get(fid);
				if (tsuid == null) {
					return new MockResponse().setResponseCode(404);
				}
				return json(200, "[{\"tsuid\":\"" + tsuid + "\",\"funcId\":\"" + fid + "\"}]");
			}
			if (path.startsWith(FID_PATH + "/")) {
				String[] ids = path.substring(FID_PATH.length() + 1).split("/");
				tsuidByFid.put(ids[1], ids[0]);
				return new MockResponse().setResponseCode(200);
			}
			if (path.equals("/opentsdb/api/uid/assign")) {
				return json(400, "{\"metric\":{\"0000000\":\"00000A\"},"
						+ "\"tagk_errors\":{\"import_year\":\"Name already exists with UID: 000001\","
						+ "\"import_month_day\":\"Name already exists with UID: 000002\","
						+ "\"import_time\":\"Name already exists with UID: 000003\"},"
						+ "\"tagv\":{\"2016\":\"000011\",\"11_05\":\"000012\",\"14_05_35\":\"000013\"}}");
			}
			return new MockResponse().setResponseCode(500);
		}

		private static MockResponse json(int code, String body) {
			return new MockResponse().setResponseCode(code).setHeader("Content-Type", "application/json")
					.setBody(body);
		}
	}

	@BeforeEach
	void setUp() throws IOException {
		server = new MockWebServer();
		server.setDispatcher(new BackendDispatcher());
		server.start();
		IkatsSession session = new IkatsSession("http://localhost", server.getPort());
		session.setReadRetryDelayMillis(0);
		api = new IkatsApi(session, Clock.fixed(Instant.parse("2016-11-05T14:05:35Z"), ZoneOffset.UTC));
	}

	@AfterEach
	void tearDown() throws IOException {
		api.close();
		server.shutdown();
	}

	@Test
	@DisplayName("A FID created through the backends is found right after")
	void testResolveThenLookup() throws Exception {
		assertFalse(api.isEmulated());
		String tsuid = api.ts().createReference("FID_1").getTsuid();
		assertEquals("00000A" + "000001000011" + "000002000012" + "000003000013", tsuid);
		assertEquals(tsuid, api.ts().fidToTsuid("FID_1", true));
	}

	@Test
	void testRemoteManagers() {
		assertNotNull(api.table());
		assertNotNull(api.op());
		assertTrue(api.getSession().getDatamodelUrl().endsWith("/datamodel-api"));
	}
}
