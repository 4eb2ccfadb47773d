package com.ikats.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class IkatsSessionTest {

	@Test
	@DisplayName("Backend URLs are host, port and path")
	void testUrls() {
		IkatsSession session = new IkatsSession("http://ikats.example.org", 8080);
		assertEquals("http://ikats.example.org:8080/datamodel-api", session.getDatamodelUrl());
		assertEquals("http://ikats.example.org:8080/opentsdb", session.getTsdbUrl());
		assertEquals("http://ikats.example.org:8080/python_api", session.getCatalogUrl());

		session.setTsdbPath("/tsdb");
		assertEquals("http://ikats.example.org:8080/tsdb", session.getTsdbUrl());
	}

	@Test
	void testDefaults() {
		IkatsSession session = new IkatsSession();
		assertEquals("http://localhost", session.getHost());
		assertEquals(80, session.getPort());
		assertEquals(100, session.getMetadataChunkSize());
	}

	@Test
	@DisplayName("Hosts shall be http(s) URLs")
	void testHostValidation() {
		new IkatsSession("https://localhost", 443);
		new IkatsSession("http://192.168.0.1", 80);
		assertThrows(IllegalArgumentException.class, () -> new IkatsSession("localhost", 80));
		assertThrows(IllegalArgumentException.class, () -> new IkatsSession("ftp://localhost", 80));
		assertThrows(IllegalArgumentException.class, () -> new IkatsSession("http://", 80));
	}

	@Test
	void testPortValidation() {
		new IkatsSession("http://localhost", 1);
		new IkatsSession("http://localhost", 65534);
		assertThrows(IllegalArgumentException.class, () -> new IkatsSession("http://localhost", 0));
		assertThrows(IllegalArgumentException.class, () -> new IkatsSession("http://localhost", 65535));
	}

	@Test
	void testPositiveSettings() {
		IkatsSession session = new IkatsSession();
		assertThrows(IllegalArgumentException.class, () -> session.setTimeoutSeconds(0));
		assertThrows(IllegalArgumentException.class, () -> session.setMetadataChunkSize(0));
	}
}
