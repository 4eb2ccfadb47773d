package com.ikats.config;

import java.util.regex.Pattern;

import org.apache.commons.lang3.Validate;

import okhttp3.logging.HttpLoggingInterceptor;

/**
 * Connection settings of the IKATS backends: one host and port, one path per backend.
 */
public class IkatsSession {

	public static final String DEFAULT_HOST = "http://localhost";
	public static final int DEFAULT_PORT = 80;
	public static final String DEFAULT_DATAMODEL_PATH = "/datamodel-api";
	public static final String DEFAULT_TSDB_PATH = "/opentsdb";
	public static final String DEFAULT_CATALOG_PATH = "/python_api";
	public static final long DEFAULT_TIMEOUT_SECONDS = 300;
	public static final long DEFAULT_READ_RETRY_DELAY_MILLIS = 4000;
	public static final int DEFAULT_METADATA_CHUNK_SIZE = 100;

	private static final Pattern HOST_PATTERN = Pattern.compile(
			"^(?:http)s?://"
			+ "(?:(?:[A-Z0-9](?:[A-Z0-9-]{0,61}[A-Z0-9])?\\.)+(?:[A-Z]{2,6}\\.?|[A-Z0-9-]{2,}\\.?)|"
			+ "localhost|"
			+ "\\d{1,3}\\.\\d{1,3}\\.\\d{1,3}\\.\\d{1,3})"
			+ "(?::\\d+)?(?:/?|[/?]\\S+)$",
			Pattern.CASE_INSENSITIVE);

	private String host;
	private int port;
	private String datamodelPath = DEFAULT_DATAMODEL_PATH;
	private String tsdbPath = DEFAULT_TSDB_PATH;
	private String catalogPath = DEFAULT_CATALOG_PATH;
	private long timeoutSeconds = DEFAULT_TIMEOUT_SECONDS;
	private HttpLoggingInterceptor.Level httpLogLevel = HttpLoggingInterceptor.Level.NONE;
	private long readRetryDelayMillis = DEFAULT_READ_RETRY_DELAY_MILLIS;
	private int metadataChunkSize = DEFAULT_METADATA_CHUNK_SIZE;
	private boolean emulate;

	public IkatsSession() {
		this(DEFAULT_HOST, DEFAULT_PORT);
	}

	public IkatsSession(String host, int port) {
		setHost(host);
		setPort(port);
	}

	public String getHost() {
		return host;
	}

	public void setHost(String host) {
		Validate.notNull(host, "host must be set");
		if (!HOST_PATTERN.matcher(host).matches()) {
			throw new IllegalArgumentException("Malformed host name: " + host);
		}
		this.host = host;
	}

	public int getPort() {
		return port;
	}

	public void setPort(int port) {
		if (port <= 0 || port >= 65535) {
			throw new IllegalArgumentException(String.format("Port must be within ]0;65535[ (got %s)", port));
		}
		this.port = port;
	}

	public String getDatamodelUrl() {
		return url(datamodelPath);
	}

	public String getTsdbUrl() {
		return url(tsdbPath);
	}

	public String getCatalogUrl() {
		return url(catalogPath);
	}

	private String url(String path) {
		return String.format("%s:%d%s", host, port, path);
	}

	public void setDatamodelPath(String datamodelPath) {
		this.datamodelPath = datamodelPath;
	}

	public void setTsdbPath(String tsdbPath) {
		this.tsdbPath = tsdbPath;
	}

	public void setCatalogPath(String catalogPath) {
		this.catalogPath = catalogPath;
	}

	public long getTimeoutSeconds() {
		return timeoutSeconds;
	}

	public void setTimeoutSeconds(long timeoutSeconds) {
		Validate.isTrue(timeoutSeconds > 0, "timeout must be positive (got %d)", timeoutSeconds);
		this.timeoutSeconds = timeoutSeconds;
	}

	public HttpLoggingInterceptor.Level getHttpLogLevel() {
		return httpLogLevel;
	}

	public void setHttpLogLevel(HttpLoggingInterceptor.Level httpLogLevel) {
		this.httpLogLevel = httpLogLevel;
	}

	public long getReadRetryDelayMillis() {
		return readRetryDelayMillis;
	}

	public void setReadRetryDelayMillis(long readRetryDelayMillis) {
		this.readRetryDelayMillis = readRetryDelayMillis;
	}

	public int getMetadataChunkSize() {
		return metadataChunkSize;
	}

	public void setMetadataChunkSize(int metadataChunkSize) {
		Validate.isTrue(metadataChunkSize > 0, "metadata chunk size must be positive (got %d)", metadataChunkSize);
		this.metadataChunkSize = metadataChunkSize;
	}

	public boolean isEmulate() {
		return emulate;
	}

	public void setEmulate(boolean emulate) {
		this.emulate = emulate;
	}

	@Override
	public String toString() {
		return "IKATS session to " + host + ":" + port;
	}
}
