package com.ikats.config;

import java.io.File;
import java.net.URL;

import org.apache.commons.configuration2.Configuration;
import org.apache.commons.configuration2.PropertiesConfiguration;
import org.apache.commons.configuration2.builder.fluent.Configurations;
import org.apache.commons.configuration2.ex.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import okhttp3.logging.HttpLoggingInterceptor;

/**
 * Reads {@code ikats.properties} and turns it into an {@link IkatsSession}.
 */
public class IkatsConfiguration {

	private static Logger logger = LoggerFactory.getLogger(IkatsConfiguration.class);

	public static final String IKATS_PROPERTIES_FILE = "ikats.properties";

	public class Constants {
		public final static String HOST = "ikats.host";
		public final static String PORT = "ikats.port";
		public final static String DATAMODEL_PATH = "ikats.datamodel.path";
		public final static String TSDB_PATH = "ikats.tsdb.path";
		public final static String CATALOG_PATH = "ikats.catalog.path";
		public final static String HTTP_TIMEOUT_SECONDS = "ikats.http.timeoutSeconds";
		public final static String HTTP_LOG_LEVEL = "ikats.http.logLevel";
		public final static String TSDB_READ_RETRY_DELAY_MILLIS = "ikats.tsdb.readRetryDelayMillis";
		public final static String METADATA_CHUNK_SIZE = "ikats.metadata.chunkSize";
		public final static String EMULATE = "ikats.emulate";
	}

	/**
	 * Loads the given file, or {@code ikats.properties} from the working directory, or the classpath
	 * copy. Built-in defaults apply to every missing key.
	 */
	public static Configuration readProperties(File propsFile) {
		Configurations configs = new Configurations();
		Configuration defaultConfig = new PropertiesConfiguration();

		try {
			if (propsFile != null && propsFile.exists()) {
				return configs.properties(propsFile);
			}
			if (propsFile != null) {
				logger.warn("Config file {} not found, looking for {} on the classpath", propsFile, IKATS_PROPERTIES_FILE);
			}
			URL resource = IkatsConfiguration.class.getClassLoader().getResource(IKATS_PROPERTIES_FILE);
			if (resource != null) {
				return configs.properties(resource);
			}
		} catch (ConfigurationException e) {
			logger.error("Error loading properties file: " + propsFile, e);
		}
		logger.warn("No {} found, using defaults", IKATS_PROPERTIES_FILE);
		return defaultConfig;
	}

	public static IkatsSession createSession(Configuration props) {
		IkatsSession session = new IkatsSession(props.getString(Constants.HOST, IkatsSession.DEFAULT_HOST),
				props.getInt(Constants.PORT, IkatsSession.DEFAULT_PORT));
		session.setDatamodelPath(props.getString(Constants.DATAMODEL_PATH, IkatsSession.DEFAULT_DATAMODEL_PATH));
		session.setTsdbPath(props.getString(Constants.TSDB_PATH, IkatsSession.DEFAULT_TSDB_PATH));
		session.setCatalogPath(props.getString(Constants.CATALOG_PATH, IkatsSession.DEFAULT_CATALOG_PATH));
		session.setTimeoutSeconds(props.getLong(Constants.HTTP_TIMEOUT_SECONDS, IkatsSession.DEFAULT_TIMEOUT_SECONDS));
		session.setHttpLogLevel(HttpLoggingInterceptor.Level
				.valueOf(props.getString(Constants.HTTP_LOG_LEVEL, HttpLoggingInterceptor.Level.NONE.name()).toUpperCase()));
		session.setReadRetryDelayMillis(props.getLong(Constants.TSDB_READ_RETRY_DELAY_MILLIS,
				IkatsSession.DEFAULT_READ_RETRY_DELAY_MILLIS));
		session.setMetadataChunkSize(props.getInt(Constants.METADATA_CHUNK_SIZE, IkatsSession.DEFAULT_METADATA_CHUNK_SIZE));
		session.setEmulate(props.getBoolean(Constants.EMULATE, false));
		return session;
	}

	public static IkatsSession createSession(File propsFile) {
		return createSession(readProperties(propsFile));
	}
}
