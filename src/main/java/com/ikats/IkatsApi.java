package com.ikats;

import java.io.Closeable;
import java.time.Clock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.ikats.catalog.CatalogClient;
import com.ikats.config.IkatsSession;
import com.ikats.datamodel.DatamodelClient;
import com.ikats.http.ServiceGenerator;
import com.ikats.manager.DatasetManager;
import com.ikats.manager.MetadataManager;
import com.ikats.manager.OperatorManager;
import com.ikats.manager.TableManager;
import com.ikats.manager.TimeseriesManager;
import com.ikats.opentsdb.OpenTsdbClient;
import com.ikats.store.DatasetStore;
import com.ikats.store.FidRegistry;
import com.ikats.store.MetadataStore;
import com.ikats.store.PointStore;
import com.ikats.store.UidAssigner;
import com.ikats.store.memory.InMemoryDatasetStore;
import com.ikats.store.memory.InMemoryFidRegistry;
import com.ikats.store.memory.InMemoryMetadataStore;
import com.ikats.store.memory.InMemoryTimeseriesStore;
import com.ikats.timeseries.ImportFinalizer;
import com.ikats.timeseries.MetadataInheritance;
import com.ikats.timeseries.MetricTagsGenerator;
import com.ikats.timeseries.TsuidResolver;

/**
 * Entry point of the API. Talks to the IKATS backends of the session, or to in-memory stores when
 * the session emulates them. Tables and operators are not emulated.
 */
public class IkatsApi implements Closeable {

	private static Logger logger = LoggerFactory.getLogger(IkatsApi.class);

	private final IkatsSession session;
	private final ServiceGenerator generator;

	private final TimeseriesManager timeseriesManager;
	private final MetadataManager metadataManager;
	private final DatasetManager datasetManager;
	private final TableManager tableManager;
	private final OperatorManager operatorManager;

	public IkatsApi(IkatsSession session) {
		this(session, Clock.systemDefaultZone());
	}

	public IkatsApi(IkatsSession session, Clock clock) {
		this.session = session;

		FidRegistry registry;
		MetadataStore metadataStore;
		UidAssigner uidAssigner;
		PointStore pointStore;
		DatasetStore datasetStore;

		if (session.isEmulate()) {
			logger.info("Emulating the IKATS backends in memory");
			this.generator = null;
			InMemoryFidRegistry memoryRegistry = new InMemoryFidRegistry();
			InMemoryMetadataStore memoryMetadata = new InMemoryMetadataStore();
			InMemoryTimeseriesStore memoryPoints = new InMemoryTimeseriesStore();
			memoryRegistry.addRemovalListener(memoryMetadata::removeAll);
			memoryRegistry.addRemovalListener(memoryPoints::removeAll);
			registry = memoryRegistry;
			metadataStore = memoryMetadata;
			uidAssigner = memoryPoints;
			pointStore = memoryPoints;
			datasetStore = new InMemoryDatasetStore(memoryRegistry);
			this.tableManager = null;
			this.operatorManager = null;
		} else {
			logger.debug("Connecting to {}", session);
			this.generator = new ServiceGenerator(session.getTimeoutSeconds(), session.getHttpLogLevel());
			DatamodelClient datamodelClient = new DatamodelClient(session, generator);
			OpenTsdbClient tsdbClient = new OpenTsdbClient(session, generator);
			registry = datamodelClient;
			metadataStore = datamodelClient;
			uidAssigner = tsdbClient;
			pointStore = tsdbClient;
			datasetStore = datamodelClient;
			this.tableManager = new TableManager(datamodelClient);
			this.operatorManager = new OperatorManager(new CatalogClient(session, generator));
		}

		MetadataInheritance inheritance = new MetadataInheritance(metadataStore);
		TsuidResolver resolver = new TsuidResolver(registry, uidAssigner, new MetricTagsGenerator(clock));
		ImportFinalizer finalizer = new ImportFinalizer(metadataStore, inheritance);
		this.timeseriesManager = new TimeseriesManager(registry, metadataStore, pointStore, resolver, finalizer,
				inheritance);
		this.metadataManager = new MetadataManager(metadataStore);
		this.datasetManager = new DatasetManager(datasetStore);
	}

	public IkatsSession getSession() {
		return session;
	}

	public boolean isEmulated() {
		return session.isEmulate();
	}

	public TimeseriesManager ts() {
		return timeseriesManager;
	}

	public MetadataManager md() {
		return metadataManager;
	}

	public DatasetManager ds() {
		return datasetManager;
	}

	public TableManager table() {
		if (tableManager == null) {
			throw new UnsupportedOperationException("Tables are not available in emulation mode");
		}
		return tableManager;
	}

	public OperatorManager op() {
		if (operatorManager == null) {
			throw new UnsupportedOperationException("Operators are not available in emulation mode");
		}
		return operatorManager;
	}

	@Override
	public void close() {
		if (generator != null) {
			generator.shutdown();
		}
	}
}
