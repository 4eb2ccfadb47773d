package com.ikats.manager;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.ikats.exception.IkatsException;
import com.ikats.exception.IkatsNotFoundException;
import com.ikats.model.DataPoint;
import com.ikats.model.FunctionalIdentifier;
import com.ikats.model.ImportSummary;
import com.ikats.model.MetadataEntry;
import com.ikats.model.ResolvedTsuid;
import com.ikats.store.FidRegistry;
import com.ikats.store.MetadataStore;
import com.ikats.store.PointStore;
import com.ikats.timeseries.ImportFinalizer;
import com.ikats.timeseries.MetadataInheritance;
import com.ikats.timeseries.Timeseries;
import com.ikats.timeseries.TsuidResolver;
import com.ikats.util.IkatsChecks;

public class TimeseriesManager {

	private static Logger logger = LoggerFactory.getLogger(TimeseriesManager.class);

	private final FidRegistry registry;
	private final MetadataStore metadataStore;
	private final PointStore pointStore;
	private final TsuidResolver resolver;
	private final ImportFinalizer finalizer;
	private final MetadataInheritance inheritance;

	public TimeseriesManager(FidRegistry registry, MetadataStore metadataStore, PointStore pointStore,
			TsuidResolver resolver, ImportFinalizer finalizer, MetadataInheritance inheritance) {
		this.registry = registry;
		this.metadataStore = metadataStore;
		this.pointStore = pointStore;
		this.resolver = resolver;
		this.finalizer = finalizer;
		this.inheritance = inheritance;
	}

	/**
	 * A local timeseries. When a FID is given, its TSUID is created right away.
	 */
	public Timeseries newTimeseries(String fid, List<DataPoint> points) throws IOException {
		Timeseries ts = fid == null ? new Timeseries() : createReference(fid);
		ts.setData(points);
		return ts;
	}

	/**
	 * Creates the TSUID of a new FID, before any point is written. Used when several jobs import the
	 * points of the same timeseries.
	 */
	public Timeseries createReference(String fid) throws IOException {
		return new Timeseries(resolver.resolveOrCreate(fid), fid);
	}

	/**
	 * @param metric null for the default one, derived from the import time
	 * @param tags null for the default ones, derived from the import time
	 */
	public ResolvedTsuid createReference(String fid, String metric, Map<String, String> tags) throws IOException {
		return resolver.resolveOrCreate(fid, metric, tags);
	}

	/**
	 * Exactly one of {@code fid} and {@code tsuid} shall be set.
	 */
	public Timeseries get(String fid, String tsuid) throws IOException {
		if ((fid == null) == (tsuid == null)) {
			throw new IllegalArgumentException("fid and tsuid are mutually exclusive");
		}
		Timeseries ts = fid != null ? new Timeseries(registry.tsuidOf(IkatsChecks.checkFid(fid)), fid)
				: new Timeseries(tsuid, registry.fidOf(tsuid));
		loadMetadata(ts);
		return ts;
	}

	/**
	 * Writes the points of the timeseries, creating its TSUID first when missing (which forces the
	 * metadata generation).
	 *
	 * @param parent timeseries the metadata are inherited from, may be null
	 * @return false when an error occurred and {@code raiseException} is not set
	 */
	public boolean save(Timeseries ts, Timeseries parent, boolean generateMetadata, boolean raiseException)
			throws IOException {
		IkatsChecks.checkFid(ts.getFid());
		if (ts.getData().isEmpty()) {
			throw new IllegalArgumentException("No points to save for " + ts.getFid());
		}
		try {
			boolean generate = generateMetadata;
			if (ts.getTsuid() == null) {
				ts.setTsuid(resolver.resolveOrCreate(ts.getFid()));
				generate = true;
			}
			ImportSummary summary = pointStore.writePoints(ts.getTsuid(), ts.getData());
			finalizer.finalizeImport(ts.getTsuid(), summary, parent == null ? null : parent.getTsuid(), generate);
			if (generate) {
				loadMetadata(ts);
			}
			if (summary.isPartial()) {
				logger.warn("{}: only {} points written out of {}", ts, summary.getSuccess(), summary.getSubmitted());
			}
		} catch (IkatsException e) {
			if (raiseException) {
				throw e;
			}
			logger.warn("Timeseries {} not saved: {}", ts, e.getMessage());
			return false;
		}
		return true;
	}

	/**
	 * Deletes the points and metadata. A timeseries used by a dataset is kept.
	 */
	public boolean delete(Timeseries ts, boolean raiseException) throws IOException {
		String tsuid = ts.getTsuid();
		if (tsuid == null) {
			if (ts.getFid() == null) {
				throw new IllegalArgumentException("Timeseries object shall have set at least tsuid or fid");
			}
			try {
				tsuid = registry.tsuidOf(ts.getFid());
			} catch (IkatsException e) {
				if (raiseException) {
					throw e;
				}
				return false;
			}
		}
		return registry.deleteTimeseries(tsuid, raiseException);
	}

	public boolean delete(String tsuid, boolean raiseException) throws IOException {
		return registry.deleteTimeseries(IkatsChecks.checkTsuid(tsuid), raiseException);
	}

	public List<Timeseries> list() throws IOException {
		List<Timeseries> result = new ArrayList<>();
		for (FunctionalIdentifier fid : registry.listTimeseries()) {
			result.add(new Timeseries(fid.getTsuid(), fid.getFuncId()));
		}
		return result;
	}

	/**
	 * @param startDate null for the {@code ikats_start_date} metadata
	 * @param endDate null for the {@code ikats_end_date} metadata
	 */
	public List<DataPoint> fetch(Timeseries ts, Long startDate, Long endDate) throws IOException {
		IkatsChecks.checkTsuid(ts.getTsuid());
		if (startDate == null || endDate == null) {
			if (ts.getMetadata(MetadataEntry.START_DATE) == null || ts.getMetadata(MetadataEntry.END_DATE) == null) {
				loadMetadata(ts);
			}
		}
		long sd = IkatsChecks.checkEpoch(startDate != null ? startDate : dateOf(ts, MetadataEntry.START_DATE),
				"start date");
		long ed = IkatsChecks.checkEpoch(endDate != null ? endDate : dateOf(ts, MetadataEntry.END_DATE), "end date");
		return pointStore.fetchPoints(ts.getTsuid(), sd, ed);
	}

	private static Long dateOf(Timeseries ts, String name) {
		MetadataEntry entry = ts.getMetadata(name);
		return entry == null ? null : entry.getValueAsLong();
	}

	public int inherit(Timeseries ts, Timeseries parent) {
		return inheritance.inherit(ts.getTsuid(), parent.getTsuid());
	}

	/**
	 * @param constraint every name shall match one of its values
	 */
	public List<String> findFromMeta(Map<String, List<String>> constraint) throws IOException {
		return metadataStore.findFromMetadata(constraint);
	}

	/**
	 * @return null when not found and {@code raiseException} is not set
	 */
	public String fidToTsuid(String fid, boolean raiseException) throws IOException {
		IkatsChecks.checkFid(fid);
		try {
			return registry.tsuidOf(fid);
		} catch (IkatsNotFoundException e) {
			if (raiseException) {
				throw e;
			}
			return null;
		}
	}

	public String tsuidToFid(String tsuid, boolean raiseException) throws IOException {
		try {
			return registry.fidOf(tsuid);
		} catch (IkatsException e) {
			if (raiseException) {
				throw e;
			}
			return null;
		}
	}

	public long countPoints(Timeseries ts) throws IOException {
		return pointStore.countPoints(IkatsChecks.checkTsuid(ts.getTsuid()));
	}

	private void loadMetadata(Timeseries ts) throws IOException {
		Map<String, MetadataEntry> metadata = metadataStore.getMetadata(Collections.singletonList(ts.getTsuid()))
				.getOrDefault(ts.getTsuid(), Collections.emptyMap());
		metadata.values().forEach(ts::putMetadata);
	}
}
