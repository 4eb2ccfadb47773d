package com.ikats.timeseries;

import java.io.IOException;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.ikats.model.DataPoint;
import com.ikats.model.ImportSummary;
import com.ikats.model.MetadataEntry;
import com.ikats.model.MetadataType;
import com.ikats.store.MetadataStore;

/**
 * Intrinsic metadata of a timeseries after a point import.
 * <p>
 * Start and end dates only widen the known range: a re-import of an earlier chunk never moves the end
 * date back. The point count is overwritten by the count of the latest import, it is not cumulative.
 */
public class ImportFinalizer {

	private static Logger logger = LoggerFactory.getLogger(ImportFinalizer.class);

	private final MetadataStore metadataStore;
	private final MetadataInheritance inheritance;

	public ImportFinalizer(MetadataStore metadataStore, MetadataInheritance inheritance) {
		this.metadataStore = metadataStore;
		this.inheritance = inheritance;
	}

	/**
	 * @param points imported points in ascending order, they are not sorted here
	 * @param success count of points the store accepted
	 */
	public void finalizeImport(String tsuid, List<DataPoint> points, int success, String parentTsuid,
			boolean generateMetadata) throws IOException {
		if (points == null || points.isEmpty()) {
			throw new IllegalArgumentException("No points imported for " + tsuid);
		}
		ImportSummary summary = new ImportSummary(points.get(0).getTimestamp(),
				points.get(points.size() - 1).getTimestamp(), points.size(), success);
		finalizeImport(tsuid, summary, parentTsuid, generateMetadata);
	}

	/**
	 * @param parentTsuid null when nothing is inherited
	 */
	public void finalizeImport(String tsuid, ImportSummary summary, String parentTsuid, boolean generateMetadata)
			throws IOException {
		if (generateMetadata) {
			Map<String, MetadataEntry> current = metadataStore.getMetadata(Collections.singletonList(tsuid))
					.getOrDefault(tsuid, Collections.emptyMap());

			MetadataEntry startDate = current.get(MetadataEntry.START_DATE);
			if (startDate == null || startDate.getValueAsLong() > summary.getStartDate()) {
				set(tsuid, MetadataEntry.START_DATE, summary.getStartDate(), MetadataType.DATE);
			}
			MetadataEntry endDate = current.get(MetadataEntry.END_DATE);
			if (endDate == null || endDate.getValueAsLong() < summary.getEndDate()) {
				set(tsuid, MetadataEntry.END_DATE, summary.getEndDate(), MetadataType.DATE);
			}
			set(tsuid, MetadataEntry.NB_POINTS, summary.getSuccess(), MetadataType.NUMBER);
		}
		if (parentTsuid != null) {
			inheritance.inherit(tsuid, parentTsuid);
		}
	}

	private void set(String tsuid, String name, long value, MetadataType type) throws IOException {
		logger.debug("{}: {} = {}", tsuid, name, value);
		metadataStore.updateMetadata(tsuid, name, String.valueOf(value), type, true);
	}
}
