package com.ikats.manager;

import java.io.IOException;
import java.util.Collections;
import java.util.Map;

import com.ikats.exception.IkatsException;
import com.ikats.model.MetadataEntry;
import com.ikats.model.MetadataType;
import com.ikats.store.MetadataStore;

public class MetadataManager {

	private final MetadataStore metadataStore;

	public MetadataManager(MetadataStore metadataStore) {
		this.metadataStore = metadataStore;
	}

	/**
	 * Creates or overwrites a metadata.
	 *
	 * @return false when an error occurred and {@code raiseException} is not set
	 */
	public boolean save(String tsuid, String name, String value, MetadataType type, boolean raiseException)
			throws IOException {
		checkValue(value, type);
		try {
			metadataStore.createMetadata(tsuid, name, value, type, true);
		} catch (IkatsException e) {
			if (raiseException) {
				throw e;
			}
			return false;
		}
		return true;
	}

	public boolean delete(String tsuid, String name, boolean raiseException) throws IOException {
		return metadataStore.deleteMetadata(tsuid, name, raiseException);
	}

	/**
	 * Typed metadata of one timeseries, keyed by name.
	 */
	public Map<String, MetadataEntry> fetch(String tsuid) throws IOException {
		return metadataStore.getMetadata(Collections.singletonList(tsuid))
				.getOrDefault(tsuid, Collections.emptyMap());
	}

	/**
	 * Numbers and dates shall parse; dates are epoch milliseconds.
	 */
	static void checkValue(String value, MetadataType type) {
		if (value == null) {
			throw new IllegalArgumentException("Metadata value shall be set");
		}
		try {
			if (type == MetadataType.NUMBER) {
				Double.parseDouble(value);
			} else if (type == MetadataType.DATE) {
				Long.parseLong(value);
			}
		} catch (NumberFormatException e) {
			throw new IllegalArgumentException(String.format("Metadata value '%s' is not a valid %s", value,
					type.getValue()), e);
		}
	}
}
