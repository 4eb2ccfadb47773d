package com.ikats.store.memory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.apache.commons.lang3.StringUtils;

import com.ikats.exception.IkatsConflictException;
import com.ikats.exception.IkatsNotFoundException;
import com.ikats.model.MetadataEntry;
import com.ikats.model.MetadataType;
import com.ikats.store.MetadataStore;
import com.ikats.util.IkatsChecks;

public class InMemoryMetadataStore implements MetadataStore {

	private final Map<String, Map<String, MetadataEntry>> metadata = new LinkedHashMap<>();

	@Override
	public Map<String, Map<String, MetadataEntry>> getMetadata(Collection<String> tsuids) {
		Map<String, Map<String, MetadataEntry>> result = new LinkedHashMap<>();
		for (String tsuid : tsuids) {
			result.put(tsuid, new LinkedHashMap<>(metadata.getOrDefault(tsuid, Collections.emptyMap())));
		}
		return result;
	}

	@Override
	public void createMetadata(String tsuid, String name, String value, MetadataType type, boolean forceUpdate) {
		check(tsuid, name, value);
		Map<String, MetadataEntry> entries = metadata.computeIfAbsent(tsuid, k -> new LinkedHashMap<>());
		if (entries.containsKey(name) && !forceUpdate) {
			throw new IkatsConflictException(String.format("Can't set metadata %s to %s (for tsuid %s)", name, value,
					tsuid));
		}
		entries.put(name, new MetadataEntry(name, value, type));
	}

	@Override
	public void updateMetadata(String tsuid, String name, String value, MetadataType type, boolean forceCreate) {
		check(tsuid, name, value);
		Map<String, MetadataEntry> entries = metadata.get(tsuid);
		if ((entries == null || !entries.containsKey(name)) && !forceCreate) {
			throw new IkatsNotFoundException(String.format("TSUID:%s - Metadata %s doesn't exist", tsuid, name));
		}
		metadata.computeIfAbsent(tsuid, k -> new LinkedHashMap<>()).put(name, new MetadataEntry(name, value, type));
	}

	@Override
	public boolean deleteMetadata(String tsuid, String name, boolean raiseException) {
		IkatsChecks.checkTsuid(tsuid);
		Map<String, MetadataEntry> entries = metadata.get(tsuid);
		if (entries == null || entries.remove(name) == null) {
			if (raiseException) {
				throw new IkatsNotFoundException(String.format("Metadata '%s' not found for TS '%s'", name, tsuid));
			}
			return false;
		}
		return true;
	}

	@Override
	public List<String> findFromMetadata(Map<String, List<String>> constraint) {
		List<String> result = new ArrayList<>();
		for (Map.Entry<String, Map<String, MetadataEntry>> ts : metadata.entrySet()) {
			if (matches(ts.getValue(), constraint)) {
				result.add(ts.getKey());
			}
		}
		return result;
	}

	private static boolean matches(Map<String, MetadataEntry> entries, Map<String, List<String>> constraint) {
		if (constraint == null) {
			return true;
		}
		for (Map.Entry<String, List<String>> criterion : constraint.entrySet()) {
			MetadataEntry entry = entries.get(criterion.getKey());
			if (entry == null || !criterion.getValue().contains(entry.getValue())) {
				return false;
			}
		}
		return true;
	}

	/**
	 * Drops every metadata of a deleted timeseries.
	 */
	public void removeAll(String tsuid) {
		metadata.remove(tsuid);
	}

	private static void check(String tsuid, String name, String value) {
		IkatsChecks.checkTsuid(tsuid);
		if (StringUtils.isEmpty(name)) {
			throw new IllegalArgumentException("name must not be empty");
		}
		if (StringUtils.isEmpty(value)) {
			throw new IllegalArgumentException("value must not be empty");
		}
	}
}
