package com.ikats.store;

import java.io.IOException;
import java.util.Collection;
import java.util.List;
import java.util.Map;

import com.ikats.model.MetadataEntry;
import com.ikats.model.MetadataType;

public interface MetadataStore {

	/**
	 * Typed metadata per TSUID. Every requested TSUID is a key of the result, possibly with an empty map.
	 */
	Map<String, Map<String, MetadataEntry>> getMetadata(Collection<String> tsuids) throws IOException;

	/**
	 * @param forceUpdate update the entry instead of failing when it already exists
	 */
	void createMetadata(String tsuid, String name, String value, MetadataType type, boolean forceUpdate)
			throws IOException;

	/**
	 * @param forceCreate create the entry instead of failing when it does not exist
	 */
	void updateMetadata(String tsuid, String name, String value, MetadataType type, boolean forceCreate)
			throws IOException;

	boolean deleteMetadata(String tsuid, String name, boolean raiseException) throws IOException;

	/**
	 * TSUIDs whose metadata match every constraint; a constraint with several values matches any of them.
	 */
	List<String> findFromMetadata(Map<String, List<String>> constraint) throws IOException;
}
