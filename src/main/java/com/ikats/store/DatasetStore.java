package com.ikats.store;

import java.io.IOException;
import java.util.Collection;
import java.util.List;

import com.ikats.model.Dataset;

public interface DatasetStore {

	/**
	 * @throws com.ikats.exception.IkatsConflictException when the name is already used
	 */
	void createDataset(String name, String description, Collection<String> tsuids) throws IOException;

	/**
	 * @throws com.ikats.exception.IkatsNotFoundException when no dataset has this name
	 */
	Dataset readDataset(String name) throws IOException;

	/**
	 * Name and description only, the timeseries are not filled.
	 */
	List<Dataset> listDatasets() throws IOException;

	/**
	 * @param deep also remove the timeseries that belong to no other dataset
	 */
	boolean deleteDataset(String name, boolean deep, boolean raiseException) throws IOException;
}
