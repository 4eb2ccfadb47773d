package com.ikats.manager;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import com.ikats.exception.IkatsConflictException;
import com.ikats.exception.IkatsException;
import com.ikats.exception.IkatsInputException;
import com.ikats.exception.IkatsNotFoundException;
import com.ikats.model.Dataset;
import com.ikats.model.FunctionalIdentifier;
import com.ikats.store.DatasetStore;
import com.ikats.timeseries.Timeseries;
import com.ikats.util.IkatsChecks;

public class DatasetManager {

	private final DatasetStore datasetStore;

	public DatasetManager(DatasetStore datasetStore) {
		this.datasetStore = datasetStore;
	}

	/**
	 * A local dataset, checked not to exist yet.
	 */
	public Dataset newDataset(String name, String description, List<Timeseries> timeseries) throws IOException {
		try {
			datasetStore.readDataset(name);
		} catch (IkatsNotFoundException e) {
			return new Dataset(name, description, toFids(timeseries));
		}
		throw new IkatsConflictException("Dataset " + name + " already exists");
	}

	/**
	 * Creation only, a dataset can't be updated.
	 */
	public boolean save(Dataset dataset, boolean raiseException) throws IOException {
		IkatsChecks.checkDatasetName(dataset.getName());
		if (dataset.getFids().isEmpty()) {
			throw new IllegalArgumentException("No TS to save");
		}
		List<String> tsuids = new ArrayList<>();
		for (FunctionalIdentifier fid : dataset.getFids()) {
			if (fid.getTsuid() == null) {
				throw new IkatsInputException(String.format("TS %s doesn't have a TSUID", fid.getFuncId()));
			}
			tsuids.add(fid.getTsuid());
		}
		try {
			datasetStore.createDataset(dataset.getName(), dataset.getDescription(), tsuids);
		} catch (IkatsException e) {
			if (raiseException) {
				throw e;
			}
			return false;
		}
		return true;
	}

	public Dataset get(String name) throws IOException {
		return datasetStore.readDataset(name);
	}

	public List<Timeseries> timeseriesOf(Dataset dataset) throws IOException {
		List<Timeseries> result = new ArrayList<>();
		for (FunctionalIdentifier fid : datasetStore.readDataset(dataset.getName()).getFids()) {
			result.add(new Timeseries(fid.getTsuid(), fid.getFuncId()));
		}
		return result;
	}

	/**
	 * @param deep also delete the timeseries used by no other dataset
	 */
	public boolean delete(String name, boolean deep, boolean raiseException) throws IOException {
		return datasetStore.deleteDataset(name, deep, raiseException);
	}

	public List<Dataset> list() throws IOException {
		return datasetStore.listDatasets();
	}

	private static List<FunctionalIdentifier> toFids(List<Timeseries> timeseries) {
		List<FunctionalIdentifier> fids = new ArrayList<>();
		if (timeseries != null) {
			timeseries.forEach(ts -> fids.add(new FunctionalIdentifier(ts.getTsuid(), ts.getFid())));
		}
		return fids;
	}
}
