package com.ikats.store.memory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.ikats.exception.IkatsConflictException;
import com.ikats.exception.IkatsException;
import com.ikats.exception.IkatsNotFoundException;
import com.ikats.model.Dataset;
import com.ikats.model.FunctionalIdentifier;
import com.ikats.store.DatasetStore;
import com.ikats.store.FidRegistry;
import com.ikats.util.IkatsChecks;

/**
 * Datasets kept in memory; the FIDs of the timeseries come from the given registry.
 */
public class InMemoryDatasetStore implements DatasetStore {

	private final FidRegistry registry;
	private final Map<String, Dataset> datasets = new LinkedHashMap<>();

	public InMemoryDatasetStore(FidRegistry registry) {
		this.registry = registry;
	}

	@Override
	public void createDataset(String name, String description, Collection<String> tsuids) throws IOException {
		IkatsChecks.checkDatasetName(name);
		if (datasets.containsKey(name)) {
			throw new IkatsConflictException(String.format("Dataset %s already exists in database", name));
		}
		List<FunctionalIdentifier> fids = new ArrayList<>();
		for (String tsuid : tsuids) {
			fids.add(new FunctionalIdentifier(tsuid, registry.fidOf(tsuid)));
		}
		datasets.put(name, new Dataset(name, description, fids));
	}

	@Override
	public Dataset readDataset(String name) {
		IkatsChecks.checkDatasetName(name);
		Dataset dataset = datasets.get(name);
		if (dataset == null) {
			throw new IkatsNotFoundException(String.format("Dataset %s not found in database", name));
		}
		return new Dataset(dataset.getName(), dataset.getDescription(), new ArrayList<>(dataset.getFids()));
	}

	@Override
	public List<Dataset> listDatasets() {
		List<Dataset> result = new ArrayList<>();
		datasets.values().forEach(d -> result.add(new Dataset(d.getName(), d.getDescription(), new ArrayList<>())));
		return result;
	}

	@Override
	public boolean deleteDataset(String name, boolean deep, boolean raiseException) throws IOException {
		IkatsChecks.checkDatasetName(name);
		Dataset removed = datasets.remove(name);
		if (removed == null) {
			if (raiseException) {
				throw new IkatsNotFoundException(String.format("Dataset %s not found in database", name));
			}
			return false;
		}
		if (deep) {
			for (FunctionalIdentifier fid : removed.getFids()) {
				if (!isUsed(fid.getTsuid())) {
					try {
						registry.deleteTimeseries(fid.getTsuid(), true);
					} catch (IkatsException e) {
						if (raiseException) {
							throw e;
						}
						return false;
					}
				}
			}
		}
		return true;
	}

	private boolean isUsed(String tsuid) {
		return datasets.values().stream()
				.anyMatch(d -> d.getFids().stream().anyMatch(f -> tsuid.equals(f.getTsuid())));
	}
}
