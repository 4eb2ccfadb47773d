package com.ikats.datamodel;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import com.google.gson.Gson;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.ikats.config.IkatsSession;
import com.ikats.exception.IkatsConflictException;
import com.ikats.exception.IkatsException;
import com.ikats.exception.IkatsNotFoundException;
import com.ikats.exception.MalformedResponseException;
import com.ikats.http.RestClient;
import com.ikats.http.RestResponse;
import com.ikats.http.ServiceGenerator;
import com.ikats.http.StatusChecks;
import com.ikats.model.Dataset;
import com.ikats.model.FunctionalIdentifier;
import com.ikats.model.MetadataEntry;
import com.ikats.model.MetadataType;
import com.ikats.store.DatasetStore;
import com.ikats.store.FidRegistry;
import com.ikats.store.MetadataStore;
import com.ikats.util.IkatsChecks;

import okhttp3.HttpUrl;

/**
 * Client of the temporal data manager: FID registry, metadata, datasets and tables.
 */
public class DatamodelClient extends RestClient implements FidRegistry, MetadataStore, DatasetStore {

	private static Logger logger = LoggerFactory.getLogger(DatamodelClient.class);

	private final DatamodelApi api;
	private final HttpUrl baseUrl;
	private final Gson gson;
	private final int chunkSize;

	public DatamodelClient(IkatsSession session, ServiceGenerator generator) {
		String root = StringUtils.appendIfMissing(session.getDatamodelUrl(), "/") + DatamodelApi.ROOT;
		this.api = generator.createService(DatamodelApi.class, root);
		this.baseUrl = HttpUrl.get(root);
		this.gson = generator.getGson();
		this.chunkSize = session.getMetadataChunkSize();
	}

	// FID registry

	@Override
	public Optional<String> findTsuid(String fid) throws IOException {
		IkatsChecks.checkFid(fid);
		RestResponse response = send(api.searchFunctionalIdentifiers(fid));
		if (response.getStatusCode() == 404) {
			return Optional.empty();
		}
		StatusChecks.check(response);
		for (JsonElement element : response.jsonArray()) {
			FunctionalIdentifier match = gson.fromJson(element, FunctionalIdentifier.class);
			if (fid.equals(match.getFuncId())) {
				return Optional.ofNullable(match.getTsuid());
			}
		}
		return Optional.empty();
	}

	@Override
	public String fidOf(String tsuid) throws IOException {
		IkatsChecks.checkTsuid(tsuid);
		RestResponse response = send(api.getFunctionalIdentifier(tsuid));
		StatusChecks.is404(response, "No FID for TSUID " + tsuid);
		StatusChecks.check(response);
		JsonElement funcId = response.jsonObject().get(MetadataEntry.FUNC_ID);
		if (funcId == null || funcId.isJsonNull()) {
			throw new IkatsNotFoundException("No FID for TSUID " + tsuid);
		}
		return funcId.getAsString();
	}

	@Override
	public void registerFid(String tsuid, String fid) throws IOException {
		IkatsChecks.checkTsuid(tsuid);
		IkatsChecks.checkFid(fid);
		RestResponse response = send(api.importFunctionalIdentifier(tsuid, fid));
		StatusChecks.is409(response, String.format("TSUID:%s - FID already exists (not updated) %s", tsuid, fid));
		StatusChecks.check(response);
		logger.debug("TSUID:{} - FID {} registered", tsuid, fid);
	}

	@Override
	public boolean deleteFid(String tsuid, boolean raiseException) throws IOException {
		IkatsChecks.checkTsuid(tsuid);
		RestResponse response = send(api.deleteFunctionalIdentifier(tsuid));
		try {
			StatusChecks.is404(response, "No FID for TSUID " + tsuid);
			StatusChecks.check(response);
		} catch (IkatsException e) {
			logger.warn("TSUID [{}] - FID not deleted: {}", tsuid, response);
			if (raiseException) {
				throw e;
			}
			return false;
		}
		logger.info("TSUID:{} - FID deleted", tsuid);
		return true;
	}

	@Override
	public List<FunctionalIdentifier> listTimeseries() throws IOException {
		RestResponse response = send(api.listFunctionalIdentifiers());
		if (response.getStatusCode() == 404) {
			return ImmutableList.of();
		}
		StatusChecks.check(response);
		ImmutableList.Builder<FunctionalIdentifier> result = ImmutableList.builder();
		for (JsonElement element : response.jsonArray()) {
			result.add(gson.fromJson(element, FunctionalIdentifier.class));
		}
		return result.build();
	}

	@Override
	public boolean deleteTimeseries(String tsuid, boolean raiseException) throws IOException {
		IkatsChecks.checkTsuid(tsuid);
		RestResponse response = send(api.removeTimeseries(tsuid));
		try {
			StatusChecks.is404(response, String.format("Timeseries %s not found in database", tsuid));
			StatusChecks.is409(response, String.format("%s belongs to -at least- one dataset", tsuid));
			StatusChecks.check(response);
		} catch (IkatsException e) {
			if (raiseException) {
				throw e;
			}
			logger.warn("Timeseries {} not deleted: {}", tsuid, e.getMessage());
			return false;
		}
		return true;
	}

	// Metadata

	@Override
	public Map<String, Map<String, MetadataEntry>> getMetadata(Collection<String> tsuids) throws IOException {
		Map<String, Map<String, MetadataEntry>> result = new LinkedHashMap<>();
		// the tsuid list travels in the URL, which servers commonly limit to 8KB
		for (List<String> chunk : Lists.partition(new ArrayList<>(tsuids), chunkSize)) {
			for (String tsuid : chunk) {
				result.put(tsuid, new LinkedHashMap<>());
			}
			RestResponse response = send(api.lookupMetadata(String.join(",", chunk)));
			if (response.getStatusCode() == 414) {
				logger.error("The size of the request is too big, lower ikats.metadata.chunkSize (currently {})", chunkSize);
			}
			if (response.getStatusCode() == 404) {
				continue;
			}
			StatusChecks.check(response);
			JsonElement json = response.json();
			if (!json.isJsonArray()) {
				// "{}" when nothing matches
				continue;
			}
			for (JsonElement element : json.getAsJsonArray()) {
				JsonObject content = element.getAsJsonObject();
				String tsuid = string(content, "tsuid");
				String name = string(content, "name");
				String dtype = content.has("dtype") ? string(content, "dtype") : MetadataType.STRING.getValue();
				result.computeIfAbsent(tsuid, k -> new LinkedHashMap<>()).put(name,
						new MetadataEntry(name, string(content, "value"), MetadataType.fromValue(dtype)));
			}
		}
		return result;
	}

	@Override
	public void createMetadata(String tsuid, String name, String value, MetadataType type, boolean forceUpdate)
			throws IOException {
		checkMetadata(tsuid, name, value);
		RestResponse response = send(api.importMetadata(tsuid, name, value, type.getValue()));
		if (response.getStatusCode() == 409) {
			if (forceUpdate) {
				updateMetadata(tsuid, name, value, type, false);
				return;
			}
			throw new IkatsConflictException(String.format("Can't set metadata %s to %s (for tsuid %s)", name, value,
					tsuid));
		}
		StatusChecks.check(response);
	}

	@Override
	public void updateMetadata(String tsuid, String name, String value, MetadataType type, boolean forceCreate)
			throws IOException {
		checkMetadata(tsuid, name, value);
		RestResponse response = send(api.updateMetadata(tsuid, name, value));
		if (response.getStatusCode() == 404) {
			if (forceCreate) {
				createMetadata(tsuid, name, value, type, false);
				return;
			}
			throw new IkatsNotFoundException(String.format("TSUID:%s - Metadata %s doesn't exist", tsuid, name));
		}
		StatusChecks.check(response);
	}

	@Override
	public boolean deleteMetadata(String tsuid, String name, boolean raiseException) throws IOException {
		IkatsChecks.checkTsuid(tsuid);
		if (StringUtils.isEmpty(name)) {
			throw new IllegalArgumentException("name must not be empty");
		}
		RestResponse response = send(api.deleteMetadata(tsuid, name));
		try {
			StatusChecks.is404(response, String.format("Metadata '%s' not found for TS '%s'", name, tsuid));
			StatusChecks.check(response);
		} catch (IkatsException e) {
			if (raiseException) {
				throw e;
			}
			return false;
		}
		return true;
	}

	@Override
	public List<String> findFromMetadata(Map<String, List<String>> constraint) throws IOException {
		HttpUrl.Builder url = baseUrl.newBuilder().addPathSegments("metadata/tsmatch");
		if (constraint != null) {
			constraint.forEach((name, values) -> values.forEach(v -> url.addQueryParameter(name, v)));
		}
		RestResponse response = send(api.tsMatch(url.build()));
		if (response.getStatusCode() == 404) {
			return ImmutableList.of();
		}
		StatusChecks.check(response);
		ImmutableList.Builder<String> result = ImmutableList.builder();
		for (JsonElement element : response.jsonArray()) {
			if (element.isJsonObject()) {
				result.add(string(element.getAsJsonObject(), "tsuid"));
			} else {
				result.add(element.getAsString());
			}
		}
		return result.build();
	}

	private static void checkMetadata(String tsuid, String name, String value) {
		IkatsChecks.checkTsuid(tsuid);
		if (StringUtils.isEmpty(name)) {
			throw new IllegalArgumentException("name must not be empty");
		}
		if (StringUtils.isEmpty(value)) {
			throw new IllegalArgumentException("value must not be empty");
		}
	}

	// Datasets

	@Override
	public void createDataset(String name, String description, Collection<String> tsuids) throws IOException {
		IkatsChecks.checkDatasetName(name);
		RestResponse response = send(api.importDataset(name, name, StringUtils.defaultString(description),
				String.join(",", tsuids)));
		StatusChecks.is409(response, String.format("Dataset %s already exists in database", name));
		StatusChecks.check(response);
	}

	@Override
	public Dataset readDataset(String name) throws IOException {
		IkatsChecks.checkDatasetName(name);
		RestResponse response = send(api.getDataset(name));
		StatusChecks.is404(response, String.format("Dataset %s not found in database", name));
		StatusChecks.check(response);
		JsonObject json = response.jsonObject();
		List<FunctionalIdentifier> fids = new ArrayList<>();
		JsonElement fidsJson = json.get("fids");
		if (fidsJson != null && fidsJson.isJsonArray()) {
			for (JsonElement element : fidsJson.getAsJsonArray()) {
				fids.add(gson.fromJson(element, FunctionalIdentifier.class));
			}
		}
		String description = json.has("description") && !json.get("description").isJsonNull()
				? json.get("description").getAsString()
				: null;
		return new Dataset(name, description, fids);
	}

	@Override
	public List<Dataset> listDatasets() throws IOException {
		RestResponse response = send(api.listDatasets());
		if (response.getStatusCode() == 404) {
			return ImmutableList.of();
		}
		StatusChecks.check(response);
		ImmutableList.Builder<Dataset> result = ImmutableList.builder();
		for (JsonElement element : response.jsonArray()) {
			Dataset dataset = gson.fromJson(element, Dataset.class);
			dataset.setFids(new ArrayList<>());
			result.add(dataset);
		}
		return result.build();
	}

	@Override
	public boolean deleteDataset(String name, boolean deep, boolean raiseException) throws IOException {
		IkatsChecks.checkDatasetName(name);
		RestResponse response = send(api.removeDataset(name, deep ? Boolean.TRUE : null));
		try {
			StatusChecks.is404(response, String.format("Dataset %s not found in database", name));
			StatusChecks.check(response);
		} catch (IkatsException e) {
			if (raiseException) {
				throw e;
			}
			return false;
		}
		return true;
	}

	// Tables

	/**
	 * @param table the table content, named by {@code table_desc.name}
	 */
	public void createTable(JsonObject table) throws IOException {
		String name = tableName(table);
		RestResponse response = send(api.createTable(table));
		StatusChecks.is400(response, "Invalid table " + name + ": " + response.getContent());
		StatusChecks.is409(response, String.format("Table %s already exist in database", name));
		StatusChecks.check(response);
	}

	/**
	 * @param name filter on the name, {@code *} matches any characters; null lists every table
	 * @param strict exact match of the name
	 */
	public List<JsonObject> listTables(String name, boolean strict) throws IOException {
		RestResponse response = send(api.listTables(name, name == null ? null : strict));
		if (response.getStatusCode() == 404) {
			return ImmutableList.of();
		}
		StatusChecks.check(response);
		ImmutableList.Builder<JsonObject> result = ImmutableList.builder();
		for (JsonElement element : response.jsonArray()) {
			result.add(element.getAsJsonObject());
		}
		return result.build();
	}

	public JsonObject readTable(String name) throws IOException {
		checkTableName(name);
		RestResponse response = send(api.readTable(name));
		StatusChecks.is400(response, "Wrong input: [" + name + "]");
		StatusChecks.is404(response, String.format("Table %s not found", name));
		StatusChecks.check(response);
		return response.jsonObject();
	}

	public void deleteTable(String name) throws IOException {
		checkTableName(name);
		RestResponse response = send(api.deleteTable(name));
		StatusChecks.is400(response, "Wrong input: [" + name + "]");
		StatusChecks.is404(response, String.format("Table %s not found", name));
		StatusChecks.check(response);
	}

	static String tableName(JsonObject table) {
		JsonObject desc = table == null ? null : table.getAsJsonObject("table_desc");
		if (desc == null || !desc.has("name")) {
			throw new IllegalArgumentException("Table shall have a table_desc.name");
		}
		String name = desc.get("name").getAsString();
		checkTableName(name);
		return name;
	}

	private static void checkTableName(String name) {
		if (StringUtils.isBlank(name)) {
			throw new IllegalArgumentException("Table name shall be set");
		}
	}

	private static String string(JsonObject object, String member) {
		JsonElement element = object.get(member);
		if (element == null || element.isJsonNull()) {
			throw new MalformedResponseException("Missing '" + member + "' in " + object);
		}
		return element.getAsString();
	}
}
