package com.ikats.manager;

import java.io.IOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.ikats.datamodel.DatamodelClient;

/**
 * Tables stored by the temporal data manager. A table is a JSON document made of a
 * {@code table_desc} (name, desc), {@code headers} (col, row) and a {@code content} (cells).
 */
public class TableManager {

	private final DatamodelClient datamodelClient;

	public TableManager(DatamodelClient datamodelClient) {
		this.datamodelClient = datamodelClient;
	}

	/**
	 * @param name overrides {@code table_desc.name} when not null
	 * @param description overrides {@code table_desc.desc} when not null
	 */
	public void create(JsonObject data, String name, String description) throws IOException {
		if (name != null || description != null) {
			JsonObject desc = data.getAsJsonObject("table_desc");
			if (desc == null) {
				desc = new JsonObject();
				data.add("table_desc", desc);
			}
			if (name != null) {
				desc.addProperty("name", name);
			}
			if (description != null) {
				desc.addProperty("desc", description);
			}
		}
		datamodelClient.createTable(data);
	}

	/**
	 * @param name null for every table, {@code *} matches any characters
	 */
	public List<JsonObject> list(String name, boolean strict) throws IOException {
		return datamodelClient.listTables(name, strict);
	}

	public JsonObject read(String name) throws IOException {
		return datamodelClient.readTable(name);
	}

	public void delete(String name) throws IOException {
		datamodelClient.deleteTable(name);
	}

	/**
	 * Rows of a table keyed by the value of the {@code obsId} column, each row reduced to the given columns.
	 */
	public static Map<String, Map<String, JsonElement>> extract(JsonObject tableContent, String obsId,
			List<String> items) {
		JsonObject headers = tableContent.getAsJsonObject("headers");
		JsonObject colHeaders = headers == null ? null : headers.getAsJsonObject("col");
		if (colHeaders == null || !colHeaders.has("data")) {
			throw new IllegalArgumentException("Table content shall contain col headers to know the name of columns");
		}
		Map<String, Integer> columns = new HashMap<>();
		JsonArray columnNames = colHeaders.getAsJsonArray("data");
		for (int i = 0; i < columnNames.size(); i++) {
			columns.put(columnNames.get(i).getAsString(), i);
		}

		// first cell of each row comes from the row headers, when present
		List<List<JsonElement>> rows = new ArrayList<>();
		JsonObject rowHeaders = headers.has("row") ? headers.getAsJsonObject("row") : null;
		if (rowHeaders != null && rowHeaders.has("data")) {
			JsonArray rowNames = rowHeaders.getAsJsonArray("data");
			for (int i = 1; i < rowNames.size(); i++) {
				List<JsonElement> row = new ArrayList<>();
				row.add(rowNames.get(i));
				rows.add(row);
			}
		}

		Map<String, Map<String, JsonElement>> results = new LinkedHashMap<>();
		JsonArray cells = tableContent.getAsJsonObject("content").getAsJsonArray("cells");
		for (int line = 0; line < cells.size(); line++) {
			if (rows.size() <= line) {
				rows.add(new ArrayList<>());
			}
			List<JsonElement> row = rows.get(line);
			cells.get(line).getAsJsonArray().forEach(row::add);
			String key = row.get(column(columns, obsId)).getAsString();
			if (results.containsKey(key)) {
				throw new IllegalArgumentException(String.format("Key %s is not unique", obsId));
			}
			Map<String, JsonElement> values = new LinkedHashMap<>();
			for (String item : items) {
				values.put(item, row.get(column(columns, item)));
			}
			results.put(key, values);
		}
		return results;
	}

	private static int column(Map<String, Integer> columns, String name) {
		Integer index = columns.get(name);
		if (index == null) {
			throw new IllegalArgumentException("Unknown column " + name);
		}
		return index;
	}
}
