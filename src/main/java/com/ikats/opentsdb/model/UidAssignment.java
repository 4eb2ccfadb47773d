package com.ikats.opentsdb.model;

import java.util.Map;
import java.util.regex.Pattern;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.ikats.exception.MalformedResponseException;

/**
 * Answer of a uid assignment. For each type, a name is either in the type bucket ({@code metric},
 * {@code tagk}, {@code tagv}) when its UID was just created, or in the {@code <type>_errors} bucket with a
 * message ending with the already allocated UID.
 * <pre>
 * {"metric": {"sys.cpu": "000042"},
 *  "tagk_errors": {"host": "Name already exists with UID: 000001"}}
 * </pre>
 */
public class UidAssignment {

	private static final Pattern HEX = Pattern.compile("[0-9A-Fa-f]+");

	private final JsonObject json;

	public UidAssignment(JsonObject json) {
		this.json = json;
	}

	public String metricUid(String metric) {
		return uidOf(UidType.METRIC, metric);
	}

	public String tagKeyUid(String tagKey) {
		return uidOf(UidType.TAGK, tagKey);
	}

	public String tagValueUid(String tagValue) {
		return uidOf(UidType.TAGV, tagValue);
	}

	public String uidOf(UidType type, String name) {
		JsonObject created = bucket(type.getValue());
		if (created != null && created.has(name)) {
			return created.get(name).getAsString();
		}
		JsonObject errors = bucket(type.getErrorsBucket());
		if (errors != null && errors.has(name)) {
			String message = errors.get(name).getAsString();
			int colon = message.indexOf(':');
			String uid = colon < 0 ? "" : message.substring(colon + 1).trim();
			if (!isHex(uid)) {
				throw new MalformedResponseException(String.format(
						"UID assignment of %s '%s' returned a malformed UID: %s", type.getValue(), name, message));
			}
			return uid;
		}
		throw new MalformedResponseException(
				String.format("UID assignment did not answer for %s '%s': %s", type.getValue(), name, json));
	}

	private JsonObject bucket(String name) {
		JsonElement element = json.get(name);
		return element != null && element.isJsonObject() ? element.getAsJsonObject() : null;
	}

	static boolean isHex(String value) {
		return HEX.matcher(value).matches();
	}

	/**
	 * Builds the answer an OpenTSDB server gives, used by the in-memory store.
	 */
	public static UidAssignment of(Map<UidType, Map<String, String>> created,
			Map<UidType, Map<String, String>> existing) {
		JsonObject json = new JsonObject();
		created.forEach((type, uids) -> json.add(type.getValue(), toJson(uids)));
		existing.forEach((type, uids) -> {
			JsonObject errors = new JsonObject();
			uids.forEach((name, uid) -> errors.addProperty(name, "Name already exists with UID: " + uid));
			json.add(type.getErrorsBucket(), errors);
		});
		return new UidAssignment(json);
	}

	private static JsonObject toJson(Map<String, String> uids) {
		JsonObject object = new JsonObject();
		uids.forEach(object::addProperty);
		return object;
	}

	@Override
	public String toString() {
		return json.toString();
	}
}
