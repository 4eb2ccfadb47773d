package com.ikats.http;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.ikats.exception.MalformedResponseException;

public class RestResponse {

	private final int statusCode;
	private final String method;
	private final String url;
	private final ResponseContent content;

	public RestResponse(int statusCode, String method, String url, ResponseContent content) {
		this.statusCode = statusCode;
		this.method = method;
		this.url = url;
		this.content = content;
	}

	public int getStatusCode() {
		return statusCode;
	}

	public String getMethod() {
		return method;
	}

	public String getUrl() {
		return url;
	}

	public ResponseContent getContent() {
		return content;
	}

	public boolean isSuccessful() {
		return statusCode >= 200 && statusCode < 300;
	}

	public JsonObject jsonObject() {
		JsonElement element = json();
		if (!element.isJsonObject()) {
			throw new MalformedResponseException(String.format("Expected a JSON object from %s, got %s", url, element));
		}
		return element.getAsJsonObject();
	}

	public JsonArray jsonArray() {
		JsonElement element = json();
		if (!element.isJsonArray()) {
			throw new MalformedResponseException(String.format("Expected a JSON array from %s, got %s", url, element));
		}
		return element.getAsJsonArray();
	}

	public JsonElement json() {
		if (!content.isJson()) {
			throw new MalformedResponseException(String.format("Expected JSON from %s, got %s: %s", url,
					content.getKind(), content));
		}
		return content.asJson();
	}

	@Override
	public String toString() {
		return statusCode + " " + method + " " + url;
	}
}
