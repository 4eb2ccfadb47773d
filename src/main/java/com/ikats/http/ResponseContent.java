package com.ikats.http;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;

import com.google.gson.JsonElement;
import com.google.gson.JsonParser;
import com.google.gson.JsonSyntaxException;

import okhttp3.MediaType;

/**
 * Body of a backend answer, classified once from its content type.
 */
public abstract class ResponseContent {

	public enum Kind {
		JSON, BYTES, TEXT
	}

	public abstract Kind getKind();

	public JsonElement asJson() {
		throw new IllegalStateException("content is " + getKind() + ", not JSON");
	}

	public byte[] asBytes() {
		throw new IllegalStateException("content is " + getKind() + ", not BYTES");
	}

	public String asText() {
		throw new IllegalStateException("content is " + getKind() + ", not TEXT");
	}

	public boolean isJson() {
		return getKind() == Kind.JSON;
	}

	public static ResponseContent json(JsonElement element) {
		return new Json(element);
	}

	public static ResponseContent bytes(byte[] bytes) {
		return new Bytes(bytes);
	}

	public static ResponseContent text(String text) {
		return new Text(text);
	}

	/**
	 * An unparsable JSON body falls back to TEXT so the caller still sees what the backend sent.
	 */
	public static ResponseContent of(MediaType mediaType, byte[] body) {
		if (mediaType != null && "octet-stream".equals(mediaType.subtype())) {
			return bytes(body);
		}
		Charset charset = mediaType == null ? StandardCharsets.UTF_8 : mediaType.charset(StandardCharsets.UTF_8);
		String str = new String(body, charset);
		boolean jsonType = mediaType != null && mediaType.subtype().endsWith("json");
		if (jsonType || (mediaType == null && !str.isBlank())) {
			try {
				JsonElement element = JsonParser.parseString(str);
				// without a content type, only a document counts as JSON
				if (jsonType || element.isJsonObject() || element.isJsonArray()) {
					return json(element);
				}
			} catch (JsonSyntaxException e) {
				return text(str);
			}
		}
		return text(str);
	}

	static final class Json extends ResponseContent {
		private final JsonElement element;

		Json(JsonElement element) {
			this.element = element;
		}

		@Override
		public Kind getKind() {
			return Kind.JSON;
		}

		@Override
		public JsonElement asJson() {
			return element;
		}

		@Override
		public String toString() {
			return element.toString();
		}
	}

	static final class Bytes extends ResponseContent {
		private final byte[] bytes;

		Bytes(byte[] bytes) {
			this.bytes = bytes;
		}

		@Override
		public Kind getKind() {
			return Kind.BYTES;
		}

		@Override
		public byte[] asBytes() {
			return bytes;
		}

		@Override
		public String toString() {
			return "<" + bytes.length + " bytes>";
		}
	}

	static final class Text extends ResponseContent {
		private final String text;

		Text(String text) {
			this.text = text;
		}

		@Override
		public Kind getKind() {
			return Kind.TEXT;
		}

		@Override
		public String asText() {
			return text;
		}

		@Override
		public String toString() {
			return text;
		}
	}
}
