package com.ikats.http;

import java.io.IOException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import okhttp3.MediaType;
import okhttp3.Request;
import okhttp3.ResponseBody;
import retrofit2.Call;
import retrofit2.Response;

/**
 * Common base of the backend clients: runs a call synchronously and wraps the answer, whatever its
 * status, into a {@link RestResponse}. Network failures propagate as {@link IOException}.
 */
public abstract class RestClient {

	private static Logger logger = LoggerFactory.getLogger(RestClient.class);

	protected RestResponse send(Call<ResponseBody> call) throws IOException {
		Request request = call.request();
		Response<ResponseBody> response;
		try {
			response = call.execute();
		} catch (IOException ioe) {
			logger.error("{} {} failed: {}", request.method(), request.url(), ioe.getMessage());
			throw ioe;
		}

		ResponseBody body = response.isSuccessful() ? response.body() : response.errorBody();
		ResponseContent content;
		if (body == null) {
			content = ResponseContent.text("");
		} else {
			try (ResponseBody b = body) {
				MediaType mediaType = b.contentType();
				content = ResponseContent.of(mediaType, b.bytes());
			}
		}
		RestResponse result = new RestResponse(response.code(), request.method(), request.url().toString(), content);
		logger.debug("{}", result);
		return result;
	}
}
