package com.ikats.catalog;

import java.io.IOException;
import java.util.List;

import org.apache.commons.lang3.StringUtils;

import com.google.common.collect.ImmutableList;
import com.google.gson.Gson;
import com.google.gson.JsonElement;
import com.ikats.config.IkatsSession;
import com.ikats.http.RestClient;
import com.ikats.http.RestResponse;
import com.ikats.http.ServiceGenerator;
import com.ikats.http.StatusChecks;
import com.ikats.model.Implementation;

/**
 * Read access to the operator catalog.
 */
public class CatalogClient extends RestClient {

	private final CatalogApi api;
	private final Gson gson;

	public CatalogClient(IkatsSession session, ServiceGenerator generator) {
		String root = StringUtils.appendIfMissing(session.getCatalogUrl(), "/") + CatalogApi.ROOT;
		this.api = generator.createService(CatalogApi.class, root);
		this.gson = generator.getGson();
	}

	public List<Implementation> listImplementations() throws IOException {
		RestResponse response = send(api.getImplementations());
		if (response.getStatusCode() == 404) {
			return ImmutableList.of();
		}
		StatusChecks.check(response);
		ImmutableList.Builder<Implementation> result = ImmutableList.builder();
		for (JsonElement element : response.jsonArray()) {
			result.add(gson.fromJson(element, Implementation.class));
		}
		return result.build();
	}

	public Implementation getImplementation(String name) throws IOException {
		if (StringUtils.isBlank(name)) {
			throw new IllegalArgumentException("Implementation name shall be set");
		}
		RestResponse response = send(api.getImplementation(name));
		StatusChecks.is404(response, "No implementation found matching " + name);
		StatusChecks.check(response);
		return gson.fromJson(response.jsonObject(), Implementation.class);
	}
}
