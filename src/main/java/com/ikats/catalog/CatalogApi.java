package com.ikats.catalog;

import okhttp3.ResponseBody;
import retrofit2.Call;
import retrofit2.http.GET;
import retrofit2.http.Path;

public interface CatalogApi {

	String ROOT = "ikats/algo/catalogue/";

	@GET("implementations")
	Call<ResponseBody> getImplementations();

	@GET("implementations/{name}")
	Call<ResponseBody> getImplementation(@Path("name") String name);
}
