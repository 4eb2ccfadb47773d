package com.ikats.datamodel;

import com.google.gson.JsonObject;

import okhttp3.HttpUrl;
import okhttp3.ResponseBody;
import retrofit2.Call;
import retrofit2.http.Body;
import retrofit2.http.DELETE;
import retrofit2.http.Field;
import retrofit2.http.FormUrlEncoded;
import retrofit2.http.GET;
import retrofit2.http.Headers;
import retrofit2.http.POST;
import retrofit2.http.PUT;
import retrofit2.http.Path;
import retrofit2.http.Query;
import retrofit2.http.Url;

/**
 * Resources of the TemporalDataManagerWebApp.
 */
public interface DatamodelApi {

	String ROOT = "TemporalDataManagerWebApp/webapi/";

	// Functional identifiers

	@GET("metadata/funcId")
	Call<ResponseBody> listFunctionalIdentifiers();

	@FormUrlEncoded
	@POST("metadata/funcId")
	Call<ResponseBody> searchFunctionalIdentifiers(@Field("funcIds") String funcIds);

	@GET("metadata/funcId/{tsuid}")
	Call<ResponseBody> getFunctionalIdentifier(@Path("tsuid") String tsuid);

	@POST("metadata/funcId/{tsuid}/{fid}")
	Call<ResponseBody> importFunctionalIdentifier(@Path("tsuid") String tsuid, @Path("fid") String fid);

	@DELETE("metadata/funcId/{tsuid}")
	Call<ResponseBody> deleteFunctionalIdentifier(@Path("tsuid") String tsuid);

	// Metadata

	@GET("metadata/list/json")
	Call<ResponseBody> lookupMetadata(@Query("tsuid") String tsuids);

	@POST("metadata/import/{tsuid}/{name}/{value}")
	Call<ResponseBody> importMetadata(@Path("tsuid") String tsuid, @Path("name") String name,
			@Path("value") String value, @Query("dtype") String dtype);

	@PUT("metadata/{tsuid}/{name}/{value}")
	Call<ResponseBody> updateMetadata(@Path("tsuid") String tsuid, @Path("name") String name,
			@Path("value") String value);

	@DELETE("metadata/{tsuid}/{name}")
	Call<ResponseBody> deleteMetadata(@Path("tsuid") String tsuid, @Path("name") String name);

	/**
	 * The constraint repeats query keys, so the full {@code metadata/tsmatch} URL is built by the caller.
	 */
	@GET
	Call<ResponseBody> tsMatch(@Url HttpUrl url);

	// Timeseries

	@DELETE("ts/{tsuid}")
	Call<ResponseBody> removeTimeseries(@Path("tsuid") String tsuid);

	// Datasets

	@FormUrlEncoded
	@POST("dataset/import/{name}")
	Call<ResponseBody> importDataset(@Path("name") String pathName, @Field("name") String name,
			@Field("description") String description, @Field("tsuidList") String tsuidList);

	@GET("dataset/{name}")
	Call<ResponseBody> getDataset(@Path("name") String name);

	@GET("dataset")
	Call<ResponseBody> listDatasets();

	/**
	 * @param deep {@code true} or {@code null}, a null query parameter is omitted
	 */
	@DELETE("dataset/{name}")
	Call<ResponseBody> removeDataset(@Path("name") String name, @Query("deep") Boolean deep);

	// Tables

	@Headers("Content-Type: application/json")
	@POST("table")
	Call<ResponseBody> createTable(@Body JsonObject table);

	@GET("table")
	Call<ResponseBody> listTables(@Query("name") String name, @Query("strict") Boolean strict);

	@GET("table/{name}")
	Call<ResponseBody> readTable(@Path("name") String name);

	@DELETE("table/{name}")
	Call<ResponseBody> deleteTable(@Path("name") String name);
}
