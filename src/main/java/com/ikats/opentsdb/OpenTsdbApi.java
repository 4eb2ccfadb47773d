package com.ikats.opentsdb;

import java.util.List;

import com.ikats.opentsdb.model.PutPoint;

import okhttp3.ResponseBody;
import retrofit2.Call;
import retrofit2.http.Body;
import retrofit2.http.GET;
import retrofit2.http.Headers;
import retrofit2.http.POST;
import retrofit2.http.Query;

public interface OpenTsdbApi {

	@GET("api/uid/assign")
	Call<ResponseBody> assignUids(@Query("metric") String metric, @Query("tagk") String tagKeys,
			@Query("tagv") String tagValues);

	@GET("api/uid/uidmeta")
	Call<ResponseBody> getUidMeta(@Query("uid") String uid, @Query("type") String type);

	@Headers("Content-Type: application/json")
	@POST("api/put?details&ms=true&sync")
	Call<ResponseBody> putPoints(@Body List<PutPoint> points);

	// tsuid is "sum:1y-count:<tsuid>"
	@GET("api/query?start=0")
	Call<ResponseBody> countPoints(@Query("tsuid") String aggregatedTsuid);

	// tsuid is "avg:<tsuid>"
	@GET("api/query?ms=true")
	Call<ResponseBody> extract(@Query("start") long start, @Query("end") long end,
			@Query("tsuid") String aggregatedTsuid);
}
