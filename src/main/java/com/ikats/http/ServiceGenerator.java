package com.ikats.http;

import java.util.concurrent.TimeUnit;

import com.google.gson.Gson;

import okhttp3.OkHttpClient;
import okhttp3.logging.HttpLoggingInterceptor;
import retrofit2.Retrofit;
import retrofit2.converter.gson.GsonConverterFactory;

/**
 * Builds the Retrofit services of the IKATS backends on top of one shared OkHttp client.
 */
public class ServiceGenerator {

	private final OkHttpClient client;
	private final Gson gson;

	public ServiceGenerator(long timeoutSeconds, HttpLoggingInterceptor.Level logLevel) {
		this(timeoutSeconds, logLevel, new Gson());
	}

	public ServiceGenerator(long timeoutSeconds, HttpLoggingInterceptor.Level logLevel, Gson gson) {
		HttpLoggingInterceptor logging = new HttpLoggingInterceptor().setLevel(logLevel);
		this.client = new OkHttpClient.Builder()
				.connectTimeout(timeoutSeconds, TimeUnit.SECONDS)
				.readTimeout(timeoutSeconds, TimeUnit.SECONDS)
				.writeTimeout(timeoutSeconds, TimeUnit.SECONDS)
				.addInterceptor(logging)
				.build();
		this.gson = gson;
	}

	public <S> S createService(Class<S> serviceClass, String baseUrl) {
		Retrofit retrofit = new Retrofit.Builder()
				.baseUrl(baseUrl.endsWith("/") ? baseUrl : baseUrl + "/")
				.addConverterFactory(GsonConverterFactory.create(gson))
				.client(client)
				.build();
		return retrofit.create(serviceClass);
	}

	public Gson getGson() {
		return gson;
	}

	public void shutdown() {
		client.dispatcher().executorService().shutdown();
		client.connectionPool().evictAll();
	}
}
