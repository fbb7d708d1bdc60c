package com.gentoro.duosmium.http;

import java.time.Duration;
import okhttp3.OkHttpClient;

public class OkHttpFactory {

  public static OkHttpClient create(Duration timeout) {
    return new OkHttpClient.Builder()
        .connectTimeout(timeout)
        .readTimeout(timeout)
        .callTimeout(timeout)
        .addInterceptor(new LoggingInterceptor())
        .build();
  }
}
