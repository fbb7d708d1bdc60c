package com.gentoro.duosmium.http;

import java.io.IOException;
import okhttp3.Interceptor;
import okhttp3.Request;
import okhttp3.Response;
import org.jetbrains.annotations.NotNull;

/** Logs outgoing catalog requests with status and timing; bodies only at trace level. */
public class LoggingInterceptor implements Interceptor {
  private static final org.slf4j.Logger log =
      com.gentoro.duosmium.logging.LoggingService.getLogger(LoggingInterceptor.class);

  private static final long MAX_TRACE_BODY = 4096;

  @NotNull
  @Override
  public Response intercept(Chain chain) throws IOException {
    Request request = chain.request();
    long startTime = System.nanoTime();
    log.debug("Sending {} {}", request.method(), request.url());

    Response response = chain.proceed(request);

    log.debug(
        "Received {} for {} in {} ms",
        response.code(),
        response.request().url(),
        String.format("%.1f", (System.nanoTime() - startTime) / 1e6d));
    if (log.isTraceEnabled()) {
      log.trace("Response body (truncated):\n{}", response.peekBody(MAX_TRACE_BODY).string());
    }
    return response;
  }
}
