package com.gentoro.usagereporting.transport;

import java.io.IOException;
import okhttp3.Headers;
import okhttp3.Interceptor;
import okhttp3.Request;
import okhttp3.Response;
import org.jetbrains.annotations.NotNull;

/** Logs request and response headers at debug. Report bodies are binary and are not logged. */
public class LoggingInterceptor implements Interceptor {
  private static final org.slf4j.Logger log =
      com.gentoro.usagereporting.logging.LoggingService.getLogger(LoggingInterceptor.class);

  static final String API_KEY_HEADER = "x-api-key";

  @NotNull
  @Override
  public Response intercept(Chain chain) throws IOException {
    Request request = chain.request();
    if (!log.isDebugEnabled()) {
      return chain.proceed(request);
    }

    long startTime = System.nanoTime();
    long contentLength = request.body() == null ? 0 : request.body().contentLength();
    log.debug(
        "Sending {} {} ({} bytes)\nHeaders:\n{}",
        request.method(),
        request.url(),
        contentLength,
        redact(request.headers()));

    Response response = chain.proceed(request);

    long endTime = System.nanoTime();
    log.debug(
        "Received response for {} in {} ms\nStatus: {}\nHeaders:\n{}",
        response.request().url(),
        String.format("%.1f", (endTime - startTime) / 1e6d),
        response.code(),
        response.headers());
    return response;
  }

  static Headers redact(Headers headers) {
    if (headers.get(API_KEY_HEADER) == null) return headers;
    return headers.newBuilder().set(API_KEY_HEADER, "<redacted>").build();
  }
}
