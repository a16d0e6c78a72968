package com.gentoro.usagereporting.transport;

import java.util.concurrent.TimeUnit;
import okhttp3.OkHttpClient;

public class OkHttpFactory {

  /**
   * Client for report delivery. The call timeout bounds each attempt as a whole, connection and
   * body transfer included.
   */
  public static OkHttpClient create(long requestTimeoutMs) {
    return new OkHttpClient.Builder()
        .connectTimeout(10, TimeUnit.SECONDS)
        .callTimeout(requestTimeoutMs, TimeUnit.MILLISECONDS)
        .retryOnConnectionFailure(false)
        .addInterceptor(new LoggingInterceptor())
        .build();
  }
}
