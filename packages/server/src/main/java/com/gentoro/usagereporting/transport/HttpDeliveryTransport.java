package com.gentoro.usagereporting.transport;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.usagereporting.exception.DeliveryException;
import com.gentoro.usagereporting.exception.EncodingException;
import com.gentoro.usagereporting.exception.ResponseParseException;
import com.gentoro.usagereporting.logging.LoggingService;
import com.gentoro.usagereporting.report.Report;
import com.gentoro.usagereporting.utility.JacksonUtility;
import java.io.IOException;
import java.time.Duration;
import java.util.Objects;
import java.util.regex.Pattern;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import okio.Buffer;
import okio.BufferedSink;
import okio.GzipSink;
import okio.Okio;
import org.slf4j.Logger;

/**
 * Delivers reports with an HTTP POST to {@code <endpointUrl>/api/ingress/traces}.
 *
 * <p>The report is verified, encoded and gzipped once; the same body is used for every attempt.
 * Network failures and 5xx responses are retried according to the {@link BackoffPolicy}. Any other
 * non-2xx status fails at once.
 */
public class HttpDeliveryTransport implements DeliveryTransport {
  private static final Logger log = LoggingService.getLogger(HttpDeliveryTransport.class);

  public static final String INGRESS_PATH = "/api/ingress/traces";
  public static final String USER_AGENT = "UsageReporting-Java";

  private static final MediaType REPORT_MEDIA_TYPE = MediaType.get("application/cbor");
  private static final Pattern JSON_CONTENT_TYPE =
      Pattern.compile("^\\s*application/json\\s*(?:;|$)", Pattern.CASE_INSENSITIVE);

  private final OkHttpClient client;
  private final String url;
  private final String apiKey;
  private final ReportCodec codec;
  private final BackoffPolicy backoff;
  private final Sleeper sleeper;
  private final TraceCapability traceCapability;
  private final boolean debugPrintReports;

  public HttpDeliveryTransport(
      OkHttpClient client,
      String endpointUrl,
      String apiKey,
      ReportCodec codec,
      BackoffPolicy backoff,
      Sleeper sleeper,
      TraceCapability traceCapability,
      boolean debugPrintReports) {
    this.client = Objects.requireNonNull(client, "client");
    this.url =
        stripTrailingSlash(Objects.requireNonNull(endpointUrl, "endpointUrl")) + INGRESS_PATH;
    this.apiKey = Objects.requireNonNull(apiKey, "apiKey");
    this.codec = Objects.requireNonNull(codec, "codec");
    this.backoff = Objects.requireNonNull(backoff, "backoff");
    this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
    this.traceCapability = Objects.requireNonNull(traceCapability, "traceCapability");
    this.debugPrintReports = debugPrintReports;
  }

  @Override
  public void send(Report report) {
    codec.verify(report);
    byte[] message = codec.encode(report);
    if (debugPrintReports) {
      log.info("Usage report: {}", codec.toDebugJson(message));
    }

    Request request =
        new Request.Builder()
            .url(url)
            .header("user-agent", USER_AGENT)
            .header(LoggingInterceptor.API_KEY_HEADER, apiKey)
            .header("content-encoding", "gzip")
            .header("accept", "application/json")
            .post(RequestBody.create(gzip(message), REPORT_MEDIA_TYPE))
            .build();

    int lastStatus = -1;
    String lastFailure = null;
    IOException lastCause = null;
    for (int attempt = 1; ; attempt++) {
      try (Response response = client.newCall(request).execute()) {
        int status = response.code();
        if (status >= 200 && status < 300) {
          onSuccess(response);
          if (debugPrintReports) {
            log.info("Usage report: status {}", status);
          }
          return;
        }
        String body = bodyText(response);
        if (status < 500 || status >= 600) {
          throw new DeliveryException(
              "Error sending report: HTTP status " + status + ", " + body, status, attempt);
        }
        lastStatus = status;
        lastFailure = "HTTP status " + status + ", " + body;
        lastCause = null;
      } catch (IOException e) {
        lastStatus = -1;
        lastFailure = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
        lastCause = e;
      }

      if (attempt >= backoff.maxAttempts()) {
        throw new DeliveryException(
            "Error sending report: " + lastFailure, lastStatus, attempt, lastCause);
      }
      Duration delay = backoff.delayAfterAttempt(attempt);
      log.debug(
          "Delivery attempt {} failed ({}), retrying in {} ms",
          attempt,
          lastFailure,
          delay.toMillis());
      try {
        sleeper.sleep(delay);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        throw new DeliveryException(
            "Interrupted while waiting to retry report delivery", lastStatus, attempt, e);
      }
    }
  }

  /** Only a 200 carries a response body worth reading. */
  private void onSuccess(Response response) {
    if (response.code() != 200 || !traceCapability.isEnabled()) return;
    String contentType = response.header("content-type");
    if (contentType == null || !JSON_CONTENT_TYPE.matcher(contentType).find()) return;

    JsonNode parsed;
    try {
      ResponseBody body = response.body();
      parsed = JacksonUtility.getJsonMapper().readTree(body == null ? "" : body.string());
    } catch (IOException e) {
      throw new ResponseParseException(
          "Error parsing response from collector: " + e.getMessage(), e);
    }
    JsonNode tracesIgnored = parsed == null ? null : parsed.get("tracesIgnored");
    if (tracesIgnored != null && tracesIgnored.isBoolean() && tracesIgnored.booleanValue()) {
      traceCapability.demote();
    }
  }

  private static String bodyText(Response response) throws IOException {
    ResponseBody body = response.body();
    String text = body == null ? "" : body.string();
    return text.isEmpty() ? "(no body)" : text;
  }

  static byte[] gzip(byte[] data) {
    Buffer compressed = new Buffer();
    try (BufferedSink sink = Okio.buffer(new GzipSink(compressed))) {
      sink.write(data);
    } catch (IOException e) {
      throw new EncodingException("Failed to compress report", e);
    }
    return compressed.readByteArray();
  }

  private static String stripTrailingSlash(String url) {
    return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
  }
}
