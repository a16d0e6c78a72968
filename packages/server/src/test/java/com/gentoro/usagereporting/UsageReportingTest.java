package com.gentoro.usagereporting;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.usagereporting.plugin.HttpRequestInfo;
import com.gentoro.usagereporting.plugin.RequestContext;
import com.gentoro.usagereporting.plugin.RequestListener;
import com.gentoro.usagereporting.report.Report;
import com.gentoro.usagereporting.report.StatsContext;
import com.gentoro.usagereporting.report.StatsReportKeys;
import com.gentoro.usagereporting.report.TracesAndStats;
import com.gentoro.usagereporting.schema.CoreSchemaHash;
import com.gentoro.usagereporting.schema.OperationDocument;
import com.gentoro.usagereporting.schema.SchemaSnapshot;
import com.gentoro.usagereporting.trace.ExecutionError;
import com.gentoro.usagereporting.trace.FieldInfo;
import com.gentoro.usagereporting.trace.ResponsePath;
import com.gentoro.usagereporting.trace.Trace;
import com.gentoro.usagereporting.transport.CborReportCodec;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class UsageReportingTest {

  private static final String SDL = "type Query { user: User } type User { name: String }";
  private static final SchemaSnapshot SCHEMA = () -> SDL;
  private static final OperationDocument DOCUMENT = () -> "query Q {\n  user { name }\n}";
  private static final String KEY = "# Q\nquery Q{user{name}}";

  private final List<Report> sent = new CopyOnWriteArrayList<>();
  private UsageReporting reporting;

  @AfterEach
  void tearDown() {
    if (reporting != null) reporting.stop();
  }

  private UsageReporting start(UsageReportingOptions.Builder options) {
    reporting =
        new UsageReporting(
            options.apiKey("key").graphRef("graph@current").build(),
            sent::add,
            () -> Instant.parse("2024-05-01T10:00:00Z"));
    reporting.start();
    return reporting;
  }

  private static RequestContext context() {
    return new RequestContext()
        .setHttp(new HttpRequestInfo("POST", Map.of("graphql-client-name", "web")))
        .setSchema(SCHEMA)
        .setSource(DOCUMENT.source())
        .setRequestOperationName("Q");
  }

  /** Serves operation {@code Q} and resolves its single field. */
  private void serve(UsageReporting reporting) {
    RequestContext context = context();
    RequestListener listener = reporting.requestDidStart(context);
    listener.didResolveSource(context);
    context.setDocument(DOCUMENT).setQueryHash("hash-q");
    listener.didValidate(List.of());
    context.setOperationName("Q").setOperationResolved(true);
    listener.didResolveOperation(context);
    if (listener.executionDidStart()) {
      listener
          .willResolveField(new FieldInfo("user", "Query", "User", ResponsePath.of("user")))
          .complete();
    }
    listener.willSendResponse(context).join();
  }

  @Test
  @DisplayName("An operation is reported as a trace under its signature key")
  void reportsOperationAsTrace() {
    start(UsageReportingOptions.builder().sendReportsImmediately(true));

    serve(reporting);

    assertEquals(1, sent.size());
    Report report = sent.get(0);
    assertEquals(CoreSchemaHash.compute(SDL), report.getHeader().getExecutableSchemaId());
    assertEquals("graph@current", report.getHeader().getGraphRef());
    assertEquals(1, report.getOperationCount());
    TracesAndStats entry = report.getTracesPerQuery().get(KEY);
    assertNotNull(entry);
    assertEquals(1, entry.getTrace().size());
    Trace trace = new CborReportCodec().decodeTrace(entry.getTrace().get(0));
    assertEquals("web", trace.getClientName());
    assertEquals("user", trace.getRoot().getChildren().get(0).getResponseName());
  }

  @Test
  @DisplayName("Once the collector ignores traces, operations are only sent as stats")
  void demotedCapabilitySendsStats() {
    start(UsageReportingOptions.builder().sendReportsImmediately(true));
    reporting.traceCapability().demote();

    serve(reporting);

    TracesAndStats entry = sent.get(0).getTracesPerQuery().get(KEY);
    assertTrue(entry.getTrace().isEmpty());
    assertEquals(
        1,
        entry.statsFor(new StatsContext("web", "")).getQueryLatencyStats().getRequestCount());
  }

  @Test
  void sendTracesOffReportsStatsOnly() {
    start(UsageReportingOptions.builder().sendReportsImmediately(true).sendTraces(false));

    serve(reporting);

    assertTrue(sent.get(0).getTracesPerQuery().get(KEY).getTrace().isEmpty());
  }

  @Test
  void overriddenSchemaIdIsUsed() {
    start(
        UsageReportingOptions.builder()
            .sendReportsImmediately(true)
            .overrideReportedSchema("type Query { public: Int }"));

    serve(reporting);

    assertEquals(
        CoreSchemaHash.compute("type Query { public: Int }"),
        sent.get(0).getHeader().getExecutableSchemaId());
  }

  @Test
  void unexecutableDocumentIsSentWhenEnabled() {
    start(
        UsageReportingOptions.builder()
            .sendReportsImmediately(true)
            .sendUnexecutableOperationDocuments(true));
    RequestContext context = context().setSource("query Q { user {");
    RequestListener listener = reporting.requestDidStart(context);
    listener.didResolveSource(context);
    context.getErrors().add(ExecutionError.of("Syntax Error: Expected Name"));

    listener.willSendResponse(context).join();

    Report report = sent.get(0);
    assertEquals(0, report.getOperationCount());
    TracesAndStats entry = report.getTracesPerQuery().get(StatsReportKeys.PARSE_FAILURE);
    Trace trace = new CborReportCodec().decodeTrace(entry.getTrace().get(0));
    assertEquals("query Q { user {", trace.getUnexecutedOperationBody());
    assertEquals("Q", trace.getUnexecutedOperationName());
  }

  @Test
  @DisplayName("Stopping sends pending usage and ignores later requests")
  void stopFlushesPendingReports() {
    start(UsageReportingOptions.builder());
    serve(reporting);
    serve(reporting);
    assertTrue(sent.isEmpty());

    reporting.stop();

    assertEquals(1, sent.size());
    assertEquals(2, sent.get(0).getOperationCount());
    assertTrue(reporting.isStopped());

    serve(reporting);
    reporting.stop();
    assertDoesNotThrow(() -> reporting.flush().join());
    assertEquals(1, sent.size());
  }

  @Test
  void excludedRequestsOnlyCount() {
    start(UsageReportingOptions.builder().includeRequest(context -> false));
    serve(reporting);

    reporting.flush().join();

    assertEquals(1, sent.size());
    assertEquals(1, sent.get(0).getOperationCount());
    assertTrue(sent.get(0).getTracesPerQuery().isEmpty());
  }
}
