package com.gentoro.usagereporting;

import com.gentoro.usagereporting.exception.ConfigException;
import com.gentoro.usagereporting.plugin.ClientInfoGenerator;
import com.gentoro.usagereporting.plugin.DefaultSendOperationsAsTrace;
import com.gentoro.usagereporting.plugin.FieldLevelInstrumentation;
import com.gentoro.usagereporting.plugin.RequestContext;
import com.gentoro.usagereporting.plugin.SendOperationAsTrace;
import com.gentoro.usagereporting.plugin.SendValuesPolicy;
import com.gentoro.usagereporting.scheduler.ErrorSink;
import com.gentoro.usagereporting.schema.LexicalSignatureCalculator;
import com.gentoro.usagereporting.schema.ReferencedFieldsCalculator;
import com.gentoro.usagereporting.schema.SchemaIdGenerator;
import com.gentoro.usagereporting.schema.SignatureCalculator;
import com.gentoro.usagereporting.trace.SendErrorsPolicy;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;
import org.apache.commons.configuration2.Configuration;

/**
 * Settings of the usage reporting pipeline. Built with {@link #builder()} or read from the {@code
 * usageReporting} section of a configuration with {@link #fromConfiguration(Configuration)}.
 *
 * <p>{@code apiKey} and {@code graphRef} are required; everything else has a default.
 */
public final class UsageReportingOptions {
  public static final String PREFIX = "usageReporting";

  public static final String DEFAULT_ENDPOINT_URL = "http://localhost:8085";
  public static final long DEFAULT_REPORT_INTERVAL_MS = 10_000;
  public static final long DEFAULT_MAX_UNCOMPRESSED_REPORT_SIZE = 4L * 1024 * 1024;
  public static final int DEFAULT_MAX_ATTEMPTS = 5;
  public static final long DEFAULT_MINIMUM_RETRY_DELAY_MS = 100;
  public static final long DEFAULT_REQUEST_TIMEOUT_MS = 30_000;
  public static final long DEFAULT_MAX_TRACE_BYTES = 10L * 1024 * 1024;
  public static final long DEFAULT_OPERATION_DERIVED_DATA_CACHE_MAX_BYTES = 10L * 1024 * 1024;

  private final String apiKey;
  private final String graphRef;
  private final String endpointUrl;
  private final long reportIntervalMs;
  private final boolean sendReportsImmediately;
  private final long maxUncompressedReportSize;
  private final int maxAttempts;
  private final long minimumRetryDelayMs;
  private final long requestTimeoutMs;
  private final boolean debugPrintReports;
  private final boolean sendTraces;
  private final String overrideReportedSchema;
  private final SendValuesPolicy sendHeaders;
  private final SendValuesPolicy sendVariableValues;
  private final SendErrorsPolicy sendErrors;
  private final boolean sendUnexecutableOperationDocuments;
  private final FieldLevelInstrumentation fieldLevelInstrumentation;
  private final long maxTraceBytes;
  private final long operationDerivedDataCacheMaxBytes;
  private final Predicate<RequestContext> includeRequest;
  private final ClientInfoGenerator clientInfoGenerator;
  private final SendOperationAsTrace sendOperationAsTrace;
  private final ErrorSink errorSink;
  private final SignatureCalculator signatureCalculator;
  private final ReferencedFieldsCalculator referencedFieldsCalculator;
  private final SchemaIdGenerator schemaIdGenerator;

  private UsageReportingOptions(Builder b) {
    this.apiKey = b.apiKey;
    this.graphRef = b.graphRef;
    this.endpointUrl = b.endpointUrl;
    this.reportIntervalMs = b.reportIntervalMs;
    this.sendReportsImmediately = b.sendReportsImmediately;
    this.maxUncompressedReportSize = b.maxUncompressedReportSize;
    this.maxAttempts = b.maxAttempts;
    this.minimumRetryDelayMs = b.minimumRetryDelayMs;
    this.requestTimeoutMs = b.requestTimeoutMs;
    this.debugPrintReports = b.debugPrintReports;
    this.sendTraces = b.sendTraces;
    this.overrideReportedSchema = b.overrideReportedSchema;
    this.sendHeaders = b.sendHeaders;
    this.sendVariableValues = b.sendVariableValues;
    this.sendErrors = b.sendErrors;
    this.sendUnexecutableOperationDocuments = b.sendUnexecutableOperationDocuments;
    this.fieldLevelInstrumentation = b.fieldLevelInstrumentation;
    this.maxTraceBytes = b.maxTraceBytes;
    this.operationDerivedDataCacheMaxBytes = b.operationDerivedDataCacheMaxBytes;
    this.includeRequest = b.includeRequest;
    this.clientInfoGenerator = b.clientInfoGenerator;
    this.sendOperationAsTrace =
        b.sendOperationAsTrace == null
            ? new DefaultSendOperationsAsTrace()
            : b.sendOperationAsTrace;
    this.errorSink = b.errorSink;
    this.signatureCalculator = b.signatureCalculator;
    this.referencedFieldsCalculator = b.referencedFieldsCalculator;
    this.schemaIdGenerator = b.schemaIdGenerator;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Reads the {@code usageReporting.*} keys. Values that still contain an unresolved {@code ${...}}
   * placeholder count as missing.
   */
  public static Builder fromConfiguration(Configuration config) {
    Builder b = builder();
    b.apiKey(string(config, "apiKey"));
    b.graphRef(string(config, "graphRef"));
    String endpoint = string(config, "endpointUrl");
    if (endpoint != null) b.endpointUrl(endpoint);
    b.reportIntervalMs(longValue(config, "reportIntervalMs", DEFAULT_REPORT_INTERVAL_MS));
    b.sendReportsImmediately(bool(config, "sendReportsImmediately", false));
    b.maxUncompressedReportSize(
        longValue(config, "maxUncompressedReportSize", DEFAULT_MAX_UNCOMPRESSED_REPORT_SIZE));
    b.maxAttempts((int) longValue(config, "maxAttempts", DEFAULT_MAX_ATTEMPTS));
    b.minimumRetryDelayMs(
        longValue(config, "minimumRetryDelayMs", DEFAULT_MINIMUM_RETRY_DELAY_MS));
    b.requestTimeoutMs(longValue(config, "requestTimeoutMs", DEFAULT_REQUEST_TIMEOUT_MS));
    b.debugPrintReports(bool(config, "debugPrintReports", false));
    b.sendTraces(bool(config, "sendTraces", true));
    b.overrideReportedSchema(string(config, "overrideReportedSchema"));
    b.sendHeaders(valuesPolicy(config, "sendHeaders"));
    b.sendVariableValues(valuesPolicy(config, "sendVariableValues"));
    String sendErrors = string(config, "sendErrors");
    if (sendErrors != null) {
      try {
        b.sendErrors(SendErrorsPolicy.fromName(sendErrors));
      } catch (IllegalArgumentException e) {
        throw new ConfigException(PREFIX + ".sendErrors: " + e.getMessage(), e);
      }
    }
    b.sendUnexecutableOperationDocuments(
        bool(config, "sendUnexecutableOperationDocuments", false));
    double rate = doubleValue(config, "fieldLevelInstrumentation", 1.0);
    if (rate < 0 || rate > 1) {
      throw new ConfigException(PREFIX + ".fieldLevelInstrumentation must be between 0 and 1");
    }
    b.fieldLevelInstrumentation(FieldLevelInstrumentation.sampled(rate));
    b.maxTraceBytes(longValue(config, "maxTraceBytes", DEFAULT_MAX_TRACE_BYTES));
    b.operationDerivedDataCacheMaxBytes(
        longValue(
            config,
            "operationDerivedDataCacheMaxBytes",
            DEFAULT_OPERATION_DERIVED_DATA_CACHE_MAX_BYTES));
    return b;
  }

  private static String key(String name) {
    return PREFIX + "." + name;
  }

  private static String string(Configuration config, String name) {
    String value;
    try {
      value = config.getString(key(name));
    } catch (RuntimeException e) {
      throw new ConfigException("Invalid value for " + key(name) + ": " + e.getMessage(), e);
    }
    if (value == null || value.isBlank() || value.contains("${")) return null;
    return value.trim();
  }

  private static long longValue(Configuration config, String name, long defaultValue) {
    String value = string(config, name);
    if (value == null) return defaultValue;
    try {
      return Long.parseLong(value);
    } catch (NumberFormatException e) {
      throw new ConfigException(key(name) + " is not a whole number: " + value, e);
    }
  }

  private static double doubleValue(Configuration config, String name, double defaultValue) {
    String value = string(config, name);
    if (value == null) return defaultValue;
    try {
      return Double.parseDouble(value);
    } catch (NumberFormatException e) {
      throw new ConfigException(key(name) + " is not a number: " + value, e);
    }
  }

  private static boolean bool(Configuration config, String name, boolean defaultValue) {
    String value = string(config, name);
    if (value == null) return defaultValue;
    if (value.equalsIgnoreCase("true")) return true;
    if (value.equalsIgnoreCase("false")) return false;
    throw new ConfigException(key(name) + " is not a boolean: " + value);
  }

  /**
   * Either a scalar {@code none} or {@code all}, or a section with {@code exceptNames} or {@code
   * onlyNames}.
   */
  private static SendValuesPolicy valuesPolicy(Configuration config, String name) {
    List<String> except = config.getList(String.class, key(name) + ".exceptNames", List.of());
    List<String> only = config.getList(String.class, key(name) + ".onlyNames", List.of());
    if (!except.isEmpty() && !only.isEmpty()) {
      throw new ConfigException(key(name) + " cannot have both exceptNames and onlyNames");
    }
    if (!except.isEmpty()) return SendValuesPolicy.except(except);
    if (!only.isEmpty()) return SendValuesPolicy.only(only);

    String value = string(config, name);
    if (value == null || value.equalsIgnoreCase("none")) return SendValuesPolicy.none();
    if (value.equalsIgnoreCase("all")) return SendValuesPolicy.all();
    throw new ConfigException(
        key(name) + " must be none, all, or a section with exceptNames or onlyNames: " + value);
  }

  public String apiKey() {
    return apiKey;
  }

  public String graphRef() {
    return graphRef;
  }

  public String endpointUrl() {
    return endpointUrl;
  }

  public long reportIntervalMs() {
    return reportIntervalMs;
  }

  public boolean sendReportsImmediately() {
    return sendReportsImmediately;
  }

  public long maxUncompressedReportSize() {
    return maxUncompressedReportSize;
  }

  public int maxAttempts() {
    return maxAttempts;
  }

  public long minimumRetryDelayMs() {
    return minimumRetryDelayMs;
  }

  public long requestTimeoutMs() {
    return requestTimeoutMs;
  }

  public boolean debugPrintReports() {
    return debugPrintReports;
  }

  public boolean sendTraces() {
    return sendTraces;
  }

  /** SDL reported instead of the served schema; null when not overridden. */
  public String overrideReportedSchema() {
    return overrideReportedSchema;
  }

  public SendValuesPolicy sendHeaders() {
    return sendHeaders;
  }

  public SendValuesPolicy sendVariableValues() {
    return sendVariableValues;
  }

  public SendErrorsPolicy sendErrors() {
    return sendErrors;
  }

  public boolean sendUnexecutableOperationDocuments() {
    return sendUnexecutableOperationDocuments;
  }

  public FieldLevelInstrumentation fieldLevelInstrumentation() {
    return fieldLevelInstrumentation;
  }

  public long maxTraceBytes() {
    return maxTraceBytes;
  }

  public long operationDerivedDataCacheMaxBytes() {
    return operationDerivedDataCacheMaxBytes;
  }

  public Predicate<RequestContext> includeRequest() {
    return includeRequest;
  }

  public ClientInfoGenerator clientInfoGenerator() {
    return clientInfoGenerator;
  }

  public SendOperationAsTrace sendOperationAsTrace() {
    return sendOperationAsTrace;
  }

  public ErrorSink errorSink() {
    return errorSink;
  }

  public SignatureCalculator signatureCalculator() {
    return signatureCalculator;
  }

  public ReferencedFieldsCalculator referencedFieldsCalculator() {
    return referencedFieldsCalculator;
  }

  public SchemaIdGenerator schemaIdGenerator() {
    return schemaIdGenerator;
  }

  public static final class Builder {
    private String apiKey;
    private String graphRef;
    private String endpointUrl = DEFAULT_ENDPOINT_URL;
    private long reportIntervalMs = DEFAULT_REPORT_INTERVAL_MS;
    private boolean sendReportsImmediately;
    private long maxUncompressedReportSize = DEFAULT_MAX_UNCOMPRESSED_REPORT_SIZE;
    private int maxAttempts = DEFAULT_MAX_ATTEMPTS;
    private long minimumRetryDelayMs = DEFAULT_MINIMUM_RETRY_DELAY_MS;
    private long requestTimeoutMs = DEFAULT_REQUEST_TIMEOUT_MS;
    private boolean debugPrintReports;
    private boolean sendTraces = true;
    private String overrideReportedSchema;
    private SendValuesPolicy sendHeaders = SendValuesPolicy.none();
    private SendValuesPolicy sendVariableValues = SendValuesPolicy.none();
    private SendErrorsPolicy sendErrors = SendErrorsPolicy.masked();
    private boolean sendUnexecutableOperationDocuments;
    private FieldLevelInstrumentation fieldLevelInstrumentation =
        FieldLevelInstrumentation.sampled(1);
    private long maxTraceBytes = DEFAULT_MAX_TRACE_BYTES;
    private long operationDerivedDataCacheMaxBytes =
        DEFAULT_OPERATION_DERIVED_DATA_CACHE_MAX_BYTES;
    private Predicate<RequestContext> includeRequest = context -> true;
    private ClientInfoGenerator clientInfoGenerator = ClientInfoGenerator.defaultGenerator();
    private SendOperationAsTrace sendOperationAsTrace;
    private ErrorSink errorSink = ErrorSink.logging();
    private SignatureCalculator signatureCalculator = new LexicalSignatureCalculator();
    private ReferencedFieldsCalculator referencedFieldsCalculator =
        (document, schema, name) -> Map.of();
    private SchemaIdGenerator schemaIdGenerator = SchemaIdGenerator.coreSchemaHash();

    public Builder apiKey(String apiKey) {
      this.apiKey = apiKey;
      return this;
    }

    public Builder graphRef(String graphRef) {
      this.graphRef = graphRef;
      return this;
    }

    public Builder endpointUrl(String endpointUrl) {
      this.endpointUrl = endpointUrl;
      return this;
    }

    public Builder reportIntervalMs(long reportIntervalMs) {
      this.reportIntervalMs = reportIntervalMs;
      return this;
    }

    /** Flush after every request and run no timer, for hosts that cannot keep background work. */
    public Builder sendReportsImmediately(boolean sendReportsImmediately) {
      this.sendReportsImmediately = sendReportsImmediately;
      return this;
    }

    public Builder maxUncompressedReportSize(long maxUncompressedReportSize) {
      this.maxUncompressedReportSize = maxUncompressedReportSize;
      return this;
    }

    public Builder maxAttempts(int maxAttempts) {
      this.maxAttempts = maxAttempts;
      return this;
    }

    public Builder minimumRetryDelayMs(long minimumRetryDelayMs) {
      this.minimumRetryDelayMs = minimumRetryDelayMs;
      return this;
    }

    public Builder requestTimeoutMs(long requestTimeoutMs) {
      this.requestTimeoutMs = requestTimeoutMs;
      return this;
    }

    public Builder debugPrintReports(boolean debugPrintReports) {
      this.debugPrintReports = debugPrintReports;
      return this;
    }

    public Builder sendTraces(boolean sendTraces) {
      this.sendTraces = sendTraces;
      return this;
    }

    public Builder overrideReportedSchema(String overrideReportedSchema) {
      this.overrideReportedSchema = overrideReportedSchema;
      return this;
    }

    public Builder sendHeaders(SendValuesPolicy sendHeaders) {
      this.sendHeaders = sendHeaders;
      return this;
    }

    public Builder sendVariableValues(SendValuesPolicy sendVariableValues) {
      this.sendVariableValues = sendVariableValues;
      return this;
    }

    public Builder sendErrors(SendErrorsPolicy sendErrors) {
      this.sendErrors = sendErrors;
      return this;
    }

    public Builder sendUnexecutableOperationDocuments(boolean sendUnexecutableOperationDocuments) {
      this.sendUnexecutableOperationDocuments = sendUnexecutableOperationDocuments;
      return this;
    }

    public Builder fieldLevelInstrumentation(FieldLevelInstrumentation fieldLevelInstrumentation) {
      this.fieldLevelInstrumentation = fieldLevelInstrumentation;
      return this;
    }

    public Builder maxTraceBytes(long maxTraceBytes) {
      this.maxTraceBytes = maxTraceBytes;
      return this;
    }

    public Builder operationDerivedDataCacheMaxBytes(long operationDerivedDataCacheMaxBytes) {
      this.operationDerivedDataCacheMaxBytes = operationDerivedDataCacheMaxBytes;
      return this;
    }

    /** Requests for which this returns false only count towards the operation count. */
    public Builder includeRequest(Predicate<RequestContext> includeRequest) {
      this.includeRequest = includeRequest;
      return this;
    }

    public Builder clientInfoGenerator(ClientInfoGenerator clientInfoGenerator) {
      this.clientInfoGenerator = clientInfoGenerator;
      return this;
    }

    public Builder sendOperationAsTrace(SendOperationAsTrace sendOperationAsTrace) {
      this.sendOperationAsTrace = sendOperationAsTrace;
      return this;
    }

    public Builder errorSink(ErrorSink errorSink) {
      this.errorSink = errorSink;
      return this;
    }

    public Builder signatureCalculator(SignatureCalculator signatureCalculator) {
      this.signatureCalculator = signatureCalculator;
      return this;
    }

    /** Without one, reports carry no referenced fields. */
    public Builder referencedFieldsCalculator(
        ReferencedFieldsCalculator referencedFieldsCalculator) {
      this.referencedFieldsCalculator = referencedFieldsCalculator;
      return this;
    }

    public Builder schemaIdGenerator(SchemaIdGenerator schemaIdGenerator) {
      this.schemaIdGenerator = schemaIdGenerator;
      return this;
    }

    /**
     * @throws ConfigException when credentials are missing or a value is out of range
     */
    public UsageReportingOptions build() {
      if (apiKey == null || apiKey.isBlank()) {
        throw new ConfigException(
            "No API key configured; set " + key("apiKey") + " to enable usage reporting");
      }
      if (graphRef == null || graphRef.isBlank()) {
        throw new ConfigException(
            "No graph ref configured; set " + key("graphRef") + " to enable usage reporting");
      }
      if (endpointUrl == null || endpointUrl.isBlank()) {
        throw new ConfigException(key("endpointUrl") + " must not be empty");
      }
      positive("reportIntervalMs", reportIntervalMs);
      positive("maxUncompressedReportSize", maxUncompressedReportSize);
      positive("maxAttempts", maxAttempts);
      positive("requestTimeoutMs", requestTimeoutMs);
      positive("maxTraceBytes", maxTraceBytes);
      positive("operationDerivedDataCacheMaxBytes", operationDerivedDataCacheMaxBytes);
      if (minimumRetryDelayMs < 0) {
        throw new ConfigException(key("minimumRetryDelayMs") + " must not be negative");
      }
      requireSet("sendHeaders", sendHeaders);
      requireSet("sendVariableValues", sendVariableValues);
      requireSet("sendErrors", sendErrors);
      requireSet("fieldLevelInstrumentation", fieldLevelInstrumentation);
      requireSet("includeRequest", includeRequest);
      requireSet("clientInfoGenerator", clientInfoGenerator);
      requireSet("errorSink", errorSink);
      requireSet("signatureCalculator", signatureCalculator);
      requireSet("referencedFieldsCalculator", referencedFieldsCalculator);
      requireSet("schemaIdGenerator", schemaIdGenerator);
      return new UsageReportingOptions(this);
    }

    private static void positive(String name, long value) {
      if (value <= 0) {
        throw new ConfigException(key(name) + " must be positive, got " + value);
      }
    }

    private static void requireSet(String name, Object value) {
      if (value == null) {
        throw new ConfigException(key(name) + " must not be null");
      }
    }
  }
}
