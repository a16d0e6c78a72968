package com.gentoro.usagereporting.plugin;

import com.gentoro.usagereporting.schema.OperationDocument;
import com.gentoro.usagereporting.schema.SchemaSnapshot;
import com.gentoro.usagereporting.trace.ExecutionError;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * What the host knows about a request. The host fills it in as the request progresses and passes
 * the same instance to every {@link RequestListener} callback.
 */
public class RequestContext {
  private HttpRequestInfo http;
  private Map<String, Object> variables;
  private String requestOperationName;
  private Map<String, Object> extensions = new LinkedHashMap<>();
  private String source;
  private String queryHash;
  private OperationDocument document;
  private String operationName;
  private boolean operationResolved;
  private SchemaSnapshot schema;
  private RequestMetrics metrics = new RequestMetrics();
  private OverallCachePolicy overallCachePolicy;
  private List<ExecutionError> errors = new ArrayList<>();
  private boolean incremental;

  public HttpRequestInfo getHttp() {
    return http;
  }

  public RequestContext setHttp(HttpRequestInfo http) {
    this.http = http;
    return this;
  }

  /** Operation variables; null when the request had none. */
  public Map<String, Object> getVariables() {
    return variables;
  }

  public RequestContext setVariables(Map<String, Object> variables) {
    this.variables = variables;
    return this;
  }

  /** Operation name as sent by the client, which may not match any operation. */
  public String getRequestOperationName() {
    return requestOperationName;
  }

  public RequestContext setRequestOperationName(String requestOperationName) {
    this.requestOperationName = requestOperationName;
    return this;
  }

  public Map<String, Object> getExtensions() {
    return extensions;
  }

  public RequestContext setExtensions(Map<String, Object> extensions) {
    this.extensions = extensions == null ? new LinkedHashMap<>() : extensions;
    return this;
  }

  public String getSource() {
    return source;
  }

  public RequestContext setSource(String source) {
    this.source = source;
    return this;
  }

  public String getQueryHash() {
    return queryHash;
  }

  public RequestContext setQueryHash(String queryHash) {
    this.queryHash = queryHash;
    return this;
  }

  /** Parsed document; null when parsing failed. */
  public OperationDocument getDocument() {
    return document;
  }

  public RequestContext setDocument(OperationDocument document) {
    this.document = document;
    return this;
  }

  /** Name of the resolved operation; empty for an anonymous operation. */
  public String getOperationName() {
    return operationName;
  }

  public RequestContext setOperationName(String operationName) {
    this.operationName = operationName;
    return this;
  }

  public boolean isOperationResolved() {
    return operationResolved;
  }

  public RequestContext setOperationResolved(boolean operationResolved) {
    this.operationResolved = operationResolved;
    return this;
  }

  public SchemaSnapshot getSchema() {
    return schema;
  }

  public RequestContext setSchema(SchemaSnapshot schema) {
    this.schema = schema;
    return this;
  }

  public RequestMetrics getMetrics() {
    return metrics;
  }

  public RequestContext setMetrics(RequestMetrics metrics) {
    this.metrics = metrics;
    return this;
  }

  /** Null unless the response is cacheable. */
  public OverallCachePolicy getOverallCachePolicy() {
    return overallCachePolicy;
  }

  public RequestContext setOverallCachePolicy(OverallCachePolicy overallCachePolicy) {
    this.overallCachePolicy = overallCachePolicy;
    return this;
  }

  public List<ExecutionError> getErrors() {
    return errors;
  }

  public RequestContext setErrors(List<ExecutionError> errors) {
    this.errors = errors == null ? new ArrayList<>() : errors;
    return this;
  }

  /** The response is delivered in several payloads (defer or stream). */
  public boolean isIncremental() {
    return incremental;
  }

  public RequestContext setIncremental(boolean incremental) {
    this.incremental = incremental;
    return this;
  }
}
