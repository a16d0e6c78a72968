package com.gentoro.usagereporting.trace;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Execution record of a single request.
 *
 * <p>A trace is mutated only by the request that owns it. Once it has been added to a report it
 * must not be touched again.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class Trace {
  @JsonProperty("startTime")
  private Timestamp startTime;

  @JsonProperty("endTime")
  private Timestamp endTime;

  @JsonProperty("durationNs")
  private long durationNs;

  @JsonProperty("root")
  private Node root;

  @JsonProperty("details")
  private Details details;

  @JsonProperty("clientName")
  private String clientName;

  @JsonProperty("clientVersion")
  private String clientVersion;

  @JsonProperty("http")
  private Http http;

  @JsonProperty("cachePolicy")
  private CachePolicy cachePolicy;

  @JsonProperty("queryPlan")
  private JsonNode queryPlan;

  @JsonProperty("fullQueryCacheHit")
  private boolean fullQueryCacheHit;

  @JsonProperty("persistedQueryHit")
  private boolean persistedQueryHit;

  @JsonProperty("persistedQueryRegister")
  private boolean persistedQueryRegister;

  @JsonProperty("registeredOperation")
  private boolean registeredOperation;

  @JsonProperty("forbiddenOperation")
  private boolean forbiddenOperation;

  @JsonProperty("fieldExecutionWeight")
  private double fieldExecutionWeight;

  @JsonProperty("unexecutedOperationBody")
  private String unexecutedOperationBody;

  @JsonProperty("unexecutedOperationName")
  private String unexecutedOperationName;

  public Timestamp getStartTime() {
    return startTime;
  }

  public void setStartTime(Timestamp startTime) {
    this.startTime = startTime;
  }

  public Timestamp getEndTime() {
    return endTime;
  }

  public void setEndTime(Timestamp endTime) {
    this.endTime = endTime;
  }

  public long getDurationNs() {
    return durationNs;
  }

  public void setDurationNs(long durationNs) {
    this.durationNs = durationNs;
  }

  public Node getRoot() {
    return root;
  }

  public void setRoot(Node root) {
    this.root = root;
  }

  public Details getDetails() {
    return details;
  }

  public void setDetails(Details details) {
    this.details = details;
  }

  public String getClientName() {
    return clientName;
  }

  public void setClientName(String clientName) {
    this.clientName = clientName;
  }

  public String getClientVersion() {
    return clientVersion;
  }

  public void setClientVersion(String clientVersion) {
    this.clientVersion = clientVersion;
  }

  public Http getHttp() {
    return http;
  }

  public void setHttp(Http http) {
    this.http = http;
  }

  public CachePolicy getCachePolicy() {
    return cachePolicy;
  }

  public void setCachePolicy(CachePolicy cachePolicy) {
    this.cachePolicy = cachePolicy;
  }

  public JsonNode getQueryPlan() {
    return queryPlan;
  }

  public void setQueryPlan(JsonNode queryPlan) {
    this.queryPlan = queryPlan;
  }

  public boolean isFullQueryCacheHit() {
    return fullQueryCacheHit;
  }

  public void setFullQueryCacheHit(boolean fullQueryCacheHit) {
    this.fullQueryCacheHit = fullQueryCacheHit;
  }

  public boolean isPersistedQueryHit() {
    return persistedQueryHit;
  }

  public void setPersistedQueryHit(boolean persistedQueryHit) {
    this.persistedQueryHit = persistedQueryHit;
  }

  public boolean isPersistedQueryRegister() {
    return persistedQueryRegister;
  }

  public void setPersistedQueryRegister(boolean persistedQueryRegister) {
    this.persistedQueryRegister = persistedQueryRegister;
  }

  public boolean isRegisteredOperation() {
    return registeredOperation;
  }

  public void setRegisteredOperation(boolean registeredOperation) {
    this.registeredOperation = registeredOperation;
  }

  public boolean isForbiddenOperation() {
    return forbiddenOperation;
  }

  public void setForbiddenOperation(boolean forbiddenOperation) {
    this.forbiddenOperation = forbiddenOperation;
  }

  public double getFieldExecutionWeight() {
    return fieldExecutionWeight;
  }

  public void setFieldExecutionWeight(double fieldExecutionWeight) {
    this.fieldExecutionWeight = fieldExecutionWeight;
  }

  public String getUnexecutedOperationBody() {
    return unexecutedOperationBody;
  }

  public void setUnexecutedOperationBody(String unexecutedOperationBody) {
    this.unexecutedOperationBody = unexecutedOperationBody;
  }

  public String getUnexecutedOperationName() {
    return unexecutedOperationName;
  }

  public void setUnexecutedOperationName(String unexecutedOperationName) {
    this.unexecutedOperationName = unexecutedOperationName;
  }

  /**
   * One resolved field, or one list element. Exactly one of {@code responseName} and {@code index}
   * is set, except on the root node where neither is.
   */
  @JsonIgnoreProperties(ignoreUnknown = true)
  public static class Node {
    @JsonProperty("responseName")
    private String responseName;

    @JsonProperty("index")
    private Integer index;

    @JsonProperty("originalFieldName")
    private String originalFieldName;

    @JsonProperty("type")
    private String type;

    @JsonProperty("parentType")
    private String parentType;

    @JsonProperty("startTime")
    private long startTime;

    @JsonProperty("endTime")
    private long endTime;

    @JsonProperty("errors")
    private List<Error> errors = new ArrayList<>();

    @JsonProperty("children")
    private List<Node> children = new ArrayList<>();

    public String getResponseName() {
      return responseName;
    }

    public void setResponseName(String responseName) {
      this.responseName = responseName;
    }

    public Integer getIndex() {
      return index;
    }

    public void setIndex(Integer index) {
      this.index = index;
    }

    public String getOriginalFieldName() {
      return originalFieldName;
    }

    public void setOriginalFieldName(String originalFieldName) {
      this.originalFieldName = originalFieldName;
    }

    public String getType() {
      return type;
    }

    public void setType(String type) {
      this.type = type;
    }

    public String getParentType() {
      return parentType;
    }

    public void setParentType(String parentType) {
      this.parentType = parentType;
    }

    /** Nanoseconds since the start of the request. */
    public long getStartTime() {
      return startTime;
    }

    public void setStartTime(long startTime) {
      this.startTime = startTime;
    }

    /** Nanoseconds since the start of the request. */
    public long getEndTime() {
      return endTime;
    }

    public void setEndTime(long endTime) {
      this.endTime = endTime;
    }

    public List<Error> getErrors() {
      return errors;
    }

    public void setErrors(List<Error> errors) {
      this.errors = errors;
    }

    public List<Node> getChildren() {
      return children;
    }

    public void setChildren(List<Node> children) {
      this.children = children;
    }
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  public static class Error {
    @JsonProperty("message")
    private String message;

    @JsonProperty("locations")
    private List<Location> locations = new ArrayList<>();

    @JsonProperty("json")
    private String json;

    public Error() {}

    public Error(String message, List<Location> locations, String json) {
      this.message = message;
      this.locations = locations == null ? new ArrayList<>() : new ArrayList<>(locations);
      this.json = json;
    }

    public String getMessage() {
      return message;
    }

    public void setMessage(String message) {
      this.message = message;
    }

    public List<Location> getLocations() {
      return locations;
    }

    public void setLocations(List<Location> locations) {
      this.locations = locations;
    }

    /** The full error, serialized as JSON. */
    public String getJson() {
      return json;
    }

    public void setJson(String json) {
      this.json = json;
    }
  }

  public record Location(int line, int column) {}

  @JsonIgnoreProperties(ignoreUnknown = true)
  public static class Http {
    @JsonProperty("method")
    private Method method = Method.UNKNOWN;

    @JsonProperty("requestHeaders")
    private Map<String, List<String>> requestHeaders = new LinkedHashMap<>();

    public Method getMethod() {
      return method;
    }

    public void setMethod(Method method) {
      this.method = method;
    }

    public Map<String, List<String>> getRequestHeaders() {
      return requestHeaders;
    }

    public void setRequestHeaders(Map<String, List<String>> requestHeaders) {
      this.requestHeaders = requestHeaders;
    }

    public enum Method {
      UNKNOWN,
      OPTIONS,
      GET,
      HEAD,
      POST,
      PUT,
      DELETE,
      TRACE,
      CONNECT,
      PATCH;

      /** Maps an HTTP method name, falling back to {@link #UNKNOWN}. */
      public static Method fromName(String name) {
        if (name != null) {
          for (Method m : values()) {
            if (m.name().equalsIgnoreCase(name)) return m;
          }
        }
        return UNKNOWN;
      }
    }
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  public static class CachePolicy {
    @JsonProperty("scope")
    private Scope scope = Scope.UNKNOWN;

    @JsonProperty("maxAgeNs")
    private long maxAgeNs;

    public CachePolicy() {}

    public CachePolicy(Scope scope, long maxAgeNs) {
      this.scope = scope;
      this.maxAgeNs = maxAgeNs;
    }

    public Scope getScope() {
      return scope;
    }

    public void setScope(Scope scope) {
      this.scope = scope;
    }

    public long getMaxAgeNs() {
      return maxAgeNs;
    }

    public void setMaxAgeNs(long maxAgeNs) {
      this.maxAgeNs = maxAgeNs;
    }

    public enum Scope {
      UNKNOWN,
      PUBLIC,
      PRIVATE
    }
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  public static class Details {
    @JsonProperty("variablesJson")
    private Map<String, String> variablesJson = new LinkedHashMap<>();

    public Map<String, String> getVariablesJson() {
      return variablesJson;
    }

    public void setVariablesJson(Map<String, String> variablesJson) {
      this.variablesJson = variablesJson;
    }
  }
}
