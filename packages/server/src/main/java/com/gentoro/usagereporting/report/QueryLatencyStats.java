package com.gentoro.usagereporting.report;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/** Request-level aggregate for one stats key and client. */
@JsonIgnoreProperties(ignoreUnknown = true)
public class QueryLatencyStats {
  @JsonProperty("latencyCount")
  private DurationHistogram latencyCount = new DurationHistogram();

  @JsonProperty("requestCount")
  private long requestCount;

  @JsonProperty("cacheHits")
  private long cacheHits;

  @JsonProperty("persistedQueryHits")
  private long persistedQueryHits;

  @JsonProperty("persistedQueryMisses")
  private long persistedQueryMisses;

  @JsonProperty("cacheLatencyCount")
  private DurationHistogram cacheLatencyCount = new DurationHistogram();

  @JsonProperty("rootErrorStats")
  private PathErrorStats rootErrorStats = new PathErrorStats();

  @JsonProperty("requestsWithErrorsCount")
  private long requestsWithErrorsCount;

  @JsonProperty("publicCacheTtlCount")
  private DurationHistogram publicCacheTtlCount = new DurationHistogram();

  @JsonProperty("privateCacheTtlCount")
  private DurationHistogram privateCacheTtlCount = new DurationHistogram();

  @JsonProperty("registeredOperationCount")
  private long registeredOperationCount;

  @JsonProperty("forbiddenOperationCount")
  private long forbiddenOperationCount;

  @JsonProperty("requestsWithoutFieldInstrumentation")
  private long requestsWithoutFieldInstrumentation;

  void roundCounts() {
    latencyCount.roundCounts();
    cacheLatencyCount.roundCounts();
    publicCacheTtlCount.roundCounts();
    privateCacheTtlCount.roundCounts();
  }

  void incrementRequestCount() {
    requestCount++;
  }

  void incrementCacheHits() {
    cacheHits++;
  }

  void incrementPersistedQueryHits() {
    persistedQueryHits++;
  }

  void incrementPersistedQueryMisses() {
    persistedQueryMisses++;
  }

  void incrementRequestsWithErrors() {
    requestsWithErrorsCount++;
  }

  void incrementRegisteredOperationCount() {
    registeredOperationCount++;
  }

  void incrementForbiddenOperationCount() {
    forbiddenOperationCount++;
  }

  void incrementRequestsWithoutFieldInstrumentation() {
    requestsWithoutFieldInstrumentation++;
  }

  public DurationHistogram getLatencyCount() {
    return latencyCount;
  }

  public void setLatencyCount(DurationHistogram latencyCount) {
    this.latencyCount = latencyCount;
  }

  public long getRequestCount() {
    return requestCount;
  }

  public void setRequestCount(long requestCount) {
    this.requestCount = requestCount;
  }

  public long getCacheHits() {
    return cacheHits;
  }

  public void setCacheHits(long cacheHits) {
    this.cacheHits = cacheHits;
  }

  public long getPersistedQueryHits() {
    return persistedQueryHits;
  }

  public void setPersistedQueryHits(long persistedQueryHits) {
    this.persistedQueryHits = persistedQueryHits;
  }

  public long getPersistedQueryMisses() {
    return persistedQueryMisses;
  }

  public void setPersistedQueryMisses(long persistedQueryMisses) {
    this.persistedQueryMisses = persistedQueryMisses;
  }

  public DurationHistogram getCacheLatencyCount() {
    return cacheLatencyCount;
  }

  public void setCacheLatencyCount(DurationHistogram cacheLatencyCount) {
    this.cacheLatencyCount = cacheLatencyCount;
  }

  public PathErrorStats getRootErrorStats() {
    return rootErrorStats;
  }

  public void setRootErrorStats(PathErrorStats rootErrorStats) {
    this.rootErrorStats = rootErrorStats;
  }

  public long getRequestsWithErrorsCount() {
    return requestsWithErrorsCount;
  }

  public void setRequestsWithErrorsCount(long requestsWithErrorsCount) {
    this.requestsWithErrorsCount = requestsWithErrorsCount;
  }

  public DurationHistogram getPublicCacheTtlCount() {
    return publicCacheTtlCount;
  }

  public void setPublicCacheTtlCount(DurationHistogram publicCacheTtlCount) {
    this.publicCacheTtlCount = publicCacheTtlCount;
  }

  public DurationHistogram getPrivateCacheTtlCount() {
    return privateCacheTtlCount;
  }

  public void setPrivateCacheTtlCount(DurationHistogram privateCacheTtlCount) {
    this.privateCacheTtlCount = privateCacheTtlCount;
  }

  public long getRegisteredOperationCount() {
    return registeredOperationCount;
  }

  public void setRegisteredOperationCount(long registeredOperationCount) {
    this.registeredOperationCount = registeredOperationCount;
  }

  public long getForbiddenOperationCount() {
    return forbiddenOperationCount;
  }

  public void setForbiddenOperationCount(long forbiddenOperationCount) {
    this.forbiddenOperationCount = forbiddenOperationCount;
  }

  public long getRequestsWithoutFieldInstrumentation() {
    return requestsWithoutFieldInstrumentation;
  }

  public void setRequestsWithoutFieldInstrumentation(long requestsWithoutFieldInstrumentation) {
    this.requestsWithoutFieldInstrumentation = requestsWithoutFieldInstrumentation;
  }
}
