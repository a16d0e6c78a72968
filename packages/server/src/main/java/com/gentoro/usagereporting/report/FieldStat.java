package com.gentoro.usagereporting.report;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public class FieldStat {
  @JsonProperty("returnType")
  private String returnType;

  @JsonProperty("errorsCount")
  private long errorsCount;

  @JsonProperty("observedExecutionCount")
  private long observedExecutionCount;

  /** Sum of field execution weights; rounded before the report is sent. */
  @JsonProperty("estimatedExecutionCount")
  private double estimatedExecutionCount;

  @JsonProperty("requestsWithErrorsCount")
  private long requestsWithErrorsCount;

  @JsonProperty("latencyCount")
  private DurationHistogram latencyCount = new DurationHistogram();

  public FieldStat() {}

  public FieldStat(String returnType) {
    this.returnType = returnType;
  }

  void record(int errors, long durationNs, double weight) {
    errorsCount += errors;
    observedExecutionCount++;
    estimatedExecutionCount += weight;
    if (errors > 0) requestsWithErrorsCount++;
    latencyCount.incrementDuration(durationNs, weight);
  }

  void ensureCountsAreIntegers() {
    estimatedExecutionCount = Math.round(estimatedExecutionCount);
    latencyCount.roundCounts();
  }

  public String getReturnType() {
    return returnType;
  }

  public void setReturnType(String returnType) {
    this.returnType = returnType;
  }

  public long getErrorsCount() {
    return errorsCount;
  }

  public void setErrorsCount(long errorsCount) {
    this.errorsCount = errorsCount;
  }

  public long getObservedExecutionCount() {
    return observedExecutionCount;
  }

  public void setObservedExecutionCount(long observedExecutionCount) {
    this.observedExecutionCount = observedExecutionCount;
  }

  public double getEstimatedExecutionCount() {
    return estimatedExecutionCount;
  }

  public void setEstimatedExecutionCount(double estimatedExecutionCount) {
    this.estimatedExecutionCount = estimatedExecutionCount;
  }

  public long getRequestsWithErrorsCount() {
    return requestsWithErrorsCount;
  }

  public void setRequestsWithErrorsCount(long requestsWithErrorsCount) {
    this.requestsWithErrorsCount = requestsWithErrorsCount;
  }

  public DurationHistogram getLatencyCount() {
    return latencyCount;
  }

  public void setLatencyCount(DurationHistogram latencyCount) {
    this.latencyCount = latencyCount;
  }
}
