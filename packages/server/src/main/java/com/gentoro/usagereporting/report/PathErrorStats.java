package com.gentoro.usagereporting.report;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.LinkedHashMap;
import java.util.Map;

/** Error counts for one response path segment, with the segments below it. */
@JsonIgnoreProperties(ignoreUnknown = true)
public class PathErrorStats {
  @JsonProperty("children")
  private Map<String, PathErrorStats> children = new LinkedHashMap<>();

  @JsonProperty("errorsCount")
  private long errorsCount;

  @JsonProperty("requestsWithErrorsCount")
  private long requestsWithErrorsCount;

  public PathErrorStats child(String segment, SizeEstimator sizeEstimator) {
    PathErrorStats existing = children.get(segment);
    if (existing != null) return existing;
    PathErrorStats child = new PathErrorStats();
    children.put(segment, child);
    sizeEstimator.add(SizeEstimator.estimatedBytesForString(segment) + 4);
    return child;
  }

  public Map<String, PathErrorStats> getChildren() {
    return children;
  }

  public void setChildren(Map<String, PathErrorStats> children) {
    this.children = children;
  }

  public long getErrorsCount() {
    return errorsCount;
  }

  public void setErrorsCount(long errorsCount) {
    this.errorsCount = errorsCount;
  }

  public long getRequestsWithErrorsCount() {
    return requestsWithErrorsCount;
  }

  public void setRequestsWithErrorsCount(long requestsWithErrorsCount) {
    this.requestsWithErrorsCount = requestsWithErrorsCount;
  }

  void addErrors(long count) {
    errorsCount += count;
  }

  void incrementRequestsWithErrors() {
    requestsWithErrorsCount++;
  }
}
