package com.gentoro.usagereporting.plugin;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.usagereporting.report.NonFtv1ErrorPath;
import java.util.ArrayList;
import java.util.List;

/** Facts about a request that the host and other plugins record while serving it. */
public class RequestMetrics {
  private boolean persistedQueryHit;
  private boolean persistedQueryRegister;
  private boolean responseCacheHit;
  private boolean forbiddenOperation;
  private boolean registeredOperation;
  private Boolean captureTraces;
  private JsonNode queryPlanTrace;
  private List<NonFtv1ErrorPath> nonFtv1ErrorPaths = new ArrayList<>();

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

  public boolean isResponseCacheHit() {
    return responseCacheHit;
  }

  public void setResponseCacheHit(boolean responseCacheHit) {
    this.responseCacheHit = responseCacheHit;
  }

  public boolean isForbiddenOperation() {
    return forbiddenOperation;
  }

  public void setForbiddenOperation(boolean forbiddenOperation) {
    this.forbiddenOperation = forbiddenOperation;
  }

  public boolean isRegisteredOperation() {
    return registeredOperation;
  }

  public void setRegisteredOperation(boolean registeredOperation) {
    this.registeredOperation = registeredOperation;
  }

  /** Whether field resolution is traced; null until someone decided. */
  public Boolean getCaptureTraces() {
    return captureTraces;
  }

  public void setCaptureTraces(Boolean captureTraces) {
    this.captureTraces = captureTraces;
  }

  public JsonNode getQueryPlanTrace() {
    return queryPlanTrace;
  }

  public void setQueryPlanTrace(JsonNode queryPlanTrace) {
    this.queryPlanTrace = queryPlanTrace;
  }

  public List<NonFtv1ErrorPath> getNonFtv1ErrorPaths() {
    return nonFtv1ErrorPaths;
  }

  public void setNonFtv1ErrorPaths(List<NonFtv1ErrorPath> nonFtv1ErrorPaths) {
    this.nonFtv1ErrorPaths = nonFtv1ErrorPaths == null ? new ArrayList<>() : nonFtv1ErrorPaths;
  }
}
