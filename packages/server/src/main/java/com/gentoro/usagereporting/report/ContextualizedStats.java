package com.gentoro.usagereporting.report;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.gentoro.usagereporting.trace.Trace;
import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/** Aggregate of the traces that share a stats key and a client. */
@JsonIgnoreProperties(ignoreUnknown = true)
public class ContextualizedStats {
  @JsonProperty("context")
  private StatsContext context;

  @JsonProperty("queryLatencyStats")
  private QueryLatencyStats queryLatencyStats = new QueryLatencyStats();

  @JsonProperty("perTypeStat")
  private Map<String, TypeStat> perTypeStat = new LinkedHashMap<>();

  public ContextualizedStats() {}

  public ContextualizedStats(StatsContext context) {
    this.context = context;
  }

  /** Folds one trace into this aggregate, growing the size estimate for every new entry. */
  public void addTrace(
      Trace trace, SizeEstimator sizeEstimator, List<NonFtv1ErrorPath> nonFtv1ErrorPaths) {
    double fieldExecutionWeight = trace.getFieldExecutionWeight();
    if (fieldExecutionWeight == 0) {
      queryLatencyStats.incrementRequestsWithoutFieldInstrumentation();
    }

    queryLatencyStats.incrementRequestCount();
    if (trace.isFullQueryCacheHit()) {
      queryLatencyStats.getCacheLatencyCount().incrementDuration(trace.getDurationNs());
      queryLatencyStats.incrementCacheHits();
    } else {
      queryLatencyStats.getLatencyCount().incrementDuration(trace.getDurationNs());
    }

    Trace.CachePolicy cachePolicy = trace.getCachePolicy();
    if (!trace.isFullQueryCacheHit() && cachePolicy != null) {
      switch (cachePolicy.getScope()) {
        case PRIVATE -> queryLatencyStats
            .getPrivateCacheTtlCount()
            .incrementDuration(cachePolicy.getMaxAgeNs());
        case PUBLIC -> queryLatencyStats
            .getPublicCacheTtlCount()
            .incrementDuration(cachePolicy.getMaxAgeNs());
        default -> {}
      }
    }

    if (trace.isPersistedQueryHit()) queryLatencyStats.incrementPersistedQueryHits();
    if (trace.isPersistedQueryRegister()) queryLatencyStats.incrementPersistedQueryMisses();
    if (trace.isForbiddenOperation()) queryLatencyStats.incrementForbiddenOperationCount();
    if (trace.isRegisteredOperation()) queryLatencyStats.incrementRegisteredOperationCount();

    Set<PathErrorStats> errorPathStats = Collections.newSetFromMap(new IdentityHashMap<>());
    boolean hasError = false;

    if (trace.getRoot() != null) {
      hasError =
          visit(
              trace.getRoot(),
              new ArrayList<>(),
              fieldExecutionWeight,
              sizeEstimator,
              errorPathStats);
    }

    for (NonFtv1ErrorPath errorPath : nonFtv1ErrorPaths) {
      hasError = true;
      if (errorPath.path() == null) continue;
      PathErrorStats current =
          queryLatencyStats
              .getRootErrorStats()
              .child("service:" + errorPath.subgraph(), sizeEstimator);
      for (Object segment : errorPath.path()) {
        if (segment instanceof String field) {
          current = current.child(field, sizeEstimator);
        }
      }
      errorPathStats.add(current);
      current.addErrors(1);
    }

    for (PathErrorStats stats : errorPathStats) {
      stats.incrementRequestsWithErrors();
    }
    if (hasError) {
      queryLatencyStats.incrementRequestsWithErrors();
    }
  }

  private boolean visit(
      Trace.Node node,
      List<String> path,
      double fieldExecutionWeight,
      SizeEstimator sizeEstimator,
      Set<PathErrorStats> errorPathStats) {
    boolean hasError = false;
    int errors = node.getErrors() == null ? 0 : node.getErrors().size();

    if (errors > 0) {
      hasError = true;
      PathErrorStats current = queryLatencyStats.getRootErrorStats();
      for (String segment : path) {
        current = current.child(segment, sizeEstimator);
      }
      current.addErrors(errors);
      errorPathStats.add(current);
    }

    if (fieldExecutionWeight != 0) {
      String fieldName =
          node.getOriginalFieldName() != null && !node.getOriginalFieldName().isEmpty()
              ? node.getOriginalFieldName()
              : node.getResponseName();
      if (node.getParentType() != null
          && fieldName != null
          && !fieldName.isEmpty()
          && node.getType() != null
          && node.getEndTime() >= node.getStartTime()) {
        typeStat(node.getParentType(), sizeEstimator)
            .fieldStat(fieldName, node.getType(), sizeEstimator)
            .record(errors, node.getEndTime() - node.getStartTime(), fieldExecutionWeight);
      }
    }

    if (node.getChildren() != null) {
      for (Trace.Node child : node.getChildren()) {
        List<String> childPath = path;
        if (child.getResponseName() != null) {
          childPath = new ArrayList<>(path);
          childPath.add(child.getResponseName());
        }
        hasError |= visit(child, childPath, fieldExecutionWeight, sizeEstimator, errorPathStats);
      }
    }
    return hasError;
  }

  private TypeStat typeStat(String parentType, SizeEstimator sizeEstimator) {
    TypeStat existing = perTypeStat.get(parentType);
    if (existing != null) return existing;
    TypeStat stat = new TypeStat();
    perTypeStat.put(parentType, stat);
    sizeEstimator.add(SizeEstimator.estimatedBytesForString(parentType) + 4);
    return stat;
  }

  void ensureCountsAreIntegers() {
    queryLatencyStats.roundCounts();
    perTypeStat.values().forEach(TypeStat::ensureCountsAreIntegers);
  }

  public StatsContext getContext() {
    return context;
  }

  public void setContext(StatsContext context) {
    this.context = context;
  }

  public QueryLatencyStats getQueryLatencyStats() {
    return queryLatencyStats;
  }

  public void setQueryLatencyStats(QueryLatencyStats queryLatencyStats) {
    this.queryLatencyStats = queryLatencyStats;
  }

  public Map<String, TypeStat> getPerTypeStat() {
    return perTypeStat;
  }

  public void setPerTypeStat(Map<String, TypeStat> perTypeStat) {
    this.perTypeStat = perTypeStat;
  }
}
