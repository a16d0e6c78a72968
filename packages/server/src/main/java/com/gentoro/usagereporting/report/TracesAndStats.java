package com.gentoro.usagereporting.report;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.gentoro.usagereporting.schema.ReferencedFieldsForType;
import com.gentoro.usagereporting.trace.Trace;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Everything a report holds for one stats key: full traces (already encoded), stats per client,
 * and the fields the operation references.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class TracesAndStats {
  @JsonProperty("trace")
  private List<byte[]> trace = new ArrayList<>();

  @JsonIgnore private final Map<StatsContext, ContextualizedStats> statsByContext =
      new LinkedHashMap<>();

  @JsonProperty("referencedFieldsByType")
  private Map<String, ReferencedFieldsForType> referencedFieldsByType = new LinkedHashMap<>();

  public TracesAndStats() {}

  public TracesAndStats(Map<String, ReferencedFieldsForType> referencedFieldsByType) {
    this.referencedFieldsByType = new LinkedHashMap<>(referencedFieldsByType);
  }

  void addEncodedTrace(byte[] encoded) {
    trace.add(encoded);
  }

  void addStats(
      Trace trace, SizeEstimator sizeEstimator, List<NonFtv1ErrorPath> nonFtv1ErrorPaths) {
    StatsContext context = new StatsContext(trace.getClientName(), trace.getClientVersion());
    ContextualizedStats stats = statsByContext.get(context);
    if (stats == null) {
      stats = new ContextualizedStats(context);
      statsByContext.put(context, stats);
      sizeEstimator.add(
          20
              + SizeEstimator.estimatedBytesForString(context.clientName())
              + SizeEstimator.estimatedBytesForString(context.clientVersion()));
    }
    stats.addTrace(trace, sizeEstimator, nonFtv1ErrorPaths);
  }

  void ensureCountsAreIntegers() {
    statsByContext.values().forEach(ContextualizedStats::ensureCountsAreIntegers);
  }

  @JsonIgnore
  public boolean hasStats() {
    return !statsByContext.isEmpty();
  }

  public ContextualizedStats statsFor(StatsContext context) {
    return statsByContext.get(context);
  }

  public List<byte[]> getTrace() {
    return trace;
  }

  public void setTrace(List<byte[]> trace) {
    this.trace = trace;
  }

  @JsonProperty("statsWithContext")
  public List<ContextualizedStats> getStatsWithContext() {
    return new ArrayList<>(statsByContext.values());
  }

  @JsonProperty("statsWithContext")
  public void setStatsWithContext(List<ContextualizedStats> statsWithContext) {
    statsByContext.clear();
    for (ContextualizedStats stats : statsWithContext) {
      statsByContext.put(stats.getContext(), stats);
    }
  }

  public Map<String, ReferencedFieldsForType> getReferencedFieldsByType() {
    return referencedFieldsByType;
  }

  public void setReferencedFieldsByType(
      Map<String, ReferencedFieldsForType> referencedFieldsByType) {
    this.referencedFieldsByType = referencedFieldsByType;
  }
}
