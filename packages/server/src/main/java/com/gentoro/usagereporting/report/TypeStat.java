package com.gentoro.usagereporting.report;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.LinkedHashMap;
import java.util.Map;

@JsonIgnoreProperties(ignoreUnknown = true)
public class TypeStat {
  @JsonProperty("perFieldStat")
  private Map<String, FieldStat> perFieldStat = new LinkedHashMap<>();

  public FieldStat fieldStat(String fieldName, String returnType, SizeEstimator sizeEstimator) {
    FieldStat existing = perFieldStat.get(fieldName);
    if (existing != null) return existing;
    FieldStat stat = new FieldStat(returnType);
    perFieldStat.put(fieldName, stat);
    sizeEstimator.add(
        SizeEstimator.estimatedBytesForString(fieldName)
            + SizeEstimator.estimatedBytesForString(returnType)
            + 10);
    return stat;
  }

  void ensureCountsAreIntegers() {
    perFieldStat.values().forEach(FieldStat::ensureCountsAreIntegers);
  }

  public Map<String, FieldStat> getPerFieldStat() {
    return perFieldStat;
  }

  public void setPerFieldStat(Map<String, FieldStat> perFieldStat) {
    this.perFieldStat = perFieldStat;
  }
}
