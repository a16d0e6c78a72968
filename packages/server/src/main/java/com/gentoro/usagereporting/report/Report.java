package com.gentoro.usagereporting.report;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.gentoro.usagereporting.trace.Timestamp;
import java.util.LinkedHashMap;
import java.util.Map;

/** The unit of delivery: everything recorded for one schema during one flush window. */
@JsonIgnoreProperties(ignoreUnknown = true)
public class Report {
  @JsonProperty("header")
  private ReportHeader header;

  @JsonProperty("tracesPerQuery")
  private Map<String, TracesAndStats> tracesPerQuery = new LinkedHashMap<>();

  @JsonProperty("endTime")
  private Timestamp endTime;

  @JsonProperty("operationCount")
  private long operationCount;

  public Report() {}

  public Report(ReportHeader header) {
    this.header = header;
  }

  public ReportHeader getHeader() {
    return header;
  }

  public void setHeader(ReportHeader header) {
    this.header = header;
  }

  public Map<String, TracesAndStats> getTracesPerQuery() {
    return tracesPerQuery;
  }

  public void setTracesPerQuery(Map<String, TracesAndStats> tracesPerQuery) {
    this.tracesPerQuery = tracesPerQuery;
  }

  public Timestamp getEndTime() {
    return endTime;
  }

  public void setEndTime(Timestamp endTime) {
    this.endTime = endTime;
  }

  public long getOperationCount() {
    return operationCount;
  }

  public void setOperationCount(long operationCount) {
    this.operationCount = operationCount;
  }
}
