package com.gentoro.usagereporting.scheduler;

import com.gentoro.usagereporting.report.ReportAccumulator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Live reports by executable schema id.
 *
 * <p>A schema id has at most one live report. It is created on first use, removed by {@link
 * #detach(String)} when it is flushed, and created again on the next use. Callers fetch the live
 * report right before each mutation and never keep it across a flush.
 *
 * <p>Only the reporting loop thread may use a registry.
 */
public class ReportRegistry {
  private final Map<String, ReportAccumulator> live = new LinkedHashMap<>();
  private final Function<String, ReportAccumulator> factory;

  public ReportRegistry(Function<String, ReportAccumulator> factory) {
    this.factory = factory;
  }

  /** The live report for the schema id, created when there is none. */
  public ReportAccumulator ensure(String executableSchemaId) {
    return live.computeIfAbsent(executableSchemaId, factory);
  }

  /** Removes and returns the live report, or null when there is none. */
  public ReportAccumulator detach(String executableSchemaId) {
    return live.remove(executableSchemaId);
  }

  public ReportAccumulator peek(String executableSchemaId) {
    return live.get(executableSchemaId);
  }

  public List<String> schemaIds() {
    return List.copyOf(live.keySet());
  }

  public boolean isEmpty() {
    return live.isEmpty();
  }
}
