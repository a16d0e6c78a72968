package com.gentoro.usagereporting.plugin;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.usagereporting.trace.Timestamp;
import com.gentoro.usagereporting.trace.Trace;
import java.time.Instant;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class DefaultSendOperationsAsTraceTest {

  private final DefaultSendOperationsAsTrace sampler = new DefaultSendOperationsAsTrace();

  private static Trace trace(String endTime, long durationNs, boolean withError) {
    Trace trace = new Trace();
    trace.setEndTime(Timestamp.of(Instant.parse(endTime)));
    trace.setDurationNs(durationNs);
    Trace.Node root = new Trace.Node();
    if (withError) {
      Trace.Node child = new Trace.Node();
      child.getErrors().add(new Trace.Error("boom", null, "{}"));
      root.getChildren().add(child);
    }
    trace.setRoot(root);
    return trace;
  }

  @Test
  @DisplayName("One trace per key, duration bucket and minute")
  void samplesOncePerMinute() {
    assertTrue(sampler.shouldSend(trace("2024-05-01T10:00:01Z", 1_500, false), "k"));
    assertFalse(sampler.shouldSend(trace("2024-05-01T10:00:59Z", 1_500, false), "k"));

    assertTrue(sampler.shouldSend(trace("2024-05-01T10:01:00Z", 1_500, false), "k"));
    assertTrue(sampler.shouldSend(trace("2024-05-01T10:00:02Z", 1_500, false), "other"));
    assertTrue(sampler.shouldSend(trace("2024-05-01T10:00:02Z", 900_000_000, false), "k"));
  }

  @Test
  void tracesWithErrorsAreSampledEveryFiveSeconds() {
    assertTrue(sampler.shouldSend(trace("2024-05-01T10:00:01Z", 1_500, true), "k"));
    assertFalse(sampler.shouldSend(trace("2024-05-01T10:00:04Z", 1_500, true), "k"));
    assertTrue(sampler.shouldSend(trace("2024-05-01T10:00:06Z", 1_500, true), "k"));
  }

  @Test
  void requiresEndTime() {
    Trace trace = new Trace();

    assertThrows(IllegalStateException.class, () -> sampler.shouldSend(trace, "k"));
  }

  @Test
  void samplingRateBounds() {
    RequestContext context = new RequestContext();
    assertEquals(0, FieldLevelInstrumentation.sampled(0).weight(context));
    assertEquals(1, FieldLevelInstrumentation.sampled(1).weight(context));
    double weight = FieldLevelInstrumentation.sampled(0.25).weight(context);
    assertTrue(weight == 0 || weight == 4);
    assertThrows(IllegalArgumentException.class, () -> FieldLevelInstrumentation.sampled(1.5));
  }
}
