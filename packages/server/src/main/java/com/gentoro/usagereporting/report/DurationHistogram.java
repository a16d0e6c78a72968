package com.gentoro.usagereporting.report;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Logarithmic latency histogram.
 *
 * <p>Bucket {@code i} holds durations in {@code (1.1^(i-1), 1.1^i]} microseconds, so a recorded
 * duration is known within about 10%. There are at most {@value #BUCKET_COUNT} buckets whatever
 * the traffic, and two histograms merge by adding buckets. Counts are doubles because field
 * executions can be recorded with a sampling weight.
 *
 * <p>The serialized form is the bucket array with trailing empty buckets dropped and each run of
 * two or more empty buckets replaced by its negated length.
 */
public class DurationHistogram {
  public static final int BUCKET_COUNT = 384;
  private static final double EXPONENT_LOG = Math.log(1.1);
  private static final int INITIAL_SIZE = 74;

  private double[] buckets;

  public DurationHistogram() {
    this.buckets = new double[INITIAL_SIZE];
  }

  private DurationHistogram(double[] buckets) {
    this.buckets = buckets;
  }

  public static int durationToBucket(long durationNs) {
    double log = Math.log(durationNs / 1000.0);
    double unbounded = Math.ceil(log / EXPONENT_LOG);
    if (Double.isNaN(unbounded) || unbounded <= 0) return 0;
    if (unbounded >= BUCKET_COUNT) return BUCKET_COUNT - 1;
    return (int) unbounded;
  }

  public DurationHistogram incrementDuration(long durationNs) {
    return incrementDuration(durationNs, 1);
  }

  public DurationHistogram incrementDuration(long durationNs, double weight) {
    incrementBucket(durationToBucket(durationNs), weight);
    return this;
  }

  public void incrementBucket(int bucket, double weight) {
    if (bucket < 0 || bucket >= BUCKET_COUNT) {
      throw new IllegalArgumentException("Bucket out of range: " + bucket);
    }
    if (bucket >= buckets.length) {
      buckets = Arrays.copyOf(buckets, BUCKET_COUNT);
    }
    buckets[bucket] += weight;
  }

  public void combine(DurationHistogram other) {
    for (int i = 0; i < other.buckets.length; i++) {
      if (other.buckets[i] != 0) incrementBucket(i, other.buckets[i]);
    }
  }

  public double bucket(int index) {
    return index < buckets.length ? buckets[index] : 0;
  }

  public double totalCount() {
    double total = 0;
    for (double b : buckets) total += b;
    return total;
  }

  void roundCounts() {
    for (int i = 0; i < buckets.length; i++) {
      buckets[i] = Math.round(buckets[i]);
    }
  }

  @JsonValue
  public long[] toArray() {
    List<Long> out = new ArrayList<>();
    int bufferedZeroes = 0;
    for (double value : buckets) {
      long count = (long) Math.floor(value);
      if (count == 0) {
        bufferedZeroes++;
        continue;
      }
      if (bufferedZeroes == 1) {
        out.add(0L);
      } else if (bufferedZeroes > 1) {
        out.add((long) -bufferedZeroes);
      }
      out.add(count);
      bufferedZeroes = 0;
    }
    return out.stream().mapToLong(Long::longValue).toArray();
  }

  @JsonCreator
  public static DurationHistogram fromArray(long[] encoded) {
    double[] buckets = new double[BUCKET_COUNT];
    int i = 0;
    for (long value : encoded) {
      if (value < 0) {
        i += (int) -value;
      } else {
        if (i >= BUCKET_COUNT) {
          throw new IllegalArgumentException(
              "Histogram has more than " + BUCKET_COUNT + " buckets");
        }
        buckets[i++] = value;
      }
    }
    return new DurationHistogram(buckets);
  }
}
