package com.gentoro.usagereporting.cache;

import com.gentoro.usagereporting.logging.LoggingService;
import com.gentoro.usagereporting.schema.OperationDocument;
import com.gentoro.usagereporting.schema.ReferencedFieldsCalculator;
import com.gentoro.usagereporting.schema.SchemaSnapshot;
import com.gentoro.usagereporting.schema.SignatureCalculator;
import com.gentoro.usagereporting.utility.JacksonUtility;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.RemovalCause;
import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;

/**
 * Signature and referenced fields per operation, scoped to one schema snapshot.
 *
 * <p>The cache remembers the snapshot it was built for. A lookup with a different snapshot (by
 * identity) drops every entry and starts a fresh cache before anything is read. Entries are weighed
 * by the byte length of their JSON form and evicted once the configured weight is exceeded.
 *
 * <p>Callers must only pass documents that parsed and validated.
 */
public class OperationDerivedDataCache {
  private static final Logger log = LoggingService.getLogger(OperationDerivedDataCache.class);

  private static final long EVICTION_WARNING_INTERVAL_MS = 60_000;

  private final SignatureCalculator signatureCalculator;
  private final ReferencedFieldsCalculator referencedFieldsCalculator;
  private final long maximumWeightBytes;

  private final AtomicLong computations = new AtomicLong();
  private final AtomicLong evictionsSinceWarning = new AtomicLong();
  private volatile long lastWarningAt = -1;

  private SchemaSnapshot scope;
  private Cache<OperationDerivedDataKey, OperationDerivedData> cache;

  public OperationDerivedDataCache(
      SignatureCalculator signatureCalculator,
      ReferencedFieldsCalculator referencedFieldsCalculator,
      long maximumWeightBytes) {
    this.signatureCalculator = Objects.requireNonNull(signatureCalculator, "signatureCalculator");
    this.referencedFieldsCalculator =
        Objects.requireNonNull(referencedFieldsCalculator, "referencedFieldsCalculator");
    if (maximumWeightBytes <= 0) {
      throw new IllegalArgumentException("maximumWeightBytes must be positive");
    }
    this.maximumWeightBytes = maximumWeightBytes;
  }

  public OperationDerivedData get(
      SchemaSnapshot schema, String queryHash, String operationName, OperationDocument document) {
    if (cache == null || scope != schema) {
      if (cache != null) {
        log.debug("Schema changed, dropping {} cached operation entries", cache.estimatedSize());
      }
      scope = schema;
      cache = newCache();
    }
    return cache.get(
        new OperationDerivedDataKey(queryHash, operationName),
        key -> compute(schema, key.operationName(), document));
  }

  /** Number of times a value had to be computed instead of served from the cache. */
  public long computationCount() {
    return computations.get();
  }

  private OperationDerivedData compute(
      SchemaSnapshot schema, String operationName, OperationDocument document) {
    computations.incrementAndGet();
    return new OperationDerivedData(
        signatureCalculator.signature(document, operationName),
        referencedFieldsCalculator.referencedFieldsByType(document, schema, operationName));
  }

  private Cache<OperationDerivedDataKey, OperationDerivedData> newCache() {
    return Caffeine.newBuilder()
        .maximumWeight(maximumWeightBytes)
        .weigher((OperationDerivedDataKey key, OperationDerivedData value) -> weigh(value))
        .removalListener(
            (OperationDerivedDataKey key, OperationDerivedData value, RemovalCause cause) -> {
              if (cause.wasEvicted()) onEviction();
            })
        .executor(Runnable::run)
        .build();
  }

  private static int weigh(OperationDerivedData value) {
    return JacksonUtility.toJson(value).getBytes(StandardCharsets.UTF_8).length;
  }

  private void onEviction() {
    long evicted = evictionsSinceWarning.incrementAndGet();
    long now = System.currentTimeMillis();
    if (lastWarningAt < 0 || now - lastWarningAt > EVICTION_WARNING_INTERVAL_MS) {
      lastWarningAt = now;
      evictionsSinceWarning.set(0);
      log.warn(
          "This server is processing a high number of unique operations. {} records have been"
              + " evicted from the operation signature cache in the past interval.",
          evicted);
    }
  }
}
