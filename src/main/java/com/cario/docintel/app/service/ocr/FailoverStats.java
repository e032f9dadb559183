package com.cario.docintel.app.service.ocr;

import com.cario.docintel.app.exception.OcrErrorKind;
import com.cario.docintel.app.model.FailoverStatsSnapshot;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Counters for one failover service instance. Every read and write goes through a single lock,
 * so a snapshot is always internally consistent.
 */
public class FailoverStats {

  private final ReentrantLock lock = new ReentrantLock();

  private long totalRequests;
  private final Map<String, Long> providerSuccesses = new TreeMap<>();
  private long confidenceTriggeredFallback;
  private long errorTriggeredFallback;
  private long forcedFallback;
  private long bothFailed;
  private long acceptedWithWarning;
  private final Map<OcrErrorKind, Long> errorsByKind = new EnumMap<>(OcrErrorKind.class);

  void recordRequest() {
    lock.lock();
    try {
      totalRequests++;
    } finally {
      lock.unlock();
    }
  }

  void recordSuccess(String provider) {
    lock.lock();
    try {
      providerSuccesses.merge(provider, 1L, Long::sum);
    } finally {
      lock.unlock();
    }
  }

  void recordError(OcrErrorKind kind) {
    lock.lock();
    try {
      errorsByKind.merge(kind, 1L, Long::sum);
    } finally {
      lock.unlock();
    }
  }

  void recordConfidenceTriggeredFallback() {
    lock.lock();
    try {
      confidenceTriggeredFallback++;
    } finally {
      lock.unlock();
    }
  }

  void recordErrorTriggeredFallback() {
    lock.lock();
    try {
      errorTriggeredFallback++;
    } finally {
      lock.unlock();
    }
  }

  void recordForcedFallback() {
    lock.lock();
    try {
      forcedFallback++;
    } finally {
      lock.unlock();
    }
  }

  void recordBothFailed() {
    lock.lock();
    try {
      bothFailed++;
    } finally {
      lock.unlock();
    }
  }

  void recordAcceptedWithWarning() {
    lock.lock();
    try {
      acceptedWithWarning++;
    } finally {
      lock.unlock();
    }
  }

  public FailoverStatsSnapshot snapshot() {
    lock.lock();
    try {
      long successes = providerSuccesses.values().stream().mapToLong(Long::longValue).sum();
      long fallbacks = confidenceTriggeredFallback + errorTriggeredFallback + forcedFallback;
      Map<String, Long> errors = new LinkedHashMap<>();
      errorsByKind.forEach((kind, count) -> errors.put(kind.name(), count));
      return FailoverStatsSnapshot.builder()
          .totalRequests(totalRequests)
          .providerSuccesses(Map.copyOf(providerSuccesses))
          .confidenceTriggeredFallback(confidenceTriggeredFallback)
          .errorTriggeredFallback(errorTriggeredFallback)
          .forcedFallback(forcedFallback)
          .bothFailed(bothFailed)
          .acceptedWithWarning(acceptedWithWarning)
          .errorsByKind(Map.copyOf(errors))
          .successRate(totalRequests == 0 ? 0.0 : (double) successes / totalRequests)
          .fallbackRate(totalRequests == 0 ? 0.0 : (double) fallbacks / totalRequests)
          .build();
    } finally {
      lock.unlock();
    }
  }

  public void reset() {
    lock.lock();
    try {
      totalRequests = 0;
      providerSuccesses.clear();
      confidenceTriggeredFallback = 0;
      errorTriggeredFallback = 0;
      forcedFallback = 0;
      bothFailed = 0;
      acceptedWithWarning = 0;
      errorsByKind.clear();
    } finally {
      lock.unlock();
    }
  }
}
