package com.cario.docintel.app.exception;

/** Classification of a provider failure, used for routing and for per-kind failover counters. */
public enum OcrErrorKind {
  AUTHENTICATION,
  RATE_LIMIT,
  PROCESSING,
  TIMEOUT,
  VALIDATION,
  TRANSPORT
}
