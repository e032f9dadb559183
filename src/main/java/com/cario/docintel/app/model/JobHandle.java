package com.cario.docintel.app.model;

import java.time.Instant;
import lombok.Value;

/** Opaque handle returned by a successful submit; used to poll the job. */
@Value
public class JobHandle {
  String provider;
  String requestId;
  String checkUrl;
  Instant submittedAt;
}
