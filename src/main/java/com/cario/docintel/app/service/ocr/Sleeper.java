package com.cario.docintel.app.service.ocr;

import java.time.Duration;

/** Waits between polls. Swapped for a recording or no-op implementation in tests. */
@FunctionalInterface
public interface Sleeper {

  void sleep(Duration duration) throws InterruptedException;

  static Sleeper threadSleep() {
    return duration -> Thread.sleep(duration.toMillis());
  }
}
