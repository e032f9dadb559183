package com.cario.docintel.app.service.extraction;

import java.util.Optional;

/**
 * Turns raw captured text into a typed field value. An empty result rejects the match, and the
 * extractor moves on to the next occurrence or pattern.
 */
@FunctionalInterface
public interface ValueParser<T> {

  Optional<T> parse(String raw);
}
