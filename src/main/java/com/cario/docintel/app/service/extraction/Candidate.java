package com.cario.docintel.app.service.extraction;

import lombok.Value;

/** An accepted match competing for a {@link SelectionMode#BEST_CANDIDATE} field. */
@Value
public class Candidate {
  Object value;
  String raw;
  int patternIndex;
  int patternCount;
  int position;
}
