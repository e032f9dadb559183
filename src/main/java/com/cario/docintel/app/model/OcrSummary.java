package com.cario.docintel.app.model;

import java.util.List;
import lombok.Value;

/** OCR metadata attached to an extraction that came through the full pipeline. */
@Value
public class OcrSummary {
  String provider;
  double averageConfidence;
  int pageCount;
  RecognitionRoute route;
  List<String> warnings;
}
