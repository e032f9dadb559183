package com.cario.docintel.app.model;

import lombok.Value;

/**
 * A file to recognize. The filename is forwarded to the provider as a hint and written to logs;
 * it is never parsed for meaning.
 */
@Value
public class OcrRequest {

  byte[] content;

  String filename;

  String mimeType;

  RecognitionOptions options;

  public long size() {
    return content == null ? 0 : content.length;
  }

  public OcrRequest withOptions(RecognitionOptions newOptions) {
    return new OcrRequest(content, filename, mimeType, newOptions);
  }
}
