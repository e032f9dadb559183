package com.cario.docintel.app.service.extraction;

import com.cario.docintel.app.model.FieldMatch;
import com.cario.docintel.app.model.SignalEvidence;
import java.util.Map;
import lombok.Value;

/** Values and audit details for every field of one document table, in table order. */
@Value
public class FieldExtraction {

  /** Field name to value; absent fields map to null. */
  Map<String, Object> values;

  Map<String, FieldMatch> details;

  public boolean has(String field) {
    return values.get(field) != null;
  }

  public Object get(String field) {
    return values.get(field);
  }

  public <T> T get(String field, Class<T> type) {
    Object value = values.get(field);
    return type.isInstance(value) ? type.cast(value) : null;
  }

  /** Indicator count for a signal-count field, 0 when absent. */
  public int signalCount(String field) {
    Object value = values.get(field);
    return value instanceof SignalEvidence ? ((SignalEvidence) value).getCount() : 0;
  }

  /** Length of a field's text form, 0 when absent. */
  public int textLength(String field) {
    Object value = values.get(field);
    return value == null ? 0 : value.toString().length();
  }

  public int presentCount() {
    return (int) values.values().stream().filter(v -> v != null).count();
  }
}
