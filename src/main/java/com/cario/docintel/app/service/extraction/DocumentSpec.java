package com.cario.docintel.app.service.extraction;

import com.cario.docintel.app.model.DocumentType;
import java.util.List;
import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/** Everything needed to parse one document type: field table, scorer, gate and normalizer. */
@Value
@Builder
public class DocumentSpec {

  @NonNull DocumentType type;

  /** In output order. */
  @Singular List<FieldSpec> fields;

  @NonNull ConfidenceRule confidenceRule;

  @NonNull VerificationRule requirement;

  double threshold;

  @Builder.Default TextNormalizer normalizer = TextNormalizer.standard();
}
