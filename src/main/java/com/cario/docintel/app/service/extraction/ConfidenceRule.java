package com.cario.docintel.app.service.extraction;

import java.util.List;
import java.util.Map;
import java.util.function.Predicate;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * Confidence as data: a weighted sum over present fields, then the first matching tier (which
 * either sets the score or lifts it to a floor), then additive bonuses, then the first step of
 * the signal ladder whose count is reached. Clamped to [0, 1]; 0.0 when no field is present.
 */
@Value
@Builder
public class ConfidenceRule {

  @Singular Map<String, Double> weights;

  /** Checked in order; only the first match applies. */
  @Singular List<Tier> tiers;

  @Singular("bonus") List<Bonus> bonuses;

  /** Signal-count field the ladder reads, or null for no ladder. */
  String signalField;

  /** Highest threshold first; only the first reached step applies. */
  @Singular("signalStep") List<SignalStep> signalLadder;

  public double score(FieldExtraction fields) {
    if (fields.presentCount() == 0) {
      return 0.0;
    }
    double score = 0.0;
    for (Map.Entry<String, Double> weight : weights.entrySet()) {
      if (fields.has(weight.getKey())) {
        score += weight.getValue();
      }
    }
    for (Tier tier : tiers) {
      if (tier.getWhen().test(fields)) {
        score = tier.isFloor() ? Math.max(score, tier.getValue()) : tier.getValue();
        break;
      }
    }
    for (Bonus bonus : bonuses) {
      if (bonus.getWhen().test(fields)) {
        score += bonus.getAmount();
      }
    }
    if (signalField != null) {
      int count = fields.signalCount(signalField);
      for (SignalStep step : signalLadder) {
        if (count >= step.getMinimumCount()) {
          score += step.getBoost();
          break;
        }
      }
    }
    return Math.max(0.0, Math.min(1.0, score));
  }

  @Value
  public static class Tier {
    String label;
    Predicate<FieldExtraction> when;
    double value;
    /** True: raise to at least {@code value}. False: set to {@code value}. */
    boolean floor;

    public static Tier set(String label, Predicate<FieldExtraction> when, double value) {
      return new Tier(label, when, value, false);
    }

    public static Tier floor(String label, Predicate<FieldExtraction> when, double value) {
      return new Tier(label, when, value, true);
    }
  }

  @Value
  public static class Bonus {
    String label;
    Predicate<FieldExtraction> when;
    double amount;
  }

  @Value
  public static class SignalStep {
    int minimumCount;
    double boost;
  }
}
