package io.github.themoah.loadlens.model;

import java.util.Locale;

/**
 * Ordered severity bands. The score feeds the impact formula.
 */
public enum Severity {
  LOW(1),
  MEDIUM(2),
  HIGH(3),
  CRITICAL(4);

  private final int score;

  Severity(int score) {
    this.score = score;
  }

  public int score() {
    return score;
  }

  public static Severity max(Severity a, Severity b) {
    return a.compareTo(b) >= 0 ? a : b;
  }

  /**
   * Returns a lowercase representation used in report payloads.
   */
  public String label() {
    return name().toLowerCase(Locale.ROOT);
  }
}
