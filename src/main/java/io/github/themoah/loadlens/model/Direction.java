package io.github.themoah.loadlens.model;

import java.util.Locale;

/**
 * Whether an anomalous window sits above or below its baseline.
 */
public enum Direction {
  INCREASE,
  DECREASE;

  public String label() {
    return name().toLowerCase(Locale.ROOT);
  }

  public String verb() {
    return this == INCREASE ? "increased" : "decreased";
  }
}
