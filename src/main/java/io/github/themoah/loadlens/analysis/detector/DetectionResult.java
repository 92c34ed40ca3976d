package io.github.themoah.loadlens.analysis.detector;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * OR-combined flags of every applicable detector for one metric, with the
 * names of the detectors that flagged each sample. The flag array is copied
 * on the way in and out.
 *
 * @param flags one flag per sample
 * @param provenance detector names per sample, empty where not flagged
 */
public record DetectionResult(
  boolean[] flags,
  List<Set<String>> provenance
) {

  public DetectionResult {
    flags = flags.clone();
    provenance = provenance.stream()
      .map(names -> Collections.unmodifiableSet(new TreeSet<>(names)))
      .toList();
  }

  @Override
  public boolean[] flags() {
    return flags.clone();
  }

  public boolean isFlagged(int index) {
    return flags[index];
  }

  public Set<String> detectorsAt(int index) {
    return provenance.get(index);
  }

  public boolean anyFlagged() {
    for (boolean flag : flags) {
      if (flag) {
        return true;
      }
    }
    return false;
  }

  public int flaggedCount() {
    int count = 0;
    for (boolean flag : flags) {
      if (flag) {
        count++;
      }
    }
    return count;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    return o instanceof DetectionResult other
      && Arrays.equals(flags, other.flags)
      && provenance.equals(other.provenance);
  }

  @Override
  public int hashCode() {
    return 31 * Arrays.hashCode(flags) + provenance.hashCode();
  }

  @Override
  public String toString() {
    return "DetectionResult[flagged=" + flaggedCount() + "/" + flags.length + "]";
  }
}
