package io.github.themoah.loadlens.analysis.detector;

import static io.github.themoah.loadlens.analysis.FrameFixtures.constant;
import static io.github.themoah.loadlens.analysis.FrameFixtures.frame;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.themoah.loadlens.config.DetectorSettings;
import io.github.themoah.loadlens.model.AnalysisMode;
import io.github.themoah.loadlens.model.ScopeFrame;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for DetectorChain.
 */
public class DetectorChainTest {

  private static final double[] SERIES = constant(10, 100);
  private static final DetectionContext CONTEXT = new DetectionContext(
    frame(ScopeFrame.OVERALL, "rt_avg", SERIES), "rt_avg", AnalysisMode.FIXED_LOAD, DetectorSettings.defaults());

  private static MetricDetector flagging(String name, boolean contextFiltered, int... indices) {
    return new MetricDetector() {
      @Override
      public String name() {
        return name;
      }

      @Override
      public boolean appliesTo(DetectionContext context) {
        return true;
      }

      @Override
      public boolean[] detect(double[] series, DetectionContext context) {
        boolean[] flags = new boolean[series.length];
        for (int index : indices) {
          flags[index] = true;
        }
        return flags;
      }

      @Override
      public boolean contextFiltered() {
        return contextFiltered;
      }
    };
  }

  private static MetricDetector throwing() {
    return new MetricDetector() {
      @Override
      public String name() {
        return "broken";
      }

      @Override
      public boolean appliesTo(DetectionContext context) {
        return true;
      }

      @Override
      public boolean[] detect(double[] series, DetectionContext context) {
        throw new IllegalArgumentException("malformed input");
      }
    };
  }

  @Test
  void flagsAreOredWithProvenance() {
    DetectorChain chain = new DetectorChain(List.of(flagging("a", false, 2, 3), flagging("b", false, 3)));

    DetectionResult result = chain.run(SERIES, CONTEXT);

    assertTrue(result.isFlagged(2));
    assertTrue(result.isFlagged(3));
    assertFalse(result.isFlagged(4));
    assertEquals(Set.of("a"), result.detectorsAt(2));
    assertEquals(Set.of("a", "b"), result.detectorsAt(3));
    assertEquals(2, result.flaggedCount());
  }

  @Test
  void throwingDetector_skipped() {
    DetectorChain chain = new DetectorChain(List.of(throwing(), flagging("ok", false, 5)));

    DetectionResult result = chain.run(SERIES, CONTEXT);

    assertTrue(result.isFlagged(5));
    assertEquals(Set.of("ok"), result.detectorsAt(5));
  }

  @Test
  void wrongLengthResult_skipped() {
    MetricDetector shortResult = new MetricDetector() {
      @Override
      public String name() {
        return "short";
      }

      @Override
      public boolean appliesTo(DetectionContext context) {
        return true;
      }

      @Override
      public boolean[] detect(double[] series, DetectionContext context) {
        return new boolean[] {true};
      }
    };

    assertFalse(new DetectorChain(List.of(shortResult)).run(SERIES, CONTEXT).anyFlagged());
  }

  @Test
  void contextFilter_appliesOnlyToFilteredDetectors() {
    // the flagged sample equals its neighbors, so the contextual filter drops it
    DetectionResult filtered = new DetectorChain(List.of(flagging("f", true, 4))).run(SERIES, CONTEXT);
    DetectionResult unfiltered = new DetectorChain(List.of(flagging("u", false, 4))).run(SERIES, CONTEXT);

    assertFalse(filtered.isFlagged(4));
    assertTrue(unfiltered.isFlagged(4));
  }

  @Test
  void standardChain_containsBuiltInDetectors() {
    List<String> names = DetectorChain.standard().detectors().stream().map(MetricDetector::name).toList();

    assertEquals(List.of(ZScoreDetector.NAME, IsolationForestDetector.NAME, StabilityTrendDetector.NAME), names);
  }
}
