package io.github.themoah.loadlens.analysis.segmentation;

import static io.github.themoah.loadlens.analysis.FrameFixtures.constant;
import static io.github.themoah.loadlens.analysis.FrameFixtures.frame;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.themoah.loadlens.config.SegmentationSettings;
import io.github.themoah.loadlens.model.ScopeFrame;
import io.github.themoah.loadlens.model.Segmentation;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for LoadSegmenter.
 */
public class LoadSegmenterTest {

  private final LoadSegmenter segmenter = new LoadSegmenter(SegmentationSettings.defaults());

  @Test
  void rampThenPlateau_splitsNearEndOfRamp() {
    // 10 -> 100 users over 5 minutes (30 samples at 10s), then 20 minutes flat
    int ramp = 30;
    int n = ramp + 120;
    double[] users = new double[n];
    double[] throughput = new double[n];
    for (int i = 0; i < n; i++) {
      users[i] = i < ramp ? 10 + 90.0 * i / (ramp - 1) : 100;
      double noise = ((i * 7) % 5 - 2);
      throughput[i] = i < ramp ? 2 * users[i] + 0.1 * noise : 200 + noise;
    }

    Segmentation segmentation = segmenter.segment(frame(ScopeFrame.OVERALL, "users", users, "throughput", throughput));

    assertTrue(segmentation.tippingPointFound());
    assertTrue(segmentation.splitIndex() >= 24 && segmentation.splitIndex() <= 32,
      "split should be near the 5-minute mark, was " + segmentation.splitIndex());
    assertTrue(segmentation.fixedLoad());
    assertTrue(segmentation.stableFraction() >= 0.6);
    assertNull(segmentation.saturation(), "load stopped rising, no saturation");
  }

  @Test
  void throughputPlateauWhileLoadRises_reportsSaturation() {
    int n = 60;
    double[] users = new double[n];
    double[] throughput = new double[n];
    for (int i = 0; i < n; i++) {
      users[i] = 10 + 190.0 * i / (n - 1);
      throughput[i] = 2 * Math.min(users[i], 100);
    }

    Segmentation segmentation = segmenter.segment(frame(ScopeFrame.OVERALL, "users", users, "throughput", throughput));

    assertTrue(segmentation.tippingPointFound());
    assertTrue(segmentation.splitIndex() >= 26 && segmentation.splitIndex() <= 30,
      "split should be where throughput flattens, was " + segmentation.splitIndex());
    assertNotNull(segmentation.saturation());
    assertEquals(200.0, segmentation.saturation().throughput(), 1e-9);
    assertTrue(segmentation.saturation().load() > 100);
  }

  @Test
  void flatLoad_wholeSeriesIsFixedLoad() {
    int n = 60;
    double[] throughput = new double[n];
    for (int i = 0; i < n; i++) {
      throughput[i] = 200 + (i % 3);
    }

    Segmentation segmentation = segmenter.segment(
      frame(ScopeFrame.OVERALL, "users", constant(n, 50), "throughput", throughput));

    assertEquals(0, segmentation.splitIndex());
    assertTrue(segmentation.fixedLoad());
    assertNull(segmentation.saturation());
  }

  @Test
  void seriesShorterThanWindow_noTippingPoint() {
    Segmentation segmentation = segmenter.segment(frame(ScopeFrame.OVERALL,
      "users", new double[] {10, 20, 30}, "throughput", new double[] {20, 40, 60}));

    assertFalse(segmentation.tippingPointFound());
    assertEquals(0, segmentation.splitIndex());
    assertFalse(segmentation.fixedLoad());
  }

  @Test
  void missingBaseMetric_notFixedLoad() {
    Segmentation segmentation = segmenter.segment(
      frame(ScopeFrame.OVERALL, "throughput", constant(30, 100)));

    assertFalse(segmentation.fixedLoad());
    assertEquals(0, segmentation.splitIndex());
  }

  @Test
  void requiredBreaches_clampedBetweenMinAndMax() {
    assertEquals(5, segmenter.requiredBreaches(0));
    assertEquals(3, segmenter.requiredBreaches(10));
    assertEquals(4, segmenter.requiredBreaches(30));
    assertEquals(5, segmenter.requiredBreaches(1000));
  }

  @Test
  void stableFraction_countsOnlyFullStableWindows() {
    double[] values = constant(10, 100);

    // windows end at indices 4..9
    assertEquals(0.6, segmenter.stableFraction(values), 1e-9);
  }
}
