package io.github.themoah.loadlens.analysis;

import io.github.themoah.loadlens.analysis.ScopeAnalyzer.ScopeOutcome;
import io.github.themoah.loadlens.analysis.detector.DetectorChain;
import io.github.themoah.loadlens.analysis.detector.StabilityTrendDetector;
import io.github.themoah.loadlens.analysis.scoring.EventRanker;
import io.github.themoah.loadlens.analysis.scoring.ImpactScorer;
import io.github.themoah.loadlens.analysis.scoring.SeverityMapper;
import io.github.themoah.loadlens.analysis.scoring.TransactionAttributor;
import io.github.themoah.loadlens.analysis.segmentation.LoadSegmenter;
import io.github.themoah.loadlens.analysis.transaction.TransactionSelector;
import io.github.themoah.loadlens.analysis.window.WindowExtractor;
import io.github.themoah.loadlens.analysis.window.WindowMerger;
import io.github.themoah.loadlens.config.AnalysisSettings;
import io.github.themoah.loadlens.config.DetectorSettings;
import io.github.themoah.loadlens.config.TransactionSettings;
import io.github.themoah.loadlens.model.AnalysisInput;
import io.github.themoah.loadlens.model.AnalysisMode;
import io.github.themoah.loadlens.model.AnalysisResult;
import io.github.themoah.loadlens.model.AnomalyWindow;
import io.github.themoah.loadlens.model.MergedEvent;
import io.github.themoah.loadlens.model.MetricNames;
import io.github.themoah.loadlens.model.ScopeFrame;
import io.github.themoah.loadlens.model.Segmentation;
import io.github.themoah.loadlens.model.TrafficVolume;
import io.github.themoah.loadlens.model.TransactionCandidate;
import io.github.themoah.loadlens.model.TransactionSelection;
import io.github.themoah.loadlens.model.TrendFinding;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs one complete analysis: segmentation, per-scope detection, transaction
 * selection, scoring, attribution and ranking.
 *
 * <p>The engine is synchronous and holds no per-run state, so one instance can
 * serve concurrent runs. Scopes and metrics are processed sequentially in a
 * fixed order, which keeps results reproducible.
 */
public class AnomalyAnalysisEngine {

  private static final Logger log = LoggerFactory.getLogger(AnomalyAnalysisEngine.class);

  private final AnalysisSettings settings;
  private final LoadSegmenter segmenter;
  private final ScopeAnalyzer scopeAnalyzer;
  private final TransactionSelector transactionSelector;
  private final EventRanker eventRanker;

  public AnomalyAnalysisEngine(AnalysisSettings settings) {
    this(settings, DetectorChain.standard());
  }

  public AnomalyAnalysisEngine(AnalysisSettings settings, DetectorChain detectorChain) {
    this.settings = settings;
    this.segmenter = new LoadSegmenter(settings.segmentation());
    SeverityMapper severityMapper = new SeverityMapper(settings.scoring());
    this.scopeAnalyzer = new ScopeAnalyzer(
      detectorChain,
      new WindowExtractor(settings.windows(), severityMapper),
      new WindowMerger(settings.windows().mergeGapSamples()));
    this.transactionSelector = new TransactionSelector(settings.transactions());
    this.eventRanker = new EventRanker(settings.scoring());
  }

  public AnalysisSettings settings() {
    return settings;
  }

  public AnalysisResult analyze(AnalysisInput input) {
    if (input == null || !input.hasOverallData()) {
      log.info("No overall data to analyze, returning insufficient data");
      return AnalysisResult.insufficientData();
    }
    ScopeFrame overall = input.overall();
    Segmentation segmentation = segmenter.segment(overall);
    AnalysisMode mode = segmentation.fixedLoad() ? AnalysisMode.FIXED_LOAD : AnalysisMode.LOOSE;

    ScopeFrame phase = mode == AnalysisMode.FIXED_LOAD ? overall.sliceFrom(segmentation.splitIndex()) : overall;
    DetectorSettings detectorSettings = settings.detectors();
    if (mode == AnalysisMode.LOOSE) {
      detectorSettings = detectorSettings.withZScoreThreshold(
        detectorSettings.zScoreThreshold() * detectorSettings.looseThresholdFactor());
      log.info("Load never stabilized (stableFraction={}), analyzing the full series in loose mode",
        String.format("%.2f", segmentation.stableFraction()));
    }

    double meanThroughput = meanOf(phase, MetricNames.THROUGHPUT);
    ScopeOutcome overallOutcome = scopeAnalyzer.analyze(phase, settings.overallMetrics(), mode,
      detectorSettings, TrafficVolume.overall(meanThroughput));

    Map<String, Map<String, List<AnomalyWindow>>> windowsByScope = new TreeMap<>();
    if (!overallOutcome.windowsByMetric().isEmpty()) {
      windowsByScope.put(overall.scope(), overallOutcome.windowsByMetric());
    }

    List<TrendFinding> trendFindings = mode == AnalysisMode.FIXED_LOAD && detectorSettings.stabilityEnabled()
      ? assessTrends(phase, detectorSettings)
      : List.of();

    TransactionSelection selection = TransactionSelection.empty();
    List<MergedEvent> transactionEvents = new ArrayList<>();
    if (shouldAnalyzeTransactions(mode, overallOutcome, input)) {
      List<ScopeFrame> transactionPhases = input.transactions().stream()
        .map(frame -> frame.sliceFromTimestamp(segmentation.splitTimestamp()))
        .collect(Collectors.toList());
      selection = transactionSelector.select(transactionPhases, meanThroughput);
      Map<String, ScopeFrame> byName = new TreeMap<>();
      transactionPhases.forEach(frame -> byName.put(frame.scope(), frame));

      for (TransactionCandidate candidate : selection.selected()) {
        ScopeFrame frame = byName.get(candidate.name());
        ScopeOutcome outcome = scopeAnalyzer.analyze(frame, settings.transactions().metrics(), mode,
          detectorSettings, new TrafficVolume(candidate.meanRps(), candidate.volumeShare()));
        if (!outcome.windowsByMetric().isEmpty()) {
          windowsByScope.put(candidate.name(), outcome.windowsByMetric());
        }
        transactionEvents.addAll(outcome.events());
      }
    }

    List<MergedEvent> scoredTransactionEvents = transactionEvents.stream()
      .map(ImpactScorer::score)
      .collect(Collectors.toList());
    List<MergedEvent> scoredOverallEvents = overallOutcome.events().stream()
      .map(ImpactScorer::score)
      .collect(Collectors.toList());

    List<MergedEvent> pooled = new ArrayList<>(
      TransactionAttributor.attribute(scoredOverallEvents, scoredTransactionEvents));
    pooled.addAll(scoredTransactionEvents);
    List<MergedEvent> ranked = eventRanker.rank(pooled);

    log.info("Analysis complete: mode={}, split={}, events={}, transactions analyzed={}",
      mode.label(), segmentation.splitIndex(), ranked.size(), selection.selected().size());
    return new AnalysisResult(AnalysisResult.Status.OK, mode, segmentation, ranked, windowsByScope,
      selection, trendFindings);
  }

  private boolean shouldAnalyzeTransactions(AnalysisMode mode, ScopeOutcome overallOutcome, AnalysisInput input) {
    TransactionSettings transactions = settings.transactions();
    if (!transactions.enabled() || input.transactions().isEmpty()) {
      return false;
    }
    if (mode == AnalysisMode.LOOSE) {
      log.debug("Skipping per-transaction analysis in loose mode");
      return false;
    }
    if (transactions.requireOverallAnomaly() && overallOutcome.events().isEmpty()) {
      log.debug("Skipping per-transaction analysis: no overall anomaly");
      return false;
    }
    return true;
  }

  private List<TrendFinding> assessTrends(ScopeFrame phase, DetectorSettings detectorSettings) {
    List<TrendFinding> findings = new ArrayList<>();
    for (String metric : settings.overallMetrics()) {
      double[] values = phase.values(metric);
      if (values == null) {
        continue;
      }
      TrendFinding finding = StabilityTrendDetector.assess(metric, values, detectorSettings);
      if (finding != null) {
        findings.add(finding);
      }
    }
    return findings;
  }

  private static double meanOf(ScopeFrame frame, String metric) {
    double[] values = frame.values(metric);
    if (values == null) {
      return Double.NaN;
    }
    return StatisticalUtils.mean(values);
  }
}
