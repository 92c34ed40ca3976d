package io.github.themoah.loadlens.analysis.transaction;

import io.github.themoah.loadlens.analysis.StatisticalUtils;
import io.github.themoah.loadlens.config.TransactionSettings;
import io.github.themoah.loadlens.config.TransactionSettings.SelectionPolicy;
import io.github.themoah.loadlens.model.MetricNames;
import io.github.themoah.loadlens.model.ScopeFrame;
import io.github.themoah.loadlens.model.TransactionCandidate;
import io.github.themoah.loadlens.model.TransactionSelection;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Chooses the bounded, high-traffic subset of transactions worth analyzing.
 */
public class TransactionSelector {

  private static final Logger log = LoggerFactory.getLogger(TransactionSelector.class);

  private static final Comparator<TransactionCandidate> BY_SHARE = Comparator
    .comparingDouble(TransactionCandidate::volumeShare).reversed()
    .thenComparing(TransactionCandidate::name);

  private final TransactionSettings settings;

  public TransactionSelector(TransactionSettings settings) {
    this.settings = settings;
  }

  /**
   * Selects transactions from their fixed-load frames.
   *
   * @param transactions per-transaction frames restricted to the fixed-load phase
   * @param overallMeanThroughput mean overall throughput in the same phase
   * @return the selection, highest share first
   */
  public TransactionSelection select(List<ScopeFrame> transactions, double overallMeanThroughput) {
    List<TransactionCandidate> eligible = new ArrayList<>();
    for (ScopeFrame frame : transactions) {
      TransactionCandidate candidate = candidate(frame, overallMeanThroughput);
      if (candidate == null) {
        continue;
      }
      if (candidate.sampleCount() < settings.minPoints() || candidate.meanRps() < settings.minRps()) {
        log.debug("Transaction {} below traffic floor: samples={}, meanRps={}",
          candidate.name(), candidate.sampleCount(), candidate.meanRps());
        continue;
      }
      eligible.add(candidate);
    }
    eligible.sort(BY_SHARE);

    List<TransactionCandidate> selected = new ArrayList<>();
    double cumulative = 0.0;
    for (TransactionCandidate candidate : eligible) {
      if (selected.size() >= settings.maxK()) {
        break;
      }
      if (settings.policy() == SelectionPolicy.COVERAGE && !selected.isEmpty() && cumulative >= settings.coverage()) {
        break;
      }
      selected.add(candidate);
      cumulative += candidate.volumeShare();
    }

    log.info("Selected {} of {} transactions ({} eligible, cumulative share {})",
      selected.size(), transactions.size(), eligible.size(), String.format("%.2f", cumulative));
    return new TransactionSelection(selected, transactions.size(), eligible.size(), cumulative);
  }

  private static TransactionCandidate candidate(ScopeFrame frame, double overallMeanThroughput) {
    double[] rps = frame.values(MetricNames.TXN_RPS);
    if (rps == null) {
      log.debug("Transaction {} has no {} series", frame.scope(), MetricNames.TXN_RPS);
      return null;
    }
    int count = StatisticalUtils.countFinite(rps, 0, rps.length);
    if (count == 0) {
      return null;
    }
    double meanRps = StatisticalUtils.mean(rps);
    double share = overallMeanThroughput > StatisticalUtils.EPSILON ? meanRps / overallMeanThroughput : 0.0;
    return new TransactionCandidate(frame.scope(), meanRps, share, count);
  }
}
