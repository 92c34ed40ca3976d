package io.github.themoah.loadlens.model;

import java.util.Map;

/**
 * Metric names understood by the engine and their display labels.
 */
public final class MetricNames {

  public static final String USERS = "users";
  public static final String THROUGHPUT = "throughput";
  public static final String RT_AVG = "rt_avg";
  public static final String RT_MEDIAN = "rt_median";
  public static final String RT_P90 = "rt_p90";
  public static final String ERROR_RATE = "error_rate";

  public static final String TXN_RPS = "rps";
  public static final String TXN_RT_AVG = "rt_ms_avg";
  public static final String TXN_RT_MEDIAN = "rt_ms_median";
  public static final String TXN_RT_P90 = "rt_ms_p90";

  private static final Map<String, String> DISPLAY_NAMES = Map.ofEntries(
    Map.entry(USERS, "Active users"),
    Map.entry(THROUGHPUT, "Throughput"),
    Map.entry(RT_AVG, "Average response time"),
    Map.entry(RT_MEDIAN, "Median response time"),
    Map.entry(RT_P90, "90th percentile response time"),
    Map.entry(ERROR_RATE, "Error rate"),
    Map.entry(TXN_RPS, "Requests per second"),
    Map.entry(TXN_RT_AVG, "Response time (avg)"),
    Map.entry(TXN_RT_MEDIAN, "Response time (median)"),
    Map.entry(TXN_RT_P90, "Response time (90th percentile)")
  );

  private MetricNames() {}

  public static String displayName(String metric) {
    return DISPLAY_NAMES.getOrDefault(metric, metric);
  }
}
