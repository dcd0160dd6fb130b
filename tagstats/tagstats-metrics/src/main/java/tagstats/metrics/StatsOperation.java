package tagstats.metrics;

/**
 * The emission operations of {@link StatsClient}. Each operation's {@link #metricPrefix} leads the metric names
 * composed by {@link TaggedStatsClient}.
 */
public enum StatsOperation {
  Incr("incr"),
  Decr("decr"),
  Gauge("gauge"),
  Set("set"),
  Timing("timing"),
  Timer("timer");

  private final String metricPrefix;

  StatsOperation(String metricPrefix) {
    this.metricPrefix = metricPrefix;
  }

  public String metricPrefix() {
    return metricPrefix;
  }
}
