package tagstats.statsd;

import com.timgroup.statsd.StatsDClient;
import tagstats.metrics.StatsClient;

import java.time.Duration;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * A {@link StatsClient} that sends over the statsd wire protocol via DataDog's {@link StatsDClient}. Metric names pass
 * through unchanged; tags are already part of the name when this is wrapped by a
 * {@link tagstats.metrics.TaggedStatsClient}, so no native dogstatsd tags are sent.
 * <p/>
 * Sampling is delegated to the underlying client, except for {@link #set}, which the statsd protocol never samples.
 */
public class DogStatsdClient implements StatsClient {
  private final StatsDClient statsd;

  public DogStatsdClient(StatsDClient statsd) {
    this.statsd = checkNotNull(statsd, "statsd");
  }

  @Override
  public void incr(String stat, long count, double rate) {
    statsd.count(stat, count, rate);
  }

  @Override
  public void decr(String stat, long count, double rate) {
    statsd.count(stat, -count, rate);
  }

  @Override
  public void gauge(String stat, double value, double rate) {
    statsd.gauge(stat, value, rate);
  }

  @Override
  public void set(String stat, Object value, double rate) {
    statsd.recordSetValue(stat, String.valueOf(value));
  }

  @Override
  public void timing(String stat, Duration elapsed, double rate) {
    statsd.recordExecutionTime(stat, elapsed.toMillis(), rate);
  }

  @Override
  public void close() {
    statsd.close();
  }

  @Override
  public String toString() {
    return "DogStatsdClient{" + statsd + '}';
  }
}
