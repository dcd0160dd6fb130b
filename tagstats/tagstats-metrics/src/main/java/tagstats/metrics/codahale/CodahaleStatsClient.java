package tagstats.metrics.codahale;

import com.codahale.metrics.DefaultSettableGauge;
import com.codahale.metrics.Gauge;
import com.codahale.metrics.MetricRegistry;
import tagstats.metrics.StatsClient;
import tagstats.metrics.StatsClientOptions;

import java.time.Duration;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * A {@link StatsClient} that records into an in-process Dropwizard {@link MetricRegistry}, under the metric names it
 * is given (prefixed with {@link StatsClientOptions#prefix}, if any):
 * <ul>
 *   <li>incr/decr adjust a {@link com.codahale.metrics.Counter}</li>
 *   <li>gauge sets a {@link DefaultSettableGauge}</li>
 *   <li>set feeds a {@link DistinctValueGauge}, which reports the number of distinct members seen</li>
 *   <li>timing (and timer) update a {@link com.codahale.metrics.Timer}</li>
 * </ul>
 * Nothing is sampled: aggregation happens in-process, so every event is recorded regardless of its rate.
 */
public class CodahaleStatsClient implements StatsClient {
  private final MetricRegistry registry;
  private final Optional<String> prefix;

  public CodahaleStatsClient(MetricRegistry registry, StatsClientOptions options) {
    this(registry, options.prefix());
  }

  public CodahaleStatsClient(MetricRegistry registry, Optional<String> prefix) {
    this.registry = registry;
    this.prefix = prefix;
  }

  @Override
  public void incr(String stat, long count, double rate) {
    checkRate(rate);
    registry.counter(name(stat)).inc(count);
  }

  @Override
  public void decr(String stat, long count, double rate) {
    checkRate(rate);
    registry.counter(name(stat)).dec(count);
  }

  @Override
  public void gauge(String stat, double value, double rate) {
    checkRate(rate);
    DefaultSettableGauge<Double> gauge = registry.gauge(name(stat), () -> new DefaultSettableGauge<Double>(0.0));
    gauge.setValue(value);
  }

  @Override
  public void set(String stat, Object value, double rate) {
    checkRate(rate);
    DistinctValueGauge gauge = registry.gauge(name(stat), DistinctValueGauge::new);
    gauge.add(String.valueOf(value));
  }

  @Override
  public void timing(String stat, Duration elapsed, double rate) {
    checkRate(rate);
    registry.timer(name(stat)).update(elapsed.toNanos(), TimeUnit.NANOSECONDS);
  }

  @Override
  public void close() {
    // the registry belongs to whoever supplied it
  }

  private String name(String stat) {
    return prefix.map(p -> MetricRegistry.name(p, stat)).orElse(stat);
  }

  private static void checkRate(double rate) {
    checkArgument(rate > 0 && rate <= 1, "sample rate must be in (0, 1]: %s", rate);
  }

  @Override
  public String toString() {
    return "CodahaleStatsClient{prefix=" + prefix + '}';
  }

  public static class DistinctValueGauge implements Gauge<Integer> {
    private final Set<String> members = ConcurrentHashMap.newKeySet();

    void add(String member) {
      members.add(member);
    }

    @Override
    public Integer getValue() {
      return members.size();
    }
  }
}
