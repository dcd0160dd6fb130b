package tagstats.metrics;

import com.google.common.collect.ImmutableMap;
import tagstats.util.context.TransientContext;

import java.time.Duration;
import java.util.Map;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * A {@link StatsClient} that appends an ordered set of tags to the name of every metric it emits, and forwards the
 * call to a delegate client with all other arguments unchanged. {@code client.incr("fool")} with tags
 * {@code {module=m, service=s}} reaches the delegate as {@code incr("incr,module=m,service=s,name=fool")}.
 * <p/>
 * Tags may be changed two ways:
 * <ul>
 *   <li>{@link #withExtraTags} derives a new, independent client; the receiver is untouched.</li>
 *   <li>{@link #extraTags} merges tags into <em>this</em> client for the extent of a {@link TransientContext},
 *   restoring the exact prior tags when the context closes.</li>
 * </ul>
 * Instances returned by {@link StatsClientRegistry} are shared. Scoped tags on a shared instance are visible to
 * every holder while the scope is open, and overlapping scopes from concurrent threads race: a scope that closes
 * out of order restores a stale snapshot. Use {@link #withExtraTags} to obtain a private client before entering
 * concurrent code.
 */
public class TaggedStatsClient implements StatsClient {
  private final StatsClient delegate;
  private volatile ImmutableMap<String, String> tags;

  public TaggedStatsClient(StatsClient delegate, Map<String, ?> tags) {
    this.delegate = checkNotNull(delegate, "delegate");
    this.tags = MetricTags.render(tags);
  }

  public static TaggedStatsClient untagged(StatsClient delegate) {
    return new TaggedStatsClient(delegate, ImmutableMap.of());
  }

  public ImmutableMap<String, String> tags() {
    return tags;
  }

  public StatsClient delegate() {
    return delegate;
  }

  public TaggedStatsClient withExtraTags(Map<String, ?> extraTags) {
    return new TaggedStatsClient(delegate, MetricTags.merge(tags, extraTags));
  }

  public TransientContext extraTags(Map<String, ?> extraTags) {
    ImmutableMap<String, String> rendered = MetricTags.render(extraTags);
    return () -> {
      ImmutableMap<String, String> prior = tags;
      tags = MetricTags.merge(prior, rendered);
      return () -> tags = prior;
    };
  }

  public CallMeasurer measure() {
    return CallMeasurer.measure(this);
  }

  public String encodedName(StatsOperation operation, String stat) {
    return MetricNames.encodedName(operation, tags, stat);
  }

  @Override
  public void incr(String stat, long count, double rate) {
    delegate.incr(encodedName(StatsOperation.Incr, stat), count, rate);
  }

  @Override
  public void decr(String stat, long count, double rate) {
    delegate.decr(encodedName(StatsOperation.Decr, stat), count, rate);
  }

  @Override
  public void gauge(String stat, double value, double rate) {
    delegate.gauge(encodedName(StatsOperation.Gauge, stat), value, rate);
  }

  @Override
  public void set(String stat, Object value, double rate) {
    delegate.set(encodedName(StatsOperation.Set, stat), value, rate);
  }

  @Override
  public void timing(String stat, Duration elapsed, double rate) {
    delegate.timing(encodedName(StatsOperation.Timing, stat), elapsed, rate);
  }

  @Override
  public StatsTimer timer(String stat, double rate) {
    return delegate.timer(encodedName(StatsOperation.Timer, stat), rate);
  }

  @Override
  public void close() {
    delegate.close();
  }

  @Override
  public String toString() {
    return "TaggedStatsClient{" +
            "tags=" + tags +
            ", delegate=" + delegate +
            '}';
  }
}
