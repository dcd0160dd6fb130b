package tagstats.metrics;

import java.time.Duration;

/**
 * A client that sends named numeric measurements to a statsd-style backend. The first argument of every emission
 * operation is the metric name; {@code rate} is the sample rate in (0, 1].
 * <p/>
 * Implementations own their transport: nothing in this interface retries, buffers or suppresses failures.
 *
 * @see TaggedStatsClient
 * @see StatsClientRegistry
 */
public interface StatsClient extends AutoCloseable {
  double UNSAMPLED = 1.0;

  void incr(String stat, long count, double rate);

  default void incr(String stat, long count) {
    incr(stat, count, UNSAMPLED);
  }

  default void incr(String stat) {
    incr(stat, 1);
  }

  void decr(String stat, long count, double rate);

  default void decr(String stat, long count) {
    decr(stat, count, UNSAMPLED);
  }

  default void decr(String stat) {
    decr(stat, 1);
  }

  void gauge(String stat, double value, double rate);

  default void gauge(String stat, double value) {
    gauge(stat, value, UNSAMPLED);
  }

  /**
   * Records {@code value} as a member of a set; the backend counts distinct members.
   */
  void set(String stat, Object value, double rate);

  default void set(String stat, Object value) {
    set(stat, value, UNSAMPLED);
  }

  void timing(String stat, Duration elapsed, double rate);

  default void timing(String stat, Duration elapsed) {
    timing(stat, elapsed, UNSAMPLED);
  }

  /**
   * Starts a duration measurement which is reported through {@link #timing} when the returned
   * {@link StatsTimer} is closed:
   * <pre>{@code
   * try (StatsTimer ignored = client.timer("render")) {
   *   render();
   * }
   * }</pre>
   */
  default StatsTimer timer(String stat, double rate) {
    return StatsTimer.start(this, stat, rate);
  }

  default StatsTimer timer(String stat) {
    return timer(stat, UNSAMPLED);
  }

  @Override
  void close();
}
