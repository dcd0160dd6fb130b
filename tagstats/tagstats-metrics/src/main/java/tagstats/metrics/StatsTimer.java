package tagstats.metrics;

import com.google.common.base.Stopwatch;
import com.google.common.base.Ticker;

import java.time.Duration;

public class StatsTimer implements AutoCloseable {
  private final StatsClient client;
  private final String stat;
  private final double rate;
  private final Stopwatch stopwatch;
  private volatile boolean stopped = false;

  private StatsTimer(StatsClient client, String stat, double rate, Ticker ticker) {
    this.client = client;
    this.stat = stat;
    this.rate = rate;
    this.stopwatch = Stopwatch.createStarted(ticker);
  }

  public static StatsTimer start(StatsClient client, String stat, double rate) {
    return start(client, stat, rate, Ticker.systemTicker());
  }

  public static StatsTimer start(StatsClient client, String stat, double rate, Ticker ticker) {
    return new StatsTimer(client, stat, rate, ticker);
  }

  public String stat() {
    return stat;
  }

  /**
   * Reports the elapsed time to the client. Only the first call reports; later calls return the same duration.
   */
  public synchronized Duration stop() {
    if (!stopped) {
      stopped = true;
      stopwatch.stop();
      client.timing(stat, stopwatch.elapsed(), rate);
    }
    return stopwatch.elapsed();
  }

  @Override
  public void close() {
    stop();
  }
}
