package tagstats.metrics;

import com.google.common.collect.ImmutableList;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

/**
 * Records every call it receives, in order.
 */
public class RecordingStatsClient implements StatsClient {
  private final List<Emission> emissions = new CopyOnWriteArrayList<>();
  private volatile boolean closed = false;

  @Override
  public void incr(String stat, long count, double rate) {
    emissions.add(new Emission("incr", stat, count));
  }

  @Override
  public void decr(String stat, long count, double rate) {
    emissions.add(new Emission("decr", stat, count));
  }

  @Override
  public void gauge(String stat, double value, double rate) {
    emissions.add(new Emission("gauge", stat, value));
  }

  @Override
  public void set(String stat, Object value, double rate) {
    emissions.add(new Emission("set", stat, value));
  }

  @Override
  public void timing(String stat, Duration elapsed, double rate) {
    emissions.add(new Emission("timing", stat, elapsed));
  }

  @Override
  public StatsTimer timer(String stat, double rate) {
    emissions.add(new Emission("timer", stat, rate));
    return StatsClient.super.timer(stat, rate);
  }

  @Override
  public void close() {
    closed = true;
  }

  public boolean isClosed() {
    return closed;
  }

  public List<Emission> emissions() {
    return ImmutableList.copyOf(emissions);
  }

  public List<String> stats() {
    return emissions.stream().map(Emission::stat).collect(Collectors.toList());
  }

  public List<String> stats(String operation) {
    return emissions.stream()
            .filter(emission -> emission.operation().equals(operation))
            .map(Emission::stat)
            .collect(Collectors.toList());
  }

  public String lastStat(String operation) {
    List<String> stats = stats(operation);
    if (stats.isEmpty()) throw new AssertionError("No " + operation + " emissions in " + emissions);
    return stats.get(stats.size() - 1);
  }

  public record Emission(String operation, String stat, Object value) {
  }
}
