package tagstats.metrics.codahale;

import com.codahale.metrics.Gauge;
import com.codahale.metrics.MetricRegistry;
import org.junit.jupiter.api.Test;
import tagstats.metrics.StatsClientOptions;
import tagstats.metrics.StatsTimer;
import tagstats.metrics.TaggedStatsClient;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

class CodahaleStatsClientTest {
  private final MetricRegistry registry = new MetricRegistry();
  private final CodahaleStatsClient client = new CodahaleStatsClient(registry, Optional.empty());

  @Test
  void countersAccumulate() {
    client.incr("jobs");
    client.incr("jobs", 4);
    client.decr("jobs", 2);

    assertThat(registry.counter("jobs").getCount()).isEqualTo(3);
  }

  @Test
  void gaugesHoldTheLastValue() {
    client.gauge("depth", 3);
    client.gauge("depth", 7.5);

    assertThat(registry.getGauges().get("depth").getValue()).isEqualTo(7.5);
  }

  @Test
  void setsCountDistinctMembers() {
    client.set("users", "alice");
    client.set("users", "bob");
    client.set("users", "alice");

    Gauge<?> gauge = registry.getGauges().get("users");
    assertThat(gauge.getValue()).isEqualTo(2);
  }

  @Test
  void timingsAndTimersUpdateTimers() {
    client.timing("latency", Duration.ofMillis(20));
    try (StatsTimer ignored = client.timer("latency")) {
      client.incr("inside");
    }

    assertThat(registry.timer("latency").getCount()).isEqualTo(2);
  }

  @Test
  void prefixIsPrepended() {
    CodahaleStatsClient prefixed = new CodahaleStatsClient(registry, StatsClientOptions.builder().prefix("app").build());

    prefixed.incr("jobs");

    assertThat(registry.getCounters()).containsKey("app.jobs");
  }

  @Test
  void taggedNamesAreRecordedVerbatim() {
    TaggedStatsClient tagged = new TaggedStatsClient(client, Map.of("service", "s"));

    tagged.incr("fool");

    assertThat(registry.counter("incr,service=s,name=fool").getCount()).isEqualTo(1);
  }

  @Test
  void rejectsInvalidRates() {
    assertThrows(IllegalArgumentException.class, () -> client.incr("jobs", 1, 0));
    assertThrows(IllegalArgumentException.class, () -> client.gauge("depth", 1, 1.5));
  }

  @Test
  void closeLeavesTheRegistryIntact() {
    client.incr("jobs");

    client.close();

    assertThat(registry.counter("jobs").getCount()).isEqualTo(1);
  }
}
