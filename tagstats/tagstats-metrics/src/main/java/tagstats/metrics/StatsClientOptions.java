package tagstats.metrics;

import org.immutables.value.Value;

import java.util.Map;
import java.util.Optional;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Transport options for a {@link StatsClient}, plus the tags that {@link StatsClientRegistry} attaches to the
 * {@link TaggedStatsClient} wrapping it. {@link #tags} keep their insertion order.
 */
@Value.Immutable
public abstract class StatsClientOptions {
  public static final String DEFAULT_HOST = "localhost";
  public static final int DEFAULT_PORT = 8125;
  public static final int DEFAULT_MAX_PACKET_SIZE_BYTES = 512;

  public static ImmutableStatsClientOptions.Builder builder() {
    return ImmutableStatsClientOptions.builder();
  }

  public static StatsClientOptions defaults() {
    return builder().build();
  }

  @Value.Default
  public String host() {
    return DEFAULT_HOST;
  }

  @Value.Default
  public int port() {
    return DEFAULT_PORT;
  }

  /**
   * Namespace prepended by the backend to every metric name.
   */
  public abstract Optional<String> prefix();

  @Value.Default
  public int maxPacketSizeBytes() {
    return DEFAULT_MAX_PACKET_SIZE_BYTES;
  }

  public abstract Map<String, String> tags();

  /**
   * These options with their {@link #tags} removed: what a backend needs to build its transport.
   */
  public StatsClientOptions transportOptions() {
    return tags().isEmpty() ? this : ImmutableStatsClientOptions.copyOf(this).withTags(Map.of());
  }

  @Value.Check
  protected void check() {
    checkArgument(!host().isEmpty(), "host must not be empty");
    checkArgument(port() > 0 && port() <= 0xFFFF, "port out of range: %s", port());
    checkArgument(maxPacketSizeBytes() > 0, "maxPacketSizeBytes must be positive: %s", maxPacketSizeBytes());
  }
}
