package tagstats.metrics;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import com.typesafe.config.ConfigObject;
import org.immutables.value.Value;

import java.util.TreeMap;

/**
 * The {@value #CONFIG_PATH} section of the application's Typesafe {@link Config}:
 * <pre>{@code
 * tagstats {
 *   service = "my-service"
 *   client {
 *     host = "localhost"
 *     port = 8125
 *     prefix = ""
 *     maxPacketSizeBytes = 512
 *     tags { region = "us-east-1" }
 *   }
 * }
 * }</pre>
 * Defaults come from this module's {@code reference.conf}. Config objects are unordered, so configured tags are
 * applied sorted by key.
 */
@Value.Immutable
public abstract class StatsClientConfig {
  public static final String CONFIG_PATH = "tagstats";

  public abstract String service();

  public abstract StatsClientOptions clientOptions();

  public static StatsClientConfig fromConfig(Config config) {
    Config section = config.withFallback(ConfigFactory.defaultReference()).resolve().getConfig(CONFIG_PATH);
    Config client = section.getConfig("client");

    ImmutableStatsClientOptions.Builder options = StatsClientOptions.builder()
            .host(client.getString("host"))
            .port(client.getInt("port"))
            .maxPacketSizeBytes(client.getInt("maxPacketSizeBytes"));

    String prefix = client.getString("prefix");
    if (!prefix.isEmpty()) options.prefix(prefix);

    ConfigObject tags = client.getObject("tags");
    new TreeMap<>(tags.unwrapped())
            .forEach((key, value) -> options.putTags(key, String.valueOf(value)));

    return ImmutableStatsClientConfig.builder()
            .service(section.getString("service"))
            .clientOptions(options.build())
            .build();
  }
}
