package tagstats.statsd;

import com.timgroup.statsd.NonBlockingStatsDClientBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tagstats.metrics.StatsClient;
import tagstats.metrics.StatsClientFactory;
import tagstats.metrics.StatsClientOptions;

import javax.inject.Singleton;

/**
 * Builds a non-blocking UDP {@link DogStatsdClient} per {@link StatsClientOptions}. Failures to resolve the host
 * surface as {@link com.timgroup.statsd.StatsDClientException} from {@link #create}.
 */
@Singleton
public class DogStatsdClientFactory implements StatsClientFactory {
  private static final Logger LOG = LoggerFactory.getLogger(DogStatsdClientFactory.class);

  @Override
  public StatsClient create(StatsClientOptions options) {
    LOG.info("Opening statsd client: {}:{} (prefix={})", options.host(), options.port(), options.prefix().orElse(""));
    return new DogStatsdClient(builder(options).build());
  }

  static NonBlockingStatsDClientBuilder builder(StatsClientOptions options) {
    NonBlockingStatsDClientBuilder builder = new NonBlockingStatsDClientBuilder()
            .hostname(options.host())
            .port(options.port())
            .maxPacketSizeBytes(options.maxPacketSizeBytes())
            .enableTelemetry(false);
    options.prefix().ifPresent(builder::prefix);
    return builder;
  }
}
