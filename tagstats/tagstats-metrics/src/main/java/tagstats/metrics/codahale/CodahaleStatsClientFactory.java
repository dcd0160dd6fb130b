package tagstats.metrics.codahale;

import com.codahale.metrics.MetricRegistry;
import tagstats.metrics.StatsClient;
import tagstats.metrics.StatsClientFactory;
import tagstats.metrics.StatsClientOptions;

import javax.inject.Inject;
import javax.inject.Singleton;

@Singleton
public class CodahaleStatsClientFactory implements StatsClientFactory {
  private final MetricRegistry registry;

  @Inject
  public CodahaleStatsClientFactory(MetricRegistry registry) {
    this.registry = registry;
  }

  @Override
  public StatsClient create(StatsClientOptions options) {
    return new CodahaleStatsClient(registry, options);
  }
}
