package tagstats.metrics;

import com.codahale.metrics.MetricRegistry;
import com.google.inject.AbstractModule;
import com.google.inject.Binder;
import com.google.inject.Provides;
import com.google.inject.multibindings.OptionalBinder;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import tagstats.metrics.codahale.CodahaleStatsClientFactory;

import javax.inject.Singleton;

/**
 * Binds a singleton {@link StatsClientRegistry} configured from the {@value StatsClientConfig#CONFIG_PATH} config
 * section. Backends default to {@link CodahaleStatsClientFactory} (recording into the bound {@link MetricRegistry});
 * other modules replace the backend via {@link #clientFactoryBinder}.
 */
public class StatsClientModule extends AbstractModule {
  private final Config config;

  public StatsClientModule() {
    this(ConfigFactory.load());
  }

  public StatsClientModule(Config config) {
    this.config = config;
  }

  public static OptionalBinder<StatsClientFactory> clientFactoryBinder(Binder binder) {
    return OptionalBinder.newOptionalBinder(binder, StatsClientFactory.class);
  }

  @Override
  protected void configure() {
    clientFactoryBinder(binder()).setDefault().to(CodahaleStatsClientFactory.class);
    OptionalBinder.newOptionalBinder(binder(), MetricRegistry.class).setDefault().toInstance(new MetricRegistry());
    bind(StatsClientRegistry.class);
  }

  @Provides
  @Singleton
  StatsClientConfig statsClientConfig() {
    return StatsClientConfig.fromConfig(config);
  }

  @Provides
  StatsClientOptions defaultClientOptions(StatsClientConfig config) {
    return config.clientOptions();
  }

  @Override
  public boolean equals(Object o) {
    return o != null && getClass() == o.getClass() && config.equals(((StatsClientModule) o).config);
  }

  @Override
  public int hashCode() {
    return config.hashCode();
  }
}
