package tagstats.statsd;

import com.google.inject.AbstractModule;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import tagstats.metrics.StatsClientModule;

/**
 * Installs {@link StatsClientModule} with clients sending to the configured statsd endpoint.
 */
public class DogStatsdModule extends AbstractModule {
  private final Config config;

  public DogStatsdModule() {
    this(ConfigFactory.load());
  }

  public DogStatsdModule(Config config) {
    this.config = config;
  }

  @Override
  protected void configure() {
    install(new StatsClientModule(config));
    StatsClientModule.clientFactoryBinder(binder()).setBinding().to(DogStatsdClientFactory.class);
  }
}
