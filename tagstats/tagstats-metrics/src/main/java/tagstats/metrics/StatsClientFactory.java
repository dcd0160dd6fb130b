package tagstats.metrics;

/**
 * Builds the backend {@link StatsClient} for a set of options. Implementations may fail (eg, for an unresolvable
 * host); {@link StatsClientRegistry} lets such failures propagate and retains nothing.
 */
@FunctionalInterface
public interface StatsClientFactory {
  StatsClient create(StatsClientOptions options);
}
