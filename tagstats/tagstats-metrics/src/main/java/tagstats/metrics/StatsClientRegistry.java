package tagstats.metrics;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.ImmutableList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tagstats.util.Reflect;

import javax.inject.Inject;
import javax.inject.Singleton;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Caches one {@link TaggedStatsClient} per distinct {@code (service, module, options)}, keyed by
 * {@link StatsClientFingerprint}. Each cached client carries the tags from its options followed by
 * {@code module=<module>,service=<service>}; an option tag with either of those keys keeps its position but takes the
 * registry's value. The client wraps a backend built by the {@link StatsClientFactory}.
 * <p/>
 * Racing first requests for the same configuration all receive the single instance that was retained; a factory
 * failure propagates to the caller and leaves no entry behind. Entries are never evicted.
 */
@Singleton
public class StatsClientRegistry implements AutoCloseable {
  private static final Logger LOG = LoggerFactory.getLogger(StatsClientRegistry.class);
  public static final String MODULE_TAG = "module";
  public static final String SERVICE_TAG = "service";

  private final StatsClientFactory clientFactory;
  private final StatsClientOptions defaultOptions;
  private final ConcurrentMap<String, TaggedStatsClient> clients = new ConcurrentHashMap<>();

  public StatsClientRegistry(StatsClientFactory clientFactory) {
    this(clientFactory, StatsClientOptions.defaults());
  }

  @Inject
  public StatsClientRegistry(StatsClientFactory clientFactory, StatsClientOptions defaultOptions) {
    this.clientFactory = clientFactory;
    this.defaultOptions = defaultOptions;
  }

  public TaggedStatsClient getClient(String service, Class<?> module) {
    return getClient(service, Reflect.dottedName(module));
  }

  public TaggedStatsClient getClient(String service, String module) {
    return getClient(service, module, defaultOptions);
  }

  public TaggedStatsClient getClient(String service, Class<?> module, StatsClientOptions options) {
    return getClient(service, Reflect.dottedName(module), options);
  }

  public TaggedStatsClient getClient(String service, String module, StatsClientOptions options) {
    checkNotNull(service, "service");
    checkNotNull(module, "module");
    checkNotNull(options, "options");
    String fingerprint = StatsClientFingerprint.of(service, module, options);
    return clients.computeIfAbsent(fingerprint, ignored -> buildClient(service, module, options));
  }

  private TaggedStatsClient buildClient(String service, String module, StatsClientOptions options) {
    Map<String, String> tags = new LinkedHashMap<>(options.tags());
    putIdentityTag(tags, MODULE_TAG, module);
    putIdentityTag(tags, SERVICE_TAG, service);

    StatsClient backend = clientFactory.create(options.transportOptions());
    LOG.debug("Created stats client for service={}, module={}: {}", service, module, backend);
    return new TaggedStatsClient(backend, tags);
  }

  private static void putIdentityTag(Map<String, String> tags, String key, String value) {
    String replaced = tags.put(key, value);
    if (replaced != null && !replaced.equals(value)) {
      LOG.warn("Replaced option tag '{}={}' with {}: the tag is reserved", key, replaced, value);
    }
  }

  public int size() {
    return clients.size();
  }

  /**
   * Forgets every cached client without closing it.
   */
  @VisibleForTesting
  public void clear() {
    clients.clear();
  }

  /**
   * Closes and forgets every cached client. The first failure is rethrown after all clients have been closed, with
   * any later failures attached as suppressed.
   */
  @Override
  public void close() {
    RuntimeException failure = null;
    for (TaggedStatsClient client : ImmutableList.copyOf(clients.values())) {
      try {
        client.close();
      } catch (RuntimeException e) {
        if (failure == null) {
          failure = e;
        } else {
          failure.addSuppressed(e);
        }
      }
    }
    clients.clear();
    if (failure != null) throw failure;
  }
}
