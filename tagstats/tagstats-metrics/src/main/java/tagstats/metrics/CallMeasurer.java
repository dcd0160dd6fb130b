package tagstats.metrics;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import org.slf4j.Logger;
import tagstats.util.context.TransientContext;
import tagstats.util.exceptions.Fallible;
import tagstats.util.exceptions.FallibleFunction;
import tagstats.util.exceptions.FallibleSupplier;
import tagstats.util.log.LoggerNames;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.function.Supplier;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Measures calls through a {@link TaggedStatsClient}. Each measured call:
 * <ol>
 *   <li>opens {@link TaggedStatsClient#extraTags} with the call-site's measurement tags
 *   ({@code def=<function>}, then any extra tags, then {@code class=<Type>} for methods),</li>
 *   <li>increments {@value #CALLS_METRIC},</li>
 *   <li>runs the call inside a {@value #DURATION_METRIC} {@link StatsClient#timer timer},</li>
 *   <li>closes the timer and restores the client's tags, whether the call returned or threw.</li>
 * </ol>
 * The duration is reported for failed calls too. Results and exceptions pass through untouched.
 * <p/>
 * Code that wants the active client passes it explicitly: see {@link #callWithClient}.
 */
public class CallMeasurer {
  public static final String CALLS_METRIC = "calls";
  public static final String DURATION_METRIC = "duration";
  public static final String DEF_TAG = "def";
  public static final String CLASS_TAG = "class";

  private static final Predicate<StackWalker.StackFrame> MEASUREMENT_FRAMES = frame -> {
    String className = frame.getClassName();
    return className.equals(CallMeasurer.class.getName())
            || className.startsWith("tagstats.metrics.annotations.MeasuredInterceptor")
            || className.contains("$$")
            || className.startsWith("com.google.inject.")
            || className.startsWith("org.aopalliance.");
  };

  private final TaggedStatsClient client;
  private final ImmutableMap<String, String> extraTags;
  private final MethodNaming methodNaming;
  private final boolean logging;
  private final Optional<Logger> logger;
  private final Clock clock;

  private CallMeasurer(
          TaggedStatsClient client,
          ImmutableMap<String, String> extraTags,
          MethodNaming methodNaming,
          boolean logging,
          Optional<Logger> logger,
          Clock clock
  ) {
    this.client = checkNotNull(client, "client");
    this.extraTags = extraTags;
    this.methodNaming = checkNotNull(methodNaming, "methodNaming");
    this.logging = logging;
    this.logger = logger;
    this.clock = checkNotNull(clock, "clock");
  }

  public static CallMeasurer measure(TaggedStatsClient client) {
    return new CallMeasurer(client, ImmutableMap.of(), MethodNaming.SeparateClassTag, false, Optional.empty(), Clock.systemUTC());
  }

  public CallMeasurer withExtraTags(Map<String, ?> tags) {
    return new CallMeasurer(client, MetricTags.merge(extraTags, tags), methodNaming, logging, logger, clock);
  }

  public CallMeasurer withMethodNaming(MethodNaming naming) {
    return new CallMeasurer(client, extraTags, naming, logging, logger, clock);
  }

  /**
   * When enabled, each call is logged at begin and end to a logger named for the measured call's caller.
   */
  public CallMeasurer withLogging(boolean enabled) {
    return new CallMeasurer(client, extraTags, methodNaming, enabled, logger, clock);
  }

  public CallMeasurer withLogger(Logger logger) {
    return new CallMeasurer(client, extraTags, methodNaming, true, Optional.of(logger), clock);
  }

  public CallMeasurer withClock(Clock clock) {
    return new CallMeasurer(client, extraTags, methodNaming, logging, logger, clock);
  }

  public TaggedStatsClient client() {
    return client;
  }

  public ImmutableMap<String, String> measurementTags(CallSite site) {
    Map<String, String> tags = new LinkedHashMap<>();
    switch (methodNaming) {
      case SeparateClassTag:
        tags.put(DEF_TAG, site.functionName());
        tags.putAll(extraTags);
        site.ownerName()
                .filter(ownerName -> !ownerName.equals(tags.get(DEF_TAG)))
                .ifPresent(ownerName -> tags.put(CLASS_TAG, ownerName));
        break;
      case QualifiedDef:
        tags.put(DEF_TAG, site.qualifiedName());
        tags.putAll(extraTags);
        break;
      default:
        throw new AssertionError("Unhandled MethodNaming: " + methodNaming);
    }
    return ImmutableMap.copyOf(tags);
  }

  public <T, E extends Exception> T call(CallSite site, FallibleSupplier<T, E> block) throws E {
    return measureCall(site, ImmutableList.of(), block);
  }

  public <E extends Exception> void run(CallSite site, Fallible<E> block) throws E {
    measureCall(site, ImmutableList.of(), block);
  }

  public <T, E extends Exception> T callWithClient(
          CallSite site,
          FallibleFunction<? super TaggedStatsClient, T, E> block
  ) throws E {
    return measureCall(site, ImmutableList.of(), () -> block.applyOrThrow(client));
  }

  public <T> Callable<T> wrapCallable(CallSite site, Callable<T> callable) {
    return () -> measureCall(site, ImmutableList.of(), FallibleSupplier.ofCallable(callable));
  }

  public <T> Supplier<T> wrapSupplier(CallSite site, Supplier<T> supplier) {
    return () -> measureCall(site, ImmutableList.of(), supplier::get);
  }

  public Runnable wrapRunnable(CallSite site, Runnable runnable) {
    return () -> measureCall(site, ImmutableList.of(), () -> {
      runnable.run();
      return null;
    });
  }

  public <I, O> Function<I, O> wrapFunction(CallSite site, Function<I, O> function) {
    return input -> measureCall(site, Collections.singletonList(input), () -> function.apply(input));
  }

  /**
   * Measures {@code block} as a call to {@code site} with the given arguments; the arguments are only used for
   * logging.
   */
  public <T, E extends Exception> T measureCall(CallSite site, List<?> args, FallibleSupplier<T, E> block) throws E {
    ImmutableMap<String, String> tags = measurementTags(site);
    Optional<Logger> callLogger = resolveLogger();
    TransientContext scope = client.extraTags(tags);
    try (TransientContext.State ignored = scope.open()) {
      client.incr(CALLS_METRIC);

      Instant t0 = clock.instant();
      callLogger.ifPresent(log -> log.info(
              "measured call begin, t0={}, fn={}, args={}", t0, site, args
      ));

      String outcome = "failed";
      try (StatsTimer ignoredTimer = client.timer(DURATION_METRIC)) {
        T result = block.getOrThrow();
        outcome = "succeeded";
        return result;
      } finally {
        if (callLogger.isPresent()) {
          Instant t1 = clock.instant();
          double delta = Duration.between(t0, t1).toNanos() / 1e9;
          callLogger.get().info(
                  "measured call end, t0={}, fn={}, args={}, t1={}, delta={}, outcome={}",
                  t0, site, args, t1, delta, outcome
          );
        }
      }
    }
  }

  Optional<Logger> resolveLogger() {
    if (!logging) return Optional.empty();
    // resolved here rather than in a lambda: the stack walk must start from this frame
    return Optional.of(logger.isPresent() ? logger.get() : LoggerNames.callerLogger(MEASUREMENT_FRAMES));
  }

  @Override
  public String toString() {
    return "CallMeasurer{" +
            "client=" + client +
            ", extraTags=" + extraTags +
            ", methodNaming=" + methodNaming +
            ", logging=" + logging +
            '}';
  }
}
