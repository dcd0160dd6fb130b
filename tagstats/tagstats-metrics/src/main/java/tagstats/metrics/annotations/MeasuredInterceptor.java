package tagstats.metrics.annotations;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import org.aopalliance.intercept.MethodInterceptor;
import org.aopalliance.intercept.MethodInvocation;
import tagstats.metrics.CallMeasurer;
import tagstats.metrics.CallSite;
import tagstats.metrics.StatsClientConfig;
import tagstats.metrics.StatsClientRegistry;
import tagstats.metrics.TaggedStatsClient;
import tagstats.util.exceptions.Exceptions;

import javax.inject.Inject;
import javax.inject.Provider;
import java.lang.reflect.Method;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.stream.Stream;

import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

public class MeasuredInterceptor implements MethodInterceptor {
  private final ConcurrentMap<Method, CallMeasurer> measurers = new ConcurrentHashMap<>();
  private Provider<StatsClientRegistry> registryProvider;
  private Provider<StatsClientConfig> configProvider;

  @Inject
  void init(Provider<StatsClientRegistry> registryProvider, Provider<StatsClientConfig> configProvider) {
    this.registryProvider = registryProvider;
    this.configProvider = configProvider;
  }

  @Override
  public Object invoke(MethodInvocation invocation) throws Throwable {
    Method method = invocation.getMethod();
    CallMeasurer measurer = measurers.computeIfAbsent(method, this::buildMeasurer);
    return measurer.measureCall(CallSite.of(method), argumentList(invocation.getArguments()), () -> proceed(invocation));
  }

  CallMeasurer buildMeasurer(Method method) {
    checkState(registryProvider != null, "MeasuredInterceptor was not injected; install MeasuredAnnotationsModule");
    Measured measured = checkNotNull(method.getAnnotation(Measured.class), "Missing @Measured annotation: %s", method);
    TaggedStatsClient client = registryProvider.get().getClient(configProvider.get().service(), method.getDeclaringClass());
    ImmutableMap<String, String> tags = Stream.of(method.getAnnotationsByType(MeasuredTag.class))
            .collect(ImmutableMap.toImmutableMap(MeasuredTag::key, MeasuredTag::value));

    CallMeasurer measurer = client.measure()
            .withExtraTags(tags)
            .withMethodNaming(measured.naming());
    return measured.log() ? measurer.withLogging(true) : measurer;
  }

  private static Object proceed(MethodInvocation invocation) throws Exception {
    try {
      return invocation.proceed();
    } catch (Exception | Error e) {
      throw e;
    } catch (Throwable t) {
      throw Exceptions.throwUnchecked(t);
    }
  }

  private static List<Object> argumentList(Object[] args) {
    return args == null ? ImmutableList.of() : Arrays.asList(args);
  }
}
