package tagstats.metrics.annotations;

import com.google.inject.AbstractModule;
import com.google.inject.matcher.AbstractMatcher;
import com.google.inject.matcher.Matcher;
import com.google.inject.matcher.Matchers;
import tagstats.metrics.StatsClientModule;

import java.lang.reflect.Method;

/**
 * Enables {@link Measured @Measured} interception. The injector must also contain a {@link StatsClientModule}, which
 * supplies the registry and the service name.
 */
public class MeasuredAnnotationsModule extends AbstractModule {
  /**
   * Interception of JDK and Guice types is never intended, and excluding them avoids needless reflection.
   */
  static final Matcher<? super Class<?>> CLASS_MATCHER =
          Matchers.not(Matchers.inSubpackage("com.google"))
                  .and(Matchers.not(Matchers.inSubpackage("java")));

  static final Matcher<Method> MEASURED_METHOD = new AbstractMatcher<>() {
    @Override
    public boolean matches(Method method) {
      return method.isAnnotationPresent(Measured.class) && !method.isSynthetic();
    }

    @Override
    public String toString() {
      return "measuredMethod()";
    }
  };

  @Override
  protected void configure() {
    MeasuredInterceptor interceptor = new MeasuredInterceptor();
    requestInjection(interceptor);
    bindInterceptor(CLASS_MATCHER, MEASURED_METHOD, interceptor);
  }
}
