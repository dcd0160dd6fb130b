package tagstats.metrics.annotations;

import tagstats.metrics.CallMeasurer;
import tagstats.metrics.MethodNaming;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Measures every call to the annotated method with {@link CallMeasurer}: a {@code calls} counter and a
 * {@code duration} timer, tagged with the method and its declaring class. The client is the
 * {@link tagstats.metrics.StatsClientRegistry registry's} client for the configured service and the declaring class.
 * <p/>
 * Requires {@link MeasuredAnnotationsModule}, and only applies to non-private, non-final methods of objects
 * constructed by Guice.
 *
 * @see MeasuredTag
 */
@Documented
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.METHOD)
public @interface Measured {
  /**
   * Log each call's begin and end to a logger named for the caller.
   */
  boolean log() default false;

  MethodNaming naming() default MethodNaming.SeparateClassTag;
}
