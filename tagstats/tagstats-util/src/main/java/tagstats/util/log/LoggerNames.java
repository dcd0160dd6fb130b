package tagstats.util.log;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tagstats.util.Reflect;

import java.util.function.Predicate;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Derives hierarchical logger names of the form {@code <package>.<Type>[.<Nested>].<method>} from a calling context,
 * either given explicitly or located on the current thread's stack.
 */
public class LoggerNames {
  private static final Logger LOG = LoggerFactory.getLogger(LoggerNames.class);
  private static final StackWalker WALKER = StackWalker.getInstance(StackWalker.Option.RETAIN_CLASS_REFERENCE);
  private static final Pattern LAMBDA_METHOD = Pattern.compile("^lambda\\$(.+)\\$\\d+$");
  private static final String STATIC_INITIALIZER = "<clinit>";
  private static final String CONSTRUCTOR = "<init>";

  public static String loggerName(Class<?> owner, String function) {
    return Reflect.dottedName(owner) + "." + function;
  }

  public static Logger logger(Class<?> owner, String function) {
    return LoggerFactory.getLogger(loggerName(owner, function));
  }

  /**
   * @param skipFrames how many frames above the immediate caller to rewind; 0 names the method that called this one
   */
  public static String callerLoggerName(int skipFrames) {
    checkArgument(skipFrames >= 0, "skipFrames must not be negative: %s", skipFrames);
    StackWalker.StackFrame frame = WALKER.walk(frames -> frames
            .filter(f -> f.getDeclaringClass() != LoggerNames.class)
            .skip(skipFrames)
            .findFirst()
    ).orElseThrow(() -> new IllegalArgumentException("Stack is not deeper than " + skipFrames + " frames"));
    return frameLoggerName(frame);
  }

  /**
   * Names the first frame above the caller that is not matched by {@code skip}.
   */
  public static String callerLoggerName(Predicate<? super StackWalker.StackFrame> skip) {
    StackWalker.StackFrame frame = WALKER.walk(frames -> frames
            .filter(f -> f.getDeclaringClass() != LoggerNames.class)
            .filter(skip.negate())
            .findFirst()
    ).orElseThrow(() -> new IllegalStateException("Every frame on the stack was skipped"));
    return frameLoggerName(frame);
  }

  public static Logger callerLogger(int skipFrames) {
    return LoggerFactory.getLogger(callerLoggerName(skipFrames));
  }

  public static Logger callerLogger(Predicate<? super StackWalker.StackFrame> skip) {
    return LoggerFactory.getLogger(callerLoggerName(skip));
  }

  static String frameLoggerName(StackWalker.StackFrame frame) {
    String className = Reflect.dottedName(frame.getDeclaringClass());
    String methodName = frame.getMethodName();
    if (methodName.equals(STATIC_INITIALIZER)) {
      LOG.warn("global loggers are BAD, name={}", className);
      return className;
    }
    if (methodName.equals(CONSTRUCTOR)) return className;

    Matcher lambda = LAMBDA_METHOD.matcher(methodName);
    if (lambda.matches()) methodName = lambda.group(1);
    return className + "." + methodName;
  }
}
