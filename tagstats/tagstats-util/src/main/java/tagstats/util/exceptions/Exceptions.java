package tagstats.util.exceptions;

import com.google.common.base.Throwables;

public class Exceptions {

  /**
   * Rethrows the given Throwable as-is when it is unchecked, otherwise wrapped in a {@link RuntimeException}.
   * Declared to return RuntimeException so callers can write {@code throw Exceptions.throwUnchecked(t)}.
   */
  public static RuntimeException throwUnchecked(Throwable t) {
    Throwables.throwIfUnchecked(t);
    throw new RuntimeException(t);
  }
}
