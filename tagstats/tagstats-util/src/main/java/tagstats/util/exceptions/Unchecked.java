package tagstats.util.exceptions;

import com.google.common.base.Throwables;

public class Unchecked {
  public static <T> T getUnchecked(FallibleSupplier<T, ?> supplier) {
    try {
      return supplier.getOrThrow();
    } catch (Exception e) {
      Throwables.throwIfUnchecked(e);
      throw new RuntimeException(e);
    }
  }

  public static <I, O> O applyUnchecked(I input, FallibleFunction<I, O, ?> f) {
    try {
      return f.applyOrThrow(input);
    } catch (Exception e) {
      Throwables.throwIfUnchecked(e);
      throw new RuntimeException(e);
    }
  }

  public static void runUnchecked(Fallible<?> runnable) {
    try {
      runnable.runOrThrow();
    } catch (Exception e) {
      Throwables.throwIfUnchecked(e);
      throw new RuntimeException(e);
    }
  }
}
