package tagstats.util.exceptions;

import java.util.concurrent.Callable;
import java.util.function.Supplier;

@FunctionalInterface
public interface FallibleSupplier<T, E extends Exception> extends Supplier<T>, Callable<T> {
  static <T> FallibleSupplier<T, Exception> ofCallable(Callable<T> callable) {
    return callable::call;
  }

  T getOrThrow() throws E;

  @Override
  default T get() {
    return Unchecked.getUnchecked(this);
  }

  @Override
  default T call() throws Exception {
    return getOrThrow();
  }
}
