package tagstats.util.context;

import tagstats.util.exceptions.Fallible;

import java.util.concurrent.Callable;
import java.util.function.Supplier;

/**
 * A block-structured context: {@link #open} applies some transient state and returns a {@link State} whose
 * {@link State#close} undoes it. The {@code *InContext} helpers guarantee that the state is closed on every exit
 * path, including exceptional ones.
 */
public interface TransientContext {

  interface State extends AutoCloseable {
    @Override
    void close();
  }

  State open();

  default <T> T callInContext(Callable<T> callable) throws Exception {
    try (State ignored = open()) {
      return callable.call();
    }
  }

  default void runInContext(Runnable r) {
    try (State ignored = open()) {
      r.run();
    }
  }

  default <E extends Exception> void runOrThrowInContext(Fallible<E> r) throws E {
    try (State ignored = open()) {
      r.runOrThrow();
    }
  }

  default <T> T getInContext(Supplier<T> supplier) {
    try (State ignored = open()) {
      return supplier.get();
    }
  }
}
