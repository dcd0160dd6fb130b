package tagstats.util.exceptions;

@FunctionalInterface
public interface Fallible<E extends Exception> extends Runnable, FallibleSupplier<Void, E> {
  void runOrThrow() throws E;

  @Override
  default void run() {
    Unchecked.runUnchecked(this);
  }

  @Override
  default Void getOrThrow() throws E {
    runOrThrow();
    return null;
  }
}
