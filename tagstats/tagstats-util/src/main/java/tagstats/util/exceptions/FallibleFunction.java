package tagstats.util.exceptions;

import java.util.function.Function;

@FunctionalInterface
public interface FallibleFunction<I, O, E extends Exception> extends Function<I, O> {
  O applyOrThrow(I input) throws E;

  @Override
  default O apply(I i) {
    return Unchecked.applyUnchecked(i, this);
  }
}
