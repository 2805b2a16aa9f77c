package harness.util.exceptions;

import com.google.common.base.Throwables;
import com.google.common.collect.ImmutableList;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * An immutable-looking accumulator of failures, used to run a series of independent actions to completion while
 * remembering everything that went wrong along the way.
 * <p/>
 * Fatal errors (see {@link Exceptions#propagateIfFatal}) are never collected; they escape immediately.
 */
public interface MultiException {

  MultiException with(Throwable toAdd);

  List<Throwable> getThrowables();

  Optional<Throwable> getCombinedThrowable();

  void throwRuntimeIfAny();

  default boolean isEmpty() {
    return getThrowables().isEmpty();
  }

  static MultiException collectFailures(Stream<? extends ThrowingRunnable> runnables) {
    return Empty.consumeAllFailures(runnables);
  }

  default MultiException consumeFailure(ThrowingRunnable runnable) {
    try {
      runnable.runOrThrow();
      return this;
    } catch (Throwable e) {
      Exceptions.propagateIfFatal(e);
      return with(e);
    }
  }

  default MultiException consumeAllFailures(Stream<? extends ThrowingRunnable> runnables) {
    return runnables.reduce(
            this,
            MultiException::consumeFailure,
            (e1, e2) -> e2.getCombinedThrowable()
                    .map(e1::with)
                    .orElse(e1)
    );
  }

  MultiException Empty = new EmptyImpl();

  class EmptyImpl implements MultiException {
    private EmptyImpl() {
    }

    public MultiException with(Throwable toAdd) {
      if (toAdd instanceof MultiException) return (MultiException) toAdd;
      return new Single(toAdd);
    }

    public List<Throwable> getThrowables() {
      return ImmutableList.of();
    }

    @Override
    public Optional<Throwable> getCombinedThrowable() {
      return Optional.empty();
    }

    public void throwRuntimeIfAny() {
    }
  }

  class Single implements MultiException {
    private final Throwable throwable;

    private Single(Throwable throwable) {
      this.throwable = throwable;
    }

    public MultiException with(Throwable toAdd) {
      return new Multiple().with(throwable).with(toAdd);
    }

    public List<Throwable> getThrowables() {
      return ImmutableList.of(throwable);
    }

    @Override
    public Optional<Throwable> getCombinedThrowable() {
      return Optional.of(throwable);
    }

    public void throwRuntimeIfAny() {
      Throwables.throwIfUnchecked(throwable);
      throw new RuntimeException(throwable);
    }
  }

  class Multiple extends RuntimeException implements MultiException {

    private Multiple() {
    }

    public MultiException with(Throwable toAdd) {
      if (toAdd instanceof Multiple) {
        for (Throwable throwable : toAdd.getSuppressed()) {
          addSuppressed(throwable);
        }
      } else {
        addSuppressed(toAdd);
      }
      return this;
    }

    public List<Throwable> getThrowables() {
      return Arrays.asList(getSuppressed());
    }

    @Override
    public Optional<Throwable> getCombinedThrowable() {
      return Optional.of(this);
    }

    public void throwRuntimeIfAny() {
      throw this;
    }

    @Override
    public String getMessage() {
      Throwable[] nested = getSuppressed();
      final StringBuilder builder = new StringBuilder("Multiple failures (").append(nested.length).append(" total):");
      for (int i = 0; i < nested.length; i++) {
        Throwable throwable = nested[i];
        builder.append("\n\n ----> ").append(i + 1).append(") ")
                .append(throwable.getClass().getName()).append(": ").append(throwable.getMessage());
      }
      return builder.toString();
    }
  }
}
