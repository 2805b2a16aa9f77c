package harness.util.exceptions;

import java.util.Optional;
import java.util.function.Predicate;

public class Exceptions {
  private static final Predicate<Throwable> IS_FATAL_ERROR = e -> e instanceof VirtualMachineError
          || e instanceof ThreadDeath
          || e instanceof LinkageError;

  /**
   * Rethrows errors that no caller should try to recover from (eg, {@link OutOfMemoryError}); anything else,
   * including {@link AssertionError}, is left for the caller to record.
   */
  public static void propagateIfFatal(Throwable t) {
    asFatalError(t).ifPresent(e -> { throw e; });
  }

  public static Optional<Error> asFatalError(Throwable t) {
    return Optional.of(t)
            .filter(Error.class::isInstance)
            .map(Error.class::cast)
            .filter(IS_FATAL_ERROR);
  }
}
