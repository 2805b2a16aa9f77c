package harness.util.exceptions;

import com.google.common.base.Throwables;

@FunctionalInterface
public interface ThrowingRunnable extends Runnable {
  void runOrThrow() throws Exception;

  @Override
  default void run() {
    try {
      runOrThrow();
    } catch (Exception e) {
      Throwables.throwIfUnchecked(e);
      throw new RuntimeException(e);
    }
  }
}
