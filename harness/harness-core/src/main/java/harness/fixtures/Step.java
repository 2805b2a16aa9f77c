package harness.fixtures;

/**
 * One step of a {@link Producer}: either it yielded a value (and can be resumed via {@link Yielded#rest}), or it
 * ran to completion.
 */
public sealed interface Step permits Step.Yielded, Step.Finished {

  static Step yielded(Object value, Continuation rest) {
    return new Yielded(value, rest);
  }

  static Step yielded(Object value) {
    return new Yielded(value, Step::done);
  }

  static Step done() {
    return Finished.INSTANCE;
  }

  @FunctionalInterface
  interface Continuation {
    Step resume() throws Exception;
  }

  record Yielded(Object value, Continuation rest) implements Step {
  }

  final class Finished implements Step {
    private static final Finished INSTANCE = new Finished();

    private Finished() {
    }

    @Override
    public String toString() {
      return "Finished";
    }
  }
}
