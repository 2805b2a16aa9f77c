package harness.fixtures;

/**
 * The two-phase body of a fixture. {@link #start} runs setup until the body yields its value; the returned
 * {@link Step.Yielded#rest continuation} holds the cleanup code, which the engine resumes exactly once at teardown.
 * <p/>
 * Most fixtures are written with {@link #of} or {@link #withCleanup}; {@link #stepwise} exposes the raw protocol.
 */
@FunctionalInterface
public interface Producer {
  Step start(FixtureArgs dependencies) throws Exception;

  static Producer stepwise(Producer producer) {
    return producer;
  }

  static <T> Producer of(Setup<T> setup) {
    return args -> Step.yielded(setup.setUp(args));
  }

  static <T> Producer withCleanup(Setup<T> setup, Cleanup<? super T> cleanup) {
    return args -> {
      T value = setup.setUp(args);
      return Step.yielded(value, () -> {
        cleanup.cleanUp(value);
        return Step.done();
      });
    };
  }

  @FunctionalInterface
  interface Setup<T> {
    T setUp(FixtureArgs dependencies) throws Exception;
  }

  @FunctionalInterface
  interface Cleanup<T> {
    void cleanUp(T value) throws Exception;
  }
}
