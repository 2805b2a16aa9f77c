package harness.report;

/**
 * Receives the progress of a run. Each executed test combination produces one {@link #testStarted} followed by
 * exactly one {@link #testFinished}.
 */
public interface TestReporter {
  TestReporter NONE = outcome -> { };

  default void testStarted(String displayName) {
  }

  void testFinished(TestOutcome outcome);

  default void runFinished(RunSummary summary) {
  }
}
