package harness.report;

import com.google.common.collect.ImmutableList;

public class CompositeTestReporter implements TestReporter {
  private final ImmutableList<TestReporter> reporters;

  public CompositeTestReporter(Iterable<? extends TestReporter> reporters) {
    this.reporters = ImmutableList.copyOf(reporters);
  }

  public static TestReporter of(TestReporter... reporters) {
    return reporters.length == 1 ? reporters[0] : new CompositeTestReporter(ImmutableList.copyOf(reporters));
  }

  @Override
  public void testStarted(String displayName) {
    reporters.forEach(reporter -> reporter.testStarted(displayName));
  }

  @Override
  public void testFinished(TestOutcome outcome) {
    reporters.forEach(reporter -> reporter.testFinished(outcome));
  }

  @Override
  public void runFinished(RunSummary summary) {
    reporters.forEach(reporter -> reporter.runFinished(summary));
  }
}
