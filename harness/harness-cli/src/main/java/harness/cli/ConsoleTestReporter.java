package harness.cli;

import harness.report.RunSummary;
import harness.report.TestOutcome;
import harness.report.TestReporter;

import java.io.PrintWriter;

/**
 * Prints one line per outcome, followed by the run summary.
 */
class ConsoleTestReporter implements TestReporter {
  private final PrintWriter out;

  ConsoleTestReporter(PrintWriter out) {
    this.out = out;
  }

  @Override
  public void testFinished(TestOutcome outcome) {
    out.printf("%-15s %s (%d ms)%n", outcome.status(), outcome.displayName(), outcome.elapsed().toMillis());
    outcome.failure().ifPresent(failure -> out.println("    " + failure));
    for (Throwable teardownFailure : outcome.teardownFailures()) {
      out.println("    teardown: " + teardownFailure);
    }
  }

  @Override
  public void runFinished(RunSummary summary) {
    out.println(summary.describe());
    out.flush();
  }
}
