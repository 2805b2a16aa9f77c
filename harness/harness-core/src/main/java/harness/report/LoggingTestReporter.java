package harness.report;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes each outcome to the {@code harness.results} log category: passes at INFO, anything else at WARN with the
 * failure attached.
 */
public class LoggingTestReporter implements TestReporter {
  private static final Logger LOG = LoggerFactory.getLogger("harness.results");

  @Override
  public void testStarted(String displayName) {
    LOG.debug("Running {}", displayName);
  }

  @Override
  public void testFinished(TestOutcome outcome) {
    if (outcome.passed()) {
      LOG.info("PASSED {} ({} ms)", outcome.displayName(), outcome.elapsed().toMillis());
      return;
    }

    LOG.warn("{} {}", outcome.status(), outcome.displayName(), outcome.failure().orElse(null));
    for (Throwable teardownFailure : outcome.teardownFailures()) {
      LOG.warn("Teardown failure in {}", outcome.displayName(), teardownFailure);
    }
  }

  @Override
  public void runFinished(RunSummary summary) {
    if (summary.isSuccessful()) {
      LOG.info("Run complete: {}", summary.describe());
    } else {
      LOG.warn("Run complete: {}", summary.describe());
    }
  }
}
