package harness.report;

import org.immutables.value.Value;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static com.google.common.base.Preconditions.checkState;

/**
 * The single result recorded for one execution of a test (one parameter combination).
 * <p/>
 * {@link #failure} holds the setup or body failure behind a {@link Status#SETUP_FAILED SETUP_FAILED} or
 * {@link Status#FAILED FAILED} status; {@link #teardownFailures} are reported in addition, whatever the status.
 */
@Value.Immutable
public abstract class TestOutcome {
  public enum Status {
    PASSED,
    FAILED,
    SETUP_FAILED,
    TEARDOWN_FAILED
  }

  public static ImmutableTestOutcome.Builder builder() {
    return ImmutableTestOutcome.builder();
  }

  public abstract String qualifiedName();

  public abstract String displayName();

  public abstract Map<String, Object> paramAssignment();

  public abstract Status status();

  public abstract Optional<Throwable> failure();

  public abstract List<Throwable> teardownFailures();

  @Value.Auxiliary
  public abstract Duration elapsed();

  public boolean passed() {
    return status() == Status.PASSED;
  }

  @Value.Check
  void checkConsistency() {
    boolean consistent = switch (status()) {
      case PASSED -> failure().isEmpty() && teardownFailures().isEmpty();
      case FAILED, SETUP_FAILED -> failure().isPresent();
      case TEARDOWN_FAILED -> failure().isEmpty() && !teardownFailures().isEmpty();
    };
    checkState(consistent, "Inconsistent %s outcome for %s", status(), displayName());
  }

  @Override
  public String toString() {
    return displayName() + ": " + status();
  }
}
