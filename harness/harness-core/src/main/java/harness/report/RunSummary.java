package harness.report;

import com.google.common.collect.ImmutableMultiset;
import org.immutables.value.Value;

import java.util.List;

@Value.Immutable
public abstract class RunSummary {
  public static ImmutableRunSummary.Builder builder() {
    return ImmutableRunSummary.builder();
  }

  public abstract List<TestOutcome> outcomes();

  /**
   * @return the number of tests skipped because their qualified names did not match the selection
   */
  @Value.Default
  public int deselectedTests() {
    return 0;
  }

  /**
   * @return whether the run stopped early because of {@code failFast}
   */
  @Value.Default
  public boolean stoppedEarly() {
    return false;
  }

  @Value.Lazy
  public ImmutableMultiset<TestOutcome.Status> statusCounts() {
    return outcomes().stream()
            .map(TestOutcome::status)
            .collect(ImmutableMultiset.toImmutableMultiset());
  }

  public int count(TestOutcome.Status status) {
    return statusCounts().count(status);
  }

  public boolean isSuccessful() {
    return count(TestOutcome.Status.PASSED) == outcomes().size();
  }

  public String describe() {
    StringBuilder builder = new StringBuilder();
    builder.append(outcomes().size()).append(" executed");
    for (TestOutcome.Status status : TestOutcome.Status.values()) {
      int count = count(status);
      if (count > 0) builder.append(", ").append(count).append(' ').append(status.name().toLowerCase());
    }
    if (deselectedTests() > 0) builder.append(", ").append(deselectedTests()).append(" deselected");
    if (stoppedEarly()) builder.append(" (stopped early)");
    return builder.toString();
  }
}
