package harness.engine;

import com.google.common.base.Stopwatch;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import harness.config.HarnessConfig;
import harness.fixtures.FixtureArgs;
import harness.fixtures.FixtureDescriptor;
import harness.fixtures.FixtureRegistry;
import harness.plan.FixtureTest;
import harness.plan.TestPlan;
import harness.report.ImmutableTestOutcome;
import harness.report.RunSummary;
import harness.report.TestOutcome;
import harness.report.TestReporter;
import harness.selection.TestSelector;
import harness.util.exceptions.Exceptions;
import harness.util.exceptions.MultiException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Runs tests against a {@link FixtureRegistry}: for each selected test, once per parameter combination (or once, if
 * it has no parametrized fixtures), resolves its requested fixtures into a fresh {@link RunContext}, runs its body,
 * and then tears down every fixture that was set up, whether or not setup or the body succeeded.
 */
public class TestRunner {
  private static final Logger LOG = LoggerFactory.getLogger(TestRunner.class);

  private final FixtureRegistry registry;
  private final HarnessConfig config;
  private final TestReporter reporter;
  private final TestSelector selector;
  private final ParametrizationExpander expander;
  private final FixtureResolver resolver;
  private final TeardownCoordinator teardownCoordinator;

  public TestRunner(FixtureRegistry registry, HarnessConfig config, TestReporter reporter) {
    this.registry = registry;
    this.config = config;
    this.reporter = reporter;
    selector = new TestSelector(config);
    expander = new ParametrizationExpander(registry, config);
    resolver = new FixtureResolver(registry);
    teardownCoordinator = new TeardownCoordinator(registry);
  }

  public static RunSummary runPlan(TestPlan plan, HarnessConfig config, TestReporter reporter) {
    return new TestRunner(plan.registry(), config, reporter).runAll(plan.tests());
  }

  /**
   * Collects every selected test (deriving qualified names and parameter combinations, so that configuration errors
   * surface before anything runs), then runs them in order.
   */
  public RunSummary runAll(List<FixtureTest> tests) {
    List<CollectedTest> collected = new ArrayList<>();
    int deselected = 0;
    for (FixtureTest test : tests) {
      String qualifiedName = test.qualifiedName(config.testRootMarker());
      if (selector.shouldRun(qualifiedName)) {
        collected.add(collect(test, qualifiedName));
      } else {
        LOG.debug("Deselected {}", qualifiedName);
        deselected++;
      }
    }
    LOG.info("Collected {} tests ({} deselected)", collected.size(), deselected);

    List<TestOutcome> outcomes = new ArrayList<>();
    boolean stoppedEarly = false;
    for (CollectedTest test : collected) {
      List<TestOutcome> testOutcomes = run(test);
      outcomes.addAll(testOutcomes);
      if (config.failFast() && !testOutcomes.stream().allMatch(TestOutcome::passed)) {
        LOG.info("Stopping after first failure: {}", test.qualifiedName());
        stoppedEarly = true;
        break;
      }
    }

    RunSummary summary = RunSummary.builder()
            .outcomes(outcomes)
            .deselectedTests(deselected)
            .stoppedEarly(stoppedEarly)
            .build();
    reporter.runFinished(summary);
    return summary;
  }

  /**
   * @return one outcome per parameter combination, or none if the test is not selected
   */
  public ImmutableList<TestOutcome> run(FixtureTest test) {
    String qualifiedName = test.qualifiedName(config.testRootMarker());
    if (!selector.shouldRun(qualifiedName)) return ImmutableList.of();
    return run(collect(test, qualifiedName));
  }

  private CollectedTest collect(FixtureTest test, String qualifiedName) {
    return new CollectedTest(test, qualifiedName, expander.expand(test.requestedFixtures()));
  }

  private ImmutableList<TestOutcome> run(CollectedTest collected) {
    if (collected.combinations().isEmpty()) {
      return ImmutableList.of(runCombination(collected.test(), collected.qualifiedName(), ImmutableMap.of()));
    }

    ImmutableList.Builder<TestOutcome> outcomes = ImmutableList.builder();
    for (ImmutableMap<String, Object> combination : collected.combinations()) {
      TestOutcome outcome = runCombination(collected.test(), collected.qualifiedName(), combination);
      outcomes.add(outcome);
      if (config.failFast() && !outcome.passed()) break;
    }
    return outcomes.build();
  }

  TestOutcome runCombination(FixtureTest test, String qualifiedName, Map<String, Object> paramAssignment) {
    String displayName = ParametrizationExpander.displayName(qualifiedName, paramAssignment);
    ImmutableTestOutcome.Builder outcome = TestOutcome.builder()
            .qualifiedName(qualifiedName)
            .displayName(displayName)
            .paramAssignment(paramAssignment);

    reporter.testStarted(displayName);
    Stopwatch stopwatch = Stopwatch.createStarted();
    List<FixtureDescriptor> requested = registry.getAll(test.requestedFixtures());
    RunContext context = new RunContext(paramAssignment);
    TestOutcome.Status status;
    MultiException teardownFailures;
    try {
      status = execute(test, requested, context, outcome);
    } finally {
      teardownFailures = teardownCoordinator.tearDownAll(requested, context);
    }

    if (!teardownFailures.isEmpty() && status == TestOutcome.Status.PASSED) {
      status = TestOutcome.Status.TEARDOWN_FAILED;
    }

    TestOutcome result = outcome.status(status)
            .teardownFailures(teardownFailures.getThrowables())
            .elapsed(stopwatch.elapsed())
            .build();
    reporter.testFinished(result);
    return result;
  }

  private TestOutcome.Status execute(
          FixtureTest test,
          List<FixtureDescriptor> requested,
          RunContext context,
          ImmutableTestOutcome.Builder outcome
  ) {
    FixtureArgs args;
    try {
      args = resolver.resolveAll(requested, context);
    } catch (Throwable e) {
      Exceptions.propagateIfFatal(e);
      LOG.debug("Setup failed for {}", test.name(), e);
      outcome.failure(e);
      return TestOutcome.Status.SETUP_FAILED;
    }

    try {
      test.body().run(args);
      return TestOutcome.Status.PASSED;
    } catch (Throwable e) {
      Exceptions.propagateIfFatal(e);
      outcome.failure(e);
      return TestOutcome.Status.FAILED;
    }
  }

  private record CollectedTest(
          FixtureTest test,
          String qualifiedName,
          ImmutableList<ImmutableMap<String, Object>> combinations
  ) {
  }
}
