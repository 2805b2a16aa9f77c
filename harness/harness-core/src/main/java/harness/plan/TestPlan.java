package harness.plan;

import com.google.common.collect.ImmutableList;
import harness.fixtures.FixtureDescriptor;
import harness.fixtures.FixtureRegistry;

import java.util.ArrayList;
import java.util.List;

import static harness.fixtures.FixtureConfigurationException.checkConfiguration;

/**
 * A validated set of tests together with the registry of fixtures they draw upon. Building a plan surfaces every
 * configuration error (unknown or cyclic fixtures, malformed declarations) before anything runs.
 */
public class TestPlan {
  private final FixtureRegistry registry;
  private final ImmutableList<FixtureTest> tests;

  private TestPlan(FixtureRegistry registry, ImmutableList<FixtureTest> tests) {
    this.registry = registry;
    this.tests = tests;
    for (FixtureTest test : tests) {
      for (String fixture : test.requestedFixtures()) {
        checkConfiguration(registry.contains(fixture),
                "Test '%s' requests unknown fixture '%s'", test.name(), fixture);
      }
    }
  }

  public static Builder builder() {
    return new Builder();
  }

  public static TestPlan fromSuites(Iterable<? extends FixtureSuite> suites) {
    Builder builder = builder();
    for (FixtureSuite suite : suites) {
      suite.define(builder);
    }
    return builder.build();
  }

  public FixtureRegistry registry() {
    return registry;
  }

  public ImmutableList<FixtureTest> tests() {
    return tests;
  }

  public static class Builder {
    private final FixtureRegistry.Builder registry = FixtureRegistry.builder();
    private final List<FixtureTest> tests = new ArrayList<>();

    public Builder fixture(FixtureDescriptor fixture) {
      registry.fixture(fixture);
      return this;
    }

    public Builder test(FixtureTest test) {
      tests.add(test);
      return this;
    }

    public TestPlan build() {
      return new TestPlan(registry.build(), ImmutableList.copyOf(tests));
    }
  }
}
