package harness.engine;

import harness.fixtures.BuiltinFixtures;
import harness.fixtures.FixtureArgs;
import harness.fixtures.FixtureDescriptor;
import harness.fixtures.FixtureRegistry;
import harness.fixtures.ProducerHandle;
import harness.fixtures.RequestContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Sets up fixtures for a {@link RunContext}, depth-first: a fixture's dependencies are resolved (in declaration
 * order) before its own producer runs, and each fixture is set up at most once per run. The {@value
 * BuiltinFixtures#REQUEST} fixture is the exception: it is produced afresh for every call site, bound to the name of
 * the fixture that asked for it.
 * <p/>
 * A failing producer propagates out of {@link #resolve} immediately; anything already set up remains registered in
 * the context, for the {@link TeardownCoordinator} to unwind.
 */
public class FixtureResolver {
  private static final Logger LOG = LoggerFactory.getLogger(FixtureResolver.class);

  private final FixtureRegistry registry;

  public FixtureResolver(FixtureRegistry registry) {
    this.registry = registry;
  }

  /**
   * Resolves the fixtures requested directly by a test, in order.
   */
  public FixtureArgs resolveAll(List<FixtureDescriptor> requested, RunContext context) {
    List<Object> values = new ArrayList<>(requested.size());
    List<String> names = new ArrayList<>(requested.size());
    for (FixtureDescriptor fixture : requested) {
      names.add(fixture.name());
      values.add(resolve(fixture, context, Optional.empty()));
    }
    return FixtureArgs.of(names, values);
  }

  public Object resolve(FixtureDescriptor fixture, RunContext context) {
    return resolve(fixture, context, Optional.empty());
  }

  /**
   * @param caller the fixture whose dependency this is, or empty when requested by the test itself
   */
  public Object resolve(FixtureDescriptor fixture, RunContext context, Optional<String> caller) {
    boolean isRequest = BuiltinFixtures.isRequest(fixture);
    if (!isRequest && context.hasResult(fixture.name())) {
      return context.result(fixture.name());
    }

    List<FixtureDescriptor> dependencies = registry.dependenciesOf(fixture);
    List<Object> dependencyValues = new ArrayList<>(dependencies.size());
    Optional<String> self = Optional.of(fixture.name());
    for (FixtureDescriptor dependency : dependencies) {
      dependencyValues.add(resolve(dependency, context, self));
    }

    LOG.debug("Setting up fixture '{}'", fixture.name());
    ProducerHandle handle = fixture.newActivation();
    Object result = handle.setUp(FixtureArgs.of(fixture.dependencyNames(), dependencyValues));

    if (isRequest && result instanceof RequestContext request) {
      result = request.boundTo(caller, context.paramAssignment());
    }

    context.record(handle, result, caller);
    return result;
  }
}
