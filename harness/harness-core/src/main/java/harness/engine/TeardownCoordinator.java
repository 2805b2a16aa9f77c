package harness.engine;

import harness.fixtures.FixtureDescriptor;
import harness.fixtures.FixtureRegistry;
import harness.fixtures.ProducerHandle;
import harness.util.exceptions.MultiException;
import harness.util.exceptions.ThrowingRunnable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Unwinds the fixtures set up during a {@link RunContext}.
 * <p/>
 * Each requested fixture is torn down depth-first: its dependencies are torn down (in declaration order) before its
 * own cleanup code is resumed. A fixture that is not pending in the context is skipped, so tearing down the same
 * fixture twice is harmless, as is tearing down a fixture whose setup never completed. Each {@code request} handle
 * is finished only on behalf of the fixture (or test) it was produced for.
 * <p/>
 * A failure while tearing down one fixture never prevents the others from being attempted; all failures are
 * collected into the returned {@link MultiException}.
 */
public class TeardownCoordinator {
  private static final Logger LOG = LoggerFactory.getLogger(TeardownCoordinator.class);

  private final FixtureRegistry registry;

  public TeardownCoordinator(FixtureRegistry registry) {
    this.registry = registry;
  }

  /**
   * Tears down every requested fixture, then any producers left pending in the context (eg, dependencies of a fixture
   * whose own setup failed), most recently set up first.
   */
  public MultiException tearDownAll(List<FixtureDescriptor> requested, RunContext context) {
    MultiException failures = MultiException.collectFailures(
            requested.stream().map(fixture -> () -> tearDown(fixture, context)));

    return failures.consumeAllFailures(context.remainingHandles().stream().map(handle -> () -> {
      LOG.debug("Tearing down orphaned fixture '{}'", handle.fixtureName());
      finish(handle, context);
    }));
  }

  /**
   * Tears down a fixture requested directly by the test.
   *
   * @throws RuntimeException the (possibly {@link MultiException combined}) teardown failure, if any
   */
  public void tearDown(FixtureDescriptor fixture, RunContext context) {
    tearDown(fixture, context, Optional.empty());
  }

  private void tearDown(FixtureDescriptor fixture, RunContext context, Optional<String> requester) {
    List<ProducerHandle> handles = context.pendingHandles(fixture.name(), requester);
    if (handles.isEmpty()) return;

    Optional<String> self = Optional.of(fixture.name());
    Stream<ThrowingRunnable> dependencies = registry.dependenciesOf(fixture).stream()
            .map(dependency -> () -> tearDown(dependency, context, self));
    Stream<ThrowingRunnable> own = handles.stream()
            .map(handle -> () -> finish(handle, context));

    MultiException.collectFailures(Stream.concat(dependencies, own)).throwRuntimeIfAny();
  }

  private void finish(ProducerHandle handle, RunContext context) {
    LOG.debug("Tearing down fixture '{}'", handle.fixtureName());
    try {
      handle.tearDown();
    } catch (RuntimeException e) {
      LOG.error("Teardown failed for fixture '{}'", handle.fixtureName(), e);
      throw e;
    } finally {
      context.release(handle);
    }
  }
}
