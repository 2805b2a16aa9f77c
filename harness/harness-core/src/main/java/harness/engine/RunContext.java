package harness.engine;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.LinkedListMultimap;
import com.google.common.collect.ListMultimap;
import harness.fixtures.BuiltinFixtures;
import harness.fixtures.ProducerHandle;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static com.google.common.base.Preconditions.checkState;

/**
 * The mutable state of a single test execution (one parameter combination): the memoized fixture values, and the
 * producers that have been set up but not yet torn down. Owned by exactly one execution, never shared.
 */
public class RunContext {
  private final ImmutableMap<String, Object> paramAssignment;
  private final Map<String, Object> results = new HashMap<>();
  private final ListMultimap<String, ProducerHandle> teardownRegistry = LinkedListMultimap.create();
  private final Map<ProducerHandle, Optional<String>> requesters = new HashMap<>();

  public RunContext(Map<String, Object> paramAssignment) {
    this.paramAssignment = ImmutableMap.copyOf(paramAssignment);
  }

  public static RunContext unparametrized() {
    return new RunContext(ImmutableMap.of());
  }

  public ImmutableMap<String, Object> paramAssignment() {
    return paramAssignment;
  }

  public boolean hasResult(String fixtureName) {
    return results.containsKey(fixtureName);
  }

  public Object result(String fixtureName) {
    checkState(hasResult(fixtureName), "No result for fixture '%s'", fixtureName);
    return results.get(fixtureName);
  }

  /**
   * @param requester the fixture that asked for this one, or empty when requested by the test itself
   */
  void record(ProducerHandle handle, Object value, Optional<String> requester) {
    results.put(handle.fixtureName(), value);
    teardownRegistry.put(handle.fixtureName(), handle);
    requesters.put(handle, requester);
  }

  /**
   * @return the handles registered under the given name; more than one only for the non-memoized request fixture
   */
  List<ProducerHandle> pendingHandles(String fixtureName) {
    return ImmutableList.copyOf(teardownRegistry.get(fixtureName));
  }

  /**
   * @return the handles to finish when tearing down the named fixture on behalf of the given requester: every
   * pending handle of a memoized fixture, but only the requester's own handle of the {@value
   * BuiltinFixtures#REQUEST} fixture
   */
  List<ProducerHandle> pendingHandles(String fixtureName, Optional<String> requester) {
    if (!fixtureName.equals(BuiltinFixtures.REQUEST)) return pendingHandles(fixtureName);
    return teardownRegistry.get(fixtureName).stream()
            .filter(handle -> requesters.get(handle).equals(requester))
            .collect(ImmutableList.toImmutableList());
  }

  void release(ProducerHandle handle) {
    teardownRegistry.remove(handle.fixtureName(), handle);
    requesters.remove(handle);
  }

  /**
   * @return every handle still awaiting teardown, most recently set up first
   */
  ImmutableList<ProducerHandle> remainingHandles() {
    return ImmutableList.copyOf(teardownRegistry.values()).reverse();
  }

  public ImmutableList<String> pendingTeardowns() {
    return ImmutableList.copyOf(teardownRegistry.keySet());
  }
}
