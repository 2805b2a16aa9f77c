package harness.fixtures;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.graph.ElementOrder;
import com.google.common.graph.GraphBuilder;
import com.google.common.graph.ImmutableGraph;
import com.google.common.graph.MutableGraph;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static harness.fixtures.FixtureConfigurationException.checkConfiguration;

/**
 * The dependency graph of all registered fixtures, keyed by name. Validated on construction: every dependency must be
 * registered, and the graph must be acyclic. Read-only afterwards, so a single registry may be shared by every run.
 */
public class FixtureRegistry {
  private final ImmutableMap<String, FixtureDescriptor> fixtures;
  private final ImmutableMap<String, ImmutableList<FixtureDescriptor>> dependencies;
  private final ImmutableGraph<String> graph;

  private FixtureRegistry(ImmutableMap<String, FixtureDescriptor> fixtures) {
    this.fixtures = fixtures;
    this.dependencies = resolveDependencies(fixtures);
    this.graph = buildGraph(fixtures.values());
    checkForCycles();
  }

  public static Builder builder() {
    return new Builder();
  }

  public static FixtureRegistry of(FixtureDescriptor... fixtures) {
    return builder().fixtures(List.of(fixtures)).build();
  }

  public ImmutableList<FixtureDescriptor> fixtures() {
    return fixtures.values().asList();
  }

  public boolean contains(String name) {
    return fixtures.containsKey(name);
  }

  public Optional<FixtureDescriptor> find(String name) {
    return Optional.ofNullable(fixtures.get(name));
  }

  public FixtureDescriptor get(String name) {
    return find(name).orElseThrow(() -> new FixtureConfigurationException("Unknown fixture: '" + name + "'"));
  }

  public ImmutableList<FixtureDescriptor> getAll(List<String> names) {
    return names.stream().map(this::get).collect(ImmutableList.toImmutableList());
  }

  /**
   * @return the fixtures the given fixture depends upon, in declaration order
   */
  public ImmutableList<FixtureDescriptor> dependenciesOf(FixtureDescriptor fixture) {
    ImmutableList<FixtureDescriptor> resolved = dependencies.get(fixture.name());
    checkConfiguration(resolved != null && fixtures.get(fixture.name()) == fixture,
            "Fixture '%s' is not registered here", fixture.name());
    return resolved;
  }

  /**
   * @return every fixture reachable from the given names, each listed once, in depth-first pre-order (a fixture
   * precedes its dependencies; siblings follow declaration order)
   */
  public ImmutableList<FixtureDescriptor> closure(List<String> names) {
    Set<FixtureDescriptor> visited = new LinkedHashSet<>();
    for (FixtureDescriptor fixture : getAll(names)) {
      visit(fixture, visited);
    }
    return ImmutableList.copyOf(visited);
  }

  private void visit(FixtureDescriptor fixture, Set<FixtureDescriptor> visited) {
    if (visited.add(fixture)) {
      for (String dependency : graph.successors(fixture.name())) {
        visit(fixtures.get(dependency), visited);
      }
    }
  }

  /**
   * @return the dependency graph, with an edge from each fixture to each fixture it requires; successors are
   * iterated in declaration order
   */
  public ImmutableGraph<String> graph() {
    return graph;
  }

  private static ImmutableMap<String, ImmutableList<FixtureDescriptor>> resolveDependencies(
          ImmutableMap<String, FixtureDescriptor> fixtures
  ) {
    ImmutableMap.Builder<String, ImmutableList<FixtureDescriptor>> builder = ImmutableMap.builder();
    for (FixtureDescriptor fixture : fixtures.values()) {
      ImmutableList.Builder<FixtureDescriptor> resolved = ImmutableList.builder();
      for (String dependency : fixture.dependencyNames()) {
        FixtureDescriptor required = fixtures.get(dependency);
        checkConfiguration(required != null,
                "Fixture '%s' depends upon unknown fixture '%s'", fixture.name(), dependency);
        resolved.add(required);
      }
      builder.put(fixture.name(), resolved.build());
    }
    return builder.build();
  }

  private static ImmutableGraph<String> buildGraph(Iterable<FixtureDescriptor> fixtures) {
    MutableGraph<String> graph = GraphBuilder.directed()
            .allowsSelfLoops(false)
            .incidentEdgeOrder(ElementOrder.stable())
            .build();
    for (FixtureDescriptor fixture : fixtures) {
      graph.addNode(fixture.name());
      for (String dependency : fixture.dependencyNames()) {
        graph.putEdge(fixture.name(), dependency);
      }
    }
    return ImmutableGraph.copyOf(graph);
  }

  private enum Color {
    IN_PROGRESS,
    DONE
  }

  private void checkForCycles() {
    Map<String, Color> colors = new HashMap<>();
    for (String name : graph.nodes()) {
      checkForCycles(name, colors, new ArrayDeque<>());
    }
  }

  private void checkForCycles(String name, Map<String, Color> colors, Deque<String> path) {
    Color color = colors.get(name);
    if (color == Color.DONE) return;
    path.addLast(name);
    if (color == Color.IN_PROGRESS) {
      List<String> cycle = new ArrayList<>(path);
      throw new FixtureConfigurationException("Cyclic fixture dependency: "
              + Joiner.on(" -> ").join(cycle.subList(cycle.indexOf(name), cycle.size())));
    }
    colors.put(name, Color.IN_PROGRESS);
    for (String dependency : graph.successors(name)) {
      checkForCycles(dependency, colors, path);
    }
    colors.put(name, Color.DONE);
    path.removeLast();
  }

  @Override
  public String toString() {
    return "FixtureRegistry" + fixtures.keySet();
  }

  public static class Builder {
    private final Map<String, FixtureDescriptor> fixtures = new LinkedHashMap<>();
    private boolean includeBuiltins = true;

    public Builder fixture(FixtureDescriptor fixture) {
      checkConfiguration(fixtures.putIfAbsent(fixture.name(), fixture) == null,
              "Fixture '%s' is registered more than once", fixture.name());
      return this;
    }

    public Builder fixtures(Iterable<? extends FixtureDescriptor> fixtures) {
      fixtures.forEach(this::fixture);
      return this;
    }

    public Builder withoutBuiltins() {
      includeBuiltins = false;
      return this;
    }

    public FixtureRegistry build() {
      Map<String, FixtureDescriptor> all = new LinkedHashMap<>();
      if (includeBuiltins) {
        for (FixtureDescriptor builtin : BuiltinFixtures.ALL) {
          all.put(builtin.name(), builtin);
        }
      }
      for (FixtureDescriptor fixture : fixtures.values()) {
        checkConfiguration(all.putIfAbsent(fixture.name(), fixture) == null,
                "Fixture '%s' collides with a builtin fixture", fixture.name());
      }
      return new FixtureRegistry(ImmutableMap.copyOf(all));
    }
  }
}
