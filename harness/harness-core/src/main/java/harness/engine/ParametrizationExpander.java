package harness.engine;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Lists;
import com.google.common.math.LongMath;
import harness.config.HarnessConfig;
import harness.fixtures.FixtureDescriptor;
import harness.fixtures.FixtureRegistry;

import java.util.List;
import java.util.Map;

import static harness.fixtures.FixtureConfigurationException.checkConfiguration;

/**
 * Computes the parameter combinations a test must run with: the cartesian product of the {@link
 * FixtureDescriptor#params params} of every parametrized fixture in the transitive closure of the test's requested
 * fixtures.
 * <p/>
 * Combinations are ordered deterministically: fixtures in the order {@link FixtureRegistry#closure} visits them, the
 * first fixture varying slowest, each fixture's values in declaration order. An empty result means the test has no
 * parametrized fixtures, and should run exactly once.
 */
public class ParametrizationExpander {
  private static final Joiner.MapJoiner PARAM_JOINER = Joiner.on(", ").withKeyValueSeparator("=");

  private final FixtureRegistry registry;
  private final HarnessConfig config;

  public ParametrizationExpander(FixtureRegistry registry, HarnessConfig config) {
    this.registry = registry;
    this.config = config;
  }

  public ImmutableList<ImmutableMap<String, Object>> expand(List<String> requestedFixtures) {
    List<FixtureDescriptor> parametrized = registry.closure(requestedFixtures).stream()
            .filter(FixtureDescriptor::isParametrized)
            .toList();

    if (parametrized.isEmpty()) return ImmutableList.of();

    List<List<Object>> candidates = parametrized.stream()
            .<List<Object>>map(FixtureDescriptor::params)
            .toList();

    long combinationCount = candidates.stream().mapToLong(List::size).reduce(1, LongMath::saturatedMultiply);
    checkConfiguration(combinationCount <= Integer.MAX_VALUE,
            "Fixtures %s produce %s parameter combinations, more than can be enumerated",
            Lists.transform(parametrized, FixtureDescriptor::name), combinationCount);
    checkConfiguration(config.maxCombinations() == 0 || combinationCount <= config.maxCombinations(),
            "Fixtures %s produce %s parameter combinations, exceeding the limit of %s",
            Lists.transform(parametrized, FixtureDescriptor::name), combinationCount, config.maxCombinations());

    ImmutableList.Builder<ImmutableMap<String, Object>> combinations = ImmutableList.builder();
    for (List<Object> values : Lists.cartesianProduct(candidates)) {
      ImmutableMap.Builder<String, Object> assignment = ImmutableMap.builder();
      for (int i = 0; i < values.size(); i++) {
        assignment.put(parametrized.get(i).name(), values.get(i));
      }
      combinations.add(assignment.build());
    }
    return combinations.build();
  }

  /**
   * @return the qualified name, suffixed with the combination's values (eg, {@code "pkg/Users/login[user=admin]"})
   */
  public static String displayName(String qualifiedName, Map<String, Object> paramAssignment) {
    if (paramAssignment.isEmpty()) return qualifiedName;
    return qualifiedName + "[" + PARAM_JOINER.join(paramAssignment) + "]";
  }
}
