package harness.engine;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import harness.config.HarnessConfig;
import harness.fixtures.FixtureConfigurationException;
import harness.fixtures.FixtureDescriptor;
import harness.fixtures.FixtureRegistry;
import harness.fixtures.Producer;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.stream.IntStream;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

class ParametrizationExpanderTest {
  private final FixtureRegistry registry = FixtureRegistry.of(
          parametrized("user", "admin", "guest"),
          parametrized("port", 80, 443, 8080),
          FixtureDescriptor.of("account", Producer.of(args -> null), "user"),
          FixtureDescriptor.of("audit", Producer.of(args -> null), "user"),
          FixtureDescriptor.of("db", Producer.of(args -> null)));

  @Test
  void unparametrizedClosureYieldsNoCombinations() {
    assertThat(expand("db", "tempdir")).isEmpty();
  }

  @Test
  void productCoversEveryPairFirstFixtureSlowest() {
    ImmutableList<ImmutableMap<String, Object>> combinations = expand("user", "port");

    assertThat(combinations).containsExactly(
            Map.of("user", "admin", "port", 80),
            Map.of("user", "admin", "port", 443),
            Map.of("user", "admin", "port", 8080),
            Map.of("user", "guest", "port", 80),
            Map.of("user", "guest", "port", 443),
            Map.of("user", "guest", "port", 8080)
    ).inOrder();
  }

  @Test
  void transitiveParamsAreIncluded() {
    assertThat(expand("account", "db")).containsExactly(
            Map.of("user", "admin"),
            Map.of("user", "guest")
    ).inOrder();
  }

  @Test
  void sharedParametrizedDependencyIsCountedOnce() {
    assertThat(expand("account", "audit")).hasSize(2);
  }

  @Test
  void expansionIsDeterministic() {
    assertThat(expand("port", "account")).isEqualTo(expand("port", "account"));
    assertThat(expand("port", "account").get(0).keySet()).containsExactly("port", "user").inOrder();
  }

  @Test
  void combinationLimitIsEnforced() {
    ParametrizationExpander limited = new ParametrizationExpander(
            registry, HarnessConfig.builder().maxCombinations(5).build());

    FixtureConfigurationException e = assertThrows(FixtureConfigurationException.class,
            () -> limited.expand(List.of("user", "port")));
    assertThat(e).hasMessageThat().contains("6 parameter combinations");
    assertThat(limited.expand(List.of("port"))).hasSize(3);
  }

  @Test
  void unenumerableProductIsAConfigurationErrorEvenWithoutALimit() {
    Integer[] thousand = IntStream.range(0, 1000).boxed().toArray(Integer[]::new);
    FixtureRegistry huge = FixtureRegistry.of(
            parametrized("a", (Object[]) thousand),
            parametrized("b", (Object[]) thousand),
            parametrized("c", (Object[]) thousand),
            parametrized("d", (Object[]) thousand));
    ParametrizationExpander unlimited = new ParametrizationExpander(huge, HarnessConfig.defaults());

    FixtureConfigurationException e = assertThrows(FixtureConfigurationException.class,
            () -> unlimited.expand(List.of("a", "b", "c", "d")));
    assertThat(e).hasMessageThat().contains("1000000000000 parameter combinations");
  }

  @Test
  void displayNameListsTheAssignment() {
    assertThat(ParametrizationExpander.displayName("pkg/test_users.py/login", ImmutableMap.of()))
            .isEqualTo("pkg/test_users.py/login");
    assertThat(ParametrizationExpander.displayName("login", ImmutableMap.of("user", "admin", "port", 80)))
            .isEqualTo("login[user=admin, port=80]");
  }

  private ImmutableList<ImmutableMap<String, Object>> expand(String... requested) {
    return new ParametrizationExpander(registry, HarnessConfig.defaults()).expand(List.of(requested));
  }

  private static FixtureDescriptor parametrized(String name, Object... params) {
    return FixtureDescriptor.builder()
            .name(name)
            .params(params)
            .produces(args -> null)
            .build();
  }
}
