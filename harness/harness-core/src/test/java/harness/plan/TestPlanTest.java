package harness.plan;

import harness.fixtures.FixtureConfigurationException;
import harness.fixtures.FixtureDescriptor;
import harness.fixtures.Producer;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

class TestPlanTest {
  private static final TestBody NOOP = args -> { };

  @Test
  void suitesContributeFixturesAndTests() {
    FixtureSuite fixtures = plan -> plan.fixture(FixtureDescriptor.of("db", Producer.of(args -> "conn")));
    FixtureSuite tests = plan -> plan.test(FixtureTest.builder().name("query").requests("db").body(NOOP).build());

    TestPlan plan = TestPlan.fromSuites(List.of(fixtures, tests));

    assertThat(plan.registry().contains("db")).isTrue();
    assertThat(plan.tests()).hasSize(1);
    assertThat(plan.tests().get(0).requestedFixtures()).containsExactly("db");
  }

  @Test
  void unknownRequestedFixtureIsRejected() {
    TestPlan.Builder builder = TestPlan.builder()
            .test(FixtureTest.builder().name("query").requests("db").body(NOOP).build());

    FixtureConfigurationException e = assertThrows(FixtureConfigurationException.class, builder::build);
    assertThat(e).hasMessageThat().isEqualTo("Test 'query' requests unknown fixture 'db'");
  }

  @Test
  void duplicateRequestIsRejected() {
    assertThrows(FixtureConfigurationException.class,
            () -> FixtureTest.builder().name("query").requests("db", "db").body(NOOP).build());
  }

  @Test
  void builtinsAreAvailableToTests() {
    TestPlan plan = TestPlan.builder()
            .test(FixtureTest.builder().name("files").requests("tempdir", "request").body(NOOP).build())
            .build();

    assertThat(plan.tests()).hasSize(1);
  }
}
