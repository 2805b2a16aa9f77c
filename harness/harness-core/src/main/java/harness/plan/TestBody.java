package harness.plan;

import harness.fixtures.FixtureArgs;

@FunctionalInterface
public interface TestBody {
  /**
   * @param fixtures the values of the test's requested fixtures, in request order
   */
  void run(FixtureArgs fixtures) throws Exception;
}
