package harness.plan;

/**
 * A unit of fixture and test declarations, discoverable via {@link java.util.ServiceLoader}.
 */
public interface FixtureSuite {
  void define(TestPlan.Builder plan);
}
