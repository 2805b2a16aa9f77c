package harness.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.immutables.value.Value;

import java.util.List;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Settings for one invocation of the test runner, built once at startup and passed explicitly to the components
 * that need them.
 * <p/>
 * Defaults live in {@code reference.conf} under the {@value #ROOT_PATH} path, and may be overridden by
 * {@code application.conf}, system properties (eg, {@code -Dharness.failFast=true}), or command-line flags.
 */
@Value.Immutable
public abstract class HarnessConfig {
  public static final String ROOT_PATH = "harness";
  public static final String DEFAULT_TEST_ROOT_MARKER = ".harness-root";

  public static ImmutableHarnessConfig.Builder builder() {
    return ImmutableHarnessConfig.builder();
  }

  public static HarnessConfig defaults() {
    return builder().build();
  }

  public static HarnessConfig fromConfig(Config config) {
    Config harness = config.withFallback(ConfigFactory.defaultReference()).getConfig(ROOT_PATH);
    return builder()
            .selection(harness.getStringList("selection"))
            .testRootMarker(harness.getString("testRootMarker"))
            .maxCombinations(harness.getInt("maxCombinations"))
            .failFast(harness.getBoolean("failFast"))
            .build();
  }

  /**
   * @return substrings of qualified test names to run; empty means run everything
   */
  public abstract List<String> selection();

  @Value.Default
  public String testRootMarker() {
    return DEFAULT_TEST_ROOT_MARKER;
  }

  @Value.Default
  public int maxCombinations() {
    return 0;
  }

  @Value.Default
  public boolean failFast() {
    return false;
  }

  @Value.Check
  void checkValues() {
    checkArgument(!testRootMarker().isBlank(), "testRootMarker must not be blank");
    checkArgument(maxCombinations() >= 0, "maxCombinations must not be negative: %s", maxCombinations());
  }
}
