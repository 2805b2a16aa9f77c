package harness.config;

import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

class HarnessConfigTest {
  @Test
  void referenceDefaultsMatchBuilderDefaults() {
    HarnessConfig loaded = HarnessConfig.fromConfig(ConfigFactory.empty());

    assertThat(loaded).isEqualTo(HarnessConfig.defaults());
    assertThat(loaded.selection()).isEmpty();
    assertThat(loaded.testRootMarker()).isEqualTo(".harness-root");
    assertThat(loaded.maxCombinations()).isEqualTo(0);
    assertThat(loaded.failFast()).isFalse();
  }

  @Test
  void overridesAreApplied() {
    HarnessConfig config = HarnessConfig.fromConfig(ConfigFactory.parseMap(Map.of(
            "harness.selection", List.of("users", "orders"),
            "harness.testRootMarker", "conftest.py",
            "harness.maxCombinations", 100,
            "harness.failFast", true)));

    assertThat(config.selection()).containsExactly("users", "orders").inOrder();
    assertThat(config.testRootMarker()).isEqualTo("conftest.py");
    assertThat(config.maxCombinations()).isEqualTo(100);
    assertThat(config.failFast()).isTrue();
  }

  @Test
  void invalidValuesAreRejected() {
    assertThrows(IllegalArgumentException.class, () -> HarnessConfig.builder().maxCombinations(-1).build());
    assertThrows(IllegalArgumentException.class, () -> HarnessConfig.builder().testRootMarker(" ").build());
  }
}
