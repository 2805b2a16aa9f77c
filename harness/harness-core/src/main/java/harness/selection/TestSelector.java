package harness.selection;

import harness.config.HarnessConfig;

import java.util.List;

/**
 * Decides whether a test runs, by plain substring matching of its qualified name against the configured selection.
 * There is no anchoring or globbing; matching any one selected string is enough.
 */
public class TestSelector {
  private final List<String> selection;

  public TestSelector(HarnessConfig config) {
    this.selection = config.selection();
  }

  public boolean shouldRun(String qualifiedName) {
    return shouldRun(selection, qualifiedName);
  }

  public static boolean shouldRun(List<String> selectedPaths, String qualifiedName) {
    return selectedPaths.isEmpty() || selectedPaths.stream().anyMatch(qualifiedName::contains);
  }
}
