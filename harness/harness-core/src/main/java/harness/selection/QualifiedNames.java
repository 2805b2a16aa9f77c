package harness.selection;

import com.google.common.base.Joiner;
import com.google.common.collect.Iterables;
import harness.fixtures.FixtureConfigurationException;
import harness.util.MoreStreams;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Derives the qualified name of a test: the path of its defining file, relative to the nearest enclosing directory
 * that contains the test-root marker file, joined with the test's declared name. Separators are always {@code /}.
 */
public final class QualifiedNames {
  public static final String UNLOCATED_PREFIX = "<unlocated>";

  private static final Joiner PATH_JOINER = Joiner.on('/');

  private QualifiedNames() {
  }

  public static String qualify(Optional<Path> definingFile, String testName, String rootMarker) {
    return definingFile
            .map(file -> qualify(file, testName, rootMarker))
            .orElseGet(() -> PATH_JOINER.join(UNLOCATED_PREFIX, testName));
  }

  /**
   * @throws FixtureConfigurationException if no ancestor directory of the file contains the marker
   */
  public static String qualify(Path definingFile, String testName, String rootMarker) {
    Path file = definingFile.toAbsolutePath().normalize();
    Path root = findTestRoot(file, rootMarker);
    Iterable<String> relativeFile = Iterables.transform(root.relativize(file), Path::toString);
    return PATH_JOINER.join(Iterables.concat(relativeFile, List.of(testName)));
  }

  public static Path findTestRoot(Path definingFile, String rootMarker) {
    Path file = definingFile.toAbsolutePath().normalize();
    return MoreStreams.generate(file.getParent(), Path::getParent)
            .filter(dir -> Files.isRegularFile(dir.resolve(rootMarker)))
            .findFirst()
            .orElseThrow(() -> new FixtureConfigurationException(
                    "Reached the filesystem root without finding test-root marker '" + rootMarker + "' above " + file));
  }
}
