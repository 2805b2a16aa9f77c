package harness.fixtures;

import com.google.common.collect.ImmutableList;
import com.google.common.io.MoreFiles;
import com.google.common.io.RecursiveDeleteOption;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Fixtures that every {@link FixtureRegistry} provides unless built {@link FixtureRegistry.Builder#withoutBuiltins
 * without builtins}.
 */
public final class BuiltinFixtures {
  private static final Logger LOG = LoggerFactory.getLogger(BuiltinFixtures.class);

  public static final String REQUEST = "request";
  public static final String TEMPDIR = "tempdir";

  /**
   * Yields an unbound {@link RequestContext}; the resolver binds it to each call site. Never memoized.
   */
  public static final FixtureDescriptor REQUEST_FIXTURE = FixtureDescriptor.builder()
          .name(REQUEST)
          .produces(args -> RequestContext.unbound())
          .build();

  /**
   * Yields a fresh temporary directory, deleted recursively at teardown.
   */
  public static final FixtureDescriptor TEMPDIR_FIXTURE = FixtureDescriptor.builder()
          .name(TEMPDIR)
          .produces(args -> Files.createTempDirectory("harness-"), BuiltinFixtures::deleteTempDir)
          .build();

  public static final ImmutableList<FixtureDescriptor> ALL = ImmutableList.of(REQUEST_FIXTURE, TEMPDIR_FIXTURE);

  private BuiltinFixtures() {
  }

  public static boolean isRequest(FixtureDescriptor fixture) {
    return fixture.name().equals(REQUEST);
  }

  private static void deleteTempDir(Path dir) throws IOException {
    if (Files.exists(dir)) {
      LOG.debug("Deleting tempdir {}", dir);
      MoreFiles.deleteRecursively(dir, RecursiveDeleteOption.ALLOW_INSECURE);
    }
  }
}
