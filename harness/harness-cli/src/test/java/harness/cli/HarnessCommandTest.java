package harness.cli;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;

import static com.google.common.truth.Truth.assertThat;

class HarnessCommandTest {
  private final StringWriter out = new StringWriter();
  private final StringWriter err = new StringWriter();

  @Test
  void passingSuiteExitsZero() {
    int exitCode = run(SampleSuite.class.getName());

    assertThat(exitCode).isEqualTo(HarnessCommand.EXIT_PASSED);
    assertThat(out.toString()).contains("<unlocated>/greets");
    assertThat(out.toString()).contains("2 executed, 2 passed");
  }

  @Test
  void failingTestExitsOne() {
    int exitCode = run(FailingSuite.class.getName());

    assertThat(exitCode).isEqualTo(HarnessCommand.EXIT_FAILED);
    assertThat(out.toString()).contains("expected failure");
    assertThat(out.toString()).contains("2 executed, 1 passed, 1 failed");
  }

  @Test
  void failFastStopsTheRun() {
    int exitCode = run("--fail-fast", FailingSuite.class.getName());

    assertThat(exitCode).isEqualTo(HarnessCommand.EXIT_FAILED);
    assertThat(out.toString()).contains("1 executed, 1 failed (stopped early)");
  }

  @Test
  void selectionFiltersBySubstring() {
    int exitCode = run("-k", "greets", "-k", "no-such-test", SampleSuite.class.getName(), FailingSuite.class.getName());

    assertThat(exitCode).isEqualTo(HarnessCommand.EXIT_PASSED);
    assertThat(out.toString()).contains("1 executed, 1 passed, 3 deselected");
  }

  @Test
  void parametrizedTestsRunPerCombination() {
    int exitCode = run(ParametrizedSuite.class.getName());

    assertThat(exitCode).isEqualTo(HarnessCommand.EXIT_PASSED);
    assertThat(out.toString()).contains("<unlocated>/sized[size=3]");
    assertThat(out.toString()).contains("3 executed, 3 passed");
  }

  @Test
  void combinationLimitIsAConfigurationError() {
    int exitCode = run("--max-combinations", "2", ParametrizedSuite.class.getName());

    assertThat(exitCode).isEqualTo(HarnessCommand.EXIT_CONFIGURATION_ERROR);
    assertThat(err.toString()).contains("exceeding the limit of 2");
  }

  @Test
  void cyclicFixturesAreAConfigurationError() {
    int exitCode = run(CyclicSuite.class.getName());

    assertThat(exitCode).isEqualTo(HarnessCommand.EXIT_CONFIGURATION_ERROR);
    assertThat(err.toString()).contains("Cyclic fixture dependency: chicken -> egg -> chicken");
  }

  @Test
  void unknownSuiteClassIsAConfigurationError() {
    int exitCode = run("harness.cli.NoSuchSuite");

    assertThat(exitCode).isEqualTo(HarnessCommand.EXIT_CONFIGURATION_ERROR);
    assertThat(err.toString()).contains("Suite class not found: harness.cli.NoSuchSuite");
  }

  @Test
  void nonSuiteClassIsAConfigurationError() {
    int exitCode = run(String.class.getName());

    assertThat(exitCode).isEqualTo(HarnessCommand.EXIT_CONFIGURATION_ERROR);
    assertThat(err.toString()).contains("does not implement harness.plan.FixtureSuite");
  }

  @Test
  void registeredSuitesAreDiscoveredWhenNoneAreNamed() {
    int exitCode = run();

    assertThat(exitCode).isEqualTo(HarnessCommand.EXIT_PASSED);
    assertThat(out.toString()).contains("<unlocated>/writes_files");
  }

  @Test
  void configFileIsApplied(@TempDir Path dir) throws IOException {
    Path configFile = dir.resolve("harness.conf");
    Files.writeString(configFile, "harness { selection = [\"writes\"], failFast = true }");

    int exitCode = run("--config", configFile.toString(), SampleSuite.class.getName());

    assertThat(exitCode).isEqualTo(HarnessCommand.EXIT_PASSED);
    assertThat(out.toString()).contains("1 executed, 1 passed, 1 deselected");
  }

  @Test
  void commandLineOverridesConfigFile(@TempDir Path dir) throws IOException {
    Path configFile = dir.resolve("harness.conf");
    Files.writeString(configFile, "harness.selection = [\"writes\"]");

    run("--config", configFile.toString(), "-k", "greets", SampleSuite.class.getName());

    assertThat(out.toString()).contains("<unlocated>/greets");
    assertThat(out.toString()).doesNotContain("writes_files");
  }

  @Test
  void missingConfigFileIsAConfigurationError(@TempDir Path dir) {
    int exitCode = run("--config", dir.resolve("absent.conf").toString(), SampleSuite.class.getName());

    assertThat(exitCode).isEqualTo(HarnessCommand.EXIT_CONFIGURATION_ERROR);
  }

  @Test
  void negativeLimitIsAConfigurationError() {
    int exitCode = run("--max-combinations", "-1", SampleSuite.class.getName());

    assertThat(exitCode).isEqualTo(HarnessCommand.EXIT_CONFIGURATION_ERROR);
    assertThat(err.toString()).contains("maxCombinations must not be negative");
  }

  private int run(String... args) {
    CommandLine commandLine = new CommandLine(new HarnessCommand());
    commandLine.setOut(new PrintWriter(out, true));
    commandLine.setErr(new PrintWriter(err, true));
    return commandLine.execute(args);
  }
}
