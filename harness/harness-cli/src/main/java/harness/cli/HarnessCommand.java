package harness.cli;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import com.typesafe.config.ConfigParseOptions;
import harness.config.HarnessConfig;
import harness.engine.TestRunner;
import harness.fixtures.FixtureConfigurationException;
import harness.plan.FixtureSuite;
import harness.plan.TestPlan;
import harness.report.CompositeTestReporter;
import harness.report.LoggingTestReporter;
import harness.report.RunSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.ServiceLoader;
import java.util.concurrent.Callable;

import static harness.fixtures.FixtureConfigurationException.checkConfiguration;

/**
 * Runs the tests declared by a set of {@link FixtureSuite FixtureSuites}, named on the command line or, when none
 * are named, discovered via {@link ServiceLoader}.
 * <p/>
 * Exits with {@value #EXIT_PASSED} when every executed test passed, {@value #EXIT_FAILED} when any did not, and
 * {@value #EXIT_CONFIGURATION_ERROR} when the run could not start.
 */
@CommandLine.Command(
        name = "harness",
        mixinStandardHelpOptions = true,
        description = "Runs fixture-driven tests, setting up and tearing down their fixtures."
)
public class HarnessCommand implements Callable<Integer> {
  private static final Logger LOG = LoggerFactory.getLogger(HarnessCommand.class);

  public static final int EXIT_PASSED = 0;
  public static final int EXIT_FAILED = 1;
  public static final int EXIT_CONFIGURATION_ERROR = 2;

  @CommandLine.Spec private CommandLine.Model.CommandSpec spec;

  @CommandLine.Option(
          names = {"-k", "--select"},
          paramLabel = "SUBSTRING",
          description = "Run only tests whose qualified name contains SUBSTRING (repeatable)"
  )
  List<String> selection = new ArrayList<>();

  @CommandLine.Option(
          names = "--root-marker",
          paramLabel = "FILENAME",
          description = "File marking the directory that qualified test names are relative to"
  )
  String rootMarker;

  @CommandLine.Option(
          names = "--max-combinations",
          paramLabel = "N",
          description = "Refuse to run a test with more than N parameter combinations (0 for no limit)"
  )
  Integer maxCombinations;

  @CommandLine.Option(names = "--fail-fast", description = "Stop after the first test that does not pass")
  boolean failFast;

  @CommandLine.Option(names = "--config", paramLabel = "FILE", description = "HOCON config file (optional)")
  Path configFile;

  @CommandLine.Parameters(
          paramLabel = "SUITE",
          arity = "0..*",
          description = "FixtureSuite classes to run (default: every registered FixtureSuite)"
  )
  List<String> suiteClassNames = new ArrayList<>();

  public static void main(String... args) {
    System.exit(new HarnessCommand().executeMain(args));
  }

  public int executeMain(String... args) {
    return new CommandLine(this).execute(args);
  }

  @Override
  public Integer call() {
    PrintWriter err = spec.commandLine().getErr();
    HarnessConfig config;
    try {
      config = loadConfig();
    } catch (ConfigException | IllegalArgumentException e) {
      LOG.debug("Invalid configuration", e);
      err.println("Configuration error: " + e.getMessage());
      return EXIT_CONFIGURATION_ERROR;
    }

    RunSummary summary;
    try {
      TestPlan plan = TestPlan.fromSuites(loadSuites());
      summary = TestRunner.runPlan(plan, config, CompositeTestReporter.of(
              new LoggingTestReporter(),
              new ConsoleTestReporter(spec.commandLine().getOut())));
    } catch (FixtureConfigurationException e) {
      LOG.debug("Invalid test declarations", e);
      err.println("Configuration error: " + e.getMessage());
      return EXIT_CONFIGURATION_ERROR;
    }

    return summary.isSuccessful() ? EXIT_PASSED : EXIT_FAILED;
  }

  HarnessConfig loadConfig() {
    Config base = ConfigFactory.load();
    if (configFile != null) {
      Config fromFile = ConfigFactory.parseFile(configFile.toFile(), ConfigParseOptions.defaults().setAllowMissing(false));
      base = fromFile.withFallback(base).resolve();
    }

    ImmutableMap.Builder<String, Object> overrides = ImmutableMap.builder();
    if (!selection.isEmpty()) overrides.put(path("selection"), selection);
    if (rootMarker != null) overrides.put(path("testRootMarker"), rootMarker);
    if (maxCombinations != null) overrides.put(path("maxCombinations"), maxCombinations);
    if (failFast) overrides.put(path("failFast"), true);

    return HarnessConfig.fromConfig(ConfigFactory.parseMap(overrides.build(), "command line").withFallback(base));
  }

  List<FixtureSuite> loadSuites() {
    if (suiteClassNames.isEmpty()) {
      List<FixtureSuite> discovered = ImmutableList.copyOf(ServiceLoader.load(FixtureSuite.class));
      LOG.info("Discovered {} registered suites", discovered.size());
      return discovered;
    }

    List<FixtureSuite> suites = new ArrayList<>(suiteClassNames.size());
    for (String className : suiteClassNames) {
      suites.add(instantiate(className));
    }
    return suites;
  }

  private static FixtureSuite instantiate(String className) {
    Class<?> suiteClass;
    try {
      suiteClass = Class.forName(className);
    } catch (ClassNotFoundException e) {
      throw new FixtureConfigurationException("Suite class not found: " + className, e);
    }
    checkConfiguration(FixtureSuite.class.isAssignableFrom(suiteClass),
            "%s does not implement %s", className, FixtureSuite.class.getName());
    try {
      return suiteClass.asSubclass(FixtureSuite.class).getDeclaredConstructor().newInstance();
    } catch (ReflectiveOperationException e) {
      throw new FixtureConfigurationException("Cannot instantiate suite " + className, e);
    }
  }

  private static String path(String key) {
    return HarnessConfig.ROOT_PATH + "." + key;
  }
}
