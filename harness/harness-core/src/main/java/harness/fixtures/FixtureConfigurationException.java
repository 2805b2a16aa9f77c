package harness.fixtures;

/**
 * A malformed fixture or test declaration, detected before any test executes.
 */
public class FixtureConfigurationException extends FixtureException {
  public FixtureConfigurationException(String message) {
    super(message);
  }

  public FixtureConfigurationException(String message, Throwable cause) {
    super(message, cause);
  }

  public static void checkConfiguration(boolean condition, String messageFormat, Object... args) {
    if (!condition) throw new FixtureConfigurationException(String.format(messageFormat, args));
  }
}
