package harness.fixtures;

/**
 * Base class for every failure raised by the fixture engine itself.
 */
public class FixtureException extends RuntimeException {
  public FixtureException(String message) {
    super(message);
  }

  public FixtureException(String message, Throwable cause) {
    super(message, cause);
  }
}
