package harness.fixtures;

/**
 * Raised when a {@link Producer} breaks the single-yield protocol: it finished setup without yielding a value, or it
 * yielded a second time while being resumed for teardown. This always indicates a broken fixture, never a test failure.
 */
public class ProducerContractException extends FixtureException {
  private final String fixtureName;

  public ProducerContractException(String fixtureName, String message) {
    super("Fixture '" + fixtureName + "' " + message);
    this.fixtureName = fixtureName;
  }

  public String getFixtureName() {
    return fixtureName;
  }
}
