package harness.fixtures;

public class FixtureTeardownException extends FixtureException {
  private final String fixtureName;

  public FixtureTeardownException(String fixtureName, Throwable cause) {
    super("Teardown failed for fixture '" + fixtureName + "': " + cause, cause);
    this.fixtureName = fixtureName;
  }

  public String getFixtureName() {
    return fixtureName;
  }
}
