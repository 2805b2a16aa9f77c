package harness.fixtures;

public class FixtureSetupException extends FixtureException {
  private final String fixtureName;

  public FixtureSetupException(String fixtureName, Throwable cause) {
    super("Setup failed for fixture '" + fixtureName + "': " + cause, cause);
    this.fixtureName = fixtureName;
  }

  public String getFixtureName() {
    return fixtureName;
  }
}
