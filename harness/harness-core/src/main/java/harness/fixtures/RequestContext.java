package harness.fixtures;

import org.immutables.value.Value;

import java.util.Map;
import java.util.Optional;

/**
 * The value of the built-in {@value BuiltinFixtures#REQUEST} fixture: a description of the call site that asked for
 * it. Unlike every other fixture value, a fresh instance is produced for each resolution, so two fixtures requesting
 * {@code request} in the same run each observe their own name.
 */
@Value.Immutable
public abstract class RequestContext {
  private static final RequestContext UNBOUND = ImmutableRequestContext.builder().build();

  public static RequestContext unbound() {
    return UNBOUND;
  }

  /**
   * @return the name of the fixture that requested this context, or empty when it was requested directly by a test
   */
  public abstract Optional<String> fixtureName();

  /**
   * @return the parameter value assigned to the requesting fixture in the current run, if it is parametrized
   */
  public abstract Optional<Object> param();

  public RequestContext boundTo(Optional<String> caller, Map<String, Object> paramAssignment) {
    return ImmutableRequestContext.builder()
            .from(this)
            .fixtureName(caller)
            .param(caller.map(paramAssignment::get))
            .build();
  }

  @SuppressWarnings("unchecked")
  public <T> T requiredParam() {
    return (T) param().orElseThrow(() -> new IllegalStateException(
            "Fixture '" + fixtureName().orElse("<test>") + "' is not parametrized"));
  }
}
