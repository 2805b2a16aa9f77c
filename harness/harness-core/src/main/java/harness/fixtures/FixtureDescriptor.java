package harness.fixtures;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Sets;
import org.immutables.value.Value;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static harness.fixtures.FixtureConfigurationException.checkConfiguration;

/**
 * The immutable definition of a fixture: its name, the names of the fixtures it depends upon (in the order their
 * values are passed to the {@link #producer}), and its keyword options.
 * <p/>
 * The only recognized option is {@value #PARAMS_OPTION}, whose value must be an {@link Iterable} or array of
 * candidate parameter values. A fixture with a non-empty {@link #params} list causes every test that (transitively)
 * requests it to run once per value.
 */
@Value.Immutable
public abstract class FixtureDescriptor {
  public static final String PARAMS_OPTION = "params";

  public static Builder builder() {
    return new Builder();
  }

  public static FixtureDescriptor of(String name, Producer producer, String... dependencyNames) {
    return builder().name(name).producer(producer).dependsOn(dependencyNames).build();
  }

  public abstract String name();

  public abstract List<String> dependencyNames();

  public abstract Producer producer();

  public abstract Map<String, Object> options();

  public ImmutableList<Object> params() {
    Object declared = options().get(PARAMS_OPTION);
    if (declared == null) return ImmutableList.of();
    return ImmutableList.copyOf(paramValues(declared));
  }

  public boolean isParametrized() {
    return !params().isEmpty();
  }

  public ProducerHandle newActivation() {
    return new ProducerHandle(name(), producer());
  }

  @Value.Check
  void checkDeclaration() {
    checkConfiguration(!name().isBlank() && name().strip().equals(name()),
            "Fixture name must be non-blank without surrounding whitespace: '%s'", name());

    Set<String> seen = Sets.newHashSet();
    for (String dependency : dependencyNames()) {
      checkConfiguration(!dependency.equals(name()), "Fixture '%s' cannot depend upon itself", name());
      checkConfiguration(seen.add(dependency), "Fixture '%s' declares dependency '%s' more than once", name(), dependency);
    }

    for (Map.Entry<String, Object> option : options().entrySet()) {
      checkConfiguration(option.getKey().equals(PARAMS_OPTION),
              "Fixture '%s' has unrecognized option '%s' (expected '%s')", name(), option.getKey(), PARAMS_OPTION);
      for (Object value : paramValues(option.getValue())) {
        checkConfiguration(value != null, "Fixture '%s' declares a null parameter value", name());
      }
    }
  }

  private Iterable<?> paramValues(Object declared) {
    if (declared instanceof Iterable<?> iterable) return iterable;
    if (declared instanceof Object[] array) return Arrays.asList(array);
    throw new FixtureConfigurationException(String.format(
            "Fixture '%s' option '%s' must be a sequence of values, but was: %s", name(), PARAMS_OPTION, declared));
  }

  @Override
  public String toString() {
    return "Fixture{" + name() + (dependencyNames().isEmpty() ? "" : " <- " + dependencyNames()) + "}";
  }

  public static class Builder extends ImmutableFixtureDescriptor.Builder {
    public Builder dependsOn(String... dependencyNames) {
      return addDependencyNames(dependencyNames);
    }

    public Builder params(Object... values) {
      return putOptions(PARAMS_OPTION, Arrays.asList(values));
    }

    public Builder params(Iterable<?> values) {
      return putOptions(PARAMS_OPTION, values);
    }

    public <T> Builder produces(Producer.Setup<T> setup) {
      return producer(Producer.of(setup));
    }

    public <T> Builder produces(Producer.Setup<T> setup, Producer.Cleanup<? super T> cleanup) {
      return producer(Producer.withCleanup(setup, cleanup));
    }
  }
}
