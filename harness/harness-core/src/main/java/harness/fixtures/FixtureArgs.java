package harness.fixtures;

import com.google.common.collect.ImmutableList;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * The resolved values handed to a producer or test body, in the order the names were declared. Values may be null.
 */
public final class FixtureArgs {
  private static final FixtureArgs EMPTY = new FixtureArgs(ImmutableList.of(), List.of());

  private final ImmutableList<String> names;
  private final List<Object> values;

  private FixtureArgs(ImmutableList<String> names, List<Object> values) {
    this.names = names;
    this.values = values;
  }

  public static FixtureArgs empty() {
    return EMPTY;
  }

  public static FixtureArgs of(List<String> names, List<?> values) {
    checkArgument(names.size() == values.size(), "Expected %s values, got %s", names.size(), values.size());
    return new FixtureArgs(ImmutableList.copyOf(names), Collections.unmodifiableList(new ArrayList<>(values)));
  }

  public int size() {
    return values.size();
  }

  public List<String> names() {
    return names;
  }

  public List<Object> values() {
    return values;
  }

  @SuppressWarnings("unchecked")
  public <T> T get(int index) {
    return (T) values.get(index);
  }

  public <T> T get(String name) {
    int index = names.indexOf(name);
    checkArgument(index >= 0, "No fixture named '%s' among %s", name, names);
    return get(index);
  }

  public <T> T get(String name, Class<T> type) {
    return type.cast(get(name));
  }

  @Override
  public String toString() {
    StringBuilder builder = new StringBuilder("{");
    for (int i = 0; i < names.size(); i++) {
      if (i > 0) builder.append(", ");
      builder.append(names.get(i)).append('=').append(values.get(i));
    }
    return builder.append('}').toString();
  }
}
