package harness.util;

import java.util.Objects;
import java.util.function.UnaryOperator;
import java.util.stream.Stream;

public class MoreStreams {
  /**
   * @return a stream starting with firstValue, followed by successive applications of stepFunction, ending before
   * the first null
   */
  public static <T> Stream<T> generate(T firstValue, UnaryOperator<T> stepFunction) {
    return Stream.iterate(firstValue, Objects::nonNull, stepFunction);
  }
}
