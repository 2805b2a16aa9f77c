package harness.util;

import com.google.common.truth.Truth;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;

import static com.google.common.truth.Truth8.assertThat;

class MoreStreamsTest {
  @Test
  void generateStopsAtFirstNull() {
    assertThat(MoreStreams.generate(Path.of("/a/b/c"), Path::getParent).map(Path::toString))
            .containsExactly("/a/b/c", "/a/b", "/a", "/")
            .inOrder();
  }

  @Test
  void generateIsLazy() {
    Truth.assertThat(MoreStreams.generate(1, x -> x + 1).limit(3).mapToInt(Integer::intValue).sum()).isEqualTo(6);
  }
}
