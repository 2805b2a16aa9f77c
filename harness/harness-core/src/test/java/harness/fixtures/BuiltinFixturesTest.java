package harness.fixtures;

import com.google.common.truth.Truth8;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

class BuiltinFixturesTest {
  @Test
  void tempdirIsDeletedRecursivelyAtTeardown() throws Exception {
    ProducerHandle handle = BuiltinFixtures.TEMPDIR_FIXTURE.newActivation();
    Path dir = (Path) handle.setUp(FixtureArgs.empty());

    assertThat(Files.isDirectory(dir)).isTrue();
    Files.createDirectories(dir.resolve("nested"));
    Files.writeString(dir.resolve("nested/file.txt"), "contents");

    handle.tearDown();
    assertThat(Files.exists(dir)).isFalse();
  }

  @Test
  void tempdirsAreDistinctPerActivation() {
    ProducerHandle first = BuiltinFixtures.TEMPDIR_FIXTURE.newActivation();
    ProducerHandle second = BuiltinFixtures.TEMPDIR_FIXTURE.newActivation();
    try {
      assertThat(first.setUp(FixtureArgs.empty())).isNotEqualTo(second.setUp(FixtureArgs.empty()));
    } finally {
      first.tearDown();
      second.tearDown();
    }
  }

  @Test
  void requestIsUnboundUntilResolved() {
    ProducerHandle handle = BuiltinFixtures.REQUEST_FIXTURE.newActivation();
    RequestContext request = (RequestContext) handle.setUp(FixtureArgs.empty());

    assertThat(request.fixtureName().isPresent()).isFalse();
    assertThat(request.param().isPresent()).isFalse();
  }

  @Test
  void boundRequestExposesCallerAndParam() {
    RequestContext request = RequestContext.unbound().boundTo(Optional.of("user"), Map.of("user", "admin"));

    Truth8.assertThat(request.fixtureName()).hasValue("user");
    assertThat(request.<String>requiredParam()).isEqualTo("admin");
  }

  @Test
  void requiredParamFailsForUnparametrizedCaller() {
    RequestContext request = RequestContext.unbound().boundTo(Optional.of("db"), Map.of("user", "admin"));

    IllegalStateException e = assertThrows(IllegalStateException.class, request::requiredParam);
    assertThat(e).hasMessageThat().contains("'db' is not parametrized");
  }
}
