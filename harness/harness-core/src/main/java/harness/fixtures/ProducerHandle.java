package harness.fixtures;

import harness.util.exceptions.Exceptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static com.google.common.base.Preconditions.checkState;

/**
 * One activation of a fixture's {@link Producer}, tracking its progress through the single-yield protocol:
 * <pre>
 *   CREATED --setUp--> SET_UP --tearDown--> TORN_DOWN
 *      \                  \
 *       `----------------- `--> FAILED
 * </pre>
 * {@link #tearDown} is only legal from SET_UP, so a producer can never be resumed twice.
 */
public final class ProducerHandle {
  private static final Logger LOG = LoggerFactory.getLogger(ProducerHandle.class);

  public enum State {
    CREATED,
    SET_UP,
    TORN_DOWN,
    FAILED
  }

  private final String fixtureName;
  private final Producer producer;
  private State state = State.CREATED;
  private Step.Continuation continuation;

  public ProducerHandle(String fixtureName, Producer producer) {
    this.fixtureName = fixtureName;
    this.producer = producer;
  }

  public String fixtureName() {
    return fixtureName;
  }

  public State state() {
    return state;
  }

  /**
   * Runs the producer up to its yield.
   *
   * @return the yielded value
   * @throws FixtureSetupException if the producer failed before yielding
   * @throws ProducerContractException if the producer completed without yielding
   */
  public Object setUp(FixtureArgs dependencies) {
    checkState(state == State.CREATED, "Fixture '%s' was already started (%s)", fixtureName, state);
    Step step;
    try {
      step = producer.start(dependencies);
    } catch (Throwable e) {
      Exceptions.propagateIfFatal(e);
      state = State.FAILED;
      throw new FixtureSetupException(fixtureName, e);
    }

    if (step instanceof Step.Yielded yielded) {
      continuation = yielded.rest();
      state = State.SET_UP;
      LOG.debug("Fixture '{}' set up", fixtureName);
      return yielded.value();
    }

    state = State.FAILED;
    throw new ProducerContractException(fixtureName, "completed setup without yielding a value");
  }

  /**
   * Resumes the producer past its yield, running its cleanup code to completion.
   *
   * @throws FixtureTeardownException if the cleanup code failed
   * @throws ProducerContractException if the producer yielded a second time
   */
  public void tearDown() {
    checkState(state == State.SET_UP, "Fixture '%s' cannot be torn down from state %s", fixtureName, state);
    Step.Continuation rest = continuation;
    continuation = null;
    Step next;
    try {
      next = rest.resume();
    } catch (Throwable e) {
      Exceptions.propagateIfFatal(e);
      state = State.FAILED;
      throw new FixtureTeardownException(fixtureName, e);
    }

    if (next instanceof Step.Yielded) {
      state = State.FAILED;
      throw new ProducerContractException(fixtureName, "yielded more than once; producers must yield exactly one value");
    }

    state = State.TORN_DOWN;
    LOG.debug("Fixture '{}' torn down", fixtureName);
  }

  @Override
  public String toString() {
    return "ProducerHandle{" + fixtureName + ", " + state + "}";
  }
}
