package topicflow.retry;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Blocks the calling thread; swapped out in tests.
 */
@FunctionalInterface
public interface Sleeper {

  Sleeper SYSTEM = duration -> TimeUnit.MILLISECONDS.sleep(duration.toMillis());

  void sleep(Duration duration) throws InterruptedException;
}
