package topicflow.spring.boot;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties for topicflow record handlers.
 *
 * @see TopicflowAutoConfiguration
 */
@ConfigurationProperties(prefix = "topicflow")
public class TopicflowProperties {

  private final Parallel parallel = new Parallel();
  private final Retry retry = new Retry();
  private final Metrics metrics = new Metrics();

  public Parallel getParallel() {
    return parallel;
  }

  public Retry getRetry() {
    return retry;
  }

  public Metrics getMetrics() {
    return metrics;
  }

  public static class Parallel {
    private int workerCount = 4;
    private int queueCapacity = 128;
    private long drainTimeoutMs = 5000;

    public int getWorkerCount() {
      return workerCount;
    }

    public void setWorkerCount(int workerCount) {
      this.workerCount = workerCount;
    }

    public int getQueueCapacity() {
      return queueCapacity;
    }

    public void setQueueCapacity(int queueCapacity) {
      this.queueCapacity = queueCapacity;
    }

    public long getDrainTimeoutMs() {
      return drainTimeoutMs;
    }

    public void setDrainTimeoutMs(long drainTimeoutMs) {
      this.drainTimeoutMs = drainTimeoutMs;
    }
  }

  public static class Retry {
    /**
     * Consumer group used in retry topic names. Retries are off while unset.
     */
    private String group;

    /**
     * One backoff per retry topic, first retry first.
     */
    private List<Duration> backoffs = new ArrayList<>();

    /**
     * Exception types surfaced without retrying, matched against the handler's error
     * after unwrapping {@code Either} layers.
     */
    private List<Class<? extends Throwable>> nonRetryableExceptions = new ArrayList<>();

    public String getGroup() {
      return group;
    }

    public void setGroup(String group) {
      this.group = group;
    }

    public List<Duration> getBackoffs() {
      return backoffs;
    }

    public void setBackoffs(List<Duration> backoffs) {
      this.backoffs = backoffs;
    }

    public List<Class<? extends Throwable>> getNonRetryableExceptions() {
      return nonRetryableExceptions;
    }

    public void setNonRetryableExceptions(List<Class<? extends Throwable>> nonRetryableExceptions) {
      this.nonRetryableExceptions = nonRetryableExceptions;
    }
  }

  public static class Metrics {
    private boolean enabled = true;
    private String namePrefix = "topicflow";

    public boolean isEnabled() {
      return enabled;
    }

    public void setEnabled(boolean enabled) {
      this.enabled = enabled;
    }

    public String getNamePrefix() {
      return namePrefix;
    }

    public void setNamePrefix(String namePrefix) {
      this.namePrefix = namePrefix;
    }
  }
}
