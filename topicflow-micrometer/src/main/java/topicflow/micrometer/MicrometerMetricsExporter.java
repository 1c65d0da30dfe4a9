package topicflow.micrometer;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import topicflow.metrics.HandlerMetric;
import topicflow.spi.MetricsExporter;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Micrometer-based implementation of {@link MetricsExporter}.
 *
 * <p>Translates {@link HandlerMetric} events into meters registered with a
 * {@link MeterRegistry}. Meters tagged by topic are registered on first use.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code topicflow.records.submitted}: records queued on a parallel handler (tag {@code topic})</li>
 *   <li>{@code topicflow.records.handled}: records taken by a worker (tags {@code topic}, {@code worker})</li>
 *   <li>{@code topicflow.records.failed}: failed or throwing invocations inside a worker
 *       (tags {@code topic}, {@code worker})</li>
 *   <li>{@code topicflow.retry.produced}: records produced to a retry topic
 *       (tags {@code topic}, {@code retry.topic})</li>
 *   <li>{@code topicflow.retry.produce.failed}: retry records the producer rejected (tag {@code topic})</li>
 *   <li>{@code topicflow.retry.exhausted}: errors surfaced with no retry left (tag {@code topic})</li>
 * </ul>
 *
 * <h3>Gauges</h3>
 * <ul>
 *   <li>{@code topicflow.workers.running}: started minus stopped workers</li>
 * </ul>
 *
 * <h3>Timers</h3>
 * <ul>
 *   <li>{@code topicflow.retry.backoff}: time retried records waited before handling (tag {@code topic})</li>
 * </ul>
 *
 * @see MetricsExporter
 */
public final class MicrometerMetricsExporter implements MetricsExporter, AutoCloseable {

  private final MeterRegistry registry;
  private final String namePrefix;
  private final Gauge workersRunningGauge;
  private final AtomicInteger workersRunning = new AtomicInteger();
  private final Map<Meter.Id, Meter> meters = new ConcurrentHashMap<>();
  private volatile boolean closed;

  /**
   * Creates an exporter with the default metric name prefix {@code "topicflow"}.
   *
   * @param registry the Micrometer meter registry
   */
  public MicrometerMetricsExporter(MeterRegistry registry) {
    this(registry, "topicflow");
  }

  /**
   * Creates an exporter with a custom metric name prefix for multi-consumer use.
   *
   * @param registry   the Micrometer meter registry
   * @param namePrefix prefix for all meter names (e.g. {@code "orders.topicflow"})
   */
  public MicrometerMetricsExporter(MeterRegistry registry, String namePrefix) {
    Objects.requireNonNull(registry, "registry");
    Objects.requireNonNull(namePrefix, "namePrefix");
    if (namePrefix.isEmpty()) {
      throw new IllegalArgumentException("namePrefix must not be empty");
    }
    if (namePrefix.endsWith(".")) {
      throw new IllegalArgumentException("namePrefix must not end with '.'");
    }

    this.registry = registry;
    this.namePrefix = namePrefix;
    this.workersRunningGauge = Gauge.builder(namePrefix + ".workers.running", workersRunning, AtomicInteger::get)
        .description("Parallel handler workers currently running")
        .register(registry);
  }

  @Override
  public void report(HandlerMetric metric) {
    if (closed) return;
    if (metric instanceof HandlerMetric.StartingWorker) {
      workersRunning.incrementAndGet();
    } else if (metric instanceof HandlerMetric.StoppingWorker) {
      workersRunning.decrementAndGet();
    } else if (metric instanceof HandlerMetric.SubmittingRecord m) {
      counter(".records.submitted", "Records queued on a parallel handler",
          Tags.of("topic", m.record().topic())).increment();
    } else if (metric instanceof HandlerMetric.HandlingRecord m) {
      counter(".records.handled", "Records taken by a worker",
          Tags.of("topic", m.record().topic(), "worker", Integer.toString(m.worker()))).increment();
    } else if (metric instanceof HandlerMetric.RecordHandlingFailed m) {
      counter(".records.failed", "Failed handler invocations inside a worker",
          Tags.of("topic", m.record().topic(), "worker", Integer.toString(m.worker()))).increment();
    } else if (metric instanceof HandlerMetric.WaitingBeforeRetry m) {
      timer(".retry.backoff", "Time retried records waited before handling",
          Tags.of("topic", m.record().topic())).record(m.remaining());
    } else if (metric instanceof HandlerMetric.RetryProduced m) {
      counter(".retry.produced", "Records produced to a retry topic",
          Tags.of("topic", m.record().topic(), "retry.topic", m.retryRecord().topic())).increment();
    } else if (metric instanceof HandlerMetric.RetryProduceFailed m) {
      counter(".retry.produce.failed", "Retry records the producer rejected",
          Tags.of("topic", m.record().topic())).increment();
    } else if (metric instanceof HandlerMetric.RetriesExhausted m) {
      counter(".retry.exhausted", "Errors surfaced with no retry left",
          Tags.of("topic", m.record().topic())).increment();
    }
  }

  private Counter counter(String suffix, String description, Tags tags) {
    Counter counter = Counter.builder(namePrefix + suffix)
        .description(description)
        .tags(tags)
        .register(registry);
    meters.putIfAbsent(counter.getId(), counter);
    return counter;
  }

  private Timer timer(String suffix, String description, Tags tags) {
    Timer timer = Timer.builder(namePrefix + suffix)
        .description(description)
        .tags(tags)
        .register(registry);
    meters.putIfAbsent(timer.getId(), timer);
    return timer;
  }

  /**
   * Removes all meters registered by this exporter from the registry.
   *
   * <p>Call this when the handlers reporting to this exporter are closed to
   * prevent stale gauges.
   */
  @Override
  public void close() {
    closed = true;
    RuntimeException first = null;
    meters.put(workersRunningGauge.getId(), workersRunningGauge);
    for (Meter meter : meters.values()) {
      try {
        registry.remove(meter);
      } catch (RuntimeException e) {
        if (first == null) first = e; else first.addSuppressed(e);
      }
    }
    meters.clear();
    if (first != null) throw first;
  }
}
