package topicflow.spi;

import topicflow.metrics.HandlerMetric;

/**
 * Fire-and-forget sink for {@link HandlerMetric} events.
 *
 * <p>The {@link #NOOP} instance discards everything. Implement this interface to
 * bridge into Micrometer, Prometheus, or other monitoring systems. Implementations
 * are called from worker and caller threads concurrently and must not throw.
 */
@FunctionalInterface
public interface MetricsExporter {

  /**
   * No-op instance that discards all metrics.
   */
  MetricsExporter NOOP = new Noop();

  /**
   * Records a handler event.
   *
   * @param metric the event (never null)
   */
  void report(HandlerMetric metric);

  /**
   * Default no-op implementation that discards all metrics.
   */
  final class Noop implements MetricsExporter {
    @Override
    public void report(HandlerMetric metric) {
    }
  }
}
