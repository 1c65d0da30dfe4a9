package topicflow.metrics;

import topicflow.ConsumerRecord;
import topicflow.ProducerRecord;
import topicflow.retry.RetryAttempt;

import java.time.Duration;
import java.util.Objects;

/**
 * Events reported by handlers to a {@link topicflow.spi.MetricsExporter}.
 *
 * <p>Metrics are advisory: reporting never changes how a record is handled.
 */
public sealed interface HandlerMetric permits
    HandlerMetric.SubmittingRecord,
    HandlerMetric.StartingWorker,
    HandlerMetric.StoppingWorker,
    HandlerMetric.HandlingRecord,
    HandlerMetric.RecordHandlingFailed,
    HandlerMetric.WaitingBeforeRetry,
    HandlerMetric.RetryProduced,
    HandlerMetric.RetryProduceFailed,
    HandlerMetric.RetriesExhausted {

  /** A record is about to be enqueued on a parallel handler's worker queue. */
  record SubmittingRecord(ConsumerRecord<?, ?> record) implements HandlerMetric {
    public SubmittingRecord {
      Objects.requireNonNull(record, "record");
    }
  }

  /** A parallel handler started worker {@code worker}. */
  record StartingWorker(int worker) implements HandlerMetric {
  }

  /** A parallel handler is stopping worker {@code worker}. */
  record StoppingWorker(int worker) implements HandlerMetric {
  }

  /** Worker {@code worker} took {@code record} off its queue and is invoking the wrapped handler. */
  record HandlingRecord(ConsumerRecord<?, ?> record, int worker) implements HandlerMetric {
    public HandlingRecord {
      Objects.requireNonNull(record, "record");
    }
  }

  /**
   * The wrapped handler failed inside worker {@code worker}. {@code error} is either the
   * failure value or the exception the handler threw; the worker keeps running.
   */
  record RecordHandlingFailed(ConsumerRecord<?, ?> record, int worker, Object error) implements HandlerMetric {
    public RecordHandlingFailed {
      Objects.requireNonNull(record, "record");
      Objects.requireNonNull(error, "error");
    }
  }

  /** A retried record is waiting {@code remaining} before it is handled again. */
  record WaitingBeforeRetry(ConsumerRecord<?, ?> record, RetryAttempt attempt, Duration remaining)
      implements HandlerMetric {
  }

  /** A failed record was re-produced to the next retry topic. */
  record RetryProduced(ConsumerRecord<?, ?> record, ProducerRecord<?, ?> retryRecord) implements HandlerMetric {
  }

  /** Producing a retry record failed; the failure is surfaced to the caller. */
  record RetryProduceFailed(ConsumerRecord<?, ?> record, ProducerRecord<?, ?> retryRecord, Throwable error)
      implements HandlerMetric {
  }

  /** No retry is left (or the error is not retryable); the error is surfaced to the caller. */
  record RetriesExhausted(ConsumerRecord<?, ?> record, RetryAttempt attempt) implements HandlerMetric {
  }
}
