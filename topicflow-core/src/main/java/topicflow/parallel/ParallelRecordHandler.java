package topicflow.parallel;

import topicflow.ConsumerRecord;
import topicflow.HandleResult;
import topicflow.HandlingInterruptedException;
import topicflow.RecordHandler;
import topicflow.metrics.HandlerMetric;
import topicflow.spi.MetricsExporter;
import topicflow.util.DaemonThreadFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Fans a handler out across a fixed set of worker threads, one bounded FIFO queue per
 * worker.
 *
 * <p>{@link #handle(ConsumerRecord)} enqueues the record on worker
 * {@code partition % workerCount} and returns {@link HandleResult#done()} once it is
 * queued; the wrapped handler's result is observed only by the worker, which reports
 * failures as {@link HandlerMetric.RecordHandlingFailed} and moves on. Records of one
 * partition are therefore handled strictly in submission order. When the target queue
 * is full the caller blocks until the worker frees a slot, so a slow handler throttles
 * the poll loop instead of buffering without bound.
 *
 * <p>Instances own their worker threads and must be closed. {@link #close()} stops
 * accepting records, lets workers drain their queues for up to the drain timeout, then
 * interrupts them; records still queued at that point are dropped and their number is
 * logged. An invocation in flight at close may finish within the drain window; it is
 * interrupted only once {@code drainTimeoutMs} has elapsed. Interrupts raised by the
 * wrapped handler itself are cleared and logged, and the worker keeps running.
 *
 * <p>Create instances via {@link RecordHandler#parallel(int)} or {@link #builder(RecordHandler)}.
 *
 * @param <E> error type of the wrapped handler
 * @param <K> record key type
 * @param <V> record value type
 */
public final class ParallelRecordHandler<E, K, V> implements RecordHandler<E, K, V>, AutoCloseable {
  private static final Logger logger = Logger.getLogger(ParallelRecordHandler.class.getName());

  public static final int DEFAULT_QUEUE_CAPACITY = 128;
  public static final int DEFAULT_WORKER_COUNT = 4;
  public static final long DEFAULT_DRAIN_TIMEOUT_MS = 5000;

  private static final long QUEUE_POLL_TIMEOUT_MS = 50;
  private static final long QUEUE_OFFER_TIMEOUT_MS = 50;

  private final RecordHandler<E, K, V> handler;
  private final Set<String> topics;
  private final List<BlockingQueue<ConsumerRecord<K, V>>> queues;
  private final ExecutorService workers;
  private final MetricsExporter metrics;
  private final int queueCapacity;
  private final long drainTimeoutMs;

  private final AtomicBoolean accepting = new AtomicBoolean(true);
  private final AtomicBoolean running = new AtomicBoolean(true);
  private final AtomicBoolean closed = new AtomicBoolean(false);
  private final AtomicInteger pendingSubmissions = new AtomicInteger(0);
  // set by close() before interrupting workers; other interrupts are cleared and ignored
  private volatile boolean forcedStop;

  private ParallelRecordHandler(Builder<E, K, V> builder) {
    this.handler = Objects.requireNonNull(builder.handler, "handler");
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    int workerCount = builder.workerCount;
    if (workerCount < 1) {
      throw new IllegalArgumentException("workerCount must be >= 1");
    }
    if (builder.queueCapacity < 1) {
      throw new IllegalArgumentException("queueCapacity must be >= 1");
    }
    if (builder.drainTimeoutMs < 0) {
      throw new IllegalArgumentException("drainTimeoutMs must be >= 0");
    }
    this.queueCapacity = builder.queueCapacity;
    this.drainTimeoutMs = builder.drainTimeoutMs;
    this.topics = handler.topics();

    List<BlockingQueue<ConsumerRecord<K, V>>> queueList = new ArrayList<>(workerCount);
    for (int i = 0; i < workerCount; i++) {
      queueList.add(new ArrayBlockingQueue<>(queueCapacity));
    }
    this.queues = Collections.unmodifiableList(queueList);

    this.workers = Executors.newFixedThreadPool(workerCount, new DaemonThreadFactory(builder.threadNamePrefix));
    for (int i = 0; i < workerCount; i++) {
      int worker = i;
      metrics.report(new HandlerMetric.StartingWorker(worker));
      workers.submit(() -> workerLoop(worker));
    }
  }

  public static <E, K, V> Builder<E, K, V> builder(RecordHandler<E, K, V> handler) {
    return new Builder<>(handler);
  }

  @Override
  public Set<String> topics() {
    return topics;
  }

  /**
   * Enqueues {@code record} on its partition's worker, blocking while that worker's
   * queue is full.
   *
   * @return {@link HandleResult#done()} once the record is queued
   * @throws IllegalStateException if this handler has been closed
   * @throws HandlingInterruptedException if the calling thread is interrupted while waiting
   */
  @Override
  public HandleResult<E> handle(ConsumerRecord<K, V> record) {
    Objects.requireNonNull(record, "record");
    pendingSubmissions.incrementAndGet();
    try {
      ensureAccepting();
      metrics.report(new HandlerMetric.SubmittingRecord(record));
      BlockingQueue<ConsumerRecord<K, V>> queue = queues.get(workerFor(record));
      while (!queue.offer(record, QUEUE_OFFER_TIMEOUT_MS, TimeUnit.MILLISECONDS)) {
        ensureAccepting();
      }
      return HandleResult.done();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new HandlingInterruptedException(
          "Interrupted while submitting record " + record.topic() + "-" + record.partition()
              + "@" + record.offset(), e);
    } finally {
      pendingSubmissions.decrementAndGet();
    }
  }

  public int workerCount() {
    return queues.size();
  }

  public int queueCapacity() {
    return queueCapacity;
  }

  /**
   * Number of records queued and not yet taken by a worker.
   */
  public int queuedRecords() {
    int total = 0;
    for (BlockingQueue<ConsumerRecord<K, V>> queue : queues) {
      total += queue.size();
    }
    return total;
  }

  public boolean isClosed() {
    return closed.get();
  }

  private int workerFor(ConsumerRecord<K, V> record) {
    return record.partition() % queues.size();
  }

  private void ensureAccepting() {
    if (!accepting.get()) {
      throw new IllegalStateException("ParallelRecordHandler is closed");
    }
  }

  private void workerLoop(int worker) {
    BlockingQueue<ConsumerRecord<K, V>> queue = queues.get(worker);
    while (true) {
      try {
        ConsumerRecord<K, V> record = queue.poll(QUEUE_POLL_TIMEOUT_MS, TimeUnit.MILLISECONDS);
        if (record == null) {
          if (!running.get()) break;
          continue;
        }
        handleRecord(worker, record);
        if (Thread.interrupted()) {
          if (forcedStop) break;
          logger.log(Level.WARNING, "Handler on worker " + worker + " left the interrupt flag set after "
              + record.topic() + "-" + record.partition() + "@" + record.offset() + "; cleared");
        }
      } catch (InterruptedException e) {
        if (forcedStop) break;
        logger.log(Level.WARNING, "Worker " + worker + " interrupted outside close; continuing");
      } catch (Throwable t) {
        logger.log(Level.SEVERE, "Worker " + worker + " loop error", t);
      }
    }
  }

  private void handleRecord(int worker, ConsumerRecord<K, V> record) {
    metrics.report(new HandlerMetric.HandlingRecord(record, worker));
    try {
      HandleResult<E> result = handler.handle(record);
      if (result instanceof HandleResult.Failed<E> failed) {
        metrics.report(new HandlerMetric.RecordHandlingFailed(record, worker, failed.error()));
        if (logger.isLoggable(Level.FINE)) {
          logger.fine("Handler failed for " + record.topic() + "-" + record.partition()
              + "@" + record.offset() + ": " + failed.error());
        }
      }
    } catch (RuntimeException e) {
      metrics.report(new HandlerMetric.RecordHandlingFailed(record, worker, e));
      logger.log(Level.WARNING, "Handler threw for " + record.topic() + "-" + record.partition()
          + "@" + record.offset(), e);
    }
  }

  /**
   * Stops accepting records, waits up to the drain timeout for queued records to be
   * handled, then interrupts the workers and drops whatever is still queued.
   * Calling this more than once has no further effect.
   */
  @Override
  public void close() {
    if (!closed.compareAndSet(false, true)) {
      return;
    }
    accepting.set(false);
    while (pendingSubmissions.get() > 0) {
      Thread.onSpinWait();
    }
    for (int i = 0; i < queues.size(); i++) {
      metrics.report(new HandlerMetric.StoppingWorker(i));
    }
    running.set(false);
    workers.shutdown();
    try {
      if (!workers.awaitTermination(drainTimeoutMs, TimeUnit.MILLISECONDS)) {
        forcedStop = true;
        workers.shutdownNow();
        int dropped = clearQueues();
        logger.log(Level.WARNING, "Drain timeout of " + drainTimeoutMs + "ms exceeded; dropped "
            + dropped + " queued record(s)");
        workers.awaitTermination(5, TimeUnit.SECONDS);
      }
    } catch (InterruptedException e) {
      forcedStop = true;
      workers.shutdownNow();
      int dropped = clearQueues();
      if (dropped > 0) {
        logger.log(Level.WARNING, "Interrupted while draining; dropped " + dropped + " queued record(s)");
      }
      Thread.currentThread().interrupt();
    }
  }

  private int clearQueues() {
    int dropped = 0;
    for (BlockingQueue<ConsumerRecord<K, V>> queue : queues) {
      List<ConsumerRecord<K, V>> remaining = new ArrayList<>();
      dropped += queue.drainTo(remaining);
    }
    return dropped;
  }

  /** Builder for {@link ParallelRecordHandler}. */
  public static final class Builder<E, K, V> {
    private final RecordHandler<E, K, V> handler;
    private int workerCount = DEFAULT_WORKER_COUNT;
    private int queueCapacity = DEFAULT_QUEUE_CAPACITY;
    private MetricsExporter metrics;
    private long drainTimeoutMs = DEFAULT_DRAIN_TIMEOUT_MS;
    private String threadNamePrefix = "topicflow-worker-";

    private Builder(RecordHandler<E, K, V> handler) {
      this.handler = handler;
    }

    /**
     * Sets the number of worker threads, each owning one queue.
     *
     * <p>Optional. Defaults to {@code 4}. Must be &ge; 1.
     */
    public Builder<E, K, V> workerCount(int workerCount) {
      this.workerCount = workerCount;
      return this;
    }

    /**
     * Sets the capacity of each worker queue.
     *
     * <p>Optional. Defaults to {@code 128}. Must be &ge; 1.
     */
    public Builder<E, K, V> queueCapacity(int queueCapacity) {
      this.queueCapacity = queueCapacity;
      return this;
    }

    /**
     * Sets the metrics sink. Optional; defaults to {@link MetricsExporter#NOOP}.
     */
    public Builder<E, K, V> metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    /**
     * Sets how long {@link #close()} waits for queued records before dropping them.
     *
     * <p>Optional. Defaults to {@code 5000}.
     */
    public Builder<E, K, V> drainTimeoutMs(long drainTimeoutMs) {
      this.drainTimeoutMs = drainTimeoutMs;
      return this;
    }

    public Builder<E, K, V> threadNamePrefix(String threadNamePrefix) {
      this.threadNamePrefix = Objects.requireNonNull(threadNamePrefix, "threadNamePrefix");
      return this;
    }

    public ParallelRecordHandler<E, K, V> build() {
      return new ParallelRecordHandler<>(this);
    }
  }
}
