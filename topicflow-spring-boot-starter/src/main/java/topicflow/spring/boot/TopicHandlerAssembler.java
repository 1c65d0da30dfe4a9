package topicflow.spring.boot;

import org.springframework.beans.factory.BeanCreationException;
import org.springframework.beans.factory.ListableBeanFactory;
import topicflow.RecordHandler;
import topicflow.parallel.ParallelRecordHandler;
import topicflow.retry.RetryPolicy;
import topicflow.retry.RetryRecordHandler;
import topicflow.spi.MetricsExporter;
import topicflow.spi.Producer;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Collects beans annotated with {@link TopicHandler} and composes them into the
 * application's handler.
 *
 * <p>Handlers are combined in bean registration order. Retries are added to each
 * handler, before combining, only when both a retry policy and a producer are given.
 *
 * @see TopicHandler
 */
public class TopicHandlerAssembler {
  private static final Logger logger = Logger.getLogger(TopicHandlerAssembler.class.getName());

  private final ListableBeanFactory beanFactory;

  public TopicHandlerAssembler(ListableBeanFactory beanFactory) {
    this.beanFactory = beanFactory;
  }

  /**
   * Returns every {@link TopicHandler} bean.
   *
   * @throws BeanCreationException if an annotated bean is not a {@link RecordHandler}
   */
  @SuppressWarnings("unchecked")
  public List<RecordHandler<Object, byte[], byte[]>> topicHandlers() {
    Map<String, Object> beans = beanFactory.getBeansWithAnnotation(TopicHandler.class);
    List<RecordHandler<Object, byte[], byte[]>> handlers = new ArrayList<>(beans.size());
    for (Map.Entry<String, Object> entry : beans.entrySet()) {
      String beanName = entry.getKey();
      Object bean = entry.getValue();
      if (!(bean instanceof RecordHandler<?, ?, ?> handler)) {
        throw new BeanCreationException(beanName,
            "Bean annotated with @TopicHandler must implement RecordHandler, "
                + "but " + bean.getClass().getName() + " does not");
      }
      // keys and values are erased; annotated handlers are documented as byte-level
      handlers.add((RecordHandler<Object, byte[], byte[]>) handler);
    }
    return handlers;
  }

  /**
   * Adds retries to every topic handler when {@code retryPolicy} and {@code producer}
   * are both non-null, then combines them.
   *
   * <p>Each handler is wrapped on its own so that its retry topics are routed back to
   * it by the combined handler.
   */
  @SuppressWarnings("unchecked")
  public RecordHandler<Object, byte[], byte[]> assemble(RetryPolicy<?> retryPolicy,
                                                        Producer producer,
                                                        MetricsExporter metrics) {
    List<RecordHandler<Object, byte[], byte[]>> handlers = topicHandlers();
    if (retryPolicy == null || producer == null) {
      RecordHandler<Object, byte[], byte[]> combined = RecordHandler.combineAll(handlers);
      logger.info("Assembled " + handlers.size() + " topic handler(s) without retries for topics "
          + combined.topics());
      return combined;
    }
    List<RecordHandler<Object, byte[], byte[]>> retrying = new ArrayList<>(handlers.size());
    for (RecordHandler<Object, byte[], byte[]> handler : handlers) {
      RetryRecordHandler<Object> withRetries = RetryRecordHandler
          .builder(handler, (RetryPolicy<Object>) retryPolicy, producer)
          .metrics(metrics)
          .build();
      retrying.add(withRetries.mapError(error -> error));
    }
    RecordHandler<Object, byte[], byte[]> combined = RecordHandler.combineAll(retrying);
    logger.info("Assembled " + handlers.size() + " topic handler(s) with retries for topics "
        + combined.topics());
    return combined;
  }

  /**
   * Assembles the handler and dispatches it on a {@link ParallelRecordHandler}
   * configured from {@code parallel}.
   */
  public ParallelRecordHandler<Object, byte[], byte[]> assembleParallel(TopicflowProperties.Parallel parallel,
                                                                        RetryPolicy<?> retryPolicy,
                                                                        Producer producer,
                                                                        MetricsExporter metrics) {
    return ParallelRecordHandler.builder(assemble(retryPolicy, producer, metrics))
        .workerCount(parallel.getWorkerCount())
        .queueCapacity(parallel.getQueueCapacity())
        .drainTimeoutMs(parallel.getDrainTimeoutMs())
        .metrics(metrics)
        .build();
  }
}
