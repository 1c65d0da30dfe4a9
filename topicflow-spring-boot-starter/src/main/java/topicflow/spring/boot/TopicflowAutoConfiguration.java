package topicflow.spring.boot;

import org.springframework.beans.factory.ListableBeanFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import topicflow.Either;
import topicflow.RecordHandler;
import topicflow.SerializationError;
import topicflow.parallel.ParallelRecordHandler;
import topicflow.retry.NonBlockingRetryPolicy;
import topicflow.retry.RetryPolicy;
import topicflow.spi.MetricsExporter;
import topicflow.spi.Producer;

import java.util.List;

/**
 * Auto-configuration for topicflow record handlers.
 *
 * <p>Creates a {@link NonBlockingRetryPolicy} when {@code topicflow.retry.group} is set
 * (deserialization failures and {@code non-retryable-exceptions} are never retried),
 * and a {@link ParallelRecordHandler} composed from all {@link TopicHandler} beans. The
 * application's consumer subscribes to its {@code topics()} and feeds it every polled
 * record; the handler is closed with the context.
 *
 * @see TopicflowProperties
 * @see TopicflowMicrometerAutoConfiguration
 */
@AutoConfiguration
@ConditionalOnClass(RecordHandler.class)
@EnableConfigurationProperties(TopicflowProperties.class)
public class TopicflowAutoConfiguration {

  @Bean
  @ConditionalOnMissingBean(RetryPolicy.class)
  @ConditionalOnProperty(prefix = "topicflow.retry", name = "group")
  public NonBlockingRetryPolicy<Object> retryPolicy(TopicflowProperties props) {
    List<Class<? extends Throwable>> nonRetryable = List.copyOf(props.getRetry().getNonRetryableExceptions());
    return NonBlockingRetryPolicy.builder(props.getRetry().getGroup())
        .backoffs(props.getRetry().getBackoffs())
        .nonRetryable(error -> isNonRetryable(error, nonRetryable))
        .build();
  }

  /**
   * Matches the innermost error of {@code error}: handler beans produced by
   * {@code deserialize} fail with an {@link Either}. Malformed input is never retried.
   */
  static boolean isNonRetryable(Object error, List<Class<? extends Throwable>> nonRetryable) {
    Object cause = error;
    while (cause instanceof Either<?, ?> either) {
      cause = either.fold(left -> left, right -> right);
    }
    if (cause instanceof SerializationError) {
      return true;
    }
    for (Class<? extends Throwable> type : nonRetryable) {
      if (type.isInstance(cause)) {
        return true;
      }
    }
    return false;
  }

  @Bean
  @ConditionalOnMissingBean
  public TopicHandlerAssembler topicHandlerAssembler(ListableBeanFactory beanFactory) {
    return new TopicHandlerAssembler(beanFactory);
  }

  @Bean(destroyMethod = "close")
  @ConditionalOnMissingBean(ParallelRecordHandler.class)
  @ConditionalOnBean(annotation = TopicHandler.class)
  public ParallelRecordHandler<Object, byte[], byte[]> topicflowRecordHandler(
      TopicflowProperties props,
      TopicHandlerAssembler assembler,
      ObjectProvider<RetryPolicy<?>> retryPolicyProvider,
      ObjectProvider<Producer> producerProvider,
      ObjectProvider<MetricsExporter> metricsProvider) {

    MetricsExporter metrics = metricsProvider.getIfAvailable(() -> MetricsExporter.NOOP);
    return assembler.assembleParallel(props.getParallel(),
        retryPolicyProvider.getIfAvailable(),
        producerProvider.getIfAvailable(),
        metrics);
  }
}
