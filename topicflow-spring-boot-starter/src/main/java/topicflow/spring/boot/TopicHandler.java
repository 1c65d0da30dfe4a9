package topicflow.spring.boot;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a Spring bean as one of the application's topic handlers.
 *
 * <p>The annotated bean must be a byte-level {@link topicflow.RecordHandler}, typically
 * obtained with {@link topicflow.RecordHandler#deserialize}. All annotated beans are
 * combined into a single handler, wrapped with retries when a
 * {@link topicflow.retry.RetryPolicy} and a {@link topicflow.spi.Producer} are
 * available, and dispatched in parallel:
 *
 * <pre>{@code
 * @Bean
 * @TopicHandler
 * RecordHandler<?, byte[], byte[]> orders(OrderService service) {
 *   return RecordHandler.<String, Order>fromConsumer("orders", r -> service.fulfil(r.value()))
 *       .deserialize(Deserializers.string(), orderDeserializer);
 * }
 * }</pre>
 *
 * @see TopicHandlerAssembler
 */
@Target({ElementType.TYPE, ElementType.METHOD})
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface TopicHandler {
}
