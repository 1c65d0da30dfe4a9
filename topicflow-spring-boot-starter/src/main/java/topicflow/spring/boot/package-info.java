/**
 * Spring Boot auto-configuration for topicflow.
 *
 * <p>Annotate byte-level {@link topicflow.RecordHandler} beans with
 * {@link topicflow.spring.boot.TopicHandler}; the starter combines them, adds retries
 * from {@code topicflow.retry.*} when a {@link topicflow.spi.Producer} bean exists, and
 * exposes the result as a {@link topicflow.parallel.ParallelRecordHandler} bean.
 *
 * @see topicflow.spring.boot.TopicflowProperties
 */
package topicflow.spring.boot;
