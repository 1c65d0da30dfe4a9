/**
 * Service provider interfaces for the collaborators handlers talk to: the
 * {@linkplain topicflow.spi.Producer producer} used for retry topics and the
 * {@linkplain topicflow.spi.MetricsExporter metrics sink}.
 */
package topicflow.spi;
