/**
 * Byte decoders used by {@link topicflow.RecordHandler#deserialize}.
 */
package topicflow.serialization;
