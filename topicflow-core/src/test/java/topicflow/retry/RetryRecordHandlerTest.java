package topicflow.retry;

import org.junit.jupiter.api.Test;
import topicflow.ConsumerRecord;
import topicflow.Either;
import topicflow.HandleResult;
import topicflow.Headers;
import topicflow.HandlingInterruptedException;
import topicflow.ProducerError;
import topicflow.ProducerRecord;
import topicflow.RecordHandler;
import topicflow.RecordMetadata;
import topicflow.metrics.HandlerMetric;
import topicflow.spi.MetricsExporter;
import topicflow.spi.Producer;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class RetryRecordHandlerTest {

    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");
    private static final Clock CLOCK = Clock.fixed(NOW, ZoneOffset.UTC);

    private final RecordingProducer producer = new RecordingProducer();
    private final List<Duration> sleeps = new ArrayList<>();
    private final List<HandlerMetric> metrics = new ArrayList<>();

    // ── Topics ──────────────────────────────────────────────────────

    @Test
    void topicsIncludeRetryTopicsOfEveryWrappedTopic() {
        RecordHandler<String, byte[], byte[]> handler =
                RecordHandler.of(Set.of("orders", "refunds"), record -> HandleResult.done());

        RetryRecordHandler<String> retrying = RetryRecordHandler.withRetries(handler, policy(2), producer);

        assertEquals(Set.of(
                "orders", "orders-billing-retry-0", "orders-billing-retry-1",
                "refunds", "refunds-billing-retry-0", "refunds-billing-retry-1"), retrying.topics());
        assertEquals(retrying.topics(), retrying.topics());
    }

    // ── Retry chain ─────────────────────────────────────────────────

    @Test
    void alwaysFailingHandlerIsRetriedExactlyOncePerRetryTopic() {
        RecordHandler<String, byte[], byte[]> failing = RecordHandler.of("orders", record -> HandleResult.failed("boom"));
        RetryRecordHandler<String> retrying = newHandler(failing, policy(3));

        ConsumerRecord<byte[], byte[]> record = ConsumerRecord.of("orders", 0, 0L, bytes("k"), bytes("v"));
        HandleResult<Either<ProducerError, String>> result = retrying.handle(record);
        int deliveries = 1;
        while (result.isDone()) {
            assertTrue(deliveries <= 3, "more than three retries produced");
            record = deliver(producer.last(), deliveries);
            result = retrying.handle(record);
            deliveries++;
        }

        assertEquals(3, producer.produced.size());
        assertEquals(List.of("orders-billing-retry-0", "orders-billing-retry-1", "orders-billing-retry-2"),
                producer.topics());
        assertEquals(Either.right("boom"), result.failure().orElseThrow());
    }

    @Test
    void failOnceThenSucceedProducesSingleRetry() {
        AtomicInteger calls = new AtomicInteger();
        RecordHandler<String, byte[], byte[]> flaky = RecordHandler.of("t", record ->
                calls.getAndIncrement() == 0 ? HandleResult.failed("transient") : HandleResult.done());
        RetryRecordHandler<String> retrying = newHandler(flaky, new SingleTopicPolicy());

        assertTrue(retrying.handle(ConsumerRecord.of("t", 0, 0L, null, bytes("v"))).isDone());
        assertEquals(List.of("t-retry-1"), producer.topics());

        assertTrue(retrying.handle(deliver(producer.last(), 1)).isDone());
        assertEquals(1, producer.produced.size());
        assertEquals(2, calls.get());
    }

    @Test
    void retryTopicsOfCombinedHandlersRouteBackToTheirOwnHandler() {
        AtomicInteger ordersCalls = new AtomicInteger();
        AtomicInteger refundsCalls = new AtomicInteger();
        RecordHandler<String, byte[], byte[]> orders = RecordHandler.of("orders", record -> {
            ordersCalls.incrementAndGet();
            return HandleResult.failed("boom");
        });
        RecordHandler<String, byte[], byte[]> refunds = RecordHandler.of("refunds", record -> {
            refundsCalls.incrementAndGet();
            return HandleResult.done();
        });
        RecordHandler<Either<ProducerError, String>, byte[], byte[]> combined =
                newHandler(orders, policy(2)).combine(newHandler(refunds, policy(2)));

        assertTrue(combined.handle(ConsumerRecord.of("orders", 0, 0L, null, bytes("v"))).isDone());
        assertTrue(combined.handle(deliver(producer.last(), 1)).isDone());

        assertEquals(2, ordersCalls.get());
        assertEquals(0, refundsCalls.get());
        assertEquals(List.of("orders-billing-retry-0", "orders-billing-retry-1"), producer.topics());
    }

    @Test
    void retryRecordKeepsKeyValueAndHeaders() {
        RecordHandler<String, byte[], byte[]> failing = RecordHandler.of("orders", record -> HandleResult.failed("boom"));
        RetryRecordHandler<String> retrying = newHandler(failing, policy(1));

        Headers headers = Headers.EMPTY.withString("trace", "t-1");
        retrying.handle(new ConsumerRecord<>("orders", 4, 10L, headers, bytes("k"), bytes("v")));

        ProducerRecord<byte[], byte[]> produced = producer.last();
        assertArrayEquals(bytes("k"), produced.key().orElseThrow());
        assertArrayEquals(bytes("v"), produced.value());
        assertEquals("t-1", produced.headers().lastString("trace").orElseThrow());
        assertTrue(produced.partition().isEmpty());
    }

    @Test
    void producerFailureSurfacesAsLeft() {
        ProducerError error = new ProducerError("broker unavailable");
        producer.failWith = error;
        RecordHandler<String, byte[], byte[]> failing = RecordHandler.of("orders", record -> HandleResult.failed("boom"));
        RetryRecordHandler<String> retrying = newHandler(failing, policy(2));

        HandleResult<Either<ProducerError, String>> result =
                retrying.handle(ConsumerRecord.of("orders", 0, 0L, null, bytes("v")));

        assertEquals(Either.left(error), result.failure().orElseThrow());
        assertEquals(1, producer.attempts);
        assertEquals(1, ofType(HandlerMetric.RetryProduceFailed.class).size());
    }

    @Test
    void emptyRetryChainPassesThrough() {
        AtomicInteger calls = new AtomicInteger();
        RecordHandler<String, byte[], byte[]> handler = RecordHandler.of("orders", record ->
                calls.incrementAndGet() == 1 ? HandleResult.done() : HandleResult.failed("boom"));
        RetryRecordHandler<String> retrying = newHandler(handler, policy(0));

        assertEquals(Set.of("orders"), retrying.topics());
        assertTrue(retrying.handle(ConsumerRecord.of("orders", 0, 0L, null, bytes("v"))).isDone());
        assertEquals(Either.right("boom"),
                retrying.handle(ConsumerRecord.of("orders", 0, 1L, null, bytes("v"))).failure().orElseThrow());
        assertTrue(producer.produced.isEmpty());
        assertEquals(1, ofType(HandlerMetric.RetriesExhausted.class).size());
    }

    @Test
    void nonRetryableErrorIsSurfacedImmediately() {
        NonBlockingRetryPolicy<String> policy = NonBlockingRetryPolicy.<String>builder("billing")
                .backoffs(Duration.ofSeconds(1), Duration.ofSeconds(5))
                .nonRetryable(error -> error.startsWith("fatal"))
                .clock(CLOCK)
                .build();
        RecordHandler<String, byte[], byte[]> failing = RecordHandler.of("orders", record -> HandleResult.failed("fatal: bad schema"));

        HandleResult<Either<ProducerError, String>> result =
                newHandler(failing, policy).handle(ConsumerRecord.of("orders", 0, 0L, null, bytes("v")));

        assertEquals(Either.right("fatal: bad schema"), result.failure().orElseThrow());
        assertTrue(producer.produced.isEmpty());
    }

    @Test
    void successOnRetryTopicProducesNothing() {
        RecordHandler<String, byte[], byte[]> ok = RecordHandler.of("orders", record -> HandleResult.done());
        RetryRecordHandler<String> retrying = newHandler(ok, policy(2));

        ConsumerRecord<byte[], byte[]> retried = new ConsumerRecord<>("orders-billing-retry-0", 0, 0L,
                retryHeaders(0, NOW.minusSeconds(10), Duration.ofSeconds(1)), null, bytes("v"));

        assertTrue(retrying.handle(retried).isDone());
        assertTrue(producer.produced.isEmpty());
        assertTrue(ofType(HandlerMetric.RetryProduced.class).isEmpty());
        assertTrue(ofType(HandlerMetric.RetriesExhausted.class).isEmpty());
    }

    // ── Backoff ─────────────────────────────────────────────────────

    @Test
    void waitsForRemainingBackoffBeforeHandling() {
        List<String> events = new ArrayList<>();
        RecordHandler<String, byte[], byte[]> handler = RecordHandler.of("orders", record -> {
            events.add("handle");
            return HandleResult.done();
        });
        RetryRecordHandler<String> retrying = RetryRecordHandler.builder(handler, policy(2), producer)
                .clock(CLOCK)
                .metrics(metrics::add)
                .sleeper(duration -> {
                    events.add("sleep " + duration);
                    sleeps.add(duration);
                })
                .build();

        ConsumerRecord<byte[], byte[]> retried = new ConsumerRecord<>("orders-billing-retry-1", 0, 0L,
                retryHeaders(1, NOW.minusSeconds(2), Duration.ofSeconds(5)), null, bytes("v"));
        retrying.handle(retried);

        assertEquals(List.of("sleep PT3S", "handle"), events);
        HandlerMetric.WaitingBeforeRetry waiting = ofType(HandlerMetric.WaitingBeforeRetry.class).get(0);
        assertEquals(Duration.ofSeconds(3), waiting.remaining());
        assertEquals(1, waiting.attempt().attempt());
        assertEquals("orders", waiting.attempt().originalTopic());
    }

    @Test
    void doesNotWaitWhenBackoffAlreadyElapsed() {
        RecordHandler<String, byte[], byte[]> handler = RecordHandler.of("orders", record -> HandleResult.done());
        RetryRecordHandler<String> retrying = newHandler(handler, policy(2));

        retrying.handle(new ConsumerRecord<>("orders-billing-retry-0", 0, 0L,
                retryHeaders(0, NOW.minusSeconds(60), Duration.ofSeconds(1)), null, bytes("v")));

        assertTrue(sleeps.isEmpty());
    }

    @Test
    void firstAttemptRecordsNeverWait() {
        RecordHandler<String, byte[], byte[]> handler = RecordHandler.of("orders", record -> HandleResult.done());
        RetryRecordHandler<String> retrying = newHandler(handler, policy(2));

        retrying.handle(ConsumerRecord.of("orders", 0, 0L, null, bytes("v")));

        assertTrue(sleeps.isEmpty());
    }

    @Test
    void interruptedBackoffThrowsAndRestoresFlag() {
        AtomicInteger calls = new AtomicInteger();
        RecordHandler<String, byte[], byte[]> handler = RecordHandler.of("orders", record -> {
            calls.incrementAndGet();
            return HandleResult.done();
        });
        RetryRecordHandler<String> retrying = RetryRecordHandler.builder(handler, policy(1), producer)
                .clock(CLOCK)
                .sleeper(duration -> {
                    throw new InterruptedException("shutdown");
                })
                .build();

        ConsumerRecord<byte[], byte[]> retried = new ConsumerRecord<>("orders-billing-retry-0", 0, 0L,
                retryHeaders(0, NOW, Duration.ofSeconds(5)), null, bytes("v"));

        try {
            assertThrows(HandlingInterruptedException.class, () -> retrying.handle(retried));
            assertTrue(Thread.currentThread().isInterrupted());
        } finally {
            Thread.interrupted();
        }
        assertEquals(0, calls.get());
    }

    // ── Helpers ─────────────────────────────────────────────────────

    private RetryRecordHandler<String> newHandler(RecordHandler<String, byte[], byte[]> handler,
                                                  RetryPolicy<? super String> policy) {
        return RetryRecordHandler.builder(handler, policy, producer)
                .clock(CLOCK)
                .metrics(metrics::add)
                .sleeper(sleeps::add)
                .build();
    }

    private static NonBlockingRetryPolicy<String> policy(int retries) {
        return NonBlockingRetryPolicy.<String>builder("billing")
                .backoffs(ExponentialBackoff.chain(Duration.ofSeconds(1), Duration.ofMinutes(1), retries))
                .clock(CLOCK)
                .build();
    }

    private static Headers retryHeaders(int attempt, Instant submittedAt, Duration backoff) {
        return Headers.EMPTY
                .withString(NonBlockingRetryPolicy.ATTEMPT_HEADER, Integer.toString(attempt))
                .withString(NonBlockingRetryPolicy.SUBMITTED_AT_HEADER, Long.toString(submittedAt.toEpochMilli()))
                .withString(NonBlockingRetryPolicy.BACKOFF_HEADER, Long.toString(backoff.toMillis()));
    }

    private static ConsumerRecord<byte[], byte[]> deliver(ProducerRecord<byte[], byte[]> produced, long offset) {
        return new ConsumerRecord<>(produced.topic(), 0, offset, produced.headers(),
                produced.key().orElse(null), produced.value());
    }

    private static byte[] bytes(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }

    private <T extends HandlerMetric> List<T> ofType(Class<T> type) {
        List<T> matching = new ArrayList<>();
        for (HandlerMetric metric : metrics) {
            if (type.isInstance(metric)) {
                matching.add(type.cast(metric));
            }
        }
        return matching;
    }

    static final class RecordingProducer implements Producer {
        final List<ProducerRecord<byte[], byte[]>> produced = new ArrayList<>();
        ProducerError failWith;
        int attempts;

        @Override
        public Either<ProducerError, RecordMetadata> produce(ProducerRecord<byte[], byte[]> record) {
            attempts++;
            if (failWith != null) {
                return Either.left(failWith);
            }
            produced.add(record);
            return Either.right(new RecordMetadata(record.topic(), 0, produced.size() - 1));
        }

        ProducerRecord<byte[], byte[]> last() {
            return produced.get(produced.size() - 1);
        }

        List<String> topics() {
            List<String> topics = new ArrayList<>();
            for (ProducerRecord<byte[], byte[]> record : produced) {
                topics.add(record.topic());
            }
            return topics;
        }
    }

    /** One retry topic, no backoff. */
    static final class SingleTopicPolicy implements RetryPolicy<String> {
        @Override
        public List<String> retryTopics(String topic) {
            return List.of(topic + "-retry-1");
        }

        @Override
        public Optional<RetryAttempt> retryAttempt(String topic, Headers headers) {
            if (!topic.endsWith("-retry-1")) {
                return Optional.empty();
            }
            return Optional.of(new RetryAttempt(0, topic.substring(0, topic.length() - "-retry-1".length()),
                    NOW, Duration.ZERO));
        }

        @Override
        public Optional<ProducerRecord<byte[], byte[]>> retryRecord(RetryAttempt attempt,
                                                                    ConsumerRecord<byte[], byte[]> record,
                                                                    String error) {
            if (attempt != null) {
                return Optional.empty();
            }
            return Optional.of(ProducerRecord.of(record.topic() + "-retry-1", record.key().orElse(null),
                    record.value(), record.headers()));
        }
    }
}
