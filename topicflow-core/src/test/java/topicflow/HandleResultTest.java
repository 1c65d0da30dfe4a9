package topicflow;

import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class HandleResultTest {

    @Test
    void doneHasNoFailure() {
        HandleResult<String> result = HandleResult.done();

        assertTrue(result.isDone());
        assertEquals(Optional.empty(), result.failure());
    }

    @Test
    void failedExposesErrorThroughAccessorAndFailure() {
        HandleResult<String> result = HandleResult.failed("boom");

        assertFalse(result.isDone());
        assertEquals(Optional.of("boom"), result.failure());
        assertEquals("boom", ((HandleResult.Failed<String>) result).error());
    }

    @Test
    void mapErrorTransformsOnlyFailures() {
        HandleResult<Integer> failed = HandleResult.<String>failed("boom").mapError(String::length);
        HandleResult<Integer> done = HandleResult.<String>done().mapError(String::length);

        assertEquals(Optional.of(4), failed.failure());
        assertTrue(done.isDone());
    }

    @Test
    void failedRejectsNullError() {
        assertThrows(NullPointerException.class, () -> HandleResult.failed(null));
    }
}
