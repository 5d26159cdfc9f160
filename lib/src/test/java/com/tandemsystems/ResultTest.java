package com.tandemsystems;

import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;

class ResultTest {

    @Test
    void testSuccessAccessors() {
        Result<Integer> result = Result.success(101);

        assertTrue(result.isSuccess());
        assertEquals(101, result.getOrThrow());
        assertEquals(101, result.getOrElse(0));
        assertTrue(result.error().isEmpty());
    }

    @Test
    void testFailureAccessors() {
        Result<Integer> result = Result.failure(OperationError.WRONG_VARIANT, "expected MsgOne");

        assertFalse(result.isSuccess());
        assertEquals(0, result.getOrElse(0));
        assertEquals(OperationError.WRONG_VARIANT, result.error().orElseThrow());
        OperationException exception = assertThrows(OperationException.class, result::getOrThrow);
        assertEquals("expected MsgOne", exception.getMessage());
    }

    @Test
    void testMapAndFlatMap() {
        assertEquals(Result.success("101"), Result.success(101).map(String::valueOf));
        assertEquals(Result.success(2), Result.success(1).flatMap(v -> Result.success(v + 1)));

        Result<Integer> failure = Result.failure(OperationError.SEND_FAILED, "closed");
        assertEquals(OperationError.SEND_FAILED, failure.map(v -> v + 1).error().orElseThrow());
        assertEquals(OperationError.SEND_FAILED, failure.flatMap(v -> Result.success(v)).error().orElseThrow());
    }

    @Test
    void testCallbacks() {
        AtomicBoolean succeeded = new AtomicBoolean();
        AtomicBoolean failed = new AtomicBoolean();

        Result.success(1).ifSuccess(v -> succeeded.set(true));
        Result.success(1).ifFailure(e -> failed.set(true));
        assertTrue(succeeded.get());
        assertFalse(failed.get());

        Result.failure(OperationError.SEND_FAILED, "closed").ifFailure(e -> failed.set(true));
        assertTrue(failed.get());
    }

    @Test
    void testNullValueIsSuccessForNoWait() {
        Result<Void> result = Result.success(null);

        assertTrue(result.isSuccess());
        assertNull(result.getOrThrow());
    }
}
