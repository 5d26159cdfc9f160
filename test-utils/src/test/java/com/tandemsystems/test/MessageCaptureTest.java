package com.tandemsystems.test;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.*;

class MessageCaptureTest {

    @Test
    void recordsInObservationOrder() {
        MessageCapture<String> capture = MessageCapture.create();
        capture.accept("a");
        capture.accept("b");

        assertEquals(List.of("a", "b"), capture.all());
        assertEquals("b", capture.last());
        assertEquals(List.of("b"), capture.filter("b"::equals));
    }

    @Test
    void lastOnEmptyCaptureThrows() {
        MessageCapture<String> capture = MessageCapture.create();
        assertTrue(capture.isEmpty());
        assertThrows(IllegalStateException.class, capture::last);
    }

    @Test
    void awaitCountSeesValuesFromOtherThreads() throws Exception {
        MessageCapture<Integer> capture = MessageCapture.create();
        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            executor.submit(() -> {
                for (int i = 0; i < 3; i++) {
                    capture.accept(i);
                }
            });
            assertTrue(capture.awaitCount(3, Duration.ofSeconds(2)));
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void awaitCountTimesOut() throws Exception {
        MessageCapture<Integer> capture = MessageCapture.create();
        assertFalse(capture.awaitCount(1, Duration.ofMillis(30)));
    }
}
