package com.tradejournal.application.service;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ConfigurableApplicationContext;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ProcessExitFailureListenerTest {

    @Mock
    private ConfigurableApplicationContext context;

    @Test
    void testOnFatalFailure_ClosesContextAndExitsNonZeroOnce() throws InterruptedException {
        // Given
        CountDownLatch terminated = new CountDownLatch(1);
        AtomicInteger exitCode = new AtomicInteger();
        AtomicInteger terminations = new AtomicInteger();
        ProcessExitFailureListener listener = new ProcessExitFailureListener(context) {
            @Override
            protected void terminate(int code) {
                exitCode.set(code);
                terminations.incrementAndGet();
                terminated.countDown();
            }
        };

        // When
        listener.onFatalFailure("trade-events-0@42", new IllegalStateException("db down"));
        listener.onFatalFailure("trade-events-0@42", new IllegalStateException("db down"));

        // Then
        assertTrue(terminated.await(5, TimeUnit.SECONDS));
        assertEquals(ProcessExitFailureListener.EXIT_CODE, exitCode.get());
        assertEquals(1, terminations.get());
        assertTrue(listener.isExiting());
        verify(context).close();
    }
}
