package dev.fumaz.conduit.lifetime;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SingletonStrategyTest {

    @Test
    void invokesFactoryOnlyOnce() {
        SingletonStrategy<Object> strategy = new SingletonStrategy<>(Object.class);
        AtomicInteger calls = new AtomicInteger();

        assertFalse(strategy.isInitialized());

        Object first = strategy.get(() -> {
            calls.incrementAndGet();
            return new Object();
        });
        Object second = strategy.get(() -> {
            calls.incrementAndGet();
            return new Object();
        });

        assertSame(first, second);
        assertEquals(1, calls.get());
        assertTrue(strategy.isInitialized());
    }

    @Test
    void rejectsNullAndRetriesLater() {
        SingletonStrategy<String> strategy = new SingletonStrategy<>(String.class);

        assertThrows(IllegalStateException.class, () -> strategy.get(() -> null));
        assertFalse(strategy.isInitialized());
        assertEquals("value", strategy.get(() -> "value"));
    }

    @Test
    void sharesOneInstanceAcrossThreads() throws Exception {
        SingletonStrategy<Object> strategy = new SingletonStrategy<>(Object.class);
        AtomicInteger calls = new AtomicInteger();
        CountDownLatch start = new CountDownLatch(1);
        ExecutorService executor = Executors.newFixedThreadPool(8);

        try {
            List<Future<Object>> futures = new ArrayList<>();

            for (int i = 0; i < 8; i++) {
                futures.add(executor.submit(() -> {
                    start.await();
                    return strategy.get(() -> {
                        calls.incrementAndGet();
                        return new Object();
                    });
                }));
            }

            start.countDown();

            Object expected = futures.get(0).get(5, TimeUnit.SECONDS);

            for (Future<Object> future : futures) {
                assertSame(expected, future.get(5, TimeUnit.SECONDS));
            }
        } finally {
            executor.shutdownNow();
        }

        assertEquals(1, calls.get());
    }

    @Test
    void lifetimeCreatesMatchingStrategy() {
        assertInstanceOf(SingletonStrategy.class, Lifetime.SINGLETON.create(String.class));
        assertInstanceOf(TransientStrategy.class, Lifetime.TRANSIENT.create(String.class));
    }
}
