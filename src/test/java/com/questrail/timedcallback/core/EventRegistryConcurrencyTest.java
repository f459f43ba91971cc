package com.questrail.timedcallback.core;

import com.questrail.timedcallback.api.RecordingCallbackInvoker;
import com.questrail.timedcallback.observability.RecordingObservabilitySink;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SplittableRandom;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * EventRegistryConcurrencyTest
 * -----------------------------------------------------------------------------
 * Processors are created, fed and closed from worker threads while another
 * thread keeps ticking the registry. Whatever the interleaving, every
 * accepted handle must be released exactly once.
 */
class EventRegistryConcurrencyTest {

    private static final int WORKERS = 4;
    private static final int ROUNDS = 200;

    @Test
    @Timeout(value = 60, unit = TimeUnit.SECONDS)
    void everyHandleIsReleasedExactlyOnceUnderConcurrentChurn() throws Exception {
        RecordingCallbackInvoker invoker = new RecordingCallbackInvoker();
        EventRegistry registry = new EventRegistry(
                invoker, new SplittableRandom(1), new RecordingObservabilitySink(), Instant::now);

        Set<Integer> accepted = ConcurrentHashMap.newKeySet();
        List<EventProcessor> survivors = new CopyOnWriteArrayList<>();
        AtomicInteger nextHandle = new AtomicInteger(1);

        AtomicBoolean ticking = new AtomicBoolean(true);
        Thread ticker = new Thread(() -> {
            while (ticking.get()) {
                registry.advanceAll(1);
            }
        }, "test-ticker");
        ticker.start();

        ExecutorService pool = Executors.newFixedThreadPool(WORKERS);
        CountDownLatch go = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();
        try {
            for (int w = 0; w < WORKERS; w++) {
                int worker = w;
                futures.add(pool.submit(() -> {
                    go.await();
                    for (int round = 0; round < ROUNDS; round++) {
                        EventProcessor processor = registry.newProcessor("owner-" + worker + "-" + round);
                        for (int k = 0; k < 5; k++) {
                            int handle = nextHandle.getAndIncrement();
                            processor.schedule(handle, 1, 3, k % 3);
                            accepted.add(handle);
                        }
                        int globalHandle = nextHandle.getAndIncrement();
                        registry.globalProcessor().schedule(globalHandle, 1, 5, 2);
                        accepted.add(globalHandle);

                        if (round % 2 == 0) {
                            processor.close();
                        } else {
                            survivors.add(processor);
                        }
                    }
                    return null;
                }));
            }

            go.countDown();
            for (Future<?> future : futures) {
                future.get(30, TimeUnit.SECONDS);
            }
        } finally {
            ticking.set(false);
            ticker.join(10_000);
            pool.shutdownNow();
        }

        registry.shutdown();
        for (EventProcessor processor : survivors) {
            processor.close();
        }

        assertReleasedExactlyOnce(accepted, invoker.releases());
        assertEquals(0, registry.registeredProcessorCount());
    }

    @Test
    @Timeout(value = 60, unit = TimeUnit.SECONDS)
    void shutdownRacingWithWorkersReleasesEveryAcceptedHandleOnce() throws Exception {
        RecordingCallbackInvoker invoker = new RecordingCallbackInvoker();
        EventRegistry registry = new EventRegistry(
                invoker, new SplittableRandom(2), new RecordingObservabilitySink(), Instant::now);

        Set<Integer> accepted = ConcurrentHashMap.newKeySet();
        List<EventProcessor> created = new CopyOnWriteArrayList<>();
        AtomicInteger nextHandle = new AtomicInteger(1);
        AtomicBoolean ticking = new AtomicBoolean(true);

        Thread ticker = new Thread(() -> {
            while (ticking.get()) {
                registry.advanceAll(1);
            }
        }, "test-ticker");
        ticker.start();

        ExecutorService pool = Executors.newFixedThreadPool(WORKERS);
        CountDownLatch started = new CountDownLatch(WORKERS);
        List<Future<?>> futures = new ArrayList<>();
        try {
            for (int w = 0; w < WORKERS; w++) {
                int worker = w;
                futures.add(pool.submit(() -> {
                    started.countDown();
                    for (int round = 0; round < ROUNDS * 10; round++) {
                        try {
                            EventProcessor processor = registry.newProcessor("owner-" + worker + "-" + round);
                            created.add(processor);
                            for (int k = 0; k < 3; k++) {
                                int handle = nextHandle.getAndIncrement();
                                if (!processor.schedule(handle, 1, 4, k % 2)) {
                                    return null;
                                }
                                accepted.add(handle);
                            }
                            if (round % 3 == 0) {
                                processor.close();
                            }
                        } catch (IllegalStateException shutDown) {
                            return null;
                        }
                    }
                    return null;
                }));
            }

            started.await();
            Thread.sleep(20);
            registry.shutdown();

            for (Future<?> future : futures) {
                future.get(30, TimeUnit.SECONDS);
            }
        } finally {
            ticking.set(false);
            ticker.join(10_000);
            pool.shutdownNow();
        }

        for (EventProcessor processor : created) {
            processor.close();
        }

        assertReleasedExactlyOnce(accepted, invoker.releases());
    }

    private static void assertReleasedExactlyOnce(Set<Integer> accepted, List<Integer> releases) {
        Map<Integer, Long> counts = releases.stream()
                .collect(Collectors.groupingBy(Function.identity(), Collectors.counting()));

        for (Integer handle : accepted) {
            assertEquals(1L, counts.getOrDefault(handle, 0L), "release count of handle " + handle);
        }
        assertTrue(accepted.containsAll(counts.keySet()), "released a handle that was never accepted");
    }
}
