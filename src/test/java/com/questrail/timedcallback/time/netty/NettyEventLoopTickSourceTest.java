package com.questrail.timedcallback.time.netty;

import com.questrail.timedcallback.time.Cancellable;
import io.netty.util.concurrent.DefaultEventExecutor;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class NettyEventLoopTickSourceTest {

    @Test
    void ticksRunOnTheExecutorThread() throws Exception {
        NettyEventLoopTickSource source = NettyEventLoopTickSource.dedicated("netty-tick-test");
        CountDownLatch ticks = new CountDownLatch(3);
        AtomicBoolean onTickThread = new AtomicBoolean(true);
        try {
            source.scheduleAtFixedRate(Duration.ofMillis(5), () -> {
                onTickThread.compareAndSet(true, source.inTickThread());
                ticks.countDown();
            });

            assertTrue(ticks.await(5, TimeUnit.SECONDS));
            assertTrue(onTickThread.get());
            assertFalse(source.inTickThread());
        } finally {
            source.shutdown();
        }
    }

    @Test
    void cancelStopsTicks() throws Exception {
        NettyEventLoopTickSource source = NettyEventLoopTickSource.dedicated("netty-tick-test");
        AtomicInteger count = new AtomicInteger();
        CountDownLatch first = new CountDownLatch(1);
        try {
            Cancellable ticks = source.scheduleAtFixedRate(Duration.ofMillis(5), () -> {
                count.incrementAndGet();
                first.countDown();
            });
            assertTrue(first.await(5, TimeUnit.SECONDS));

            ticks.cancel();
            Thread.sleep(50);
            int afterCancel = count.get();
            Thread.sleep(100);
            assertEquals(afterCancel, count.get());
        } finally {
            source.shutdown();
        }
    }

    @Test
    void rejectsNonPositivePeriod() {
        NettyEventLoopTickSource source = NettyEventLoopTickSource.dedicated("netty-tick-test");
        try {
            assertThrows(IllegalArgumentException.class,
                    () -> source.scheduleAtFixedRate(Duration.ofMillis(-1), () -> { }));
        } finally {
            source.shutdown();
        }
    }

    @Test
    void borrowedExecutorSurvivesShutdown() {
        DefaultEventExecutor executor = new DefaultEventExecutor();
        try {
            new NettyEventLoopTickSource(executor).shutdown();
            assertFalse(executor.isShuttingDown());
        } finally {
            executor.shutdownGracefully(0, 1, TimeUnit.SECONDS).awaitUninterruptibly(5, TimeUnit.SECONDS);
        }
    }
}
