/*
 * Copyright AMQProxy Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.amqproxy.proxy.internal.upstream;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ChannelIdAllocatorTest {

    @Test
    void allocatesFromOneUpwards() {
        ChannelIdAllocator allocator = new ChannelIdAllocator(10);

        assertEquals(1, allocator.allocate().getAsInt());
        assertEquals(2, allocator.allocate().getAsInt());
        assertEquals(2, allocator.leasedCount());
    }

    @Test
    void releasedIdIsNotReusedStraightAway() {
        ChannelIdAllocator allocator = new ChannelIdAllocator(10);
        int first = allocator.allocate().getAsInt();

        assertTrue(allocator.release(first));

        assertEquals(2, allocator.allocate().getAsInt());
    }

    @Test
    void wrapsAroundSkippingLeasedIds() {
        ChannelIdAllocator allocator = new ChannelIdAllocator(3);
        allocator.allocate();
        allocator.allocate();
        allocator.allocate();
        allocator.release(2);

        assertEquals(2, allocator.allocate().getAsInt());
        assertTrue(allocator.allocate().isEmpty());
    }

    @Test
    void exhaustedAllocatorReturnsEmpty() {
        ChannelIdAllocator allocator = new ChannelIdAllocator(1);
        allocator.allocate();

        assertTrue(allocator.allocate().isEmpty());
    }

    @Test
    void zeroChannelMaxMeansFullIdSpace() {
        assertEquals(65535, new ChannelIdAllocator(0).channelMax());
        assertThrows(IllegalArgumentException.class, () -> new ChannelIdAllocator(70000));
    }

    @Test
    void releaseOfUnknownIdIsRejected() {
        ChannelIdAllocator allocator = new ChannelIdAllocator(5);

        assertFalse(allocator.release(3));
        assertFalse(allocator.release(0));
        assertFalse(allocator.isLeased(3));
    }

    @Test
    void concurrentAllocationsAreUnique() throws Exception {
        ChannelIdAllocator allocator = new ChannelIdAllocator(2047);
        Set<Integer> ids = ConcurrentHashMap.newKeySet();
        int threads = 8;
        int perThread = 200;
        CountDownLatch start = new CountDownLatch(1);
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        try {
            for (int t = 0; t < threads; t++) {
                executor.submit(() -> {
                    start.await();
                    for (int i = 0; i < perThread; i++) {
                        ids.add(allocator.allocate().getAsInt());
                    }
                    return null;
                });
            }
            start.countDown();
            executor.shutdown();
            assertTrue(executor.awaitTermination(10, TimeUnit.SECONDS));
        }
        finally {
            executor.shutdownNow();
        }

        assertEquals(threads * perThread, ids.size());
        assertEquals(threads * perThread, allocator.leasedCount());
    }
}
