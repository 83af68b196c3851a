package com.openforge.dnd.support;

import io.github.resilience4j.bulkhead.ThreadPoolBulkhead;
import io.github.resilience4j.bulkhead.ThreadPoolBulkheadConfig;

import java.util.concurrent.CountDownLatch;

/**
 * A one-thread, one-slot hashing lane with both the thread and the queue slot taken, so
 * the next submission is rejected with BulkheadFullException. Closing releases the work.
 */
public class SaturatedHashingLane implements AutoCloseable {

    private final CountDownLatch     release = new CountDownLatch(1);
    private final ThreadPoolBulkhead bulkhead;

    public SaturatedHashingLane() {
        bulkhead = ThreadPoolBulkhead.of("saturated-hashing", ThreadPoolBulkheadConfig.custom()
                .coreThreadPoolSize(1)
                .maxThreadPoolSize(1)
                .queueCapacity(1)
                .build());
        bulkhead.executeSupplier(this::awaitRelease);
        bulkhead.executeSupplier(this::awaitRelease);
    }

    public ThreadPoolBulkhead bulkhead() {
        return bulkhead;
    }

    private Boolean awaitRelease() {
        try {
            release.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        return Boolean.TRUE;
    }

    @Override
    public void close() throws Exception {
        release.countDown();
        bulkhead.close();
    }
}
