package org.iceforge.cloudstorage.task;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class ExecutorTaskSubmitterTest {

    private final ExecutorService pool = Executors.newSingleThreadExecutor();
    private final TaskSubmitter submitter = new ExecutorTaskSubmitter(pool);

    @AfterEach
    void tearDown() {
        pool.shutdownNow();
    }

    @Test
    void runsTaskOnPool() throws Exception {
        Future<String> f = submitter.submit(() -> Thread.currentThread().getName());
        assertNotEquals(Thread.currentThread().getName(), f.get(5, TimeUnit.SECONDS));
    }

    @Test
    void failureSurfacesThroughFuture() {
        Future<Object> f = submitter.submit(() -> {
            throw new IllegalStateException("boom");
        });
        ExecutionException e = assertThrows(ExecutionException.class, () -> f.get(5, TimeUnit.SECONDS));
        assertInstanceOf(IllegalStateException.class, e.getCause());
    }
}
