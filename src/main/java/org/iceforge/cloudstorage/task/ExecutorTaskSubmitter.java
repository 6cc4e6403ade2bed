package org.iceforge.cloudstorage.task;

import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

public class ExecutorTaskSubmitter implements TaskSubmitter {

    private final ExecutorService executor;

    public ExecutorTaskSubmitter(ExecutorService executor) {
        this.executor = Objects.requireNonNull(executor);
    }

    @Override
    public <T> Future<T> submit(Callable<T> task) {
        return executor.submit(task);
    }
}
