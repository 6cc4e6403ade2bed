package org.iceforge.cloudstorage.upload;

import org.iceforge.cloudstorage.CloudStorageProperties;
import org.iceforge.cloudstorage.task.ExecutorTaskSubmitter;
import org.iceforge.cloudstorage.task.TaskSubmitter;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
public class UploadConfig {

    @Bean
    public ChunkPlanner chunkPlanner(CloudStorageProperties props) {
        return new ChunkPlanner(props.getUpload().getMinPartSizeBytes(), props.getUpload().getMaxParts());
    }

    @Bean
    public RetryPolicy uploadRetryPolicy(CloudStorageProperties props) {
        CloudStorageProperties.Upload upload = props.getUpload();
        return new RetryPolicy(upload.getMaxAttempts(), upload.getRetryBaseBackoffMillis(), upload.getRetryMaxBackoffMillis());
    }

    /**
     * Part uploads. Kept apart from {@link #uploadJobExecutor} so that whole uploads waiting on
     * their parts can never occupy every thread the parts need.
     */
    @Bean(destroyMethod = "shutdown")
    public ExecutorService uploadExecutor(CloudStorageProperties props) {
        return daemonPool(props.getUpload().getUploadThreads(), "cloudstorage-upload-");
    }

    @Bean(destroyMethod = "shutdown")
    public ExecutorService uploadJobExecutor(CloudStorageProperties props) {
        return daemonPool(props.getUpload().getAsyncUploadThreads(), "cloudstorage-upload-job-");
    }

    @Bean
    public TaskSubmitter taskSubmitter(@Qualifier("uploadExecutor") ExecutorService uploadExecutor) {
        return new ExecutorTaskSubmitter(uploadExecutor);
    }

    @Bean
    public TaskSubmitter uploadJobSubmitter(@Qualifier("uploadJobExecutor") ExecutorService uploadJobExecutor) {
        return new ExecutorTaskSubmitter(uploadJobExecutor);
    }

    private static ExecutorService daemonPool(int threads, String namePrefix) {
        AtomicInteger seq = new AtomicInteger();
        return Executors.newFixedThreadPool(Math.max(1, threads), r -> {
            Thread t = new Thread(r, namePrefix + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }
}
