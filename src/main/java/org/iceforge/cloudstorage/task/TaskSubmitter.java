package org.iceforge.cloudstorage.task;

import java.util.concurrent.Callable;
import java.util.concurrent.Future;

/**
 * Hands work to whatever worker pool the host application runs. The core decides when a step
 * becomes eligible to run; the submitter decides how it is scheduled.
 */
public interface TaskSubmitter {

    <T> Future<T> submit(Callable<T> task);
}
