package com.hartwig.varpipe;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

import com.google.common.util.concurrent.ThreadFactoryBuilder;

public final class ExecutorUtil {
    private ExecutorUtil() {
    }

    /**
     * Executor with a fixed number of workers and an unbounded queue, work beyond nThreads waits. Used for run loops and for stage
     * and shard work.
     */
    public static ExecutorService createQueueingExecutorService(int nThreads, String nameTemplate) {
        return new ThreadPoolExecutor(nThreads,
                nThreads,
                60L,
                TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(),
                new ThreadFactoryBuilder().setNameFormat(nameTemplate).setDaemon(true).build());
    }
}
