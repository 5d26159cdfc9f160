package com.tandemsystems.config;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Factory for the executor that runs actor workers.
 * Each worker occupies one thread for its whole life, so a bounded pool caps the number of
 * actors that can run at the same time; the default cached pool has no such cap.
 */
public class ThreadPoolFactory {
    private static final int DEFAULT_SHUTDOWN_TIMEOUT_SECONDS = 10;
    private static final String DEFAULT_THREAD_NAME_PREFIX = "tandem";

    private ThreadPoolType executorType = ThreadPoolType.CACHED;
    private int fixedPoolSize = Runtime.getRuntime().availableProcessors();
    private int workStealingParallelism = Runtime.getRuntime().availableProcessors();
    private int shutdownTimeoutSeconds = DEFAULT_SHUTDOWN_TIMEOUT_SECONDS;
    private String threadNamePrefix = DEFAULT_THREAD_NAME_PREFIX;
    private boolean daemonThreads = true;

    /**
     * Enum defining the types of thread pools that can be used.
     */
    public enum ThreadPoolType {
        /**
         * A thread per live worker, reused after the worker ends.
         * No limit on the number of concurrent actors.
         */
        CACHED,

        /**
         * A fixed number of threads. At most {@code fixedPoolSize} actors run at once;
         * further workers wait for a free thread.
         */
        FIXED,

        /**
         * A work-stealing pool with the configured parallelism.
         */
        WORK_STEALING
    }

    /**
     * Creates a new ThreadPoolFactory with default settings.
     */
    public ThreadPoolFactory() {
        // Use defaults
    }

    /**
     * Creates an executor service based on the current configuration.
     *
     * @param poolName Name prefix for the threads in this pool
     * @return A new executor service
     */
    public ExecutorService createExecutorService(String poolName) {
        switch (executorType) {
            case CACHED:
                return Executors.newCachedThreadPool(createThreadFactory(poolName));
            case FIXED:
                return Executors.newFixedThreadPool(fixedPoolSize, createThreadFactory(poolName));
            case WORK_STEALING:
                return Executors.newWorkStealingPool(workStealingParallelism);
            default:
                throw new IllegalStateException("Unknown executor type: " + executorType);
        }
    }

    /**
     * Creates a named thread factory for better thread identification in logs and profilers.
     *
     * @param poolName The pool name, appended to the configured prefix
     * @return A thread factory that creates named threads
     */
    public ThreadFactory createThreadFactory(String poolName) {
        String prefix = threadNamePrefix + "-" + poolName + "-";
        AtomicInteger threadNumber = new AtomicInteger(1);
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + threadNumber.getAndIncrement());
            thread.setDaemon(daemonThreads);
            return thread;
        };
    }

    // Getters and setters

    public ThreadPoolType getExecutorType() {
        return executorType;
    }

    public ThreadPoolFactory setExecutorType(ThreadPoolType executorType) {
        this.executorType = executorType;
        return this;
    }

    public int getFixedPoolSize() {
        return fixedPoolSize;
    }

    public ThreadPoolFactory setFixedPoolSize(int fixedPoolSize) {
        if (fixedPoolSize <= 0) {
            throw new IllegalArgumentException("Pool size must be positive: " + fixedPoolSize);
        }
        this.fixedPoolSize = fixedPoolSize;
        return this;
    }

    public int getWorkStealingParallelism() {
        return workStealingParallelism;
    }

    public ThreadPoolFactory setWorkStealingParallelism(int workStealingParallelism) {
        if (workStealingParallelism <= 0) {
            throw new IllegalArgumentException("Parallelism must be positive: " + workStealingParallelism);
        }
        this.workStealingParallelism = workStealingParallelism;
        return this;
    }

    public int getShutdownTimeoutSeconds() {
        return shutdownTimeoutSeconds;
    }

    public ThreadPoolFactory setShutdownTimeoutSeconds(int shutdownTimeoutSeconds) {
        this.shutdownTimeoutSeconds = shutdownTimeoutSeconds;
        return this;
    }

    public String getThreadNamePrefix() {
        return threadNamePrefix;
    }

    public ThreadPoolFactory setThreadNamePrefix(String threadNamePrefix) {
        this.threadNamePrefix = threadNamePrefix;
        return this;
    }

    public boolean isDaemonThreads() {
        return daemonThreads;
    }

    public ThreadPoolFactory setDaemonThreads(boolean daemonThreads) {
        this.daemonThreads = daemonThreads;
        return this;
    }
}
