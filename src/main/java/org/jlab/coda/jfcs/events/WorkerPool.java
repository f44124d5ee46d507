/*
 *   Copyright (c) 2026.  Jefferson Lab (JLab). All rights reserved. Permission
 *   to use, copy, modify, and distribute  this software and its documentation for
 *   educational, research, and not-for-profit purposes, without fee and without a
 *   signed licensing agreement.
 */
package org.jlab.coda.jfcs.events;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Process-wide pool of daemon threads used to run data-parallel loops
 * over events or parameters. The pool is created on first use and sized
 * to the number of available processors.
 */
public final class WorkerPool {

    /** Run loops with fewer items than this on the calling thread. */
    public static final int MINIMUM_PARALLEL_ITEMS = 2;

    /**
     * Body of a parallel loop. Called once per slice of the index range.
     */
    public interface RangeTask {
        /**
         * Process indexes in [begin, end).
         * @param begin first index.
         * @param end   one past the last index.
         */
        void run(int begin, int end);
    }

    /** Lazy holder. Class initialization creates the pool exactly once. */
    private static final class Holder {
        static final int THREADS = Math.max(1, Runtime.getRuntime().availableProcessors());
        static final ExecutorService POOL = Executors.newFixedThreadPool(THREADS, new ThreadFactory() {
            private final AtomicInteger count = new AtomicInteger();
            @Override
            public Thread newThread(Runnable r) {
                Thread t = new Thread(r, "jfcs-worker-" + count.incrementAndGet());
                t.setDaemon(true);
                return t;
            }
        });
    }

    private WorkerPool() {}

    /**
     * Get the number of worker threads.
     * @return number of threads.
     */
    public static int getNumberOfThreads() {return Holder.THREADS;}


    /**
     * Split [0, count) into contiguous slices and run them on the pool.
     * Returns when all slices are done. Small ranges run on the calling thread.
     *
     * @param count     number of items.
     * @param minimumSlice smallest number of items worth a task of its own.
     * @param task      loop body.
     * @throws RuntimeException any unchecked exception thrown by the body.
     * @throws IllegalStateException if interrupted while waiting.
     */
    public static void parallelFor(int count, int minimumSlice, RangeTask task) {
        if (count <= 0) return;

        int slices = Math.min(Holder.THREADS, count / Math.max(1, minimumSlice));
        if (slices < MINIMUM_PARALLEL_ITEMS) {
            task.run(0, count);
            return;
        }

        int per = (count + slices - 1) / slices;
        List<Future<?>> futures = new ArrayList<Future<?>>(slices);
        for (int begin = 0; begin < count; begin += per) {
            final int b = begin;
            final int e = Math.min(count, begin + per);
            futures.add(Holder.POOL.submit(new Runnable() {
                @Override
                public void run() {task.run(b, e);}
            }));
        }

        RuntimeException failure = null;
        for (Future<?> f : futures) {
            try {
                f.get();
            }
            catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException("interrupted while waiting for workers", e);
            }
            catch (ExecutionException e) {
                Throwable cause = e.getCause();
                if (cause instanceof Error) throw (Error) cause;
                if (failure == null) {
                    failure = (cause instanceof RuntimeException) ?
                              (RuntimeException) cause : new IllegalStateException(cause);
                }
            }
        }
        if (failure != null) throw failure;
    }
}
