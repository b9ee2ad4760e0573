package com.p14n.filebroker.broker;

import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import com.google.common.util.concurrent.ThreadFactoryBuilder;

/**
 * Default implementation of {@link AsyncExecutor} backed by a JDK thread pool
 * with named daemon threads.
 *
 * <p>
 * The no-argument constructor uses a cached pool, so a subscriber that never
 * returns only pins its own thread and later invocations still get one. A
 * fixed pool can be used instead when the number of threads must be capped.
 * </p>
 */
public class DefaultExecutor implements AsyncExecutor {

        private final ExecutorService es;

        /**
         * Creates a new executor with a cached thread pool.
         */
        public DefaultExecutor() {
                this.es = createCachedExecutorService();
        }

        /**
         * Creates a new executor with a fixed-size thread pool.
         *
         * @param fixedSize the number of threads in the pool
         */
        public DefaultExecutor(int fixedSize) {
                this.es = createFixedExecutorService(fixedSize);
        }

        protected ExecutorService createFixedExecutorService(int size) {
                return Executors.newFixedThreadPool(size,
                                new ThreadFactoryBuilder().setNameFormat("file-broker-fixed-%d").setDaemon(true)
                                                .build());
        }

        protected ExecutorService createCachedExecutorService() {
                return Executors.newCachedThreadPool(
                                new ThreadFactoryBuilder().setNameFormat("file-broker-handler-%d").setDaemon(true)
                                                .build());
        }

        @Override
        public List<Runnable> shutdownNow() {
                return es.shutdownNow();
        }

        @Override
        public <T> Future<T> submit(Callable<T> task) {
                return es.submit(task);
        }

        @Override
        public void close() {
                shutdownNow();
        }
}
