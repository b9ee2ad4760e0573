package com.p14n.filebroker.broker;

import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.Future;

/**
 * Runs subscriber invocations off the publishing thread so the broker can
 * bound how long it waits for each one.
 */
public interface AsyncExecutor extends AutoCloseable {

    <T> Future<T> submit(Callable<T> task);

    List<Runnable> shutdownNow();
}
