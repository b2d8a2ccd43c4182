package com.p14n.fanout.broker;

import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * The threads the fan-out layer runs on: reconnect timers are scheduled here
 * and durable publishes are submitted here. Tests substitute a deterministic
 * implementation.
 */
public interface AsyncExecutor extends AutoCloseable {

    /**
     * Runs a one-shot task after a delay. Cancelling the returned future before
     * it fires prevents the task from running.
     */
    ScheduledFuture<?> schedule(Runnable command, long delay, TimeUnit unit);

    <T> Future<T> submit(Callable<T> task);

    /**
     * Stops both scheduled and submitted work.
     *
     * @return the tasks that never started
     */
    List<Runnable> shutdownNow();

    @Override
    void close();
}
