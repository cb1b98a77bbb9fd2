package org.abstractica.streamclient.impl.client;

import java.time.Duration;

/**
 * Single-threaded task executor owning a client's protocol state.
 *
 * <p>Tasks run one at a time, in submission order. Every caller operation,
 * transport signal and timer of a client runs as a task, so protocol state
 * needs no locking.</p>
 */
public interface Scheduler extends AutoCloseable
{
    /**
     * Runs a task as soon as possible.
     *
     * @param task the task
     */
    void execute(Runnable task);

    /**
     * Runs a task after a delay.
     *
     * @param task  the task
     * @param delay the delay
     * @return handle to cancel the task
     */
    ScheduledTask schedule(Runnable task, Duration delay);

    /**
     * Returns the scheduler's notion of the current time.
     *
     * @return time in milliseconds
     */
    long nowMillis();

    /**
     * Stops accepting tasks and cancels delayed ones.
     */
    @Override
    void close();

    /**
     * Handle to a delayed task.
     */
    interface ScheduledTask
    {
        /**
         * Prevents the task from running if it has not started.
         */
        void cancel();

        boolean isCancelled();
    }
}
