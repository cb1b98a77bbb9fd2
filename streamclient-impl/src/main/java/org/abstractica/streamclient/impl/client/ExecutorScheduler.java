package org.abstractica.streamclient.impl.client;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Scheduler backed by one daemon thread.
 *
 * <p>An exception escaping a task is logged and does not stop the thread.</p>
 */
public class ExecutorScheduler implements Scheduler
{
    private static final Logger LOG = LoggerFactory.getLogger(ExecutorScheduler.class);
    private static final AtomicInteger THREAD_COUNTER = new AtomicInteger(0);

    private final ScheduledThreadPoolExecutor executor;

    public ExecutorScheduler()
    {
        this("stream-client-" + THREAD_COUNTER.incrementAndGet());
    }

    public ExecutorScheduler(String threadName)
    {
        Objects.requireNonNull(threadName, "threadName");
        this.executor = new ScheduledThreadPoolExecutor(1, runnable -> {
            Thread thread = new Thread(runnable, threadName);
            thread.setDaemon(true);
            return thread;
        });
        this.executor.setRemoveOnCancelPolicy(true);
        this.executor.setExecuteExistingDelayedTasksAfterShutdownPolicy(false);
    }

    @Override
    public void execute(Runnable task)
    {
        Objects.requireNonNull(task, "task");
        try
        {
            executor.execute(guarded(task));
        }
        catch (RejectedExecutionException e)
        {
            LOG.debug("Scheduler closed, task dropped");
        }
    }

    @Override
    public ScheduledTask schedule(Runnable task, Duration delay)
    {
        Objects.requireNonNull(task, "task");
        Objects.requireNonNull(delay, "delay");
        try
        {
            ScheduledFuture<?> future = executor.schedule(guarded(task), delay.toMillis(), TimeUnit.MILLISECONDS);
            return new FutureTask(future);
        }
        catch (RejectedExecutionException e)
        {
            LOG.debug("Scheduler closed, delayed task dropped");
            return CANCELLED;
        }
    }

    @Override
    public long nowMillis()
    {
        return System.currentTimeMillis();
    }

    @Override
    public void close()
    {
        executor.shutdown();
    }

    public boolean isClosed()
    {
        return executor.isShutdown();
    }

    private static Runnable guarded(Runnable task)
    {
        return () -> {
            try
            {
                task.run();
            }
            catch (Exception e)
            {
                LOG.error("Unhandled error in client task", e);
            }
        };
    }

    private static final ScheduledTask CANCELLED = new ScheduledTask()
    {
        @Override
        public void cancel()
        {
        }

        @Override
        public boolean isCancelled()
        {
            return true;
        }
    };

    private record FutureTask(ScheduledFuture<?> future) implements ScheduledTask
    {
        @Override
        public void cancel()
        {
            future.cancel(false);
        }

        @Override
        public boolean isCancelled()
        {
            return future.isCancelled();
        }
    }
}
