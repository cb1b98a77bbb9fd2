package org.abstractica.streamclient.impl.client;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.PriorityQueue;

/**
 * Deterministic scheduler for tests.
 *
 * <p>Nothing runs until the test calls {@link #runPending()} or
 * {@link #advance(Duration)}. Time only moves when advanced. Exceptions
 * escaping a task are collected instead of thrown.</p>
 */
public class ManualScheduler implements Scheduler
{
    private final Deque<Runnable> ready = new ArrayDeque<>();
    private final PriorityQueue<Timer> timers = new PriorityQueue<>();
    private final List<Throwable> errors = new ArrayList<>();
    private long nowMs = 0;
    private long sequence = 0;
    private boolean closed = false;

    @Override
    public void execute(Runnable task)
    {
        if (!closed)
        {
            ready.addLast(task);
        }
    }

    @Override
    public ScheduledTask schedule(Runnable task, Duration delay)
    {
        Timer timer = new Timer(nowMs + delay.toMillis(), sequence++, task);
        if (!closed)
        {
            timers.add(timer);
        }
        else
        {
            timer.cancel();
        }
        return timer;
    }

    @Override
    public long nowMillis()
    {
        return nowMs;
    }

    @Override
    public void close()
    {
        closed = true;
        timers.clear();
    }

    /**
     * Runs queued tasks, and tasks they queue, until none is left.
     */
    public void runPending()
    {
        Runnable task;
        while ((task = ready.pollFirst()) != null)
        {
            run(task);
        }
    }

    /**
     * Moves time forward, running every timer that falls due on the way.
     *
     * @param duration how far to move
     */
    public void advance(Duration duration)
    {
        long target = nowMs + duration.toMillis();
        runPending();
        while (true)
        {
            Timer next = timers.peek();
            if (next == null || next.dueAtMs > target)
            {
                break;
            }
            timers.poll();
            if (next.cancelled)
            {
                continue;
            }
            nowMs = Math.max(nowMs, next.dueAtMs);
            run(next.task);
            runPending();
        }
        nowMs = target;
    }

    public int pendingTimers()
    {
        int count = 0;
        for (Timer timer : timers)
        {
            if (!timer.cancelled)
            {
                count++;
            }
        }
        return count;
    }

    public List<Throwable> getErrors()
    {
        return errors;
    }

    public boolean isClosed()
    {
        return closed;
    }

    private void run(Runnable task)
    {
        try
        {
            task.run();
        }
        catch (RuntimeException | AssertionError e)
        {
            errors.add(e);
        }
    }

    private static final class Timer implements ScheduledTask, Comparable<Timer>
    {
        private final long dueAtMs;
        private final long sequence;
        private final Runnable task;
        private boolean cancelled;

        Timer(long dueAtMs, long sequence, Runnable task)
        {
            this.dueAtMs = dueAtMs;
            this.sequence = sequence;
            this.task = task;
        }

        @Override
        public void cancel()
        {
            cancelled = true;
        }

        @Override
        public boolean isCancelled()
        {
            return cancelled;
        }

        @Override
        public int compareTo(Timer other)
        {
            int byTime = Long.compare(dueAtMs, other.dueAtMs);
            return byTime != 0 ? byTime : Long.compare(sequence, other.sequence);
        }
    }
}
