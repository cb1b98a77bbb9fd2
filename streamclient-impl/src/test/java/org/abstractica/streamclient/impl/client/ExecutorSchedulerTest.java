package org.abstractica.streamclient.impl.client;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link ExecutorScheduler}.
 */
class ExecutorSchedulerTest
{
    private ExecutorScheduler scheduler;

    @BeforeEach
    void setUp()
    {
        scheduler = new ExecutorScheduler("scheduler-test");
    }

    @AfterEach
    void tearDown()
    {
        scheduler.close();
    }

    @Test
    void execute_runsTasksInOrderOnOneThread() throws InterruptedException
    {
        List<String> threads = new CopyOnWriteArrayList<>();
        List<Integer> order = new CopyOnWriteArrayList<>();
        CountDownLatch done = new CountDownLatch(3);

        for (int i = 0; i < 3; i++)
        {
            int n = i;
            scheduler.execute(() -> {
                threads.add(Thread.currentThread().getName());
                order.add(n);
                done.countDown();
            });
        }

        assertTrue(done.await(5, TimeUnit.SECONDS));
        assertEquals(List.of(0, 1, 2), order);
        assertTrue(threads.stream().allMatch("scheduler-test"::equals));
    }

    @Test
    void execute_survivesFailingTask() throws InterruptedException
    {
        CountDownLatch done = new CountDownLatch(1);

        scheduler.execute(() -> {
            throw new IllegalStateException("task bug");
        });
        scheduler.execute(done::countDown);

        assertTrue(done.await(5, TimeUnit.SECONDS));
    }

    @Test
    void schedule_cancelledTaskNeverRuns() throws InterruptedException
    {
        CountDownLatch ran = new CountDownLatch(1);
        CountDownLatch after = new CountDownLatch(1);

        Scheduler.ScheduledTask task = scheduler.schedule(ran::countDown, Duration.ofMillis(100));
        task.cancel();
        scheduler.schedule(after::countDown, Duration.ofMillis(200));

        assertTrue(after.await(5, TimeUnit.SECONDS));
        assertTrue(task.isCancelled());
        assertEquals(1, ran.getCount());
    }

    @Test
    void close_dropsLaterTasks()
    {
        scheduler.close();

        assertTrue(scheduler.isClosed());
        scheduler.execute(() -> fail("ran after close"));
        assertTrue(scheduler.schedule(() -> fail("ran after close"), Duration.ofMillis(1)).isCancelled());
    }
}
