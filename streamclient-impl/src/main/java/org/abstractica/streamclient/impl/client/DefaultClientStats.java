package org.abstractica.streamclient.impl.client;

import org.abstractica.streamclient.ClientStats;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Default implementation of ClientStats.
 */
public class DefaultClientStats implements ClientStats
{
    private final AtomicLong framesSent = new AtomicLong(0);
    private final AtomicLong framesReceived = new AtomicLong(0);
    private final AtomicLong framesDropped = new AtomicLong(0);
    private final AtomicLong connectionAttempts = new AtomicLong(0);
    private final AtomicInteger queuedFrames = new AtomicInteger(0);
    private final AtomicInteger pendingCommands = new AtomicInteger(0);

    @Override
    public long getFramesSent()
    {
        return framesSent.get();
    }

    @Override
    public long getFramesReceived()
    {
        return framesReceived.get();
    }

    @Override
    public long getFramesDropped()
    {
        return framesDropped.get();
    }

    @Override
    public long getConnectionAttempts()
    {
        return connectionAttempts.get();
    }

    @Override
    public int getQueuedFrames()
    {
        return queuedFrames.get();
    }

    @Override
    public int getPendingCommands()
    {
        return pendingCommands.get();
    }

    // ========== Update Methods ==========

    public void recordFrameSent()
    {
        framesSent.incrementAndGet();
    }

    public void recordFrameReceived()
    {
        framesReceived.incrementAndGet();
    }

    public void recordFrameDropped()
    {
        framesDropped.incrementAndGet();
    }

    public void recordConnectionAttempt()
    {
        connectionAttempts.incrementAndGet();
    }

    public void updateQueues(int queued, int pending)
    {
        queuedFrames.set(queued);
        pendingCommands.set(pending);
    }

    @Override
    public String toString()
    {
        return "ClientStats[sent=" + framesSent.get()
                + ", received=" + framesReceived.get()
                + ", dropped=" + framesDropped.get()
                + ", attempts=" + connectionAttempts.get()
                + ", queued=" + queuedFrames.get()
                + ", pending=" + pendingCommands.get() + "]";
    }
}
