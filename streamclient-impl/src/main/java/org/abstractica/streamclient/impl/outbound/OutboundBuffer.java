package org.abstractica.streamclient.impl.outbound;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * FIFO buffer for frames produced before the session is ready.
 *
 * <p>A flush sends exactly the frames that were buffered when it started.
 * Frames enqueued while a flush is running stay behind the older ones and go
 * out on the next flush.</p>
 *
 * <p>Not thread-safe. Owned by the client's event thread.</p>
 */
public class OutboundBuffer
{
    private static final Logger LOG = LoggerFactory.getLogger(OutboundBuffer.class);

    private final Deque<QueuedMessage> queue;

    public OutboundBuffer()
    {
        this.queue = new ArrayDeque<>();
    }

    /**
     * Appends a frame.
     *
     * @param message the frame to buffer
     */
    public void enqueue(QueuedMessage message)
    {
        Objects.requireNonNull(message, "message");
        queue.addLast(message);
        LOG.debug("Buffered '{}' ({} queued)", message.command().method(), queue.size());
    }

    /**
     * Sends every frame buffered at the time of the call, in order.
     *
     * @param sender sends one frame
     * @return number of frames sent
     */
    public int flush(Consumer<QueuedMessage> sender)
    {
        Objects.requireNonNull(sender, "sender");

        int count = queue.size();
        for (int i = 0; i < count; i++)
        {
            QueuedMessage message = queue.pollFirst();
            if (message == null)
            {
                return i;
            }
            sender.accept(message);
        }
        if (count > 0)
        {
            LOG.debug("Flushed {} buffered frame(s)", count);
        }
        return count;
    }

    public boolean isEmpty()
    {
        return queue.isEmpty();
    }

    public int size()
    {
        return queue.size();
    }
}
