package org.abstractica.streamclient.impl.outbound;

import org.abstractica.streamclient.impl.protocol.OutboundCommand;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link OutboundBuffer}.
 */
class OutboundBufferTest
{
    private OutboundBuffer buffer;

    @BeforeEach
    void setUp()
    {
        buffer = new OutboundBuffer();
    }

    private static QueuedMessage message(String method)
    {
        return new QueuedMessage(OutboundCommand.fireAndForget(method, null), "{\"m\":\"" + method + "\"}", 0);
    }

    @Test
    void enqueue_growsBuffer()
    {
        assertTrue(buffer.isEmpty());
        buffer.enqueue(message("a"));
        buffer.enqueue(message("b"));
        assertEquals(2, buffer.size());
    }

    @Test
    void flush_sendsInEnqueueOrderAndEmpties()
    {
        buffer.enqueue(message("a"));
        buffer.enqueue(message("b"));
        buffer.enqueue(message("c"));

        List<String> sent = new ArrayList<>();
        int count = buffer.flush(m -> sent.add(m.command().method()));

        assertEquals(3, count);
        assertEquals(List.of("a", "b", "c"), sent);
        assertTrue(buffer.isEmpty());
    }

    @Test
    void flush_framesEnqueuedDuringFlushWaitForNextFlush()
    {
        buffer.enqueue(message("a"));
        buffer.enqueue(message("b"));

        List<String> sent = new ArrayList<>();
        buffer.flush(m -> {
            sent.add(m.command().method());
            if (m.command().method().equals("a"))
            {
                buffer.enqueue(message("late"));
            }
        });

        assertEquals(List.of("a", "b"), sent);
        assertEquals(1, buffer.size());

        buffer.flush(m -> sent.add(m.command().method()));
        assertEquals(List.of("a", "b", "late"), sent);
    }

    @Test
    void flush_emptyBufferSendsNothing()
    {
        assertEquals(0, buffer.flush(m -> fail("nothing to send")));
    }
}
