package org.abstractica.streamclient.impl.protocol;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;

/**
 * JSON encoding and decoding of wire frames.
 *
 * <p>Decoding never throws: anything that is not valid JSON, or does not
 * match one of the known frame shapes, decodes to empty.</p>
 */
public class FrameCodec
{
    private static final Logger LOG = LoggerFactory.getLogger(FrameCodec.class);

    private final ObjectMapper mapper;

    public FrameCodec()
    {
        this(new ObjectMapper());
    }

    public FrameCodec(ObjectMapper mapper)
    {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    // ========== Encoding ==========

    /**
     * Encodes a command to its JSON text.
     *
     * @param command the command
     * @return the frame text
     */
    public String encode(OutboundCommand command)
    {
        Objects.requireNonNull(command, "command");

        ObjectNode frame = mapper.createObjectNode();
        frame.put("m", command.method());
        if (command.params() != null && !command.params().isNull())
        {
            frame.set("p", command.params());
        }
        if (command.correlationId() != null)
        {
            frame.put("i", command.correlationId().longValue());
        }

        try
        {
            return mapper.writeValueAsString(frame);
        }
        catch (JsonProcessingException e)
        {
            throw new IllegalStateException("Failed to encode command '" + command.method() + "'", e);
        }
    }

    /**
     * Converts caller supplied parameters to a JSON tree.
     *
     * @param params a JSON node, a map, a record or bean, or null
     * @return the JSON tree, or null if params is null
     * @throws IllegalArgumentException if params cannot be represented as JSON
     */
    public JsonNode toParams(Object params)
    {
        if (params == null)
        {
            return null;
        }
        if (params instanceof JsonNode node)
        {
            return node;
        }
        try
        {
            return mapper.valueToTree(params);
        }
        catch (IllegalArgumentException e)
        {
            throw new IllegalArgumentException(
                    "Command parameters cannot be serialized: " + params.getClass().getName(), e);
        }
    }

    public ObjectMapper getMapper()
    {
        return mapper;
    }

    // ========== Decoding ==========

    /**
     * Decodes a received frame.
     *
     * @param text the frame text
     * @return the decoded frame, or empty if malformed
     */
    public Optional<InboundFrame> decode(String text)
    {
        if (text == null || text.isEmpty())
        {
            return Optional.empty();
        }

        JsonNode root;
        try
        {
            root = mapper.readTree(text);
        }
        catch (JsonProcessingException e)
        {
            LOG.debug("Frame is not valid JSON: {}", e.getOriginalMessage());
            return Optional.empty();
        }

        if (root == null || !root.isObject())
        {
            return Optional.empty();
        }

        if (root.has("hello"))
        {
            return decodeHello(root.get("hello"));
        }
        if (root.has("n"))
        {
            return decodeNotification(root);
        }
        if (root.has("r"))
        {
            return correlationId(root)
                    .map(id -> new InboundFrame.Result(id, root.get("r")));
        }
        if (root.has("e"))
        {
            return correlationId(root)
                    .map(id -> new InboundFrame.ErrorReply(id, root.get("e")));
        }
        return Optional.empty();
    }

    private static Optional<InboundFrame> decodeHello(JsonNode hello)
    {
        if (hello == null || !hello.isObject())
        {
            return Optional.empty();
        }
        JsonNode sid = hello.get("sid");
        if (sid == null || !sid.isTextual() || sid.asText().isEmpty())
        {
            return Optional.empty();
        }
        boolean isNew = hello.path("isNew").asBoolean(false);
        return Optional.of(new InboundFrame.Hello(sid.asText(), isNew));
    }

    private static Optional<InboundFrame> decodeNotification(JsonNode root)
    {
        JsonNode name = root.get("n");
        if (!name.isTextual() || name.asText().isEmpty())
        {
            return Optional.empty();
        }
        JsonNode payload = root.has("d") ? root.get("d") : NullNode.getInstance();
        return Optional.of(new InboundFrame.NotificationFrame(name.asText(), payload));
    }

    private static Optional<Long> correlationId(JsonNode root)
    {
        JsonNode id = root.get("i");
        if (id == null || !id.canConvertToLong() || !id.isIntegralNumber())
        {
            return Optional.empty();
        }
        return Optional.of(id.asLong());
    }
}
