package com.fleetrun.worker.protocol;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

/**
 * Line-oriented JSON codec for {@link WorkerMessage}s. One message per line;
 * the encoder never emits a newline inside a message.
 */
public final class MessageCodec {

    private final ObjectMapper mapper;

    public MessageCodec() {
        this(new ObjectMapper());
    }

    public MessageCodec(ObjectMapper base) {
        this.mapper = base.copy()
                .disable(SerializationFeature.INDENT_OUTPUT)
                .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    public String encode(WorkerMessage message) {
        try {
            return mapper.writeValueAsString(message);
        } catch (JsonProcessingException e) {
            throw new ProtocolException("Cannot encode " + message.getClass().getSimpleName(), e);
        }
    }

    /**
     * @throws ProtocolException if the line is not a known message
     */
    public WorkerMessage decode(String line) {
        try {
            return mapper.readValue(line, WorkerMessage.class);
        } catch (JsonProcessingException e) {
            throw new ProtocolException("Not a worker message: " + abbreviate(line), e);
        }
    }

    private static String abbreviate(String line) {
        return line.length() > 200 ? line.substring(0, 200) + "..." : line;
    }
}
