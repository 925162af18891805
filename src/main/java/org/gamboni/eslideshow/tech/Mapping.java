package org.gamboni.eslideshow.tech;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.util.Optional;
import java.util.function.Supplier;

/** Helper object for mapping data to and from JSON. Shared by the player control channel,
 * the Web API client and the HTTP front end.
 */
public class Mapping implements Supplier<ObjectMapper> {
    private final ObjectMapper jacksonMapper;

    public Mapping() {
        this.jacksonMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                // The player process and the Web API both send more than we care about
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public String writeValueAsString(Object payload) {
        try {
            return jacksonMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new RuntimeException(e);
        }
    }

    /** Parse the given text as a JSON tree, or return empty if it is not valid JSON. */
    public Optional<JsonNode> tryReadTree(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.ofNullable(jacksonMapper.readTree(text));
        } catch (JsonProcessingException e) {
            return Optional.empty();
        }
    }

    public ObjectNode newObject() {
        return jacksonMapper.createObjectNode();
    }

    @Override
    public ObjectMapper get() {
        return this.jacksonMapper;
    }
}
