package fr.imt.jobdaemon.jobdaemon.business.command;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;

import java.util.Optional;

/**
 * Typed access to the {@code args} object of a control request.
 * Missing or malformed arguments raise {@link IllegalArgumentException}.
 */
public class CommandArguments {

    public static final String JOB_SPEC = "jobSpec";
    public static final String JOB_ID = "jobId";
    public static final String SIGNAL = "signal";
    public static final String FORCE = "force";
    public static final String FILTER = "filter";
    public static final String UPDATE = "update";
    public static final String LIMIT = "limit";

    private final JsonNode args;
    private final ObjectMapper objectMapper;

    public CommandArguments(JsonNode args, ObjectMapper objectMapper) {
        this.args = args != null ? args : NullNode.getInstance();
        this.objectMapper = objectMapper;
    }

    public String requireString(String name) {
        return optionalString(name)
                .orElseThrow(() -> new IllegalArgumentException("Missing required argument: " + name));
    }

    public Optional<String> optionalString(String name) {
        JsonNode value = args.get(name);
        if (value == null || value.isNull()) {
            return Optional.empty();
        }
        if (!value.isTextual() || value.asText().isBlank()) {
            throw new IllegalArgumentException("Argument '" + name + "' must be a non-empty string");
        }
        return Optional.of(value.asText());
    }

    public boolean flag(String name) {
        JsonNode value = args.get(name);
        if (value == null || value.isNull()) {
            return false;
        }
        if (!value.isBoolean()) {
            throw new IllegalArgumentException("Argument '" + name + "' must be a boolean");
        }
        return value.booleanValue();
    }

    public Optional<Integer> optionalInt(String name) {
        JsonNode value = args.get(name);
        if (value == null || value.isNull()) {
            return Optional.empty();
        }
        if (!value.canConvertToInt()) {
            throw new IllegalArgumentException("Argument '" + name + "' must be an integer");
        }
        return Optional.of(value.intValue());
    }

    public <T> T require(String name, Class<T> type) {
        return optional(name, type)
                .orElseThrow(() -> new IllegalArgumentException("Missing required argument: " + name));
    }

    public <T> Optional<T> optional(String name, Class<T> type) {
        JsonNode value = args.get(name);
        if (value == null || value.isNull()) {
            return Optional.empty();
        }
        if (!value.isObject()) {
            throw new IllegalArgumentException("Argument '" + name + "' must be an object");
        }
        try {
            return Optional.of(objectMapper.treeToValue(value, type));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid argument '" + name + "': " + e.getOriginalMessage(), e);
        }
    }
}
