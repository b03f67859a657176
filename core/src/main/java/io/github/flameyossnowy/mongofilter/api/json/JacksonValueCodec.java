package io.github.flameyossnowy.mongofilter.api.json;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.flameyossnowy.mongofilter.api.exceptions.json.JacksonJsonLocation;
import io.github.flameyossnowy.mongofilter.api.exceptions.json.JsonLocation;
import io.github.flameyossnowy.mongofilter.api.exceptions.json.JsonProcessException;
import io.github.flameyossnowy.mongofilter.api.value.StructuredValue;
import org.jetbrains.annotations.NotNull;

import java.util.Objects;

public class JacksonValueCodec<T> implements ValueCodec<T> {
    private final ObjectMapper mapper;
    private final Class<T> type;

    public JacksonValueCodec(@NotNull ObjectMapper mapper, @NotNull Class<T> type) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.type = Objects.requireNonNull(type, "type");
    }

    @Override
    public StructuredValue encode(T value) {
        try {
            return JacksonValueBridge.fromJsonNode(mapper.valueToTree(value));
        } catch (IllegalArgumentException e) {
            throw new JsonProcessException("Unable to encode " + type.getSimpleName() + ": " + e.getMessage(), e, JsonLocation.UNKNOWN);
        }
    }

    @Override
    public T decode(StructuredValue value) {
        try {
            return mapper.treeToValue(JacksonValueBridge.toJsonNode(value), type);
        } catch (JsonProcessingException e) {
            throw new JsonProcessException(e.getMessage(), e, JacksonJsonLocation.from(e.getLocation()));
        } catch (IllegalArgumentException e) {
            throw new JsonProcessException("Unable to decode " + type.getSimpleName() + ": " + e.getMessage(), e, JsonLocation.UNKNOWN);
        }
    }

    public Class<T> type() {
        return type;
    }
}
