package de.bsommerfeld.dbqueue.core.value;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.util.Objects;
import java.util.Optional;

/**
 * Stores arbitrary objects as JSON text. Text and blob columns are accepted on
 * decode; malformed JSON decodes to empty like any other kind mismatch.
 *
 * @param <T> the mapped type
 */
final class JsonConverter<T> implements ValueConverter<T> {

    private final ObjectMapper mapper;
    private final Class<T> type;

    JsonConverter(ObjectMapper mapper, Class<T> type) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.type = Objects.requireNonNull(type, "type");
    }

    @Override
    public Value encode(T value) {
        try {
            return Value.of(mapper.writeValueAsString(value));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot encode " + type.getSimpleName() + " as JSON", e);
        }
    }

    @Override
    public Optional<T> decode(Value value) {
        try {
            if (value instanceof Value.Text t)
                return Optional.ofNullable(mapper.readValue(t.value(), type));
            if (value instanceof Value.Blob b)
                return Optional.ofNullable(mapper.readValue(b.value(), type));
        } catch (IOException e) {
            return Optional.empty();
        }
        return Optional.empty();
    }
}
