package io.bastion.core.serializer;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.io.IOException;
import java.util.Objects;

/**
 * JSON serializer using Jackson, for caching structured values such as
 * query result rows.
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * ValueSerializer<List<Lesson>> lessons =
 *     JacksonValueSerializer.of(new TypeReference<List<Lesson>>() {});
 *
 * bastion.set(List.of("lessons", gradeId), rows, lessons);
 * }</pre>
 *
 * @param <T> the type to serialize
 *
 * @since 1.0.0
 */
public class JacksonValueSerializer<T> implements ValueSerializer<T> {

    private final ObjectMapper objectMapper;
    private final JavaType type;

    /**
     * Creates a serializer with the default ObjectMapper.
     *
     * @param type the class to serialize/deserialize
     */
    public JacksonValueSerializer(Class<T> type) {
        this(type, createDefaultObjectMapper());
    }

    /**
     * Creates a serializer with a custom ObjectMapper.
     *
     * @param type the class to serialize/deserialize
     * @param objectMapper the ObjectMapper to use
     */
    public JacksonValueSerializer(Class<T> type, ObjectMapper objectMapper) {
        this(objectMapper.constructType(Objects.requireNonNull(type, "type must not be null")), objectMapper);
    }

    private JacksonValueSerializer(JavaType type, ObjectMapper objectMapper) {
        this.type = type;
        this.objectMapper = objectMapper;
    }

    /**
     * Creates a serializer for a generic type.
     *
     * @param typeReference the full generic type
     * @param <T> the value type
     * @return new serializer
     */
    public static <T> JacksonValueSerializer<T> of(TypeReference<T> typeReference) {
        ObjectMapper mapper = createDefaultObjectMapper();
        return new JacksonValueSerializer<>(mapper.constructType(typeReference), mapper);
    }

    static ObjectMapper createDefaultObjectMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
    }

    @Override
    public byte[] serialize(T value) {
        if (value == null) {
            throw new SerializationException("Cannot serialize a null value");
        }
        try {
            return objectMapper.writeValueAsBytes(value);
        } catch (JsonProcessingException e) {
            throw new SerializationException("Failed to serialize value to JSON", e);
        }
    }

    @Override
    public T deserialize(byte[] bytes) {
        if (bytes == null || bytes.length == 0) {
            throw new SerializationException("Cannot deserialize empty bytes to " + type);
        }
        try {
            return objectMapper.readValue(bytes, type);
        } catch (IOException e) {
            throw new SerializationException("Failed to deserialize JSON to " + type, e);
        }
    }

    /**
     * Returns the ObjectMapper used by this serializer.
     *
     * @return the ObjectMapper
     */
    public ObjectMapper getObjectMapper() {
        return objectMapper;
    }
}
