package io.bastion.core.serializer;

/**
 * Converts typed values to and from the byte arrays a cache stores.
 *
 * <p>Implementations must be thread-safe. A cache never stores null, so
 * {@link #serialize} is only called with non-null values.</p>
 *
 * @param <T> the value type
 *
 * @since 1.0.0
 */
public interface ValueSerializer<T> {

    /**
     * Serializes a value.
     *
     * @param value the value, not null
     * @return the encoded bytes, never null
     * @throws SerializationException if the value cannot be encoded
     */
    byte[] serialize(T value);

    /**
     * Deserializes bytes produced by {@link #serialize}.
     *
     * @param bytes the encoded bytes
     * @return the value
     * @throws SerializationException if the bytes cannot be decoded
     */
    T deserialize(byte[] bytes);

    /**
     * Exception thrown when serialization or deserialization fails.
     */
    class SerializationException extends RuntimeException {
        public SerializationException(String message) {
            super(message);
        }

        public SerializationException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
