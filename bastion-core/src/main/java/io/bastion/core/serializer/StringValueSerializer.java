package io.bastion.core.serializer;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * String serializer, UTF-8 unless told otherwise.
 *
 * @since 1.0.0
 */
public class StringValueSerializer implements ValueSerializer<String> {

    public static final StringValueSerializer UTF_8 = new StringValueSerializer(StandardCharsets.UTF_8);

    private final Charset charset;

    public StringValueSerializer(Charset charset) {
        this.charset = Objects.requireNonNull(charset, "charset must not be null");
    }

    @Override
    public byte[] serialize(String value) {
        if (value == null) {
            throw new SerializationException("Cannot serialize a null string");
        }
        return value.getBytes(charset);
    }

    @Override
    public String deserialize(byte[] bytes) {
        if (bytes == null) {
            throw new SerializationException("Cannot deserialize null bytes");
        }
        return new String(bytes, charset);
    }

    public Charset charset() {
        return charset;
    }
}
