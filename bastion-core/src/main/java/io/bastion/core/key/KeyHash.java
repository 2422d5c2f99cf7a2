package io.bastion.core.key;

import java.nio.ByteBuffer;

/**
 * Opaque 256-bit cache key produced by {@link KeyHasher}.
 *
 * <p>The digest is held as four longs so the record stays immutable and gets
 * value-based {@code equals}/{@code hashCode} without a backing array.</p>
 *
 * @since 1.0.0
 */
public record KeyHash(long h0, long h1, long h2, long h3) {

    /** Digest length in bytes. */
    public static final int LENGTH = 32;

    /**
     * Wraps a raw SHA-256 digest.
     *
     * @param digest exactly {@value #LENGTH} bytes
     * @return the key hash
     * @throws IllegalArgumentException if the digest has the wrong length
     */
    public static KeyHash of(byte[] digest) {
        if (digest == null || digest.length != LENGTH) {
            throw new IllegalArgumentException("digest must be " + LENGTH + " bytes");
        }
        ByteBuffer buffer = ByteBuffer.wrap(digest);
        return new KeyHash(buffer.getLong(), buffer.getLong(), buffer.getLong(), buffer.getLong());
    }

    /**
     * Returns the digest bytes as a fresh array.
     * @return 32-byte digest
     */
    public byte[] toBytes() {
        return ByteBuffer.allocate(LENGTH)
                .putLong(h0)
                .putLong(h1)
                .putLong(h2)
                .putLong(h3)
                .array();
    }

    /**
     * Short prefix for log lines.
     * @return first 8 hex characters
     */
    public String shortHex() {
        return String.format("%08x", h0 >>> 32);
    }

    @Override
    public String toString() {
        return String.format("%016x%016x%016x%016x", h0, h1, h2, h3);
    }
}
