package io.bastion.core.key;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Base64;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Canonicalizes structured cache keys and digests them with SHA-256.
 *
 * <p>Each key part is converted into a type-tagged JSON tree before hashing, so
 * {@code "1"} and {@code 1} never collide and part boundaries cannot be forged
 * by concatenation. Sets and maps are ordered by the canonical text of their
 * elements, which makes logically equal inputs hash identically regardless of
 * iteration order.</p>
 *
 * <h2>Tags</h2>
 * <ul>
 *   <li>{@code ["n"]} null</li>
 *   <li>{@code ["s", text]} strings, {@code ["c", text]} characters</li>
 *   <li>{@code ["i", digits]} integral numbers, {@code ["f", decimal]} floating point</li>
 *   <li>{@code ["b", bool]} booleans, {@code ["x", base64]} byte arrays</li>
 *   <li>{@code ["e", class, name]} enums</li>
 *   <li>{@code ["l", ...]} lists and object arrays, {@code ["set", ...]} sets</li>
 *   <li>{@code ["m", [k, v], ...]} maps, {@code ["opt", v?]} optionals</li>
 *   <li>{@code ["o", class, tree]} anything else, serialized by Jackson</li>
 * </ul>
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * KeyHasher hasher = new KeyHasher();
 * KeyHash key = hasher.hash("lesson_plans_by_subject", "mathematics", 50);
 * }</pre>
 *
 * <p>Thread-safe; a single instance can be shared.</p>
 *
 * @since 1.0.0
 */
public class KeyHasher {

    /** Maximum nesting depth accepted for a single key part. */
    public static final int MAX_DEPTH = 32;

    private static final String DIGEST_ALGORITHM = "SHA-256";

    private final ObjectMapper objectMapper;
    private final JsonNodeFactory nodes = JsonNodeFactory.instance;

    public KeyHasher() {
        this(createDefaultObjectMapper());
    }

    /**
     * Creates a hasher using a custom ObjectMapper for untagged objects.
     *
     * @param objectMapper the mapper used for the {@code "o"} tag
     */
    public KeyHasher(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    private static ObjectMapper createDefaultObjectMapper() {
        return JsonMapper.builder()
                .addModule(new JavaTimeModule())
                .configure(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY, true)
                .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true)
                .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false)
                .configure(SerializationFeature.FAIL_ON_EMPTY_BEANS, true)
                .build();
    }

    /**
     * Hashes the given key parts.
     *
     * @param parts ordered key parts
     * @return 256-bit key hash
     * @throws KeyEncodingException if a part cannot be canonicalized
     */
    public KeyHash hash(Object... parts) {
        if (parts == null) {
            throw new KeyEncodingException("key parts must not be null");
        }
        return hash(Arrays.asList(parts));
    }

    /**
     * Hashes the given key parts.
     *
     * @param parts ordered key parts
     * @return 256-bit key hash
     * @throws KeyEncodingException if a part cannot be canonicalized
     */
    public KeyHash hash(List<?> parts) {
        return KeyHash.of(digest(canonicalBytes(parts)));
    }

    /**
     * Returns the canonical byte form that {@link #hash(List)} digests.
     *
     * @param parts ordered key parts
     * @return canonical UTF-8 JSON bytes
     * @throws KeyEncodingException if a part cannot be canonicalized
     */
    public byte[] canonicalBytes(List<?> parts) {
        if (parts == null) {
            throw new KeyEncodingException("key parts must not be null");
        }
        ArrayNode root = nodes.arrayNode();
        for (Object part : parts) {
            root.add(canonicalize(part, 0));
        }
        try {
            return objectMapper.writeValueAsBytes(root);
        } catch (JsonProcessingException e) {
            throw new KeyEncodingException("Failed to write canonical key", e);
        }
    }

    private JsonNode canonicalize(Object value, int depth) {
        if (depth > MAX_DEPTH) {
            throw new KeyEncodingException("Key nesting exceeds " + MAX_DEPTH + " levels");
        }
        if (value == null) {
            return tagged("n");
        }
        if (value instanceof CharSequence text) {
            return tagged("s").add(text.toString());
        }
        if (value instanceof Character c) {
            return tagged("c").add(c.toString());
        }
        if (value instanceof Boolean b) {
            return tagged("b").add(b);
        }
        if (value instanceof Integer || value instanceof Long
                || value instanceof Short || value instanceof Byte) {
            return tagged("i").add(Long.toString(((Number) value).longValue()));
        }
        if (value instanceof BigInteger big) {
            return tagged("i").add(big.toString());
        }
        if (value instanceof Double || value instanceof Float) {
            return tagged("f").add(decimalText(((Number) value).doubleValue(), value.toString()));
        }
        if (value instanceof BigDecimal decimal) {
            return tagged("f").add(plain(decimal));
        }
        if (value instanceof byte[] bytes) {
            return tagged("x").add(Base64.getEncoder().encodeToString(bytes));
        }
        if (value instanceof Enum<?> e) {
            return tagged("e").add(e.getDeclaringClass().getName()).add(e.name());
        }
        if (value instanceof Optional<?> optional) {
            ArrayNode node = tagged("opt");
            optional.ifPresent(inner -> node.add(canonicalize(inner, depth + 1)));
            return node;
        }
        if (value instanceof Set<?> set) {
            ArrayNode node = tagged("set");
            sortedByText(canonicalizeAll(set, depth)).forEach(node::add);
            return node;
        }
        if (value instanceof Collection<?> collection) {
            ArrayNode node = tagged("l");
            canonicalizeAll(collection, depth).forEach(node::add);
            return node;
        }
        if (value instanceof Object[] array) {
            ArrayNode node = tagged("l");
            canonicalizeAll(Arrays.asList(array), depth).forEach(node::add);
            return node;
        }
        if (value instanceof Map<?, ?> map) {
            return canonicalizeMap(map, depth);
        }
        return canonicalizeObject(value);
    }

    private List<JsonNode> canonicalizeAll(Collection<?> values, int depth) {
        List<JsonNode> result = new ArrayList<>(values.size());
        for (Object element : values) {
            result.add(canonicalize(element, depth + 1));
        }
        return result;
    }

    private JsonNode canonicalizeMap(Map<?, ?> map, int depth) {
        List<ArrayNode> pairs = new ArrayList<>(map.size());
        for (Map.Entry<?, ?> entry : map.entrySet()) {
            ArrayNode pair = nodes.arrayNode();
            pair.add(canonicalize(entry.getKey(), depth + 1));
            pair.add(canonicalize(entry.getValue(), depth + 1));
            pairs.add(pair);
        }
        // Keys are unique, so ordering by the key node alone is total
        pairs.sort(Comparator.comparing(pair -> pair.get(0).toString()));
        ArrayNode node = tagged("m");
        pairs.forEach(node::add);
        return node;
    }

    private JsonNode canonicalizeObject(Object value) {
        try {
            JsonNode tree = objectMapper.valueToTree(value);
            return tagged("o").add(value.getClass().getName()).add(tree);
        } catch (IllegalArgumentException e) {
            throw new KeyEncodingException(
                    "Key part of type " + value.getClass().getName() + " is not serializable", e);
        }
    }

    private ArrayNode tagged(String tag) {
        return nodes.arrayNode().add(tag);
    }

    private static List<JsonNode> sortedByText(List<JsonNode> elements) {
        elements.sort(Comparator.comparing(JsonNode::toString));
        return elements;
    }

    private static String decimalText(double value, String fallback) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return fallback;
        }
        return plain(new BigDecimal(fallback));
    }

    private static String plain(BigDecimal decimal) {
        if (decimal.signum() == 0) {
            return "0";
        }
        return decimal.stripTrailingZeros().toPlainString();
    }

    private static byte[] digest(byte[] canonical) {
        try {
            return MessageDigest.getInstance(DIGEST_ALGORITHM).digest(canonical);
        } catch (NoSuchAlgorithmException e) {
            // Every Java platform is required to ship SHA-256
            throw new IllegalStateException(DIGEST_ALGORITHM + " not available", e);
        }
    }
}
