// file: src/main/java/io/difflite/core/JacksonStructuralHasher.java
package io.difflite.core;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;

/**
 * Structural hasher built on Jackson's tree model.
 * <p>
 * Steps:
 *  1) Convert the value to a {@link JsonNode} tree with {@link ObjectMapper#valueToTree(Object)}.
 *     Anything Jackson can serialize (beans, records, maps, collections, arrays, scalars) is accepted.
 *  2) Walk the tree in canonical form and feed every node into SHA-256:
 *      - objects: fields sorted by name, so property/insertion order does not matter,
 *      - arrays: elements in order,
 *      - every node is prefixed with a one-byte kind tag and lengths are explicit,
 *        so "ab","c" and "a","bc" never collide structurally.
 *  3) Keep the first 8 bytes of the digest as the {@link ContentHash}.
 * <p>
 * Failure modes:
 *  - Reference cycles and types without serializable properties make Jackson
 *    fail during conversion; that surfaces as {@link HashingException}.
 * <p>
 * Instances are thread safe: the mapper is shared, the digest is per call.
 */
public final class JacksonStructuralHasher implements StructuralHasher {

    private static final byte TAG_NULL = 'Z';
    private static final byte TAG_TRUE = 'T';
    private static final byte TAG_FALSE = 'F';
    private static final byte TAG_INTEGER = 'I';
    private static final byte TAG_DECIMAL = 'D';
    private static final byte TAG_TEXT = 'S';
    private static final byte TAG_BINARY = 'X';
    private static final byte TAG_ARRAY = 'A';
    private static final byte TAG_OBJECT = 'O';

    private final ObjectMapper mapper;

    public JacksonStructuralHasher() {
        this(defaultMapper());
    }

    /**
     * @param mapper mapper used for the value-to-tree conversion; modules registered
     *               on it (for example date/time support) change what can be hashed.
     */
    public JacksonStructuralHasher(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    /** Mapper with the features hashing relies on: fail on cycles and on empty beans. */
    public static ObjectMapper defaultMapper() {
        return new ObjectMapper()
                .enable(SerializationFeature.FAIL_ON_SELF_REFERENCES)
                .enable(SerializationFeature.FAIL_ON_EMPTY_BEANS)
                .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS);
    }

    @Override
    public ContentHash hash(Object value) {
        JsonNode tree;
        try {
            tree = mapper.valueToTree(value);
        } catch (IllegalArgumentException e) {
            throw new HashingException("cannot hash value of " + typeName(value) + ": " + e.getMessage(), e);
        }

        MessageDigest md = newDigest();
        feed(md, tree);
        return ContentHash.of(Arrays.copyOf(md.digest(), ContentHash.LENGTH));
    }

    // ---------------- canonical walk ----------------

    private static void feed(MessageDigest md, JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            md.update(TAG_NULL);
            return;
        }

        switch (node.getNodeType()) {
            case BOOLEAN -> md.update(node.booleanValue() ? TAG_TRUE : TAG_FALSE);
            case NUMBER -> feedNumber(md, node);
            case STRING -> {
                md.update(TAG_TEXT);
                lengthPrefixed(md, node.textValue().getBytes(StandardCharsets.UTF_8));
            }
            case BINARY -> {
                md.update(TAG_BINARY);
                try {
                    lengthPrefixed(md, node.binaryValue());
                } catch (java.io.IOException e) {
                    throw new HashingException("unreadable binary node", e);
                }
            }
            case ARRAY -> {
                md.update(TAG_ARRAY);
                md.update(intBE(node.size()));
                for (JsonNode child : node) {
                    feed(md, child);
                }
            }
            case OBJECT -> {
                md.update(TAG_OBJECT);
                md.update(intBE(node.size()));
                List<String> names = new ArrayList<>(node.size());
                for (Iterator<String> it = node.fieldNames(); it.hasNext(); ) {
                    names.add(it.next());
                }
                names.sort(null);
                for (String name : names) {
                    lengthPrefixed(md, name.getBytes(StandardCharsets.UTF_8));
                    feed(md, node.get(name));
                }
            }
            default -> throw new HashingException("unsupported node type " + node.getNodeType());
        }
    }

    /**
     * Integral values hash by their exact decimal digits regardless of width (int 7 == long 7).
     * Floating values hash by their canonical decimal string.
     */
    private static void feedNumber(MessageDigest md, JsonNode node) {
        String canonical;
        if (node.isIntegralNumber()) {
            md.update(TAG_INTEGER);
            canonical = node.bigIntegerValue().toString();
        } else {
            md.update(TAG_DECIMAL);
            canonical = node.isBigDecimal()
                    ? node.decimalValue().stripTrailingZeros().toPlainString()
                    : Double.toString(node.doubleValue());
        }
        lengthPrefixed(md, canonical.getBytes(StandardCharsets.US_ASCII));
    }

    private static void lengthPrefixed(MessageDigest md, byte[] bytes) {
        md.update(intBE(bytes.length));
        md.update(bytes);
    }

    private static byte[] intBE(int v) {
        return ByteBuffer.allocate(4).order(ByteOrder.BIG_ENDIAN).putInt(v).array();
    }

    private static String typeName(Object value) {
        return value == null ? "null" : value.getClass().getName();
    }

    static MessageDigest newDigest() {
        try { return MessageDigest.getInstance("SHA-256"); }
        catch (Exception e) { throw new RuntimeException(e); }
    }
}
