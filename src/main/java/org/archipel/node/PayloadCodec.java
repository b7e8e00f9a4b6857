package org.archipel.node;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InvalidClassException;
import java.io.ObjectInputFilter;
import java.io.ObjectInputStream;
import java.io.ObjectOutputStream;
import java.io.Serializable;
import java.util.List;

/**
 * Java serialization of the payloads nodes exchange during a run: migrants, population
 * reports and worker failures. Genomes, fitness and log values must be serializable.
 *
 * <p>Decoding only accepts the classes of an allow-list: archipel types, the {@code java.lang},
 * {@code java.util}, {@code java.time}, {@code java.io} and {@code java.net} packages used by
 * genomes, logs and failure causes, arrays of those or of primitives, and the extra patterns
 * configured under {@code archipel.node.payload.allowed-classes}. Everything else is
 * rejected before it is instantiated.</p>
 */
public final class PayloadCodec {

    private static final List<String> BUILT_IN_CLASSES = List.of(
        "org.archipel.**",
        "java.lang.*",
        "java.util.*",
        "java.time.*",
        "java.io.*",
        "java.net.*",
        "java.net.http.*");

    public static final int DEFAULT_MAX_DEPTH = 64;
    public static final long DEFAULT_MAX_ARRAY_LENGTH = 10_000_000L;

    /**
     * The filter applied by {@link #decode(byte[], Class)}.
     */
    public static final ObjectInputFilter DEFAULT_FILTER = filter(List.of(), DEFAULT_MAX_DEPTH, DEFAULT_MAX_ARRAY_LENGTH);

    private PayloadCodec() {
    }

    /**
     * Builds a deserialization filter that accepts the built-in classes and the given patterns.
     *
     * @param allowedClasses Additional class patterns in {@link ObjectInputFilter.Config#createFilter}
     *                       syntax, e.g. {@code com.example.genomes.*}.
     * @param maxDepth       The maximum object graph depth.
     * @param maxArrayLength The maximum length of any array.
     * @return The filter.
     * @throws IllegalArgumentException if a pattern is malformed.
     */
    public static ObjectInputFilter filter(List<String> allowedClasses, int maxDepth, long maxArrayLength) {
        StringBuilder pattern = new StringBuilder()
            .append("maxdepth=").append(maxDepth).append(';')
            .append("maxarray=").append(maxArrayLength).append(';');
        for (String allowed : BUILT_IN_CLASSES) {
            pattern.append(allowed).append(';');
        }
        for (String allowed : allowedClasses) {
            if (allowed.isBlank() || allowed.contains(";") || allowed.startsWith("!")) {
                throw new IllegalArgumentException("invalid allowed class pattern: '" + allowed + "'");
            }
            pattern.append(allowed.trim()).append(';');
        }
        pattern.append("!*");
        return ObjectInputFilter.Config.createFilter(pattern.toString());
    }

    public static byte[] encode(Serializable payload) {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        try (ObjectOutputStream out = new ObjectOutputStream(bytes)) {
            out.writeObject(payload);
        } catch (IOException e) {
            throw new IllegalArgumentException("payload cannot be serialized: " + e.getMessage(), e);
        }
        return bytes.toByteArray();
    }

    /**
     * Decodes a payload with the {@link #DEFAULT_FILTER}.
     *
     * @throws IllegalArgumentException if the bytes are not a serialized {@code type} or
     *                                  contain a class the filter rejects.
     */
    public static <T> T decode(byte[] payload, Class<T> type) {
        return decode(payload, type, DEFAULT_FILTER);
    }

    public static <T> T decode(byte[] payload, Class<T> type, ObjectInputFilter filter) {
        try (ObjectInputStream in = new ObjectInputStream(new ByteArrayInputStream(payload))) {
            in.setObjectInputFilter(filter);
            Object value = in.readObject();
            if (!type.isInstance(value)) {
                throw new IllegalArgumentException(String.format(
                    "expected a payload of type %s but got %s", type.getName(),
                    value == null ? "null" : value.getClass().getName()));
            }
            return type.cast(value);
        } catch (InvalidClassException e) {
            throw new IllegalArgumentException("payload rejected: " + e.getMessage(), e);
        } catch (IOException | ClassNotFoundException e) {
            throw new IllegalArgumentException("payload cannot be deserialized: " + e.getMessage(), e);
        }
    }
}
