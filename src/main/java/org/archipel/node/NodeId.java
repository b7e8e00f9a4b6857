package org.archipel.node;

import java.io.Serializable;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Identifies a participating process by a logical name and the address of its node server.
 * Written as {@code name@host:port}.
 *
 * @param name The logical node name.
 * @param host The host the node server listens on.
 * @param port The port the node server listens on.
 */
public record NodeId(String name, String host, int port) implements Serializable {

    private static final Pattern FORMAT = Pattern.compile("^([^@\\s]+)@([^:\\s]+):(\\d{1,5})$");

    public NodeId {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("node name must not be blank");
        }
        if (host == null || host.isBlank()) {
            throw new IllegalArgumentException("node host must not be blank");
        }
        if (port < 0 || port > 65535) {
            throw new IllegalArgumentException("node port must be in range 0..65535, got: " + port);
        }
    }

    /**
     * Parses {@code name@host:port}.
     *
     * @param value The textual node identifier.
     * @return The parsed identifier.
     * @throws IllegalArgumentException if the value is malformed.
     */
    public static NodeId parse(String value) {
        Matcher matcher = FORMAT.matcher(value == null ? "" : value.trim());
        if (!matcher.matches()) {
            throw new IllegalArgumentException(String.format(
                "invalid node '%s', expected the format name@host:port", value));
        }
        return new NodeId(matcher.group(1), matcher.group(2), Integer.parseInt(matcher.group(3)));
    }

    /**
     * @return The base URL of the node server.
     */
    public String baseUrl() {
        return "http://" + host + ":" + port;
    }

    @Override
    public String toString() {
        return name + "@" + host + ":" + port;
    }
}
