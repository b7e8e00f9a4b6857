package org.archipel.node;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Consumer;

/**
 * Names registered by processes on this node, each with a handler for the leader's
 * initiate message. Peers look names up through {@code GET /registry/{name}}.
 */
public class NameDirectory {

    private final ConcurrentMap<String, Consumer<NodeId>> entries = new ConcurrentHashMap<>();

    /**
     * Registers a name.
     *
     * @throws IllegalStateException if the name is already taken.
     */
    public void register(String name, Consumer<NodeId> onInitiate) {
        if (entries.putIfAbsent(name, onInitiate) != null) {
            throw new IllegalStateException("name '" + name + "' is already registered");
        }
    }

    public void unregister(String name) {
        entries.remove(name);
    }

    public boolean isRegistered(String name) {
        return entries.containsKey(name);
    }

    public Optional<Consumer<NodeId>> lookup(String name) {
        return Optional.ofNullable(entries.get(name));
    }
}
