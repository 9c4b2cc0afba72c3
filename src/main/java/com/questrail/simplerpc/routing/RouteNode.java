package com.questrail.simplerpc.routing;

import com.questrail.simplerpc.api.RpcHandler;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * RouteNode
 * -----------------------------------------------------------------------------
 * One segment of a {@link RouteTrie}.
 *
 * <p>The name is informational only; a node is addressed through the key under
 * which its parent holds it. Structural mutation ({@link #childOrCreate(String)},
 * {@link #detachChild(String)}, {@link #bindHandler(RpcHandler)},
 * {@link #rename(String)}) is package-private and performed by the owning trie.
 * Renaming relabels the node; it never moves it.</p>
 */
public final class RouteNode {

    private volatile String name;
    private volatile RpcHandler handler;
    private final Map<String, RouteNode> children = new ConcurrentHashMap<>();

    RouteNode(String name) {
        this.name = Objects.requireNonNull(name, "name");
    }

    public String name() {
        return name;
    }

    /**
     * The handler bound at this exact node, if any.
     */
    public Optional<RpcHandler> handler() {
        return Optional.ofNullable(handler);
    }

    public Optional<RouteNode> child(String segment) {
        return Optional.ofNullable(children.get(segment));
    }

    /**
     * Read-only view of the immediate child segment names.
     */
    public Set<String> childNames() {
        return Collections.unmodifiableSet(children.keySet());
    }

    void rename(String name) {
        this.name = Objects.requireNonNull(name, "name");
    }

    void bindHandler(RpcHandler handler) {
        this.handler = handler;
    }

    RouteNode childOrCreate(String segment) {
        return children.computeIfAbsent(segment, RouteNode::new);
    }

    boolean detachChild(String segment) {
        return children.remove(segment) != null;
    }

    @Override
    public String toString() {
        return "RouteNode[" +
                "name=" + name +
                ", bound=" + (handler != null) +
                ", children=" + children.keySet() +
                ']';
    }
}
