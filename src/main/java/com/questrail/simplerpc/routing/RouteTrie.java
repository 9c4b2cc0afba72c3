package com.questrail.simplerpc.routing;

import com.questrail.simplerpc.api.RpcHandler;

import java.util.Objects;
import java.util.Optional;

/**
 * RouteTrie
 * =============================================================================
 * Tree of {@link RouteNode}s addressed by dot-separated route keys.
 *
 * <h2>Addressing</h2>
 * A key is split on {@code '.'} into segments, each naming an immediate child.
 * Empty segments are kept ({@code "a..b"} has three segments). The empty key
 * addresses the root node itself without tokenizing.
 *
 * <h2>Matching</h2>
 * Lookups are exact: there is no partial match and no wildcard. A path whose
 * nodes exist but whose final node has no bound handler resolves to a node
 * without a handler, which is distinct from "no such route".
 *
 * <h2>Lifecycle</h2>
 * Nodes are created lazily by {@link #insert(String, RpcHandler)} and are only
 * removed by {@link #remove(String)}, which detaches the final node from its
 * parent and drops the whole subtree below it.
 */
public final class RouteTrie {

    private static final String SEPARATOR_REGEX = "\\.";

    private final RouteNode root = new RouteNode("");

    public RouteNode root() {
        return root;
    }

    /**
     * Bind the handler that receives envelopes with an empty route key.
     */
    public void bindRootHandler(RpcHandler handler) {
        root.bindHandler(Objects.requireNonNull(handler, "handler"));
    }

    /**
     * Bind {@code handler} at {@code path}, creating intermediate nodes as needed.
     * Replaces a handler previously bound at exactly this path; ancestors and
     * descendants are untouched.
     *
     * @throws IllegalArgumentException if {@code path} is null or empty, or
     *                                  {@code handler} is null
     */
    public void insert(String path, RpcHandler handler) {
        if (path == null || path.isEmpty()) {
            throw new IllegalArgumentException("route key must not be empty");
        }
        if (handler == null) {
            throw new IllegalArgumentException("handler must not be null");
        }

        RouteNode node = root;
        for (String segment : split(path)) {
            node = node.childOrCreate(segment);
        }
        node.bindHandler(handler);
    }

    /**
     * Resolve the node at {@code path}.
     *
     * @return the node, or {@link Optional#empty()} if any segment is missing
     */
    public Optional<RouteNode> findNode(String path) {
        Objects.requireNonNull(path, "path");
        if (path.isEmpty()) {
            return Optional.of(root);
        }

        RouteNode node = root;
        for (String segment : split(path)) {
            Optional<RouteNode> next = node.child(segment);
            if (next.isEmpty()) {
                return Optional.empty();
            }
            node = next.get();
        }
        return Optional.of(node);
    }

    /**
     * Resolve the handler bound at exactly {@code path}.
     */
    public Optional<RpcHandler> lookup(String path) {
        return findNode(path).flatMap(RouteNode::handler);
    }

    /**
     * Detach the node at {@code path} and its subtree.
     *
     * @return {@code true} if a node was detached; {@code false} if the path did
     *         not resolve (a no-op)
     */
    public boolean remove(String path) {
        if (path == null || path.isEmpty()) {
            throw new IllegalArgumentException("route key must not be empty");
        }

        String[] segments = split(path);
        RouteNode parent = root;
        for (int i = 0; i < segments.length - 1; i++) {
            Optional<RouteNode> next = parent.child(segments[i]);
            if (next.isEmpty()) {
                return false;
            }
            parent = next.get();
        }
        return parent.detachChild(segments[segments.length - 1]);
    }

    /**
     * Relabel the node at {@code path}. The node stays addressed by its path;
     * only the name reported by {@link RouteNode#name()} changes.
     *
     * @return {@code true} if the node exists and was renamed
     */
    public boolean rename(String path, String name) {
        Objects.requireNonNull(name, "name");
        Optional<RouteNode> node = findNode(path);
        node.ifPresent(n -> n.rename(name));
        return node.isPresent();
    }

    private static String[] split(String path) {
        // limit -1 keeps trailing empty segments
        return path.split(SEPARATOR_REGEX, -1);
    }
}
