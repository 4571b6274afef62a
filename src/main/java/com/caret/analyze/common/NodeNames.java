package com.caret.analyze.common;

import java.util.Objects;

/**
 * Helpers for fully qualified node names such as {@code /ns/sub/node}.
 */
public final class NodeNames {

    private NodeNames() {
        // utility class
    }

    /**
     * A node name split into its namespace (always ending in {@code /}) and its base name.
     */
    public record NodeName(String namespace, String name) {
    }

    /**
     * Splits a node name at its last {@code /}.
     * {@code "/ns/sub/node"} becomes {@code ("/ns/sub/", "node")}; a name without a
     * slash lives in the root namespace {@code "/"}.
     */
    public static NodeName toNsAndName(String nodeName) {
        Objects.requireNonNull(nodeName, "nodeName must not be null");
        int lastSlash = nodeName.lastIndexOf('/');
        if (lastSlash < 0) {
            return new NodeName("/", nodeName);
        }
        return new NodeName(nodeName.substring(0, lastSlash) + "/", nodeName.substring(lastSlash + 1));
    }
}
