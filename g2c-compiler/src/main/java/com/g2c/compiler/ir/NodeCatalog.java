package com.g2c.compiler.ir;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable table of known node types: the built-ins plus any types contributed by plugins.
 */
public final class NodeCatalog {

    private static final NodeCatalog BUILT_INS = new NodeCatalog(NodeTypes.builtInSignatures());

    private final Map<String, NodeSignature> signatures;

    private NodeCatalog(Map<String, NodeSignature> signatures) {
        this.signatures = Collections.unmodifiableMap(signatures);
    }

    public static NodeCatalog builtIns() {
        return BUILT_INS;
    }

    /**
     * Returns a copy of this catalog with {@code signature} added.
     *
     * @throws IllegalArgumentException if the type is already known
     */
    public NodeCatalog with(NodeSignature signature) {
        if (contains(signature.type())) {
            throw new IllegalArgumentException("Node type already registered: " + signature.type());
        }
        Map<String, NodeSignature> copy = new LinkedHashMap<>(signatures);
        copy.put(signature.type(), signature);
        return new NodeCatalog(copy);
    }

    public Optional<NodeSignature> lookup(String type) {
        return Optional.ofNullable(signatures.get(NodeTypes.canonical(type)));
    }

    public boolean contains(String type) {
        return signatures.containsKey(NodeTypes.canonical(type));
    }

    /** Role of a node type; unknown types are treated as side-effecting. */
    public NodeRole roleOf(String type) {
        return lookup(type).map(NodeSignature::role).orElse(NodeRole.EFFECT);
    }

    public int size() {
        return signatures.size();
    }
}
