package com.g2c.compiler.codegen;

import com.g2c.compiler.ir.NodeTypes;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Dispatch table from node type to generation rule. Built-ins register first, plugins after
 * their descriptors validate.
 */
public final class RuleRegistry {

    private final Map<String, NodeRule> rules = new LinkedHashMap<>();

    /** A registry holding the rules of every built-in node type. */
    public static RuleRegistry builtIns() {
        RuleRegistry registry = new RuleRegistry();
        BuiltInRules.registerAll(registry);
        return registry;
    }

    /**
     * @throws IllegalArgumentException if {@code type} already has a rule
     */
    public void register(String type, NodeRule rule) {
        String canonical = NodeTypes.canonical(type);
        if (rules.containsKey(canonical)) {
            throw new IllegalArgumentException("Generation rule already registered for node type: " + type);
        }
        rules.put(canonical, rule);
    }

    public Optional<NodeRule> get(String type) {
        return Optional.ofNullable(rules.get(NodeTypes.canonical(type)));
    }

    public boolean contains(String type) {
        return rules.containsKey(NodeTypes.canonical(type));
    }

    public Set<String> types() {
        return Collections.unmodifiableSet(rules.keySet());
    }
}
