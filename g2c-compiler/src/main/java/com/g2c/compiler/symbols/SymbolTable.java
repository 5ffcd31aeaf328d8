package com.g2c.compiler.symbols;

import com.g2c.compiler.ir.PortRef;

import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Generated identifiers of one scope (the top level or one function body).
 *
 * <p>Each (node, port) output gets a C++-legal name on first production and keeps it for every
 * later lookup. Temporaries are named {@code <hint>_<n>}; user-supplied names (variables,
 * functions, parameters) are sanitized and prefixed with {@code g2c_u_} so they can never
 * collide with temporaries, library names or keywords. Names never leak between scopes.
 */
public final class SymbolTable {

    public static final String USER_PREFIX = "g2c_u_";

    private static final Set<String> KEYWORDS = Set.of(
            "alignas", "alignof", "and", "and_eq", "asm", "auto", "bitand", "bitor", "bool", "break",
            "case", "catch", "char", "char8_t", "char16_t", "char32_t", "class", "compl", "concept",
            "const", "consteval", "constexpr", "constinit", "const_cast", "continue", "co_await",
            "co_return", "co_yield", "decltype", "default", "delete", "do", "double", "dynamic_cast",
            "else", "enum", "explicit", "export", "extern", "false", "float", "for", "friend", "goto",
            "if", "inline", "int", "long", "mutable", "namespace", "new", "noexcept", "not", "not_eq",
            "nullptr", "operator", "or", "or_eq", "private", "protected", "public", "register",
            "reinterpret_cast", "requires", "return", "short", "signed", "sizeof", "static",
            "static_assert", "static_cast", "struct", "switch", "template", "this", "thread_local",
            "throw", "true", "try", "typedef", "typeid", "typename", "union", "unsigned", "using",
            "virtual", "void", "volatile", "wchar_t", "while", "xor", "xor_eq",
            "main", "std", "guard"
    );

    private final Map<PortRef, String> bindings = new TreeMap<>();
    private final Map<String, String> variables = new TreeMap<>();
    private final Set<String> used = new HashSet<>();
    private final Map<String, Integer> counters = new HashMap<>();

    public SymbolTable() {}

    /** A scope that must not reuse the given names (function identifiers, formal parameters). */
    public SymbolTable(Collection<String> reserved) {
        used.addAll(reserved);
    }

    /** Marks an identifier as taken in this scope. */
    public void reserve(String identifier) {
        used.add(identifier);
    }

    public boolean isTaken(String identifier) {
        return used.contains(identifier) || KEYWORDS.contains(identifier);
    }

    /** Binds an output directly to an existing identifier, e.g. an argument source to its parameter. */
    public String seed(String nodeId, String port, String identifier) {
        used.add(identifier);
        bindings.put(new PortRef(nodeId, port), identifier);
        return identifier;
    }

    /**
     * Returns the identifier of an output, creating one from {@code hint} on first production.
     */
    public String bind(String nodeId, String port, String hint) {
        PortRef ref = new PortRef(nodeId, port);
        String existing = bindings.get(ref);
        if (existing != null) return existing;
        String name = fresh(hint);
        bindings.put(ref, name);
        return name;
    }

    /** Identifier already produced for an output, or null. */
    public String lookup(String nodeId, String port) {
        return bindings.get(new PortRef(nodeId, port));
    }

    /** Stable identifier of a user variable within this scope. */
    public String variable(String name) {
        String existing = variables.get(name);
        if (existing != null) return existing;
        String id = unique(USER_PREFIX + userPart(name));
        variables.put(name, id);
        return id;
    }

    /** A new temporary {@code <hint>_<n>}, unique in this scope. */
    public String fresh(String hint) {
        String base = sanitize(hint == null || hint.isBlank() ? "v" : hint).toLowerCase(Locale.ROOT).replaceAll("_{2,}", "_");
        while (base.startsWith("_")) base = base.substring(1);
        if (base.isEmpty() || Character.isDigit(base.charAt(0))) base = "v" + base;
        String candidate;
        do {
            int n = counters.merge(base, 1, Integer::sum);
            candidate = base + "_" + n;
        } while (isTaken(candidate));
        used.add(candidate);
        return candidate;
    }

    private String unique(String candidate) {
        if (!isTaken(candidate)) {
            used.add(candidate);
            return candidate;
        }
        int n = 1;
        while (isTaken(candidate + "_" + n)) n++;
        used.add(candidate + "_" + n);
        return candidate + "_" + n;
    }

    /** Identifier of a user function, shared by every scope. */
    public static String functionName(String name) {
        return USER_PREFIX + userPart(name);
    }

    /** Identifier of a formal parameter. */
    public static String parameterName(String name) {
        return USER_PREFIX + userPart(name);
    }

    /** Replaces every character that cannot appear in a C++ identifier with {@code _}. */
    public static String sanitize(String raw) {
        if (raw == null || raw.isEmpty()) return "_";
        StringBuilder sb = new StringBuilder(raw.length());
        for (char c : raw.toCharArray()) {
            sb.append((c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9') || c == '_' ? c : '_');
        }
        return sb.toString();
    }

    /** Sanitized name with no leading or doubled underscores, since {@code __} is reserved in C++. */
    private static String userPart(String name) {
        String s = sanitize(name).replaceAll("_{2,}", "_");
        if (s.startsWith("_")) s = s.substring(1);
        return s.isEmpty() ? "v" : s;
    }
}
