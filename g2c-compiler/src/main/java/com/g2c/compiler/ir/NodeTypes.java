package com.g2c.compiler.ir;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Built-in node vocabulary: canonical type names, accepted aliases and default signatures.
 */
public final class NodeTypes {

    public static final String LITERAL       = "Literal";
    public static final String ADD           = "Add";
    public static final String SUB           = "Sub";
    public static final String MUL           = "Mul";
    public static final String DIV           = "Div";
    public static final String MOD           = "Mod";
    public static final String EQ            = "Eq";
    public static final String NEQ           = "Neq";
    public static final String LT            = "Lt";
    public static final String GT            = "Gt";
    public static final String LTE           = "Lte";
    public static final String GTE           = "Gte";
    public static final String AND           = "And";
    public static final String OR            = "Or";
    public static final String NOT           = "Not";
    public static final String CONCAT        = "Concat";
    public static final String CAST          = "Cast";
    public static final String VAR_GET       = "VarGet";
    public static final String VAR_SET       = "VarSet";
    public static final String VAR_DECL      = "VarDecl";
    public static final String PRINT         = "Print";
    public static final String RETURN        = "Return";
    public static final String ARG           = "Arg";
    public static final String CALL_FUNCTION = "CallFunction";
    public static final String IF            = "If";
    public static final String WHILE         = "While";

    public static final Set<String> ARITHMETIC = Set.of(ADD, SUB, MUL, DIV, MOD);
    public static final Set<String> ORDERING   = Set.of(LT, GT, LTE, GTE);
    public static final Set<String> EQUALITY   = Set.of(EQ, NEQ);
    public static final Set<String> LOGIC      = Set.of(AND, OR);
    public static final Set<String> VARIABLES  = Set.of(VAR_GET, VAR_SET, VAR_DECL);

    private static final Map<String, String> ALIASES = Map.of(
            "Const", LITERAL,
            "Call", CALL_FUNCTION,
            "Param", ARG,
            "Branch", IF,
            "Loop", WHILE
    );

    private NodeTypes() {}

    /** Resolves an alias to its canonical type name; other names are returned unchanged. */
    public static String canonical(String type) {
        if (type == null) return null;
        return ALIASES.getOrDefault(type, type);
    }

    static Map<String, NodeSignature> builtInSignatures() {
        Map<String, NodeSignature> sigs = new LinkedHashMap<>();
        PortSpec out = PortSpec.of("out");

        put(sigs, LITERAL, NodeRole.PURE, List.of(), List.of(out));
        for (String t : List.of(ADD, SUB, MUL, DIV, MOD)) {
            put(sigs, t, NodeRole.PURE,
                    List.of(PortSpec.of("a", ValueType.DOUBLE), PortSpec.of("b", ValueType.DOUBLE)),
                    List.of(out));
        }
        for (String t : List.of(EQ, NEQ)) {
            put(sigs, t, NodeRole.PURE, List.of(PortSpec.of("a"), PortSpec.of("b")),
                    List.of(PortSpec.of("out", ValueType.BOOL)));
        }
        for (String t : List.of(LT, GT, LTE, GTE)) {
            put(sigs, t, NodeRole.PURE,
                    List.of(PortSpec.of("a", ValueType.DOUBLE), PortSpec.of("b", ValueType.DOUBLE)),
                    List.of(PortSpec.of("out", ValueType.BOOL)));
        }
        for (String t : List.of(AND, OR)) {
            put(sigs, t, NodeRole.PURE,
                    List.of(PortSpec.of("a", ValueType.BOOL), PortSpec.of("b", ValueType.BOOL)),
                    List.of(PortSpec.of("out", ValueType.BOOL)));
        }
        put(sigs, NOT, NodeRole.PURE, List.of(PortSpec.of("in", ValueType.BOOL)),
                List.of(PortSpec.of("out", ValueType.BOOL)));
        put(sigs, CONCAT, NodeRole.PURE, List.of(PortSpec.of("a"), PortSpec.of("b")),
                List.of(PortSpec.of("out", ValueType.STRING)));
        put(sigs, CAST, NodeRole.PURE, List.of(PortSpec.of("in")), List.of(out));

        put(sigs, VAR_GET, NodeRole.STATE_READ, List.of(), List.of(out));
        put(sigs, VAR_SET, NodeRole.STATE_WRITE, List.of(PortSpec.of("value")), List.of(out));
        put(sigs, VAR_DECL, NodeRole.STATE_WRITE, List.of(PortSpec.optional("value", null)), List.of());

        put(sigs, PRINT, NodeRole.EFFECT, List.of(PortSpec.of("text")), List.of());
        put(sigs, RETURN, NodeRole.RETURN, List.of(PortSpec.optional("value", null)), List.of());
        put(sigs, ARG, NodeRole.ARGUMENT, List.of(), List.of(out));
        // inputs come from the callee's parameter list
        put(sigs, CALL_FUNCTION, NodeRole.EFFECT, List.of(), List.of(out));

        put(sigs, IF, NodeRole.BRANCH, List.of(PortSpec.of("cond", ValueType.BOOL)), List.of());
        put(sigs, WHILE, NodeRole.LOOP, List.of(PortSpec.of("cond", ValueType.BOOL)), List.of());
        return sigs;
    }

    private static void put(Map<String, NodeSignature> sigs, String type, NodeRole role,
                            List<PortSpec> inputs, List<PortSpec> outputs) {
        sigs.put(type, new NodeSignature(type, role, inputs, outputs, true));
    }
}
