package com.g2c.compiler.codegen;

import com.g2c.compiler.ir.ValueType;
import com.google.gson.JsonElement;
import com.google.gson.JsonPrimitive;

/**
 * C++ spellings shared by the generation rules.
 */
public final class CppSyntax {

    /** Stream-based stringification used by Concat and Cast-to-string. */
    public static final String STR_HELPER =
            "template <typename T> std::string g2c_str(const T& v) { std::ostringstream os; os << std::boolalpha << v; return os.str(); }";

    private CppSyntax() {}

    /** A double-quoted C++ string literal; control characters become octal escapes. */
    public static String quote(String s) {
        StringBuilder sb = new StringBuilder(s.length() + 2);
        sb.append('"');
        for (char c : s.toCharArray()) {
            switch (c) {
                case '"' -> sb.append("\\\"");
                case '\\' -> sb.append("\\\\");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '\t' -> sb.append("\\t");
                default -> {
                    if (c < 0x20 || c == 0x7f) {
                        sb.append(String.format("\\%03o", (int) c));
                    } else {
                        sb.append(c);
                    }
                }
            }
        }
        return sb.append('"').toString();
    }

    /**
     * Spells a JSON scalar as a C++ literal. Strings flowing into a string-typed slot are wrapped
     * in {@code std::string} so that operators behave as on strings.
     */
    public static String literal(JsonElement value, ValueType target) {
        if (value == null || !value.isJsonPrimitive()) {
            throw new IllegalArgumentException("Not a scalar literal: " + value);
        }
        JsonPrimitive p = value.getAsJsonPrimitive();
        if (p.isBoolean()) return p.getAsBoolean() ? "true" : "false";
        if (p.isNumber()) {
            String text = p.getAsString();
            if (target != null && target.equals(ValueType.DOUBLE) && !text.contains(".")
                    && !text.contains("e") && !text.contains("E")) {
                return text + ".0";
            }
            return text;
        }
        String quoted = quote(p.getAsString());
        return target != null && target.equals(ValueType.STRING) ? "std::string(" + quoted + ")" : quoted;
    }

    /** Type used to declare a temporary; unknown and {@code any} deduce with {@code auto}. */
    public static String declarationType(ValueType type) {
        if (type == null || type.kind() == ValueType.Kind.ANY || type.kind() == ValueType.Kind.VOID) return "auto";
        return type.cppName();
    }
}
