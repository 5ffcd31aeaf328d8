package com.g2c.compiler.codegen;

import com.g2c.compiler.ir.ValueType;
import com.google.gson.JsonArray;
import com.google.gson.JsonParser;
import com.google.gson.JsonPrimitive;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CppSyntaxTest {

    @Test
    void quoteEscapesSpecialCharacters() {
        assertEquals("\"a\\\"b\\\\c\\n\"", CppSyntax.quote("a\"b\\c\n"));
        assertEquals("\"\\001\"", CppSyntax.quote("\u0001"));
    }

    @Test
    void integerLiteralGainsFractionInDoubleSlot() {
        assertEquals("3.0", CppSyntax.literal(new JsonPrimitive(3), ValueType.DOUBLE));
        assertEquals("3", CppSyntax.literal(new JsonPrimitive(3), ValueType.INT));
        assertEquals("1e5", CppSyntax.literal(JsonParser.parseString("1e5"), ValueType.DOUBLE));
    }

    @Test
    void stringLiteralIsWrappedOnlyInStringSlot() {
        assertEquals("std::string(\"hi\")", CppSyntax.literal(new JsonPrimitive("hi"), ValueType.STRING));
        assertEquals("\"hi\"", CppSyntax.literal(new JsonPrimitive("hi"), null));
    }

    @Test
    void booleansAreSpelledInLowerCase() {
        assertEquals("true", CppSyntax.literal(new JsonPrimitive(true), ValueType.BOOL));
    }

    @Test
    void nonScalarIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> CppSyntax.literal(new JsonArray(), ValueType.ANY));
        assertThrows(IllegalArgumentException.class, () -> CppSyntax.literal(null, ValueType.ANY));
    }

    @Test
    void declarationTypeFallsBackToAuto() {
        assertEquals("auto", CppSyntax.declarationType(null));
        assertEquals("auto", CppSyntax.declarationType(ValueType.ANY));
        assertEquals("std::string", CppSyntax.declarationType(ValueType.STRING));
    }
}
