package com.g2c.compiler.ir;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ValueTypeTest {

    @Test
    void aliasesCanonicalize() {
        assertEquals(ValueType.DOUBLE, ValueType.parse("number"));
        assertEquals(ValueType.DOUBLE, ValueType.parse("float"));
        assertEquals(ValueType.ANY, ValueType.parse("auto"));
        assertEquals(ValueType.STRING, ValueType.parse("std::string"));
        assertNull(ValueType.parse("  "));
    }

    @Test
    void unknownSpellingIsKeptAsOpaqueType() {
        ValueType t = ValueType.parse("std::vector<int>");
        assertEquals(ValueType.Kind.OPAQUE, t.kind());
        assertEquals("std::vector<int>", t.cppName());
        assertTrue(t.isConcrete());
    }

    @Test
    void intWidensToDoubleButNotBack() {
        assertTrue(ValueType.DOUBLE.accepts(ValueType.INT));
        assertFalse(ValueType.INT.accepts(ValueType.DOUBLE));
        assertFalse(ValueType.BOOL.accepts(ValueType.STRING));
        assertTrue(ValueType.BOOL.accepts(ValueType.ANY));
        assertTrue(ValueType.ANY.accepts(ValueType.STRING));
    }

    @Test
    void joinOfWritersPicksLeastUpperBound() {
        assertEquals(ValueType.INT, ValueType.join(null, ValueType.INT));
        assertEquals(ValueType.DOUBLE, ValueType.join(ValueType.INT, ValueType.DOUBLE));
        assertEquals(ValueType.ANY, ValueType.join(ValueType.INT, ValueType.STRING));
    }

    @Test
    void cppSpellings() {
        assertEquals("std::string", ValueType.STRING.cppName());
        assertEquals("auto", ValueType.ANY.cppName());
        assertEquals("void", ValueType.VOID.cppName());
        assertFalse(ValueType.VOID.isConcrete());
    }
}
