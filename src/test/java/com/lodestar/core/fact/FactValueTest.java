package com.lodestar.core.fact;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class FactValueTest {

    enum Colour { RED }

    @Test
    @DisplayName("integral numbers are held as long, others as double")
    void numbers() {
        assertTrue(FactValue.of(3).isIntegral());
        assertEquals(3L, FactValue.of((short) 3).asLong());
        assertFalse(FactValue.of(2.5).isIntegral());
        assertEquals(2.5, FactValue.of(2.5f).asDouble());
        assertTrue(FactValue.of(new BigDecimal("10")).isIntegral());
    }

    @Test
    @DisplayName("non-finite doubles are rejected")
    void nonFinite() {
        assertThrows(IllegalArgumentException.class, () -> FactValue.of(Double.NaN));
        assertThrows(IllegalArgumentException.class, () -> FactValue.number(Double.POSITIVE_INFINITY));
    }

    @Test
    @DisplayName("maps become ordered records and collections become lists")
    void structures() {
        var map = new LinkedHashMap<String, Object>();
        map.put("b", 1L);
        map.put("a", List.of("x", "y"));

        FactValue value = FactValue.of(map);

        assertEquals(FactValue.Type.RECORD, value.type());
        assertEquals(List.of("b", "a"), List.copyOf(value.asRecord().keySet()));
        assertEquals(FactValue.Type.LIST, value.asRecord().get("a").type());
        assertEquals(map, value.unwrap());
    }

    @Test
    @DisplayName("lists must be homogeneous")
    void heterogeneousList() {
        var ex = assertThrows(IllegalArgumentException.class, () -> FactValue.of(List.of("a", 1)));
        assertTrue(ex.getMessage().contains("homogeneous"));
    }

    @Test
    @DisplayName("unsupported types are named in the error")
    void unsupportedType() {
        var ex = assertThrows(IllegalArgumentException.class, () -> FactValue.of(new Object()));
        assertTrue(ex.getMessage().contains("java.lang.Object"));
    }

    @Test
    @DisplayName("enums become their name, null becomes NULL")
    void enumsAndNull() {
        assertEquals("RED", FactValue.of(Colour.RED).asString());
        assertSame(FactValue.NULL, FactValue.of(null));
        assertTrue(FactValue.of(null).isNull());
    }

    @Test
    @DisplayName("typed accessors reject other types")
    void wrongAccessor() {
        assertThrows(IllegalStateException.class, () -> FactValue.of("x").asBoolean());
    }

    @Test
    @DisplayName("record keys must be strings")
    void recordKeysMustBeStrings() {
        assertThrows(IllegalArgumentException.class, () -> FactValue.of(Map.of(1, "x")));
    }
}
