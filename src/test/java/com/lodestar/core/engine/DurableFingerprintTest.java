package com.lodestar.core.engine;

import com.lodestar.core.fact.Fact;
import com.lodestar.core.fact.FactKind;
import com.lodestar.core.fact.Facts;
import com.lodestar.core.fact.Scope;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class DurableFingerprintTest {

    @Test
    @DisplayName("ignores insertion order of facts and record fields")
    void orderIndependent() {
        var ab = new LinkedHashMap<String, Object>();
        ab.put("a", 1);
        ab.put("b", 2);
        var ba = new LinkedHashMap<String, Object>();
        ba.put("b", 2);
        ba.put("a", 1);

        Facts first = Facts.of(Fact.of("x", "1", Scope.SESSION), Fact.of("r", ab, Scope.SESSION));
        Facts second = Facts.of(Fact.of("r", ba, Scope.SESSION), Fact.of("x", "1", Scope.SESSION));

        assertEquals(DurableFingerprint.of(first), DurableFingerprint.of(second));
    }

    @Test
    @DisplayName("ignores iteration-scoped facts")
    void ignoresIterationFacts() {
        Facts durable = Facts.of(Fact.of("x", 1, Scope.SESSION));

        assertEquals(DurableFingerprint.of(durable),
                DurableFingerprint.of(durable.merge(Facts.of(Fact.of("tmp", 1, Scope.ITERATION)))));
    }

    @Test
    @DisplayName("distinguishes values, types, scopes and kinds")
    void sensitive() {
        String base = DurableFingerprint.of(Facts.of(Fact.of("x", 1, Scope.SESSION)));

        assertNotEquals(base, DurableFingerprint.of(Facts.of(Fact.of("x", 2, Scope.SESSION))));
        assertNotEquals(base, DurableFingerprint.of(Facts.of(Fact.of("x", "1", Scope.SESSION))));
        assertNotEquals(base, DurableFingerprint.of(Facts.of(Fact.of("x", 1.0, Scope.SESSION))));
        assertNotEquals(base, DurableFingerprint.of(Facts.of(Fact.of("x", 1, Scope.PERSISTENT))));
        assertNotEquals(base, DurableFingerprint.of(Facts.of(Fact.of("x", 1, Scope.SESSION, FactKind.PROGRESS))));
    }

    @Test
    @DisplayName("is a 64-character hex SHA-256")
    void format() {
        String fingerprint = DurableFingerprint.of(Facts.empty());

        assertEquals(64, fingerprint.length());
        assertTrue(fingerprint.matches("[0-9a-f]+"));
        assertEquals(DurableFingerprint.of(Facts.of(Fact.of("m", Map.of(), Scope.SESSION))).length(), 64);
    }
}
