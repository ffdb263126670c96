package com.lodestar.core.persistence;

import com.fasterxml.jackson.databind.JsonNode;
import com.lodestar.core.fact.Fact;
import com.lodestar.core.fact.FactKind;
import com.lodestar.core.fact.FactValue;
import com.lodestar.core.fact.Facts;
import com.lodestar.core.fact.Scope;
import com.lodestar.core.phase.PhaseSet;
import com.lodestar.core.state.IterationFacts;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class FactCodecTest {

    private final FactCodec codec = new FactCodec();

    @Nested
    @DisplayName("wire format")
    class WireFormat {

        @Test
        @DisplayName("facts carry key, value, scope and lowercase kind")
        void factShape() {
            JsonNode node = codec.factToJson(Fact.of("plan_ready", true, Scope.SESSION, FactKind.PROGRESS));

            assertEquals("plan_ready", node.get("key").asText());
            assertTrue(node.get("value").booleanValue());
            assertEquals("session", node.get("scope").asText());
            assertEquals("progress", node.get("kind").asText());
        }

        @Test
        @DisplayName("history records use snake_case by_action and ISO timestamps")
        void iterationShape() {
            var phase = PhaseSet.create("START").phase("START");
            var record = IterationFacts.of(4, phase, Instant.parse("2026-01-02T03:04:05.678Z"),
                    Map.of("Greet", Facts.of(Fact.of("said_hello", true, Scope.SESSION))));

            JsonNode node = codec.iterationToJson(record);

            assertEquals(4, node.get("iteration").intValue());
            assertEquals("START", node.get("phase").asText());
            assertEquals("2026-01-02T03:04:05.678Z", node.get("timestamp").asText());
            assertTrue(node.get("by_action").get("Greet").has("said_hello"));
        }
    }

    @Nested
    @DisplayName("reading")
    class Reading {

        @Test
        @DisplayName("kind defaults to FACT when absent")
        void kindDefault() {
            Fact fact = codec.factFromJson(codec.read("{\"key\":\"a\",\"value\":1,\"scope\":\"persistent\"}"));

            assertEquals(FactKind.FACT, fact.kind());
            assertEquals(Scope.PERSISTENT, fact.scope());
            assertEquals(1L, fact.value().asLong());
        }

        @Test
        @DisplayName("integers stay integral and fractions stay doubles")
        void numbers() {
            assertTrue(codec.valueFromJson(codec.read("7")).isIntegral());
            assertEquals(FactValue.number(7.5), codec.valueFromJson(codec.read("7.5")));
        }

        @Test
        @DisplayName("unknown scopes are malformed")
        void unknownScope() {
            assertThrows(StateStoreException.class,
                    () -> codec.factFromJson(codec.read("{\"key\":\"a\",\"value\":1,\"scope\":\"forever\"}")));
        }

        @Test
        @DisplayName("heterogeneous lists are malformed")
        void heterogeneousList() {
            assertThrows(StateStoreException.class, () -> codec.valueFromJson(codec.read("[1, \"a\"]")));
        }

        @Test
        @DisplayName("invalid JSON raises StateStoreException")
        void invalidJson() {
            assertThrows(StateStoreException.class, () -> codec.read("{oops"));
        }

        @Test
        @DisplayName("history records need an integer iteration and a parseable timestamp")
        void malformedIteration() {
            assertThrows(StateStoreException.class, () -> codec.readIteration(
                    "{\"iteration\":\"one\",\"phase\":\"START\",\"timestamp\":\"2026-01-01T00:00:00Z\"}"));
            assertThrows(StateStoreException.class, () -> codec.readIteration(
                    "{\"iteration\":1,\"phase\":\"START\",\"timestamp\":\"yesterday\"}"));
        }

        @Test
        @DisplayName("blank history lines are skipped")
        void blankLines() {
            List<IterationFacts> history = codec.readHistoryLines(List.of(
                    "{\"iteration\":1,\"phase\":\"START\",\"timestamp\":\"2026-01-01T00:00:00Z\",\"by_action\":{}}",
                    "  "));

            assertEquals(1, history.size());
            assertTrue(history.get(0).phaseOptional().isEmpty());
        }
    }

    @Test
    @DisplayName("fact bundles keep their order")
    void orderPreserved() {
        Facts facts = Facts.of(
                Fact.of("z", 1, Scope.SESSION),
                Fact.of("a", List.of(1, 2), Scope.SESSION),
                Fact.of("m", Map.of("k", "v"), Scope.PERSISTENT, FactKind.KNOWLEDGE));

        Facts read = codec.readFacts(codec.writeFacts(facts));

        assertEquals(List.of("z", "a", "m"), List.copyOf(read.keys()));
        assertEquals(facts, read);
    }
}
