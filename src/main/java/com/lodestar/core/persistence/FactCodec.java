package com.lodestar.core.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.lodestar.core.fact.Fact;
import com.lodestar.core.fact.FactKind;
import com.lodestar.core.fact.FactValue;
import com.lodestar.core.fact.Facts;
import com.lodestar.core.fact.Scope;
import com.lodestar.core.state.IterationFacts;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * JSON mapping for facts and history records, shared by the file and JDBC stores.
 * <p>
 * Mapping is explicit over Jackson's tree model:
 * <ul>
 *   <li>Fact: {@code {"key", "value", "scope", "kind"}}</li>
 *   <li>Facts: object of fully-qualified key to Fact</li>
 *   <li>IterationFacts: {@code {"iteration", "phase", "timestamp", "by_action"}}, timestamp as ISO-8601</li>
 *   <li>Committed session state: {@code {"iteration", "facts"}}</li>
 * </ul>
 * Phase identities are written by name only.
 */
public final class FactCodec {

    private static final Logger log = LoggerFactory.getLogger(FactCodec.class);

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private final ObjectMapper objectMapper;

    public FactCodec() {
        this(new ObjectMapper());
    }

    public FactCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    // ── Values ───────────────────────────────────────────────────────────

    public JsonNode valueToJson(FactValue value) {
        return switch (value.type()) {
            case NULL -> NODES.nullNode();
            case STRING -> NODES.textNode(value.asString());
            case BOOLEAN -> NODES.booleanNode(value.asBoolean());
            case NUMBER -> value.isIntegral()
                    ? NODES.numberNode(value.asLong())
                    : NODES.numberNode(value.asDouble());
            case RECORD -> {
                ObjectNode node = NODES.objectNode();
                value.asRecord().forEach((name, field) -> node.set(name, valueToJson(field)));
                yield node;
            }
            case LIST -> {
                ArrayNode node = NODES.arrayNode();
                value.asList().forEach(element -> node.add(valueToJson(element)));
                yield node;
            }
        };
    }

    public FactValue valueFromJson(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return FactValue.NULL;
        }
        if (node.isTextual()) {
            return FactValue.string(node.textValue());
        }
        if (node.isBoolean()) {
            return FactValue.bool(node.booleanValue());
        }
        if (node.isIntegralNumber()) {
            if (!node.canConvertToLong()) {
                throw new StateStoreException("Integral fact value out of range: " + node);
            }
            return FactValue.number(node.longValue());
        }
        if (node.isNumber()) {
            return FactValue.number(node.doubleValue());
        }
        if (node.isObject()) {
            var fields = new LinkedHashMap<String, FactValue>();
            Iterator<Map.Entry<String, JsonNode>> it = node.fields();
            while (it.hasNext()) {
                var field = it.next();
                fields.put(field.getKey(), valueFromJson(field.getValue()));
            }
            return FactValue.record(fields);
        }
        if (node.isArray()) {
            var elements = new ArrayList<FactValue>(node.size());
            node.forEach(element -> elements.add(valueFromJson(element)));
            try {
                return FactValue.list(elements);
            } catch (IllegalArgumentException e) {
                throw new StateStoreException("Malformed fact list: " + e.getMessage(), e);
            }
        }
        throw new StateStoreException("Unsupported JSON node for a fact value: " + node.getNodeType());
    }

    // ── Facts ────────────────────────────────────────────────────────────

    public ObjectNode factToJson(Fact fact) {
        ObjectNode node = NODES.objectNode();
        node.put("key", fact.key());
        node.set("value", valueToJson(fact.value()));
        node.put("scope", fact.scope().wireName());
        node.put("kind", fact.kind().name().toLowerCase(Locale.ROOT));
        return node;
    }

    public Fact factFromJson(JsonNode node) {
        String key = requiredText(node, "key");
        Scope scope;
        FactKind kind;
        try {
            scope = Scope.fromWireName(requiredText(node, "scope"));
            JsonNode kindNode = node.get("kind");
            kind = kindNode == null || kindNode.isNull()
                    ? FactKind.FACT
                    : FactKind.valueOf(kindNode.asText().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new StateStoreException("Malformed fact '" + key + "': " + e.getMessage(), e);
        }
        return new Fact(key, valueFromJson(node.get("value")), scope, kind);
    }

    public ObjectNode factsToJson(Facts facts) {
        ObjectNode node = NODES.objectNode();
        for (Fact fact : facts) {
            node.set(fact.key(), factToJson(fact));
        }
        return node;
    }

    public Facts factsFromJson(JsonNode node) {
        if (node == null || node.isNull()) {
            return Facts.empty();
        }
        if (!node.isObject()) {
            throw new StateStoreException("Expected an object of facts, got " + node.getNodeType());
        }
        var facts = new ArrayList<Fact>(node.size());
        node.forEach(factNode -> facts.add(factFromJson(factNode)));
        return Facts.of(facts);
    }

    // ── History ──────────────────────────────────────────────────────────

    public ObjectNode iterationToJson(IterationFacts record) {
        ObjectNode node = NODES.objectNode();
        node.put("iteration", record.iteration());
        node.put("phase", record.phaseName());
        node.put("timestamp", record.timestamp().toString());
        node.set("by_action", byActionToJson(record.byAction()));
        return node;
    }

    public IterationFacts iterationFromJson(JsonNode node) {
        JsonNode iteration = node.get("iteration");
        if (iteration == null || !iteration.isInt()) {
            throw new StateStoreException("History record has no integer 'iteration': " + node);
        }
        Instant timestamp;
        try {
            timestamp = Instant.parse(requiredText(node, "timestamp"));
        } catch (DateTimeParseException e) {
            throw new StateStoreException("Malformed history timestamp: " + e.getMessage(), e);
        }
        return new IterationFacts(iteration.intValue(), requiredText(node, "phase"), null, timestamp,
                byActionFromJson(node.get("by_action")));
    }

    public ObjectNode byActionToJson(Map<String, Facts> byAction) {
        ObjectNode node = NODES.objectNode();
        byAction.forEach((action, facts) -> node.set(action, factsToJson(facts)));
        return node;
    }

    public Map<String, Facts> byActionFromJson(JsonNode node) {
        var byAction = new LinkedHashMap<String, Facts>();
        if (node == null || node.isNull()) {
            return byAction;
        }
        Iterator<Map.Entry<String, JsonNode>> it = node.fields();
        while (it.hasNext()) {
            var entry = it.next();
            byAction.put(entry.getKey(), factsFromJson(entry.getValue()));
        }
        return byAction;
    }

    // ── Strings ──────────────────────────────────────────────────────────

    public String write(JsonNode node) {
        try {
            return objectMapper.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new StateStoreException("Failed to serialize JSON", e);
        }
    }

    public JsonNode read(String json) {
        try {
            return objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new StateStoreException("Failed to parse stored JSON", e);
        }
    }

    public String writeFacts(Facts facts) {
        return write(factsToJson(facts));
    }

    public Facts readFacts(String json) {
        return factsFromJson(read(json));
    }

    public String writeIteration(IterationFacts record) {
        return write(iterationToJson(record));
    }

    public IterationFacts readIteration(String json) {
        return iterationFromJson(read(json));
    }

    /**
     * Reads one record per line, skipping blank lines. A final line that does
     * not parse is taken to be an interrupted append and dropped; a bad line
     * anywhere else fails the read.
     */
    public List<IterationFacts> readHistoryLines(List<String> lines) {
        int last = lines.size() - 1;
        while (last >= 0 && lines.get(last).isBlank()) {
            last--;
        }
        var history = new ArrayList<IterationFacts>(lines.size());
        for (int i = 0; i <= last; i++) {
            String line = lines.get(i);
            if (line.isBlank()) {
                continue;
            }
            try {
                history.add(readIteration(line));
            } catch (StateStoreException e) {
                if (i < last) {
                    throw e;
                }
                log.warn("Dropping unreadable final history line ({} chars): {}", line.length(), e.getMessage());
            }
        }
        return history;
    }

    /**
     * A session's facts together with the last iteration whose save completed.
     */
    public record SessionState(int iteration, Facts facts) {}

    public String writeSessionState(SessionState state) {
        ObjectNode node = NODES.objectNode();
        node.put("iteration", state.iteration());
        node.set("facts", factsToJson(state.facts()));
        return write(node);
    }

    public SessionState readSessionState(String json) {
        JsonNode node = read(json);
        JsonNode iteration = node.get("iteration");
        if (iteration == null || !iteration.isInt()) {
            throw new StateStoreException("Session state has no integer 'iteration'");
        }
        return new SessionState(iteration.intValue(), factsFromJson(node.get("facts")));
    }

    private static String requiredText(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || !value.isTextual()) {
            throw new StateStoreException("Missing text field '" + field + "' in " + node);
        }
        return value.textValue();
    }
}
