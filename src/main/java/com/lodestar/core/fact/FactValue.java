package com.lodestar.core.fact;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Tagged payload of a {@link Fact}.
 * <p>
 * Values are restricted to strings, numbers, booleans, records (ordered
 * name-to-value maps), homogeneous lists and null, so that facts can be
 * serialized without reflection. Integral numbers are held as {@code long},
 * all others as {@code double}.
 */
public final class FactValue {

    public enum Type {
        STRING,
        NUMBER,
        BOOLEAN,
        RECORD,
        LIST,
        NULL
    }

    public static final FactValue NULL = new FactValue(Type.NULL, null);
    public static final FactValue TRUE = new FactValue(Type.BOOLEAN, Boolean.TRUE);
    public static final FactValue FALSE = new FactValue(Type.BOOLEAN, Boolean.FALSE);

    private final Type type;
    private final Object raw;

    private FactValue(Type type, Object raw) {
        this.type = type;
        this.raw = raw;
    }

    public static FactValue string(String value) {
        return new FactValue(Type.STRING, Objects.requireNonNull(value, "value"));
    }

    public static FactValue number(long value) {
        return new FactValue(Type.NUMBER, value);
    }

    public static FactValue number(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            throw new IllegalArgumentException("Fact numbers must be finite, got " + value);
        }
        return new FactValue(Type.NUMBER, value);
    }

    public static FactValue bool(boolean value) {
        return value ? TRUE : FALSE;
    }

    public static FactValue record(Map<String, FactValue> fields) {
        var copy = new LinkedHashMap<String, FactValue>();
        fields.forEach((name, value) -> copy.put(
                Objects.requireNonNull(name, "record field name"),
                Objects.requireNonNull(value, "record field '" + name + "'")));
        return new FactValue(Type.RECORD, Collections.unmodifiableMap(copy));
    }

    public static FactValue list(List<FactValue> elements) {
        Type elementType = null;
        for (FactValue element : elements) {
            Objects.requireNonNull(element, "list element");
            if (elementType == null) {
                elementType = element.type;
            } else if (element.type != elementType) {
                throw new IllegalArgumentException(
                        "Fact lists must be homogeneous: found " + element.type + " after " + elementType);
            }
        }
        return new FactValue(Type.LIST, List.copyOf(elements));
    }

    /**
     * Converts a plain Java value into a FactValue.
     *
     * @throws IllegalArgumentException if the value (or a nested value) has an unsupported type
     */
    public static FactValue of(Object value) {
        if (value == null) {
            return NULL;
        }
        if (value instanceof FactValue fv) {
            return fv;
        }
        if (value instanceof String s) {
            return string(s);
        }
        if (value instanceof Boolean b) {
            return bool(b);
        }
        if (value instanceof Long || value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return number(((Number) value).longValue());
        }
        if (value instanceof Number n) {
            double d = n.doubleValue();
            if (d == Math.rint(d) && !(value instanceof Double) && !(value instanceof Float)
                    && Math.abs(d) < 0x1p63) {
                return number(n.longValue());
            }
            return number(d);
        }
        if (value instanceof Enum<?> e) {
            return string(e.name());
        }
        if (value instanceof Map<?, ?> map) {
            var fields = new LinkedHashMap<String, FactValue>();
            map.forEach((k, v) -> {
                if (!(k instanceof String name)) {
                    throw new IllegalArgumentException("Record field names must be strings, got " + k);
                }
                fields.put(name, of(v));
            });
            return record(fields);
        }
        if (value instanceof Collection<?> collection) {
            var elements = new ArrayList<FactValue>(collection.size());
            for (Object element : collection) {
                elements.add(of(element));
            }
            return list(elements);
        }
        throw new IllegalArgumentException(
                "Unsupported fact value type: " + value.getClass().getName());
    }

    public Type type() {
        return type;
    }

    public boolean isNull() {
        return type == Type.NULL;
    }

    public String asString() {
        requireType(Type.STRING);
        return (String) raw;
    }

    public boolean asBoolean() {
        requireType(Type.BOOLEAN);
        return (Boolean) raw;
    }

    public Number asNumber() {
        requireType(Type.NUMBER);
        return (Number) raw;
    }

    public boolean isIntegral() {
        return type == Type.NUMBER && raw instanceof Long;
    }

    public long asLong() {
        return asNumber().longValue();
    }

    public double asDouble() {
        return asNumber().doubleValue();
    }

    @SuppressWarnings("unchecked")
    public Map<String, FactValue> asRecord() {
        requireType(Type.RECORD);
        return (Map<String, FactValue>) raw;
    }

    @SuppressWarnings("unchecked")
    public List<FactValue> asList() {
        requireType(Type.LIST);
        return (List<FactValue>) raw;
    }

    /**
     * Converts back to plain Java values: String, Long, Double, Boolean,
     * ordered Map, List or null.
     */
    public Object unwrap() {
        return switch (type) {
            case RECORD -> {
                var out = new LinkedHashMap<String, Object>();
                asRecord().forEach((k, v) -> out.put(k, v.unwrap()));
                yield Collections.unmodifiableMap(out);
            }
            case LIST -> asList().stream().map(FactValue::unwrap).toList();
            default -> raw;
        };
    }

    private void requireType(Type expected) {
        if (type != expected) {
            throw new IllegalStateException("Fact value is " + type + ", not " + expected);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FactValue other)) return false;
        return type == other.type && Objects.equals(raw, other.raw);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, raw);
    }

    @Override
    public String toString() {
        return switch (type) {
            case STRING -> "\"" + raw + "\"";
            case NULL -> "null";
            default -> String.valueOf(raw);
        };
    }
}
