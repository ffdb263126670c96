package com.lodestar.core.engine;

import com.fasterxml.jackson.databind.node.TextNode;
import com.lodestar.core.fact.Fact;
import com.lodestar.core.fact.FactValue;
import com.lodestar.core.fact.Facts;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Comparator;
import java.util.HexFormat;
import java.util.List;
import java.util.TreeMap;

/**
 * SHA-256 over a canonical encoding of the durable facts: sorted by key,
 * each as {@code key|scope|kind|value}, record fields sorted by name.
 * Equal fact sets always give equal fingerprints regardless of insertion order.
 */
public final class DurableFingerprint {

    private DurableFingerprint() {}

    public static String of(Facts facts) {
        List<Fact> sorted = facts.durable().stream()
                .sorted(Comparator.comparing(Fact::key))
                .toList();
        var sb = new StringBuilder();
        for (Fact fact : sorted) {
            sb.append(quote(fact.key())).append('|')
                    .append(fact.scope().wireName()).append('|')
                    .append(fact.kind().name()).append('|');
            appendValue(sb, fact.value());
            sb.append('\n');
        }
        return sha256(sb.toString());
    }

    private static void appendValue(StringBuilder sb, FactValue value) {
        switch (value.type()) {
            case STRING -> sb.append(quote(value.asString()));
            case RECORD -> {
                sb.append('{');
                new TreeMap<>(value.asRecord()).forEach((name, field) -> {
                    sb.append(quote(name)).append(':');
                    appendValue(sb, field);
                    sb.append(',');
                });
                sb.append('}');
            }
            case LIST -> {
                sb.append('[');
                value.asList().forEach(element -> {
                    appendValue(sb, element);
                    sb.append(',');
                });
                sb.append(']');
            }
            case NUMBER -> sb.append(value.isIntegral() ? "i" : "d").append(value.asNumber());
            default -> sb.append(value);
        }
    }

    private static String quote(String text) {
        return TextNode.valueOf(text).toString();
    }

    private static String sha256(String text) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(text.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
