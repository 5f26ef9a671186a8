package com.putman.sim.io;

import com.fasterxml.jackson.core.io.JsonStringEncoder;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.putman.sim.model.RunLog;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;

/**
 * Canonical serialization and 32-bit FNV-1a hashing of a RunLog.
 *
 * <p>
 * The value is first mapped to a Jackson tree, then written compactly:
 * <ul>
 * <li>arrays keep their order;</li>
 * <li>object keys are sorted lexicographically, so map insertion order never
 * reaches the hash;</li>
 * <li>integral numbers print as integers, reals in their shortest plain
 * decimal form ({@code 1.0 -> 1}, {@code 0.080 -> 0.08}), non-finite reals as
 * {@code null};</li>
 * <li>strings are JSON-quoted.</li>
 * </ul>
 * The digest folds every UTF-16 char of that string with
 * {@code hash = (hash ^ c) * 16777619}, starting from 2166136261, and prints
 * the result as 8 lowercase hex digits.
 */
public final class RunLogHasher {
    static final int FNV_OFFSET_BASIS = 0x811C9DC5;
    static final int FNV_PRIME = 0x01000193;

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private RunLogHasher() {
        // Utility class
    }

    public static String hash(RunLog runLog) {
        return fnv1a(canonicalize(runLog));
    }

    /** Canonical string form of any Jackson-serializable value. */
    public static String canonicalize(Object value) {
        JsonNode tree = MAPPER.valueToTree(value);
        StringBuilder sb = new StringBuilder(16_384);
        write(tree, sb);
        return sb.toString();
    }

    public static String fnv1a(String text) {
        int hash = FNV_OFFSET_BASIS;
        for (int i = 0; i < text.length(); i++) {
            hash ^= text.charAt(i);
            hash *= FNV_PRIME;
        }
        return String.format(Locale.ROOT, "%08x", hash);
    }

    private static void write(JsonNode node, StringBuilder sb) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            sb.append("null");
        } else if (node.isObject()) {
            List<String> keys = new ArrayList<>(node.size());
            for (Iterator<String> it = node.fieldNames(); it.hasNext();)
                keys.add(it.next());
            keys.sort(null);
            sb.append('{');
            for (int i = 0; i < keys.size(); i++) {
                if (i > 0)
                    sb.append(',');
                appendQuoted(keys.get(i), sb);
                sb.append(':');
                write(node.get(keys.get(i)), sb);
            }
            sb.append('}');
        } else if (node.isArray()) {
            sb.append('[');
            for (int i = 0; i < node.size(); i++) {
                if (i > 0)
                    sb.append(',');
                write(node.get(i), sb);
            }
            sb.append(']');
        } else if (node.isTextual()) {
            appendQuoted(node.textValue(), sb);
        } else if (node.isIntegralNumber()) {
            sb.append(node.bigIntegerValue());
        } else if (node.isNumber()) {
            appendReal(node.doubleValue(), sb);
        } else if (node.isBoolean()) {
            sb.append(node.booleanValue());
        } else {
            throw new IllegalArgumentException("Unsupported JSON node type: " + node.getNodeType());
        }
    }

    private static void appendQuoted(String text, StringBuilder sb) {
        sb.append('"');
        JsonStringEncoder.getInstance().quoteAsString(text, sb);
        sb.append('"');
    }

    static void appendReal(double d, StringBuilder sb) {
        if (!Double.isFinite(d)) {
            sb.append("null");
        } else if (d == Math.rint(d) && Math.abs(d) < 1e15) {
            sb.append((long) d);
        } else {
            sb.append(new BigDecimal(Double.toString(d)).stripTrailingZeros().toPlainString());
        }
    }
}
