package io.tisgrid.vm;

import java.util.List;
import java.util.Map;

/**
 * Renders the keyed trees produced by {@link AstNode#toTree()} as JSON.
 * Used for debug output only.
 */
public final class AstJson {

    private AstJson() {}

    public static String toJson(AstNode node) {
        return toJson(node.toTree());
    }

    static String toJson(Object v) {
        if (v == null) return "null";
        if (v instanceof String) {
            return "\"" + escapeJson((String) v) + "\"";
        }
        if (v instanceof Number || v instanceof Boolean) return v.toString();
        if (v instanceof List) {
            StringBuilder sb = new StringBuilder("[");
            List<?> list = (List<?>) v;
            for (int i = 0; i < list.size(); i++) {
                if (i > 0) sb.append(",");
                sb.append(toJson(list.get(i)));
            }
            sb.append("]");
            return sb.toString();
        }
        if (v instanceof Map) {
            StringBuilder sb = new StringBuilder("{");
            boolean first = true;
            for (Map.Entry<?, ?> e : ((Map<?, ?>) v).entrySet()) {
                if (!first) sb.append(",");
                first = false;
                sb.append("\"").append(escapeJson(String.valueOf(e.getKey()))).append("\":");
                sb.append(toJson(e.getValue()));
            }
            sb.append("}");
            return sb.toString();
        }
        throw new IllegalArgumentException("Not a tree value: " + v.getClass().getName());
    }

    private static final char[] HEX = "0123456789abcdef".toCharArray();

    // Quote, backslash and control characters; everything else passes through
    private static String escapeJson(String s) {
        StringBuilder sb = new StringBuilder(s.length() + 8);
        for (char c : s.toCharArray()) {
            if (c == '"' || c == '\\') {
                sb.append('\\').append(c);
            } else if (c == '\n') {
                sb.append("\\n");
            } else if (c == '\r') {
                sb.append("\\r");
            } else if (c == '\t') {
                sb.append("\\t");
            } else if (c < 0x20) {
                sb.append("\\u00").append(HEX[c >> 4]).append(HEX[c & 0xf]);
            } else {
                sb.append(c);
            }
        }
        return sb.toString();
    }
}
