package com.litequery.output;

import com.litequery.ast.QueryAst;

import java.util.List;
import java.util.Map;

/**
 * Writes a query AST as JSON text in the engine's wire format.
 */
public class OutputFormatter {
    private final boolean prettyPrint;

    // StringBuilder pool for performance
    private static final ThreadLocal<StringBuilder> STRING_BUILDER_POOL =
        ThreadLocal.withInitial(() -> new StringBuilder(512));

    public OutputFormatter(boolean prettyPrint) {
        this.prettyPrint = prettyPrint;
    }

    public String format(QueryAst node) {
        StringBuilder sb = STRING_BUILDER_POOL.get();
        sb.setLength(0);

        formatValue(node.toPlain(), 0, sb);

        return sb.toString();
    }

    private void formatValue(Object value, int indent, StringBuilder sb) {
        if (value instanceof List<?> list) {
            formatArray(list, indent, sb);
        } else if (value instanceof Map<?, ?> map) {
            formatObject(map, indent, sb);
        } else if (value == null) {
            sb.append("null");
        } else if (value instanceof Number || value instanceof Boolean) {
            sb.append(value);
        } else {
            sb.append('"').append(escapeString(value.toString())).append('"');
        }
    }

    private void formatArray(List<?> elements, int indent, StringBuilder sb) {
        if (elements.isEmpty()) {
            sb.append("[]");
            return;
        }

        // Short operand lists of scalars stay on one line
        if (!prettyPrint || elements.stream().noneMatch(e -> e instanceof List<?> || e instanceof Map<?, ?>)) {
            sb.append('[');
            boolean first = true;
            for (Object element : elements) {
                if (!first) {
                    sb.append(prettyPrint ? ", " : ",");
                }
                first = false;
                formatValue(element, indent, sb);
            }
            sb.append(']');
            return;
        }

        String indentStr = " ".repeat(indent);
        sb.append("[\n");

        boolean first = true;
        for (Object element : elements) {
            if (!first) {
                sb.append(",\n");
            }
            first = false;

            sb.append(indentStr).append("  ");
            formatValue(element, indent + 2, sb);
        }

        sb.append('\n').append(indentStr).append(']');
    }

    private void formatObject(Map<?, ?> fields, int indent, StringBuilder sb) {
        if (fields.isEmpty()) {
            sb.append("{}");
            return;
        }

        String indentStr = " ".repeat(indent);
        sb.append(prettyPrint ? "{\n" : "{");

        boolean first = true;
        for (Map.Entry<?, ?> entry : fields.entrySet()) {
            if (!first) {
                sb.append(prettyPrint ? ",\n" : ",");
            }
            first = false;

            if (prettyPrint) {
                sb.append(indentStr).append("  ");
            }
            sb.append('"').append(escapeString(String.valueOf(entry.getKey()))).append(prettyPrint ? "\": " : "\":");
            formatValue(entry.getValue(), indent + 2, sb);
        }

        if (prettyPrint) {
            sb.append('\n').append(indentStr);
        }
        sb.append('}');
    }

    private String escapeString(String s) {
        // Fast path: if no escaping needed, return original
        boolean needsEscaping = false;
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c == '\\' || c == '"' || c < 0x20) {
                needsEscaping = true;
                break;
            }
        }

        if (!needsEscaping) {
            return s;
        }

        StringBuilder result = new StringBuilder(s.length() + 16);
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            switch (c) {
                case '\\' -> result.append("\\\\");
                case '"'  -> result.append("\\\"");
                case '\n' -> result.append("\\n");
                case '\r' -> result.append("\\r");
                case '\t' -> result.append("\\t");
                default   -> {
                    if (c < 0x20) {
                        result.append(String.format("\\u%04x", (int) c));
                    } else {
                        result.append(c);
                    }
                }
            }
        }
        return result.toString();
    }
}
