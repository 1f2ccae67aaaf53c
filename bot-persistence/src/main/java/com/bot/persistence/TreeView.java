package com.bot.persistence;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Renders a data tree (nested maps and lists) as indented text lines for inspection, e.g.
 * <pre>
 * ├── config
 * │   └── greeting: hello
 * └── counters
 *     ├── [0]: 1
 *     └── [1]: 2
 * </pre>
 */
public final class TreeView {

    private static final String BRANCH = "├── ";
    private static final String LAST_BRANCH = "└── ";
    private static final String PIPE = "│   ";
    private static final String SPACE = "    ";
    // Map.entry rejects null values
    private static final Object NULL_MARKER = new Object();

    private TreeView() {
    }

    /** Returns one line per node; an empty tree renders as {@code (empty)}. */
    public static List<String> render(Object root) {
        List<String> lines = new ArrayList<>();
        if (isEmptyContainer(root)) {
            lines.add("(empty)");
            return lines;
        }
        if (!(root instanceof Map) && !(root instanceof Collection)) {
            lines.add(String.valueOf(root));
            return lines;
        }
        renderChildren(root, "", lines);
        return lines;
    }

    private static void renderChildren(Object node, String prefix, List<String> lines) {
        List<Map.Entry<String, Object>> children = childrenOf(node);
        Iterator<Map.Entry<String, Object>> it = children.iterator();
        while (it.hasNext()) {
            Map.Entry<String, Object> child = it.next();
            boolean last = !it.hasNext();
            Object value = child.getValue();
            String connector = last ? LAST_BRANCH : BRANCH;
            if ((value instanceof Map || value instanceof Collection) && !isEmptyContainer(value)) {
                lines.add(prefix + connector + child.getKey());
                renderChildren(value, prefix + (last ? SPACE : PIPE), lines);
            } else {
                lines.add(prefix + connector + child.getKey() + ": " + leafText(value));
            }
        }
    }

    private static List<Map.Entry<String, Object>> childrenOf(Object node) {
        List<Map.Entry<String, Object>> out = new ArrayList<>();
        if (node instanceof Map<?, ?> map) {
            for (Map.Entry<?, ?> e : map.entrySet()) {
                out.add(Map.entry(String.valueOf(e.getKey()), nullSafe(e.getValue())));
            }
        } else if (node instanceof Collection<?> collection) {
            int i = 0;
            for (Object item : collection) {
                out.add(Map.entry("[" + i++ + "]", nullSafe(item)));
            }
        }
        return out;
    }

    private static String leafText(Object value) {
        if (value instanceof Map) return "{}";
        if (value instanceof Collection) return "[]";
        if (value == NULL_MARKER) return "null";
        return String.valueOf(value);
    }

    private static boolean isEmptyContainer(Object value) {
        if (value == null) return true;
        if (value instanceof Map<?, ?> map) return map.isEmpty();
        if (value instanceof Collection<?> collection) return collection.isEmpty();
        return false;
    }

    private static Object nullSafe(Object value) {
        return value != null ? value : NULL_MARKER;
    }
}
