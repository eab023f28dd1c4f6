/*
 * The MIT License
 *
 * Copyright 2025 Karate Labs Inc.
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in
 * all copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN
 * THE SOFTWARE.
 */
package io.asserting.output;

import java.lang.reflect.Array;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Renders values into the representation shown in failure messages and diffed
 * between actual and expected. Strings are quoted and escaped, characters are
 * single-quoted, iterables and arrays render as {@code [a, b]}, maps as
 * {@code {k: v}}. Everything else uses {@code toString()}.
 */
public final class Debug {

    private Debug() {
        // only static methods
    }

    public static String format(Object value) {
        StringBuilder sb = new StringBuilder();
        append(sb, value);
        return sb.toString();
    }

    public static void append(StringBuilder sb, Object value) {
        if (value == null) {
            sb.append("null");
        } else if (value instanceof CharSequence cs) {
            appendQuoted(sb, cs.toString());
        } else if (value instanceof Character c) {
            appendQuoted(sb, c.charValue());
        } else if (value instanceof Map<?, ?> map) {
            sb.append('{');
            Iterator<? extends Map.Entry<?, ?>> iterator = map.entrySet().iterator();
            while (iterator.hasNext()) {
                appendEntry(sb, iterator.next());
                if (iterator.hasNext()) {
                    sb.append(", ");
                }
            }
            sb.append('}');
        } else if (value instanceof Optional<?> optional) {
            if (optional.isPresent()) {
                sb.append("Optional[");
                append(sb, optional.get());
                sb.append(']');
            } else {
                sb.append("Optional.empty");
            }
        } else {
            List<Object> items = toList(value);
            if (items == null) {
                sb.append(value);
            } else {
                sb.append('[');
                for (int i = 0; i < items.size(); i++) {
                    if (i > 0) {
                        sb.append(", ");
                    }
                    append(sb, items.get(i));
                }
                sb.append(']');
            }
        }
    }

    static void appendEntry(StringBuilder sb, Map.Entry<?, ?> entry) {
        append(sb, entry.getKey());
        sb.append(": ");
        append(sb, entry.getValue());
    }

    /**
     * Returns the elements of an {@link Iterable} or an array (of objects or
     * primitives) as a list, or null if the value is neither.
     */
    public static List<Object> toList(Object value) {
        if (value instanceof Iterable<?> iterable) {
            List<Object> list = new ArrayList<>();
            for (Object o : iterable) {
                list.add(o);
            }
            return list;
        }
        if (value != null && value.getClass().isArray()) {
            int length = Array.getLength(value);
            List<Object> list = new ArrayList<>(length);
            for (int i = 0; i < length; i++) {
                list.add(Array.get(value, i));
            }
            return list;
        }
        return null;
    }

    public static String quote(String s) {
        StringBuilder sb = new StringBuilder(s.length() + 2);
        appendQuoted(sb, s);
        return sb.toString();
    }

    private static void appendQuoted(StringBuilder sb, String s) {
        sb.append('"');
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c == '"') {
                sb.append("\\\"");
            } else {
                appendEscaped(sb, c);
            }
        }
        sb.append('"');
    }

    private static void appendQuoted(StringBuilder sb, char c) {
        sb.append('\'');
        if (c == '\'') {
            sb.append("\\'");
        } else {
            appendEscaped(sb, c);
        }
        sb.append('\'');
    }

    private static void appendEscaped(StringBuilder sb, char c) {
        switch (c) {
            case '\\' -> sb.append("\\\\");
            case '\n' -> sb.append("\\n");
            case '\r' -> sb.append("\\r");
            case '\t' -> sb.append("\\t");
            case '\b' -> sb.append("\\b");
            case '\f' -> sb.append("\\f");
            default -> {
                if (Character.isISOControl(c)) {
                    sb.append(String.format("\\u%04x", (int) c));
                } else {
                    sb.append(c);
                }
            }
        }
    }

}
