package com.stage.composition.parse;

import com.stage.composition.core.model.PropertyValue;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Resolves raw property value text into a typed {@link PropertyValue}, guided by the declared type.
 */
public final class ValueParser {

    private static final Set<String> NUMERIC_TYPES = Set.of(
            "float", "double", "half", "int", "uint", "int64", "uint64", "uchar", "timecode");

    private static final Set<String> STRING_TYPES = Set.of("string", "token", "asset");

    private static final Pattern TUPLE = Pattern.compile(
            "\\(\\s*([-+]?[\\d.eE+-]+)\\s*,\\s*([-+]?[\\d.eE+-]+)\\s*,\\s*([-+]?[\\d.eE+-]+)\\s*\\)");

    private static final Pattern QUOTED = Pattern.compile("\"((?:[^\"\\\\]|\\\\.)*)\"|'((?:[^'\\\\]|\\\\.)*)'");

    private ValueParser() {
    }

    /**
     * @param typeName declared type token, may be null for untyped values
     * @param raw      value text as written after the {@code =}
     */
    public static PropertyValue parse(String typeName, String raw) {
        String value = raw == null ? "" : raw.trim();
        String type = typeName == null ? "" : typeName.toLowerCase(Locale.ROOT);

        if (type.startsWith("color3") || type.startsWith("float3") || type.startsWith("double3")) {
            Matcher m = TUPLE.matcher(value);
            if (m.find()) {
                Double r = toNumber(m.group(1));
                Double g = toNumber(m.group(2));
                Double b = toNumber(m.group(3));
                if (r != null && g != null && b != null) {
                    return new PropertyValue.ColorValue(r, g, b);
                }
            }
            return PropertyValue.of(value);
        }
        if (type.equals("string[]") || type.equals("token[]")) {
            return new PropertyValue.StringArrayValue(quotedItems(value));
        }
        if (type.equals("bool")) {
            if ("true".equalsIgnoreCase(value) || "1".equals(value)) {
                return PropertyValue.of(true);
            }
            if ("false".equalsIgnoreCase(value) || "0".equals(value)) {
                return PropertyValue.of(false);
            }
            return PropertyValue.of(value);
        }
        if (NUMERIC_TYPES.contains(type)) {
            Double number = toNumber(value);
            return number != null ? PropertyValue.of(number) : PropertyValue.of(value);
        }
        if (STRING_TYPES.contains(type)) {
            return PropertyValue.of(unquote(value));
        }

        if (isQuoted(value)) {
            return PropertyValue.of(unquote(value));
        }
        Double number = toNumber(value);
        return number != null ? PropertyValue.of(number) : PropertyValue.of(value);
    }

    /**
     * Removes one level of surrounding quotes (or asset sigils) and resolves escapes.
     */
    public static String unquote(String value) {
        String v = value.trim();
        if (v.length() >= 6 && (v.startsWith("\"\"\"") && v.endsWith("\"\"\"")
                || v.startsWith("'''") && v.endsWith("'''"))) {
            return v.substring(3, v.length() - 3);
        }
        if (isQuoted(v)) {
            return unescape(v.substring(1, v.length() - 1));
        }
        if (v.length() >= 2 && v.startsWith("@") && v.endsWith("@")) {
            return v.substring(1, v.length() - 1);
        }
        return v;
    }

    /**
     * Escapes a string for writing between double quotes.
     */
    public static String escape(String value) {
        return value.replace("\\", "\\\\").replace("\"", "\\\"");
    }

    private static String unescape(String value) {
        if (value.indexOf('\\') < 0) {
            return value;
        }
        StringBuilder sb = new StringBuilder(value.length());
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c == '\\' && i + 1 < value.length()) {
                char next = value.charAt(++i);
                switch (next) {
                    case 'n' -> sb.append('\n');
                    case 't' -> sb.append('\t');
                    default -> sb.append(next);
                }
            } else {
                sb.append(c);
            }
        }
        return sb.toString();
    }

    private static boolean isQuoted(String v) {
        return v.length() >= 2
                && (v.startsWith("\"") && v.endsWith("\"") || v.startsWith("'") && v.endsWith("'"));
    }

    private static List<String> quotedItems(String value) {
        List<String> items = new ArrayList<>();
        Matcher m = QUOTED.matcher(value);
        while (m.find()) {
            String item = m.group(1) != null ? m.group(1) : m.group(2);
            items.add(unescape(item));
        }
        return items;
    }

    private static Double toNumber(String value) {
        if (value == null || value.isEmpty()) {
            return null;
        }
        try {
            return Double.parseDouble(value);
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
