package com.stage.composition.parse;

import com.stage.composition.core.model.AssetReference;
import com.stage.composition.core.model.ReferenceKind;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts {@code references} / {@code payload} directives from a metadata block or a prim body.
 */
final class ReferenceParser {

    private static final Pattern DIRECTIVE = Pattern.compile(
            "(?m)(?:^|[\\s(;])(?:(?:prepend|append|add|delete)\\s+)?(references|payload)\\s*=\\s*"
                    + "(\\[[^\\]]*\\]|\"[^\"]*\"|[^\\s)]+)");

    private ReferenceParser() {
    }

    /**
     * First directive of the given kind found in the text.
     */
    static Optional<AssetReference> find(String text, ReferenceKind kind) {
        if (text == null || text.isEmpty()) {
            return Optional.empty();
        }
        Matcher m = DIRECTIVE.matcher(text);
        while (m.find()) {
            if (!m.group(1).equals(kind.keyword())) {
                continue;
            }
            Optional<AssetReference> ref = AssetReference.parse(kind, firstItem(m.group(2)));
            if (ref.isPresent()) {
                return ref;
            }
        }
        return Optional.empty();
    }

    // Only single-target arcs are modeled: a list contributes its first entry.
    private static String firstItem(String value) {
        String v = value.trim();
        if (v.startsWith("[") && v.endsWith("]")) {
            v = v.substring(1, v.length() - 1).trim();
            int comma = v.indexOf(',');
            if (comma >= 0) {
                v = v.substring(0, comma).trim();
            }
        }
        return v;
    }
}
