package com.stage.composition.core.model;

import java.util.Locale;
import java.util.Optional;

/**
 * How a prim block contributes to the stage.
 * Each specifier has a canonical keyword and a long-form alias.
 */
public enum Specifier {

    /** Defines a new prim. */
    DEFINE("def", "define"),

    /** Modifies or extends a prim defined elsewhere. */
    OVERRIDE("over", "override"),

    /** Abstract prim that is not rendered on its own. */
    CLASS("class", "class");

    private final String keyword;
    private final String alias;

    Specifier(String keyword, String alias) {
        this.keyword = keyword;
        this.alias = alias;
    }

    /**
     * Canonical keyword written by the composer.
     */
    public String keyword() {
        return keyword;
    }

    public String alias() {
        return alias;
    }

    /**
     * Parses a specifier keyword, accepting both the canonical and the long form.
     */
    public static Optional<Specifier> fromKeyword(String token) {
        if (token == null) {
            return Optional.empty();
        }
        String lower = token.trim().toLowerCase(Locale.ROOT);
        for (Specifier specifier : values()) {
            if (specifier.keyword.equals(lower) || specifier.alias.equals(lower)) {
                return Optional.of(specifier);
            }
        }
        return Optional.empty();
    }
}
