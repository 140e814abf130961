package com.stage.composition.core.model;

import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Descriptor of a reference or payload arc: one target layer file and at most
 * one target prim path inside it. Without a target path the arc points at the
 * target file's default (first root) prim.
 *
 * <p>Four textual shapes normalize to the same descriptor:</p>
 * <pre>
 * &#64;scene.usda&#64;&lt;/World&gt;   full form
 * scene.usda&#64;&lt;/World&gt;    missing leading sigil
 * &#64;scene.usda&#64;           default target
 * scene.usda             bare file name
 * </pre>
 */
public record AssetReference(ReferenceKind kind, String assetPath, String targetPath) {

    private static final Pattern FULL = Pattern.compile("^@+([^@]+)@+<([^>]+)>$");
    private static final Pattern NO_LEADING_SIGIL = Pattern.compile("^([^@]+)@+<([^>]+)>$");
    private static final Pattern DEFAULT_TARGET = Pattern.compile("^@+([^@]+)@+$");
    private static final Pattern BARE_FILE = Pattern.compile(
            "^([^@<>\\s]+\\.(?:usda|usd|usdc))$", Pattern.CASE_INSENSITIVE);

    public AssetReference {
        Objects.requireNonNull(kind, "kind is required");
        Objects.requireNonNull(assetPath, "assetPath is required");
        assetPath = stripSigils(assetPath.trim());
        if (assetPath.isEmpty()) {
            throw new IllegalArgumentException("assetPath must not be blank");
        }
        if (targetPath != null && targetPath.isBlank()) {
            targetPath = null;
        }
    }

    public static AssetReference reference(String assetPath, String targetPath) {
        return new AssetReference(ReferenceKind.REFERENCE, assetPath, targetPath);
    }

    public static AssetReference payload(String assetPath, String targetPath) {
        return new AssetReference(ReferenceKind.PAYLOAD, assetPath, targetPath);
    }

    /**
     * Parses a reference value in any of the accepted shapes.
     * Surrounding whitespace, quotes and list brackets are ignored.
     *
     * @return the descriptor, or empty when the value matches no accepted shape
     */
    public static Optional<AssetReference> parse(ReferenceKind kind, String value) {
        if (value == null) {
            return Optional.empty();
        }
        String ref = value.trim();
        if (ref.startsWith("[") && ref.endsWith("]")) {
            ref = ref.substring(1, ref.length() - 1).trim();
        }
        if (ref.length() >= 2 && ref.startsWith("\"") && ref.endsWith("\"")) {
            ref = ref.substring(1, ref.length() - 1).trim();
        }
        if (ref.isEmpty()) {
            return Optional.empty();
        }

        Matcher m = FULL.matcher(ref);
        if (m.matches()) {
            return Optional.of(new AssetReference(kind, m.group(1), m.group(2)));
        }
        m = NO_LEADING_SIGIL.matcher(ref);
        if (m.matches()) {
            return Optional.of(new AssetReference(kind, m.group(1), m.group(2)));
        }
        m = DEFAULT_TARGET.matcher(ref);
        if (m.matches()) {
            return Optional.of(new AssetReference(kind, m.group(1), null));
        }
        m = BARE_FILE.matcher(ref);
        if (m.matches()) {
            return Optional.of(new AssetReference(kind, m.group(1), null));
        }
        return Optional.empty();
    }

    public boolean hasTargetPath() {
        return targetPath != null;
    }

    public Optional<String> target() {
        return Optional.ofNullable(targetPath);
    }

    /**
     * Canonical text form: {@code @file@<path>} or {@code @file@}.
     */
    public String format() {
        return targetPath != null
                ? "@" + assetPath + "@<" + targetPath + ">"
                : "@" + assetPath + "@";
    }

    private static String stripSigils(String path) {
        int from = 0;
        int to = path.length();
        while (from < to && path.charAt(from) == '@') from++;
        while (to > from && path.charAt(to - 1) == '@') to--;
        return path.substring(from, to);
    }

    @Override
    public String toString() {
        return kind.keyword() + " = " + format();
    }
}
