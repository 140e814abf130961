package com.stage.composition.core;

import java.util.regex.Pattern;

/**
 * Input validation for identifiers that end up written into layer text.
 */
public final class PrimNameValidator {

    /** Maximum allowed length for prim and property names. */
    public static final int MAX_NAME_LENGTH = 256;

    private static final Pattern PRIM_NAME = Pattern.compile("^[A-Za-z_][A-Za-z0-9_]*$");
    private static final Pattern PROPERTY_NAME = Pattern.compile("^[A-Za-z_][A-Za-z0-9_:.]*$");

    private PrimNameValidator() {
        // utility class
    }

    /**
     * Validates a prim name: a letter or underscore followed by letters, digits or underscores.
     *
     * @throws ValidationException if the name is invalid
     */
    public static void validatePrimName(String name) {
        if (name == null || name.isBlank()) {
            throw new ValidationException("Prim name must not be null or blank", "name", name);
        }
        if (name.length() > MAX_NAME_LENGTH) {
            throw new ValidationException(
                    "Prim name exceeds maximum length of " + MAX_NAME_LENGTH +
                            " characters (was " + name.length() + ")", "name", name);
        }
        if (!PRIM_NAME.matcher(name).matches()) {
            throw new ValidationException(
                    "Invalid prim name. Must start with letter or underscore and contain only " +
                            "alphanumeric characters and underscores, got: '" + name + "'", "name", name);
        }
    }

    public static boolean isValidPrimName(String name) {
        return name != null && name.length() <= MAX_NAME_LENGTH && PRIM_NAME.matcher(name).matches();
    }

    /**
     * Validates a property name, namespaced names ({@code ns:name}) included.
     *
     * @throws ValidationException if the name is invalid
     */
    public static void validatePropertyName(String name) {
        if (name == null || name.isBlank()) {
            throw new ValidationException("Property name must not be null or blank", "propertyName", name);
        }
        if (!PROPERTY_NAME.matcher(name).matches()) {
            throw new ValidationException(
                    "Invalid property name, got: '" + name + "'", "propertyName", name);
        }
    }

    /**
     * Validates a layer file path.
     *
     * @throws ValidationException if the path is null, blank or contains control characters
     */
    public static void validateFilePath(String filePath) {
        if (filePath == null || filePath.isBlank()) {
            throw new ValidationException("File path is required", "filePath", filePath);
        }
        if (containsControlCharacters(filePath)) {
            throw new ValidationException("File path must not contain control characters", "filePath", filePath);
        }
    }

    private static boolean containsControlCharacters(String s) {
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c < 0x20 || c == 0x7F) {
                return true;
            }
        }
        return false;
    }
}
