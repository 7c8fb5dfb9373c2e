package com.rulegen.engine;

import java.util.Locale;
import java.util.Objects;

/**
 * An atomic rule feature. Two features are the same when name and value are equal; integer valued features
 * ({@code number}, {@code offset}) hold a {@link Long} so {@code 0x10} and {@code 16} compare equal.
 */
public record Feature(String name, Object value) {
    private static final String STRING = "string";
    private static final String REGEX = "regex";
    private static final String INLINE_DESCRIPTION = " = ";

    public Feature {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(value, "value");
    }

    /**
     * Builds a feature from a rule's {@code name: value} pair, dropping an inline {@code value = description}
     * on every feature but {@code string}.
     */
    public static Feature parse(String name, String rawValue) {
        String key = name.strip().toLowerCase(Locale.ROOT);
        String value = rawValue == null ? "" : rawValue.strip();

        if (key.equals(STRING)) {
            if (isRegex(value)) {
                return new Feature(REGEX, value);
            }
            return new Feature(STRING, value);
        }

        int description = value.indexOf(INLINE_DESCRIPTION);
        if (description >= 0) {
            value = value.substring(0, description).strip();
        }

        if (isInteger(key)) {
            return new Feature(key, parseInteger(key, value));
        }
        return new Feature(key, value);
    }

    public String valueString() {
        if (value instanceof Long number) {
            return number < 0 ? String.format("-0x%X", -number) : String.format("0x%X", number);
        }
        return value.toString();
    }

    /**
     * The feature as it is written in a rule, e.g. {@code api: CreateFileA}.
     */
    public String toRuleSyntax() {
        return name + ": " + valueString();
    }

    @Override
    public String toString() {
        String text = valueString();
        return text.isEmpty() ? name : name + "(" + text + ")";
    }

    private static boolean isRegex(String value) {
        return value.length() > 2 && value.startsWith("/") && (value.endsWith("/") || value.endsWith("/i"));
    }

    // number/x32 style keys carry an architecture suffix
    private static boolean isInteger(String key) {
        String base = key.contains("/") ? key.substring(0, key.indexOf('/')) : key;
        return base.equals("number") || base.equals("offset");
    }

    private static long parseInteger(String key, String text) {
        String digits = text;
        boolean negative = digits.startsWith("-");
        if (negative) {
            digits = digits.substring(1);
        }
        try {
            long parsed = digits.startsWith("0x") || digits.startsWith("0X")
                    ? Long.parseLong(digits.substring(2), 16)
                    : Long.parseLong(digits);
            return negative ? -parsed : parsed;
        } catch (NumberFormatException e) {
            throw new InvalidRuleException("Invalid " + key + " value: " + text, e);
        }
    }
}
