package com.rulegen.dsl;

/**
 * Structural matcher for counted features: {@code - count(<name>(<value>)): <count>}, where the value may carry
 * an embedded description as {@code <value> = <description>}.
 */
public record CountSyntax(String name, String value, String description, String count) {
    static final String PREFIX = "- count(";
    private static final String CLOSE = ")):";

    /**
     * Matches {@code - count(<name>(<value>)): <count>}. The value is returned as written, including any
     * embedded description. Returns null when the text does not have that shape.
     */
    public static CountSyntax parse(String text) {
        if (text == null || !text.startsWith(PREFIX)) {
            return null;
        }

        int nameEnd = PREFIX.length();
        while (nameEnd < text.length() && isAsciiLetter(text.charAt(nameEnd))) {
            nameEnd++;
        }
        if (nameEnd == PREFIX.length() || nameEnd >= text.length() || text.charAt(nameEnd) != '(') {
            return null;
        }

        int close = text.lastIndexOf(CLOSE);
        if (close <= nameEnd + 1) {
            return null;
        }

        String count = text.substring(close + CLOSE.length()).trim();
        if (count.isEmpty()) {
            return null;
        }

        return new CountSyntax(text.substring(PREFIX.length(), nameEnd), text.substring(nameEnd + 1, close), "", count);
    }

    /**
     * Matches {@code - count(<name>(<value> = <description>)): <count>}. The separator is the last {@code =}
     * with whitespace on both sides. Returns null when there is no embedded description.
     */
    public static CountSyntax parseWithDescription(String text) {
        CountSyntax counted = parse(text);
        if (counted == null) {
            return null;
        }

        String inner = counted.value();
        int separator = findDescriptionSeparator(inner);
        if (separator < 0) {
            return null;
        }

        String value = inner.substring(0, separator).trim();
        String description = inner.substring(separator + 1).trim();
        if (value.isEmpty() || description.isEmpty()) {
            return null;
        }
        return new CountSyntax(counted.name(), value, description, counted.count());
    }

    public String render() {
        return PREFIX + name + "(" + value + ")): " + count;
    }

    public String renderWithDescription(String description) {
        return PREFIX + name + "(" + value + " = " + description + ")): " + count;
    }

    private static int findDescriptionSeparator(String inner) {
        for (int i = inner.length() - 2; i >= 1; i--) {
            if (inner.charAt(i) == '='
                    && Character.isWhitespace(inner.charAt(i - 1))
                    && Character.isWhitespace(inner.charAt(i + 1))) {
                return i;
            }
        }
        return -1;
    }

    private static boolean isAsciiLetter(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
    }
}
