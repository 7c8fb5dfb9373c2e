package com.rulegen.dsl;

/**
 * Splits rule text at the first {@code features:} marker. Everything up to the marker is an opaque header.
 */
public final class RuleText {
    public static final String FEATURES_MARKER = "features:";
    private static final String SYNTHESIZED_MARKER = "\n  " + FEATURES_MARKER + "\n";

    private RuleText() {
    }

    public static boolean hasFeatures(String ruleText) {
        return ruleText != null && ruleText.contains(FEATURES_MARKER);
    }

    public static String body(String ruleText) {
        if (!hasFeatures(ruleText)) {
            return "";
        }
        return ruleText.substring(ruleText.indexOf(FEATURES_MARKER) + FEATURES_MARKER.length()).strip();
    }

    /**
     * The header up to and including the marker plus a newline, or the whole text with a marker appended.
     */
    public static String header(String ruleText) {
        if (ruleText == null) {
            return SYNTHESIZED_MARKER;
        }
        int marker = ruleText.indexOf(FEATURES_MARKER);
        if (marker < 0) {
            return ruleText.stripTrailing() + SYNTHESIZED_MARKER;
        }
        return ruleText.substring(0, marker + FEATURES_MARKER.length()) + "\n";
    }
}
