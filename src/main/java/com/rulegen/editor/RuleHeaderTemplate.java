package com.rulegen.editor;

import com.rulegen.dsl.RuleText;

import java.util.Locale;

/**
 * Metadata block written at the top of a newly generated rule, ending in the features marker.
 */
public final class RuleHeaderTemplate {
    private RuleHeaderTemplate() {
    }

    public static String render(String author, String scope, String sampleMd5, Long address) {
        String example = address != null
                ? String.format("      - %s:0x%X", sampleMd5.toUpperCase(Locale.ROOT), address)
                : String.format("      - %s", sampleMd5.toUpperCase(Locale.ROOT));

        return String.join("\n",
                "# generated using capa explorer for IDA Pro",
                "rule:",
                "  meta:",
                "    name: <insert_name>",
                "    namespace: <insert_namespace>",
                "    author: " + author,
                "    scope: " + scope,
                "    references: <insert_references>",
                "    examples:",
                example,
                "  " + RuleText.FEATURES_MARKER);
    }
}
