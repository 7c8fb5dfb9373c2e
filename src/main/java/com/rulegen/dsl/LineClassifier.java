package com.rulegen.dsl;

import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;

public class LineClassifier {
    static final String COMMENT_PREFIX = "#";
    static final String[] EXPRESSION_PREFIXES = {"- and:", "- or:", "- not:", "- basic block:", "- optional:"};

    private static final String COUNT_PREFIX = "- count";
    private static final String DESCRIPTION_WORD = "description";

    public MutableList<ClassifiedLine> classifyAll(String body) {
        MutableList<ClassifiedLine> lines = Lists.mutable.empty();
        int previousIndent = 0;
        for (String line : body.lines().toList()) {
            ClassifiedLine classified = classify(line, previousIndent);
            previousIndent = classified.indent();
            lines.add(classified);
        }
        return lines;
    }

    public ClassifiedLine classify(String line, int previousIndent) {
        int indent = indentOf(line, previousIndent);
        String trimmed = line.strip();

        String feature = trimmed;
        String description = "";
        String comment = "";

        if (trimmed.startsWith(COUNT_PREFIX)) {
            // the '=' inside a count is part of the syntax, so only the comment is split off here
            int hash = trimmed.indexOf('#');
            if (hash >= 0) {
                feature = trimmed.substring(0, hash);
                comment = trimmed.substring(hash + 1);
            }
            CountSyntax counted = CountSyntax.parseWithDescription(feature);
            if (counted != null) {
                feature = counted.render();
                description = counted.description();
            }
        } else if (!trimmed.startsWith(COMMENT_PREFIX)) {
            int hash = trimmed.indexOf('#');
            if (hash >= 0) {
                feature = trimmed.substring(0, hash);
                comment = trimmed.substring(hash + 1);
            }
            int equals = feature.indexOf('=');
            if (equals >= 0) {
                description = feature.substring(equals + 1);
                feature = feature.substring(0, equals);
            }
        }

        feature = feature.strip();
        return new ClassifiedLine(feature, description.strip(), comment.strip(), indent, kindOf(feature));
    }

    /**
     * Leading whitespace of the line. Blank lines keep the previous indent, and description lines count two
     * spaces less since they sit one level under the node they describe.
     */
    public static int indentOf(String line, int previousIndent) {
        String stripped = line.stripLeading();
        if (stripped.isBlank()) {
            return previousIndent;
        }
        int indent = line.length() - stripped.length();
        if (stripped.startsWith(DESCRIPTION_WORD)) {
            indent = Math.max(0, indent - 2);
        }
        return indent;
    }

    public static NodeKind kindOf(String featureText) {
        if (isExpression(featureText)) {
            return NodeKind.EXPRESSION;
        }
        if (featureText.startsWith(COMMENT_PREFIX)) {
            return NodeKind.COMMENT;
        }
        return NodeKind.FEATURE;
    }

    public static boolean isExpression(String featureText) {
        for (String prefix : EXPRESSION_PREFIXES) {
            if (featureText.startsWith(prefix)) {
                return true;
            }
        }
        return false;
    }
}
