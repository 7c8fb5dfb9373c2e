package com.rulegen.dsl;

import java.util.ArrayDeque;
import java.util.Deque;

public class TreeSerializer {
    private static final int BASE_INDENT = 4;
    private static final int INDENT_STEP = 2;
    private static final String STRING_PREFIX = "- string";
    private static final String COUNT_PREFIX = "- count";
    private static final String STRING_FEATURE = "string";

    /**
     * Renders the header of {@code ruleText} followed by the tree, one node per line (two for nodes whose
     * description goes on its own line). A null root renders the header alone.
     */
    public String serialize(String ruleText, DslNode root) {
        StringBuilder sb = new StringBuilder(RuleText.header(ruleText));
        if (root == null) {
            return sb.toString();
        }

        Deque<Positioned> pending = new ArrayDeque<>();
        pending.push(new Positioned(root, 0));
        while (!pending.isEmpty()) {
            Positioned current = pending.pop();
            formatNode(current.node(), current.depth(), sb);
            current.node().children().reverseForEach(child -> pending.push(new Positioned(child, current.depth() + 1)));
        }
        return sb.toString();
    }

    public String format(DslNode node, int depth) {
        StringBuilder sb = new StringBuilder();
        formatNode(node, depth, sb);
        return sb.toString();
    }

    private void formatNode(DslNode node, int depth, StringBuilder sb) {
        String indent = " ".repeat(INDENT_STEP * depth + BASE_INDENT);
        String nested = indent + " ".repeat(INDENT_STEP);
        String feature = node.featureText();
        String description = node.description();
        String comment = commentSuffix(node.comment());

        if (node.isBlank()) {
            line(sb, "");
            return;
        }

        if (node.kind() == NodeKind.COMMENT || feature.startsWith(LineClassifier.COMMENT_PREFIX)) {
            line(sb, indent + feature);
            return;
        }

        if (description.isEmpty()) {
            line(sb, indent + feature + comment);
            return;
        }

        CountSyntax counted = feature.startsWith(COUNT_PREFIX) ? CountSyntax.parse(feature) : null;
        if (node.kind() == NodeKind.EXPRESSION || LineClassifier.isExpression(feature)) {
            line(sb, indent + feature + comment);
            line(sb, nested + TreeBuilder.DESCRIPTION_ITEM + " " + description);
        } else if (feature.startsWith(STRING_PREFIX)) {
            line(sb, indent + feature + comment);
            line(sb, nested + TreeBuilder.DESCRIPTION_KEY + " " + description);
        } else if (counted != null) {
            if (STRING_FEATURE.equals(counted.name())) {
                line(sb, indent + feature + comment);
                line(sb, nested + TreeBuilder.DESCRIPTION_KEY + " " + description);
            } else {
                line(sb, indent + counted.renderWithDescription(description) + comment);
            }
        } else {
            // plain leaves and counts that do not have the count(name(value)) shape
            line(sb, indent + feature + " = " + description + comment);
        }
    }

    private static String commentSuffix(String comment) {
        return comment.isEmpty() ? "" : " # " + comment;
    }

    private static void line(StringBuilder sb, String text) {
        sb.append(text).append('\n');
    }

    private record Positioned(DslNode node, int depth) {
    }
}
