package com.rulegen.dsl;

/**
 * One physical line of the features block split into its parts, with the indent used to place it in the tree.
 */
public record ClassifiedLine(String featureText, String description, String comment, int indent, NodeKind kind) {

    public boolean isBlank() {
        return featureText.isEmpty() && description.isEmpty() && comment.isEmpty();
    }

    public boolean isDescription() {
        return featureText.startsWith(TreeBuilder.DESCRIPTION_KEY)
                || featureText.startsWith(TreeBuilder.DESCRIPTION_ITEM);
    }
}
