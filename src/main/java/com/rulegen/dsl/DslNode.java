package com.rulegen.dsl;

import org.eclipse.collections.api.list.ListIterable;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;

/**
 * Editable node of a rule's features tree. Only expression nodes own children; the parent link is a back
 * reference maintained by {@link #addChild(int, DslNode)} and {@link #detach()}.
 */
public final class DslNode {
    private final NodeKind kind;
    private String featureText;
    private String description;
    private String comment;
    private final MutableList<DslNode> children = Lists.mutable.empty();
    private DslNode parent;

    public DslNode(NodeKind kind, String featureText, String description, String comment) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.featureText = clean(featureText);
        this.description = clean(description);
        this.comment = clean(comment);
    }

    public static DslNode of(ClassifiedLine line) {
        return new DslNode(line.kind(), line.featureText(), line.description(), line.comment());
    }

    public static DslNode expression(String featureText) {
        return new DslNode(NodeKind.EXPRESSION, featureText, "", "");
    }

    public static DslNode feature(String featureText) {
        return new DslNode(NodeKind.FEATURE, featureText, "", "");
    }

    public static DslNode comment(String text) {
        return new DslNode(NodeKind.COMMENT, text, "", "");
    }

    public static DslNode blank() {
        return new DslNode(NodeKind.FEATURE, "", "", "");
    }

    public NodeKind kind() {
        return kind;
    }

    public String featureText() {
        return featureText;
    }

    public void setFeatureText(String featureText) {
        this.featureText = clean(featureText);
    }

    public String description() {
        return description;
    }

    public void setDescription(String description) {
        this.description = clean(description);
    }

    public String comment() {
        return comment;
    }

    public void setComment(String comment) {
        this.comment = clean(comment);
    }

    /**
     * A blank line of the features block, kept so the text can be written back with it.
     */
    public boolean isBlank() {
        return kind == NodeKind.FEATURE && featureText.isEmpty() && description.isEmpty() && comment.isEmpty();
    }

    public boolean canHaveChildren() {
        return kind == NodeKind.EXPRESSION;
    }

    public ListIterable<DslNode> children() {
        return children.asUnmodifiable();
    }

    /**
     * The last child that is not a blank line, or null.
     */
    public DslNode lastChild() {
        return children.asReversed().detect(child -> !child.isBlank());
    }

    public DslNode parent() {
        return parent;
    }

    public boolean isRoot() {
        return parent == null;
    }

    public int depth() {
        int depth = 0;
        for (DslNode node = parent; node != null; node = node.parent) {
            depth++;
        }
        return depth;
    }

    public DslNode root() {
        DslNode node = this;
        while (node.parent != null) {
            node = node.parent;
        }
        return node;
    }

    public boolean isAncestorOf(DslNode other) {
        for (DslNode node = other.parent; node != null; node = node.parent) {
            if (node == this) {
                return true;
            }
        }
        return false;
    }

    public void addChild(DslNode child) {
        addChild(children.size(), child);
    }

    /**
     * Inserts the child at the given position, taking it away from its current parent first.
     */
    public void addChild(int index, DslNode child) {
        if (!canHaveChildren()) {
            throw new IllegalStateException(kind + " node cannot have children: " + featureText);
        }
        if (child == this || child.isAncestorOf(this)) {
            throw new IllegalArgumentException("Cannot move a node under itself: " + child.featureText);
        }
        child.detach();
        if (index < 0 || index > children.size()) {
            throw new IndexOutOfBoundsException("Child index " + index + " out of range 0.." + children.size());
        }
        children.add(index, child);
        child.parent = this;
    }

    public void detach() {
        if (parent != null) {
            parent.children.remove(this);
            parent = null;
        }
    }

    /**
     * This node and all of its descendants, depth-first, parents before children.
     */
    public MutableList<DslNode> preOrder() {
        MutableList<DslNode> nodes = Lists.mutable.empty();
        Deque<DslNode> pending = new ArrayDeque<>();
        pending.push(this);
        while (!pending.isEmpty()) {
            DslNode node = pending.pop();
            nodes.add(node);
            node.children.reverseForEach(pending::push);
        }
        return nodes;
    }

    @Override
    public String toString() {
        return kind + "[" + featureText + "]";
    }

    private static String clean(String text) {
        return text == null ? "" : text.strip();
    }
}
