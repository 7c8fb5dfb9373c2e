package com.rulegen.editor;

import com.rulegen.dsl.DslNode;
import com.rulegen.dsl.LineClassifier;
import com.rulegen.dsl.NodeKind;
import com.rulegen.dsl.TreeBuilder;
import com.rulegen.dsl.TreeSerializer;
import com.rulegen.engine.Feature;
import org.eclipse.collections.api.bag.MutableBag;
import org.eclipse.collections.api.list.ListIterable;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.Consumer;

/**
 * Editing model behind a rule editor view: the rule text shown in the preview and the features tree built from
 * it. Every change to the tree regenerates the preview and notifies the listeners.
 */
public class RuleEditor {
    private static final Logger log = LoggerFactory.getLogger(RuleEditor.class);

    static final String DEFAULT_ROOT = "- or:";

    private final TreeBuilder builder = new TreeBuilder();
    private final TreeSerializer serializer = new TreeSerializer();
    private final MutableList<Consumer<String>> listeners = Lists.mutable.empty();

    private String previewText = "";
    private DslNode root;

    public void addListener(Consumer<String> listener) {
        listeners.add(listener);
    }

    public String preview() {
        return previewText;
    }

    public DslNode root() {
        return root;
    }

    public boolean isEmpty() {
        return root == null;
    }

    /**
     * Replaces the tree with the features of {@code ruleText}. The preview keeps the text as given.
     */
    public void load(String ruleText) {
        previewText = ruleText == null ? "" : ruleText;
        root = builder.build(previewText).orElse(null);
        log.debug("Loaded rule with {} nodes", root == null ? 0 : root.preOrder().size());
    }

    public void loadDefaultHeader(String author, String scope, String sampleMd5, Long address) {
        previewText = RuleHeaderTemplate.render(author, scope, sampleMd5, address);
    }

    public void clear() {
        root = null;
        updatePreview();
    }

    public String updatePreview() {
        previewText = serializer.serialize(previewText, root);
        listeners.each(listener -> listener.accept(previewText));
        return previewText;
    }

    /**
     * Appends features under the root, creating an {@code - or:} root first when the tree is empty. Features
     * listed once are added as-is, repeated ones as a single count.
     */
    public void addFeatures(ListIterable<Feature> features) {
        if (root == null) {
            root = DslNode.expression(DEFAULT_ROOT);
        }

        MutableBag<Feature> counts = features.toBag();
        ListIterable<Feature> distinct = features.distinct();

        distinct.select(feature -> counts.occurrencesOf(feature) == 1)
                .each(feature -> root.addChild(DslNode.feature("- " + feature.toRuleSyntax())));
        distinct.select(feature -> counts.occurrencesOf(feature) > 1)
                .each(feature -> root.addChild(
                        DslNode.feature("- count(" + feature + "): " + counts.occurrencesOf(feature))));

        updatePreview();
    }

    /**
     * Moves the given feature and comment nodes into a new expression appended under the root.
     */
    public DslNode nest(String expressionText, ListIterable<DslNode> nodes) {
        requireExpression(expressionText);
        if (root == null) {
            throw new IllegalStateException("No features to nest");
        }

        DslNode expression = DslNode.expression(expressionText);
        root.addChild(expression);
        nodes.reject(node -> node.canHaveChildren() || node.isBlank()).each(expression::addChild);

        updatePreview();
        return expression;
    }

    public void modifyExpression(DslNode expression, String expressionText) {
        requireExpression(expressionText);
        if (expression.kind() != NodeKind.EXPRESSION) {
            throw new IllegalArgumentException("Not an expression: " + expression.featureText());
        }
        expression.setFeatureText(expressionText);
        updatePreview();
    }

    public void setDescription(DslNode node, String description) {
        node.setDescription(description);
        updatePreview();
    }

    public void setComment(DslNode node, String comment) {
        node.setComment(comment);
        updatePreview();
    }

    public void move(DslNode node, DslNode newParent, int index) {
        if (node == root) {
            throw new IllegalArgumentException("The root cannot be moved");
        }
        if (!newParent.canHaveChildren()) {
            throw new IllegalArgumentException("Cannot drop onto " + newParent.kind() + " node " + newParent.featureText());
        }
        if (node == newParent || node.isAncestorOf(newParent)) {
            throw new IllegalArgumentException("Cannot move " + node.featureText() + " under itself");
        }

        node.detach();
        newParent.addChild(Math.min(Math.max(index, 0), newParent.children().size()), node);
        updatePreview();
    }

    public void remove(DslNode node) {
        if (node == root) {
            root = null;
        } else {
            node.detach();
        }
        updatePreview();
    }

    public MutableList<DslNode> features() {
        return allNodes().reject(node -> node.canHaveChildren() || node.isBlank());
    }

    public MutableList<DslNode> expressions() {
        return allNodes().select(DslNode::canHaveChildren);
    }

    private MutableList<DslNode> allNodes() {
        return root == null ? Lists.mutable.empty() : root.preOrder();
    }

    private static void requireExpression(String expressionText) {
        if (!LineClassifier.isExpression(expressionText)) {
            throw new IllegalArgumentException("Not an expression: " + expressionText);
        }
    }
}
