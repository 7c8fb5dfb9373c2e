package com.rulegen.engine;

import org.eclipse.collections.api.list.ListIterable;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Collects the leaf features of an expression in pre-order. Duplicates are kept; callers compare sets.
 */
public class ExpressionFlattener {

    public MutableList<Feature> flatten(ExpressionNode expression) {
        MutableList<Feature> features = Lists.mutable.empty();
        Deque<ExpressionNode> pending = new ArrayDeque<>();
        pending.push(expression);

        while (!pending.isEmpty()) {
            ExpressionNode node = pending.pop();
            if (node instanceof ExpressionNode.Leaf leaf) {
                features.add(leaf.feature());
            } else {
                childrenOf(node).reverseForEach(pending::push);
            }
        }
        return features;
    }

    private static ListIterable<ExpressionNode> childrenOf(ExpressionNode node) {
        if (node instanceof ExpressionNode.And and) {
            return and.children();
        }
        if (node instanceof ExpressionNode.Or or) {
            return or.children();
        }
        if (node instanceof ExpressionNode.Some some) {
            return some.children();
        }
        if (node instanceof ExpressionNode.Not not) {
            return Lists.immutable.of(not.child());
        }
        if (node instanceof ExpressionNode.Subscope subscope) {
            return Lists.immutable.of(subscope.child());
        }
        if (node instanceof ExpressionNode.Range range) {
            return Lists.immutable.of(range.child());
        }
        throw new IllegalArgumentException("Unsupported expression: " + node);
    }
}
