package com.rulegen.engine;

import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.impl.factory.Lists;

public sealed interface ExpressionNode {
    record And(ImmutableList<ExpressionNode> children) implements ExpressionNode {
        public And(ExpressionNode... children) {
            this(Lists.immutable.of(children));
        }
    }

    record Or(ImmutableList<ExpressionNode> children) implements ExpressionNode {
        public Or(ExpressionNode... children) {
            this(Lists.immutable.of(children));
        }
    }

    // n-of-m match, count 0 is the optional block
    record Some(int count, ImmutableList<ExpressionNode> children) implements ExpressionNode {
        public Some(int count, ExpressionNode... children) {
            this(count, Lists.immutable.of(children));
        }
    }

    record Not(ExpressionNode child) implements ExpressionNode {}

    record Subscope(String scope, ExpressionNode child) implements ExpressionNode {}

    record Range(int min, int max, ExpressionNode child) implements ExpressionNode {}

    record Leaf(Feature feature) implements ExpressionNode {}

    static Leaf leaf(String name, Object value) {
        return new Leaf(new Feature(name, value));
    }
}
