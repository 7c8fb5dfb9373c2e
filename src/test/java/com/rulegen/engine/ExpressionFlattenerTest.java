package com.rulegen.engine;

import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;
import org.junit.jupiter.api.Test;

import static com.rulegen.engine.ExpressionNode.leaf;
import static org.junit.jupiter.api.Assertions.*;

public class ExpressionFlattenerTest {

    private final ExpressionFlattener flattener = new ExpressionFlattener();

    @Test
    public void testLeafFlattensToItself() {
        assertEquals(Lists.mutable.of(new Feature("api", "CreateFileA")),
                flattener.flatten(leaf("api", "CreateFileA")));
    }

    @Test
    public void testCombinatorsContributeChildrenInPreOrder() {
        ExpressionNode expression = new ExpressionNode.And(
                leaf("api", "a"),
                new ExpressionNode.Or(
                        leaf("api", "b"),
                        new ExpressionNode.Not(leaf("string", "c"))),
                new ExpressionNode.Some(2,
                        leaf("number", 1L),
                        new ExpressionNode.Subscope("basic block", leaf("mnemonic", "xor")),
                        new ExpressionNode.Range(2, Integer.MAX_VALUE, leaf("characteristic", "nzxor"))));

        MutableList<Feature> features = flattener.flatten(expression);

        assertEquals(Lists.mutable.of(
                new Feature("api", "a"),
                new Feature("api", "b"),
                new Feature("string", "c"),
                new Feature("number", 1L),
                new Feature("mnemonic", "xor"),
                new Feature("characteristic", "nzxor")), features);
    }

    @Test
    public void testDuplicatesAreKept() {
        ExpressionNode expression = new ExpressionNode.Or(
                leaf("api", "a"),
                new ExpressionNode.And(leaf("api", "a"), leaf("api", "a")));

        assertEquals(3, flattener.flatten(expression).size());
        assertEquals(1, flattener.flatten(expression).toSet().size());
    }

    @Test
    public void testEmptyCombinatorsHaveNoFeatures() {
        ExpressionNode expression = new ExpressionNode.Or(
                new ExpressionNode.And(),
                new ExpressionNode.Some(0));

        assertTrue(flattener.flatten(expression).isEmpty());
    }

    @Test
    public void testLeafCountMatchesStructure() {
        ExpressionNode expression = leaf("api", "x");
        for (int i = 0; i < 500; i++) {
            expression = i % 2 == 0
                    ? new ExpressionNode.And(expression, leaf("number", (long) i))
                    : new ExpressionNode.Not(expression);
        }

        assertEquals(251, flattener.flatten(expression).size());
        assertEquals(new Feature("api", "x"), flattener.flatten(expression).getFirst());
    }
}
