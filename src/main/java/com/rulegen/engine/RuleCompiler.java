package com.rulegen.engine;

import com.rulegen.yaml.DocNode;
import com.rulegen.yaml.RuleDocumentParser;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

/**
 * Compiles rule documents into expression trees.
 */
public class RuleCompiler {
    private static final Logger log = LoggerFactory.getLogger(RuleCompiler.class);

    private static final String DEFAULT_SCOPE = "function";
    private static final String DESCRIPTION = "description";
    private static final String OR_MORE = " or more";
    private static final String OR_FEWER = " or fewer";
    private static final String COUNT_OPEN = "count(";

    private final RuleDocumentParser parser = new RuleDocumentParser();

    public Rule compile(Path path) throws IOException {
        String source = Files.readString(path, StandardCharsets.UTF_8);
        return compile(source, path);
    }

    public Rule compile(String source) throws IOException {
        return compile(source, null);
    }

    private Rule compile(String source, Path path) throws IOException {
        DocNode document = parser.parse(source);

        DocNode.Mapping rule = requireMapping(asMapping(document, "rule document").get("rule"), "rule");
        DocNode.Mapping meta = requireMapping(rule.get("meta"), "rule.meta");
        String name = requireScalar(meta.get("name"), "rule.meta.name");
        DocNode scopeNode = meta.get("scope");
        String scope = scopeNode instanceof DocNode.Scalar scalar ? scalar.text() : DEFAULT_SCOPE;

        DocNode features = rule.get("features");
        if (!(features instanceof DocNode.Sequence statements) || statements.elements().size() != 1) {
            throw new InvalidRuleException("Rule " + name + " must begin with a single top level statement");
        }

        ExpressionNode statement = buildStatement(statements.elements().getFirst());
        log.debug("Compiled rule {} ({} scope)", name, scope);
        return new Rule(name, scope, statement, path);
    }

    ExpressionNode buildStatement(DocNode node) {
        DocNode.Mapping statement = asMapping(node, "statement");
        String key = statementKey(statement);
        DocNode value = statement.get(key);

        if (key.equals("and")) {
            return new ExpressionNode.And(buildChildren(value, key));
        }
        if (key.equals("or")) {
            return new ExpressionNode.Or(buildChildren(value, key));
        }
        if (key.equals("not")) {
            return new ExpressionNode.Not(single(buildChildren(value, key), key));
        }
        if (key.equals("optional")) {
            return new ExpressionNode.Some(0, buildChildren(value, key));
        }
        if (key.endsWith(OR_MORE)) {
            int count = parseCount(key.substring(0, key.length() - OR_MORE.length()), key);
            return new ExpressionNode.Some(count, buildChildren(value, key));
        }
        if (key.equals("function") || key.equals("basic block") || key.equals("instruction")) {
            ImmutableList<ExpressionNode> children = buildChildren(value, key);
            ExpressionNode child = children.size() == 1 ? children.getFirst() : new ExpressionNode.And(children);
            return new ExpressionNode.Subscope(key, child);
        }
        if (key.startsWith(COUNT_OPEN) && key.endsWith(")")) {
            return buildRange(key, value);
        }
        return new ExpressionNode.Leaf(Feature.parse(key, scalarText(value, key)));
    }

    private ImmutableList<ExpressionNode> buildChildren(DocNode value, String key) {
        if (value instanceof DocNode.Null) {
            return Lists.immutable.empty();
        }
        if (!(value instanceof DocNode.Sequence sequence)) {
            throw new InvalidRuleException("Statement " + key + " must hold a list of children");
        }

        MutableList<ExpressionNode> children = Lists.mutable.empty();
        for (DocNode element : sequence.elements()) {
            if (isDescriptionOnly(element)) {
                continue;
            }
            children.add(buildStatement(element));
        }
        return children.toImmutable();
    }

    private ExpressionNode buildRange(String key, DocNode value) {
        String inner = key.substring(COUNT_OPEN.length(), key.length() - 1).strip();
        Feature feature;
        int open = inner.indexOf('(');
        if (open > 0 && inner.endsWith(")")) {
            feature = Feature.parse(inner.substring(0, open), inner.substring(open + 1, inner.length() - 1));
        } else {
            feature = Feature.parse(inner, "");
        }

        String count = scalarText(value, key).strip();
        int min;
        int max;
        if (count.endsWith(OR_MORE)) {
            min = parseCount(count.substring(0, count.length() - OR_MORE.length()), key);
            max = Integer.MAX_VALUE;
        } else if (count.endsWith(OR_FEWER)) {
            min = 0;
            max = parseCount(count.substring(0, count.length() - OR_FEWER.length()), key);
        } else if (count.startsWith("(") && count.endsWith(")") && count.contains(",")) {
            String[] bounds = count.substring(1, count.length() - 1).split(",", 2);
            min = parseCount(bounds[0], key);
            max = parseCount(bounds[1], key);
        } else {
            min = parseCount(count, key);
            max = min;
        }

        if (max < min) {
            throw new InvalidRuleException("Invalid range for " + key + ": " + count);
        }
        return new ExpressionNode.Range(min, max, new ExpressionNode.Leaf(feature));
    }

    private static String statementKey(DocNode.Mapping statement) {
        for (Map.Entry<String, DocNode> entry : statement.fields().entrySet()) {
            if (!entry.getKey().equals(DESCRIPTION)) {
                return entry.getKey();
            }
        }
        throw new InvalidRuleException("Statement has no feature or expression: " + statement.fields().keySet());
    }

    private static boolean isDescriptionOnly(DocNode element) {
        return element instanceof DocNode.Mapping mapping
                && mapping.fields().size() == 1
                && mapping.fields().containsKey(DESCRIPTION);
    }

    private static ExpressionNode single(ImmutableList<ExpressionNode> children, String key) {
        if (children.size() != 1) {
            throw new InvalidRuleException("Statement " + key + " takes exactly one child, found " + children.size());
        }
        return children.getFirst();
    }

    private static int parseCount(String text, String key) {
        try {
            return Integer.parseInt(text.strip());
        } catch (NumberFormatException e) {
            throw new InvalidRuleException("Invalid count in " + key + ": " + text, e);
        }
    }

    private static String scalarText(DocNode value, String key) {
        if (value instanceof DocNode.Scalar scalar) {
            return scalar.text();
        }
        if (value instanceof DocNode.Null) {
            return "";
        }
        throw new InvalidRuleException("Feature " + key + " must have a scalar value");
    }

    private static DocNode.Mapping asMapping(DocNode node, String what) {
        if (node instanceof DocNode.Mapping mapping) {
            return mapping;
        }
        throw new InvalidRuleException("Expected " + what + " to be a mapping");
    }

    private static DocNode.Mapping requireMapping(DocNode node, String what) {
        if (node == null) {
            throw new InvalidRuleException("Missing " + what);
        }
        return asMapping(node, what);
    }

    private static String requireScalar(DocNode node, String what) {
        if (node instanceof DocNode.Scalar scalar && !scalar.text().isBlank()) {
            return scalar.text();
        }
        throw new InvalidRuleException("Missing " + what);
    }
}
