package com.rulegen.overlap;

import com.rulegen.engine.ExpressionFlattener;
import com.rulegen.engine.Feature;
import com.rulegen.engine.InvalidRuleException;
import com.rulegen.engine.Rule;
import com.rulegen.engine.RuleCompiler;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.api.set.MutableSet;
import org.eclipse.collections.impl.factory.Lists;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Finds existing rules that share at least one leaf feature with a new rule.
 */
public class OverlapDetector {
    private static final Logger log = LoggerFactory.getLogger(OverlapDetector.class);

    private final RuleCompiler compiler;
    private final RuleSetLoader loader;
    private final ExpressionFlattener flattener = new ExpressionFlattener();

    public OverlapDetector() {
        this(new RuleCompiler());
    }

    public OverlapDetector(RuleCompiler compiler) {
        this.compiler = compiler;
        this.loader = new RuleSetLoader(compiler);
    }

    public OverlapResult findOverlappingRules(Path newRulePath, List<Path> rulePaths) {
        if (!newRulePath.toString().endsWith(RuleSetLoader.RULE_SUFFIX)) {
            throw new RuleFileNameException(newRulePath, RuleSetLoader.RULE_SUFFIX);
        }

        Rule newRule = loadNewRule(newRulePath);
        MutableSet<Feature> newFeatures = flattener.flatten(newRule.statement()).toSet();
        log.debug("New rule {} has {} distinct features", newRule.name(), newFeatures.size());

        RuleSetLoader.LoadedRules existing = loader.load(rulePaths);

        int count = 0;
        MutableList<String> overlapping = Lists.mutable.empty();
        for (Rule rule : existing.rules()) {
            MutableList<Feature> features = flattener.flatten(rule.statement());
            if (features.isEmpty()) {
                log.debug("Skipping rule {} without features", rule.name());
                continue;
            }
            count++;
            if (features.anySatisfy(newFeatures::contains)) {
                overlapping.add(rule.name());
            }
        }

        return new OverlapResult(count, overlapping.toImmutable(), existing.warnings());
    }

    private Rule loadNewRule(Path path) {
        try {
            return compiler.compile(path);
        } catch (IOException | InvalidRuleException e) {
            throw new InvalidRuleException("Failed to load new rule " + path + ": " + e.getMessage(), e);
        }
    }
}
