package com.rulegen.overlap;

import com.rulegen.engine.Rule;
import com.rulegen.engine.RuleCompiler;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.api.set.MutableSet;
import org.eclipse.collections.impl.factory.Lists;
import org.eclipse.collections.impl.factory.Sets;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Loads the existing rules to check against. Files are compiled in parallel, but rules come back in the order
 * their paths were supplied, directories expanded in sorted order.
 */
public class RuleSetLoader {
    private static final Logger log = LoggerFactory.getLogger(RuleSetLoader.class);

    static final String RULE_SUFFIX = ".yml";
    private static final String GITHUB_DIRECTORY = ".github";

    private final RuleCompiler compiler;

    public RuleSetLoader(RuleCompiler compiler) {
        this.compiler = compiler;
    }

    public LoadedRules load(List<Path> paths) {
        MutableList<RuleLoadWarning> warnings = Lists.mutable.empty();
        MutableList<Path> files = collectRuleFiles(paths, warnings);

        List<Outcome> outcomes = files.parallelStream()
                .map(this::loadRule)
                .collect(Collectors.toList());

        MutableList<Rule> rules = Lists.mutable.empty();
        MutableSet<String> names = Sets.mutable.empty();
        for (Outcome outcome : outcomes) {
            if (outcome.warning() != null) {
                warnings.add(outcome.warning());
            } else if (!names.add(outcome.rule().name())) {
                log.warn("Duplicate rule name {} in {}, keeping the first one", outcome.rule().name(), outcome.rule().path());
            } else {
                rules.add(outcome.rule());
            }
        }

        log.debug("Loaded {} rules from {} files", rules.size(), files.size());
        return new LoadedRules(rules.toImmutable(), warnings.toImmutable());
    }

    MutableList<Path> collectRuleFiles(List<Path> paths, MutableList<RuleLoadWarning> warnings) {
        MutableList<Path> files = Lists.mutable.empty();
        for (Path path : paths) {
            if (!Files.exists(path)) {
                warn(warnings, path, "rule path doesn't exist");
            } else if (Files.isDirectory(path)) {
                try (Stream<Path> walk = Files.walk(path)) {
                    walk.filter(Files::isRegularFile)
                            .filter(file -> !isUnderGithub(path.relativize(file)))
                            .sorted()
                            .forEach(file -> {
                                if (file.getFileName().toString().endsWith(RULE_SUFFIX)) {
                                    files.add(file);
                                } else if (!isIgnorable(file)) {
                                    log.warn("Skipping non-{} file: {}", RULE_SUFFIX, file);
                                }
                            });
                } catch (IOException | UncheckedIOException e) {
                    warn(warnings, path, e.getMessage());
                }
            } else {
                files.add(path);
            }
        }
        return files;
    }

    private Outcome loadRule(Path file) {
        try {
            return new Outcome(compiler.compile(file), null);
        } catch (IOException | RuntimeException e) {
            RuleLoadWarning warning = new RuleLoadWarning(file, e.getClass().getSimpleName() + " " + e.getMessage());
            log.warn("{}", warning);
            return new Outcome(null, warning);
        }
    }

    private static void warn(MutableList<RuleLoadWarning> warnings, Path path, String message) {
        RuleLoadWarning warning = new RuleLoadWarning(path, message);
        log.warn("{}", warning);
        warnings.add(warning);
    }

    private static boolean isUnderGithub(Path relative) {
        for (Path part : relative) {
            if (part.toString().equals(GITHUB_DIRECTORY)) {
                return true;
            }
        }
        return false;
    }

    private static boolean isIgnorable(Path file) {
        String name = file.getFileName().toString();
        return name.startsWith(".git") || name.endsWith(".git") || name.endsWith(".md") || name.endsWith(".txt");
    }

    public record LoadedRules(ImmutableList<Rule> rules, ImmutableList<RuleLoadWarning> warnings) {
    }

    private record Outcome(Rule rule, RuleLoadWarning warning) {
    }
}
