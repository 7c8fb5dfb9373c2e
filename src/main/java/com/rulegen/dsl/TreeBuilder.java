package com.rulegen.dsl;

import org.eclipse.collections.api.list.ListIterable;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Optional;

/**
 * Rebuilds the features tree from indented lines. The first line becomes the root; every following line is
 * placed by comparing its indent with the child level of the enclosing frames.
 */
public class TreeBuilder {
    private static final Logger log = LoggerFactory.getLogger(TreeBuilder.class);

    static final String DESCRIPTION_KEY = "description:";
    static final String DESCRIPTION_ITEM = "- description:";

    private final LineClassifier classifier = new LineClassifier();

    public Optional<DslNode> build(String ruleText) {
        if (!RuleText.hasFeatures(ruleText)) {
            log.debug("No {} block, nothing to build", RuleText.FEATURES_MARKER);
            return Optional.empty();
        }
        return build(classifier.classifyAll(RuleText.body(ruleText)));
    }

    public Optional<DslNode> build(ListIterable<ClassifiedLine> lines) {
        int first = lines.detectIndex(line -> !line.isBlank());
        if (first < 0) {
            return Optional.empty();
        }

        DslNode root = DslNode.of(lines.get(first));
        MutableList<ClassifiedLine> rest = lines.toList().subList(first + 1, lines.size());
        ClassifiedLine firstChild = rest.detect(line -> !line.isBlank());
        if (firstChild == null) {
            return Optional.of(root);
        }

        Deque<Frame> frames = new ArrayDeque<>();
        frames.push(new Frame(root, firstChild.indent()));
        // blank lines go in front of the next placed line, so they never decide a level themselves
        MutableList<ClassifiedLine> blanks = Lists.mutable.empty();

        for (ClassifiedLine line : rest) {
            if (line.isBlank()) {
                blanks.add(line);
                continue;
            }

            Frame frame = frames.peek();
            if (line.indent() > frame.level()) {
                DslNode last = frame.parent().lastChild();
                if (last != null && last.canHaveChildren()) {
                    frame = new Frame(last, line.indent());
                    frames.push(frame);
                } else {
                    log.debug("Indented line without an expression to nest under: {}", line.featureText());
                }
            } else if (line.indent() < frame.level()) {
                frame = ascend(frames, line);
            }

            DslNode parent = frame.parent();
            blanks.each(blank -> attach(parent, blank));
            blanks.clear();
            attach(parent, line);
        }
        DslNode current = frames.peek().parent();
        blanks.each(blank -> attach(current, blank));

        return Optional.of(root);
    }

    /**
     * Pops back to the open level matching the line's indent. When no level matches, only the innermost level
     * is closed and the line goes to its parent.
     */
    private static Frame ascend(Deque<Frame> frames, ClassifiedLine line) {
        boolean matched = false;
        for (Frame open : frames) {
            if (open.level() == line.indent()) {
                matched = true;
                break;
            }
        }

        if (matched) {
            while (frames.peek().level() != line.indent()) {
                frames.pop();
            }
        } else {
            if (frames.size() > 1) {
                frames.pop();
            }
            log.debug("No level matches indent {} of line {}, attaching to {}",
                    line.indent(), line.featureText(), frames.peek().parent());
        }
        return frames.peek();
    }

    /**
     * Description lines never become nodes: they describe the latest sibling, or the parent when it has none.
     */
    private void attach(DslNode parent, ClassifiedLine line) {
        if (line.isDescription()) {
            DslNode last = parent.lastChild();
            DslNode target = last == null ? parent : last;
            target.setDescription(descriptionText(line));
            return;
        }
        if (!parent.canHaveChildren()) {
            // only possible for the root, which is then the sole node able to hold the line
            log.warn("Root {} cannot have children, dropping {}", parent, line.featureText());
            return;
        }
        parent.addChild(DslNode.of(line));
    }

    static String descriptionText(ClassifiedLine line) {
        String text = line.featureText();
        String prefix = text.startsWith(DESCRIPTION_ITEM) ? DESCRIPTION_ITEM : DESCRIPTION_KEY;
        String description = text.substring(prefix.length()).strip();
        if (!line.description().isEmpty()) {
            description = description + " = " + line.description();
        }
        // the node keeps its own comment, so one on the description line stays part of the description
        if (!line.comment().isEmpty()) {
            description = description + " # " + line.comment();
        }
        return description;
    }

    private record Frame(DslNode parent, int level) {
    }
}
