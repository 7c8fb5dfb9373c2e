package com.rulegen.overlap;

import org.eclipse.collections.api.list.ImmutableList;

/**
 * {@code count} is the number of existing rules with at least one feature; {@code overlappingRules} names those
 * sharing a feature with the new rule, in the order the rules were supplied.
 */
public record OverlapResult(int count, ImmutableList<String> overlappingRules, ImmutableList<RuleLoadWarning> warnings) {
}
