package com.rulegen.engine;

import java.nio.file.Path;

/**
 * A compiled rule. {@code path} is null for rules compiled from text.
 */
public record Rule(String name, String scope, ExpressionNode statement, Path path) {
}
