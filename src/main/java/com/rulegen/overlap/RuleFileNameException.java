package com.rulegen.overlap;

import java.nio.file.Path;

/**
 * Raised before any I/O when the rule to check does not have the rule file suffix.
 */
public class RuleFileNameException extends IllegalArgumentException {
    public RuleFileNameException(Path path, String suffix) {
        super("New rule file name doesn't end with " + suffix + ": " + path);
    }
}
