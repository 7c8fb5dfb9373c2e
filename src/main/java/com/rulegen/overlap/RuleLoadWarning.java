package com.rulegen.overlap;

import java.nio.file.Path;

public record RuleLoadWarning(Path path, String message) {
    @Override
    public String toString() {
        return "Error: " + path + " " + message;
    }
}
