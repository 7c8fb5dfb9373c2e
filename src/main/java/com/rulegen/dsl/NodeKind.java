package com.rulegen.dsl;

public enum NodeKind {
    EXPRESSION,
    FEATURE,
    COMMENT
}
