package com.rulegen.yaml;

import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.api.map.MutableMap;

public sealed interface DocNode {
    record Mapping(MutableMap<String, DocNode> fields) implements DocNode {
        public DocNode get(String key) {
            return fields.get(key);
        }
    }

    record Sequence(MutableList<DocNode> elements) implements DocNode {}

    // scalars keep the text exactly as written, number and boolean resolution is left to the reader
    record Scalar(String text) implements DocNode {}

    record Null() implements DocNode {}
}
