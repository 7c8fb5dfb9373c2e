package com.rulegen.yaml;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.eclipse.collections.impl.factory.Lists;
import org.eclipse.collections.impl.map.mutable.MapAdapter;

import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.util.LinkedHashMap;

public class RuleDocumentParser {
    private final YAMLFactory factory = new YAMLFactory();

    public DocNode parse(String source) throws IOException {
        return parse(new StringReader(source));
    }

    public DocNode parse(Reader input) throws IOException {
        try (JsonParser parser = factory.createParser(input)) {
            JsonToken token = parser.nextToken();
            if (token == null) {
                throw new IOException("Empty rule document");
            }
            return parseValue(parser, token);
        }
    }

    private DocNode parseValue(JsonParser parser, JsonToken token) throws IOException {
        if (token == null) {
            throw new IOException("Unexpected end of rule document");
        }
        return switch (token) {
            case START_OBJECT -> parseMapping(parser);
            case START_ARRAY -> parseSequence(parser);
            case VALUE_STRING, VALUE_NUMBER_INT, VALUE_NUMBER_FLOAT, VALUE_TRUE, VALUE_FALSE ->
                    new DocNode.Scalar(parser.getText());
            case VALUE_NULL -> new DocNode.Null();
            default -> throw new IOException("Unexpected YAML token: " + token);
        };
    }

    private DocNode.Mapping parseMapping(JsonParser parser) throws IOException {
        var fields = MapAdapter.adapt(new LinkedHashMap<String, DocNode>());

        JsonToken token;
        while ((token = parser.nextToken()) != JsonToken.END_OBJECT) {
            if (token != JsonToken.FIELD_NAME) {
                throw new IOException("Expected a key but found " + token);
            }
            String key = parser.getCurrentName();
            fields.put(key, parseValue(parser, parser.nextToken()));
        }

        return new DocNode.Mapping(fields);
    }

    private DocNode.Sequence parseSequence(JsonParser parser) throws IOException {
        var elements = Lists.mutable.<DocNode>empty();

        JsonToken token;
        while ((token = parser.nextToken()) != JsonToken.END_ARRAY) {
            elements.add(parseValue(parser, token));
        }

        return new DocNode.Sequence(elements);
    }
}
