package com.rulegen.overlap;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.nio.file.Path;

public class OverlapReportFormatter {
    private final JsonFactory factory = new JsonFactory();

    public String format(Path newRulePath, OverlapResult result) {
        StringBuilder sb = new StringBuilder();
        sb.append("\n");
        sb.append("New rule path : ").append(newRulePath).append("\n");
        sb.append("Number of rules checked : ").append(result.count()).append("\n");

        if (result.overlappingRules().isEmpty()) {
            sb.append("Paths to overlapping rules : None\n");
        } else {
            sb.append("Paths to overlapping rules :\n");
            result.overlappingRules().each(name -> sb.append("- ").append(name).append("\n"));
        }

        sb.append("Number of rules containing same features : ")
          .append(result.overlappingRules().size())
          .append("\n");
        return sb.toString();
    }

    public String toJson(OverlapResult result) {
        StringWriter out = new StringWriter();
        try (JsonGenerator generator = factory.createGenerator(out)) {
            generator.useDefaultPrettyPrinter();
            generator.writeStartObject();

            generator.writeArrayFieldStart("overlapping_rules");
            for (String name : result.overlappingRules()) {
                generator.writeString(name);
            }
            generator.writeEndArray();

            generator.writeNumberField("count", result.count());

            generator.writeArrayFieldStart("warnings");
            for (RuleLoadWarning warning : result.warnings()) {
                generator.writeStartObject();
                generator.writeStringField("path", warning.path().toString());
                generator.writeStringField("message", warning.message());
                generator.writeEndObject();
            }
            generator.writeEndArray();

            generator.writeEndObject();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return out.toString();
    }
}
