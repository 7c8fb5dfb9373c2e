package com.rulegen.overlap;

import org.eclipse.collections.impl.factory.Lists;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.nio.file.Paths;

import static org.junit.jupiter.api.Assertions.*;

public class OverlapReportFormatterTest {

    private final OverlapReportFormatter formatter = new OverlapReportFormatter();
    private final Path newRule = Paths.get("rules", "new.yml");

    @Test
    public void testReportWithOverlaps() {
        OverlapResult result = new OverlapResult(3, Lists.immutable.of("X", "Y"), Lists.immutable.empty());

        assertEquals("\n"
                + "New rule path : " + newRule + "\n"
                + "Number of rules checked : 3\n"
                + "Paths to overlapping rules :\n"
                + "- X\n"
                + "- Y\n"
                + "Number of rules containing same features : 2\n", formatter.format(newRule, result));
    }

    @Test
    public void testReportWithoutOverlaps() {
        OverlapResult result = new OverlapResult(5, Lists.immutable.empty(), Lists.immutable.empty());

        String report = formatter.format(newRule, result);

        assertTrue(report.contains("Paths to overlapping rules : None\n"));
        assertTrue(report.endsWith("Number of rules containing same features : 0\n"));
    }

    @Test
    public void testJson() {
        OverlapResult result = new OverlapResult(2, Lists.immutable.of("X"),
                Lists.immutable.of(new RuleLoadWarning(Paths.get("bad.yml"), "broken")));

        String json = formatter.toJson(result).replaceAll("\\s+", "");

        assertEquals("{\"overlapping_rules\":[\"X\"],\"count\":2,"
                + "\"warnings\":[{\"path\":\"bad.yml\",\"message\":\"broken\"}]}", json);
    }
}
