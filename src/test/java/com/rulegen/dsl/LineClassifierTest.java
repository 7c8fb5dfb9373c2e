package com.rulegen.dsl;

import org.eclipse.collections.api.list.MutableList;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

public class LineClassifierTest {

    private final LineClassifier classifier = new LineClassifier();

    // ============================================================
    // Splitting feature, description and comment
    // ============================================================

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
        "'    - and:'                              | - and:                      | ''        | ''",
        "'      - api: CreateFileA # opens file'   | - api: CreateFileA          | ''        | opens file",
        "'      - number: 0x10 = size # flags'     | - number: 0x10              | size      | flags",
        "'# whole line = kept # as is'             | # whole line = kept # as is | ''        | ''",
        "'- count(number(5 = desc)): 3 # note'     | - count(number(5)): 3       | desc      | note",
        "'- count(number(5=desc)): 3'              | - count(number(5=desc)): 3  | ''        | ''",
        "'- count(mnemonic(xor)): 2 or more'       | - count(mnemonic(xor)): 2 or more | '' | ''",
        "'- count(basic blocks): 4 # many'         | - count(basic blocks): 4    | ''        | many",
        "'  description: a = b'                    | description: a              | b         | ''",
    })
    public void testSplitsLine(String line, String feature, String description, String comment) {
        ClassifiedLine classified = classifier.classify(line, 0);

        assertEquals(feature, classified.featureText());
        assertEquals(description, classified.description());
        assertEquals(comment, classified.comment());
    }

    @Test
    public void testCountDescriptionSplitsOnLastSeparator() {
        ClassifiedLine classified = classifier.classify("- count(string(a = b = c)): 2", 0);

        assertEquals("- count(string(a = b)): 2", classified.featureText());
        assertEquals("c", classified.description());
    }

    // ============================================================
    // Classification
    // ============================================================

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
        "- and:               | EXPRESSION",
        "- or:                | EXPRESSION",
        "- not:               | EXPRESSION",
        "- basic block:       | EXPRESSION",
        "- optional:          | EXPRESSION",
        "'# a comment'        | COMMENT",
        "- api: CreateFileA   | FEATURE",
        "- 2 or more:         | FEATURE",
        "- count(api(a)): 2   | FEATURE",
    })
    public void testKindOf(String featureText, NodeKind expected) {
        assertEquals(expected, LineClassifier.kindOf(featureText));
    }

    // ============================================================
    // Indentation
    // ============================================================

    @Test
    public void testIndentCountsLeadingWhitespace() {
        assertEquals(6, LineClassifier.indentOf("      - api: a", 0));
        assertEquals(0, LineClassifier.indentOf("- or:", 4));
        assertEquals(2, LineClassifier.indentOf("\t\t- api: a", 0));
    }

    @Test
    public void testDescriptionLineIsTwoSpacesShallower() {
        assertEquals(6, LineClassifier.indentOf("        description: mutex name", 0));
        assertEquals(0, LineClassifier.indentOf("description: top", 0));
        assertEquals(0, LineClassifier.indentOf(" description: top", 0));
    }

    @Test
    public void testDescriptionItemKeepsItsIndent() {
        assertEquals(8, LineClassifier.indentOf("        - description: and block", 0));
    }

    @Test
    public void testBlankLineInheritsPreviousIndent() {
        assertEquals(6, LineClassifier.indentOf("", 6));
        assertEquals(10, LineClassifier.indentOf("    ", 10));
    }

    @Test
    public void testClassifyAllTracksBlankLines() {
        MutableList<ClassifiedLine> lines = classifier.classifyAll(String.join("\n",
                "- or:",
                "      # first",
                "",
                "        - api: a",
                "   ",
                "      - api: b"));

        assertEquals(6, lines.size());
        assertEquals(0, lines.get(0).indent());
        assertEquals(6, lines.get(1).indent());
        assertEquals(6, lines.get(2).indent());
        assertTrue(lines.get(2).isBlank());
        assertEquals(8, lines.get(3).indent());
        assertEquals(8, lines.get(4).indent());
        assertEquals(6, lines.get(5).indent());
        assertEquals(NodeKind.COMMENT, lines.get(1).kind());
    }

    @Test
    public void testDescriptionLinesAreRecognised() {
        assertTrue(classifier.classify("  description: x", 0).isDescription());
        assertTrue(classifier.classify("  - description: x", 0).isDescription());
        assertFalse(classifier.classify("  - string: description: x", 0).isDescription());
    }
}
