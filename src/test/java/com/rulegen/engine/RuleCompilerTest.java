package com.rulegen.engine;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.io.IOException;
import java.net.URISyntaxException;
import java.nio.file.Path;
import java.nio.file.Paths;

import static com.rulegen.engine.ExpressionNode.leaf;
import static org.junit.jupiter.api.Assertions.*;

public class RuleCompilerTest {

    private final RuleCompiler compiler = new RuleCompiler();

    private Path resource(String fileName) throws URISyntaxException {
        return Paths.get(getClass().getResource("/rules/" + fileName).toURI());
    }

    private static String rule(String... featureLines) {
        return "rule:\n  meta:\n    name: test\n  features:\n" + String.join("\n", featureLines) + "\n";
    }

    private ExpressionNode statement(String... featureLines) throws IOException {
        return compiler.compile(rule(featureLines)).statement();
    }

    // ============================================================
    // Rule files
    // ============================================================

    @Test
    public void testCompilesRuleFile() throws Exception {
        Path path = resource("create-file.yml");
        Rule rule = compiler.compile(path);

        assertEquals("create file", rule.name());
        assertEquals("function", rule.scope());
        assertEquals(path, rule.path());
        assertEquals(new ExpressionNode.Or(
                leaf("api", "kernel32.CreateFileA"),
                leaf("api", "kernel32.CreateFileW")), rule.statement());
    }

    @Test
    public void testCompilesNestedRuleFile() throws Exception {
        Rule rule = compiler.compile(resource("xor-loop.yml"));

        assertEquals("basic block", rule.scope());
        assertEquals(new ExpressionNode.And(
                leaf("characteristic", "tight loop"),
                leaf("characteristic", "nzxor"),
                new ExpressionNode.Not(leaf("number", 0L)),
                new ExpressionNode.Range(2, Integer.MAX_VALUE, leaf("mnemonic", "xor"))), rule.statement());
    }

    @Test
    public void testDescriptionsAreNotStatements() throws Exception {
        Rule rule = compiler.compile(resource("write-file.yml"));

        assertEquals(new ExpressionNode.And(
                new ExpressionNode.Or(leaf("api", "kernel32.WriteFile"), leaf("api", "NtWriteFile")),
                new ExpressionNode.Some(0, leaf("number", 0x40000000L))), rule.statement());
    }

    @Test
    public void testFeatureWithDescriptionKey() throws Exception {
        Rule rule = compiler.compile(resource("new-mutex-file.yml"));

        assertEquals(new ExpressionNode.And(
                leaf("string", "foo"),
                leaf("api", "kernel32.CreateFileA"),
                new ExpressionNode.Subscope("basic block", leaf("mnemonic", "cmp"))), rule.statement());
    }

    @Test
    public void testScopeDefaultsToFunction() throws IOException {
        assertEquals("function", compiler.compile(rule("    - api: a")).scope());
        assertNull(compiler.compile(rule("    - api: a")).path());
    }

    // ============================================================
    // Statements
    // ============================================================

    @Test
    public void testNOrMore() throws IOException {
        assertEquals(new ExpressionNode.Some(2, leaf("api", "a"), leaf("api", "b"), leaf("api", "c")),
                statement(
                        "    - 2 or more:",
                        "      - api: a",
                        "      - api: b",
                        "      - api: c"));
    }

    @Test
    public void testSubscopeWithSeveralChildrenIsConjunction() throws IOException {
        assertEquals(new ExpressionNode.Subscope("instruction",
                        new ExpressionNode.And(leaf("mnemonic", "mov"), leaf("offset", 0x10L))),
                statement(
                        "    - instruction:",
                        "      - mnemonic: mov",
                        "      - offset: 0x10"));
    }

    @Test
    public void testEmptyExpressionHasNoChildren() throws IOException {
        assertEquals(new ExpressionNode.Or(), statement("    - or:"));
    }

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
        "3         | 3 | 3",
        "2 or more | 2 | 2147483647",
        "4 or fewer | 0 | 4",
        "'(1, 5)'  | 1 | 5",
    })
    public void testCountForms(String count, int min, int max) throws IOException {
        ExpressionNode expected = new ExpressionNode.Range(min, max, leaf("api", "a"));

        assertEquals(expected, statement("    - count(api(a)): " + count));
    }

    @Test
    public void testCountWithoutValue() throws IOException {
        assertEquals(new ExpressionNode.Range(4, 4, leaf("basic blocks", "")),
                statement("    - count(basic blocks): 4"));
    }

    @Test
    public void testStringFeatures() throws IOException {
        assertEquals(new ExpressionNode.Or(leaf("string", "a = b"), leaf("regex", "/open.*/i")),
                statement(
                        "    - or:",
                        "      - string: a = b",
                        "      - string: /open.*/i"));
    }

    // ============================================================
    // Invalid rules
    // ============================================================

    @Test
    public void testMissingNameIsRejected() {
        assertThrows(InvalidRuleException.class,
                () -> compiler.compile("rule:\n  meta:\n    scope: function\n  features:\n    - api: a\n"));
    }

    @Test
    public void testSeveralTopLevelStatementsAreRejected() {
        assertThrows(InvalidRuleException.class, () -> statement("    - api: a", "    - api: b"));
    }

    @Test
    public void testNotTakesExactlyOneChild() {
        assertThrows(InvalidRuleException.class, () -> statement(
                "    - not:",
                "      - api: a",
                "      - api: b"));
    }

    @Test
    public void testInvalidNumberIsRejected() {
        assertThrows(InvalidRuleException.class, () -> statement("    - number: many"));
    }

    @Test
    public void testInvertedRangeIsRejected() {
        assertThrows(InvalidRuleException.class, () -> statement("    - count(api(a)): (5, 1)"));
    }

    @Test
    public void testEmptyDocumentIsRejected() {
        assertThrows(IOException.class, () -> compiler.compile(""));
    }
}
