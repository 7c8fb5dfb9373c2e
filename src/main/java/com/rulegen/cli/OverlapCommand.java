package com.rulegen.cli;

import com.rulegen.engine.InvalidRuleException;
import com.rulegen.overlap.OverlapDetector;
import com.rulegen.overlap.OverlapReportFormatter;
import com.rulegen.overlap.OverlapResult;
import com.rulegen.overlap.RuleFileNameException;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

@Command(name = "overlap", mixinStandardHelpOptions = true,
         description = "Find existing rules sharing features with a new rule")
public class OverlapCommand implements Callable<Integer> {
    @Parameters(index = "0", description = "Path to the new rule (.yml)")
    private Path newRule;

    @Parameters(index = "1..*", arity = "1..*", description = "Rule files or directories to check against")
    private List<Path> rules;

    @Option(names = {"-j", "--json"}, description = "Print the result as JSON")
    private boolean json = false;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        try {
            OverlapResult result = new OverlapDetector().findOverlappingRules(newRule, rules);

            OverlapReportFormatter formatter = new OverlapReportFormatter();
            out.println(json ? formatter.toJson(result) : formatter.format(newRule, result));
            out.flush();
            return 0;
        } catch (RuleFileNameException | InvalidRuleException e) {
            spec.commandLine().getErr().println("Error: " + e.getMessage());
            return 1;
        }
    }
}
