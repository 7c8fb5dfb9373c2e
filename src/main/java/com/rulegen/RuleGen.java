package com.rulegen;

import ch.qos.logback.classic.Level;
import com.rulegen.cli.FormatCommand;
import com.rulegen.cli.NewRuleCommand;
import com.rulegen.cli.OverlapCommand;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

import java.util.concurrent.Callable;

@Command(name = "rulegen", mixinStandardHelpOptions = true, version = "1.0",
         description = "Edit rule feature trees and find rules with overlapping features",
         subcommands = {FormatCommand.class, NewRuleCommand.class, OverlapCommand.class})
public class RuleGen implements Callable<Integer> {
    @Spec
    private CommandSpec spec;

    @Option(names = {"-v", "--verbose"}, description = "Log debug output to stderr")
    void setVerbose(boolean verbose) {
        if (verbose && LoggerFactory.getLogger("com.rulegen") instanceof ch.qos.logback.classic.Logger logger) {
            logger.setLevel(Level.DEBUG);
        }
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new RuleGen()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() {
        spec.commandLine().usage(spec.commandLine().getOut());
        return 0;
    }
}
