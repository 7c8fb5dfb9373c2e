package com.rulegen.cli;

import com.rulegen.editor.RuleEditor;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.File;
import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.concurrent.Callable;

@Command(name = "format", mixinStandardHelpOptions = true,
         description = "Rebuild a rule's features tree and print the regenerated rule")
public class FormatCommand implements Callable<Integer> {
    @Parameters(index = "0", arity = "0..1", description = "Rule file (default: stdin)")
    private File inputFile;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        try {
            String ruleText = inputFile != null
                    ? Files.readString(inputFile.toPath(), StandardCharsets.UTF_8)
                    : new String(System.in.readAllBytes(), StandardCharsets.UTF_8);

            RuleEditor editor = new RuleEditor();
            editor.load(ruleText);
            out.print(editor.updatePreview());
            out.flush();
            return 0;
        } catch (IOException e) {
            spec.commandLine().getErr().println("Error: " + e.getMessage());
            return 1;
        }
    }
}
