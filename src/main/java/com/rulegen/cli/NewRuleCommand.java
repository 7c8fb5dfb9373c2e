package com.rulegen.cli;

import com.rulegen.editor.RuleEditor;
import com.rulegen.engine.Feature;
import com.rulegen.engine.InvalidRuleException;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

@Command(name = "new", mixinStandardHelpOptions = true,
         description = "Print a new rule from the default header and the given features")
public class NewRuleCommand implements Callable<Integer> {
    @Option(names = {"-a", "--author"}, required = true, description = "Rule author")
    private String author;

    @Option(names = {"-s", "--scope"}, defaultValue = "function", description = "Rule scope (default: ${DEFAULT-VALUE})")
    private String scope;

    @Option(names = {"-m", "--md5"}, required = true, description = "MD5 of the sample the rule was written for")
    private String md5;

    @Option(names = {"--address"}, description = "Address in the sample, e.g. 0x401000")
    private String address;

    @Option(names = {"-f", "--feature"}, description = "Feature as name:value, repeat for counts")
    private List<String> features = new ArrayList<>();

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        try {
            RuleEditor editor = new RuleEditor();
            editor.loadDefaultHeader(author, scope, md5, parseAddress(address));

            if (features.isEmpty()) {
                out.print(editor.updatePreview());
            } else {
                MutableList<Feature> parsed = Lists.mutable.empty();
                for (String feature : features) {
                    parsed.add(parseFeature(feature));
                }
                editor.addFeatures(parsed);
                out.print(editor.preview());
            }
            out.flush();
            return 0;
        } catch (IllegalArgumentException | InvalidRuleException e) {
            spec.commandLine().getErr().println("Error: " + e.getMessage());
            return 1;
        }
    }

    static Feature parseFeature(String text) {
        int colon = text.indexOf(':');
        if (colon <= 0) {
            throw new IllegalArgumentException("Feature must be written as name:value: " + text);
        }
        return Feature.parse(text.substring(0, colon), text.substring(colon + 1));
    }

    private static Long parseAddress(String text) {
        if (text == null || text.isBlank()) {
            return null;
        }
        String digits = text.strip();
        if (digits.startsWith("0x") || digits.startsWith("0X")) {
            return Long.parseLong(digits.substring(2), 16);
        }
        return Long.parseLong(digits);
    }
}
