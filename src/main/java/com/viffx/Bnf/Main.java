package com.viffx.Bnf;

import com.viffx.Bnf.Compiler.Compiler;
import com.viffx.Bnf.Compiler.SymbolizationLimitException;
import com.viffx.Bnf.Grammar.Grammar;
import com.viffx.Bnf.Grammar.GrammarLoader;
import com.viffx.Bnf.Tokens.Token;
import com.viffx.Bnf.Utils.AstPrinter;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

@Command(
        name = "bnf",
        mixinStandardHelpOptions = true,
        version = "bnf 0.1.0",
        description = {
                "Symbolizes text with a grammar file and prints the result.",
                "",
                "A grammar file holds one rule per 'priority N => <name> ::= ...' header,",
                "rules may continue on the following lines. Lines starting with # are comments.",
        })
public class Main implements Callable<Integer> {
    private static final Logger log = LogManager.getLogger(Main.class);

    @Parameters(index = "0", paramLabel = "GRAMMAR", description = "the grammar file")
    Path grammarFile;

    @Parameters(index = "1..*", arity = "1..*", paramLabel = "TEXT", description = "the texts to symbolize")
    List<String> texts;

    @Option(names = {"-t", "--tree"}, description = "print the token tree of each text")
    boolean tree;

    @Option(names = "--max-passes", defaultValue = "0", paramLabel = "N",
            description = "give up after N symbolization passes (default: ${DEFAULT-VALUE}, no limit)")
    int maxPasses;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    public static void main(String[] args) {
        int exitCode = new CommandLine(new Main()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        Grammar grammar;
        try {
            grammar = GrammarLoader.load(grammarFile);
        } catch (IOException e) {
            log.debug("cannot load grammar {}", grammarFile, e);
            err.println("cannot load grammar " + grammarFile + ": " + e.getMessage());
            return 1;
        }
        grammar.withPassLimit(maxPasses);
        Compiler compiler = new Compiler(grammar);

        for (String text : texts) {
            List<Token> roots;
            try {
                roots = grammar.symbolize(text);
            } catch (SymbolizationLimitException e) {
                err.println(text + ": " + e.getMessage());
                return 2;
            }
            out.println("text:   " + text);
            if (tree) out.print(AstPrinter.toString(roots));
            out.println("roots:  " + roots.size() + (roots.size() == 1 ? " (single root)" : ""));
            out.println("output: " + compiler.compile(roots));
        }
        out.flush();
        return 0;
    }
}
