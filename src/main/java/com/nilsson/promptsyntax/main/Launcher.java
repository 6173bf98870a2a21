package com.nilsson.promptsyntax.main;

import com.google.inject.Guice;
import com.google.inject.Injector;
import com.nilsson.promptsyntax.model.Conjunction;
import com.nilsson.promptsyntax.model.ParsingException;
import com.nilsson.promptsyntax.service.ConjunctionJsonWriter;
import com.nilsson.promptsyntax.service.PromptParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.inject.Inject;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 <h2>Launcher</h2>
 <p>
 Command-line entry point of the <b>Prompt Syntax Toolkit</b>. Reads a prompt, parses it and prints
 the result as JSON.
 </p>
 * <h3>Usage:</h3>
 <ul>
 <li>{@code prompt-syntax [--legacy] [--tree] <prompt words...>}</li>
 <li>With no prompt words the prompt is read from standard input.</li>
 <li>{@code --legacy} accepts the colon-weighted blend notation.</li>
 <li>{@code --tree} prints the parse tree before flattening.</li>
 </ul>
 * <h3>Exit codes:</h3>
 <p>
 {@code 0} on success, {@code 1} for invalid prompt syntax, {@code 2} for any other failure.
 </p>
 */
public class Launcher {

    private static final Logger logger = LoggerFactory.getLogger(Launcher.class);

    static final String FLAG_LEGACY = "--legacy";
    static final String FLAG_TREE = "--tree";

    private final PromptParser parser;
    private final ConjunctionJsonWriter writer;

    @Inject
    public Launcher(PromptParser parser, ConjunctionJsonWriter writer) {
        this.parser = parser;
        this.writer = writer;
    }

    // ------------------------------------------------------------------------
    // Entry Point
    // ------------------------------------------------------------------------

    public static void main(String[] args) {
        Injector injector = Guice.createInjector(new AppModule());
        Launcher launcher = injector.getInstance(Launcher.class);
        int status = launcher.run(args, System.in, System.out, System.err);
        if (status != 0) {
            System.exit(status);
        }
    }

    /**
     Runs one invocation of the tool.
     * @return the process exit code.
     */
    public int run(String[] args, InputStream in, PrintStream out, PrintStream err) {
        boolean legacy = false;
        boolean tree = false;
        List<String> words = new ArrayList<>();
        for (String arg : args) {
            if (FLAG_LEGACY.equals(arg)) {
                legacy = true;
            } else if (FLAG_TREE.equals(arg)) {
                tree = true;
            } else {
                words.add(arg);
            }
        }

        try {
            String prompt = words.isEmpty()
                    ? new String(in.readAllBytes(), StandardCharsets.UTF_8).strip()
                    : String.join(" ", words);

            Conjunction result;
            if (tree) {
                result = parser.parseTree(prompt);
            } else if (legacy) {
                result = parser.parseWithLegacySupport(prompt);
            } else {
                result = parser.parseConjunction(prompt);
            }
            out.println(writer.write(result));
            return 0;
        } catch (ParsingException e) {
            if (e.getNear() == null) {
                err.println("Invalid prompt syntax: " + e.getMessage());
            } else {
                err.println("Invalid prompt syntax near '" + e.getNear() + "': " + e.getMessage());
            }
            return 1;
        } catch (IOException | RuntimeException e) {
            logger.error("Failed to process prompt", e);
            err.println("Error: " + e.getMessage());
            return 2;
        }
    }
}
