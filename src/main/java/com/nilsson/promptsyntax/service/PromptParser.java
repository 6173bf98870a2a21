package com.nilsson.promptsyntax.service;

import com.nilsson.promptsyntax.data.ParserSettings;
import com.nilsson.promptsyntax.model.Blend;
import com.nilsson.promptsyntax.model.Conjunction;
import com.nilsson.promptsyntax.model.FlattenedPrompt;
import com.nilsson.promptsyntax.model.Fragment;
import com.nilsson.promptsyntax.model.ParsingException;
import com.nilsson.promptsyntax.service.legacy.LegacyBlendParser;
import com.nilsson.promptsyntax.service.parser.PromptFlattener;
import com.nilsson.promptsyntax.service.parser.PromptGrammar;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.inject.Inject;
import java.util.Optional;

/**
 <h2>PromptParser</h2>
 <p>
 Entry point of the prompt syntax toolkit. Parsing and flattening are exposed as one call,
 {@link #parseConjunction(String)}; the unflattened tree is available through {@link #parseTree(String)}
 for tools that want to inspect it.
 </p>

 <h3>Threading:</h3>
 <p>
 The parser keeps no per-call state, so a single instance is shared by the whole application.
 </p>
 */
public class PromptParser {

    private static final Logger logger = LoggerFactory.getLogger(PromptParser.class);

    private final ParserSettings settings;
    private final PromptGrammar grammar;
    private final PromptFlattener flattener;
    private final LegacyBlendParser legacyParser;

    @Inject
    public PromptParser(ParserSettings settings) {
        this.settings = settings;
        this.grammar = new PromptGrammar(settings);
        this.flattener = new PromptFlattener();
        this.legacyParser = new LegacyBlendParser(grammar, flattener);
    }

    public PromptParser() {
        this(ParserSettings.defaults());
    }

    // ------------------------------------------------------------------------
    // Public API
    // ------------------------------------------------------------------------

    /**
     Parses and flattens a prompt.
     * @param prompt the raw prompt text; {@code null} is treated as empty.

     @return a {@link Conjunction} of {@link FlattenedPrompt}s and blends of them. Blank input gives
     a single prompt holding one empty fragment.
     @throws ParsingException on explicit operator misuse.
     */
    public Conjunction parseConjunction(String prompt) {
        if (prompt == null || prompt.isBlank()) {
            return Conjunction.of(FlattenedPrompt.of(Fragment.empty()));
        }
        Conjunction flattened = flattener.flatten(parseTree(prompt));
        if (settings.logParseTrees()) {
            logger.debug("Flattened prompt: {}", flattened);
        }
        return flattened;
    }

    /**
     Parses a prompt without flattening it.
     */
    public Conjunction parseTree(String prompt) {
        Conjunction tree = grammar.parse(prompt);
        if (settings.logParseTrees()) {
            logger.debug("Parsed '{}' into {}", prompt, tree);
        }
        if (tree.parts().size() > 1) {
            logger.info("Prompt has {} conjunction parts; conditioning uses only the first", tree.parts().size());
        }
        return tree;
    }

    /**
     Reads {@code text} in the legacy {@code text:weight} notation.
     * @return the blend, or empty if the text has fewer than two weighted segments.
     */
    public Optional<Blend> parseLegacyBlend(String text) {
        return legacyParser.parse(text);
    }

    /**
     Uses the legacy notation when it applies, and the full grammar otherwise.
     */
    public Conjunction parseWithLegacySupport(String prompt) {
        Optional<Blend> legacy = parseLegacyBlend(prompt);
        if (legacy.isPresent()) {
            logger.debug("Using legacy blend syntax for '{}'", prompt);
            return Conjunction.of(legacy.get());
        }
        return parseConjunction(prompt);
    }
}
