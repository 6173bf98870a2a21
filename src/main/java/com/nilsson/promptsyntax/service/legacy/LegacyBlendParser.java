package com.nilsson.promptsyntax.service.legacy;

import com.nilsson.promptsyntax.model.Blend;
import com.nilsson.promptsyntax.model.BlendablePrompt;
import com.nilsson.promptsyntax.model.Conjunction;
import com.nilsson.promptsyntax.model.ConjunctionPart;
import com.nilsson.promptsyntax.model.FlattenedPrompt;
import com.nilsson.promptsyntax.model.ParsingException;
import com.nilsson.promptsyntax.service.parser.PromptFlattener;
import com.nilsson.promptsyntax.service.parser.PromptGrammar;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 <h2>LegacyBlendParser</h2>
 <p>
 Adapter for the older colon-weighted blend notation, {@code mountain man:0.7 man mountain:0.3}.
 Each segment runs up to an unescaped {@code :} and may carry a numeric weight after it; a missing
 weight counts as {@code 1.0}. A literal colon is written {@code \:}.
 </p>

 <h3>Normalization:</h3>
 <ul>
 <li>Weights are divided by their sum.</li>
 <li>If the raw weights sum to exactly zero, every segment gets {@code 1/N} instead and a warning
 is logged.</li>
 </ul>
 <p>
 Text with fewer than two segments is not a legacy blend.
 </p>
 */
public class LegacyBlendParser {

    private static final Logger logger = LoggerFactory.getLogger(LegacyBlendParser.class);

    private static final Pattern SUBPROMPT = Pattern.compile(
            "(?<prompt>(?:\\\\:|[^:])+)(?::+(?<weight>-?\\d+(?:\\.\\d+)?)?\\s*|$)");

    private final PromptGrammar grammar;
    private final PromptFlattener flattener;

    public LegacyBlendParser(PromptGrammar grammar, PromptFlattener flattener) {
        this.grammar = grammar;
        this.flattener = flattener;
    }

    // ------------------------------------------------------------------------
    // Public API
    // ------------------------------------------------------------------------

    /**
     Parses {@code text} as a legacy blend.
     * @param text raw prompt text.

     @return a normalized {@link Blend} of flattened prompts, or empty if the text holds at most
     one segment.
     @throws ParsingException if a segment does not parse to a single flattened prompt.
     */
    public Optional<Blend> parse(String text) {
        List<WeightedSubprompt> subprompts = split(text, true);
        if (subprompts.size() <= 1) {
            return Optional.empty();
        }

        List<BlendablePrompt> children = new ArrayList<>(subprompts.size());
        List<Double> weights = new ArrayList<>(subprompts.size());
        for (WeightedSubprompt subprompt : subprompts) {
            children.add(parseSegment(subprompt.prompt()));
            weights.add(subprompt.weight());
        }
        return Optional.of(new Blend(children, weights, true));
    }

    /**
     Splits {@code text} into weighted segments.
     * @param normalize divide weights by their sum, falling back to equal weights on a zero sum.
     */
    public static List<WeightedSubprompt> split(String text, boolean normalize) {
        List<WeightedSubprompt> parsed = new ArrayList<>();
        if (text == null || text.isEmpty()) {
            return parsed;
        }

        Matcher m = SUBPROMPT.matcher(text);
        while (m.find()) {
            String prompt = m.group("prompt").replace("\\:", ":");
            String weight = m.group("weight");
            parsed.add(new WeightedSubprompt(prompt, weight == null ? 1.0 : Double.parseDouble(weight)));
        }
        if (!normalize || parsed.size() <= 1) {
            return parsed;
        }

        double sum = parsed.stream().mapToDouble(WeightedSubprompt::weight).sum();
        List<WeightedSubprompt> normalized = new ArrayList<>(parsed.size());
        if (sum == 0.0) {
            logger.warn("Legacy blend weights sum to zero, using equal weights for {} segments: {}",
                    parsed.size(), text);
            double equal = 1.0 / parsed.size();
            for (WeightedSubprompt subprompt : parsed) {
                normalized.add(new WeightedSubprompt(subprompt.prompt(), equal));
            }
        } else {
            for (WeightedSubprompt subprompt : parsed) {
                normalized.add(new WeightedSubprompt(subprompt.prompt(), subprompt.weight() / sum));
            }
        }
        return normalized;
    }

    // ------------------------------------------------------------------------
    // Internal Helpers
    // ------------------------------------------------------------------------

    private FlattenedPrompt parseSegment(String segment) {
        Conjunction conjunction = flattener.flatten(grammar.parse(segment));
        ConjunctionPart first = conjunction.parts().get(0);
        if (!(first instanceof FlattenedPrompt prompt)) {
            throw new ParsingException("Legacy blend segment must be a plain prompt", segment);
        }
        return prompt;
    }
}
