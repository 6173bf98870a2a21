package com.nilsson.promptsyntax.service.parser;

import com.nilsson.promptsyntax.data.ParserSettings;
import com.nilsson.promptsyntax.model.Attention;
import com.nilsson.promptsyntax.model.Blend;
import com.nilsson.promptsyntax.model.BlendablePrompt;
import com.nilsson.promptsyntax.model.Conjunction;
import com.nilsson.promptsyntax.model.ConjunctionPart;
import com.nilsson.promptsyntax.model.CrossAttentionControlSubstitute;
import com.nilsson.promptsyntax.model.Fragment;
import com.nilsson.promptsyntax.model.OptionValue;
import com.nilsson.promptsyntax.model.ParsingException;
import com.nilsson.promptsyntax.model.Prompt;
import com.nilsson.promptsyntax.model.PromptElement;
import com.nilsson.promptsyntax.model.SwapOptions;
import com.nilsson.promptsyntax.model.UnrecognizedOperatorException;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.nilsson.promptsyntax.service.parser.PromptLexicon.*;

/**
 <h2>PromptGrammar</h2>
 <p>
 Recursive-descent grammar that turns a prompt string into an unflattened tree. The grammar object
 holds only its configuration; every call works on its own {@link Scan}, so one instance can be
 shared between threads and re-entered for quoted sub-prompts.
 </p>

 <h3>Productions, strongest first:</h3>
 <ul>
 <li><b>Conjunction:</b> {@code ("a", "b").and(w...)} spanning the whole input, otherwise a sequence of
 blends and prompts.</li>
 <li><b>Blend:</b> {@code ("a", "b").blend(w...[, no_normalize])}; each quoted string is parsed again
 as a prompt.</li>
 <li><b>Swap:</b> {@code target.swap(replacement[, options])} where the target is an attention, a quoted
 fragment, a group or a restricted word.</li>
 <li><b>Attention:</b> {@code 1.5(...)}, {@code ++(...)}, {@code --word}.</li>
 <li><b>Quoted fragment</b> and <b>group</b>: {@code "..."} and {@code (...)}, spliced into the parent.</li>
 <li><b>Literal text:</b> whatever is left. Unmatched brackets and stray operators end up here rather
 than failing the parse.</li>
 </ul>

 <p>
 Only explicit operator misuse raises a {@link ParsingException}; an unknown {@code .name(} raises
 {@link UnrecognizedOperatorException}.
 </p>
 */
public class PromptGrammar {

    // ------------------------------------------------------------------------
    // Configuration
    // ------------------------------------------------------------------------

    private static final String OP_SWAP = "swap";
    private static final String OP_BLEND = "blend";
    private static final String OP_AND = "and";
    private static final String NO_NORMALIZE = "no_normalize";

    /** Deepest group nesting accepted; keeps recursion well inside the default thread stack. */
    static final int MAX_NESTING = 100;

    /** Replacement words inside {@code .swap(...)} also end at the option separator. */
    private static final String REPLACEMENT_STOPS = "()\",";

    private final double plusBase;
    private final double minusBase;

    public PromptGrammar(ParserSettings settings) {
        this.plusBase = settings.attentionPlusBase();
        this.minusBase = settings.attentionMinusBase();
    }

    // ------------------------------------------------------------------------
    // Public API
    // ------------------------------------------------------------------------

    /**
     Parses a complete prompt string into an unflattened conjunction.
     * @param text the raw prompt; blank text yields a single prompt holding an empty fragment.

     @return a {@link Conjunction} whose parts are {@link Prompt}s and {@link Blend}s of prompts.
     @throws ParsingException on explicit operator misuse.
     */
    public Conjunction parse(String text) {
        return new Scan(text == null ? "" : text).conjunction();
    }

    /**
     Parses the whole of {@code text} as a single prompt, ignoring conjunction-level operators.
     */
    public Prompt parsePrompt(String text) {
        String source = text == null ? "" : text;
        if (source.isBlank()) {
            return Prompt.of(Fragment.empty());
        }
        Scan scan = new Scan(source);
        return new Prompt(scan.body(0, false, false).nodes());
    }

    // ------------------------------------------------------------------------
    // Per-call state
    // ------------------------------------------------------------------------

    private record Match(List<PromptElement> nodes, int end) {
    }

    private record QuotedList(List<String> contents, int end) {
    }

    private record BlendMatch(Blend blend, int end) {
    }

    private static final Match NO_MATCH = new Match(List.of(), -1);

    /**
     One parse over one string. Strict productions are memoized by start position, since the
     literal-text fallback probes them again while scanning words.
     */
    private final class Scan {

        private final String text;
        private final int length;
        private final Map<Integer, Match> strictMemo = new HashMap<>();
        private final Map<Integer, Match> groupMemo = new HashMap<>();
        private final Map<Integer, Match> quotedMemo = new HashMap<>();
        private final Map<Integer, Match> attentionMemo = new HashMap<>();
        private int depth;

        Scan(String text) {
            this.text = text;
            this.length = text.length();
        }

        // --- Conjunction & blend ---

        Conjunction conjunction() {
            int pos = skipWhitespace(text, 0);
            if (pos >= length) {
                return Conjunction.of(Prompt.of(Fragment.empty()));
            }

            Conjunction explicit = explicitConjunction(pos);
            if (explicit != null) return explicit;

            List<ConjunctionPart> parts = new ArrayList<>();
            while (pos < length) {
                BlendMatch blend = blendAt(pos);
                if (blend != null) {
                    parts.add(blend.blend());
                    pos = skipWhitespace(text, blend.end());
                    continue;
                }
                Match prompt = body(pos, false, true);
                parts.add(new Prompt(prompt.nodes()));
                pos = skipWhitespace(text, prompt.end());
            }
            return new Conjunction(parts);
        }

        private Conjunction explicitConjunction(int pos) {
            QuotedList list = quotedListAt(pos);
            if (list == null || !OP_AND.equals(operatorAt(text, list.end()))) return null;

            int p = list.end() + OP_AND.length() + 2;
            List<Double> weights = new ArrayList<>();
            p = numberList(p, weights, ".and()");
            p = skipWhitespace(text, p);
            if (p >= length || text.charAt(p) != ')') {
                throw new ParsingException(".and(): expected numeric weights", near(pos));
            }
            if (skipWhitespace(text, p + 1) < length) {
                throw new ParsingException(".and() must span the whole prompt", near(pos));
            }

            List<ConjunctionPart> parts = new ArrayList<>();
            for (String content : list.contents()) {
                parts.add(parsePrompt(unescapeQuotes(content)));
            }
            try {
                return new Conjunction(parts, weights.isEmpty() ? null : weights);
            } catch (ParsingException e) {
                throw new ParsingException(e.getMessage(), text.substring(pos, p + 1));
            }
        }

        private BlendMatch blendAt(int pos) {
            if (pos >= length || text.charAt(pos) != '(') return null;
            QuotedList list = quotedListAt(pos);
            if (list == null || !OP_BLEND.equals(operatorAt(text, list.end()))) return null;

            int p = list.end() + OP_BLEND.length() + 2;
            List<Double> weights = new ArrayList<>();
            p = numberList(p, weights, ".blend()");
            if (weights.isEmpty()) {
                throw new ParsingException(".blend(): expected at least one weight", near(pos));
            }

            boolean normalize = true;
            p = skipWhitespace(text, p);
            if (p < length && text.charAt(p) == ',') {
                int flagStart = skipWhitespace(text, p + 1);
                int flagEnd = identifierEnd(text, flagStart);
                if (flagEnd < 0 || !NO_NORMALIZE.equals(text.substring(flagStart, flagEnd))) {
                    throw new ParsingException(".blend(): expected a number or no_normalize", near(flagStart));
                }
                normalize = false;
                p = skipWhitespace(text, flagEnd);
            }
            if (p >= length || text.charAt(p) != ')') {
                throw new ParsingException(".blend(): expected ')' after weights", near(pos));
            }

            int end = p + 1;
            String trailing = operatorAt(text, end);
            if (OP_SWAP.equals(trailing)) {
                throw new ParsingException("().blend(): a blend cannot be the target of .swap()",
                        text.substring(pos, Math.min(length, end + OP_SWAP.length() + 2)));
            }
            if (trailing != null) {
                throw misplacedOperator(trailing, pos, end);
            }

            List<BlendablePrompt> prompts = new ArrayList<>();
            for (String content : list.contents()) {
                prompts.add(parsePrompt(unescapeQuotes(content)));
            }
            try {
                return new BlendMatch(new Blend(prompts, weights, normalize), end);
            } catch (ParsingException e) {
                throw new ParsingException(e.getMessage(), text.substring(pos, end));
            }
        }

        /** {@code ( "a" , "b" )} returning the raw quoted contents. */
        private QuotedList quotedListAt(int pos) {
            if (pos >= length || text.charAt(pos) != '(') return null;
            List<String> contents = new ArrayList<>();
            int p = pos + 1;
            while (true) {
                p = skipWhitespace(text, p);
                if (p >= length || text.charAt(p) != '"') return null;
                int close = closingQuote(text, p);
                if (close < 0) return null;
                contents.add(text.substring(p + 1, close));
                p = skipWhitespace(text, close + 1);
                if (p >= length) return null;
                if (text.charAt(p) == ')') return new QuotedList(contents, p + 1);
                if (text.charAt(p) != ',') return null;
                p++;
            }
        }

        /** Comma separated numbers, stopping before anything that is not one. */
        private int numberList(int pos, List<Double> into, String operator) {
            int p = skipWhitespace(text, pos);
            int end = numberEnd(text, p);
            if (end < 0) return p;
            into.add(parseNumber(text, p, end));
            p = skipWhitespace(text, end);
            while (p < length && text.charAt(p) == ',') {
                int next = skipWhitespace(text, p + 1);
                end = numberEnd(text, next);
                if (end < 0) {
                    if (identifierEnd(text, next) > 0) return p;
                    throw new ParsingException(operator + ": expected a number", near(next));
                }
                into.add(parseNumber(text, next, end));
                p = skipWhitespace(text, end);
            }
            return p;
        }

        // --- Prompt body ---

        /**
         Parses prompt elements from {@code pos} until the end of input or, inside a group, until the
         closing parenthesis. Adjacent literal words become one fragment with their spacing intact.
         * @return the elements and the end position (the closing parenthesis inside a group), or
         {@code null} if a group is never closed.
         */
        Match body(int pos, boolean inGroup, boolean stopAtBlend) {
            List<PromptElement> nodes = new ArrayList<>();
            int runStart = -1;
            int runEnd = -1;
            int p = pos;
            while (true) {
                p = skipWhitespace(text, p);
                if (p >= length) {
                    if (inGroup) return null;
                    flushRun(nodes, runStart, runEnd);
                    return new Match(nodes, p);
                }
                char c = text.charAt(p);
                if (inGroup && c == ')') {
                    flushRun(nodes, runStart, runEnd);
                    return new Match(nodes, p);
                }
                if (stopAtBlend && c == '(' && p > pos && blendAt(p) != null) {
                    flushRun(nodes, runStart, runEnd);
                    return new Match(nodes, p);
                }

                Match strict = strictAt(p);
                if (strict != null) {
                    flushRun(nodes, runStart, runEnd);
                    runStart = -1;
                    nodes.addAll(strict.nodes());
                    p = strict.end();
                    continue;
                }

                int wordEnd = literalWordEnd(p, inGroup, stopAtBlend);
                if (runStart < 0) runStart = p;
                runEnd = wordEnd;
                p = wordEnd;
            }
        }

        private void flushRun(List<PromptElement> nodes, int runStart, int runEnd) {
            if (runStart >= 0) {
                nodes.add(new Fragment(unescape(text.substring(runStart, runEnd))));
            }
        }

        /**
         Literal fallback: everything up to whitespace, a group's closing parenthesis, or a bracket or
         quote where a strict production does match.
         */
        private int literalWordEnd(int pos, boolean inGroup, boolean stopAtBlend) {
            int i = isEscapeAt(text, pos) ? pos + 2 : pos + 1;
            while (i < length) {
                if (isEscapeAt(text, i)) {
                    i += 2;
                    continue;
                }
                char c = text.charAt(i);
                if (Character.isWhitespace(c)) break;
                if (inGroup && c == ')') break;
                if (stopAtBlend && c == '(' && blendAt(i) != null) break;
                if ((c == '(' || c == '"') && strictAt(i) != null) break;
                i++;
            }
            return i;
        }

        // --- Strict productions ---

        private Match strictAt(int pos) {
            Match cached = strictMemo.get(pos);
            if (cached == null) {
                Match found = swapAt(pos);
                if (found == null) found = attentionAt(pos);
                if (found == null) found = quotedAt(pos);
                if (found == null) found = groupAt(pos);
                cached = found == null ? NO_MATCH : found;
                strictMemo.put(pos, cached);
            }
            return cached == NO_MATCH ? null : cached;
        }

        private Match groupAt(int pos) {
            if (pos >= length || text.charAt(pos) != '(') return null;
            Match cached = groupMemo.get(pos);
            if (cached == null) {
                if (++depth > MAX_NESTING) {
                    throw new ParsingException("Prompt nests groups more than " + MAX_NESTING + " levels deep",
                            near(pos));
                }
                try {
                    Match inner = body(pos + 1, true, false);
                    if (inner == null || !isGroupBoundary(text, inner.end() + 1)) {
                        cached = NO_MATCH;
                    } else {
                        cached = new Match(orEmpty(inner.nodes()), inner.end() + 1);
                    }
                } finally {
                    depth--;
                }
                groupMemo.put(pos, cached);
            }
            return cached == NO_MATCH ? null : cached;
        }

        private Match quotedAt(int pos) {
            if (pos >= length || text.charAt(pos) != '"') return null;
            Match cached = quotedMemo.get(pos);
            if (cached == null) {
                cached = quoted(pos);
                quotedMemo.put(pos, cached == null ? NO_MATCH : cached);
            }
            return cached == NO_MATCH ? null : cached;
        }

        private Match quoted(int pos) {
            int close = closingQuote(text, pos);
            if (close < 0 || !isGroupBoundary(text, close + 1)) return null;

            String content = text.substring(pos + 1, close);
            if (content.isBlank()) {
                return new Match(List.of(Fragment.empty()), close + 1);
            }
            Match inner = new Scan(content).body(0, false, false);
            return new Match(orEmpty(inner.nodes()), close + 1);
        }

        private Match attentionAt(int pos) {
            if (pos >= length) return null;
            Match cached = attentionMemo.get(pos);
            if (cached == null) {
                cached = attention(pos);
                attentionMemo.put(pos, cached == null ? NO_MATCH : cached);
            }
            return cached == NO_MATCH ? null : cached;
        }

        private Match attention(int pos) {
            char c = text.charAt(pos);

            // explicit weight: 1.5(...)
            int numEnd = numberEnd(text, pos);
            if (numEnd > 0) {
                Match group = groupAt(numEnd);
                if (group == null) return null;
                double weight = parseNumber(text, pos, numEnd);
                return new Match(List.of(new Attention(weight, group.nodes())), group.end());
            }

            // sign run: ++(...) or --word
            if (c != '+' && c != '-') return null;
            int runEnd = pos;
            while (runEnd < length && text.charAt(runEnd) == c) {
                runEnd++;
            }
            double base = c == '+' ? plusBase : minusBase;
            double weight = runEnd - pos == 1 ? base : Math.pow(base, runEnd - pos);

            if (runEnd < length && (text.charAt(runEnd) == '(' || text.charAt(runEnd) == '"')) {
                Match group = text.charAt(runEnd) == '(' ? groupAt(runEnd) : quotedAt(runEnd);
                if (group == null) return null;
                return new Match(List.of(new Attention(weight, group.nodes())), group.end());
            }
            int wordEnd = restrictedWordEnd(text, runEnd, WORD_STOPS);
            if (wordEnd == runEnd) return null;
            Fragment word = new Fragment(unescape(text.substring(runEnd, wordEnd)));
            return new Match(List.of(new Attention(weight, List.of(word))), wordEnd);
        }

        private Match restrictedWordAt(int pos) {
            int end = restrictedWordEnd(text, pos, WORD_STOPS);
            if (end == pos) return null;
            return new Match(List.of(new Fragment(unescape(text.substring(pos, end)))), end);
        }

        // --- Swap ---

        private Match swapAt(int pos) {
            Match[] targets = {attentionAt(pos), quotedAt(pos), groupAt(pos), restrictedWordAt(pos)};
            for (Match target : targets) {
                if (target == null) continue;
                String operator = operatorAt(text, target.end());
                if (operator == null) continue;
                if (!OP_SWAP.equals(operator)) {
                    throw misplacedOperator(operator, pos, target.end());
                }
                return swapArguments(target.nodes(), pos, target.end() + OP_SWAP.length() + 2);
            }
            return null;
        }

        private ParsingException misplacedOperator(String operator, int start, int operatorPos) {
            String near = text.substring(start, Math.min(length, operatorPos + operator.length() + 2));
            if (OP_BLEND.equals(operator)) {
                return new ParsingException(".blend() only applies to a parenthesized list of quoted prompts "
                        + "at the top level of the prompt", near);
            }
            if (OP_AND.equals(operator)) {
                return new ParsingException(".and() only applies to a parenthesized list of quoted prompts "
                        + "making up the whole prompt", near);
            }
            return new UnrecognizedOperatorException(operator, near);
        }

        /**
         Parses {@code replacement[, option]*)} following {@code .swap(}.
         */
        private Match swapArguments(List<PromptElement> original, int start, int pos) {
            List<PromptElement> edited = new ArrayList<>();
            int runStart = -1;
            int runEnd = -1;
            int p = pos;
            while (true) {
                p = skipWhitespace(text, p);
                if (p >= length) {
                    throw new ParsingException(".swap(): missing ')'", near(start));
                }
                char c = text.charAt(p);
                if (c == ')' || c == ',') break;

                Match element = attentionAt(p);
                if (element == null) element = quotedAt(p);
                if (element == null) element = groupAt(p);
                if (element != null) {
                    rejectOperatorAfter(element.end(), p);
                    flushRun(edited, runStart, runEnd);
                    runStart = -1;
                    edited.addAll(element.nodes());
                    p = element.end();
                    continue;
                }

                int wordEnd = restrictedWordEnd(text, p, REPLACEMENT_STOPS);
                if (wordEnd == p) {
                    throw new ParsingException(".swap(): unexpected '" + c + "' in replacement", near(p));
                }
                rejectOperatorAfter(wordEnd, p);
                if (runStart < 0) runStart = p;
                runEnd = wordEnd;
                p = wordEnd;
            }
            flushRun(edited, runStart, runEnd);

            Map<String, OptionValue> options = new LinkedHashMap<>();
            while (text.charAt(p) == ',') {
                p = option(skipWhitespace(text, p + 1), options);
                p = skipWhitespace(text, p);
                if (p >= length) {
                    throw new ParsingException(".swap(): missing ')'", near(start));
                }
            }
            if (text.charAt(p) != ')') {
                throw new ParsingException(".swap(): expected ',' or ')'", near(p));
            }

            CrossAttentionControlSubstitute substitute =
                    new CrossAttentionControlSubstitute(original, edited, SwapOptions.of(options));
            return new Match(List.of(substitute), p + 1);
        }

        private void rejectOperatorAfter(int end, int start) {
            String operator = operatorAt(text, end);
            if (operator == null) return;
            if (OP_SWAP.equals(operator)) {
                throw new ParsingException(".swap(): substitutions cannot be nested",
                        text.substring(start, end + OP_SWAP.length() + 2));
            }
            throw misplacedOperator(operator, start, end);
        }

        /** {@code key=value}, a bare flag, or a bare number (stored as {@code weight}). */
        private int option(int pos, Map<String, OptionValue> into) {
            int numEnd = numberEnd(text, pos);
            if (numEnd > 0) {
                into.put(SwapOptions.WEIGHT, OptionValue.of(parseNumber(text, pos, numEnd)));
                return numEnd;
            }
            int keyEnd = identifierEnd(text, pos);
            if (keyEnd < 0) {
                throw new ParsingException(".swap(): expected an option", near(pos));
            }
            String key = text.substring(pos, keyEnd);
            int p = skipWhitespace(text, keyEnd);
            if (p >= length || text.charAt(p) != '=') {
                into.put(key, OptionValue.flag());
                return keyEnd;
            }

            int valueStart = skipWhitespace(text, p + 1);
            int valueEnd = numberEnd(text, valueStart);
            if (valueEnd > 0) {
                into.put(key, OptionValue.of(parseNumber(text, valueStart, valueEnd)));
                return valueEnd;
            }
            valueEnd = restrictedWordEnd(text, valueStart, REPLACEMENT_STOPS);
            if (valueEnd == valueStart) {
                throw new ParsingException(".swap(): option '" + key + "' has no value", near(pos));
            }
            into.put(key, OptionValue.of(unescape(text.substring(valueStart, valueEnd))));
            return valueEnd;
        }

        // --- Helpers ---

        private List<PromptElement> orEmpty(List<PromptElement> nodes) {
            return nodes.isEmpty() ? List.of(Fragment.empty()) : nodes;
        }

        private String near(int pos) {
            int start = Math.max(0, Math.min(pos, length));
            return text.substring(start, Math.min(length, start + 32));
        }
    }
}
