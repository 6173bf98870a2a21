package com.nilsson.promptsyntax.data;

/**
 Tunable parameters of the prompt grammar.
 * @param attentionPlusBase  weight of a single {@code +} in a sign run; a run of n gives {@code base^n}.
 * @param attentionMinusBase weight of a single {@code -} in a sign run.
 * @param logParseTrees      log every parse tree and flattened result at DEBUG.
 */
public record ParserSettings(double attentionPlusBase, double attentionMinusBase, boolean logParseTrees) {

    public static final double DEFAULT_PLUS_BASE = 1.1;
    public static final double DEFAULT_MINUS_BASE = 0.9;

    public ParserSettings {
        if (!(attentionPlusBase > 0.0) || !(attentionMinusBase > 0.0)) {
            throw new IllegalArgumentException("Attention bases must be positive, got "
                    + attentionPlusBase + " / " + attentionMinusBase);
        }
    }

    public static ParserSettings defaults() {
        return new ParserSettings(DEFAULT_PLUS_BASE, DEFAULT_MINUS_BASE, false);
    }

    public static ParserSettings fromRepository(SettingsRepository repository) {
        return new ParserSettings(
                repository.getDouble("attention_plus_base", DEFAULT_PLUS_BASE),
                repository.getDouble("attention_minus_base", DEFAULT_MINUS_BASE),
                repository.getBoolean("log_parse_trees", false)
        );
    }
}
