package com.nilsson.promptsyntax.model;

/**
 Value of a {@code .swap()} option: a number, a piece of text, or a boolean flag.
 */
public interface OptionValue {

    static OptionValue of(double value) {
        return new NumberValue(value);
    }

    static OptionValue of(String value) {
        return new TextValue(value);
    }

    static OptionValue flag() {
        return new FlagValue(true);
    }

    record NumberValue(double value) implements OptionValue {
    }

    record TextValue(String value) implements OptionValue {
        public TextValue {
            if (value == null) {
                throw new ParsingException("Option text must not be null");
            }
        }
    }

    record FlagValue(boolean value) implements OptionValue {
    }
}
