package com.nilsson.promptsyntax.model;

/**
 The atomic unit of prompt text with a scalar weight; {@code 1.0} is neutral.
 <p>
 Escape sequences are resolved by the grammar before a fragment is built, so {@link #text()}
 holds literal characters only.
 </p>
 */
public record Fragment(String text, double weight) implements PromptElement, FlatElement {

    public Fragment {
        if (text == null) {
            throw new ParsingException("Fragment text must not be null");
        }
    }

    public Fragment(String text) {
        this(text, 1.0);
    }

    public static Fragment empty() {
        return new Fragment("");
    }

    public boolean isEmpty() {
        return text.isEmpty();
    }
}
