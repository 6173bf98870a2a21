package com.nilsson.promptsyntax.model;

import java.util.List;

/**
 Top-level syntactic unit produced by the grammar, before flattening.
 */
public record Prompt(List<PromptElement> children) implements BlendablePrompt {

    public Prompt {
        if (children == null || Nodes.hasNull(children)) {
            throw new ParsingException("Prompt children must be a list of prompt elements");
        }
        children = List.copyOf(children);
    }

    public static Prompt of(PromptElement... children) {
        return new Prompt(List.of(children));
    }

    @Override
    public boolean containsSubstitution() {
        return CrossAttentionControlSubstitute.containsSubstitution(children);
    }
}
