package com.nilsson.promptsyntax.model;

import java.util.List;

/**
 A nesting scope whose weight multiplies into every descendant when the tree is flattened.
 Weights are never combined at parse time.
 */
public record Attention(double weight, List<PromptElement> children) implements PromptElement {

    public Attention {
        if (children == null) {
            throw new ParsingException("Attention children must be a list, got null");
        }
        if (Nodes.hasNull(children)) {
            throw new ParsingException("Attention children must not contain null");
        }
        children = List.copyOf(children);
    }
}
