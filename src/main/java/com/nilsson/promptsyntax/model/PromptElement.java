package com.nilsson.promptsyntax.model;

/**
 A node that may appear inside a {@link Prompt}, an {@link Attention} scope, or either side
 of a {@link CrossAttentionControlSubstitute} before flattening.
 */
public interface PromptElement {
}
