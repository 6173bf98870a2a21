package com.nilsson.promptsyntax.model;

/**
 A prompt that can be one of the weighted members of a {@link Blend}.
 */
public interface BlendablePrompt extends ConjunctionPart {

    /**
     @return {@code true} if a {@link CrossAttentionControlSubstitute} appears anywhere in this prompt.
     */
    boolean containsSubstitution();
}
