package com.nilsson.promptsyntax.model;

import java.util.ArrayList;
import java.util.List;

/**
 <h2>FlattenedPrompt</h2>
 <p>
 Linear form of a {@link Prompt}: an ordered run of weighted fragments and substitution spans,
 with every attention scope already multiplied into the fragment weights. This is what a
 tokenizer consumes.
 </p>
 */
public record FlattenedPrompt(List<FlatElement> children) implements BlendablePrompt {

    public FlattenedPrompt {
        if (children == null || Nodes.hasNull(children)) {
            throw new ParsingException("FlattenedPrompt children must be a list of fragments or substitutions");
        }
        for (FlatElement child : children) {
            if (child instanceof CrossAttentionControlSubstitute substitute && !substitute.isFlat()) {
                throw new ParsingException("FlattenedPrompt cannot hold an unflattened .swap()");
            }
        }
        children = List.copyOf(children);
    }

    public static FlattenedPrompt of(FlatElement... children) {
        return new FlattenedPrompt(List.of(children));
    }

    /**
     Convenience for the common case of plain weighted text.
     * @param textAndWeights alternating {@code String} text and {@code Number} weight values.
     */
    public static FlattenedPrompt ofWeighted(Object... textAndWeights) {
        if (textAndWeights.length % 2 != 0) {
            throw new IllegalArgumentException("Expected text/weight pairs");
        }
        List<FlatElement> fragments = new ArrayList<>();
        for (int i = 0; i < textAndWeights.length; i += 2) {
            fragments.add(new Fragment((String) textAndWeights[i], ((Number) textAndWeights[i + 1]).doubleValue()));
        }
        return new FlattenedPrompt(fragments);
    }

    /**
     @return {@code true} if there is nothing to condition on: no children, or a single
     fragment with empty text.
     */
    public boolean isEmpty() {
        return children.isEmpty()
                || (children.size() == 1 && children.get(0) instanceof Fragment fragment && fragment.isEmpty());
    }

    @Override
    public boolean containsSubstitution() {
        return children.stream().anyMatch(CrossAttentionControlSubstitute.class::isInstance);
    }
}
