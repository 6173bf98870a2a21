package com.nilsson.promptsyntax.model;

import java.util.List;

/**
 A weighted combination of independently conditioned prompts, merged in embedding space downstream.
 <p>
 The prompt and weight counts must match, and no member may contain a {@code .swap()}:
 blending substitution spans has no defined meaning.
 </p>
 */
public record Blend(List<BlendablePrompt> children, List<Double> weights, boolean normalizeWeights)
        implements ConjunctionPart {

    public Blend {
        if (children == null || weights == null || Nodes.hasNull(children) || Nodes.hasNull(weights)) {
            throw new ParsingException("().blend(): prompts and weights must be lists");
        }
        if (children.size() != weights.size()) {
            throw new ParsingException("().blend(): mismatched prompt/weight counts ("
                    + children.size() + " prompts, " + weights.size() + " weights)");
        }
        for (BlendablePrompt child : children) {
            if (child.containsSubstitution()) {
                throw new ParsingException("().blend(): cannot blend prompts containing .swap()");
            }
        }
        children = List.copyOf(children);
        weights = List.copyOf(weights);
    }

    public Blend(List<BlendablePrompt> children, List<Double> weights) {
        this(children, weights, true);
    }
}
