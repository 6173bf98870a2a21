package com.nilsson.promptsyntax.model;

/**
 A node that survives flattening: either a weighted text {@link Fragment} or a
 {@link CrossAttentionControlSubstitute} whose sides are themselves flat.
 */
public interface FlatElement {
}
