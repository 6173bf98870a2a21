package com.nilsson.promptsyntax.model;

/**
 One independently conditioned part of a {@link Conjunction}.
 */
public interface ConjunctionPart {
}
