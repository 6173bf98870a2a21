package com.nilsson.promptsyntax.service.legacy;

/**
 One {@code text:weight} segment of the legacy colon syntax, with escaped colons already resolved.
 */
public record WeightedSubprompt(String prompt, double weight) {
}
