package com.nilsson.promptsyntax.model;

import java.util.Collections;
import java.util.List;

/**
 Entry and exit type of prompt parsing: one or more independently conditioned parts, each with a
 weight (all {@code 1.0} unless given by {@code .and()}).
 <p>
 Downstream conditioning currently consumes only the first part; the caller decides how many
 to use.
 </p>
 */
public record Conjunction(List<ConjunctionPart> parts, List<Double> weights) {

    public Conjunction {
        if (parts == null || Nodes.hasNull(parts)) {
            throw new ParsingException("Conjunction parts must be a list");
        }
        if (weights == null) {
            weights = Collections.nCopies(parts.size(), 1.0);
        }
        if (Nodes.hasNull(weights) || weights.size() != parts.size()) {
            throw new ParsingException(".and(): mismatched part/weight counts ("
                    + parts.size() + " parts, " + weights.size() + " weights)");
        }
        parts = List.copyOf(parts);
        weights = List.copyOf(weights);
    }

    public Conjunction(List<ConjunctionPart> parts) {
        this(parts, null);
    }

    public static Conjunction of(ConjunctionPart... parts) {
        return new Conjunction(List.of(parts));
    }
}
