package com.nilsson.promptsyntax.model;

import java.util.List;

/**
 <h2>CrossAttentionControlSubstitute</h2>
 <p>
 Result of the {@code .swap()} operator. The {@link #original()} side generates the attention maps;
 the {@link #edited()} side is rendered using those maps, so the edited content keeps the
 composition of the original.
 </p>
 <ul>
 <li>An empty edited side becomes a single empty {@link Fragment}.</li>
 <li>Substitutions do not nest: neither side may contain another substitution.</li>
 <li>{@link #options()} always carries the schedule defaults, see {@link SwapOptions}.</li>
 </ul>
 */
public record CrossAttentionControlSubstitute(List<PromptElement> original,
                                              List<PromptElement> edited,
                                              SwapOptions options) implements PromptElement, FlatElement {

    public CrossAttentionControlSubstitute {
        if (original == null || Nodes.hasNull(original)) {
            throw new ParsingException(".swap(): original side must be a list of prompt elements");
        }
        if (edited == null || Nodes.hasNull(edited)) {
            throw new ParsingException(".swap(): edited side must be a list of prompt elements");
        }
        if (containsSubstitution(original) || containsSubstitution(edited)) {
            throw new ParsingException(".swap(): substitutions cannot be nested inside another .swap()");
        }
        original = List.copyOf(original);
        edited = edited.isEmpty() ? List.of(Fragment.empty()) : List.copyOf(edited);
        options = options == null ? SwapOptions.defaults() : options;
    }

    public CrossAttentionControlSubstitute(List<PromptElement> original, List<PromptElement> edited) {
        this(original, edited, SwapOptions.defaults());
    }

    /**
     @return {@code true} when both sides consist of fragments only, as produced by the flattener.
     */
    public boolean isFlat() {
        return original.stream().allMatch(Fragment.class::isInstance)
                && edited.stream().allMatch(Fragment.class::isInstance);
    }

    static boolean containsSubstitution(List<? extends PromptElement> elements) {
        for (PromptElement element : elements) {
            if (element instanceof CrossAttentionControlSubstitute) {
                return true;
            }
            if (element instanceof Attention attention && containsSubstitution(attention.children())) {
                return true;
            }
        }
        return false;
    }
}
