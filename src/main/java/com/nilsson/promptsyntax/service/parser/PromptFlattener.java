package com.nilsson.promptsyntax.service.parser;

import com.nilsson.promptsyntax.model.Attention;
import com.nilsson.promptsyntax.model.Blend;
import com.nilsson.promptsyntax.model.BlendablePrompt;
import com.nilsson.promptsyntax.model.Conjunction;
import com.nilsson.promptsyntax.model.ConjunctionPart;
import com.nilsson.promptsyntax.model.CrossAttentionControlSubstitute;
import com.nilsson.promptsyntax.model.FlatElement;
import com.nilsson.promptsyntax.model.FlattenedPrompt;
import com.nilsson.promptsyntax.model.Fragment;
import com.nilsson.promptsyntax.model.Prompt;
import com.nilsson.promptsyntax.model.PromptElement;

import java.util.ArrayList;
import java.util.List;

/**
 <h2>PromptFlattener</h2>
 <p>
 Reduces a parsed tree to the linear form a tokenizer consumes. A single recursive walk carries a
 multiplicative weight scale, starting at {@code 1.0}; every attention scope multiplies it for its
 descendants, and every fragment is emitted with its own weight times the scale.
 </p>

 <h3>Per node:</h3>
 <ul>
 <li><b>Prompt:</b> children linearized in order, then fused by {@link FragmentFuser}.</li>
 <li><b>Substitution:</b> both sides flattened and fused separately at the current scale; options
 pass through untouched.</li>
 <li><b>Blend:</b> each child flattened on its own; weights and the normalize flag pass through.</li>
 <li><b>Conjunction:</b> every part flattened, part weights preserved.</li>
 </ul>
 */
public class PromptFlattener {

    public Conjunction flatten(Conjunction conjunction) {
        List<ConjunctionPart> parts = new ArrayList<>(conjunction.parts().size());
        for (ConjunctionPart part : conjunction.parts()) {
            parts.add(flattenPart(part));
        }
        return new Conjunction(parts, conjunction.weights());
    }

    public ConjunctionPart flattenPart(ConjunctionPart part) {
        if (part instanceof Blend blend) {
            List<BlendablePrompt> children = new ArrayList<>(blend.children().size());
            for (BlendablePrompt child : blend.children()) {
                children.add(flattenPrompt(child));
            }
            return new Blend(children, blend.weights(), blend.normalizeWeights());
        }
        return flattenPrompt((BlendablePrompt) part);
    }

    public FlattenedPrompt flattenPrompt(BlendablePrompt prompt) {
        if (prompt instanceof FlattenedPrompt flattened) {
            return flattened;
        }
        List<FlatElement> linear = new ArrayList<>();
        appendAll(((Prompt) prompt).children(), 1.0, linear);
        return new FlattenedPrompt(FragmentFuser.fuse(linear));
    }

    // ------------------------------------------------------------------------
    // Tree walk
    // ------------------------------------------------------------------------

    private void appendAll(List<PromptElement> elements, double scale, List<FlatElement> into) {
        for (PromptElement element : elements) {
            append(element, scale, into);
        }
    }

    private void append(PromptElement element, double scale, List<FlatElement> into) {
        if (element instanceof Fragment fragment) {
            into.add(new Fragment(fragment.text(), fragment.weight() * scale));
        } else if (element instanceof Attention attention) {
            appendAll(attention.children(), scale * attention.weight(), into);
        } else if (element instanceof CrossAttentionControlSubstitute substitute) {
            into.add(new CrossAttentionControlSubstitute(
                    flattenSide(substitute.original(), scale),
                    flattenSide(substitute.edited(), scale),
                    substitute.options()));
        } else {
            throw new IllegalStateException("Unhandled prompt element: " + element);
        }
    }

    /** Substitutions never nest, so a flattened side holds fragments only. */
    private List<PromptElement> flattenSide(List<PromptElement> side, double scale) {
        List<FlatElement> linear = new ArrayList<>();
        appendAll(side, scale, linear);
        List<PromptElement> fragments = new ArrayList<>();
        for (FlatElement element : FragmentFuser.fuse(linear)) {
            fragments.add((Fragment) element);
        }
        return fragments;
    }
}
