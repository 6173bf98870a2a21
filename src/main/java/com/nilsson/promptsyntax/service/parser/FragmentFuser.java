package com.nilsson.promptsyntax.service.parser;

import com.nilsson.promptsyntax.model.FlatElement;
import com.nilsson.promptsyntax.model.Fragment;

import java.util.ArrayList;
import java.util.List;

/**
 Merges runs of adjacent fragments that share a weight into one fragment, joining their text with
 a single space. A substitution span is never merged and splits the run around it.
 <p>
 Empty fragments add no text to a merged run, so {@code ("fire", "")} fuses to {@code "fire"}. A
 sequence made of nothing but one empty fragment is left as it is. Fusing is idempotent.
 </p>
 */
public final class FragmentFuser {

    private FragmentFuser() {
    }

    public static List<FlatElement> fuse(List<FlatElement> elements) {
        List<FlatElement> fused = new ArrayList<>(elements.size());
        Fragment pending = null;

        for (FlatElement element : elements) {
            if (element instanceof Fragment fragment) {
                if (pending != null && pending.weight() == fragment.weight()) {
                    pending = new Fragment(join(pending.text(), fragment.text()), pending.weight());
                } else {
                    if (pending != null) fused.add(pending);
                    pending = fragment;
                }
            } else {
                if (pending != null) fused.add(pending);
                pending = null;
                fused.add(element);
            }
        }
        if (pending != null) fused.add(pending);
        return fused;
    }

    private static String join(String left, String right) {
        if (left.isEmpty()) return right;
        if (right.isEmpty()) return left;
        return left + " " + right;
    }
}
