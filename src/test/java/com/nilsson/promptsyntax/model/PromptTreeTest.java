package com.nilsson.promptsyntax.model;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 Construction invariants of the tree types.
 */
class PromptTreeTest {

    private final CrossAttentionControlSubstitute swap =
            new CrossAttentionControlSubstitute(List.of(new Fragment("cat")), List.of(new Fragment("dog")));

    // ------------------------------------------------------------------------
    // Fragment / Attention
    // ------------------------------------------------------------------------

    @Test
    void testFragmentDefaults() {
        assertEquals(1.0, new Fragment("a").weight());
        assertTrue(Fragment.empty().isEmpty());
        assertThrows(ParsingException.class, () -> new Fragment(null, 1.0));
    }

    @Test
    void testAttentionRejectsNullChildren() {
        assertThrows(ParsingException.class, () -> new Attention(1.0, null));
        assertThrows(ParsingException.class, () -> new Attention(1.0, Arrays.asList(new Fragment("a"), null)));
    }

    // ------------------------------------------------------------------------
    // Substitution
    // ------------------------------------------------------------------------

    @Test
    void testEmptyEditedSideBecomesEmptyFragment() {
        CrossAttentionControlSubstitute empty = new CrossAttentionControlSubstitute(List.of(new Fragment("a")), List.of());
        assertEquals(List.of(Fragment.empty()), empty.edited());
        assertEquals(SwapOptions.defaults(), empty.options());
    }

    @Test
    void testNestedSubstitutionIsRejected() {
        assertThrows(ParsingException.class,
                () -> new CrossAttentionControlSubstitute(List.of(swap), List.of(new Fragment("x"))));
        assertThrows(ParsingException.class,
                () -> new CrossAttentionControlSubstitute(List.of(new Fragment("x")),
                        List.of(new Attention(1.2, List.of(swap)))));
    }

    @Test
    void testIsFlat() {
        assertTrue(swap.isFlat());
        assertFalse(new CrossAttentionControlSubstitute(
                List.of(new Attention(1.1, List.of(new Fragment("a")))), List.of(new Fragment("b"))).isFlat());
    }

    // ------------------------------------------------------------------------
    // Prompts
    // ------------------------------------------------------------------------

    @Test
    void testFlattenedPromptIsEmpty() {
        assertTrue(new FlattenedPrompt(List.of()).isEmpty());
        assertTrue(FlattenedPrompt.of(Fragment.empty()).isEmpty());
        assertFalse(FlattenedPrompt.ofWeighted("a", 1.0).isEmpty());
        assertFalse(FlattenedPrompt.of(Fragment.empty(), Fragment.empty()).isEmpty());
    }

    @Test
    void testFlattenedPromptRejectsUnflattenedSwap() {
        CrossAttentionControlSubstitute nested = new CrossAttentionControlSubstitute(
                List.of(new Attention(1.1, List.of(new Fragment("a")))), List.of(new Fragment("b")));
        assertThrows(ParsingException.class, () -> FlattenedPrompt.of(nested));
    }

    @Test
    void testContainsSubstitution() {
        assertTrue(Prompt.of(new Attention(2.0, List.of(swap))).containsSubstitution());
        assertFalse(Prompt.of(new Fragment("a")).containsSubstitution());
        assertTrue(FlattenedPrompt.of(swap).containsSubstitution());
    }

    // ------------------------------------------------------------------------
    // Blend / Conjunction
    // ------------------------------------------------------------------------

    @Test
    void testBlendCountsMustMatch() {
        ParsingException e = assertThrows(ParsingException.class,
                () -> new Blend(List.of(Prompt.of(new Fragment("a"))), List.of(1.0, 2.0)));
        assertTrue(e.getMessage().contains("mismatched"));
    }

    @Test
    void testBlendRejectsSubstitution() {
        assertThrows(ParsingException.class,
                () -> new Blend(List.of(Prompt.of(swap), Prompt.of(new Fragment("b"))), List.of(1.0, 1.0)));
    }

    @Test
    void testConjunctionDefaultWeights() {
        Conjunction conjunction = Conjunction.of(Prompt.of(new Fragment("a")), Prompt.of(new Fragment("b")));
        assertEquals(List.of(1.0, 1.0), conjunction.weights());
        assertThrows(ParsingException.class,
                () -> new Conjunction(List.of(Prompt.of(new Fragment("a"))), List.of(1.0, 1.0)));
    }

    @Test
    void testUnrecognizedOperatorException() {
        UnrecognizedOperatorException e = new UnrecognizedOperatorException("jump", "cat.jump(");
        assertEquals("jump", e.getOperatorName());
        assertEquals("cat.jump(", e.getNear());
        assertTrue(e.getMessage().contains(".jump()"));
    }
}
