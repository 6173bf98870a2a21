package com.nilsson.promptsyntax.service.parser;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class PromptLexiconTest {

    @Test
    void testUnescape() {
        assertEquals("mountain (man)", PromptLexicon.unescape("mountain \\(man\\)"));
        assertEquals("a \\b", PromptLexicon.unescape("a \\b"), "Unknown escapes stay as written");
        assertEquals("1:2, \\", PromptLexicon.unescape("1:2\\, \\\\"));
        assertEquals("say \"hi\" \\(x", PromptLexicon.unescapeQuotes("say \\\"hi\\\" \\(x"));
    }

    @Test
    void testNumbers() {
        assertEquals(3, PromptLexicon.numberEnd("1.5(x)", 0));
        assertEquals(2, PromptLexicon.numberEnd("-1(x)", 0));
        assertEquals(2, PromptLexicon.numberEnd(".5", 0));
        assertEquals(2, PromptLexicon.numberEnd("2.", 0));
        assertEquals(-1, PromptLexicon.numberEnd("-x", 0));
        assertEquals(-1, PromptLexicon.numberEnd("abc", 3));
        assertEquals(1.5, PromptLexicon.parseNumber("w=1.5", 2, 5), 1e-12);
    }

    @Test
    void testOperatorAt() {
        assertEquals("swap", PromptLexicon.operatorAt("cat.swap(dog)", 3));
        assertNull(PromptLexicon.operatorAt("cat.swap", 3), "No call without a parenthesis");
        assertNull(PromptLexicon.operatorAt("v1.5(x)", 2));
        assertNull(PromptLexicon.operatorAt("cat", 1));
    }

    @Test
    void testRestrictedWord() {
        String stops = PromptLexicon.WORD_STOPS;
        assertEquals(3, PromptLexicon.restrictedWordEnd("cat.swap(dog)", 0, stops));
        assertEquals(7, PromptLexicon.restrictedWordEnd("hot-dog, bun", 0, stops));
        assertEquals(8, PromptLexicon.restrictedWordEnd("Mr.Smith rides", 0, stops));
        assertEquals(6, PromptLexicon.restrictedWordEnd("a\\(b\\) c", 0, stops));
        assertEquals(0, PromptLexicon.restrictedWordEnd("(x)", 0, stops));
    }

    @Test
    void testClosingQuote() {
        assertEquals(4, PromptLexicon.closingQuote("\"abc\"", 0));
        assertEquals(5, PromptLexicon.closingQuote("\"a\\\"b\"", 0));
        assertEquals(-1, PromptLexicon.closingQuote("\"abc", 0));
    }

    @Test
    void testGroupBoundary() {
        assertTrue(PromptLexicon.isGroupBoundary("(a)", 3));
        assertTrue(PromptLexicon.isGroupBoundary("(a) b", 3));
        assertTrue(PromptLexicon.isGroupBoundary("(a).swap(b)", 3));
        assertFalse(PromptLexicon.isGroupBoundary("(ba)dly", 4));
    }
}
