package com.nilsson.promptsyntax.service.parser;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 <h2>PromptLexicon</h2>
 <p>
 Character-level primitives shared by the prompt grammar: escape handling, numeric literals,
 identifiers, operator calls and restricted words. All methods are pure scans over a string that
 return an end index, so the grammar can try a production and back off without allocating.
 </p>

 <h3>Escapes:</h3>
 <p>
 A backslash before one of {@code ( ) " , . + - = \} makes that character literal. Any other
 backslash is ordinary text.
 </p>
 */
public final class PromptLexicon {

    public static final String ESCAPABLE = "()\",.+-=\\";

    /** Characters that end a restricted word, besides whitespace. */
    public static final String WORD_STOPS = "()\",";

    private static final Pattern NUMBER = Pattern.compile("-?(?:\\d+(?:\\.\\d*)?|\\.\\d+)");
    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private PromptLexicon() {
    }

    // ------------------------------------------------------------------------
    // Escapes
    // ------------------------------------------------------------------------

    public static boolean isEscapeAt(String text, int pos) {
        return pos + 1 < text.length()
                && text.charAt(pos) == '\\'
                && ESCAPABLE.indexOf(text.charAt(pos + 1)) >= 0;
    }

    /**
     Resolves every escape sequence in {@code raw}.
     * @param raw text as written in the prompt.

     @return the literal text, e.g. {@code \(man\)} becomes {@code (man)}.
     */
    public static String unescape(String raw) {
        if (raw.indexOf('\\') < 0) return raw;
        StringBuilder sb = new StringBuilder(raw.length());
        int i = 0;
        while (i < raw.length()) {
            if (isEscapeAt(raw, i)) {
                sb.append(raw.charAt(i + 1));
                i += 2;
            } else {
                sb.append(raw.charAt(i));
                i++;
            }
        }
        return sb.toString();
    }

    /**
     Resolves only escaped double quotes, leaving every other escape for the grammar.
     Used on quoted prompt strings before they are parsed again as prompts.
     */
    public static String unescapeQuotes(String raw) {
        return raw.replace("\\\"", "\"");
    }

    // ------------------------------------------------------------------------
    // Scanning
    // ------------------------------------------------------------------------

    public static int skipWhitespace(String text, int pos) {
        while (pos < text.length() && Character.isWhitespace(text.charAt(pos))) {
            pos++;
        }
        return pos;
    }

    /**
     @return the end of the numeric literal starting at {@code pos}, or {@code -1}.
     */
    public static int numberEnd(String text, int pos) {
        return lookingAt(NUMBER, text, pos);
    }

    public static double parseNumber(String text, int start, int end) {
        return Double.parseDouble(text.substring(start, end));
    }

    /**
     @return the end of the identifier starting at {@code pos}, or {@code -1}.
     */
    public static int identifierEnd(String text, int pos) {
        return lookingAt(IDENTIFIER, text, pos);
    }

    /**
     Recognizes an operator call {@code .name(} at {@code pos}.
     * @return the operator name, or {@code null} if there is no call here.
     */
    public static String operatorAt(String text, int pos) {
        if (pos >= text.length() || text.charAt(pos) != '.') return null;
        int end = identifierEnd(text, pos + 1);
        if (end < 0 || end >= text.length() || text.charAt(end) != '(') return null;
        return text.substring(pos + 1, end);
    }

    /**
     Scans a restricted word: characters up to whitespace, an unescaped character from
     {@code stops}, or a {@code .} that opens an operator call. Escaped characters never end it.
     * @return the end of the word; equal to {@code pos} if there is no word here.
     */
    public static int restrictedWordEnd(String text, int pos, String stops) {
        int i = pos;
        while (i < text.length()) {
            if (isEscapeAt(text, i)) {
                i += 2;
                continue;
            }
            char c = text.charAt(i);
            if (Character.isWhitespace(c) || stops.indexOf(c) >= 0) break;
            if (c == '.' && operatorAt(text, i) != null) break;
            i++;
        }
        return i;
    }

    /**
     Finds the closing quote of a double-quoted string opening at {@code pos}. A backslash
     always escapes the character after it.
     * @return index of the closing quote, or {@code -1} if the string is unterminated.
     */
    public static int closingQuote(String text, int pos) {
        int i = pos + 1;
        while (i < text.length()) {
            char c = text.charAt(i);
            if (c == '\\' && i + 1 < text.length()) {
                i += 2;
            } else if (c == '"') {
                return i;
            } else {
                i++;
            }
        }
        return -1;
    }

    /**
     A group or quoted fragment may not run straight into a word: {@code (ba)dly} is text.
     */
    public static boolean isGroupBoundary(String text, int pos) {
        return pos >= text.length() || !Character.isLetterOrDigit(text.charAt(pos));
    }

    private static int lookingAt(Pattern pattern, String text, int pos) {
        if (pos >= text.length()) return -1;
        Matcher m = pattern.matcher(text);
        m.region(pos, text.length());
        return m.lookingAt() ? m.end() : -1;
    }
}
