package com.nilsson.promptsyntax.main;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.nilsson.promptsyntax.model.Conjunction;
import com.nilsson.promptsyntax.model.FlattenedPrompt;
import com.nilsson.promptsyntax.model.ParsingException;
import com.nilsson.promptsyntax.service.ConjunctionJsonWriter;
import com.nilsson.promptsyntax.service.PromptParser;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

/**
 Tests the command-line flow of {@link Launcher}: argument handling, output and exit codes.
 */
@ExtendWith(MockitoExtension.class)
class LauncherTest {

    @Mock
    private PromptParser mockParser;

    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private final ByteArrayOutputStream err = new ByteArrayOutputStream();
    private final InputStream noInput = new ByteArrayInputStream(new byte[0]);

    private int run(Launcher launcher, InputStream in, String... args) {
        return launcher.run(args, in,
                new PrintStream(out, true, StandardCharsets.UTF_8),
                new PrintStream(err, true, StandardCharsets.UTF_8));
    }

    // ------------------------------------------------------------------------
    // With a real parser
    // ------------------------------------------------------------------------

    @Test
    void testPrintsFlattenedJson() throws Exception {
        Launcher launcher = new Launcher(new PromptParser(), new ConjunctionJsonWriter());

        assertEquals(0, run(launcher, noInput, "2.0(fire)", "smoke"));

        JsonNode root = new ObjectMapper().readTree(out.toString(StandardCharsets.UTF_8));
        JsonNode children = root.get("parts").get(0).get("children");
        assertEquals("fire", children.get(0).get("text").asText());
        assertEquals(2.0, children.get(0).get("weight").asDouble(), 1e-12);
        assertEquals("smoke", children.get(1).get("text").asText());
    }

    @Test
    void testReadsPromptFromStdin() throws Exception {
        Launcher launcher = new Launcher(new PromptParser(), new ConjunctionJsonWriter());
        InputStream in = new ByteArrayInputStream("fire (flames)\n".getBytes(StandardCharsets.UTF_8));

        assertEquals(0, run(launcher, in, "--tree"));

        JsonNode part = new ObjectMapper().readTree(out.toString(StandardCharsets.UTF_8)).get("parts").get(0);
        assertEquals("prompt", part.get("type").asText(), "--tree prints the unflattened prompt");
    }

    @Test
    void testParseErrorIsReported() {
        Launcher launcher = new Launcher(new PromptParser(), new ConjunctionJsonWriter());

        assertEquals(1, run(launcher, noInput, "a", "cat.jump(dog)"));
        String message = err.toString(StandardCharsets.UTF_8);
        assertTrue(message.startsWith("Invalid prompt syntax near '"), "Unexpected message: " + message);
        assertTrue(message.contains(".jump()"));
        assertEquals("", out.toString(StandardCharsets.UTF_8), "Nothing is printed on failure");
    }

    @Test
    void testBlendErrorNamesTheBlend() {
        Launcher launcher = new Launcher(new PromptParser(), new ConjunctionJsonWriter());

        assertEquals(1, run(launcher, noInput, "(\"a\",\"b\").blend(1,2,3)"));
        String message = err.toString(StandardCharsets.UTF_8).strip();
        assertTrue(message.startsWith("Invalid prompt syntax near '(\"a\",\"b\").blend(1,2,3)'"),
                "Unexpected message: " + message);
    }

    // ------------------------------------------------------------------------
    // With a mocked parser
    // ------------------------------------------------------------------------

    @Test
    void testLegacyFlagUsesLegacyEntryPoint() {
        when(mockParser.parseWithLegacySupport(anyString()))
                .thenReturn(Conjunction.of(FlattenedPrompt.ofWeighted("x", 1.0)));
        Launcher launcher = new Launcher(mockParser, new ConjunctionJsonWriter());

        assertEquals(0, run(launcher, noInput, "--legacy", "a:1", "b:2"));
        verify(mockParser).parseWithLegacySupport("a:1 b:2");
        verify(mockParser, never()).parseConjunction(anyString());
    }

    @Test
    void testParsingExceptionFromParser() {
        when(mockParser.parseConjunction("bad")).thenThrow(new ParsingException("boom", "ba"));
        Launcher launcher = new Launcher(mockParser, new ConjunctionJsonWriter());

        assertEquals(1, run(launcher, noInput, "bad"));
        assertEquals("Invalid prompt syntax near 'ba': boom", err.toString(StandardCharsets.UTF_8).strip());
    }

    @Test
    void testErrorWithoutLocation() {
        when(mockParser.parseConjunction("x")).thenThrow(new ParsingException("boom"));
        Launcher launcher = new Launcher(mockParser, new ConjunctionJsonWriter());

        assertEquals(1, run(launcher, noInput, "x"));
        assertEquals("Invalid prompt syntax: boom", err.toString(StandardCharsets.UTF_8).strip());
    }

    @Test
    void testUnexpectedFailure() {
        when(mockParser.parseConjunction(anyString())).thenThrow(new IllegalStateException("broken"));
        Launcher launcher = new Launcher(mockParser, new ConjunctionJsonWriter());

        assertEquals(2, run(launcher, noInput, "x"));
        assertTrue(err.toString(StandardCharsets.UTF_8).contains("broken"));
    }
}
