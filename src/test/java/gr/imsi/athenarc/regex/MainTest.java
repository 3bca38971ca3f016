package gr.imsi.athenarc.regex;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;

import org.junit.jupiter.api.Test;

public class MainTest {

    private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();

    private int run(String... args) {
        PrintStream out = new PrintStream(buffer, true, StandardCharsets.UTF_8);
        return new Main().run(out, args);
    }

    private List<String> lines() {
        return Arrays.asList(buffer.toString(StandardCharsets.UTF_8).split("\\R"));
    }

    @Test
    public void testPatternFromArguments() {
        assertEquals(0, run("-pattern", "[a-z]+[0-9]", "-inputs", "abc1", "ABC1", "1"));
        assertEquals(Arrays.asList("[a-z]+[0-9]:", "true", "false", "false"), lines());
    }

    @Test
    public void testDemoSamples() {
        assertEquals(0, run());
        assertEquals(Arrays.asList(
            "Quantifier tests:", "true", "true", "false",
            "",
            "Character class tests:", "true", "true", "false", "false",
            "",
            "Negated character class test:", "true", "false"), lines());
    }

    @Test
    public void testTrace() {
        assertEquals(0, run("-pattern", "ab", "-inputs", "ab", "-trace"));
        assertEquals(Arrays.asList("ab:", "true", "  path: a -> b"), lines());
    }

    @Test
    public void testDot() {
        assertEquals(0, run("-pattern", "a", "-dot"));
        assertTrue(lines().contains("digraph NFA {"));
    }

    @Test
    public void testMalformedPatternIsReported() {
        assertEquals(1, run("-pattern", "[a-z", "-inputs", "a"));
        assertTrue(lines().get(0).startsWith("error: Unmatched opening bracket"), lines().toString());
    }

    @Test
    public void testUnknownArgument() {
        assertEquals(2, run("-bogus"));
    }

    @Test
    public void testHelp() {
        assertEquals(0, run("--help"));
    }
}
