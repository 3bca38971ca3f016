package gr.imsi.athenarc.regex.compiler;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import gr.imsi.athenarc.regex.nfa.CharClassState;
import gr.imsi.athenarc.regex.nfa.NFA;
import gr.imsi.athenarc.regex.nfa.StateKind;

public class PatternTokenizerTest {

    private NFA.Builder builder;
    private PatternTokenizer tokenizer;

    @BeforeEach
    void setUp() {
        builder = new NFA.Builder();
        tokenizer = new PatternTokenizer(builder);
    }

    @Test
    public void testEmptyPatternYieldsOnlyEnd() {
        List<PatternItem> items = tokenizer.tokenize("");
        assertEquals(1, items.size());
        assertSame(builder.getEndState(), items.get(0).getState());
    }

    @Test
    public void testAtomsAndQuantifiers() {
        List<PatternItem> items = tokenizer.tokenize("a*4.+[^0-9]");
        assertEquals(5, items.size());

        assertEquals(StateKind.LITERAL, items.get(0).getState().getKind());
        assertSame(RepetitionFactor.zeroOrMore(), items.get(0).getRepetitionFactor());

        assertEquals(StateKind.LITERAL, items.get(1).getState().getKind());
        assertFalse(items.get(1).isQuantified());

        assertEquals(StateKind.ANY_CHAR, items.get(2).getState().getKind());
        assertSame(RepetitionFactor.oneOrMore(), items.get(2).getRepetitionFactor());

        assertEquals(StateKind.CHAR_CLASS, items.get(3).getState().getKind());
        assertTrue(((CharClassState) items.get(3).getState()).isNegated());

        assertEquals(StateKind.END, items.get(4).getState().getKind());
    }

    /**
     * Metacharacters other than '.', '[', '*' and '+' are plain literals.
     */
    @Test
    public void testOtherPunctuationIsLiteral() {
        List<PatternItem> items = tokenizer.tokenize("]^-?(|)");
        assertEquals(8, items.size());
        for (int i = 0; i < 7; i++) {
            assertEquals(StateKind.LITERAL, items.get(i).getState().getKind(), "item " + i);
        }
    }

    @Test
    public void testClassBodyIsTakenUpToFirstClosingBracket() {
        List<PatternItem> items = tokenizer.tokenize("[]]");
        assertEquals(3, items.size());
        assertEquals("[]", items.get(0).getState().getLabel());
        assertEquals(StateKind.LITERAL, items.get(1).getState().getKind());
    }

    @Test
    public void testLoneQuantifiers() {
        MalformedPatternException star = assertThrows(MalformedPatternException.class, () -> tokenizer.tokenize("*"));
        assertEquals(0, star.getIndex());
        assertEquals("*", star.getPattern());
        assertThrows(MalformedPatternException.class, () -> tokenizer.tokenize("+"));
    }

    @Test
    public void testDoubleQuantifier() {
        MalformedPatternException e = assertThrows(MalformedPatternException.class, () -> tokenizer.tokenize("ab**"));
        assertEquals(3, e.getIndex());
        assertThrows(MalformedPatternException.class, () -> new PatternTokenizer(new NFA.Builder()).tokenize("a+*"));
        assertThrows(MalformedPatternException.class, () -> new PatternTokenizer(new NFA.Builder()).tokenize("a*+"));
    }

    @Test
    public void testUnmatchedBracket() {
        MalformedPatternException e = assertThrows(MalformedPatternException.class, () -> tokenizer.tokenize("x[a-z"));
        assertEquals(1, e.getIndex());
        assertTrue(e.getMessage().contains("Unmatched"), e.getMessage());
        assertThrows(MalformedPatternException.class, () -> new PatternTokenizer(new NFA.Builder()).tokenize("["));
    }

    @Test
    public void testNonAsciiOutsideClass() {
        MalformedPatternException e = assertThrows(MalformedPatternException.class, () -> tokenizer.tokenize("café"));
        assertEquals(3, e.getIndex());
        assertTrue(e.getMessage().contains("U+00E9"), e.getMessage());
    }

    @Test
    public void testNonAsciiInsideClassIsAllowed() {
        List<PatternItem> items = tokenizer.tokenize("[é]");
        assertTrue(items.get(0).getState().accepts('é'));
    }

    @Test
    public void testRepetitionFactor() {
        assertEquals(0, RepetitionFactor.zeroOrMore().getMinRepetitions());
        assertEquals(Integer.MAX_VALUE, RepetitionFactor.zeroOrMore().getMaxRepetitions());
        assertEquals(1, RepetitionFactor.oneOrMore().getMinRepetitions());
        assertTrue(RepetitionFactor.zeroOrMore().isOptional());
        assertFalse(RepetitionFactor.oneOrMore().isOptional());
        assertFalse(RepetitionFactor.once().isQuantified());
        assertSame(RepetitionFactor.zeroOrMore(), RepetitionFactor.fromSymbol('*'));
        assertSame(RepetitionFactor.oneOrMore(), RepetitionFactor.fromSymbol('+'));
        assertThrows(IllegalArgumentException.class, () -> RepetitionFactor.fromSymbol('?'));
        assertEquals("{*}", RepetitionFactor.zeroOrMore().toString());
    }
}
