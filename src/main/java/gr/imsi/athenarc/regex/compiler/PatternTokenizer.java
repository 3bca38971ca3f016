package gr.imsi.athenarc.regex.compiler;

import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import gr.imsi.athenarc.regex.nfa.NFA;

/**
 * Splits a pattern into atoms, each with its quantifier attached, and
 * creates the matching states in the automaton under construction.
 */
public class PatternTokenizer {
    private static final Logger LOG = LoggerFactory.getLogger(PatternTokenizer.class);

    private static final char MAX_ASCII = 0x7F;

    private final NFA.Builder builder;

    public PatternTokenizer(NFA.Builder builder) {
        this.builder = builder;
    }

    /**
     * Tokenizes {@code pattern}. The returned list always ends with the
     * automaton's end state.
     *
     * @throws MalformedPatternException on an unclosed class, a quantifier
     *         with nothing to apply to, or a non-ASCII character outside a class
     */
    public List<PatternItem> tokenize(String pattern) {
        List<PatternItem> items = new ArrayList<>();
        int i = 0;
        while (i < pattern.length()) {
            char c = pattern.charAt(i);

            if (c == '[') {
                int closing = pattern.indexOf(']', i + 1);
                if (closing == -1) {
                    throw new MalformedPatternException("Unmatched opening bracket", pattern, i);
                }
                items.add(PatternItem.of(builder.addCharClass(pattern.substring(i + 1, closing))));
                i = closing + 1;
            } else if (c == '.') {
                items.add(PatternItem.of(builder.addAnyChar()));
                i++;
            } else if (RepetitionFactor.isQuantifier(c)) {
                if (items.isEmpty()) {
                    throw new MalformedPatternException("Quantifier '" + c + "' has nothing to quantify", pattern, i);
                }
                PatternItem previous = items.remove(items.size() - 1);
                if (previous.isQuantified()) {
                    throw new MalformedPatternException("Quantifier '" + c + "' follows another quantifier", pattern, i);
                }
                items.add(previous.withRepetition(RepetitionFactor.fromSymbol(c)));
                i++;
            } else if (c <= MAX_ASCII) {
                items.add(PatternItem.of(builder.addLiteral(c)));
                i++;
            } else {
                throw new MalformedPatternException(
                    String.format("Unsupported character U+%04X", (int) c), pattern, i);
            }
        }

        items.add(PatternItem.of(builder.getEndState()));
        LOG.debug("Tokenized \"{}\" into {}", pattern, items);
        return items;
    }
}
