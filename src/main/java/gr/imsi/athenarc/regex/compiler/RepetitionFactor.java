package gr.imsi.athenarc.regex.compiler;

/**
 * Represents how many times a pattern atom may be repeated. Only the three
 * forms the pattern syntax can express exist: a bare atom, {@code *} and
 * {@code +}.
 */
public class RepetitionFactor {
    private static final RepetitionFactor ONCE = new RepetitionFactor(1, 1, '\0');
    private static final RepetitionFactor ZERO_OR_MORE = new RepetitionFactor(0, Integer.MAX_VALUE, '*');
    private static final RepetitionFactor ONE_OR_MORE = new RepetitionFactor(1, Integer.MAX_VALUE, '+');

    private final int minRepetitions;
    private final int maxRepetitions;
    private final char symbol;

    /**
     * Exactly one occurrence (an unquantified atom).
     */
    public static RepetitionFactor once() {
        return ONCE;
    }

    /**
     * Zero or more occurrences ({@code *}).
     */
    public static RepetitionFactor zeroOrMore() {
        return ZERO_OR_MORE;
    }

    /**
     * One or more occurrences ({@code +}).
     */
    public static RepetitionFactor oneOrMore() {
        return ONE_OR_MORE;
    }

    /**
     * @param symbol a quantifier character
     * @return the factor for {@code symbol}
     * @throws IllegalArgumentException if {@code symbol} is not a quantifier
     */
    public static RepetitionFactor fromSymbol(char symbol) {
        switch (symbol) {
            case '*':
                return ZERO_OR_MORE;
            case '+':
                return ONE_OR_MORE;
            default:
                throw new IllegalArgumentException("Not a quantifier: " + symbol);
        }
    }

    public static boolean isQuantifier(char c) {
        return c == '*' || c == '+';
    }

    private RepetitionFactor(int minRepetitions, int maxRepetitions, char symbol) {
        this.minRepetitions = minRepetitions;
        this.maxRepetitions = maxRepetitions;
        this.symbol = symbol;
    }

    public int getMinRepetitions() {
        return minRepetitions;
    }

    public int getMaxRepetitions() {
        return maxRepetitions;
    }

    public boolean isQuantified() {
        return this != ONCE;
    }

    public boolean isOptional() {
        return minRepetitions == 0;
    }

    @Override
    public String toString() {
        if (!isQuantified()) {
            return "{1}";
        }
        return "{" + symbol + "}";
    }
}
