package gr.imsi.athenarc.regex.compiler;

/**
 * Thrown when a pattern cannot be compiled. No automaton is produced.
 */
public class MalformedPatternException extends IllegalArgumentException {
    private static final long serialVersionUID = 1L;

    private final String pattern;
    private final int index;

    public MalformedPatternException(String message, String pattern, int index) {
        super(message + " at index " + index + " in pattern \"" + pattern + "\"");
        this.pattern = pattern;
        this.index = index;
    }

    public String getPattern() {
        return pattern;
    }

    /**
     * @return position in the pattern where the problem was found
     */
    public int getIndex() {
        return index;
    }
}
