package gr.imsi.athenarc.regex.nfa;

/**
 * The closed set of state variants an {@link NFA} is built from.
 */
public enum StateKind {
    ENTRY,
    END,
    ANY_CHAR,
    LITERAL,
    CHAR_CLASS
}
