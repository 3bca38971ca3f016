package gr.imsi.athenarc.regex.nfa;

/**
 * Matches any single character ({@code .}).
 */
public final class AnyCharState extends NFAState {

    AnyCharState(int id) {
        super(id);
    }

    @Override
    public StateKind getKind() {
        return StateKind.ANY_CHAR;
    }

    @Override
    public boolean accepts(char c) {
        return true;
    }

    @Override
    public String getLabel() {
        return ".";
    }
}
