package gr.imsi.athenarc.regex.nfa;

/**
 * The accepting node of an automaton. Consumes no character and never has
 * outgoing transitions.
 */
public final class EndState extends NFAState {

    EndState(int id) {
        super(id);
    }

    @Override
    public StateKind getKind() {
        return StateKind.END;
    }

    @Override
    public boolean accepts(char c) {
        return false;
    }

    @Override
    public boolean isWalkable() {
        return false;
    }

    @Override
    public String getLabel() {
        return "end";
    }

    @Override
    void addTransition(Transition t) {
        throw new IllegalStateException("End state cannot have outgoing transitions");
    }
}
