package gr.imsi.athenarc.regex.nfa;

/**
 * The start node of an automaton. Consumes no character.
 */
public final class EntryState extends NFAState {

    EntryState(int id) {
        super(id);
    }

    @Override
    public StateKind getKind() {
        return StateKind.ENTRY;
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
        return "entry";
    }
}
