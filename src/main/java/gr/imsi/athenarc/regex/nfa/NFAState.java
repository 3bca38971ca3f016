package gr.imsi.athenarc.regex.nfa;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.google.common.collect.ImmutableList;

/**
 * A node of the automaton. Subclasses form a fixed set of variants, one per
 * {@link StateKind}, and differ only in which characters they accept.
 *
 * States are created by {@link NFA.Builder} and live as long as the owning
 * {@link NFA}. Their transitions are mutable only while the builder is open.
 */
public abstract class NFAState {
    private final int id;
    private List<Transition> transitions = new ArrayList<>();

    NFAState(int id) {
        this.id = id;
    }

    /**
     * @return the index of this state inside its automaton
     */
    public int getId() {
        return id;
    }

    public abstract StateKind getKind();

    /**
     * Checks whether the given character is consumed by this state.
     *
     * @param c the character to test
     * @return true if entering this state on {@code c} is allowed
     */
    public abstract boolean accepts(char c);

    /**
     * Whether a single-path walk may leave this state through
     * {@link NFA#firstMatchingTransition(NFAState, char)}.
     */
    public boolean isWalkable() {
        return true;
    }

    /**
     * Short human readable description, used for transition labels and DOT output.
     */
    public abstract String getLabel();

    /**
     * @return a read-only view; edges are added through {@link NFA.Builder#connect}
     */
    public List<Transition> getTransitions() {
        return Collections.unmodifiableList(transitions);
    }

    void addTransition(Transition t) {
        transitions.add(t);
    }

    void freeze() {
        transitions = ImmutableList.copyOf(transitions);
    }

    @Override
    public String toString() {
        return getKind() + "#" + id + " (" + getLabel() + ", transitions=" + transitions.size() + ")";
    }
}
