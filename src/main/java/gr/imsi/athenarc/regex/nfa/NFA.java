package gr.imsi.athenarc.regex.nfa;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.jetbrains.annotations.NotNull;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

/**
 * A compiled automaton. Owns every state it contains; states refer to each
 * other only through their ids in {@link #getStates()}.
 *
 * Instances are produced by {@link Builder} and are immutable afterwards, so
 * they can be matched from several threads without synchronization.
 */
public class NFA {
    private final List<NFAState> states;
    private final EntryState entryState;
    private final EndState endState;

    private NFA(List<NFAState> states, EntryState entryState, EndState endState) {
        this.states = ImmutableList.copyOf(states);
        this.entryState = entryState;
        this.endState = endState;
    }

    public EntryState getEntryState() {
        return entryState;
    }

    public EndState getEndState() {
        return endState;
    }

    public NFAState getState(int id) {
        return states.get(id);
    }

    public List<NFAState> getStates() {
        return states;
    }

    public int size() {
        return states.size();
    }

    /**
     * @return the targets of {@code state}'s transitions, in insertion order
     */
    public List<NFAState> targetsOf(@NotNull NFAState state) {
        List<NFAState> targets = new ArrayList<>(state.getTransitions().size());
        for (Transition t : state.getTransitions()) {
            targets.add(states.get(t.getTargetId()));
        }
        return targets;
    }

    /**
     * Finds the first transition out of {@code state}, in insertion order,
     * whose target accepts {@code c}. Entry and End never yield a transition.
     *
     * @return the target state, or empty if no transition accepts {@code c}
     */
    public Optional<NFAState> firstMatchingTransition(@NotNull NFAState state, char c) {
        if (!state.isWalkable()) {
            return Optional.empty();
        }
        for (Transition t : state.getTransitions()) {
            NFAState target = states.get(t.getTargetId());
            if (target.accepts(c)) {
                return Optional.of(target);
            }
        }
        return Optional.empty();
    }

    public boolean hasTransitionToEnd(@NotNull NFAState state) {
        for (Transition t : state.getTransitions()) {
            if (t.getTargetId() == endState.getId()) {
                return true;
            }
        }
        return false;
    }

    public String toDotFormat() {
        StringBuilder sb = new StringBuilder();
        sb.append("digraph NFA {\n");
        sb.append("  rankdir=LR;\n");
        sb.append("  node [shape = circle];\n");

        for (NFAState state : states) {
            String label = escape(state.getLabel());
            if (state.getKind() == StateKind.END) {
                sb.append(String.format("  %d [shape=doublecircle, label=\"%s\"];\n", state.getId(), label));
            } else {
                sb.append(String.format("  %d [label=\"%s\"];\n", state.getId(), label));
            }
        }

        for (NFAState state : states) {
            for (Transition transition : state.getTransitions()) {
                sb.append(String.format("  %d -> %d [label=\"%s\"];\n",
                    state.getId(), transition.getTargetId(), escape(transition.getLabel())));
            }
        }
        sb.append("}\n");
        return sb.toString();
    }

    private static String escape(String label) {
        return label.replace("\\", "\\\\").replace("\"", "\\\"");
    }

    /**
     * Collects states and transitions for a single automaton. The entry and
     * end states are created up front; {@link #build()} freezes the graph.
     */
    public static class Builder {
        private final List<NFAState> states = new ArrayList<>();
        private final EntryState entryState;
        private final EndState endState;
        private boolean built;

        public Builder() {
            this.entryState = register(new EntryState(0));
            this.endState = register(new EndState(1));
        }

        public EntryState getEntryState() {
            return entryState;
        }

        public EndState getEndState() {
            return endState;
        }

        public AnyCharState addAnyChar() {
            return register(new AnyCharState(states.size()));
        }

        public LiteralState addLiteral(char symbol) {
            return register(new LiteralState(states.size(), symbol));
        }

        public CharClassState addCharClass(String definition) {
            return register(new CharClassState(states.size(), definition));
        }

        /**
         * Adds a transition {@code from -> to}. Duplicate edges are kept.
         */
        public Builder connect(@NotNull NFAState from, @NotNull NFAState to) {
            checkOpen();
            Preconditions.checkArgument(owns(from) && owns(to),
                "States %s and %s must belong to this automaton", from, to);
            from.addTransition(new Transition(to.getId(), to.getLabel()));
            return this;
        }

        public NFA build() {
            checkOpen();
            built = true;
            for (NFAState state : states) {
                state.freeze();
            }
            return new NFA(states, entryState, endState);
        }

        private boolean owns(NFAState state) {
            return state.getId() < states.size() && states.get(state.getId()) == state;
        }

        private void checkOpen() {
            Preconditions.checkState(!built, "Automaton has already been built");
        }

        private <S extends NFAState> S register(S state) {
            checkOpen();
            states.add(state);
            return state;
        }
    }
}
