package gr.imsi.athenarc.regex.compiler;

import gr.imsi.athenarc.regex.nfa.NFAState;

/**
 * One element of a tokenized pattern: an atom state together with the
 * repetition applied to it. The trailing end marker is an item too, always
 * with {@link RepetitionFactor#once()}.
 */
public class PatternItem {
    private final NFAState state;
    private final RepetitionFactor repetitionFactor;

    public PatternItem(NFAState state, RepetitionFactor repetitionFactor) {
        this.state = state;
        this.repetitionFactor = repetitionFactor;
    }

    public static PatternItem of(NFAState state) {
        return new PatternItem(state, RepetitionFactor.once());
    }

    public NFAState getState() {
        return state;
    }

    public RepetitionFactor getRepetitionFactor() {
        return repetitionFactor;
    }

    public boolean isQuantified() {
        return repetitionFactor.isQuantified();
    }

    public PatternItem withRepetition(RepetitionFactor factor) {
        return new PatternItem(state, factor);
    }

    @Override
    public String toString() {
        return state.getLabel() + repetitionFactor;
    }
}
