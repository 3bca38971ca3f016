package gr.imsi.athenarc.regex.nfa;

/**
 * An outgoing edge of a state. Holds the arena id of its target rather than
 * the target itself, so the graph may contain cycles without states owning
 * each other.
 */
public class Transition {
    private final int targetId;
    private final String label;

    Transition(int targetId, String label) {
        this.targetId = targetId;
        this.label = label;
    }

    public int getTargetId() {
        return targetId;
    }

    public String getLabel() {
        return label;
    }

    @Override
    public String toString() {
        return "@Transition target=" + targetId + " label=" + label;
    }
}
