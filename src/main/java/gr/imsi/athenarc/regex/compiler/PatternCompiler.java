package gr.imsi.athenarc.regex.compiler;

import java.util.List;

import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Preconditions;

import gr.imsi.athenarc.regex.nfa.NFA;
import gr.imsi.athenarc.regex.nfa.NFAState;

/**
 * Compiles a pattern into an {@link NFA}.
 *
 * Atoms are chained in order from the entry state. A {@code +} atom gets a
 * self-loop. A {@code *} atom gets a self-loop plus a bypass edge from the
 * previous state to the next item, which lets it be skipped. The bypass
 * looks exactly one item ahead: in {@code a*b*} the entry state can reach
 * {@code a} or {@code b}, but not the end state.
 */
public class PatternCompiler {
    private static final Logger LOG = LoggerFactory.getLogger(PatternCompiler.class);

    /**
     * @throws MalformedPatternException if the pattern is not valid
     */
    public NFA compile(@NotNull String pattern) {
        Preconditions.checkNotNull(pattern, "pattern");
        NFA.Builder builder = new NFA.Builder();
        List<PatternItem> items = new PatternTokenizer(builder).tokenize(pattern);
        connectStates(builder, items);
        NFA nfa = builder.build();
        LOG.debug("Compiled \"{}\" into an automaton of {} states", pattern, nfa.size());
        return nfa;
    }

    private void connectStates(NFA.Builder builder, List<PatternItem> items) {
        NFAState current = builder.getEntryState();

        for (int i = 0; i < items.size(); i++) {
            PatternItem item = items.get(i);
            NFAState state = item.getState();

            if (item.isQuantified()) {
                if (item.getRepetitionFactor().isOptional() && i + 1 < items.size()) {
                    NFAState bypass = items.get(i + 1).getState();
                    LOG.trace("Bypass {} -> {}", current, bypass);
                    builder.connect(current, bypass);
                }
                builder.connect(state, state);
            }
            builder.connect(current, state);
            current = state;
        }
    }
}
