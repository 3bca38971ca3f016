package gr.imsi.athenarc.regex.matcher;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import gr.imsi.athenarc.regex.nfa.NFA;
import gr.imsi.athenarc.regex.nfa.NFAState;

/**
 * Runs input strings against a compiled {@link NFA}.
 *
 * Matching keeps every reachable state at once. A string is accepted when,
 * after its last character, some active state has an edge into the end
 * state. The end state itself never becomes active.
 */
public class NFAMatcher {
    private static final Logger LOG = LoggerFactory.getLogger(NFAMatcher.class);

    private NFAMatcher() {
    }

    /**
     * Checks whether the whole of {@code input} is matched by {@code nfa}.
     * Never throws for any input.
     */
    public static boolean matches(@NotNull NFA nfa, @NotNull String input) {
        if (input.isEmpty()) {
            // only the entry state's own edges are looked at
            return nfa.hasTransitionToEnd(nfa.getEntryState());
        }

        Set<NFAState> activeStates = new LinkedHashSet<>();
        activeStates.add(nfa.getEntryState());

        for (int i = 0; i < input.length(); i++) {
            char c = input.charAt(i);
            Set<NFAState> nextActive = new LinkedHashSet<>();
            for (NFAState state : activeStates) {
                for (NFAState target : nfa.targetsOf(state)) {
                    if (target.accepts(c)) {
                        nextActive.add(target);
                    }
                }
            }
            LOG.trace("After '{}' at index {}: {}", c, i, nextActive);

            if (nextActive.isEmpty()) {
                LOG.debug("Rejected \"{}\": no transition on '{}' at index {}", input, c, i);
                return false;
            }
            activeStates = nextActive;
        }

        for (NFAState state : activeStates) {
            if (nfa.hasTransitionToEnd(state)) {
                return true;
            }
        }
        LOG.debug("Rejected \"{}\": no active state reaches the end", input);
        return false;
    }

    /**
     * Follows a single path through the automaton, always taking the first
     * transition that accepts the next character. The first step is resolved
     * on the entry state's edges directly, since the entry state is not
     * walkable.
     *
     * @return the states visited, one per consumed character; shorter than
     *         {@code input} if the walk got stuck
     */
    public static List<NFAState> walkFirstPath(@NotNull NFA nfa, @NotNull String input) {
        if (input.isEmpty()) {
            return Collections.emptyList();
        }
        List<NFAState> path = new ArrayList<>(input.length());

        NFAState current = null;
        for (NFAState target : nfa.targetsOf(nfa.getEntryState())) {
            if (target.accepts(input.charAt(0))) {
                current = target;
                break;
            }
        }
        if (current == null) {
            return path;
        }
        path.add(current);

        for (int i = 1; i < input.length(); i++) {
            Optional<NFAState> next = nfa.firstMatchingTransition(current, input.charAt(i));
            if (!next.isPresent()) {
                LOG.debug("First-path walk of \"{}\" stopped at index {}", input, i);
                break;
            }
            current = next.get();
            path.add(current);
        }
        return path;
    }
}
