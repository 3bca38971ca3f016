package gr.imsi.athenarc.regex;

import java.util.List;

import org.jetbrains.annotations.NotNull;

import gr.imsi.athenarc.regex.compiler.MalformedPatternException;
import gr.imsi.athenarc.regex.compiler.PatternCompiler;
import gr.imsi.athenarc.regex.matcher.NFAMatcher;
import gr.imsi.athenarc.regex.nfa.NFA;
import gr.imsi.athenarc.regex.nfa.NFAState;

/**
 * A compiled pattern. Compile once, then match any number of strings, from
 * any number of threads.
 */
public class RegexFSM {
    private final String pattern;
    private final NFA nfa;

    private RegexFSM(String pattern, NFA nfa) {
        this.pattern = pattern;
        this.nfa = nfa;
    }

    /**
     * @throws MalformedPatternException if the pattern is not valid
     */
    public static RegexFSM compile(@NotNull String pattern) {
        return new RegexFSM(pattern, new PatternCompiler().compile(pattern));
    }

    public boolean matches(@NotNull String input) {
        return NFAMatcher.matches(nfa, input);
    }

    public List<NFAState> walkFirstPath(@NotNull String input) {
        return NFAMatcher.walkFirstPath(nfa, input);
    }

    public String getPattern() {
        return pattern;
    }

    public NFA getNfa() {
        return nfa;
    }

    public String toDotFormat() {
        return nfa.toDotFormat();
    }

    @Override
    public String toString() {
        return "RegexFSM{pattern=\"" + pattern + "\", states=" + nfa.size() + "}";
    }
}
