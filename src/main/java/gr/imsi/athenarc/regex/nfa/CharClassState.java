package gr.imsi.athenarc.regex.nfa;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableRangeSet;
import com.google.common.collect.Range;
import com.google.common.collect.RangeSet;
import com.google.common.collect.TreeRangeSet;

/**
 * A bracketed character class such as {@code [a-z0-9]} or {@code [^0-9]}.
 *
 * The class body is read left to right. A leading {@code ^} negates the class.
 * {@code x-y} adds every character from {@code x} to {@code y} inclusive when
 * both endpoints are present; any other character is added on its own, so a
 * trailing or leading {@code -} is literal. A reversed range such as
 * {@code z-a} adds nothing.
 */
public final class CharClassState extends NFAState {
    private final String definition;
    private final RangeSet<Character> allowed;
    private final boolean negated;

    CharClassState(int id, String definition) {
        super(id);
        Preconditions.checkNotNull(definition, "class definition");
        this.definition = definition;

        String body = definition;
        boolean negate = false;
        if (!body.isEmpty() && body.charAt(0) == '^') {
            negate = true;
            body = body.substring(1);
        }

        RangeSet<Character> chars = TreeRangeSet.create();
        int i = 0;
        while (i < body.length()) {
            if (i + 2 < body.length() && body.charAt(i + 1) == '-') {
                char from = body.charAt(i);
                char to = body.charAt(i + 2);
                if (from <= to) {
                    chars.add(Range.closed(from, to));
                }
                i += 3;
            } else {
                chars.add(Range.singleton(body.charAt(i)));
                i += 1;
            }
        }
        this.allowed = ImmutableRangeSet.copyOf(chars);
        this.negated = negate;
    }

    public RangeSet<Character> getAllowed() {
        return allowed;
    }

    public boolean isNegated() {
        return negated;
    }

    @Override
    public StateKind getKind() {
        return StateKind.CHAR_CLASS;
    }

    @Override
    public boolean accepts(char c) {
        return allowed.contains(c) != negated;
    }

    @Override
    public String getLabel() {
        return "[" + definition + "]";
    }
}
