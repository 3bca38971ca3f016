package gr.imsi.athenarc.regex.nfa;

public final class LiteralState extends NFAState {
    private final char symbol;

    LiteralState(int id, char symbol) {
        super(id);
        this.symbol = symbol;
    }

    public char getSymbol() {
        return symbol;
    }

    @Override
    public StateKind getKind() {
        return StateKind.LITERAL;
    }

    @Override
    public boolean accepts(char c) {
        return symbol == c;
    }

    @Override
    public String getLabel() {
        return String.valueOf(symbol);
    }
}
