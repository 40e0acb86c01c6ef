package org.carball.sqladvisor.rules;

import java.util.Optional;

public enum Operator {
    EQ("=="),
    NE("!="),
    GT(">"),
    GE(">="),
    LT("<"),
    LE("<=");

    private final String symbol;

    Operator(String symbol) {
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }

    public boolean isOrdering() {
        return this != EQ && this != NE;
    }

    public static Optional<Operator> fromSymbol(String symbol) {
        for (Operator operator : values()) {
            if (operator.symbol.equals(symbol)) {
                return Optional.of(operator);
            }
        }
        return Optional.empty();
    }

    boolean compare(double actual, double expected) {
        switch (this) {
            case EQ:
                return Double.compare(actual, expected) == 0;
            case NE:
                return Double.compare(actual, expected) != 0;
            case GT:
                return actual > expected;
            case GE:
                return actual >= expected;
            case LT:
                return actual < expected;
            case LE:
                return actual <= expected;
            default:
                throw new IllegalStateException("Unhandled operator " + this);
        }
    }
}
