package com.github.jza.automaton;

import com.github.jza.symbol.Symbol;
import org.jetbrains.annotations.NotNull;

/**
 * A weighted, symbol-labeled edge. Owned by its source state.
 */
public final class Transition {

    @NotNull
    private final State from;

    @NotNull
    private final State to;

    @NotNull
    private final Symbol symbol;

    private double count;

    Transition(@NotNull State from, @NotNull State to, @NotNull Symbol symbol, double count) {
        if (count < 0 || Double.isNaN(count)) {
            throw new IllegalArgumentException("Transition count must be non-negative, got " + count);
        }
        this.from = from;
        this.to = to;
        this.symbol = symbol;
        this.count = count;
    }

    @NotNull
    public State getFrom() {
        return from;
    }

    @NotNull
    public State getTo() {
        return to;
    }

    @NotNull
    public Symbol getSymbol() {
        return symbol;
    }

    public double getCount() {
        return count;
    }

    /**
     * Share of this edge in the total weight leaving its source state.
     * An untrained source state gives every edge probability 0.
     */
    public double getProbability() {
        double total = from.getTotalCount();
        if (total == 0.0) return 0.0;
        return count / total;
    }

    void credit(double amount) {
        count += amount;
    }

    @Override
    public String toString() {
        return from.getName() + " =[" + symbol + "]=> " + to.getName();
    }
}
