package com.github.jza.automaton;

import com.github.jza.symbol.Symbol;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Collections;
import java.util.List;

/**
 * Where and why a symbol sequence was rejected.
 */
public final class FailureReport {

    @NotNull
    private final List<Symbol> symbols;

    private final int index;

    @NotNull
    private final List<State> previousStates;

    private final boolean invalidEndState;

    FailureReport(@NotNull List<Symbol> symbols, int index, @NotNull List<State> previousStates, boolean invalidEndState) {
        this.symbols = Collections.unmodifiableList(symbols);
        this.index = index;
        this.previousStates = Collections.unmodifiableList(previousStates);
        this.invalidEndState = invalidEndState;
    }

    /**
     * The offending symbol, or null when an empty sequence was analysed.
     */
    @Nullable
    public Symbol getSymbol() {
        return index < symbols.size() ? symbols.get(index) : null;
    }

    @NotNull
    public List<Symbol> getSymbols() {
        return symbols;
    }

    public int getIndex() {
        return index;
    }

    /**
     * States reached just before the failing symbol. For an invalid end state these are
     * the states reached after the last symbol.
     */
    @NotNull
    public List<State> getPreviousStates() {
        return previousStates;
    }

    /**
     * True if every symbol could be read but no walk finished in an end state.
     */
    public boolean isInvalidEndState() {
        return invalidEndState;
    }

    @Override
    public String toString() {
        return "FailureReport{index=" + index + ", symbol=" + getSymbol()
                + ", previousStates=" + previousStates + ", invalidEndState=" + invalidEndState + "}";
    }
}
