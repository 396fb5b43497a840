package com.github.jza.corpus;

import com.github.jza.symbol.Symbol;
import org.jetbrains.annotations.NotNull;

import java.util.List;
import java.util.Map;

/**
 * One piece of a corpus, as a symbol list.
 */
public interface Chart {

    /**
     * Symbols of the whole chart. With wrap-around, the beginning of the chart is repeated
     * after its end so that the turnaround back to the top is part of the sequence.
     */
    @NotNull
    List<Symbol> getSymbols(boolean withWrapAround);

    /**
     * Symbols of every section, keyed by section name.
     */
    @NotNull
    Map<String, List<Symbol>> getSections(boolean withWrapAround);

}
