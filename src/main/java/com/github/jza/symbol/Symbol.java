package com.github.jza.symbol;

import org.jetbrains.annotations.NotNull;

/**
 * A harmonic function token, such as {@code bVIIx} or {@code IIm}.
 *
 * The automaton treats symbols as opaque values: two symbols are interchangeable
 * whenever {@link #equals(Object)} says so. Implementations must therefore provide
 * value-based {@code equals} and {@code hashCode}.
 */
public interface Symbol {

    /**
     * Scale degree part of the symbol, e.g. {@code bVII}.
     */
    @NotNull
    String getNumeral();

    /**
     * Chord quality classification, e.g. {@code x} for a dominant seventh.
     */
    @NotNull
    String getQuality();

}
