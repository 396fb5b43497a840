package com.github.jza.symbol;

import org.jetbrains.annotations.NotNull;

import java.util.Objects;

/**
 * Plain value implementation of {@link Symbol}: a roman numeral and a quality marker.
 *
 * It knows nothing about intervals or chord spelling, it only gives the automaton
 * something comparable to work with.
 */
public final class NumeralSymbol implements Symbol {

    /**
     * Quality markers recognised by {@link #parse(String)}.
     */
    public static final String QUALITIES = "Mmxøos";

    public static final String DEFAULT_QUALITY = "M";

    @NotNull
    public static final SymbolFactory FACTORY = NumeralSymbol::of;

    @NotNull
    private final String numeral;

    @NotNull
    private final String quality;

    private NumeralSymbol(@NotNull String numeral, @NotNull String quality) {
        this.numeral = numeral;
        this.quality = quality;
    }

    @NotNull
    public static NumeralSymbol of(@NotNull String numeral, @NotNull String quality) {
        if (numeral.isEmpty()) {
            throw new IllegalArgumentException("Symbol numeral must not be empty");
        }
        return new NumeralSymbol(numeral, quality);
    }

    /**
     * Parse a symbol written as numeral followed by an optional quality marker,
     * e.g. {@code "IIm"}, {@code "bVIIx"} or {@code "I"} (major).
     */
    @NotNull
    public static NumeralSymbol parse(@NotNull String text) {
        String trimmed = text.trim();
        if (trimmed.isEmpty()) {
            throw new IllegalArgumentException("Cannot parse an empty symbol");
        }
        int last = trimmed.length() - 1;
        char marker = trimmed.charAt(last);
        // "I" alone is a numeral, never a quality
        if (last > 0 && QUALITIES.indexOf(marker) >= 0) {
            return of(trimmed.substring(0, last), String.valueOf(marker));
        }
        return of(trimmed, DEFAULT_QUALITY);
    }

    @NotNull
    @Override
    public String getNumeral() {
        return numeral;
    }

    @NotNull
    @Override
    public String getQuality() {
        return quality;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof NumeralSymbol)) return false;
        NumeralSymbol that = (NumeralSymbol) o;
        return numeral.equals(that.numeral) && quality.equals(that.quality);
    }

    @Override
    public int hashCode() {
        return Objects.hash(numeral, quality);
    }

    @Override
    public String toString() {
        return numeral + quality;
    }
}
