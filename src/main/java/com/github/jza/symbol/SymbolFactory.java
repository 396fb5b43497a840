package com.github.jza.symbol;

import org.jetbrains.annotations.NotNull;

/**
 * Reconstructs symbols from their persisted {@code (numeral, quality)} form.
 */
@FunctionalInterface
public interface SymbolFactory {

    @NotNull
    Symbol create(@NotNull String numeral, @NotNull String quality);

}
