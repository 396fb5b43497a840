package com.github.jza.io;

import com.github.jza.symbol.Symbol;
import com.github.jza.symbol.SymbolFactory;
import org.jetbrains.annotations.NotNull;

import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;

/**
 * Writes a symbol as its numeral and quality, reads it back through a {@link SymbolFactory}.
 */
public final class SymbolSerializer implements Serializer<Symbol> {

    @NotNull
    private final SymbolFactory factory;

    public SymbolSerializer(@NotNull SymbolFactory factory) {
        this.factory = factory;
    }

    @Override
    public void write(@NotNull DataOutputStream stream, @NotNull Symbol item) throws IOException {
        stream.writeUTF(item.getNumeral());
        stream.writeUTF(item.getQuality());
    }

    @NotNull
    @Override
    public Symbol read(@NotNull DataInputStream stream) throws IOException {
        String numeral = stream.readUTF();
        String quality = stream.readUTF();
        return factory.create(numeral, quality);
    }
}
