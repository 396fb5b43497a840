package com.github.jza.io;

import org.jetbrains.annotations.NotNull;

import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Binary framing of values that the automaton treats as opaque, such as symbols.
 */
public interface Serializer<T> {

    void write(@NotNull DataOutputStream stream, @NotNull T item) throws IOException;

    @NotNull
    T read(@NotNull DataInputStream stream) throws IOException;

    /**
     * Length-prefixed list of items.
     */
    default void writeAll(@NotNull DataOutputStream stream, @NotNull List<? extends T> items) throws IOException {
        stream.writeInt(items.size());
        for (T item : items) {
            write(stream, item);
        }
    }

    @NotNull
    default List<T> readAll(@NotNull DataInputStream stream) throws IOException {
        int size = stream.readInt();
        if (size < 0) {
            throw new IOException("Negative list length " + size);
        }
        // size is untrusted until the items are actually read
        List<T> result = new ArrayList<>();
        for (int i = 0; i < size; i++) {
            result.add(read(stream));
        }
        return result;
    }
}
