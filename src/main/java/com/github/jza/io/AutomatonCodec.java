package com.github.jza.io;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.jza.automaton.Automaton;
import com.github.jza.automaton.GenerationSettings;
import com.github.jza.automaton.State;
import com.github.jza.automaton.Transition;
import com.github.jza.symbol.Symbol;
import com.github.jza.symbol.SymbolFactory;
import org.jetbrains.annotations.NotNull;

import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Saves and restores automata, either as a JSON document or in a compact binary form.
 *
 * Both forms store states in order, then every transition as {@code (from index, to index,
 * symbol, count)}. The binary form keeps a table of distinct symbols and refers to it by
 * index. Loading rebuilds the graph through the regular construction calls, so the restored
 * automaton has the same shape and counts as the saved one.
 */
public final class AutomatonCodec {

    @NotNull
    private final SymbolFactory symbolFactory;

    @NotNull
    private final ObjectMapper mapper;

    public AutomatonCodec(@NotNull SymbolFactory symbolFactory) {
        this(symbolFactory, new ObjectMapper());
    }

    public AutomatonCodec(@NotNull SymbolFactory symbolFactory, @NotNull ObjectMapper mapper) {
        this.symbolFactory = symbolFactory;
        this.mapper = mapper;
    }

    /* Document model */

    @NotNull
    public AutomatonDocument toDocument(@NotNull Automaton automaton) {
        List<AutomatonDocument.StateEntry> states = new ArrayList<>();
        for (State s : automaton.getStates()) {
            states.add(new AutomatonDocument.StateEntry(s.getName(), s.isStart(), s.isEnd()));
        }
        List<AutomatonDocument.TransitionEntry> transitions = new ArrayList<>();
        for (Transition t : automaton.getTransitions()) {
            AutomatonDocument.SymbolEntry symbol = new AutomatonDocument.SymbolEntry(
                    t.getSymbol().getNumeral(), t.getSymbol().getQuality());
            transitions.add(new AutomatonDocument.TransitionEntry(
                    t.getFrom().getIndex(), t.getTo().getIndex(), symbol, t.getCount()));
        }
        return new AutomatonDocument(states, transitions);
    }

    @NotNull
    public Automaton fromDocument(@NotNull AutomatonDocument document) {
        return fromDocument(document, GenerationSettings.defaults());
    }

    @NotNull
    public Automaton fromDocument(@NotNull AutomatonDocument document, @NotNull GenerationSettings settings) {
        Automaton automaton = new Automaton(settings);
        for (AutomatonDocument.StateEntry s : document.getStates()) {
            automaton.addState(s.getName(), s.isStart(), s.isEnd());
        }
        List<State> states = automaton.getStates();
        for (AutomatonDocument.TransitionEntry t : document.getTransitions()) {
            Symbol symbol = symbolFactory.create(t.getSymbol().getNumeral(), t.getSymbol().getQuality());
            automaton.addTransition(symbol, stateAt(states, t.getFrom()), stateAt(states, t.getTo()), t.getCount());
        }
        return automaton;
    }

    /* JSON */

    @NotNull
    public String toJson(@NotNull Automaton automaton) throws JsonProcessingException {
        return mapper.writeValueAsString(toDocument(automaton));
    }

    @NotNull
    public Automaton fromJson(@NotNull String json) throws JsonProcessingException {
        return fromDocument(mapper.readValue(json, AutomatonDocument.class));
    }

    public void writeJson(@NotNull OutputStream stream, @NotNull Automaton automaton) throws IOException {
        mapper.writeValue(stream, toDocument(automaton));
    }

    @NotNull
    public Automaton readJson(@NotNull InputStream stream) throws IOException {
        return fromDocument(mapper.readValue(stream, AutomatonDocument.class));
    }

    /* Binary */

    public void write(@NotNull DataOutputStream stream, @NotNull Automaton automaton,
                      @NotNull Serializer<Symbol> symbolSerializer) throws IOException {
        // write states
        List<State> states = automaton.getStates();
        stream.writeInt(states.size());
        for (State s : states) {
            stream.writeUTF(s.getName());
            stream.writeBoolean(s.isStart());
            stream.writeBoolean(s.isEnd());
        }
        // write symbol table, in order of first use
        List<Transition> transitions = automaton.getTransitions();
        Map<Symbol, Integer> symbolIndex = new LinkedHashMap<>();
        for (Transition t : transitions) {
            symbolIndex.putIfAbsent(t.getSymbol(), symbolIndex.size());
        }
        symbolSerializer.writeAll(stream, new ArrayList<>(symbolIndex.keySet()));
        // write transitions
        stream.writeInt(transitions.size());
        for (Transition t : transitions) {
            stream.writeInt(t.getFrom().getIndex());
            stream.writeInt(t.getTo().getIndex());
            stream.writeInt(symbolIndex.get(t.getSymbol()));
            stream.writeDouble(t.getCount());
        }
    }

    @NotNull
    public Automaton read(@NotNull DataInputStream stream, @NotNull Serializer<Symbol> symbolSerializer,
                          @NotNull GenerationSettings settings) throws IOException {
        Automaton automaton = new Automaton(settings);
        // read states
        int stateCount = stream.readInt();
        for (int i = 0; i < stateCount; i++) {
            String name = stream.readUTF();
            boolean start = stream.readBoolean();
            boolean end = stream.readBoolean();
            automaton.addState(name, start, end);
        }
        // read symbol table
        List<Symbol> symbols = symbolSerializer.readAll(stream);
        // read transitions
        List<State> states = automaton.getStates();
        int transitionCount = stream.readInt();
        for (int i = 0; i < transitionCount; i++) {
            State from = stateAt(states, stream.readInt());
            State to = stateAt(states, stream.readInt());
            int symbol = stream.readInt();
            if (symbol < 0 || symbol >= symbols.size()) {
                throw new IllegalArgumentException("Transition refers to unknown symbol index " + symbol
                        + " (symbol table has " + symbols.size() + " entries)");
            }
            double count = stream.readDouble();
            automaton.addTransition(symbols.get(symbol), from, to, count);
        }
        return automaton;
    }

    @NotNull
    public Automaton read(@NotNull DataInputStream stream) throws IOException {
        return read(stream, new SymbolSerializer(symbolFactory), GenerationSettings.defaults());
    }

    public void write(@NotNull DataOutputStream stream, @NotNull Automaton automaton) throws IOException {
        write(stream, automaton, new SymbolSerializer(symbolFactory));
    }

    @NotNull
    private static State stateAt(@NotNull List<State> states, int index) {
        if (index < 0 || index >= states.size()) {
            throw new IllegalArgumentException("Transition refers to unknown state index " + index
                    + " (automaton has " + states.size() + " states)");
        }
        return states.get(index);
    }
}
