package com.github.jza.io;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.List;

/**
 * Persisted layout of an automaton. Transitions refer to states by their position in
 * {@link #getStates()}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class AutomatonDocument {

    @NotNull
    private final List<StateEntry> states;

    @NotNull
    private final List<TransitionEntry> transitions;

    @JsonCreator
    public AutomatonDocument(@JsonProperty("states") List<StateEntry> states,
                             @JsonProperty("transitions") List<TransitionEntry> transitions) {
        this.states = states == null ? new ArrayList<>() : states;
        this.transitions = transitions == null ? new ArrayList<>() : transitions;
    }

    @NotNull
    @JsonProperty("states")
    public List<StateEntry> getStates() {
        return states;
    }

    @NotNull
    @JsonProperty("transitions")
    public List<TransitionEntry> getTransitions() {
        return transitions;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class StateEntry {

        @NotNull
        private final String name;
        private final boolean start;
        private final boolean end;

        @JsonCreator
        public StateEntry(@JsonProperty("name") String name,
                          @JsonProperty("isStart") boolean start,
                          @JsonProperty("isEnd") boolean end) {
            if (name == null) {
                throw new IllegalArgumentException("State entry without a name");
            }
            this.name = name;
            this.start = start;
            this.end = end;
        }

        @NotNull
        @JsonProperty("name")
        public String getName() {
            return name;
        }

        @JsonProperty("isStart")
        public boolean isStart() {
            return start;
        }

        @JsonProperty("isEnd")
        public boolean isEnd() {
            return end;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class SymbolEntry {

        @NotNull
        private final String numeral;
        @NotNull
        private final String quality;

        @JsonCreator
        public SymbolEntry(@JsonProperty("numeral") String numeral,
                           @JsonProperty("quality") String quality) {
            if (numeral == null || quality == null) {
                throw new IllegalArgumentException("Symbol entry needs a numeral and a quality");
            }
            this.numeral = numeral;
            this.quality = quality;
        }

        @NotNull
        @JsonProperty("numeral")
        public String getNumeral() {
            return numeral;
        }

        @NotNull
        @JsonProperty("quality")
        public String getQuality() {
            return quality;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class TransitionEntry {

        private final int from;
        private final int to;
        @NotNull
        private final SymbolEntry symbol;
        private final double count;

        @JsonCreator
        public TransitionEntry(@JsonProperty(value = "from", required = true) Integer from,
                               @JsonProperty(value = "to", required = true) Integer to,
                               @JsonProperty("symbol") SymbolEntry symbol,
                               @JsonProperty("count") double count) {
            if (from == null || to == null) {
                throw new IllegalArgumentException("Transition entry needs a from and a to state index");
            }
            if (symbol == null) {
                throw new IllegalArgumentException("Transition entry without a symbol");
            }
            this.from = from;
            this.to = to;
            this.symbol = symbol;
            this.count = count;
        }

        @JsonProperty("from")
        public int getFrom() {
            return from;
        }

        @JsonProperty("to")
        public int getTo() {
            return to;
        }

        @NotNull
        @JsonProperty("symbol")
        public SymbolEntry getSymbol() {
            return symbol;
        }

        @JsonProperty("count")
        public double getCount() {
            return count;
        }
    }
}
