package com.github.jza.automaton;

import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Aggregates transition counts under string keys and turns them into probabilities.
 */
public final class ProbabilityTable {

    /**
     * How a transition is labeled in a report.
     */
    public enum KeyType {
        /** The transition symbol, e.g. {@code IIm}. */
        SYMBOL(t -> t.getSymbol().toString()),
        /** Name of the state the transition enters. */
        STATE(t -> t.getTo().getName()),
        /** Both, formatted as {@code "IIm: Subdominant 2"}. */
        SYMBOL_AND_STATE(t -> t.getSymbol() + ": " + t.getTo().getName());

        @NotNull
        private final Function<Transition, String> keyFunction;

        KeyType(@NotNull Function<Transition, String> keyFunction) {
            this.keyFunction = keyFunction;
        }

        @NotNull
        public Function<Transition, String> keyFunction() {
            return keyFunction;
        }
    }

    // Only provides static methods.
    private ProbabilityTable() {}

    /**
     * Sum counts per key, normalise by the total count of {@code transitions} and sort from
     * the most to the least probable key. Zero-count transitions never create a key, ties keep
     * the order in which keys were first seen.
     */
    @NotNull
    public static Map<String, Double> of(@NotNull Collection<Transition> transitions,
                                         @NotNull Function<Transition, String> keyFunction) {
        double total = 0.0;
        Map<String, Double> counts = new LinkedHashMap<>();
        for (Transition t : transitions) {
            total += t.getCount();
            if (t.getCount() != 0.0) {
                counts.merge(keyFunction.apply(t), t.getCount(), Double::sum);
            }
        }
        if (counts.isEmpty()) return Collections.emptyMap();

        List<Map.Entry<String, Double>> entries = new ArrayList<>(counts.entrySet());
        // List.sort is stable
        entries.sort((a, b) -> Double.compare(b.getValue(), a.getValue()));
        Map<String, Double> result = new LinkedHashMap<>();
        for (Map.Entry<String, Double> entry : entries) {
            result.put(entry.getKey(), entry.getValue() / total);
        }
        return result;
    }

    @NotNull
    public static Map<String, Double> of(@NotNull Collection<Transition> transitions, @NotNull KeyType keyType) {
        return of(transitions, keyType.keyFunction());
    }
}
