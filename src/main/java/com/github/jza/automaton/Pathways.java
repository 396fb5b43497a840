package com.github.jza.automaton;

import com.github.jza.symbol.Symbol;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Layered reachability over an automaton.
 *
 * A pathway is a list of layers, one per symbol. Layer i holds every transition that can be
 * taken at step i by some walk consistent with the symbols seen so far. Concrete walks are
 * recovered by chaining a transition's target with a source in the next layer.
 */
final class Pathways {

    // Only provides static methods.
    private Pathways() {}

    /**
     * Forward pass: layer 0 is every transition labeled {@code symbols[0]} leaving a start state,
     * every further layer extends the targets of the previous one.
     */
    @NotNull
    static List<List<Transition>> reachForward(@NotNull Automaton automaton, @NotNull List<? extends Symbol> symbols) {
        List<List<Transition>> layers = new ArrayList<>(symbols.size());
        if (symbols.isEmpty()) return layers;
        List<Transition> layer = TransitionQuery.create()
                .symbol(symbols.get(0))
                .fromStart(true)
                .filter(automaton.getTransitions());
        layers.add(layer);
        for (int i = 1; i < symbols.size(); i++) {
            layer = step(targets(layer), symbols.get(i));
            layers.add(layer);
        }
        return layers;
    }

    /**
     * Full pathway search: forward reachability, restriction of the last layer to end states,
     * then backward dead end pruning. If any layer ends up empty, the symbols cannot be
     * recognised.
     */
    @NotNull
    static List<List<Transition>> find(@NotNull Automaton automaton, @NotNull List<? extends Symbol> symbols) {
        List<List<Transition>> layers = reachForward(automaton, symbols);
        if (layers.isEmpty()) return layers;
        restrictLastToEnd(layers);
        return removeDeadEnds(layers);
    }

    static boolean isComplete(@NotNull List<List<Transition>> layers) {
        if (layers.isEmpty()) return false;
        for (List<Transition> layer : layers) {
            if (layer.isEmpty()) return false;
        }
        return true;
    }

    static void restrictLastToEnd(@NotNull List<List<Transition>> layers) {
        int last = layers.size() - 1;
        layers.set(last, TransitionQuery.create().toEnd(true).filter(layers.get(last)));
    }

    /**
     * Starting at the last layer and walking backwards, drop every transition whose target is
     * not the source of some transition in the next layer.
     */
    @NotNull
    static List<List<Transition>> removeDeadEnds(@NotNull List<List<Transition>> layers) {
        for (int i = layers.size() - 2; i >= 0; i--) {
            Set<State> nextSources = sources(layers.get(i + 1));
            List<Transition> kept = new ArrayList<>();
            for (Transition t : layers.get(i)) {
                if (nextSources.contains(t.getTo())) kept.add(t);
            }
            layers.set(i, kept);
        }
        return layers;
    }

    /**
     * Forward counterpart of {@link #removeDeadEnds(List)}: drop every transition whose source
     * is not the target of some transition in the previous layer.
     */
    @NotNull
    static List<List<Transition>> removeUnreachable(@NotNull List<List<Transition>> layers) {
        for (int i = 1; i < layers.size(); i++) {
            Set<State> previousTargets = targets(layers.get(i - 1));
            List<Transition> kept = new ArrayList<>();
            for (Transition t : layers.get(i)) {
                if (previousTargets.contains(t.getFrom())) kept.add(t);
            }
            layers.set(i, kept);
        }
        return layers;
    }

    /**
     * Expand pruned layers into every concrete sequence of states. Each list starts with the
     * state the walk leaves and continues with one state per layer.
     */
    @NotNull
    static List<List<State>> expand(@NotNull List<List<Transition>> layers) {
        if (!isComplete(layers)) return Collections.emptyList();
        List<List<State>> paths = new ArrayList<>();
        for (State s : sources(layers.get(0))) {
            List<State> path = new ArrayList<>();
            path.add(s);
            paths.add(path);
        }
        for (List<Transition> layer : layers) {
            List<List<State>> extended = new ArrayList<>();
            for (Transition t : layer) {
                for (List<State> path : paths) {
                    if (path.get(path.size() - 1) == t.getFrom()) {
                        List<State> next = new ArrayList<>(path);
                        next.add(t.getTo());
                        extended.add(next);
                    }
                }
            }
            paths = extended;
        }
        return paths;
    }

    /**
     * Every transition labeled {@code symbol} leaving one of {@code states}, without duplicates.
     * A null symbol matches any label.
     */
    @NotNull
    static List<Transition> step(@NotNull Collection<State> states, @Nullable Symbol symbol) {
        Set<Transition> result = new LinkedHashSet<>();
        for (State s : states) {
            if (symbol == null) {
                result.addAll(s.getTransitions());
            } else {
                result.addAll(s.getTransitionsBySymbol(symbol));
            }
        }
        return new ArrayList<>(result);
    }

    @NotNull
    static Set<State> targets(@NotNull Collection<Transition> transitions) {
        Set<State> result = new LinkedHashSet<>();
        for (Transition t : transitions) {
            result.add(t.getTo());
        }
        return result;
    }

    @NotNull
    static Set<State> sources(@NotNull Collection<Transition> transitions) {
        Set<State> result = new LinkedHashSet<>();
        for (Transition t : transitions) {
            result.add(t.getFrom());
        }
        return result;
    }
}
