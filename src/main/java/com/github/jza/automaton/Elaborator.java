package com.github.jza.automaton;

import com.github.jza.automaton.exception.NoViableChoiceException;
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
 * Samples alternative routes through the automaton: elaborations of a single transition,
 * connections between two transitions and fixed length walks.
 *
 * All layers built here leave out zero-count transitions, a generated walk never uses an
 * edge that training has not seen.
 */
final class Elaborator {

    @NotNull
    private final Automaton automaton;

    Elaborator(@NotNull Automaton automaton) {
        this.automaton = automaton;
    }

    /**
     * Layers of 2 and 3 hop routes from {@code t.from} to {@code t.to}.
     *
     * Routes never pass through an end state in between and never revisit either endpoint
     * directly, so substituting one for {@code t} keeps the phrase structure of a sequence.
     * Layer 0 holds first hops, layer 1 second hops (some of which already arrive), layer 2
     * third hops. Returns an empty list if there is no route.
     */
    @NotNull
    List<List<Transition>> findElaborations(@NotNull Transition t) {
        State a = t.getFrom();
        State b = t.getTo();

        List<Transition> firstHops = new ArrayList<>();
        for (Transition x : a.getTransitions()) {
            if (x.getCount() > 0 && !x.getTo().isEnd() && x.getTo() != b) firstHops.add(x);
        }
        List<Transition> lastHops = new ArrayList<>();
        for (Transition x : automaton.getTransitionsByToState(b)) {
            if (x.getCount() > 0 && !x.getFrom().isEnd() && x.getFrom() != a) lastHops.add(x);
        }

        List<List<Transition>> twoHops = new ArrayList<>();
        twoHops.add(new ArrayList<>(firstHops));
        twoHops.add(new ArrayList<>(lastHops));
        prune(twoHops);

        Set<State> lastSources = Pathways.sources(lastHops);
        List<Transition> middleHops = new ArrayList<>();
        for (Transition x : Pathways.step(Pathways.targets(firstHops), null)) {
            if (x.getCount() > 0 && lastSources.contains(x.getTo())) middleHops.add(x);
        }
        List<List<Transition>> threeHops = new ArrayList<>();
        threeHops.add(new ArrayList<>(firstHops));
        threeHops.add(middleHops);
        threeHops.add(new ArrayList<>(lastHops));
        prune(threeHops);

        List<Transition> first = union(twoHops.get(0), threeHops.get(0));
        if (first.isEmpty()) return Collections.emptyList();
        List<List<Transition>> merged = new ArrayList<>();
        merged.add(first);
        merged.add(union(twoHops.get(1), threeHops.get(1)));
        if (!threeHops.get(2).isEmpty()) {
            merged.add(threeHops.get(2));
        }
        return merged;
    }

    /**
     * Sample a route from {@code t.from} to {@code t.to}. Unless {@code mustElaborate} is set,
     * {@code t} itself competes with the first hops and may be returned alone.
     *
     * @throws NoViableChoiceException if an elaboration is required but none exists
     */
    @NotNull
    List<Transition> elaborate(@NotNull Transition t, boolean mustElaborate) {
        List<List<Transition>> layers = findElaborations(t);
        if (layers.isEmpty()) {
            if (mustElaborate) {
                throw new NoViableChoiceException("No elaboration of " + t);
            }
            return Collections.singletonList(t);
        }

        List<Transition> candidates = new ArrayList<>(layers.get(0));
        if (!mustElaborate) candidates.add(t);
        Transition current = automaton.sampleByProbability(candidates);
        List<Transition> path = new ArrayList<>();
        path.add(current);
        int layer = 1;
        while (current.getTo() != t.getTo()) {
            if (layer >= layers.size()) {
                throw new NoViableChoiceException("Elaboration of " + t + " ran past its layers");
            }
            current = automaton.sampleByProbability(
                    TransitionQuery.create().from(current.getTo()).filter(layers.get(layer)));
            path.add(current);
            layer += 1;
        }
        return path;
    }

    /**
     * Transitions leading from {@code before.to} to {@code after.to} whose last element carries
     * {@code after}'s symbol: a 2 hop walk sampled through anchored layers, with its first hop
     * elaborated.
     */
    @NotNull
    List<Transition> connect(@NotNull Transition before, @NotNull Transition after) {
        List<Transition> firstHops = TransitionQuery.create()
                .positiveCount()
                .filter(before.getTo().getTransitions());
        List<List<Transition>> layers = forward(firstHops, 2);
        restrictLast(layers, after.getSymbol(), after.getTo());
        Pathways.removeDeadEnds(layers);
        if (!Pathways.isComplete(layers)) {
            throw new NoViableChoiceException("No connection from " + before + " to " + after);
        }
        List<Transition> walk = samplePath(layers);
        List<Transition> result = new ArrayList<>(elaborate(walk.get(0), false));
        result.add(walk.get(1));
        return result;
    }

    @NotNull
    Sequence nLengthSequence(int n, @NotNull Symbol startSymbol, @NotNull Symbol endSymbol,
                             @Nullable State startState, @Nullable State endState) {
        if (n < 1) {
            throw new IllegalArgumentException("Sequence length must be positive, got " + n);
        }
        TransitionQuery firstQuery = TransitionQuery.create().symbol(startSymbol).positiveCount();
        if (startState != null) {
            firstQuery.to(startState);
        } else {
            firstQuery.fromStart(true);
        }
        List<List<Transition>> layers = forward(firstQuery.filter(automaton.getTransitions()), n);
        restrictLast(layers, endSymbol, endState);
        Pathways.removeDeadEnds(layers);
        if (!Pathways.isComplete(layers)) {
            throw new NoViableChoiceException("No " + n + " transition walk from " + startSymbol + " to " + endSymbol);
        }
        return new Sequence(automaton, samplePath(layers));
    }

    /**
     * {@code n} layers starting with {@code first}, each further layer holding the weighted
     * transitions leaving the previous layer's targets.
     */
    @NotNull
    private static List<List<Transition>> forward(@NotNull List<Transition> first, int n) {
        List<List<Transition>> layers = new ArrayList<>(n);
        List<Transition> layer = first;
        layers.add(layer);
        for (int i = 1; i < n; i++) {
            layer = TransitionQuery.create().positiveCount().filter(Pathways.step(Pathways.targets(layer), null));
            layers.add(layer);
        }
        return layers;
    }

    /**
     * Keep last layer transitions carrying {@code symbol} and entering {@code endState}, or any
     * end state if it is null.
     */
    private static void restrictLast(@NotNull List<List<Transition>> layers, @NotNull Symbol symbol,
                                     @Nullable State endState) {
        TransitionQuery query = TransitionQuery.create().symbol(symbol);
        if (endState != null) {
            query.to(endState);
        } else {
            query.toEnd(true);
        }
        int last = layers.size() - 1;
        layers.set(last, query.filter(layers.get(last)));
    }

    /**
     * Sample one walk through pruned layers, each step restricted to transitions leaving the
     * previous target.
     */
    @NotNull
    private List<Transition> samplePath(@NotNull List<List<Transition>> layers) {
        List<Transition> path = new ArrayList<>(layers.size());
        Transition current = automaton.sampleByProbability(layers.get(0));
        path.add(current);
        for (int i = 1; i < layers.size(); i++) {
            current = automaton.sampleByProbability(
                    TransitionQuery.create().from(current.getTo()).filter(layers.get(i)));
            path.add(current);
        }
        return path;
    }

    private static void prune(@NotNull List<List<Transition>> layers) {
        Pathways.removeDeadEnds(layers);
        Pathways.removeUnreachable(layers);
    }

    @NotNull
    private static List<Transition> union(@NotNull Collection<Transition> a, @NotNull Collection<Transition> b) {
        Set<Transition> result = new LinkedHashSet<>(a);
        result.addAll(b);
        return new ArrayList<>(result);
    }
}
