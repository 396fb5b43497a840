package com.github.jza.automaton;

import com.github.jza.symbol.Symbol;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A harmonic function context. Identity is by instance: several states may share a name.
 */
public final class State {

    @NotNull
    private final String name;

    private final boolean start;

    private final boolean end;

    // position inside the owning automaton
    private final int index;

    @NotNull
    private final List<Transition> transitions = new ArrayList<>();

    State(@NotNull String name, boolean start, boolean end, int index) {
        this.name = name;
        this.start = start;
        this.end = end;
        this.index = index;
    }

    @NotNull
    public String getName() {
        return name;
    }

    /**
     * True if a walk may begin by leaving this state.
     */
    public boolean isStart() {
        return start;
    }

    /**
     * True if a walk may finish by entering this state.
     */
    public boolean isEnd() {
        return end;
    }

    public int getIndex() {
        return index;
    }

    @NotNull
    public List<Transition> getTransitions() {
        return Collections.unmodifiableList(transitions);
    }

    /**
     * Add an outgoing edge unless an edge with an equal symbol and the same target exists.
     *
     * @return the new edge, or null if it would have been a duplicate
     */
    @Nullable
    Transition addTransition(@NotNull Symbol symbol, @NotNull State to, double count) {
        if (hasTransition(symbol, to)) return null;
        Transition transition = new Transition(this, to, symbol, count);
        transitions.add(transition);
        return transition;
    }

    public boolean hasTransition(@NotNull Symbol symbol, @NotNull State to) {
        for (Transition t : transitions) {
            if (t.getTo() == to && t.getSymbol().equals(symbol)) return true;
        }
        return false;
    }

    @NotNull
    public List<Transition> getTransitionsBySymbol(@NotNull Symbol symbol) {
        List<Transition> result = new ArrayList<>();
        for (Transition t : transitions) {
            if (t.getSymbol().equals(symbol)) result.add(t);
        }
        return result;
    }

    @NotNull
    public List<Transition> getTransitionsByQuery(@NotNull TransitionQuery query) {
        return query.filter(transitions);
    }

    @NotNull
    public List<State> getNextStates() {
        List<State> result = new ArrayList<>(transitions.size());
        for (Transition t : transitions) {
            result.add(t.getTo());
        }
        return result;
    }

    @NotNull
    public List<State> getNextStatesBySymbol(@NotNull Symbol symbol) {
        List<State> result = new ArrayList<>();
        for (Transition t : transitions) {
            if (t.getSymbol().equals(symbol)) result.add(t.getTo());
        }
        return result;
    }

    public double getTotalCount() {
        double total = 0.0;
        for (Transition t : transitions) {
            total += t.getCount();
        }
        return total;
    }

    @Override
    public String toString() {
        return name;
    }
}
