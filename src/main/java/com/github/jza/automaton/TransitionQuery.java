package com.github.jza.automaton;

import com.github.jza.symbol.Symbol;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.function.Predicate;

/**
 * A conjunction of optional constraints on a transition. Unset constraints match anything.
 *
 * <pre>
 *     automaton.getTransitionsByQuery(TransitionQuery.create().from(state).symbol(symbol));
 * </pre>
 */
public final class TransitionQuery implements Predicate<Transition> {

    @Nullable private State from;
    @Nullable private State to;
    @Nullable private Symbol symbol;
    @Nullable private String quality;
    @Nullable private Boolean fromStart;
    @Nullable private Boolean fromEnd;
    @Nullable private Boolean toStart;
    @Nullable private Boolean toEnd;
    private boolean positiveCount;

    private TransitionQuery() {}

    @NotNull
    public static TransitionQuery create() {
        return new TransitionQuery();
    }

    @NotNull
    public TransitionQuery from(@NotNull State state) {
        this.from = state;
        return this;
    }

    @NotNull
    public TransitionQuery to(@NotNull State state) {
        this.to = state;
        return this;
    }

    @NotNull
    public TransitionQuery symbol(@NotNull Symbol symbol) {
        this.symbol = symbol;
        return this;
    }

    @NotNull
    public TransitionQuery quality(@NotNull String quality) {
        this.quality = quality;
        return this;
    }

    @NotNull
    public TransitionQuery fromStart(boolean value) {
        this.fromStart = value;
        return this;
    }

    @NotNull
    public TransitionQuery fromEnd(boolean value) {
        this.fromEnd = value;
        return this;
    }

    @NotNull
    public TransitionQuery toStart(boolean value) {
        this.toStart = value;
        return this;
    }

    @NotNull
    public TransitionQuery toEnd(boolean value) {
        this.toEnd = value;
        return this;
    }

    /**
     * Only match edges that have been given some weight.
     */
    @NotNull
    public TransitionQuery positiveCount() {
        this.positiveCount = true;
        return this;
    }

    @Override
    public boolean test(@NotNull Transition t) {
        if (from != null && t.getFrom() != from) return false;
        if (to != null && t.getTo() != to) return false;
        if (symbol != null && !t.getSymbol().equals(symbol)) return false;
        if (quality != null && !t.getSymbol().getQuality().equals(quality)) return false;
        if (fromStart != null && t.getFrom().isStart() != fromStart) return false;
        if (fromEnd != null && t.getFrom().isEnd() != fromEnd) return false;
        if (toStart != null && t.getTo().isStart() != toStart) return false;
        if (toEnd != null && t.getTo().isEnd() != toEnd) return false;
        return !positiveCount || t.getCount() > 0;
    }

    @NotNull
    public List<Transition> filter(@NotNull Collection<Transition> transitions) {
        List<Transition> result = new ArrayList<>();
        for (Transition t : transitions) {
            if (test(t)) result.add(t);
        }
        return result;
    }
}
