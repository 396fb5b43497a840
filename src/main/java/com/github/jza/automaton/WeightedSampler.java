package com.github.jza.automaton;

import com.github.jza.automaton.exception.NoViableChoiceException;
import org.jetbrains.annotations.NotNull;

import java.util.List;
import java.util.Random;

/**
 * Picks a transition with probability proportional to its count within a candidate set.
 */
public final class WeightedSampler {

    @NotNull
    private final Random random;

    public WeightedSampler(@NotNull Random random) {
        this.random = random;
    }

    /**
     * Draw one value in [0, 1) and return the first candidate whose cumulative
     * probability exceeds it. Candidates are visited in list order.
     *
     * @throws NoViableChoiceException if the candidates carry no weight at all
     */
    @NotNull
    public Transition sample(@NotNull List<Transition> transitions) {
        double total = 0.0;
        for (Transition t : transitions) {
            total += t.getCount();
        }
        if (total <= 0.0) {
            throw new NoViableChoiceException("No viable choice among " + transitions.size() + " transitions");
        }
        double draw = random.nextDouble();
        double cumulative = 0.0;
        Transition lastWeighted = null;
        for (Transition t : transitions) {
            if (t.getCount() <= 0.0) continue;
            cumulative += t.getCount() / total;
            lastWeighted = t;
            if (cumulative > draw) {
                return t;
            }
        }
        // rounding can leave the cumulative sum a hair below the draw
        return lastWeighted;
    }
}
