package com.github.jza.automaton;

import com.github.jza.automaton.exception.GenerationFailedException;
import com.github.jza.automaton.exception.InvalidSequenceException;
import com.github.jza.automaton.exception.NoViableChoiceException;
import com.github.jza.symbol.Symbol;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.Predicate;

/**
 * A connected walk over an automaton: the target of every transition is the source of the next.
 *
 * Sequences are immutable. Every edit returns a new sequence and leaves the receiver and the
 * automaton untouched. The transitions are the automaton's own edges, not copies.
 */
public final class Sequence {

    @NotNull
    private final Automaton automaton;

    @NotNull
    private final List<Transition> transitions;

    /**
     * @throws InvalidSequenceException if the transitions are not connected
     */
    public Sequence(@NotNull Automaton automaton, @NotNull List<Transition> transitions) {
        for (int i = 1; i < transitions.size(); i++) {
            if (transitions.get(i).getFrom() != transitions.get(i - 1).getTo()) {
                throw new InvalidSequenceException(i, "Invalid sequence: " + transitions.get(i - 1)
                        + " is followed by " + transitions.get(i));
            }
        }
        this.automaton = automaton;
        this.transitions = Collections.unmodifiableList(new ArrayList<>(transitions));
    }

    @NotNull
    public Automaton getAutomaton() {
        return automaton;
    }

    /* Reading */

    @NotNull
    public List<Transition> getTransitions() {
        return transitions;
    }

    @Nullable
    public Transition first() {
        return transitions.isEmpty() ? null : transitions.get(0);
    }

    @Nullable
    public Transition last() {
        return transitions.isEmpty() ? null : transitions.get(transitions.size() - 1);
    }

    @NotNull
    public Transition get(int index) {
        return transitions.get(index);
    }

    public int length() {
        return transitions.size();
    }

    public boolean isEmpty() {
        return transitions.isEmpty();
    }

    @NotNull
    public List<Symbol> getSymbols() {
        List<Symbol> result = new ArrayList<>(transitions.size());
        for (Transition t : transitions) {
            result.add(t.getSymbol());
        }
        return result;
    }

    /**
     * States entered by the walk, one per transition.
     */
    @NotNull
    public List<State> getStates() {
        List<State> result = new ArrayList<>(transitions.size());
        for (Transition t : transitions) {
            result.add(t.getTo());
        }
        return result;
    }

    /**
     * One {@code "symbol: state"} string per transition.
     */
    @NotNull
    public List<String> getSymbolStateStrings() {
        List<String> result = new ArrayList<>(transitions.size());
        for (Transition t : transitions) {
            result.add(t.getSymbol() + ": " + t.getTo().getName());
        }
        return result;
    }

    /**
     * Symbols with runs of equal adjacent symbols collapsed into one.
     */
    @NotNull
    public List<Symbol> getSymbolsCollapsed() {
        List<Symbol> result = new ArrayList<>();
        for (Transition t : transitions) {
            if (result.isEmpty() || !result.get(result.size() - 1).equals(t.getSymbol())) {
                result.add(t.getSymbol());
            }
        }
        return result;
    }

    /* Growing */

    /**
     * Append one sampled transition, leaving the last state, or a start state if empty. Unless
     * {@code allowRepeats} is set, the new symbol differs from the current last one.
     *
     * @throws NoViableChoiceException if no weighted transition qualifies
     */
    @NotNull
    public Sequence add(boolean allowRepeats) {
        List<Symbol> excluded = new ArrayList<>(1);
        Transition last = last();
        if (!allowRepeats && last != null) excluded.add(last.getSymbol());
        return addExcluding(excluded);
    }

    @NotNull
    public Sequence addN(int n, boolean allowRepeats) {
        Sequence sequence = this;
        for (int i = 0; i < n; i++) {
            sequence = sequence.add(allowRepeats);
        }
        return sequence;
    }

    /**
     * Keep adding transitions until one enters an end state.
     *
     * @throws GenerationFailedException if every attempt ran into a dead end
     */
    @NotNull
    public Sequence addFull(boolean allowRepeats) {
        return grow("full phrase", s -> s.last().getTo().isEnd(), allowRepeats);
    }

    /**
     * Keep adding transitions until one carries {@code symbol}.
     *
     * @throws GenerationFailedException if every attempt ran into a dead end
     */
    @NotNull
    public Sequence addUntilSymbol(@NotNull Symbol symbol, boolean allowRepeats) {
        return grow("phrase ending on " + symbol, s -> s.last().getSymbol().equals(symbol), allowRepeats);
    }

    @NotNull
    private Sequence grow(@NotNull String what, @NotNull Predicate<Sequence> done, boolean allowRepeats) {
        return automaton.withRetries(what, () -> {
            Sequence sequence = this;
            do {
                sequence = sequence.add(allowRepeats);
                automaton.checkLength(sequence);
            } while (!done.test(sequence));
            return sequence;
        });
    }

    /**
     * Grow the walk backwards until it leaves a start state. The first transition is first
     * swapped for an equivalent one (same symbol and target, any source) so that the walk can
     * be extended from a fresh state. At least one transition is prepended.
     *
     * @throws IllegalStateException if the sequence is empty
     * @throws GenerationFailedException if every attempt ran into a dead end
     */
    @NotNull
    public Sequence prependFull(boolean allowRepeats) {
        Transition first = first();
        if (first == null) {
            throw new IllegalStateException("Cannot prepend to an empty sequence");
        }
        return automaton.withRetries("prefix before " + first, () -> {
            List<Transition> result = new ArrayList<>(transitions);
            result.set(0, automaton.sampleByProbability(automaton.getTransitionsByQuery(
                    TransitionQuery.create().symbol(first.getSymbol()).to(first.getTo()))));
            do {
                Transition earliest = result.get(0);
                List<Transition> candidates = automaton.getTransitionsByToState(earliest.getFrom());
                if (!allowRepeats) {
                    candidates.removeIf(t -> t.getSymbol().equals(earliest.getSymbol()));
                }
                result.add(0, automaton.sampleByProbability(candidates));
                if (result.size() > automaton.getSettings().getMaxSequenceLength()) {
                    throw new NoViableChoiceException("Prefix grew past "
                            + automaton.getSettings().getMaxSequenceLength() + " transitions");
                }
            } while (!result.get(0).getFrom().isStart());
            return new Sequence(automaton, result);
        });
    }

    /* Shrinking */

    @NotNull
    public Sequence remove() {
        return removeN(1);
    }

    /**
     * Drop the last {@code n} transitions. At least one transition always remains.
     *
     * @throws IllegalArgumentException if {@code n} is negative or not smaller than the length
     */
    @NotNull
    public Sequence removeN(int n) {
        if (n < 0 || n >= length()) {
            throw new IllegalArgumentException("Cannot remove " + n + " transitions from a sequence of length " + length());
        }
        return new Sequence(automaton, transitions.subList(0, length() - n));
    }

    /**
     * Replace the last transition by a sampled one with a different symbol. Unless
     * {@code allowRepeats} is set, the replacement also differs from the new last symbol.
     *
     * @throws IllegalStateException if the sequence is empty
     * @throws NoViableChoiceException if no weighted replacement exists
     */
    @NotNull
    public Sequence changeLast(boolean allowRepeats) {
        Transition removed = last();
        if (removed == null) {
            throw new IllegalStateException("Cannot change the last transition of an empty sequence");
        }
        Sequence shorter = new Sequence(automaton, transitions.subList(0, length() - 1));
        List<Symbol> excluded = new ArrayList<>(2);
        excluded.add(removed.getSymbol());
        Transition newLast = shorter.last();
        if (!allowRepeats && newLast != null) excluded.add(newLast.getSymbol());
        return shorter.addExcluding(excluded);
    }

    @NotNull
    private Sequence addExcluding(@NotNull List<Symbol> excluded) {
        Transition last = last();
        List<Transition> candidates = new ArrayList<>(last == null
                ? automaton.getInitialTransitions()
                : last.getTo().getTransitions());
        candidates.removeIf(t -> excluded.contains(t.getSymbol()));
        List<Transition> result = new ArrayList<>(transitions);
        result.add(automaton.sampleByProbability(candidates));
        return new Sequence(automaton, result);
    }

    /* Editing */

    /**
     * Regenerate the smallest phrase around {@code index}, a phrase being delimited by end states.
     * A trailing phrase is regrown forwards, a leading one backwards, and an inner one is
     * replaced by a connection between its neighbours.
     *
     * @throws IndexOutOfBoundsException if {@code index} is not a valid position
     * @throws GenerationFailedException if no replacement could be built
     */
    @NotNull
    public Sequence reharmonizeAtIndex(int index, boolean allowRepeats) {
        return reharmonizeAtIndex(index, allowRepeats, null, null);
    }

    /**
     * Like {@link #reharmonizeAtIndex(int, boolean)}, but when the phrase is the whole sequence
     * and an anchor is given, the sequence is regenerated with the same length and the same
     * first and last symbols, its first transition entering {@code startState} and its last
     * entering {@code endState}. A null anchor falls back to the start or end flag.
     */
    @NotNull
    public Sequence reharmonizeAtIndex(int index, boolean allowRepeats,
                                       @Nullable State startState, @Nullable State endState) {
        if (index < 0 || index >= length()) {
            throw new IndexOutOfBoundsException("Index " + index + " out of bounds for length " + length());
        }
        int startIndex = index;
        while (startIndex > 0 && !get(startIndex).getFrom().isEnd()) startIndex -= 1;
        int endIndex = index;
        while (endIndex < length() - 1 && !get(endIndex).getTo().isEnd()) endIndex += 1;

        boolean wholeSequence = startIndex == 0 && endIndex == length() - 1;
        if (wholeSequence && (startState != null || endState != null)) {
            return automaton.generateNLengthSequence(length(), get(0).getSymbol(),
                    get(length() - 1).getSymbol(), startState, endState);
        }
        if (endIndex == length() - 1) {
            return new Sequence(automaton, transitions.subList(0, startIndex)).addFull(allowRepeats);
        }
        if (startIndex == 0) {
            return new Sequence(automaton, transitions.subList(endIndex + 1, length())).prependFull(allowRepeats);
        }

        Sequence connection = automaton.generateConnection(get(startIndex - 1), get(endIndex + 1));
        List<Transition> result = new ArrayList<>(transitions.subList(0, startIndex));
        result.addAll(connection.getTransitions());
        result.addAll(transitions.subList(endIndex + 2, length()));
        Sequence reharmonized = new Sequence(automaton, result);
        return allowRepeats ? reharmonized : reharmonized.makeUnique();
    }

    /**
     * Try to drop the transition at {@code index}. At either end it is simply removed. Inside,
     * it and its successor are replaced by a single edge from its source to the successor's
     * target carrying the successor's symbol, if the automaton has one.
     *
     * @return the shortened sequence, or this very instance if no such edge exists
     * @throws IndexOutOfBoundsException if {@code index} is not a valid position
     */
    @NotNull
    public Sequence splice(int index) {
        if (index < 0 || index >= length()) {
            throw new IndexOutOfBoundsException("Index " + index + " out of bounds for length " + length());
        }
        List<Transition> result = new ArrayList<>(transitions);
        if (index == 0 || index == length() - 1) {
            result.remove(index);
            return new Sequence(automaton, result);
        }
        Transition next = get(index + 1);
        Transition shortcut = get(index).getFrom().getTransitionsByQuery(
                TransitionQuery.create().symbol(next.getSymbol()).to(next.getTo()))
                .stream().findFirst().orElse(null);
        if (shortcut == null) return this;
        result.remove(index + 1);
        result.set(index, shortcut);
        return new Sequence(automaton, result);
    }

    /**
     * Splice away transitions that repeat a neighbour's symbol wherever the automaton allows it.
     * Scans are repeated until one makes no change.
     */
    @NotNull
    public Sequence makeUnique() {
        Sequence sequence = this;
        boolean changed;
        do {
            changed = false;
            int i = 0;
            while (i < sequence.length()) {
                if (sequence.repeatsNeighbour(i)) {
                    Sequence spliced = sequence.splice(i);
                    if (spliced != sequence) {
                        sequence = spliced;
                        changed = true;
                        continue;
                    }
                }
                i += 1;
            }
        } while (changed);
        return sequence;
    }

    private boolean repeatsNeighbour(int i) {
        Symbol symbol = get(i).getSymbol();
        return (i > 0 && get(i - 1).getSymbol().equals(symbol))
                || (i < length() - 1 && get(i + 1).getSymbol().equals(symbol));
    }

    @Override
    public String toString() {
        return String.join(" | ", getSymbolStateStrings());
    }
}
