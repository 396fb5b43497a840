package com.github.jza.automaton;

import com.github.jza.automaton.exception.GenerationFailedException;
import com.github.jza.automaton.exception.NoViableChoiceException;
import com.github.jza.symbol.Symbol;
import kotlin.Pair;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Supplier;
import java.util.regex.Pattern;

/**
 * Weighted nondeterministic automaton over harmonic function symbols.
 *
 * The automaton owns its states, every state owns its outgoing transitions. The edge set is
 * never stored separately, {@link #getTransitions()} concatenates the per-state lists in state
 * order. Nothing is ever removed from the graph, only training changes it after construction.
 *
 * Instances are not thread safe. Sequences only read the graph, so they may be generated
 * concurrently as long as nobody trains or extends the automaton at the same time.
 */
public class Automaton {

    private static final Logger log = LoggerFactory.getLogger(Automaton.class);

    @NotNull
    private final List<State> states = new ArrayList<>();

    @NotNull
    private final GenerationSettings settings;

    @NotNull
    private final WeightedSampler sampler;

    @NotNull
    private final Elaborator elaborator;

    public Automaton() {
        this(GenerationSettings.defaults());
    }

    public Automaton(@NotNull GenerationSettings settings) {
        this.settings = settings;
        this.sampler = new WeightedSampler(settings.getRandom());
        this.elaborator = new Elaborator(this);
    }

    @NotNull
    public GenerationSettings getSettings() {
        return settings;
    }

    /* Construction */

    @NotNull
    public State addState(@NotNull String name, boolean isStart, boolean isEnd) {
        State state = new State(name, isStart, isEnd, states.size());
        states.add(state);
        return state;
    }

    /**
     * Add an untrained edge.
     *
     * @return the new edge, or null if {@code from} already has an equal edge to {@code to}
     */
    @Nullable
    public Transition addTransition(@NotNull Symbol symbol, @NotNull State from, @NotNull State to) {
        return addTransition(symbol, from, to, 0.0);
    }

    @Nullable
    public Transition addTransition(@NotNull Symbol symbol, @NotNull State from, @NotNull State to, double count) {
        checkOwned(from);
        checkOwned(to);
        return from.addTransition(symbol, to, count);
    }

    private void checkOwned(@NotNull State state) {
        int index = state.getIndex();
        if (index >= states.size() || states.get(index) != state) {
            throw new IllegalArgumentException("State " + state + " does not belong to this automaton");
        }
    }

    /* State queries */

    @NotNull
    public List<State> getStates() {
        return Collections.unmodifiableList(states);
    }

    @NotNull
    public List<State> getStatesByName(@NotNull String name) {
        List<State> result = new ArrayList<>();
        for (State s : states) {
            if (s.getName().equals(name)) result.add(s);
        }
        return result;
    }

    @Nullable
    public State getStateByName(@NotNull String name) {
        for (State s : states) {
            if (s.getName().equals(name)) return s;
        }
        return null;
    }

    /**
     * States whose name contains a match of {@code pattern}.
     */
    @NotNull
    public List<State> getStatesByPattern(@NotNull Pattern pattern) {
        List<State> result = new ArrayList<>();
        for (State s : states) {
            if (pattern.matcher(s.getName()).find()) result.add(s);
        }
        return result;
    }

    @NotNull
    public List<State> getStatesByPattern(@NotNull String regex) {
        return getStatesByPattern(Pattern.compile(regex));
    }

    /**
     * States called {@code name} that have an edge into {@code downstream}.
     */
    @NotNull
    public List<State> getStatesByNameAndTransition(@NotNull String name, @NotNull State downstream) {
        List<State> result = new ArrayList<>();
        for (State s : getStatesByName(name)) {
            if (s.getNextStates().contains(downstream)) result.add(s);
        }
        return result;
    }

    @Nullable
    public State getStateByNameAndTransition(@NotNull String name, @NotNull State downstream) {
        List<State> found = getStatesByNameAndTransition(name, downstream);
        return found.isEmpty() ? null : found.get(0);
    }

    /**
     * Find a state called {@code name} leading to {@code downstream}, or create one. The flags are
     * only used for a newly created state. This lets topology rules share helper states instead
     * of creating one per rule application.
     */
    @NotNull
    public State getOrCreateStateByNameAndTransition(@NotNull String name, @NotNull State downstream,
                                                     boolean isStart, boolean isEnd) {
        State existing = getStateByNameAndTransition(name, downstream);
        if (existing != null) return existing;
        return addState(name, isStart, isEnd);
    }

    /* Transition queries */

    @NotNull
    public List<Transition> getTransitions() {
        List<Transition> result = new ArrayList<>();
        for (State s : states) {
            result.addAll(s.getTransitions());
        }
        return result;
    }

    @NotNull
    public List<Transition> getTransitionsBySymbol(@NotNull Symbol symbol) {
        return getTransitionsByQuery(TransitionQuery.create().symbol(symbol));
    }

    @NotNull
    public List<Transition> getTransitionsByQuality(@NotNull String quality) {
        return getTransitionsByQuery(TransitionQuery.create().quality(quality));
    }

    @NotNull
    public List<Transition> getTransitionsByToState(@NotNull State to) {
        return getTransitionsByQuery(TransitionQuery.create().to(to));
    }

    @NotNull
    public List<Transition> getTransitionsByQuery(@NotNull TransitionQuery query) {
        return query.filter(getTransitions());
    }

    @Nullable
    public Transition getTransitionByQuery(@NotNull TransitionQuery query) {
        for (State s : states) {
            for (Transition t : s.getTransitions()) {
                if (query.test(t)) return t;
            }
        }
        return null;
    }

    /**
     * Transitions a walk may begin with, i.e. those leaving a start state.
     */
    @NotNull
    public List<Transition> getInitialTransitions() {
        return getTransitionsByQuery(TransitionQuery.create().fromStart(true));
    }

    /* Pathway search */

    /**
     * One layer per symbol with every transition some accepting walk over {@code symbols} can
     * take at that position. An empty layer means the symbols are not accepted.
     */
    @NotNull
    public List<List<Transition>> getPathways(@NotNull List<? extends Symbol> symbols) {
        return Pathways.find(this, symbols);
    }

    /**
     * Every state path that reads {@code symbols}, starting with the start state that is left by
     * the first symbol.
     */
    @NotNull
    public List<List<State>> analyze(@NotNull List<? extends Symbol> symbols) {
        return Pathways.expand(getPathways(symbols));
    }

    /**
     * Credit every transition that some accepting walk over {@code symbols} uses. Each position
     * hands out one unit of count, split evenly among the transitions possible there.
     *
     * @return false if the symbols are not accepted, in which case nothing is credited
     */
    public boolean trainSequence(@NotNull List<? extends Symbol> symbols) {
        List<List<Transition>> layers = getPathways(symbols);
        if (!Pathways.isComplete(layers)) {
            log.debug("No pathway for {}, skipping", symbols);
            return false;
        }
        for (List<Transition> layer : layers) {
            double credit = 1.0 / layer.size();
            for (Transition t : layer) {
                t.credit(credit);
            }
        }
        return true;
    }

    /**
     * @return number of sequences that were accepted and credited
     */
    public int trainSequences(@NotNull List<? extends List<? extends Symbol>> sequences) {
        int trained = 0;
        for (List<? extends Symbol> symbols : sequences) {
            if (trainSequence(symbols)) trained += 1;
        }
        log.debug("Trained on {} of {} sequences", trained, sequences.size());
        return trained;
    }

    /* Validation */

    /**
     * Read {@code symbols} one at a time and report the first position where no state can be
     * reached anymore, or the last position if reading succeeds but no end state is reached.
     *
     * @return null if the symbols are accepted
     */
    @Nullable
    public FailureReport findFailurePoint(@NotNull List<? extends Symbol> symbols) {
        List<Symbol> copy = new ArrayList<>(symbols);
        if (copy.isEmpty()) {
            return new FailureReport(copy, 0, Collections.emptyList(), false);
        }
        Set<State> current = Pathways.targets(
                TransitionQuery.create().symbol(copy.get(0)).fromStart(true).filter(getTransitions()));
        if (current.isEmpty()) {
            return new FailureReport(copy, 0, Collections.emptyList(), false);
        }
        for (int i = 1; i < copy.size(); i++) {
            Set<State> previous = current;
            current = Pathways.targets(Pathways.step(previous, copy.get(i)));
            if (current.isEmpty()) {
                return new FailureReport(copy, i, new ArrayList<>(previous), false);
            }
        }
        for (State s : current) {
            if (s.isEnd()) return null;
        }
        return new FailureReport(copy, copy.size() - 1, new ArrayList<>(current), true);
    }

    public boolean validate(@NotNull List<? extends Symbol> symbols) {
        return findFailurePoint(symbols) == null;
    }

    /* Probability reports */

    /**
     * Probability of each target state name given that {@code symbol} is played, i.e. how
     * likely each harmonic function is for that symbol.
     */
    @NotNull
    public Map<String, Double> getStateProbabilitiesGivenSymbol(@NotNull Symbol symbol) {
        return ProbabilityTable.of(getTransitionsBySymbol(symbol), ProbabilityTable.KeyType.STATE);
    }

    /**
     * Probability of each symbol among the transitions entering states matching {@code pattern}.
     */
    @NotNull
    public Map<String, Double> getSymbolProbabilitiesGivenStatePattern(@NotNull Pattern pattern) {
        Set<State> matching = new LinkedHashSet<>(getStatesByPattern(pattern));
        List<Transition> transitions = new ArrayList<>();
        for (Transition t : getTransitions()) {
            if (matching.contains(t.getTo())) transitions.add(t);
        }
        return ProbabilityTable.of(transitions, ProbabilityTable.KeyType.SYMBOL);
    }

    @NotNull
    public Map<String, Double> getTransitionProbabilitiesGivenStatePattern(@NotNull Pattern pattern) {
        return getTransitionProbabilitiesGivenStatePattern(pattern, ProbabilityTable.KeyType.SYMBOL_AND_STATE);
    }

    /**
     * Probability of each way of leaving states matching {@code pattern}.
     */
    @NotNull
    public Map<String, Double> getTransitionProbabilitiesGivenStatePattern(@NotNull Pattern pattern,
                                                                          @NotNull ProbabilityTable.KeyType keyType) {
        List<Transition> transitions = new ArrayList<>();
        for (State s : getStatesByPattern(pattern)) {
            transitions.addAll(s.getTransitions());
        }
        return ProbabilityTable.of(transitions, keyType);
    }

    /* Sampling and generation */

    /**
     * @throws NoViableChoiceException if no transition carries weight
     */
    @NotNull
    public Transition sampleByProbability(@NotNull List<Transition> transitions) {
        return sampler.sample(transitions);
    }

    @NotNull
    public Sequence buildSequence() {
        return new Sequence(this, Collections.emptyList());
    }

    /**
     * A one-transition sequence leaving a start state with {@code startSymbol}.
     *
     * @throws NoViableChoiceException if no trained initial transition carries that symbol
     */
    @NotNull
    public Sequence buildSequence(@NotNull Symbol startSymbol) {
        List<Transition> initial = TransitionQuery.create()
                .symbol(startSymbol)
                .filter(getInitialTransitions());
        return new Sequence(this, Collections.singletonList(sampleByProbability(initial)));
    }

    /**
     * Sample a walk of exactly {@code n} transitions starting with {@code startSymbol} and ending
     * with {@code endSymbol}. A null {@code startState} means the walk leaves a start state,
     * otherwise its first transition must enter {@code startState}. A null {@code endState} means
     * the walk ends in an end state, otherwise its last transition must enter {@code endState}.
     *
     * @throws GenerationFailedException if no such walk exists
     */
    @NotNull
    public Sequence generateNLengthSequence(int n, @NotNull Symbol startSymbol, @NotNull Symbol endSymbol,
                                            @Nullable State startState, @Nullable State endState) {
        return withRetries(n + " transition walk from " + startSymbol + " to " + endSymbol,
                () -> elaborator.nLengthSequence(n, startSymbol, endSymbol, startState, endState));
    }

    @NotNull
    public Sequence generateNLengthSequence(int n, @NotNull Symbol startSymbol, @NotNull Symbol endSymbol) {
        return generateNLengthSequence(n, startSymbol, endSymbol, null, null);
    }

    /**
     * Sample transitions that lead from the target of {@code before} to the target of
     * {@code after}, ending with {@code after}'s symbol. Splicing the result in place of
     * {@code after} keeps a sequence connected.
     *
     * @throws GenerationFailedException if {@code after} cannot be reached that way
     */
    @NotNull
    public Sequence generateConnection(@NotNull Transition before, @NotNull Transition after) {
        return withRetries("connection from " + before + " to " + after,
                () -> new Sequence(this, elaborator.connect(before, after)));
    }

    /**
     * Alternative 2 and 3 hop routes between the endpoints of {@code transition}, as merged layers.
     */
    @NotNull
    public List<List<Transition>> findElaborations(@NotNull Transition transition) {
        return elaborator.findElaborations(transition);
    }

    @NotNull
    public List<Transition> elaborate(@NotNull Transition transition, boolean mustElaborate) {
        return elaborator.elaborate(transition, mustElaborate);
    }

    /**
     * A walk starting with {@code firstSymbol}, at least {@code minLength} transitions long and
     * ending in an end state.
     */
    @NotNull
    public Sequence generateSequenceFromStartAndLength(@NotNull Symbol firstSymbol, int minLength) {
        return withRetries("sequence of length " + minLength + " from " + firstSymbol, () -> {
            Sequence sequence = buildSequence(firstSymbol);
            while (sequence.length() < minLength || !sequence.last().getTo().isEnd()) {
                sequence = sequence.add(true);
                checkLength(sequence);
            }
            return sequence;
        });
    }

    /**
     * A walk starting with {@code firstSymbol} whose last transition carries {@code lastSymbol}
     * and enters an end state.
     */
    @NotNull
    public Sequence generateSequenceFromStartAndEnd(@NotNull Symbol firstSymbol, @NotNull Symbol lastSymbol) {
        return withRetries("sequence from " + firstSymbol + " to " + lastSymbol, () -> {
            Sequence sequence = buildSequence(firstSymbol);
            while (!(sequence.last().getSymbol().equals(lastSymbol) && sequence.last().getTo().isEnd())) {
                sequence = sequence.add(true);
                checkLength(sequence);
            }
            return sequence;
        });
    }

    /**
     * Generate {@code n} walks from {@code firstSymbol} to {@code lastSymbol} and count how often
     * each collapsed symbol string occurs, most frequent first.
     */
    @NotNull
    public List<Pair<String, Integer>> mostCommonGeneratedSequences(@NotNull Symbol firstSymbol,
                                                                   @NotNull Symbol lastSymbol, int n) {
        Map<String, Integer> occurrences = new LinkedHashMap<>();
        for (int i = 0; i < n; i++) {
            Sequence sequence = generateSequenceFromStartAndEnd(firstSymbol, lastSymbol);
            List<String> names = new ArrayList<>();
            for (Symbol s : sequence.getSymbolsCollapsed()) {
                names.add(s.toString());
            }
            occurrences.merge(String.join(" ", names), 1, Integer::sum);
        }
        List<Pair<String, Integer>> result = new ArrayList<>();
        for (Map.Entry<String, Integer> entry : occurrences.entrySet()) {
            result.add(new Pair<>(entry.getKey(), entry.getValue()));
        }
        result.sort((a, b) -> Integer.compare(b.getSecond(), a.getSecond()));
        return result;
    }

    /**
     * Run {@code attempt} until it stops running into zero weight dead ends, at most
     * {@link GenerationSettings#getMaxAttempts()} times.
     */
    <T> T withRetries(@NotNull String what, @NotNull Supplier<T> attempt) {
        NoViableChoiceException last = null;
        for (int i = 1; i <= settings.getMaxAttempts(); i++) {
            try {
                return attempt.get();
            } catch (NoViableChoiceException e) {
                log.debug("Attempt {} to build {} failed: {}", i, what, e.getMessage());
                last = e;
            }
        }
        throw new GenerationFailedException("Could not construct " + what + " after "
                + settings.getMaxAttempts() + " attempts", settings.getMaxAttempts(), last);
    }

    void checkLength(@NotNull Sequence sequence) {
        if (sequence.length() > settings.getMaxSequenceLength()) {
            throw new NoViableChoiceException("Sequence grew past " + settings.getMaxSequenceLength()
                    + " transitions without finishing");
        }
    }

    @Override
    public String toString() {
        int edges = 0;
        for (State s : states) {
            edges += s.getTransitions().size();
        }
        return "Automaton{states=" + states.size() + ", transitions=" + edges + "}";
    }
}
