package com.github.jza.automaton;

import com.github.jza.symbol.NumeralSymbol;
import com.github.jza.symbol.Symbol;

import java.util.Arrays;
import java.util.List;
import java.util.Random;

/**
 * Small hand-built automata shared by the tests.
 */
final class Fixtures {

    static final Symbol I = NumeralSymbol.parse("I");
    static final Symbol IIm = NumeralSymbol.parse("IIm");
    static final Symbol IVM = NumeralSymbol.parse("IVM");
    static final Symbol Vx = NumeralSymbol.parse("Vx");
    static final Symbol VIm = NumeralSymbol.parse("VIm");
    static final Symbol VIx = NumeralSymbol.parse("VIx");
    static final Symbol X = NumeralSymbol.parse("x");
    static final Symbol Y = NumeralSymbol.parse("y");
    static final Symbol Z = NumeralSymbol.parse("z");

    private Fixtures() {}

    static List<Symbol> symbols(Symbol... symbols) {
        return Arrays.asList(symbols);
    }

    static GenerationSettings settings(long seed) {
        return new GenerationSettings(new Random(seed), 100, 64);
    }

    /**
     * Tonic, subdominant and dominant states (all start and end) plus three helper states.
     * Every edge carries a positive count.
     */
    static final class Functional {
        final Automaton automaton;
        final State tonic;
        final State subdominant;
        final State dominant;
        final State applied;
        final State neighbor;
        final State passing;

        final Transition tonicI;
        final Transition tonicVIm;
        final Transition tonicIIm;
        final Transition tonicIVM;
        final Transition tonicVIx;
        final Transition appliedIIm;
        final Transition subdominantIIm;
        final Transition subdominantIVM;
        final Transition subdominantVx;
        final Transition dominantVx;
        final Transition dominantI;
        final Transition dominantIVM;
        final Transition neighborI;
        final Transition neighborIIm;
        final Transition passingI;

        Functional(long seed) {
            automaton = new Automaton(settings(seed));
            tonic = automaton.addState("Tonic 1", true, true);
            subdominant = automaton.addState("Subdominant 2", true, true);
            dominant = automaton.addState("Dominant 5", true, true);
            applied = automaton.addState("V / IIm", false, false);
            neighbor = automaton.addState("Neighbor of I", false, false);
            passing = automaton.addState("Passing chord", false, false);

            tonicI = automaton.addTransition(I, tonic, tonic, 1);
            tonicVIm = automaton.addTransition(VIm, tonic, tonic, 2);
            tonicIIm = automaton.addTransition(IIm, tonic, subdominant, 3);
            tonicIVM = automaton.addTransition(IVM, tonic, subdominant, 2);
            tonicVIx = automaton.addTransition(VIx, tonic, applied, 1);
            subdominantIIm = automaton.addTransition(IIm, subdominant, subdominant, 1);
            subdominantIVM = automaton.addTransition(IVM, subdominant, subdominant, 1);
            subdominantVx = automaton.addTransition(Vx, subdominant, dominant, 4);
            dominantVx = automaton.addTransition(Vx, dominant, dominant, 1);
            dominantI = automaton.addTransition(I, dominant, tonic, 5);
            dominantIVM = automaton.addTransition(IVM, dominant, neighbor, 1);
            appliedIIm = automaton.addTransition(IIm, applied, subdominant, 2);
            neighborI = automaton.addTransition(I, neighbor, tonic, 1);
            neighborIIm = automaton.addTransition(IIm, neighbor, passing, 1);
            passingI = automaton.addTransition(I, passing, tonic, 1);
        }

        Sequence sequence(Transition... transitions) {
            return new Sequence(automaton, Arrays.asList(transitions));
        }
    }

    /**
     * {@code S0(start) =[x]=> S1(end)}, untrained.
     */
    static final class SingleEdge {
        final Automaton automaton;
        final State s0;
        final State s1;
        final Transition edge;

        SingleEdge(double count) {
            automaton = new Automaton(settings(7));
            s0 = automaton.addState("S0", true, false);
            s1 = automaton.addState("S1", false, true);
            edge = automaton.addTransition(X, s0, s1, count);
        }
    }
}
