package com.github.jza.automaton;

import com.github.jza.automaton.exception.GenerationFailedException;
import com.github.jza.automaton.exception.InvalidSequenceException;
import com.github.jza.automaton.exception.NoViableChoiceException;
import com.github.jza.symbol.NumeralSymbol;
import com.github.jza.symbol.Symbol;
import org.junit.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Random;

import static com.github.jza.automaton.Fixtures.I;
import static com.github.jza.automaton.Fixtures.IIm;
import static com.github.jza.automaton.Fixtures.IVM;
import static com.github.jza.automaton.Fixtures.Vx;
import static com.github.jza.automaton.Fixtures.X;
import static com.github.jza.automaton.Fixtures.Y;
import static com.github.jza.automaton.Fixtures.Z;
import static com.github.jza.automaton.Fixtures.symbols;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class SequenceTest {

    private static void assertConnected(Sequence sequence) {
        List<Transition> transitions = sequence.getTransitions();
        for (int i = 1; i < transitions.size(); i++) {
            assertSame(sequence.toString(), transitions.get(i - 1).getTo(), transitions.get(i).getFrom());
        }
    }

    private static void assertNoAdjacentRepeats(Sequence sequence) {
        List<Transition> transitions = sequence.getTransitions();
        for (int i = 1; i < transitions.size(); i++) {
            assertNotEquals(sequence.toString(), transitions.get(i - 1).getSymbol(), transitions.get(i).getSymbol());
        }
    }

    @Test
    public void disconnectedTransitionsAreRejected() {
        Fixtures.Functional f = new Fixtures.Functional(1);
        try {
            f.sequence(f.tonicIIm, f.dominantI);
            fail();
        } catch (InvalidSequenceException e) {
            assertEquals(1, e.getIndex());
        }
    }

    @Test
    public void readers() {
        Fixtures.Functional f = new Fixtures.Functional(1);
        Sequence sequence = f.sequence(f.tonicIIm, f.subdominantIIm, f.subdominantVx, f.dominantI);

        assertEquals(4, sequence.length());
        assertSame(f.tonicIIm, sequence.first());
        assertSame(f.dominantI, sequence.last());
        assertEquals(symbols(IIm, IIm, Vx, I), sequence.getSymbols());
        assertEquals(symbols(IIm, Vx, I), sequence.getSymbolsCollapsed());
        assertEquals(Arrays.asList(f.subdominant, f.subdominant, f.dominant, f.tonic), sequence.getStates());
        assertEquals("Vx: Dominant 5", sequence.getSymbolStateStrings().get(2));
        assertEquals("IIm: Subdominant 2 | IIm: Subdominant 2 | Vx: Dominant 5 | I: Tonic 1", sequence.toString());

        Sequence empty = f.automaton.buildSequence();
        assertTrue(empty.isEmpty());
        assertNull(empty.first());
        assertNull(empty.last());
    }

    @Test
    public void addStartsAtStartState() {
        Fixtures.Functional f = new Fixtures.Functional(3);
        for (int i = 0; i < 50; i++) {
            Sequence sequence = f.automaton.buildSequence().add(false);
            assertEquals(1, sequence.length());
            assertTrue(sequence.first().getFrom().isStart());
        }
    }

    @Test
    public void addNWithoutRepeats() {
        Fixtures.Functional f = new Fixtures.Functional(5);
        Sequence sequence = f.automaton.buildSequence(I).addN(20, false);
        assertEquals(21, sequence.length());
        assertConnected(sequence);
        assertNoAdjacentRepeats(sequence);
    }

    @Test
    public void editsLeaveReceiverUnchanged() {
        Fixtures.Functional f = new Fixtures.Functional(1);
        Sequence sequence = f.sequence(f.tonicIIm, f.subdominantVx);
        sequence.add(true);
        sequence.remove();
        sequence.changeLast(false);
        assertEquals(Arrays.asList(f.tonicIIm, f.subdominantVx), sequence.getTransitions());
    }

    @Test
    public void addFullEndsInEndState() {
        Fixtures.Functional f = new Fixtures.Functional(11);
        for (int i = 0; i < 50; i++) {
            Sequence sequence = f.sequence(f.tonicVIx).addFull(false);
            assertTrue(sequence.last().getTo().isEnd());
            assertSame(f.tonicVIx, sequence.first());
            assertConnected(sequence);
            assertNoAdjacentRepeats(sequence);
        }
    }

    @Test
    public void addUntilSymbol() {
        Fixtures.Functional f = new Fixtures.Functional(13);
        Sequence sequence = f.automaton.buildSequence(IIm).addUntilSymbol(I, true);
        assertEquals(I, sequence.last().getSymbol());
        assertConnected(sequence);
    }

    @Test
    public void prependFullLeavesStartState() {
        Fixtures.Functional f = new Fixtures.Functional(17);
        for (int i = 0; i < 50; i++) {
            Sequence sequence = f.sequence(f.neighborIIm, f.passingI).prependFull(false);
            assertTrue(sequence.first().getFrom().isStart());
            assertTrue(sequence.length() >= 3);
            assertSame(f.passingI, sequence.last());
            assertConnected(sequence);
        }
    }

    @Test
    public void prependFullKeepsSymbolAndTargetOfFirst() {
        Fixtures.Functional f = new Fixtures.Functional(19);
        for (int i = 0; i < 50; i++) {
            Sequence sequence = f.sequence(f.dominantI).prependFull(false);
            assertTrue(sequence.length() >= 2);
            assertEquals(I, sequence.last().getSymbol());
            assertSame(f.tonic, sequence.last().getTo());
            assertTrue(sequence.first().getFrom().isStart());
            assertConnected(sequence);
        }
    }

    @Test(expected = IllegalStateException.class)
    public void prependFullOnEmptySequence() {
        new Fixtures.Functional(1).automaton.buildSequence().prependFull(true);
    }

    @Test
    public void removeN() {
        Fixtures.Functional f = new Fixtures.Functional(1);
        Sequence sequence = f.sequence(f.tonicIIm, f.subdominantVx, f.dominantI);
        assertEquals(Collections.singletonList(f.tonicIIm), sequence.removeN(2).getTransitions());
        assertEquals(Arrays.asList(f.tonicIIm, f.subdominantVx), sequence.remove().getTransitions());
        assertEquals(sequence.getTransitions(), sequence.removeN(0).getTransitions());
    }

    @Test(expected = IllegalArgumentException.class)
    public void removeNCannotEmptyTheSequence() {
        Fixtures.Functional f = new Fixtures.Functional(1);
        f.sequence(f.tonicIIm, f.subdominantVx, f.dominantI).removeN(3);
    }

    @Test(expected = IllegalArgumentException.class)
    public void removeNRejectsNegative() {
        Fixtures.Functional f = new Fixtures.Functional(1);
        f.sequence(f.tonicIIm).removeN(-1);
    }

    @Test
    public void changeLastPicksAnotherSymbol() {
        Fixtures.Functional f = new Fixtures.Functional(1);
        Sequence changed = f.sequence(f.tonicIIm, f.subdominantVx).changeLast(false);
        assertEquals(Arrays.asList(f.tonicIIm, f.subdominantIVM), changed.getTransitions());
    }

    @Test(expected = NoViableChoiceException.class)
    public void changeLastWithoutAlternative() {
        Fixtures.Functional f = new Fixtures.Functional(1);
        f.sequence(f.neighborIIm, f.passingI).changeLast(true);
    }

    @Test(expected = IllegalStateException.class)
    public void changeLastOnEmptySequence() {
        new Fixtures.Functional(1).automaton.buildSequence().changeLast(true);
    }

    @Test
    public void spliceReplacesTwoTransitionsByShortcut() {
        Fixtures.Functional f = new Fixtures.Functional(1);
        Sequence sequence = f.sequence(f.tonicIIm, f.subdominantIIm, f.subdominantVx);
        assertEquals(Arrays.asList(f.tonicIIm, f.subdominantVx), sequence.splice(1).getTransitions());
    }

    @Test
    public void spliceAtBoundaryRemoves() {
        Fixtures.Functional f = new Fixtures.Functional(1);
        Sequence sequence = f.sequence(f.tonicIIm, f.subdominantVx, f.dominantI);
        assertEquals(Arrays.asList(f.subdominantVx, f.dominantI), sequence.splice(0).getTransitions());
        assertEquals(Arrays.asList(f.tonicIIm, f.subdominantVx), sequence.splice(2).getTransitions());
    }

    @Test
    public void spliceWithoutShortcutReturnsSameInstance() {
        Fixtures.Functional f = new Fixtures.Functional(1);
        Sequence sequence = f.sequence(f.tonicIIm, f.subdominantVx, f.dominantI);
        assertSame(sequence, sequence.splice(1));
    }

    @Test(expected = IndexOutOfBoundsException.class)
    public void spliceOutOfRange() {
        Fixtures.Functional f = new Fixtures.Functional(1);
        f.sequence(f.tonicIIm).splice(1);
    }

    @Test
    public void makeUniqueRemovesRepeatsAndIsIdempotent() {
        Fixtures.Functional f = new Fixtures.Functional(1);
        Sequence sequence = f.sequence(f.tonicIIm, f.subdominantIVM, f.subdominantIVM, f.subdominantVx, f.dominantI);
        Sequence once = sequence.makeUnique();
        assertNoAdjacentRepeats(once);
        assertConnected(once);
        assertEquals(symbols(IIm, IVM, Vx, I), once.getSymbols());
        assertEquals(once.getTransitions(), once.makeUnique().getTransitions());
    }

    @Test
    public void reharmonizeInnerPhrase() {
        Fixtures.Functional f = new Fixtures.Functional(1);
        Sequence sequence = f.sequence(f.tonicIIm, f.subdominantVx, f.dominantI);
        Sequence result = sequence.reharmonizeAtIndex(1, false);
        assertEquals(Arrays.asList(f.tonicIIm, f.subdominantVx, f.dominantI), result.getTransitions());
    }

    @Test
    public void reharmonizeTrailingPhrase() {
        Fixtures.Functional f = new Fixtures.Functional(23);
        Sequence sequence = f.sequence(f.tonicIIm, f.subdominantVx, f.dominantI);
        for (int i = 0; i < 20; i++) {
            Sequence result = sequence.reharmonizeAtIndex(2, false);
            assertSame(f.tonicIIm, result.get(0));
            assertSame(f.subdominantVx, result.get(1));
            assertTrue(result.length() >= 3);
            assertTrue(result.last().getTo().isEnd());
            assertConnected(result);
        }
    }

    @Test
    public void reharmonizeLeadingPhrase() {
        Fixtures.Functional f = new Fixtures.Functional(29);
        Sequence sequence = f.sequence(f.tonicIIm, f.subdominantVx, f.dominantI);
        for (int i = 0; i < 20; i++) {
            Sequence result = sequence.reharmonizeAtIndex(0, false);
            assertSame(f.dominantI, result.last());
            assertTrue(result.first().getFrom().isStart());
            assertConnected(result);
        }
    }

    @Test
    public void reharmonizeSpansHelperStates() {
        Fixtures.Functional f = new Fixtures.Functional(31);
        Sequence sequence = f.sequence(f.tonicI, f.tonicVIx, f.appliedIIm, f.subdominantVx, f.dominantI);
        for (int i = 0; i < 20; i++) {
            Sequence result = sequence.reharmonizeAtIndex(2, true);
            assertSame(f.tonicI, result.first());
            assertSame(f.subdominantVx, result.get(result.length() - 2));
            assertSame(f.dominantI, result.last());
            assertConnected(result);
        }
    }

    @Test
    public void reharmonizeSingleTransition() {
        Fixtures.SingleEdge single = new Fixtures.SingleEdge(1);
        Sequence sequence = new Sequence(single.automaton, Collections.singletonList(single.edge));
        assertEquals(sequence.getTransitions(), sequence.reharmonizeAtIndex(0, true).getTransitions());
        assertEquals(sequence.getTransitions(), sequence.reharmonizeAtIndex(0, false).getTransitions());
    }

    @Test
    public void reharmonizeWholeSequenceKeepsAnchors() {
        Automaton automaton = new Automaton(Fixtures.settings(73));
        State s = automaton.addState("S", true, true);
        Transition loopI = automaton.addTransition(I, s, s, 1);
        automaton.addTransition(IVM, s, s, 1);
        Sequence sequence = new Sequence(automaton, Collections.singletonList(loopI));

        for (int i = 0; i < 50; i++) {
            Sequence result = sequence.reharmonizeAtIndex(0, true, s, s);
            assertEquals(Collections.singletonList(loopI), result.getTransitions());
        }
    }

    @Test
    public void reharmonizeWholeSequenceWithAnchorsKeepsLengthAndSymbols() {
        Fixtures.Functional f = new Fixtures.Functional(79);
        Sequence sequence = f.sequence(f.tonicVIx, f.appliedIIm);
        Sequence result = sequence.reharmonizeAtIndex(1, true, f.applied, f.subdominant);
        assertEquals(Arrays.asList(f.tonicVIx, f.appliedIIm), result.getTransitions());
    }

    @Test
    public void reharmonizeInnerPhraseRemovesIntroducedRepeats() {
        Automaton automaton = new Automaton(Fixtures.settings(83));
        State p = automaton.addState("P", true, false);
        State a = automaton.addState("A", false, true);
        State b = automaton.addState("B", false, true);
        State c = automaton.addState("C", false, true);
        State d = automaton.addState("D", false, true);
        State e = automaton.addState("E", false, true);
        Symbol w = NumeralSymbol.parse("w");
        Transition pw = automaton.addTransition(w, p, a, 1);
        Transition ax = automaton.addTransition(X, a, b, 1);
        Transition shortcut = automaton.addTransition(X, a, e, 1);
        Transition by = automaton.addTransition(Y, b, c, 0);
        automaton.addTransition(X, b, e, 1);
        Transition cz = automaton.addTransition(Z, c, d, 1);
        Transition ez = automaton.addTransition(Z, e, d, 1);
        Sequence sequence = new Sequence(automaton, Arrays.asList(pw, ax, by, cz));

        Sequence withRepeats = sequence.reharmonizeAtIndex(2, true);
        assertEquals(symbols(w, X, X, Z), withRepeats.getSymbols());

        Sequence unique = sequence.reharmonizeAtIndex(2, false);
        assertEquals(Arrays.asList(pw, shortcut, ez), unique.getTransitions());
        assertNoAdjacentRepeats(unique);
    }

    @Test
    public void reharmonizeInnerPhraseWithoutConnection() {
        Automaton automaton = new Automaton(new GenerationSettings(new Random(1), 3, 16));
        State a = automaton.addState("A", true, true);
        State b = automaton.addState("B", false, true);
        State c = automaton.addState("C", false, true);
        State d = automaton.addState("D", false, true);
        Transition ax = automaton.addTransition(X, a, b, 1);
        Transition by = automaton.addTransition(Y, b, c, 0);
        Transition cz = automaton.addTransition(Z, c, d, 1);
        try {
            new Sequence(automaton, Arrays.asList(ax, by, cz)).reharmonizeAtIndex(1, false);
            fail();
        } catch (GenerationFailedException e) {
            assertEquals(3, e.getAttempts());
            assertTrue(e.getCause() instanceof NoViableChoiceException);
        }
    }

    @Test(expected = IndexOutOfBoundsException.class)
    public void reharmonizeOutOfRange() {
        Fixtures.Functional f = new Fixtures.Functional(1);
        f.sequence(f.tonicIIm).reharmonizeAtIndex(1, true);
    }

    @Test
    public void addFullGivesUpOnDeadEnd() {
        Automaton automaton = new Automaton(new GenerationSettings(new Random(1), 3, 16));
        State s0 = automaton.addState("S0", true, false);
        State s1 = automaton.addState("S1", false, false);
        State s2 = automaton.addState("S2", false, true);
        automaton.addTransition(X, s0, s1, 1);
        automaton.addTransition(X, s1, s2, 0);
        try {
            automaton.buildSequence().addFull(true);
            fail();
        } catch (GenerationFailedException e) {
            assertEquals(3, e.getAttempts());
            assertTrue(e.getCause() instanceof NoViableChoiceException);
        }
    }

    @Test(expected = GenerationFailedException.class)
    public void addFullGivesUpOnEndlessLoop() {
        Automaton automaton = new Automaton(new GenerationSettings(new Random(1), 3, 10));
        State s0 = automaton.addState("S0", true, false);
        State end = automaton.addState("E", false, true);
        automaton.addTransition(X, s0, s0, 1);
        automaton.addTransition(X, end, end, 1);
        automaton.buildSequence().addFull(true);
    }

    @Test
    public void generatedSequencesAreAccepted() {
        Fixtures.Functional f = new Fixtures.Functional(37);
        for (int i = 0; i < 50; i++) {
            Sequence sequence = f.automaton.buildSequence().addFull(false);
            assertTrue(sequence.toString(), f.automaton.validate(sequence.getSymbols()));
            assertFalse(f.automaton.analyze(sequence.getSymbols()).isEmpty());
        }
    }
}
