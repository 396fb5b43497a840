package com.github.jza.corpus;

import com.github.jza.automaton.Automaton;
import com.github.jza.symbol.Symbol;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Feeds a corpus into {@link Automaton#trainSequences(List)}, either chart by chart or section
 * by section.
 */
public final class CorpusTrainer {

    private static final Logger log = LoggerFactory.getLogger(CorpusTrainer.class);

    public static final int DEFAULT_MIN_SECTION_SIZE = 2;

    @NotNull
    private final Automaton automaton;

    public CorpusTrainer(@NotNull Automaton automaton) {
        this.automaton = automaton;
    }

    /**
     * Train on every whole chart.
     *
     * @return number of charts the automaton accepted
     */
    public int trainBySong(@NotNull Corpus corpus, boolean withWrapAround) {
        List<List<Symbol>> sequences = new ArrayList<>();
        for (Chart chart : corpus.getCharts()) {
            sequences.add(chart.getSymbols(withWrapAround));
        }
        return train("charts", sequences);
    }

    public int trainBySection(@NotNull Corpus corpus, boolean withWrapAround) {
        return trainBySection(corpus, DEFAULT_MIN_SECTION_SIZE, withWrapAround);
    }

    /**
     * Train on every section with at least {@code minSectionSize} symbols.
     *
     * @return number of sections the automaton accepted
     */
    public int trainBySection(@NotNull Corpus corpus, int minSectionSize, boolean withWrapAround) {
        List<List<Symbol>> sequences = new ArrayList<>();
        for (Chart chart : corpus.getCharts()) {
            for (List<Symbol> section : chart.getSections(withWrapAround).values()) {
                if (section.size() >= minSectionSize) sequences.add(section);
            }
        }
        return train("sections", sequences);
    }

    private int train(@NotNull String what, @NotNull List<List<Symbol>> sequences) {
        int trained = automaton.trainSequences(sequences);
        log.info("Trained on {} of {} {}", trained, sequences.size(), what);
        return trained;
    }
}
