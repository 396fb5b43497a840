package com.github.jza.corpus;

import org.jetbrains.annotations.NotNull;

import java.util.List;

public interface Corpus {

    @NotNull
    List<? extends Chart> getCharts();

}
