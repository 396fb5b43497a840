package com.github.jza.automaton;

import org.jetbrains.annotations.NotNull;

import java.util.Properties;
import java.util.Random;

/**
 * Knobs of the stochastic generation code: where random numbers come from and how hard
 * chained constructions may try before giving up.
 */
public final class GenerationSettings {

    public static final String MAX_ATTEMPTS_KEY = "jza.generation.maxAttempts";
    public static final String MAX_SEQUENCE_LENGTH_KEY = "jza.generation.maxSequenceLength";
    public static final String SEED_KEY = "jza.generation.seed";

    public static final int DEFAULT_MAX_ATTEMPTS = 100;
    public static final int DEFAULT_MAX_SEQUENCE_LENGTH = 256;

    @NotNull
    private final Random random;

    private final int maxAttempts;

    private final int maxSequenceLength;

    public GenerationSettings(@NotNull Random random, int maxAttempts, int maxSequenceLength) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be positive, got " + maxAttempts);
        }
        if (maxSequenceLength < 1) {
            throw new IllegalArgumentException("maxSequenceLength must be positive, got " + maxSequenceLength);
        }
        this.random = random;
        this.maxAttempts = maxAttempts;
        this.maxSequenceLength = maxSequenceLength;
    }

    @NotNull
    public static GenerationSettings defaults() {
        return new GenerationSettings(new Random(), DEFAULT_MAX_ATTEMPTS, DEFAULT_MAX_SEQUENCE_LENGTH);
    }

    @NotNull
    public static GenerationSettings withSeed(long seed) {
        return new GenerationSettings(new Random(seed), DEFAULT_MAX_ATTEMPTS, DEFAULT_MAX_SEQUENCE_LENGTH);
    }

    /**
     * Read settings from properties; missing keys fall back to the defaults and a missing
     * seed gives an unseeded random source.
     */
    @NotNull
    public static GenerationSettings fromProperties(@NotNull Properties properties) {
        int attempts = intProperty(properties, MAX_ATTEMPTS_KEY, DEFAULT_MAX_ATTEMPTS);
        int length = intProperty(properties, MAX_SEQUENCE_LENGTH_KEY, DEFAULT_MAX_SEQUENCE_LENGTH);
        String seed = properties.getProperty(SEED_KEY);
        Random random;
        if (seed == null || seed.trim().isEmpty()) {
            random = new Random();
        } else {
            random = new Random(parse(SEED_KEY, seed));
        }
        return new GenerationSettings(random, attempts, length);
    }

    private static int intProperty(Properties properties, String key, int fallback) {
        String value = properties.getProperty(key);
        if (value == null || value.trim().isEmpty()) return fallback;
        return Math.toIntExact(parse(key, value));
    }

    private static long parse(String key, String value) {
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Property " + key + " is not a number: " + value, e);
        }
    }

    @NotNull
    public Random getRandom() {
        return random;
    }

    /**
     * Number of times a chained construction is restarted after hitting a dead end.
     */
    public int getMaxAttempts() {
        return maxAttempts;
    }

    /**
     * Upper bound on the number of transitions a single construction attempt may add.
     */
    public int getMaxSequenceLength() {
        return maxSequenceLength;
    }
}
