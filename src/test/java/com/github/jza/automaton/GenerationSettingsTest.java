package com.github.jza.automaton;

import org.junit.Test;

import java.util.Properties;
import java.util.Random;

import static org.junit.Assert.assertEquals;

public class GenerationSettingsTest {

    @Test
    public void missingPropertiesFallBackToDefaults() {
        GenerationSettings settings = GenerationSettings.fromProperties(new Properties());
        assertEquals(GenerationSettings.DEFAULT_MAX_ATTEMPTS, settings.getMaxAttempts());
        assertEquals(GenerationSettings.DEFAULT_MAX_SEQUENCE_LENGTH, settings.getMaxSequenceLength());
    }

    @Test
    public void propertiesAreRead() {
        Properties properties = new Properties();
        properties.setProperty(GenerationSettings.MAX_ATTEMPTS_KEY, "7");
        properties.setProperty(GenerationSettings.MAX_SEQUENCE_LENGTH_KEY, " 32 ");
        properties.setProperty(GenerationSettings.SEED_KEY, "99");

        GenerationSettings settings = GenerationSettings.fromProperties(properties);
        assertEquals(7, settings.getMaxAttempts());
        assertEquals(32, settings.getMaxSequenceLength());
        assertEquals(new Random(99).nextLong(), settings.getRandom().nextLong());
    }

    @Test(expected = IllegalArgumentException.class)
    public void malformedNumberIsRejected() {
        Properties properties = new Properties();
        properties.setProperty(GenerationSettings.MAX_ATTEMPTS_KEY, "many");
        GenerationSettings.fromProperties(properties);
    }

    @Test(expected = IllegalArgumentException.class)
    public void nonPositiveLimitIsRejected() {
        new GenerationSettings(new Random(), 0, 10);
    }
}
