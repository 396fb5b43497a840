package com.github.jza.symbol;

import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotEquals;

public class NumeralSymbolTest {

    @Test
    public void parseSplitsTrailingQuality() {
        NumeralSymbol s = NumeralSymbol.parse("IIm");
        assertEquals("II", s.getNumeral());
        assertEquals("m", s.getQuality());

        NumeralSymbol dominant = NumeralSymbol.parse("bVIIx");
        assertEquals("bVII", dominant.getNumeral());
        assertEquals("x", dominant.getQuality());
    }

    @Test
    public void parseDefaultsToMajor() {
        NumeralSymbol s = NumeralSymbol.parse("IV");
        assertEquals("IV", s.getNumeral());
        assertEquals(NumeralSymbol.DEFAULT_QUALITY, s.getQuality());
        assertEquals(NumeralSymbol.of("IV", "M"), s);
    }

    @Test
    public void singleCharacterIsNumeral() {
        NumeralSymbol s = NumeralSymbol.parse("x");
        assertEquals("x", s.getNumeral());
        assertEquals("M", s.getQuality());
    }

    @Test
    public void valueEquality() {
        assertEquals(NumeralSymbol.parse("Vx"), NumeralSymbol.FACTORY.create("V", "x"));
        assertEquals(NumeralSymbol.parse("Vx").hashCode(), NumeralSymbol.of("V", "x").hashCode());
        assertNotEquals(NumeralSymbol.parse("Vx"), NumeralSymbol.parse("VM"));
        assertEquals("IIm", NumeralSymbol.parse("IIm").toString());
    }

    @Test(expected = IllegalArgumentException.class)
    public void emptyNumeralIsRejected() {
        NumeralSymbol.of("", "M");
    }
}
