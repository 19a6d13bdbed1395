package com.ashscreener.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class StockTest {

    @Test
    void codesShouldBeNormalized() {
        assertEquals("600000", Stock.normalizeCode("sh600000"));
        assertEquals("000001", Stock.normalizeCode("1"));
        assertEquals("300750", Stock.normalizeCode("300750.SZ"));
        assertEquals("", Stock.normalizeCode(null));
    }

    @Test
    void specialTreatmentAndDelistingNamesShouldBeExcluded() {
        assertTrue(new Stock("600001", "*ST海润").excludedByName());
        assertTrue(new Stock("600002", "ST中天").excludedByName());
        assertTrue(new Stock("600003", "退市大控").excludedByName());
        assertFalse(new Stock("600000", "浦发银行").excludedByName());
    }

    @Test
    void boardShouldFollowCodePrefix() {
        assertEquals(Board.MAIN, new Stock("600000", "a").board);
        assertEquals(Board.MAIN, new Stock("000001", "a").board);
        assertEquals(Board.CHINEXT, new Stock("300750", "a").board);
        assertEquals(Board.STAR, new Stock("688981", "a").board);
        assertEquals(Board.BEIJING, new Stock("830799", "a").board);
        assertFalse(Board.BEIJING.screenable());
        assertTrue(Board.STAR.screenable());
    }
}
