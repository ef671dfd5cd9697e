package com.tripscout.pojo.research;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class ResearchProgressTest {

    @Test
    void percentageOf_shouldFloorAndCap() {
        assertEquals(0, ResearchProgress.percentageOf(0, 0));
        assertEquals(11, ResearchProgress.percentageOf(1, 9));
        assertEquals(66, ResearchProgress.percentageOf(2, 3));
        assertEquals(100, ResearchProgress.percentageOf(9, 9));
        assertEquals(100, ResearchProgress.percentageOf(10, 9));
    }

    @Test
    void scoreBreakdown_shouldWeightAndRoundOverall() {
        ScoreBreakdown s = ScoreBreakdown.of(100, 100, 100, 100, 100, 100);
        assertEquals(100.0, s.getOverall());

        ScoreBreakdown neutral = ScoreBreakdown.of(50, 50, 50, 20, 30, 50);
        assertEquals(42.0, neutral.getOverall());
    }
}
