package com.marketsim.common.stats;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Deterministic verification of {@link ValueStatistics}.
 */
class ValueStatisticsTest {

    @Nested
    @DisplayName("mode()")
    class Mode {

        @Test
        @DisplayName("[1,1,2,2] → no unique mode")
        void tiedMode() {
            ModeResult mode = ValueStatistics.mode(List.of(1.0, 1.0, 2.0, 2.0));
            assertFalse(mode.isUnique());
            assertInstanceOf(ModeResult.NoUniqueMode.class, mode);
            assertEquals("No unique mode", mode.describe());
        }

        @Test
        @DisplayName("[1,1,1,2] → 1")
        void uniqueMode() {
            ModeResult mode = ValueStatistics.mode(List.of(1.0, 1.0, 1.0, 2.0));
            assertTrue(mode.isUnique());
            assertEquals(ModeResult.of(1.0), mode);
        }

        @Test
        @DisplayName("all distinct values share frequency 1 → no unique mode")
        void allDistinct() {
            assertFalse(ValueStatistics.mode(List.of(3.0, 1.0, 2.0)).isUnique());
        }

        @Test
        @DisplayName("single value is its own mode")
        void singleValue() {
            assertEquals(ModeResult.of(5.0), ValueStatistics.mode(List.of(5.0)));
        }
    }

    @Nested
    @DisplayName("summarize()")
    class Summarize {

        @Test
        @DisplayName("empty group → no data, no exception")
        void emptyGroup() {
            ValueSummary summary = ValueStatistics.summarize(Collections.emptyList());
            assertFalse(summary.hasData());
            assertSame(ValueSummary.noData(), summary);
            assertEquals(0, summary.count());
        }

        @Test
        @DisplayName("odd-sized group")
        void oddGroup() {
            ValueSummary summary = ValueStatistics.summarize(List.of(900.0, 1100.0, 1100.0, 1300.0, 600.0));
            assertTrue(summary.hasData());
            assertEquals(5, summary.count());
            assertEquals(1000.0, summary.mean());
            assertEquals(1100.0, summary.median());
            assertEquals(600.0, summary.min());
            assertEquals(1300.0, summary.max());
            assertEquals(ModeResult.of(1100.0), summary.mode());
        }

        @Test
        @DisplayName("even-sized group takes the mean of the middle pair")
        void evenGroup() {
            ValueSummary summary = ValueStatistics.summarize(List.of(1.0, 4.0, 2.0, 3.0));
            assertEquals(2.5, summary.median());
            assertEquals(2.5, summary.mean());
            assertFalse(summary.mode().isUnique());
        }

        @Test
        @DisplayName("values equal to the cent share a mode")
        void roundsToCents() {
            ValueSummary summary = ValueStatistics.summarize(List.of(1100.0000000000002, 1100.0, 990.0));
            assertEquals(ModeResult.of(1100.0), summary.mode());
            assertEquals(1063.33, summary.mean());
        }
    }
}
