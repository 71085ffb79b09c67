package com.irisplatform.common.stats;

import com.irisplatform.common.exception.InvalidInputException;
import com.irisplatform.common.model.WindowStats;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class WindowStatsCalculatorTest {

    @Nested
    @DisplayName("compute()")
    class ComputeTests {

        @Test
        @DisplayName("five samples → mean, sample std and interpolated p95")
        void fiveSamples() {
            WindowStats stats = WindowStatsCalculator.compute(List.of(10.0, 20.0, 30.0, 40.0, 50.0));

            assertEquals(30.0, stats.mean(), 1e-9);
            assertEquals(Math.sqrt(250.0), stats.std(), 1e-9);
            // k = 4 * 0.95 = 3.8 → 40 + (50 - 40) * 0.8
            assertEquals(48.0, stats.p95(), 1e-9);
        }

        @Test
        @DisplayName("sample order does not matter")
        void unsortedInput() {
            WindowStats sorted = WindowStatsCalculator.compute(List.of(10.0, 20.0, 30.0, 40.0, 50.0));
            WindowStats shuffled = WindowStatsCalculator.compute(List.of(50.0, 10.0, 40.0, 20.0, 30.0));

            assertEquals(sorted.p95(), shuffled.p95(), 1e-9);
            assertEquals(sorted.mean(), shuffled.mean(), 1e-9);
            assertEquals(sorted.std(), shuffled.std(), 1e-9);
        }

        @Test
        @DisplayName("single sample → std 0.0, p95 equals the sample")
        void singleSample() {
            WindowStats stats = WindowStatsCalculator.compute(List.of(42.0));

            assertEquals(42.0, stats.mean());
            assertEquals(0.0, stats.std());
            assertEquals(42.0, stats.p95());
        }

        @Test
        @DisplayName("identical samples → std 0.0")
        void identicalSamples() {
            assertEquals(0.0, WindowStatsCalculator.compute(List.of(7.0, 7.0, 7.0)).std(), 1e-12);
        }

        @Test
        @DisplayName("computeAll keeps window order")
        void computeAll() {
            List<WindowStats> stats = WindowStatsCalculator.computeAll(List.of(
                List.of(30.0, 32.0), List.of(10.0, 12.0)));

            assertEquals(2, stats.size());
            assertEquals(31.0, stats.get(0).mean(), 1e-9);
            assertEquals(11.0, stats.get(1).mean(), 1e-9);
        }
    }

    @Nested
    @DisplayName("percentile()")
    class PercentileTests {

        @Test
        @DisplayName("p100 → largest value")
        void max() {
            assertEquals(3.0, WindowStatsCalculator.percentile(List.of(1.0, 2.0, 3.0), 100));
        }

        @Test
        @DisplayName("p0 → smallest value")
        void min() {
            assertEquals(1.0, WindowStatsCalculator.percentile(List.of(1.0, 2.0, 3.0), 0));
        }

        @Test
        @DisplayName("p50 of an even-sized list interpolates")
        void median() {
            assertEquals(2.5, WindowStatsCalculator.percentile(List.of(1.0, 2.0, 3.0, 4.0), 50), 1e-9);
        }

        @Test
        @DisplayName("out-of-range percentile → InvalidInputException")
        void outOfRange() {
            assertThrows(InvalidInputException.class,
                () -> WindowStatsCalculator.percentile(List.of(1.0), 101));
            assertThrows(InvalidInputException.class,
                () -> WindowStatsCalculator.percentile(List.of(1.0), Double.NaN));
        }
    }

    @Nested
    @DisplayName("invalid samples")
    class InvalidSampleTests {

        @Test
        @DisplayName("empty window → InvalidInputException")
        void empty() {
            assertThrows(InvalidInputException.class, () -> WindowStatsCalculator.compute(List.of()));
        }

        @Test
        @DisplayName("null window → InvalidInputException")
        void nullWindow() {
            assertThrows(InvalidInputException.class, () -> WindowStatsCalculator.compute(null));
        }

        @Test
        @DisplayName("negative, NaN or null sample → InvalidInputException")
        void badSamples() {
            assertThrows(InvalidInputException.class, () -> WindowStatsCalculator.compute(List.of(1.0, -2.0)));
            assertThrows(InvalidInputException.class, () -> WindowStatsCalculator.compute(List.of(1.0, Double.NaN)));
            assertThrows(InvalidInputException.class, () -> WindowStatsCalculator.compute(Arrays.asList(1.0, null)));
        }
    }
}
