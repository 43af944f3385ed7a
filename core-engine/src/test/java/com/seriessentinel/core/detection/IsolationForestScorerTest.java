package com.seriessentinel.core.detection;

import com.seriessentinel.core.model.Observation;
import com.seriessentinel.core.model.PointResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link IsolationForestScorer}.
 */
class IsolationForestScorerTest {

    private final IsolationForestScorer scorer = new IsolationForestScorer();

    @Test
    @DisplayName("Should return an empty result for an empty series")
    void shouldHandleEmptySeries() {
        assertThat(scorer.score(List.of(), 0.05, 42)).isEmpty();
    }

    @Test
    @DisplayName("Should reject a series shorter than the minimum sample size")
    void shouldRejectSinglePoint() {
        assertThatThrownBy(() -> scorer.score(List.of(new Observation("t0", 1.0)), 0.05, 42))
                .isInstanceOf(InvalidInputException.class)
                .hasMessageContaining("at least 2");
    }

    @ParameterizedTest
    @ValueSource(doubles = { Double.NaN, Double.POSITIVE_INFINITY, Double.NEGATIVE_INFINITY })
    @DisplayName("Should reject non-finite values")
    void shouldRejectNonFiniteValues(double bad) {
        List<Observation> series = List.of(
                new Observation("t0", 1.0), new Observation("t1", bad), new Observation("t2", 2.0));

        assertThatThrownBy(() -> scorer.score(series, 0.05, 42))
                .isInstanceOf(InvalidInputException.class)
                .hasMessageContaining("t1");
    }

    @ParameterizedTest
    @ValueSource(doubles = { 0.0, -0.1, 0.51, 1.0, Double.NaN })
    @DisplayName("Should reject contamination outside (0, 0.5]")
    void shouldRejectContaminationOutOfRange(double contamination) {
        assertThatThrownBy(() -> scorer.score(linearSeries(10), contamination, 42))
                .isInstanceOf(InvalidInputException.class)
                .hasMessageContaining("contamination");
    }

    @Test
    @DisplayName("Should accept the upper contamination bound")
    void shouldAcceptUpperContaminationBound() {
        assertThat(scorer.score(linearSeries(10), 0.5, 42)).hasSize(10);
    }

    @Test
    @DisplayName("Should return one result per observation in input order")
    void shouldPreserveLengthAndOrder() {
        List<Observation> series = List.of(
                new Observation("t3", 5.0),
                new Observation("t1", 7.0),
                new Observation("t2", 6.0),
                new Observation("t0", 90.0));

        List<PointResult> results = scorer.score(series, 0.25, 42);

        assertThat(results).extracting(PointResult::getTimestamp).containsExactly("t3", "t1", "t2", "t0");
        assertThat(results).extracting(PointResult::getValue).containsExactly(5.0, 7.0, 6.0, 90.0);
    }

    @Test
    @DisplayName("Should produce identical scores and flags for identical arguments")
    void shouldBeDeterministic() {
        List<Observation> series = noisySeriesWithOutlier();

        List<PointResult> first = scorer.score(series, 0.1, 1234);
        List<PointResult> second = new IsolationForestScorer().score(series, 0.1, 1234);

        assertThat(second).isEqualTo(first);
    }

    @Test
    @DisplayName("Should flag exactly the extreme outlier at low contamination")
    void shouldFlagExtremeOutlier() {
        List<PointResult> results = scorer.score(noisySeriesWithOutlier(), 0.05, 42);

        assertThat(results).filteredOn(PointResult::isAnomaly)
                .extracting(PointResult::getValue)
                .containsExactly(1_000.0);
    }

    @Test
    @DisplayName("Should flag a point exactly when its score is negative")
    void shouldFlagNegativeScores() {
        for (PointResult result : scorer.score(linearSeries(40), 0.2, 42)) {
            assertThat(result.isAnomaly()).isEqualTo(result.getScore() < 0);
        }
    }

    @Test
    @DisplayName("Should flag more points as contamination grows")
    void shouldFlagMoreWithHigherContamination() {
        List<Observation> series = linearSeries(30);

        long low = scorer.score(series, 0.05, 42).stream().filter(PointResult::isAnomaly).count();
        long high = scorer.score(series, 0.5, 42).stream().filter(PointResult::isAnomaly).count();

        assertThat(low).isPositive();
        assertThat(high).isGreaterThan(low);
    }

    @Test
    @DisplayName("Should not flag anything when every value is identical")
    void shouldNotFlagConstantSeries() {
        List<Observation> series = new ArrayList<>();
        for (int i = 0; i < 20; i++) {
            series.add(new Observation("t" + i, 3.0));
        }

        assertThat(scorer.score(series, 0.1, 42)).noneMatch(PointResult::isAnomaly);
    }

    @Test
    @DisplayName("Should reject an invalid forest shape")
    void shouldRejectInvalidShape() {
        assertThatThrownBy(() -> new IsolationForestScorer(0, 256))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new IsolationForestScorer(100, 1))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Should interpolate percentiles linearly between ranks")
    void shouldInterpolatePercentiles() {
        double[] data = { 4.0, 1.0, 3.0, 2.0 };

        assertThat(IsolationForestScorer.percentile(data, 0)).isEqualTo(1.0);
        assertThat(IsolationForestScorer.percentile(data, 100)).isEqualTo(4.0);
        assertThat(IsolationForestScorer.percentile(data, 50)).isEqualTo(2.5);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static List<Observation> linearSeries(int size) {
        List<Observation> series = new ArrayList<>();
        for (int i = 0; i < size; i++) {
            series.add(new Observation(String.format("t%03d", i), i));
        }
        return series;
    }

    /** 30 points cycling through 10.0, 10.1, 10.2 with one value of 1000 at index 17. */
    private static List<Observation> noisySeriesWithOutlier() {
        List<Observation> series = new ArrayList<>();
        for (int i = 0; i < 30; i++) {
            double value = i == 17 ? 1_000.0 : 10.0 + (i % 3) * 0.1;
            series.add(new Observation(String.format("t%03d", i), value));
        }
        return series;
    }
}
