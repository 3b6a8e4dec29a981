package com.pharma.signal.engine;

import com.pharma.signal.exception.MalformedSeriesException;
import com.pharma.signal.model.GapPolicy;
import com.pharma.signal.model.MonitoringParameters;
import com.pharma.signal.model.NormalizedSeries;
import com.pharma.signal.model.ObservationPoint;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static com.pharma.signal.testutil.TestDataFactory.observed;
import static com.pharma.signal.testutil.TestDataFactory.point;
import static com.pharma.signal.testutil.TestDataFactory.quarter;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TimeSeriesNormalizerTest {

    private final TimeSeriesNormalizer normalizer = new TimeSeriesNormalizer();

    private static MonitoringParameters policy(GapPolicy gapPolicy) {
        return MonitoringParameters.builder().gapPolicy(gapPolicy).build();
    }

    private static List<ObservationPoint> withGap() {
        return List.of(point("2023Q1", 10), point("2023Q2", 20), point("2023Q4", 40));
    }

    @Test
    void normalize_unorderedInput_sortedByPeriod() {
        List<ObservationPoint> raw = List.of(
                point("2023Q3", 30), point("2023Q1", 10), point("2023Q4", 40), point("2023Q2", 20));

        NormalizedSeries series = normalizer.normalize("ozempic", raw, MonitoringParameters.defaults());

        assertThat(series.getCounts()).containsExactly(10, 20, 30, 40);
        assertThat(series.getFirstPeriod()).isEqualTo(quarter("2023Q1"));
        assertThat(series.getLastPeriod()).isEqualTo(quarter("2023Q4"));
        assertThat(series.getGapPeriods()).isEmpty();
        assertThat(series.isDiscontinuous()).isFalse();
    }

    @Test
    void normalize_zeroVersusCarryForward_differOnTheGap() {
        NormalizedSeries zero = normalizer.normalize("ozempic", withGap(), policy(GapPolicy.ZERO));
        NormalizedSeries carry = normalizer.normalize("ozempic", withGap(), policy(GapPolicy.CARRY_FORWARD));

        assertThat(zero.getCounts()).containsExactly(10, 20, 0, 40);
        assertThat(carry.getCounts()).containsExactly(10, 20, 20, 40);
        assertThat(zero.getGapPeriods()).containsExactly(quarter("2023Q3"));
        assertThat(carry.getGapPeriods()).containsExactly(quarter("2023Q3"));
        assertThat(zero).isNotEqualTo(carry);
        assertThat(zero.getSnapshotDigest()).isNotEqualTo(carry.getSnapshotDigest());
    }

    @Test
    void normalize_dropPolicy_leavesGapOutAndMarksDiscontinuous() {
        NormalizedSeries series = normalizer.normalize("ozempic", withGap(), policy(GapPolicy.DROP));

        assertThat(series.size()).isEqualTo(3);
        assertThat(series.getCounts()).containsExactly(10, 20, 40);
        assertThat(series.isDiscontinuous()).isTrue();
        assertThat(series.getCoveredQuarters()).isEqualTo(4);
    }

    @Test
    void normalize_multiQuarterGap_carryForwardRepeatsLastKnownCount() {
        List<ObservationPoint> raw = List.of(point("2022Q3", 7), point("2023Q2", 12));

        NormalizedSeries series = normalizer.normalize("ozempic", raw, policy(GapPolicy.CARRY_FORWARD));

        assertThat(series.getCounts()).containsExactly(7, 7, 7, 12);
        assertThat(series.getGapPeriods()).hasSize(2);
    }

    @Test
    void normalize_duplicateQuarter_finalCountBeatsProvisional() {
        List<ObservationPoint> raw = new ArrayList<>(List.of(
                point("2023Q1", 10), point("2023Q2", 20), point("2023Q3", 30)));
        raw.add(observed("2023Q4", 40, false, 100));
        raw.add(observed("2023Q4", 55, true, 200));

        NormalizedSeries series = normalizer.normalize("ozempic", raw, MonitoringParameters.defaults());

        assertThat(series.size()).isEqualTo(4);
        assertThat(series.get(3).getCount()).isEqualTo(40);
    }

    @Test
    void normalize_duplicateQuarter_laterObservationWins() {
        List<ObservationPoint> raw = new ArrayList<>(List.of(
                point("2023Q1", 10), point("2023Q2", 20), point("2023Q3", 30)));
        raw.add(observed("2023Q4", 45, false, 300));
        raw.add(observed("2023Q4", 40, false, 100));

        NormalizedSeries series = normalizer.normalize("ozempic", raw, MonitoringParameters.defaults());

        assertThat(series.get(3).getCount()).isEqualTo(45);
    }

    @Test
    void normalize_duplicateQuarter_tieGoesToLaterElement() {
        List<ObservationPoint> raw = new ArrayList<>(List.of(
                point("2023Q1", 10), point("2023Q2", 20), point("2023Q3", 30)));
        raw.add(observed("2023Q4", 40, false, 100));
        raw.add(observed("2023Q4", 41, false, 100));

        NormalizedSeries series = normalizer.normalize("ozempic", raw, MonitoringParameters.defaults());

        assertThat(series.get(3).getCount()).isEqualTo(41);
    }

    @Test
    void normalize_misalignedPeriod_throws() {
        List<ObservationPoint> raw = List.of(
                point("2023Q1", 10), ObservationPoint.of(LocalDate.of(2023, 5, 1), 20));

        assertThatThrownBy(() -> normalizer.normalize("ozempic", raw, MonitoringParameters.defaults()))
                .isInstanceOf(MalformedSeriesException.class)
                .hasMessageContaining("2023-05-01");
    }

    @Test
    void normalize_negativeCount_throws() {
        List<ObservationPoint> raw = List.of(
                point("2023Q1", 10), point("2023Q2", -1), point("2023Q3", 10), point("2023Q4", 10));

        assertThatThrownBy(() -> normalizer.normalize("ozempic", raw, MonitoringParameters.defaults()))
                .isInstanceOf(MalformedSeriesException.class)
                .hasMessageContaining("negative");
    }

    @Test
    void normalize_nullInputOrElement_throws() {
        assertThatThrownBy(() -> normalizer.normalize("ozempic", null, MonitoringParameters.defaults()))
                .isInstanceOf(MalformedSeriesException.class);
        assertThatThrownBy(() -> normalizer.normalize("ozempic",
                Arrays.asList(point("2023Q1", 1), null), MonitoringParameters.defaults()))
                .isInstanceOf(MalformedSeriesException.class);
    }

    @Test
    void normalize_fewerQuartersThanMinimum_throws() {
        List<ObservationPoint> raw = List.of(point("2023Q1", 10), point("2023Q2", 20), point("2023Q3", 30));

        assertThatThrownBy(() -> normalizer.normalize("ozempic", raw, MonitoringParameters.defaults()))
                .isInstanceOf(MalformedSeriesException.class)
                .hasMessageContaining("at least 4");
    }

    @Test
    void normalize_threeObservationsSpanningFourQuarters_succeeds() {
        NormalizedSeries series = normalizer.normalize("ozempic", withGap(), policy(GapPolicy.DROP));

        assertThat(series.size()).isEqualTo(3);
    }

    @Test
    void normalize_spanBeyondMaximum_rejectedBeforeFilling() {
        List<ObservationPoint> raw = List.of(
                point("2023Q1", 10),
                ObservationPoint.of(LocalDate.of(999_999_999, 1, 1), 12));

        assertThatThrownBy(() -> normalizer.normalize("ozempic", raw, MonitoringParameters.defaults()))
                .isInstanceOf(MalformedSeriesException.class)
                .hasMessageContaining("at most 400");
    }

    @Test
    void normalize_spanAtMaximum_accepted() {
        MonitoringParameters params = MonitoringParameters.builder().maxSpanQuarters(8).build();
        List<ObservationPoint> raw = List.of(point("2022Q1", 10), point("2023Q4", 12));

        NormalizedSeries series = normalizer.normalize("ozempic", raw, params);

        assertThat(series.size()).isEqualTo(8);
        assertThatThrownBy(() -> normalizer.normalize("ozempic",
                List.of(point("2022Q1", 10), point("2024Q1", 12)), params))
                .isInstanceOf(MalformedSeriesException.class);
    }
}
