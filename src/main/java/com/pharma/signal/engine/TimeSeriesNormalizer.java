package com.pharma.signal.engine;

import com.pharma.signal.exception.MalformedSeriesException;
import com.pharma.signal.model.GapPolicy;
import com.pharma.signal.model.MonitoringParameters;
import com.pharma.signal.model.NormalizedSeries;
import com.pharma.signal.model.ObservationPoint;
import com.pharma.signal.model.Quarters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Turns an unordered collection of raw quarterly counts into a gap-handled,
 * strictly ordered series.
 *
 * Duplicates for the same quarter are resolved as follows:
 * a final (non-provisional) count beats a provisional one; otherwise the
 * later observedAt wins, and on equal observedAt the later input element wins.
 *
 * Missing quarters between the first and last observation are filled per the
 * run's {@link GapPolicy}.
 */
@Component
public class TimeSeriesNormalizer {

    private static final Logger log = LoggerFactory.getLogger(TimeSeriesNormalizer.class);

    public NormalizedSeries normalize(String drug, Collection<ObservationPoint> raw, MonitoringParameters params) {
        if (raw == null) {
            throw new MalformedSeriesException("Series " + drug + ": observations are missing");
        }

        TreeMap<LocalDate, ObservationPoint> byPeriod = new TreeMap<>();
        int duplicates = 0;
        for (ObservationPoint point : raw) {
            if (point == null) {
                throw new MalformedSeriesException("Series " + drug + ": null observation");
            }
            LocalDate period = Quarters.requireQuarterStart(point.getPeriodStart(), "Series " + drug);
            if (point.getCount() < 0) {
                throw new MalformedSeriesException(String.format(
                        "Series %s: negative count %d for %s", drug, point.getCount(), period));
            }
            ObservationPoint existing = byPeriod.get(period);
            if (existing == null) {
                byPeriod.put(period, point);
            } else {
                duplicates++;
                byPeriod.put(period, preferred(existing, point));
            }
        }

        if (!byPeriod.isEmpty()) {
            long span = Quarters.between(byPeriod.firstKey(), byPeriod.lastKey()) + 1;
            if (span > params.getMaxSpanQuarters()) {
                throw new MalformedSeriesException(String.format(
                        "Series %s: %s to %s spans %d quarters, at most %d allowed",
                        drug, byPeriod.firstKey(), byPeriod.lastKey(), span, params.getMaxSpanQuarters()));
            }
        }

        List<ObservationPoint> points = new ArrayList<>();
        List<LocalDate> gaps = new ArrayList<>();
        GapPolicy policy = params.getGapPolicy();

        ObservationPoint previous = null;
        for (Map.Entry<LocalDate, ObservationPoint> entry : byPeriod.entrySet()) {
            if (previous != null) {
                LocalDate missing = Quarters.plus(previous.getPeriodStart(), 1);
                while (missing.isBefore(entry.getKey())) {
                    gaps.add(missing);
                    ObservationPoint filler = fill(policy, missing, previous);
                    if (filler != null) {
                        points.add(filler);
                        previous = filler;
                    }
                    missing = Quarters.plus(missing, 1);
                }
            }
            points.add(entry.getValue());
            previous = entry.getValue();
        }

        NormalizedSeries series = NormalizedSeries.builder()
                .drug(drug)
                .gapPolicy(policy)
                .points(points)
                .gapPeriods(gaps)
                .discontinuous(policy == GapPolicy.DROP && !gaps.isEmpty())
                .build();

        if (series.getCoveredQuarters() < params.getMinPeriods()) {
            throw new MalformedSeriesException(String.format(
                    "Series %s: %d quarter(s) after normalization, at least %d required",
                    drug, series.getCoveredQuarters(), params.getMinPeriods()));
        }

        log.debug("Normalized {}: {} raw -> {} points ({} duplicates resolved, {} gaps, policy={})",
                drug, raw.size(), series.size(), duplicates, gaps.size(), policy.getValue());
        return series;
    }

    private ObservationPoint preferred(ObservationPoint existing, ObservationPoint candidate) {
        if (existing.isProvisional() != candidate.isProvisional()) {
            return existing.isProvisional() ? candidate : existing;
        }
        // same status: later observation supersedes, ties go to the later element
        return candidate.getObservedAt() >= existing.getObservedAt() ? candidate : existing;
    }

    private ObservationPoint fill(GapPolicy policy, LocalDate period, ObservationPoint previous) {
        switch (policy) {
            case ZERO:
                return ObservationPoint.of(period, 0);
            case CARRY_FORWARD:
                return ObservationPoint.of(period, previous.getCount());
            case DROP:
                return null;
            default:
                throw new IllegalStateException("Unhandled gap policy " + policy);
        }
    }
}
