package com.pharma.signal.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.pharma.signal.exception.MalformedSeriesException;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.LocalDate;
import java.util.HexFormat;
import java.util.List;

/**
 * Strictly ordered quarterly series produced by one normalization pass.
 * The constructor enforces quarter alignment and strictly increasing periods.
 */
@Getter
@ToString
@EqualsAndHashCode
@Schema(description = "Gap-handled, strictly ordered quarterly series")
public final class NormalizedSeries {

    @Schema(description = "Drug or variant name", example = "ozempic")
    private final String drug;

    @Schema(description = "Gap policy applied during normalization", example = "zero")
    private final GapPolicy gapPolicy;

    @Schema(description = "Observed and gap-filled points in period order")
    private final List<ObservationPoint> points;

    @Schema(description = "Quarters that were missing from the raw input")
    private final List<LocalDate> gapPeriods;

    @Schema(description = "True when missing quarters were dropped instead of filled", example = "false")
    private final boolean discontinuous;

    @Builder
    private NormalizedSeries(String drug, GapPolicy gapPolicy, List<ObservationPoint> points,
                             List<LocalDate> gapPeriods, boolean discontinuous) {
        this.drug = drug;
        this.gapPolicy = gapPolicy;
        this.points = points == null ? List.of() : List.copyOf(points);
        this.gapPeriods = gapPeriods == null ? List.of() : List.copyOf(gapPeriods);
        this.discontinuous = discontinuous;

        LocalDate previous = null;
        for (ObservationPoint point : this.points) {
            LocalDate period = Quarters.requireQuarterStart(point.getPeriodStart(), "Series " + drug);
            if (previous != null && !period.isAfter(previous)) {
                throw new MalformedSeriesException(String.format(
                        "Series %s: period %s does not follow %s", drug, period, previous));
            }
            previous = period;
        }
    }

    public int size() {
        return points.size();
    }

    @JsonIgnore
    public boolean isEmpty() {
        return points.isEmpty();
    }

    public ObservationPoint get(int index) {
        return points.get(index);
    }

    @JsonIgnore
    public long[] getCounts() {
        return points.stream().mapToLong(ObservationPoint::getCount).toArray();
    }

    @JsonIgnore
    public LocalDate getFirstPeriod() {
        return points.isEmpty() ? null : points.get(0).getPeriodStart();
    }

    @JsonIgnore
    public LocalDate getLastPeriod() {
        return points.isEmpty() ? null : points.get(points.size() - 1).getPeriodStart();
    }

    /**
     * Number of calendar quarters spanned by the series, including quarters a
     * DROP policy left out.
     */
    @JsonIgnore
    public int getCoveredQuarters() {
        if (points.isEmpty()) return 0;
        return (int) Quarters.between(getFirstPeriod(), getLastPeriod()) + 1;
    }

    /**
     * SHA-256 over the normalized content. Identical inputs under the same gap
     * policy always produce the same digest.
     */
    @JsonIgnore
    public String getSnapshotDigest() {
        StringBuilder canonical = new StringBuilder(String.valueOf(gapPolicy));
        for (ObservationPoint point : points) {
            canonical.append('|').append(point.getPeriodStart())
                    .append('=').append(point.getCount())
                    .append(point.isProvisional() ? 'p' : 'f');
        }
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(canonical.toString().getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
