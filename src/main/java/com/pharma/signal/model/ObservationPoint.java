package com.pharma.signal.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.LocalDate;

@Value
@Builder(toBuilder = true)
@Jacksonized
@Schema(description = "Quarterly count of adverse-event reports for one drug")
public class ObservationPoint {

    @Schema(description = "First day of the calendar quarter", example = "2023-10-01")
    LocalDate periodStart;

    @Schema(description = "Number of reports received in the quarter", example = "145")
    long count;

    @Schema(description = "Whether the count may still be superseded by a corrected figure", example = "false")
    boolean provisional;

    @Schema(description = "When the count was observed at the source, epoch milliseconds. " +
            "Orders duplicate reports for the same quarter.", example = "1704067200000")
    long observedAt;

    public static ObservationPoint of(LocalDate periodStart, long count) {
        return ObservationPoint.builder().periodStart(periodStart).count(count).build();
    }
}
