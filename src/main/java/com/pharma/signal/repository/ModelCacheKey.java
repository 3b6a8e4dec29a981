package com.pharma.signal.repository;

import lombok.Value;

/**
 * Identity of a fitted model: the same drug variant, data snapshot, normalized
 * series and forecast settings always yield the same fit. The series digest
 * keeps a caller-supplied snapshot version from matching a differently
 * normalized series.
 */
@Value
public class ModelCacheKey {
    String drug;
    String variant;
    String snapshotVersion;
    String seriesDigest;
    String fingerprint;
}
