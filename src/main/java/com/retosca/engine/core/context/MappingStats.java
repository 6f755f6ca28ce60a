package com.retosca.engine.core.context;

import lombok.Builder;
import lombok.Value;

/**
 * Aggregated statistics for a translation run.
 */
@Value
@Builder(toBuilder = true)
public class MappingStats {

    int resourcesDiscovered;
    int primaryMapped;
    int associativeMapped;
    int unsupported;
    int declined;
    int failed;

    int nodesEmitted;
    int inputsEmitted;
    int outputsEmitted;

    long translationTimeMillis;

    public static MappingStats empty() {
        return MappingStats.builder().build();
    }
}
