package org.carball.tuner.tuning;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum TuningStage {
    CLUSTER_AND_TUNE("cluster/tune"),
    REFINE("refine"),
    ROUTE("route");

    private final String displayName;
}
