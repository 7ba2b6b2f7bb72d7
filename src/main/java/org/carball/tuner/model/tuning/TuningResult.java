package org.carball.tuner.model.tuning;

import java.util.List;

/**
 * Output of a complete tuning run: the per-replica configurations and the routing table, along with
 * the intermediate states that produced them.
 */
public record TuningResult(
        TuningState clusteredState,
        List<Double> acceptedTuneCosts,
        TuningState refinedState,
        RoutingTable routingTable
) {
    public IndexConfigurations configurations() {
        return refinedState.configurations();
    }
}
