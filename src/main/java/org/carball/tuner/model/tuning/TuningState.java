package org.carball.tuner.model.tuning;

import java.util.Map;

/**
 * A partition, the configurations recommended for it, and the total cost measured once those
 * configurations were applied.
 */
public record TuningState(
        IndexConfigurations configurations,
        Partition partition,
        double totalCost,
        Map<String, Double> replicaCosts
) {}
