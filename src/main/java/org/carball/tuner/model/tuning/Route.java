package org.carball.tuner.model.tuning;

/**
 * Where one query is served, and its estimated cost there.
 */
public record Route(String queryId, String replicaId, int replicaPosition, double cost) {}
