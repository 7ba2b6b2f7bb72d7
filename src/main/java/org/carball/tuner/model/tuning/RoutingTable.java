package org.carball.tuner.model.tuning;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Final query-to-replica assignment. Every query of the routed workload appears exactly once.
 */
public final class RoutingTable {

    private final Map<String, Route> routes = new LinkedHashMap<>();
    private final List<String> replicaIds;

    public RoutingTable(List<String> replicaIds) {
        this.replicaIds = List.copyOf(replicaIds);
    }

    public void add(Route route) {
        if (route.replicaPosition() < 0 || route.replicaPosition() >= replicaIds.size()
                || !replicaIds.get(route.replicaPosition()).equals(route.replicaId())) {
            throw new IllegalArgumentException("Route to unknown replica: " + route);
        }
        if (routes.putIfAbsent(route.queryId(), route) != null) {
            throw new IllegalStateException("Query " + route.queryId() + " is already routed");
        }
    }

    public Route get(String queryId) {
        return routes.get(queryId);
    }

    public String replicaFor(String queryId) {
        Route route = routes.get(queryId);
        return route == null ? null : route.replicaId();
    }

    public Collection<Route> routes() {
        return Collections.unmodifiableCollection(routes.values());
    }

    public List<String> replicaIds() {
        return replicaIds;
    }

    public int size() {
        return routes.size();
    }

    /**
     * Sum of routed query costs per replica, in replica order.
     */
    public Map<String, Double> loadByReplica() {
        Map<String, Double> loads = new LinkedHashMap<>();
        replicaIds.forEach(id -> loads.put(id, 0.0));
        routes.values().forEach(r -> loads.merge(r.replicaId(), r.cost(), Double::sum));
        return loads;
    }

    public double totalCost() {
        return routes.values().stream().mapToDouble(Route::cost).sum();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof RoutingTable other
                && replicaIds.equals(other.replicaIds)
                && routes.equals(other.routes);
    }

    @Override
    public int hashCode() {
        return routes.hashCode();
    }

    @Override
    public String toString() {
        return routes.values().toString();
    }
}
