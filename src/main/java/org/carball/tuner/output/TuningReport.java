package org.carball.tuner.output;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;
import org.carball.tuner.config.TuningParameters;
import org.carball.tuner.model.schema.Index;
import org.carball.tuner.model.tuning.Route;
import org.carball.tuner.model.tuning.RoutingTable;
import org.carball.tuner.model.tuning.TuningResult;
import org.carball.tuner.model.workload.Query;

import java.io.UncheckedIOException;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

@Slf4j
public class TuningReport {

    private final TuningResult result;
    private final TuningParameters parameters;
    private final int queryCount;
    private final LocalDateTime timestamp;
    private final ObjectMapper objectMapper;

    public TuningReport(TuningResult result, TuningParameters parameters, int queryCount) {
        this(result, parameters, queryCount, LocalDateTime.now());
    }

    TuningReport(TuningResult result, TuningParameters parameters, int queryCount, LocalDateTime timestamp) {
        this.result = result;
        this.parameters = parameters;
        this.queryCount = queryCount;
        this.timestamp = timestamp;

        this.objectMapper = new ObjectMapper();
        this.objectMapper.registerModule(new JavaTimeModule());
        this.objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.objectMapper.enable(SerializationFeature.INDENT_OUTPUT);
        this.objectMapper.setSerializationInclusion(JsonInclude.Include.NON_NULL);
    }

    public String toJson() {
        try {
            return objectMapper.writeValueAsString(buildReportData());
        } catch (JsonProcessingException e) {
            log.error("Error generating JSON report", e);
            throw new UncheckedIOException("Failed to generate JSON report", e);
        }
    }

    public String toMarkdown() {
        StringBuilder md = new StringBuilder();
        RoutingTable routing = result.routingTable();
        Map<String, Double> loads = routing.loadByReplica();

        // Header
        md.append("# Read Replica Tuning Report\n\n");
        md.append("**Generated:** ").append(timestamp.format(DateTimeFormatter.ISO_LOCAL_DATE_TIME)).append("  \n");
        md.append("**Replicas:** ").append(routing.replicaIds().size()).append("  \n");
        md.append("**Queries:** ").append(queryCount).append("  \n\n");

        // Parameters
        md.append("## Parameters\n\n");
        md.append("| Parameter | Value |\n");
        md.append("|-----------|-------|\n");
        md.append("| Routing threshold | ").append(parameters.getThreshold()).append(" |\n");
        md.append("| Space budget (bytes) | ").append(parameters.getSpaceBudgetBytes()).append(" |\n");
        md.append("| Max index width | ").append(parameters.getMaxIndexWidth()).append(" |\n\n");

        // Stage costs
        md.append("## Estimated Cost by Stage\n\n");
        md.append("| Stage | Total Cost |\n");
        md.append("|-------|------------|\n");
        md.append("| Cluster and tune | ").append(format(result.clusteredState().totalCost())).append(" |\n");
        md.append("| Balance refinement | ").append(format(result.refinedState().totalCost())).append(" |\n");
        md.append("| Load-aware routing | ").append(format(routing.totalCost())).append(" |\n\n");

        if (result.acceptedTuneCosts().size() > 1) {
            md.append("Accepted cluster-and-tune costs: ")
                    .append(result.acceptedTuneCosts().stream().map(TuningReport::format).collect(Collectors.joining(" → ")))
                    .append("\n\n");
        }

        // Per-replica configuration
        md.append("## Replica Configurations\n\n");
        for (String replicaId : routing.replicaIds()) {
            List<Index> indexes = result.configurations().forReplica(replicaId);
            md.append("### ").append(replicaId).append("\n\n");
            md.append("- **Routed load:** ").append(format(loads.get(replicaId))).append("\n");
            md.append("- **Assigned queries:** ").append(describeQueries(result.refinedState().partition().queriesOf(replicaId))).append("\n");
            if (indexes.isEmpty()) {
                md.append("- **Indexes:** none\n\n");
            } else {
                md.append("- **Indexes:**\n");
                indexes.forEach(index -> md.append("  - `").append(describe(index)).append("`\n"));
                md.append("\n");
            }
        }

        // Routing table
        md.append("## Routing Table\n\n");
        md.append("| Query | Replica | Estimated Cost |\n");
        md.append("|-------|---------|----------------|\n");
        for (Route route : routing.routes()) {
            md.append("| ").append(route.queryId())
                    .append(" | ").append(route.replicaId())
                    .append(" | ").append(format(route.cost())).append(" |\n");
        }
        md.append("\n");

        return md.toString();
    }

    private ReportData buildReportData() {
        ReportData report = new ReportData();
        RoutingTable routing = result.routingTable();
        Map<String, Double> loads = routing.loadByReplica();

        report.setTuningMetadata(new TuningMetadata(
                timestamp,
                routing.replicaIds().size(),
                queryCount,
                parameters.getThreshold(),
                parameters.getSpaceBudgetBytes(),
                parameters.getMaxIndexWidth()
        ));

        StageCosts costs = new StageCosts();
        costs.setAcceptedClusterAndTune(result.acceptedTuneCosts());
        costs.setClusterAndTune(result.clusteredState().totalCost());
        costs.setRefined(result.refinedState().totalCost());
        costs.setRouted(routing.totalCost());
        report.setStageCosts(costs);

        report.setReplicas(routing.replicaIds().stream()
                .map(replicaId -> {
                    ReplicaSummary summary = new ReplicaSummary();
                    summary.setReplicaId(replicaId);
                    summary.setIndexes(result.configurations().forReplica(replicaId).stream()
                            .map(TuningReport::describe)
                            .collect(Collectors.toList()));
                    summary.setAssignedQueries(result.refinedState().partition().queriesOf(replicaId).stream()
                            .map(Query::getId)
                            .collect(Collectors.toList()));
                    summary.setRoutedLoad(loads.get(replicaId));
                    return summary;
                })
                .collect(Collectors.toList()));

        report.setRoutes(routing.routes().stream()
                .map(route -> new RouteEntry(route.queryId(), route.replicaId(), route.cost()))
                .collect(Collectors.toList()));

        return report;
    }

    private static String describe(Index index) {
        return index.getTable().getName() + "(" + index.getColumns().stream()
                .map(c -> c.getName())
                .collect(Collectors.joining(", ")) + ")";
    }

    private static String describeQueries(List<Query> queries) {
        if (queries.isEmpty()) {
            return "none";
        }
        return queries.stream().map(Query::getId).collect(Collectors.joining(", "));
    }

    private static String format(double cost) {
        return String.format("%.2f", cost);
    }


    // Inner classes for JSON structure
    @lombok.Data
    private static class ReportData {
        private TuningMetadata tuningMetadata;
        private StageCosts stageCosts;
        private List<ReplicaSummary> replicas;
        private List<RouteEntry> routes;
    }

    @lombok.Data
    @lombok.AllArgsConstructor
    private static class TuningMetadata {
        private LocalDateTime timestamp;
        private int replicaCount;
        private int queryCount;
        private double threshold;
        private long spaceBudgetBytes;
        private int maxIndexWidth;
    }

    @lombok.Data
    private static class StageCosts {
        private List<Double> acceptedClusterAndTune;
        private double clusterAndTune;
        private double refined;
        private double routed;
    }

    @lombok.Data
    private static class ReplicaSummary {
        private String replicaId;
        private List<String> indexes;
        private List<String> assignedQueries;
        private double routedLoad;
    }

    @lombok.Data
    @lombok.AllArgsConstructor
    private static class RouteEntry {
        private String queryId;
        private String replicaId;
        private double cost;
    }
}
