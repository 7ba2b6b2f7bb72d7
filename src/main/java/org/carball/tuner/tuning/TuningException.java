package org.carball.tuner.tuning;

import lombok.Getter;

/**
 * A tuning run failed and produced no output. Identifies the stage and, when known, the replica and
 * query involved.
 */
@Getter
public class TuningException extends RuntimeException {

    private final TuningStage stage;
    private final String replicaId;
    private final String queryId;

    public TuningException(TuningStage stage, String replicaId, String queryId, String message, Throwable cause) {
        super(describe(stage, replicaId, queryId, message), cause);
        this.stage = stage;
        this.replicaId = replicaId;
        this.queryId = queryId;
    }

    private static String describe(TuningStage stage, String replicaId, String queryId, String message) {
        StringBuilder text = new StringBuilder("Stage ").append(stage.getDisplayName()).append(" failed");
        if (replicaId != null) {
            text.append(" on replica ").append(replicaId);
        }
        if (queryId != null) {
            text.append(" for query ").append(queryId);
        }
        return text.append(": ").append(message).toString();
    }
}
