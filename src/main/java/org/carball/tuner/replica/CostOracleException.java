package org.carball.tuner.replica;

import lombok.Getter;

/**
 * A cost oracle call failed. Transient failures (lost connection, timeout) may succeed when retried.
 */
@Getter
public class CostOracleException extends RuntimeException {

    private final boolean transientFailure;
    private final String replicaId;
    private final String queryId;

    public CostOracleException(String message, Throwable cause, boolean transientFailure) {
        this(message, cause, transientFailure, null, null);
    }

    public CostOracleException(String message, Throwable cause, boolean transientFailure,
                               String replicaId, String queryId) {
        super(message, cause);
        this.transientFailure = transientFailure;
        this.replicaId = replicaId;
        this.queryId = queryId;
    }

    /**
     * The same failure, annotated with the replica and (optionally) the query it happened on.
     */
    public CostOracleException withContext(String replica, String query) {
        StringBuilder message = new StringBuilder(getMessage()).append(" [replica=").append(replica);
        if (query != null) {
            message.append(", query=").append(query);
        }
        message.append(']');
        return new CostOracleException(message.toString(), getCause(), transientFailure, replica, query);
    }
}
