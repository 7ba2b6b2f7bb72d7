package org.carball.tuner.replica;

import lombok.Builder;
import lombok.ToString;
import lombok.Value;

/**
 * Connection parameters of one read replica.
 */
@Value
@Builder
public class ReplicaEndpoint {
    String id;
    String host;
    @Builder.Default
    int port = 5432;
    String database;
    String user;
    @ToString.Exclude
    String password;

    public String jdbcUrl() {
        return String.format("jdbc:postgresql://%s:%d/%s", host, port, database);
    }
}
