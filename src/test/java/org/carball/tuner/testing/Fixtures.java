package org.carball.tuner.testing;

import org.carball.tuner.model.schema.Column;
import org.carball.tuner.model.schema.DatabaseSchema;
import org.carball.tuner.model.schema.Index;
import org.carball.tuner.model.schema.Table;
import org.carball.tuner.model.workload.Query;
import org.carball.tuner.replica.Replica;
import org.carball.tuner.replica.ReplicaEndpoint;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * A small order-entry schema and helpers for building queries and replicas against it.
 */
public final class Fixtures {

    private Fixtures() {
    }

    public static DatabaseSchema schema() {
        Table orders = new Table("orders");
        orders.addColumn("id");
        orders.addColumn("customer_id");
        orders.addColumn("status");
        orders.addColumn("total");
        orders.addColumn("created_at");

        Table customers = new Table("customers");
        customers.addColumn("id");
        customers.addColumn("region");
        customers.addColumn("name");
        customers.addColumn("segment");

        return new DatabaseSchema(List.of(orders, customers));
    }

    public static Column column(DatabaseSchema schema, String qualifiedName) {
        String[] parts = qualifiedName.split("\\.");
        return schema.findTable(parts[0])
                .flatMap(t -> t.findColumn(parts[1]))
                .orElseThrow(() -> new IllegalArgumentException("Unknown column " + qualifiedName));
    }

    public static Index index(DatabaseSchema schema, String... qualifiedNames) {
        return new Index(columns(schema, qualifiedNames));
    }

    public static Query query(DatabaseSchema schema, String id, String... qualifiedNames) {
        return new Query(id, "SELECT * FROM t WHERE " + String.join(" AND ", Arrays.asList(qualifiedNames)),
                columns(schema, qualifiedNames));
    }

    public static Replica replica(String id, FakeCostOracle oracle) {
        return new Replica(endpoint(id), oracle);
    }

    public static ReplicaEndpoint endpoint(String id) {
        return ReplicaEndpoint.builder()
                .id(id)
                .host("localhost")
                .database("tpch")
                .user("tuner")
                .build();
    }

    private static List<Column> columns(DatabaseSchema schema, String... qualifiedNames) {
        List<Column> columns = new ArrayList<>();
        for (String name : qualifiedNames) {
            columns.add(column(schema, name));
        }
        return columns;
    }
}
