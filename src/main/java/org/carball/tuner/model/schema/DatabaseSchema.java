package org.carball.tuner.model.schema;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.stream.Collectors;

@Data
public class DatabaseSchema {
    private List<Table> tables = new ArrayList<>();

    public DatabaseSchema() {
    }

    public DatabaseSchema(List<Table> tables) {
        this.tables = new ArrayList<>(tables);
    }

    public void addTable(Table table) {
        tables.add(table);
    }

    public Optional<Table> findTable(String name) {
        return tables.stream()
                .filter(t -> t.getName().equalsIgnoreCase(name))
                .findFirst();
    }

    public List<Column> getAllColumns() {
        return tables.stream()
                .flatMap(t -> t.getColumns().stream())
                .sorted()
                .collect(Collectors.toList());
    }

    /**
     * All columns with the given name, across every table. Several tables may share a column name.
     */
    public List<Column> findColumns(String columnName) {
        String wanted = columnName.toLowerCase(Locale.ROOT);
        return getAllColumns().stream()
                .filter(c -> c.getName().equals(wanted))
                .collect(Collectors.toList());
    }
}
