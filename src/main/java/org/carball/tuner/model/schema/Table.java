package org.carball.tuner.model.schema;

import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

@Getter
public class Table {

    private final String name;
    private final List<Column> columns = new ArrayList<>();

    public Table(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Table name must not be blank");
        }
        this.name = name.trim().toLowerCase(Locale.ROOT);
    }

    public Column addColumn(Column column) {
        column.attachTo(this);
        columns.add(column);
        return column;
    }

    public Column addColumn(String columnName) {
        return addColumn(new Column(columnName));
    }

    public Optional<Column> findColumn(String columnName) {
        String wanted = columnName.toLowerCase(Locale.ROOT);
        return columns.stream()
                .filter(c -> c.getName().equals(wanted))
                .findFirst();
    }

    public List<Column> getColumns() {
        return Collections.unmodifiableList(columns);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Table other)) {
            return false;
        }
        return name.equals(other.name) && columns.equals(other.columns);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, columns);
    }

    @Override
    public String toString() {
        return name;
    }
}
