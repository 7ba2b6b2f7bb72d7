package org.carball.tuner.model.schema;

import lombok.Getter;

import java.util.Comparator;
import java.util.Locale;
import java.util.Objects;

/**
 * An indexable column. Equality, hashing and ordering are defined over (table name, column name),
 * so a column must be attached to its {@link Table} before it is compared or put in a set.
 */
@Getter
public class Column implements Comparable<Column> {

    private static final Comparator<Column> ORDER = Comparator
            .comparing((Column c) -> c.requireTable().getName())
            .thenComparing(Column::getName);

    private final String name;
    private Table table;

    public Column(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Column name must not be blank");
        }
        this.name = name.trim().toLowerCase(Locale.ROOT);
    }

    void attachTo(Table owner) {
        if (this.table != null && this.table != owner) {
            throw new IllegalStateException("Column " + name + " already belongs to table " + this.table.getName());
        }
        this.table = owner;
    }

    public String getQualifiedName() {
        return requireTable().getName() + "." + name;
    }

    private Table requireTable() {
        if (table == null) {
            throw new IllegalStateException("Column " + name + " has no owning table");
        }
        return table;
    }

    @Override
    public int compareTo(Column other) {
        return ORDER.compare(this, other);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Column other)) {
            return false;
        }
        // Table.equals compares columns, so only the table name is checked here
        return requireTable().getName().equals(other.requireTable().getName()) && name.equals(other.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(requireTable().getName(), name);
    }

    @Override
    public String toString() {
        return table == null ? name : getQualifiedName();
    }
}
