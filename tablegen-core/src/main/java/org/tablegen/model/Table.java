package org.tablegen.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AccessLevel;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * A base table found in the catalog. Columns are attached once, after the table list
 * has been read, and are ordered and numbered 1..n by ordinal position.
 */
@Getter
@ToString
@EqualsAndHashCode
public class Table {
    private final String name;
    private List<Column> columns = List.of();
    @Getter(AccessLevel.NONE)
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    private boolean attached;

    public Table(String name) {
        this.name = Objects.requireNonNull(name, "name");
    }

    @JsonCreator
    public Table(@JsonProperty("name") String name,
                 @JsonProperty("columns") List<Column> columns) {
        this(name);
        if (columns != null) {
            attachColumns(columns);
        }
    }

    public void attachColumns(List<Column> fetched) {
        if (attached) {
            throw new IllegalStateException("Columns already attached to table " + name);
        }
        List<Column> sorted = new ArrayList<>(fetched);
        sorted.sort(Comparator.comparingInt(Column::getOrdinalPosition));

        List<Column> numbered = new ArrayList<>(sorted.size());
        for (int i = 0; i < sorted.size(); i++) {
            Column c = sorted.get(i);
            numbered.add(c.getOrdinalPosition() == i + 1 ? c : c.toBuilder().ordinalPosition(i + 1).build());
        }
        this.columns = List.copyOf(numbered);
        this.attached = true;
    }
}
