package io.github.yok.evselink.persistence;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.function.Function;
import lombok.Getter;

/**
 * Column layout of a destination table and how to turn a row object into column values.
 *
 * @param <T> row type
 */
@Getter
public class TableLayout<T> {

    private final String tableName;

    private final List<String> columns;

    private final Function<T, Object[]> valuesOf;

    /**
     * Creates a layout.
     *
     * @param tableName destination table
     * @param columns column names, in the order {@code valuesOf} returns values
     * @param valuesOf row to column values
     */
    public TableLayout(String tableName, List<String> columns, Function<T, Object[]> valuesOf) {
        this.tableName = tableName;
        this.columns = ImmutableList.copyOf(columns);
        this.valuesOf = valuesOf;
    }
}
