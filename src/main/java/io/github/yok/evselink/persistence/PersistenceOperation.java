package io.github.yok.evselink.persistence;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.stream.Collectors;
import lombok.Getter;

/**
 * One step of a persistence plan: clear a table, or insert-or-update rows by primary key.
 *
 * <p>
 * Operations only describe the write. {@link TransactionalPlanExecutor} runs a list of them, in
 * order, inside one transaction.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
public final class PersistenceOperation {

    /**
     * Kind of write.
     */
    public enum Kind {
        // DELETE FROM table
        CLEAR,
        // insert rows, updating rows whose primary key already exists
        UPSERT
    }

    private final Kind kind;
    private final String tableName;
    private final List<String> columns;
    private final List<Object[]> rows;

    private PersistenceOperation(Kind kind, String tableName, List<String> columns,
            List<Object[]> rows) {
        this.kind = kind;
        this.tableName = tableName;
        this.columns = columns;
        this.rows = rows;
    }

    /**
     * Creates an operation that deletes every row of a table.
     *
     * @param tableName table to clear
     * @return clear operation
     */
    public static PersistenceOperation clear(String tableName) {
        return new PersistenceOperation(Kind.CLEAR, tableName, ImmutableList.of(),
                ImmutableList.of());
    }

    /**
     * Creates an insert-or-update operation.
     *
     * @param <T> row type
     * @param layout table layout
     * @param items rows to write
     * @return upsert operation
     */
    public static <T> PersistenceOperation upsert(TableLayout<T> layout, List<T> items) {
        List<Object[]> rows =
                items.stream().map(layout.getValuesOf()).collect(Collectors.toList());
        return new PersistenceOperation(Kind.UPSERT, layout.getTableName(), layout.getColumns(),
                rows);
    }

    public int rowCount() {
        return rows.size();
    }

    @Override
    public String toString() {
        return kind == Kind.CLEAR ? "CLEAR " + tableName
                : "UPSERT " + tableName + " rows=" + rows.size();
    }
}
