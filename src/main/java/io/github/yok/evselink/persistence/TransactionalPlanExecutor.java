package io.github.yok.evselink.persistence;

import io.github.yok.evselink.core.ImportException;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.dbunit.database.IDatabaseConnection;
import org.dbunit.dataset.Column;
import org.dbunit.dataset.DataSetException;
import org.dbunit.dataset.DefaultDataSet;
import org.dbunit.dataset.DefaultTable;
import org.dbunit.dataset.DefaultTableMetaData;
import org.dbunit.dataset.IDataSet;
import org.dbunit.dataset.datatype.DataType;
import org.dbunit.operation.DatabaseOperation;

/**
 * Runs a list of {@link PersistenceOperation}s as one transaction.
 *
 * <p>
 * <strong>Contract:</strong>
 * </p>
 * <ul>
 * <li>Auto-commit is switched off for the duration of the plan and restored afterwards.</li>
 * <li>Operations run strictly in list order: {@code CLEAR} via DBUnit DELETE_ALL,
 * {@code UPSERT} via DBUnit REFRESH. Empty upserts are skipped.</li>
 * <li>After the last operation the transaction is committed.</li>
 * <li>On the first failure the transaction is rolled back and an {@link ImportException} is
 * thrown; nothing of the plan remains in the database.</li>
 * </ul>
 *
 * <p>
 * Column data types are taken from the database metadata by DBUnit, so the in-memory tables are
 * built with {@link DataType#UNKNOWN}.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class TransactionalPlanExecutor {

    private final OperationExecutor operationExecutor;

    /**
     * Creates an executor with the default DBUnit operations.
     */
    public TransactionalPlanExecutor() {
        this(new OperationExecutor() {
            @Override
            public void deleteAll(IDatabaseConnection connection, IDataSet dataSet)
                    throws Exception {
                DatabaseOperation.DELETE_ALL.execute(connection, dataSet);
            }

            @Override
            public void refresh(IDatabaseConnection connection, IDataSet dataSet)
                    throws Exception {
                DatabaseOperation.REFRESH.execute(connection, dataSet);
            }
        });
    }

    /**
     * Creates an executor with custom DBUnit operations.
     *
     * @param operationExecutor executor for DBUnit write operations
     */
    public TransactionalPlanExecutor(OperationExecutor operationExecutor) {
        this.operationExecutor = operationExecutor;
    }

    OperationExecutor getOperationExecutor() {
        return operationExecutor;
    }

    /**
     * Executes the plan in one transaction.
     *
     * @param phase phase name for logging
     * @param dbConn DBUnit connection wrapping the destination JDBC connection
     * @param plan operations in execution order
     * @throws ImportException if any operation, the commit, or the transaction setup fails
     */
    public void execute(String phase, IDatabaseConnection dbConn,
            List<PersistenceOperation> plan) {
        Connection jdbc;
        boolean autoCommit;
        try {
            jdbc = dbConn.getConnection();
            autoCommit = jdbc.getAutoCommit();
            jdbc.setAutoCommit(false);
        } catch (SQLException e) {
            throw new ImportException("[" + phase + "] Failed to start transaction", e);
        }

        log.info("[{}] Transaction started (operations={})", phase, plan.size());
        try {
            for (PersistenceOperation op : plan) {
                apply(phase, dbConn, op);
            }
            jdbc.commit();
            log.info("[{}] Transaction committed", phase);
        } catch (Exception e) {
            try {
                jdbc.rollback();
                log.warn("[{}] Transaction rolled back due to error.", phase);
            } catch (SQLException rollbackEx) {
                log.warn("[{}] Rollback failed: {}", phase, rollbackEx.getMessage(), rollbackEx);
                e.addSuppressed(rollbackEx);
            }
            throw new ImportException("[" + phase + "] " + e.getMessage(), e);
        } finally {
            try {
                jdbc.setAutoCommit(autoCommit);
            } catch (SQLException e) {
                log.warn("[{}] Failed to restore auto-commit: {}", phase, e.getMessage());
            }
        }
    }

    private void apply(String phase, IDatabaseConnection dbConn, PersistenceOperation op)
            throws Exception {
        switch (op.getKind()) {
            case CLEAR:
                operationExecutor.deleteAll(dbConn,
                        new DefaultDataSet(new DefaultTable(op.getTableName())));
                log.info("[{}] Table[{}] deletedAll", phase, op.getTableName());
                break;
            case UPSERT:
                if (op.rowCount() == 0) {
                    log.info("[{}] Table[{}] no rows → skipping", phase, op.getTableName());
                    return;
                }
                operationExecutor.refresh(dbConn, new DefaultDataSet(toTable(op)));
                log.info("[{}] Table[{}] upserted={}", phase, op.getTableName(), op.rowCount());
                break;
            default:
                throw new IllegalStateException("Unsupported operation: " + op.getKind());
        }
    }

    static DefaultTable toTable(PersistenceOperation op) throws DataSetException {
        Column[] columns = op.getColumns().stream().map(c -> new Column(c, DataType.UNKNOWN))
                .toArray(Column[]::new);
        DefaultTable table =
                new DefaultTable(new DefaultTableMetaData(op.getTableName(), columns));
        for (Object[] row : op.getRows()) {
            table.addRow(row);
        }
        return table;
    }
}
