package io.github.yok.evselink.persistence;

import org.dbunit.database.IDatabaseConnection;
import org.dbunit.dataset.IDataSet;

/**
 * Abstraction for the DBUnit write operations used by {@link TransactionalPlanExecutor}.
 *
 * @author Yasuharu.Okawauchi
 */
public interface OperationExecutor {

    /**
     * Executes DBUnit DELETE_ALL.
     *
     * @param connection DBUnit connection
     * @param dataSet tables to clear
     * @throws Exception execution failure
     */
    void deleteAll(IDatabaseConnection connection, IDataSet dataSet) throws Exception;

    /**
     * Executes DBUnit REFRESH (insert, or update when the primary key exists).
     *
     * @param connection DBUnit connection
     * @param dataSet rows to write
     * @throws Exception execution failure
     */
    void refresh(IDatabaseConnection connection, IDataSet dataSet) throws Exception;
}
