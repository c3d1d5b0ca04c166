package org.learningjava.biasscore.application.port;

import java.sql.SQLException;

/**
 * A single relational transaction. Nothing written through it is visible to other
 * readers before {@link #commit()}.
 */
public interface StoreTransaction extends AutoCloseable {

    /** @return number of affected rows */
    int execute(String sql, Object... params) throws SQLException;

    void commit() throws SQLException;

    void rollback() throws SQLException;

    /** Releases the connection. Rolls back first if neither commit nor rollback happened. */
    @Override
    void close() throws SQLException;
}
