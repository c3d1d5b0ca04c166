package org.learningjava.biasscore.application.port;

import java.sql.SQLException;

public interface ScoreStorePort {
    void ensureSchema();

    /** Opens a transaction; the caller owns it and must close it. */
    StoreTransaction begin() throws SQLException;
}
