package de.bsommerfeld.drydock.db;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Unit of work executed against a leased connection by
 * {@link ConnectionPool#withConnection}.
 */
@FunctionalInterface
public interface SqlWork<T> {

    T apply(Connection connection) throws SQLException;
}
