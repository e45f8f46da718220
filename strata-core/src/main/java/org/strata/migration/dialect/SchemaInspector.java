package org.strata.migration.dialect;

import org.strata.model.SchemaSnapshot;
import org.strata.model.TableModel;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.Optional;

/**
 * Reads live schema metadata from the target store.
 */
public interface SchemaInspector {

    SchemaSnapshot snapshot(Connection connection) throws SQLException;

    Optional<TableModel> table(Connection connection, String tableName) throws SQLException;
}
