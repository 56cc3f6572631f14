package db.migration;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import org.flywaydb.core.api.migration.BaseJavaMigration;
import org.flywaydb.core.api.migration.Context;

public class V4__register_pipeline_locks extends BaseJavaMigration {
  private static final String[] LOCK_NAMES = {"gold-refresh"};

  @Override
  public void migrate(Context context) throws Exception {
    Connection connection = context.getConnection();
    for (String lockName : LOCK_NAMES) {
      if (!lockExists(connection, lockName)) {
        try (PreparedStatement ps =
            connection.prepareStatement(
                "INSERT INTO pipeline_locks (lock_name, owner, acquired_at, expires_at) "
                    + "VALUES (?, NULL, NULL, NULL)")) {
          ps.setString(1, lockName);
          ps.executeUpdate();
        }
      }
    }
  }

  private boolean lockExists(Connection connection, String lockName) throws SQLException {
    try (PreparedStatement ps =
        connection.prepareStatement("SELECT 1 FROM pipeline_locks WHERE lock_name = ?")) {
      ps.setString(1, lockName);
      try (ResultSet rs = ps.executeQuery()) {
        return rs.next();
      }
    }
  }
}
