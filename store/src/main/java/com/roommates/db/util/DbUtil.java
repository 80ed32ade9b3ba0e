package com.roommates.db.util;

import com.roommates.common.status.Status;
import com.roommates.common.status.StatusOr;
import java.sql.ResultSet;
import java.sql.SQLException;
import javax.annotation.Nonnull;

/**
 * Utility methods for reading typed values out of a ResultSet by column position. The column name
 * is only used for error messages.
 */
public final class DbUtil {

  private DbUtil() {
    // Utility class, no instances
  }

  /** Gets a non-null int from a ResultSet column using column index. */
  @Nonnull
  public static StatusOr<Integer> getInt(ResultSet rs, String columnName, int columnIndex) {
    try {
      int value = rs.getInt(columnIndex);
      if (rs.wasNull()) {
        return StatusOr.ofStatus(
            Status.invalidArgument(
                "Column " + columnName + " at index " + columnIndex + " is null"));
      }
      return StatusOr.ofValue(value);
    } catch (SQLException e) {
      return StatusOr.ofStatus(Status.internal("Failed to get int: " + e.getMessage(), e));
    }
  }

  /** Gets a non-null String from a ResultSet column using column index. */
  @Nonnull
  public static StatusOr<String> getString(ResultSet rs, String columnName, int columnIndex) {
    try {
      String value = rs.getString(columnIndex);
      if (rs.wasNull() || value == null) {
        return StatusOr.ofStatus(
            Status.invalidArgument(
                "Column " + columnName + " at index " + columnIndex + " is null"));
      }
      return StatusOr.ofValue(value);
    } catch (SQLException e) {
      return StatusOr.ofStatus(Status.internal("Failed to get String: " + e.getMessage(), e));
    }
  }
}
