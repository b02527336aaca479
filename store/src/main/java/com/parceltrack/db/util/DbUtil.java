package com.parceltrack.db.util;

import com.parceltrack.common.status.ErrorReason;
import com.parceltrack.common.status.Status;
import com.parceltrack.common.status.StatusCode;
import com.parceltrack.common.status.StatusOr;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.SQLTimeoutException;
import java.sql.Statement;
import java.time.Duration;
import javax.annotation.Nonnull;

/** Utility methods for database operations. */
public final class DbUtil {

  /** SQLSTATE reported by PostgreSQL when a statement is cancelled, including by timeout. */
  private static final String QUERY_CANCELED_SQL_STATE = "57014";

  private DbUtil() {
    // Utility class, no instances
  }

  /**
   * Applies a query timeout to a statement. JDBC timeouts have one-second granularity, so a
   * positive sub-second duration rounds up to one second. Zero or negative means no limit.
   */
  public static void applyTimeout(Statement stmt, Duration timeout) throws SQLException {
    int seconds = toTimeoutSeconds(timeout);
    if (seconds > 0) {
      stmt.setQueryTimeout(seconds);
    }
  }

  /** Converts a duration to whole JDBC timeout seconds, rounding up; 0 means no limit. */
  public static int toTimeoutSeconds(Duration timeout) {
    if (timeout == null || timeout.isZero() || timeout.isNegative()) {
      return 0;
    }
    if (timeout.getSeconds() >= Integer.MAX_VALUE) {
      return Integer.MAX_VALUE;
    }
    return (int) timeout.getSeconds() + (timeout.getNano() > 0 ? 1 : 0);
  }

  /** Gets a non-null string from a ResultSet column using column name. */
  @Nonnull
  public static StatusOr<String> getRequiredString(ResultSet rs, String columnName) {
    try {
      String value = rs.getString(columnName);
      if (rs.wasNull() || value == null) {
        return StatusOr.ofStatus(
            Status.of(ErrorReason.STORAGE_FAILURE, "Column " + columnName + " is null"));
      }
      return StatusOr.ofValue(value);
    } catch (SQLException e) {
      return StatusOr.ofStatus(toStatus("Failed to get " + columnName, e));
    }
  }

  /** Gets a non-null integer from a ResultSet column using column name. */
  @Nonnull
  public static StatusOr<Integer> getRequiredInt(ResultSet rs, String columnName) {
    try {
      int value = rs.getInt(columnName);
      if (rs.wasNull()) {
        return StatusOr.ofStatus(
            Status.of(ErrorReason.STORAGE_FAILURE, "Column " + columnName + " is null"));
      }
      return StatusOr.ofValue(value);
    } catch (SQLException e) {
      return StatusOr.ofStatus(toStatus("Failed to get " + columnName, e));
    }
  }

  /**
   * Converts a driver exception into a STORAGE_FAILURE status that keeps the exception as its
   * cause. Statement timeouts are reported under DEADLINE_EXCEEDED.
   */
  @Nonnull
  public static Status toStatus(String message, SQLException e) {
    StatusCode code = isTimeout(e) ? StatusCode.DEADLINE_EXCEEDED : StatusCode.INTERNAL;
    return Status.of(code, ErrorReason.STORAGE_FAILURE, message + ": " + e.getMessage(), e);
  }

  /** Returns true if the exception reports a statement that hit its query timeout. */
  public static boolean isTimeout(SQLException e) {
    return e instanceof SQLTimeoutException || QUERY_CANCELED_SQL_STATE.equals(e.getSQLState());
  }
}
