package com.rowbase.db.util;

import com.google.common.base.Joiner;
import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import com.rowbase.common.status.Status;
import com.rowbase.common.status.StatusOr;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.Collections;
import java.util.Optional;
import javax.annotation.Nonnull;

/** Utility methods for database operations. */
public final class DbUtil {

  private static final Joiner COMMA_JOINER = Joiner.on(", ");

  private DbUtil() {
    // Utility class, no instances
  }

  /**
   * Quotes a table or column name as a PostgreSQL delimited identifier. Embedded double quotes are
   * doubled, so any name is safe to splice into generated SQL.
   */
  @Nonnull
  public static String quote(String identifier) {
    Preconditions.checkArgument(!Strings.isNullOrEmpty(identifier), "Identifier cannot be empty");
    return '"' + identifier.replace("\"", "\"\"") + '"';
  }

  /** Returns {@code count} comma separated JDBC placeholders, e.g. {@code ?, ?, ?}. */
  @Nonnull
  public static String placeholders(int count) {
    Preconditions.checkArgument(count > 0, "Placeholder count must be positive: %s", count);
    return COMMA_JOINER.join(Collections.nCopies(count, "?"));
  }

  /** Converts a java.time.Instant to java.sql.Timestamp. */
  @Nonnull
  public static Timestamp toSqlTimestamp(Instant instant) {
    if (instant == null) {
      throw new IllegalArgumentException("Instant cannot be null");
    }
    return Timestamp.from(instant);
  }

  /** Gets an Instant from a ResultSet column using column name. */
  @Nonnull
  public static StatusOr<Instant> getInstant(ResultSet rs, String columnName) {
    try {
      Timestamp timestamp = rs.getTimestamp(columnName);
      if (rs.wasNull() || timestamp == null) {
        return StatusOr.ofStatus(Status.invalidArgument("Column " + columnName + " is null"));
      }
      return StatusOr.ofValue(timestamp.toInstant());
    } catch (SQLException e) {
      return StatusOr.ofException(e);
    }
  }

  /**
   * Gets an optional Instant from a ResultSet column, returning Optional.empty() if the column is
   * null.
   */
  @Nonnull
  public static StatusOr<Optional<Instant>> getOptionalInstant(ResultSet rs, String columnName) {
    try {
      Timestamp timestamp = rs.getTimestamp(columnName);
      if (rs.wasNull() || timestamp == null) {
        return StatusOr.ofValue(Optional.empty());
      }
      return StatusOr.ofValue(Optional.of(timestamp.toInstant()));
    } catch (SQLException e) {
      return StatusOr.ofException(e);
    }
  }
}
