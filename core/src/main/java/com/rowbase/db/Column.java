package com.rowbase.db;

import com.google.common.base.Preconditions;
import com.rowbase.db.util.DbUtil;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Types;
import java.time.Instant;
import java.util.function.Function;
import javax.annotation.Nonnull;

/**
 * A data column of an entity table: its name, SQL type, nullability, and how to write a row's
 * value for it into a statement parameter.
 *
 * @param name column name, unquoted
 * @param sqlType PostgreSQL type used in CREATE TABLE
 * @param nullable whether the column accepts NULL
 * @param binder writes the column value of a row
 * @param <R> the row type
 */
public record Column<R>(String name, String sqlType, boolean nullable, Binder<R> binder) {

  /** Writes one column of a row into a statement parameter. */
  @FunctionalInterface
  public interface Binder<R> {
    void bind(PreparedStatement stmt, int index, R row) throws SQLException;
  }

  public Column {
    Preconditions.checkArgument(name != null && !name.isEmpty(), "Column name cannot be empty");
    Preconditions.checkNotNull(sqlType);
    Preconditions.checkNotNull(binder);
  }

  public static <R> Column<R> text(String name, Function<R, String> getter) {
    return new Column<>(name, "TEXT", false, (stmt, i, row) -> stmt.setString(i, getter.apply(row)));
  }

  public static <R> Column<R> nullableText(String name, Function<R, String> getter) {
    return new Column<>(name, "TEXT", true, (stmt, i, row) -> stmt.setString(i, getter.apply(row)));
  }

  public static <R> Column<R> bigint(String name, Function<R, Long> getter) {
    return new Column<>(name, "BIGINT", false, (stmt, i, row) -> stmt.setLong(i, getter.apply(row)));
  }

  public static <R> Column<R> integer(String name, Function<R, Integer> getter) {
    return new Column<>(name, "INTEGER", false, (stmt, i, row) -> stmt.setInt(i, getter.apply(row)));
  }

  public static <R> Column<R> bool(String name, Function<R, Boolean> getter) {
    return new Column<>(
        name, "BOOLEAN", false, (stmt, i, row) -> stmt.setBoolean(i, getter.apply(row)));
  }

  public static <R> Column<R> timestamp(String name, Function<R, Instant> getter) {
    return new Column<>(
        name,
        "TIMESTAMPTZ",
        false,
        (stmt, i, row) -> stmt.setTimestamp(i, DbUtil.toSqlTimestamp(getter.apply(row))));
  }

  public static <R> Column<R> nullableTimestamp(String name, Function<R, Instant> getter) {
    return new Column<>(
        name,
        "TIMESTAMPTZ",
        true,
        (stmt, i, row) -> {
          Instant value = getter.apply(row);
          if (value == null) {
            stmt.setNull(i, Types.TIMESTAMP);
          } else {
            stmt.setTimestamp(i, DbUtil.toSqlTimestamp(value));
          }
        });
  }

  @Nonnull
  public String quotedName() {
    return DbUtil.quote(name);
  }

  /** The column definition used in CREATE TABLE. */
  @Nonnull
  public String definition() {
    return nullable ? quotedName() + " " + sqlType : quotedName() + " " + sqlType + " NOT NULL";
  }
}
