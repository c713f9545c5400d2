package com.rowbase.db;

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;
import com.rowbase.common.status.Status;
import com.rowbase.common.status.StatusOr;
import com.rowbase.db.util.DbUtil;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.function.Function;
import javax.annotation.Nonnull;

/**
 * An identifier column: either the generated primary key of an entity table, or a plain
 * {@code NOT NULL} column holding another table's identifier (as used by junction tables).
 *
 * <p>Typed identifiers are derived with {@link #map}:
 *
 * <pre>
 * IdColumn&lt;UserId&gt; id = IdColumn.bigSerial("id").map(UserId::new, UserId::value);
 * </pre>
 *
 * @param <I> the Java type of the identifier
 */
public final class IdColumn<I> {

  /** Writes an identifier into a statement parameter. */
  @FunctionalInterface
  public interface Binder<I> {
    void bind(PreparedStatement stmt, int index, I value) throws SQLException;
  }

  /** Reads an identifier from a result set column, returning null for SQL NULL. */
  @FunctionalInterface
  public interface Reader<I> {
    I read(ResultSet rs, String columnName) throws SQLException;
  }

  private final String name;
  private final String sqlType;
  private final boolean generated;
  private final Binder<I> binder;
  private final Reader<I> reader;

  private IdColumn(
      String name, String sqlType, boolean generated, Binder<I> binder, Reader<I> reader) {
    Preconditions.checkArgument(name != null && !name.isEmpty(), "Column name cannot be empty");
    this.name = name;
    this.sqlType = Preconditions.checkNotNull(sqlType);
    this.generated = generated;
    this.binder = Preconditions.checkNotNull(binder);
    this.reader = Preconditions.checkNotNull(reader);
  }

  /** A {@code BIGINT} identity primary key. */
  public static IdColumn<Long> bigSerial(String name) {
    return new IdColumn<>(name, "BIGINT", true, IdColumn::bindLong, IdColumn::readLong);
  }

  /** An {@code INTEGER} identity primary key. */
  public static IdColumn<Integer> serial(String name) {
    return new IdColumn<>(name, "INTEGER", true, IdColumn::bindInt, IdColumn::readInt);
  }

  /** A {@code BIGINT NOT NULL} column referencing another table's identifier. */
  public static IdColumn<Long> bigint(String name) {
    return new IdColumn<>(name, "BIGINT", false, IdColumn::bindLong, IdColumn::readLong);
  }

  /** An {@code INTEGER NOT NULL} column referencing another table's identifier. */
  public static IdColumn<Integer> integer(String name) {
    return new IdColumn<>(name, "INTEGER", false, IdColumn::bindInt, IdColumn::readInt);
  }

  /**
   * Returns a column with the same storage whose Java values are converted with the given
   * functions.
   */
  public <J> IdColumn<J> map(Function<I, J> wrap, Function<J, I> unwrap) {
    Preconditions.checkNotNull(wrap);
    Preconditions.checkNotNull(unwrap);
    return new IdColumn<>(
        name,
        sqlType,
        generated,
        (stmt, index, value) -> binder.bind(stmt, index, unwrap.apply(value)),
        (rs, columnName) -> {
          I raw = reader.read(rs, columnName);
          return raw == null ? null : wrap.apply(raw);
        });
  }

  /**
   * Returns a non-generated column of the same type and conversions under another name, for
   * referencing this identifier from another table.
   */
  public IdColumn<I> asReference(String referenceName) {
    return new IdColumn<>(referenceName, sqlType, false, binder, reader);
  }

  @Nonnull
  public String name() {
    return name;
  }

  @Nonnull
  public String quotedName() {
    return DbUtil.quote(name);
  }

  @Nonnull
  public String sqlType() {
    return sqlType;
  }

  /** True for identity columns whose values are assigned by the database. */
  public boolean isGenerated() {
    return generated;
  }

  /** The column definition used in CREATE TABLE. */
  @Nonnull
  public String definition() {
    if (generated) {
      return quotedName() + " " + sqlType + " GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY";
    }
    return quotedName() + " " + sqlType + " NOT NULL";
  }

  public void bind(PreparedStatement stmt, int index, I value) throws SQLException {
    Preconditions.checkNotNull(value, "Identifier cannot be null");
    binder.bind(stmt, index, value);
  }

  /** Reads this column from the current row of a ResultSet. */
  @Nonnull
  public StatusOr<I> extract(ResultSet rs) {
    return extract(rs, name);
  }

  /** Reads a value of this column's type from the given result column. */
  @Nonnull
  public StatusOr<I> extract(ResultSet rs, String columnName) {
    try {
      I value = reader.read(rs, columnName);
      if (value == null) {
        return StatusOr.ofStatus(Status.invalidArgument("Column " + columnName + " is null"));
      }
      return StatusOr.ofValue(value);
    } catch (SQLException e) {
      return StatusOr.ofException(e);
    }
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("name", name)
        .add("sqlType", sqlType)
        .add("generated", generated)
        .toString();
  }

  private static void bindLong(PreparedStatement stmt, int index, Long value) throws SQLException {
    stmt.setLong(index, value);
  }

  private static Long readLong(ResultSet rs, String columnName) throws SQLException {
    long value = rs.getLong(columnName);
    return rs.wasNull() ? null : value;
  }

  private static void bindInt(PreparedStatement stmt, int index, Integer value)
      throws SQLException {
    stmt.setInt(index, value);
  }

  private static Integer readInt(ResultSet rs, String columnName) throws SQLException {
    int value = rs.getInt(columnName);
    return rs.wasNull() ? null : value;
  }
}
