package com.rowbase.db;

import com.google.common.base.Joiner;
import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import com.rowbase.common.status.StatusOr;
import com.rowbase.db.util.DbUtil;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import javax.annotation.Nonnull;

/**
 * Maps an entity table to its row type: the table name, the generated identifier column, the data
 * columns in the order they are written, and how to build a row from a query result.
 *
 * <p>A table for a simple user record looks like:
 *
 * <pre>
 * public final class UserTable extends Table&lt;Long, User&gt; {
 *   public UserTable() {
 *     super("users", IdColumn.bigSerial("id"), List.of(
 *         Column.text("email", User::email),
 *         Column.text("first_name", User::firstName),
 *         Column.text("last_name", User::lastName)));
 *   }
 *
 *   &#64;Override
 *   protected StatusOr&lt;User&gt; extractRow(ResultSet rs, Long id) throws SQLException {
 *     return StatusOr.ofValue(new User(Optional.of(id),
 *         rs.getString("email"), rs.getString("first_name"), rs.getString("last_name")));
 *   }
 * }
 * </pre>
 *
 * <p>The SQL for the table is generated once, from the mapping, by the repository using it.
 *
 * @param <I> the identifier type
 * @param <R> the row type
 */
public abstract class Table<I, R extends BaseRow<I, R>> {

  private static final Joiner COMMA_JOINER = Joiner.on(", ");

  private final String name;
  private final IdColumn<I> idColumn;
  private final ImmutableList<Column<R>> columns;

  protected Table(String name, IdColumn<I> idColumn, List<Column<R>> columns) {
    Preconditions.checkArgument(!Strings.isNullOrEmpty(name), "Table name cannot be empty");
    Preconditions.checkNotNull(idColumn, "Identifier column cannot be null");
    Preconditions.checkArgument(
        idColumn.isGenerated(), "Identifier column %s must be generated", idColumn.name());
    Preconditions.checkArgument(
        columns != null && !columns.isEmpty(), "Table %s needs at least one data column", name);

    Set<String> seen = new HashSet<>();
    seen.add(idColumn.name());
    for (Column<R> column : columns) {
      Preconditions.checkArgument(
          seen.add(column.name()), "Duplicate column %s in table %s", column.name(), name);
    }

    this.name = name;
    this.idColumn = idColumn;
    this.columns = ImmutableList.copyOf(columns);
  }

  /**
   * Builds a row from the current position of a result set. The result set contains every column
   * of the table; the identifier has already been read.
   */
  protected abstract StatusOr<R> extractRow(ResultSet rs, I id) throws SQLException;

  @Nonnull
  public String name() {
    return name;
  }

  @Nonnull
  public String quotedName() {
    return DbUtil.quote(name);
  }

  @Nonnull
  public IdColumn<I> idColumn() {
    return idColumn;
  }

  @Nonnull
  public ImmutableList<Column<R>> columns() {
    return columns;
  }

  /** Reads a full row, identifier included, from the current position of a result set. */
  StatusOr<R> read(ResultSet rs) throws SQLException {
    StatusOr<I> idOr = idColumn.extract(rs);
    if (idOr.isNotOk()) {
      return StatusOr.ofStatus(idOr.getStatus());
    }
    return extractRow(rs, idOr.getValue());
  }

  /**
   * Binds the data columns of a row to parameters 1..n of the statement.
   *
   * @return the index of the next free parameter
   */
  int bindColumns(PreparedStatement stmt, R row) throws SQLException {
    int index = 1;
    for (Column<R> column : columns) {
      column.binder().bind(stmt, index++, row);
    }
    return index;
  }

  String createSql() {
    StringBuilder sql = new StringBuilder("CREATE TABLE IF NOT EXISTS ")
        .append(quotedName())
        .append(" (")
        .append(idColumn.definition());
    for (Column<R> column : columns) {
      sql.append(", ").append(column.definition());
    }
    return sql.append(")").toString();
  }

  String dropSql() {
    return "DROP TABLE " + quotedName();
  }

  String selectSql() {
    return "SELECT " + idColumn.quotedName() + ", " + dataColumnList() + " FROM " + quotedName();
  }

  String selectAllSql() {
    return selectSql() + " ORDER BY " + idColumn.quotedName();
  }

  String selectByIdSql() {
    return selectSql() + " WHERE " + idColumn.quotedName() + " = ?";
  }

  String selectByIdsSql(int count) {
    return selectSql() + " WHERE " + idColumn.quotedName()
        + " IN (" + DbUtil.placeholders(count) + ")";
  }

  String insertSql() {
    return "INSERT INTO " + quotedName() + " (" + dataColumnList() + ")"
        + " VALUES (" + DbUtil.placeholders(columns.size()) + ")"
        + " RETURNING " + idColumn.quotedName();
  }

  String updateSql() {
    List<String> assignments = columns.stream()
        .map(column -> column.quotedName() + " = ?")
        .toList();
    return "UPDATE " + quotedName() + " SET " + COMMA_JOINER.join(assignments)
        + " WHERE " + idColumn.quotedName() + " = ?";
  }

  String deleteByIdSql() {
    return "DELETE FROM " + quotedName() + " WHERE " + idColumn.quotedName() + " = ?";
  }

  String deleteAllSql() {
    return "DELETE FROM " + quotedName();
  }

  String countSql() {
    return "SELECT COUNT(*) FROM " + quotedName();
  }

  private String dataColumnList() {
    return COMMA_JOINER.join(columns.stream().map(Column::quotedName).iterator());
  }
}
