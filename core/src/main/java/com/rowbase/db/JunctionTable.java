package com.rowbase.db;

import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import com.rowbase.db.util.DbUtil;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * A many-to-many link table holding pairs of identifiers. The pair is the primary key.
 *
 * @param <A> identifier type of the first side
 * @param <B> identifier type of the second side
 */
public final class JunctionTable<A, B> {

  private final String name;
  private final IdColumn<A> first;
  private final IdColumn<B> second;
  @Nullable private final String firstReference;
  @Nullable private final String secondReference;

  private JunctionTable(
      String name,
      IdColumn<A> first,
      IdColumn<B> second,
      @Nullable String firstReference,
      @Nullable String secondReference) {
    Preconditions.checkArgument(!Strings.isNullOrEmpty(name), "Table name cannot be empty");
    Preconditions.checkArgument(!first.isGenerated(), "Column %s must not be generated", first.name());
    Preconditions.checkArgument(
        !second.isGenerated(), "Column %s must not be generated", second.name());
    Preconditions.checkArgument(
        !first.name().equals(second.name()), "Duplicate column %s in table %s", first.name(), name);
    this.name = name;
    this.first = first;
    this.second = second;
    this.firstReference = firstReference;
    this.secondReference = secondReference;
  }

  /** A link table without foreign keys. */
  public static <A, B> JunctionTable<A, B> of(String name, IdColumn<A> first, IdColumn<B> second) {
    return new JunctionTable<>(name, first, second, null, null);
  }

  /**
   * A link table between two entity tables. Both columns reference the entity identifiers and
   * links are removed together with the entities.
   */
  public static <A, B> JunctionTable<A, B> linking(
      String name,
      Table<A, ?> firstTable,
      String firstColumn,
      Table<B, ?> secondTable,
      String secondColumn) {
    return new JunctionTable<>(
        name,
        firstTable.idColumn().asReference(firstColumn),
        secondTable.idColumn().asReference(secondColumn),
        references(firstTable),
        references(secondTable));
  }

  private static String references(Table<?, ?> table) {
    return " REFERENCES " + table.quotedName()
        + " (" + table.idColumn().quotedName() + ") ON DELETE CASCADE";
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
  public IdColumn<A> first() {
    return first;
  }

  @Nonnull
  public IdColumn<B> second() {
    return second;
  }

  String createSql() {
    return "CREATE TABLE IF NOT EXISTS " + quotedName() + " ("
        + first.definition() + Strings.nullToEmpty(firstReference) + ", "
        + second.definition() + Strings.nullToEmpty(secondReference) + ", "
        + "PRIMARY KEY (" + first.quotedName() + ", " + second.quotedName() + "))";
  }

  String dropSql() {
    return "DROP TABLE " + quotedName();
  }

  String insertSql() {
    return "INSERT INTO " + quotedName() + " (" + first.quotedName() + ", " + second.quotedName()
        + ") VALUES (?, ?) ON CONFLICT DO NOTHING";
  }

  String existsSql() {
    return "SELECT 1 FROM " + quotedName() + " WHERE " + pairCondition();
  }

  String deleteSql() {
    return "DELETE FROM " + quotedName() + " WHERE " + pairCondition();
  }

  /** Selects {@code target} for all rows whose {@code key} column matches. */
  String selectSql(IdColumn<?> target, IdColumn<?> key) {
    return "SELECT " + target.quotedName() + " FROM " + quotedName()
        + " WHERE " + key.quotedName() + " = ? ORDER BY " + target.quotedName();
  }

  String deleteWhereSql(IdColumn<?> key) {
    return "DELETE FROM " + quotedName() + " WHERE " + key.quotedName() + " = ?";
  }

  private String pairCondition() {
    return first.quotedName() + " = ? AND " + second.quotedName() + " = ?";
  }
}
