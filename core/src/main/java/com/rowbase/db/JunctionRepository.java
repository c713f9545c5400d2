package com.rowbase.db;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.rowbase.common.status.Status;
import com.rowbase.common.status.StatusOr;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import javax.annotation.Nonnull;
import org.tinylog.Logger;

/**
 * Operations on a {@link JunctionTable}: linking, unlinking and following links in either
 * direction.
 *
 * @param <A> identifier type of the first side
 * @param <B> identifier type of the second side
 */
public class JunctionRepository<A, B> {

  private final JunctionTable<A, B> table;

  public JunctionRepository(JunctionTable<A, B> table) {
    this.table = Preconditions.checkNotNull(table, "Table cannot be null");
  }

  @Nonnull
  public JunctionTable<A, B> table() {
    return table;
  }

  @Nonnull
  public Status create(Connection conn) {
    Logger.debug("Creating junction table {}", table.name());
    try (PreparedStatement stmt = conn.prepareStatement(table.createSql())) {
      stmt.execute();
      return Status.ok();
    } catch (SQLException e) {
      return Status.fromSqlException(e);
    }
  }

  @Nonnull
  public Status drop(Connection conn) {
    Logger.debug("Dropping junction table {}", table.name());
    try (PreparedStatement stmt = conn.prepareStatement(table.dropSql())) {
      stmt.execute();
      return Status.ok();
    } catch (SQLException e) {
      return Status.fromSqlException(e);
    }
  }

  /**
   * Links {@code a} and {@code b}. Linking an already linked pair is a no-op.
   *
   * @return the number of rows inserted, 0 when the link already existed
   */
  @Nonnull
  public StatusOr<Integer> save(Connection conn, A a, B b) {
    return updatePair(conn, table.insertSql(), a, b);
  }

  @Nonnull
  public StatusOr<Boolean> exists(Connection conn, A a, B b) {
    try (PreparedStatement stmt = conn.prepareStatement(table.existsSql())) {
      bindPair(stmt, a, b);
      try (ResultSet rs = stmt.executeQuery()) {
        return StatusOr.ofValue(rs.next());
      }
    } catch (SQLException e) {
      return StatusOr.ofException(e);
    }
  }

  /** All second-side identifiers linked to {@code a}, ascending. */
  @Nonnull
  public StatusOr<List<B>> forA(Connection conn, A a) {
    return select(conn, table.second(), table.first(), a);
  }

  /** All first-side identifiers linked to {@code b}, ascending. */
  @Nonnull
  public StatusOr<List<A>> forB(Connection conn, B b) {
    return select(conn, table.first(), table.second(), b);
  }

  /** @return the number of rows removed, 0 when the pair was not linked */
  @Nonnull
  public StatusOr<Integer> delete(Connection conn, A a, B b) {
    return updatePair(conn, table.deleteSql(), a, b);
  }

  /** Removes every link of {@code a}. */
  @Nonnull
  public StatusOr<Integer> deleteForA(Connection conn, A a) {
    return deleteWhere(conn, table.first(), a);
  }

  /** Removes every link of {@code b}. */
  @Nonnull
  public StatusOr<Integer> deleteForB(Connection conn, B b) {
    return deleteWhere(conn, table.second(), b);
  }

  private StatusOr<Integer> updatePair(Connection conn, String sql, A a, B b) {
    try (PreparedStatement stmt = conn.prepareStatement(sql)) {
      bindPair(stmt, a, b);
      return StatusOr.ofValue(stmt.executeUpdate());
    } catch (SQLException e) {
      return StatusOr.ofException(e);
    }
  }

  private void bindPair(PreparedStatement stmt, A a, B b) throws SQLException {
    table.first().bind(stmt, 1, a);
    table.second().bind(stmt, 2, b);
  }

  private <T, K> StatusOr<List<T>> select(
      Connection conn, IdColumn<T> target, IdColumn<K> key, K value) {
    try (PreparedStatement stmt = conn.prepareStatement(table.selectSql(target, key))) {
      key.bind(stmt, 1, value);
      try (ResultSet rs = stmt.executeQuery()) {
        List<T> result = new ArrayList<>();
        while (rs.next()) {
          StatusOr<T> idOr = target.extract(rs);
          if (idOr.isNotOk()) {
            return StatusOr.ofStatus(idOr.getStatus());
          }
          result.add(idOr.getValue());
        }
        return StatusOr.ofValue(ImmutableList.copyOf(result));
      }
    } catch (SQLException e) {
      return StatusOr.ofException(e);
    }
  }

  private <K> StatusOr<Integer> deleteWhere(Connection conn, IdColumn<K> key, K value) {
    try (PreparedStatement stmt = conn.prepareStatement(table.deleteWhereSql(key))) {
      key.bind(stmt, 1, value);
      return StatusOr.ofValue(stmt.executeUpdate());
    } catch (SQLException e) {
      return StatusOr.ofException(e);
    }
  }
}
