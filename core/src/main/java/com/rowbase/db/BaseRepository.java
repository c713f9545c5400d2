package com.rowbase.db;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Iterables;
import com.rowbase.common.status.Status;
import com.rowbase.common.status.StatusOr;
import com.rowbase.db.util.Transactions;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import javax.annotation.Nonnull;
import org.tinylog.Logger;

/**
 * {@link Repository} implementation generating plain SQL from a {@link Table} mapping.
 *
 * <p>Concrete repositories usually just bind the table:
 *
 * <pre>
 * public final class UsersRepository extends BaseRepository&lt;Long, User&gt; {
 *   public UsersRepository() {
 *     super(new UserTable());
 *   }
 * }
 * </pre>
 *
 * <p>Instances are immutable and can be shared between threads as long as each thread uses its
 * own connection.
 *
 * @param <I> the identifier type
 * @param <R> the row type
 */
public class BaseRepository<I, R extends BaseRow<I, R>> implements Repository<I, R> {

  /** Upper bound on identifiers sent in a single IN list. */
  static final int MAX_IDS_PER_QUERY = 1000;

  private final Table<I, R> table;

  private final String createSql;
  private final String dropSql;
  private final String selectAllSql;
  private final String selectByIdSql;
  private final String insertSql;
  private final String updateSql;
  private final String deleteByIdSql;
  private final String deleteAllSql;
  private final String countSql;

  public BaseRepository(Table<I, R> table) {
    this.table = Preconditions.checkNotNull(table, "Table cannot be null");
    this.createSql = table.createSql();
    this.dropSql = table.dropSql();
    this.selectAllSql = table.selectAllSql();
    this.selectByIdSql = table.selectByIdSql();
    this.insertSql = table.insertSql();
    this.updateSql = table.updateSql();
    this.deleteByIdSql = table.deleteByIdSql();
    this.deleteAllSql = table.deleteAllSql();
    this.countSql = table.countSql();
  }

  @Nonnull
  public Table<I, R> table() {
    return table;
  }

  @Nonnull
  @Override
  public Status create(Connection conn) {
    Logger.debug("Creating table {}", table.name());
    return execute(conn, createSql);
  }

  @Nonnull
  @Override
  public Status drop(Connection conn) {
    Logger.debug("Dropping table {}", table.name());
    return execute(conn, dropSql);
  }

  @Nonnull
  @Override
  public StatusOr<I> save(Connection conn, R row) {
    Preconditions.checkNotNull(row, "Row cannot be null");
    Optional<I> id = row.id();
    if (id.isPresent()) {
      return update(conn, row, id.get());
    }
    return insert(conn, row);
  }

  @Nonnull
  @Override
  public StatusOr<List<I>> saveAll(Connection conn, List<R> rows) {
    Preconditions.checkNotNull(rows, "Rows cannot be null");
    if (rows.isEmpty()) {
      return StatusOr.ofValue(ImmutableList.of());
    }
    Logger.debug("Saving {} rows into {}", rows.size(), table.name());
    return Transactions.inTransaction(conn, c -> {
      List<I> ids = new ArrayList<>(rows.size());
      for (R row : rows) {
        StatusOr<I> idOr = save(c, row);
        if (idOr.isNotOk()) {
          return StatusOr.ofStatus(idOr.getStatus());
        }
        ids.add(idOr.getValue());
      }
      return StatusOr.ofValue(ImmutableList.copyOf(ids));
    });
  }

  @Nonnull
  @Override
  public StatusOr<Optional<R>> findById(Connection conn, I id) {
    Preconditions.checkNotNull(id, "Identifier cannot be null");
    try (PreparedStatement stmt = conn.prepareStatement(selectByIdSql)) {
      table.idColumn().bind(stmt, 1, id);
      try (ResultSet rs = stmt.executeQuery()) {
        if (rs.next()) {
          return table.read(rs).map(Optional::of);
        }
        return StatusOr.ofValue(Optional.empty());
      }
    } catch (SQLException e) {
      return StatusOr.ofException(e);
    }
  }

  @Nonnull
  @Override
  public StatusOr<R> findExistingById(Connection conn, I id) {
    return findById(conn, id)
        .flatMap(rowOpt -> StatusOr.fromOptional(rowOpt, notFoundMessage(id)));
  }

  @Nonnull
  @Override
  public StatusOr<List<R>> findAll(Connection conn) {
    try (PreparedStatement stmt = conn.prepareStatement(selectAllSql);
         ResultSet rs = stmt.executeQuery()) {
      List<R> result = new ArrayList<>();
      while (rs.next()) {
        StatusOr<R> rowOr = table.read(rs);
        if (rowOr.isNotOk()) {
          return StatusOr.ofStatus(rowOr.getStatus());
        }
        result.add(rowOr.getValue());
      }
      return StatusOr.ofValue(ImmutableList.copyOf(result));
    } catch (SQLException e) {
      return StatusOr.ofException(e);
    }
  }

  @Nonnull
  @Override
  public StatusOr<List<R>> findByIds(Connection conn, List<I> ids) {
    Preconditions.checkNotNull(ids, "Identifiers cannot be null");
    if (ids.isEmpty()) {
      return StatusOr.ofValue(ImmutableList.of());
    }

    Map<I, R> byId = new HashMap<>();
    for (List<I> chunk : Iterables.partition(ImmutableSet.copyOf(ids), MAX_IDS_PER_QUERY)) {
      try (PreparedStatement stmt = conn.prepareStatement(table.selectByIdsSql(chunk.size()))) {
        for (int i = 0; i < chunk.size(); i++) {
          table.idColumn().bind(stmt, i + 1, chunk.get(i));
        }
        try (ResultSet rs = stmt.executeQuery()) {
          while (rs.next()) {
            StatusOr<I> idOr = table.idColumn().extract(rs);
            if (idOr.isNotOk()) {
              return StatusOr.ofStatus(idOr.getStatus());
            }
            StatusOr<R> rowOr = table.extractRow(rs, idOr.getValue());
            if (rowOr.isNotOk()) {
              return StatusOr.ofStatus(rowOr.getStatus());
            }
            byId.put(idOr.getValue(), rowOr.getValue());
          }
        }
      } catch (SQLException e) {
        return StatusOr.ofException(e);
      }
    }

    ImmutableList.Builder<R> result = ImmutableList.builder();
    for (I id : ids) {
      R row = byId.get(id);
      if (row != null) {
        result.add(row);
      }
    }
    return StatusOr.ofValue(result.build());
  }

  @Nonnull
  @Override
  public StatusOr<I> copyAndSave(Connection conn, I id) {
    return findExistingById(conn, id).flatMap(row -> insert(conn, row.withId(Optional.empty())));
  }

  @Nonnull
  @Override
  public StatusOr<Integer> deleteById(Connection conn, I id) {
    Preconditions.checkNotNull(id, "Identifier cannot be null");
    try (PreparedStatement stmt = conn.prepareStatement(deleteByIdSql)) {
      table.idColumn().bind(stmt, 1, id);
      int rowsAffected = stmt.executeUpdate();
      return StatusOr.ofValue(rowsAffected);
    } catch (SQLException e) {
      return StatusOr.ofException(e);
    }
  }

  @Nonnull
  @Override
  public StatusOr<Integer> deleteAll(Connection conn) {
    try (PreparedStatement stmt = conn.prepareStatement(deleteAllSql)) {
      int rowsAffected = stmt.executeUpdate();
      Logger.debug("Deleted {} rows from {}", rowsAffected, table.name());
      return StatusOr.ofValue(rowsAffected);
    } catch (SQLException e) {
      return StatusOr.ofException(e);
    }
  }

  @Nonnull
  @Override
  public StatusOr<Long> count(Connection conn) {
    try (PreparedStatement stmt = conn.prepareStatement(countSql);
         ResultSet rs = stmt.executeQuery()) {
      if (!rs.next()) {
        return StatusOr.ofStatus(Status.internal("Count query returned no rows", null));
      }
      return StatusOr.ofValue(rs.getLong(1));
    } catch (SQLException e) {
      return StatusOr.ofException(e);
    }
  }

  private StatusOr<I> insert(Connection conn, R row) {
    try (PreparedStatement stmt = conn.prepareStatement(insertSql)) {
      table.bindColumns(stmt, row);
      try (ResultSet rs = stmt.executeQuery()) {
        if (!rs.next()) {
          return StatusOr.ofStatus(
              Status.internal("Insert into " + table.name() + " returned no identifier", null));
        }
        return table.idColumn().extract(rs);
      }
    } catch (SQLException e) {
      return StatusOr.ofException(e);
    }
  }

  private StatusOr<I> update(Connection conn, R row, I id) {
    try (PreparedStatement stmt = conn.prepareStatement(updateSql)) {
      int idIndex = table.bindColumns(stmt, row);
      table.idColumn().bind(stmt, idIndex, id);
      int rowsAffected = stmt.executeUpdate();
      if (rowsAffected == 0) {
        Logger.warn("Update of {} matched no row for id {}", table.name(), id);
        return StatusOr.ofStatus(Status.notFound(notFoundMessage(id)));
      }
      return StatusOr.ofValue(id);
    } catch (SQLException e) {
      return StatusOr.ofException(e);
    }
  }

  private Status execute(Connection conn, String sql) {
    try (PreparedStatement stmt = conn.prepareStatement(sql)) {
      stmt.execute();
      return Status.ok();
    } catch (SQLException e) {
      return Status.fromSqlException(e);
    }
  }

  private String notFoundMessage(I id) {
    return "No row in " + table.name() + " with id " + id;
  }
}
