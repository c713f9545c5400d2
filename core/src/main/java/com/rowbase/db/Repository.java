package com.rowbase.db;

import com.rowbase.common.status.Status;
import com.rowbase.common.status.StatusOr;
import java.sql.Connection;
import java.util.List;
import java.util.Optional;
import javax.annotation.Nonnull;

/**
 * Identifier-addressed CRUD over a single entity table.
 *
 * <p>Implementations hold no rows and no connection: every call runs on the connection passed in,
 * inside whatever transaction the caller has open. Failures are returned as statuses. A missing
 * row is reported as {@code NOT_FOUND} by the "existing" family of operations and as an empty
 * result by the others; backend failures keep the original {@link java.sql.SQLException} as
 * their cause.
 *
 * @param <I> the identifier type
 * @param <R> the row type
 */
public interface Repository<I, R extends BaseRow<I, R>> {

  /** Creates the table if it does not exist yet. */
  @Nonnull
  Status create(Connection conn);

  /** Drops the table. */
  @Nonnull
  Status drop(Connection conn);

  /**
   * Inserts a row without identifier, or updates the stored row with the same identifier.
   *
   * @return the new identifier on insert, the row's identifier on update; NOT_FOUND when updating
   *     an identifier with no stored row
   */
  @Nonnull
  StatusOr<I> save(Connection conn, R row);

  /**
   * Saves each row in order, atomically where the connection allows.
   *
   * @return the identifiers in the same order as the rows
   */
  @Nonnull
  StatusOr<List<I>> saveAll(Connection conn, List<R> rows);

  @Nonnull
  StatusOr<Optional<R>> findById(Connection conn, I id);

  /** Like {@link #findById}, but a missing row is NOT_FOUND. */
  @Nonnull
  StatusOr<R> findExistingById(Connection conn, I id);

  /** All rows, ordered by identifier. */
  @Nonnull
  StatusOr<List<R>> findAll(Connection conn);

  /** Rows for the given identifiers in the order requested; missing identifiers are skipped. */
  @Nonnull
  StatusOr<List<R>> findByIds(Connection conn, List<I> ids);

  /**
   * Inserts a copy of the stored row under a new identifier.
   *
   * @return the identifier of the copy; NOT_FOUND when the source row does not exist
   */
  @Nonnull
  StatusOr<I> copyAndSave(Connection conn, I id);

  /** @return the number of rows removed, 0 if there was none */
  @Nonnull
  StatusOr<Integer> deleteById(Connection conn, I id);

  /** @return the number of rows removed */
  @Nonnull
  StatusOr<Integer> deleteAll(Connection conn);

  @Nonnull
  StatusOr<Long> count(Connection conn);
}
