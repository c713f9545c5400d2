package com.rowbase.db.util;

import com.rowbase.common.status.StatusOr;
import java.sql.Connection;
import java.sql.SQLException;
import javax.annotation.Nonnull;
import org.tinylog.Logger;

/**
 * Runs a unit of work atomically on a JDBC connection.
 *
 * <p>When the connection is in auto-commit mode the work gets its own transaction: it is committed
 * if the work returns an OK result and rolled back otherwise, and auto-commit is restored
 * afterwards. When the caller already has a transaction open, the work simply joins it and the
 * caller decides whether to commit. A runtime exception thrown by the work rolls the transaction
 * back and is rethrown.
 */
public final class Transactions {

  private Transactions() {
    // Utility class, no instances
  }

  /** A piece of database work that reports its own failures through StatusOr. */
  @FunctionalInterface
  public interface Work<T> {
    StatusOr<T> run(Connection conn) throws SQLException;
  }

  @Nonnull
  public static <T> StatusOr<T> inTransaction(Connection conn, Work<T> work) {
    boolean ownsTransaction;
    try {
      ownsTransaction = conn.getAutoCommit();
      if (!ownsTransaction) {
        return work.run(conn);
      }
      conn.setAutoCommit(false);
    } catch (SQLException e) {
      return StatusOr.ofException(e);
    }

    StatusOr<T> result;
    try {
      result = work.run(conn);
      if (result.isOk()) {
        conn.commit();
      } else {
        Logger.warn("Rolling back transaction: {}", result.getStatus());
        conn.rollback();
      }
    } catch (SQLException e) {
      result = StatusOr.ofException(e);
      rollbackQuietly(conn, e);
    } catch (RuntimeException e) {
      // Restoring auto-commit would commit the partial work
      rollbackQuietly(conn, e);
      throw e;
    } finally {
      restoreAutoCommit(conn);
    }
    return result;
  }

  private static void rollbackQuietly(Connection conn, Exception original) {
    try {
      conn.rollback();
    } catch (SQLException e) {
      original.addSuppressed(e);
      Logger.error(e, "Rollback failed: {}", e.getMessage());
    }
  }

  private static void restoreAutoCommit(Connection conn) {
    try {
      conn.setAutoCommit(true);
    } catch (SQLException e) {
      Logger.error(e, "Failed to restore auto-commit: {}", e.getMessage());
    }
  }
}
