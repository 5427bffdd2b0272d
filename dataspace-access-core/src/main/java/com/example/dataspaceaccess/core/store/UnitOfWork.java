package com.example.dataspaceaccess.core.store;

import static java.lang.System.Logger.Level.DEBUG;
import static java.lang.System.Logger.Level.WARNING;

import java.lang.System.Logger;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One logical transaction against the backing store.
 *
 * <p>Wraps a JDBC {@link Connection} with auto-commit disabled. A unit of work belongs to the thread
 * that opened it: handing it to another thread and using it there fails with {@link
 * IllegalStateException}. Obtain instances through {@link UnitOfWorkManager}.
 */
public final class UnitOfWork implements AutoCloseable {

  private static final Logger logger = System.getLogger(UnitOfWork.class.getName());

  private final Connection connection;
  private final Thread owner;
  private final AtomicBoolean closed = new AtomicBoolean(false);

  UnitOfWork(final Connection connection, final Thread owner) {
    this.connection = connection;
    this.owner = owner;
  }

  /**
   * Returns the underlying connection for issuing statements.
   *
   * @return open JDBC connection
   * @throws IllegalStateException if closed or called from a thread other than the owner
   */
  public Connection connection() {
    checkUsable();
    return connection;
  }

  /**
   * Name of the thread that owns this unit of work.
   *
   * @return owner thread name
   */
  public String owner() {
    return owner.getName();
  }

  /**
   * Commits pending changes.
   *
   * @throws StoreException if the store rejects the commit
   */
  public void commit() {
    checkUsable();
    try {
      connection.commit();
    } catch (final SQLException e) {
      throw new StoreException("Commit failed", e);
    }
  }

  /**
   * Discards pending changes.
   *
   * @throws StoreException if the rollback cannot be performed
   */
  public void rollback() {
    checkUsable();
    try {
      connection.rollback();
    } catch (final SQLException e) {
      throw new StoreException("Rollback failed", e);
    }
  }

  public boolean isClosed() {
    return closed.get();
  }

  /** Rolls back anything not committed and releases the connection. Repeated calls do nothing. */
  @Override
  public void close() {
    if (!closed.compareAndSet(false, true)) return;

    try {
      connection.rollback();
    } catch (final SQLException e) {
      logger.log(WARNING, "Rollback on close failed for unit of work owned by {0}", owner());
    }
    try {
      connection.close();
      logger.log(DEBUG, "Closed unit of work owned by {0}", owner());
    } catch (final SQLException e) {
      logger.log(WARNING, "Failed to close connection", e);
    }
  }

  private void checkUsable() {
    if (closed.get()) throw new IllegalStateException("Unit of work is closed");
    if (Thread.currentThread() != owner)
      throw new IllegalStateException(
          "Unit of work owned by " + owner() + " used from " + Thread.currentThread().getName());
  }
}
