package com.example.dataspaceaccess.core.store;

import static java.lang.System.Logger.Level.DEBUG;
import static java.lang.System.Logger.Level.INFO;
import static java.lang.System.Logger.Level.WARNING;

import java.lang.System.Logger;
import java.sql.SQLException;
import java.util.Objects;
import java.util.Optional;
import javax.sql.DataSource;

/**
 * Gatekeeper to the backing store that binds at most one {@link UnitOfWork} to each thread.
 *
 * <h2>Scoped usage</h2>
 *
 * <pre>{@code
 * var manager = new UnitOfWorkManager(hikariDataSource);
 *
 * long id = manager.runScoped(uow -> repository.insert(uow, record));
 * }</pre>
 *
 * <p>{@link #runScoped(ScopedWork)} commits when the body completes, rolls back when it throws and
 * always closes and unbinds the unit of work. A scope entered while another is active on the same
 * thread joins it: only the outermost scope commits, rolls back and closes.
 *
 * <h2>Ad-hoc usage</h2>
 *
 * <pre>{@code
 * var uow = manager.acquire();
 * try (var st = uow.connection().createStatement()) {
 *     st.executeUpdate("DELETE FROM credential_token WHERE is_revoked");
 * }
 * manager.commit();
 * manager.close();
 * }</pre>
 */
public final class UnitOfWorkManager {

  private static final Logger logger = System.getLogger(UnitOfWorkManager.class.getName());

  private final DataSource dataSource;
  private final ThreadLocal<UnitOfWork> bound = new ThreadLocal<>();

  /**
   * Creates a manager over the given data source, typically a connection pool.
   *
   * @param dataSource backing store; the only connection source used by this library
   */
  public UnitOfWorkManager(final DataSource dataSource) {
    this.dataSource = Objects.requireNonNull(dataSource, "dataSource");
  }

  /**
   * Returns the unit of work bound to the calling thread, opening and binding one if needed.
   *
   * @return live unit of work owned by the calling thread
   * @throws StoreUnavailableException if no connection can be obtained
   */
  public UnitOfWork acquire() {
    return current()
        .orElseGet(
            () -> {
              final var unitOfWork = open();
              bound.set(unitOfWork);
              return unitOfWork;
            });
  }

  /**
   * Returns the live unit of work bound to the calling thread without opening one.
   *
   * @return bound unit of work, or empty
   */
  public Optional<UnitOfWork> current() {
    return Optional.ofNullable(bound.get()).filter(uow -> !uow.isClosed());
  }

  /**
   * Runs {@code work} inside a transactional scope.
   *
   * <p>When the calling thread has no live unit of work, a new one is opened and bound for the
   * duration of the call. It is committed if {@code work} returns normally, rolled back if it
   * throws (the original exception is rethrown unchanged), and closed and unbound in every case.
   *
   * <p>When a live unit of work is already bound, {@code work} runs on it and the enclosing owner
   * stays responsible for commit, rollback and close.
   *
   * @param work body to execute
   * @param <T> result type
   * @param <E> checked exception raised by the body
   * @return the body's result
   * @throws E when the body fails
   * @throws StoreException if the commit fails (the scope still rolls back and closes)
   * @throws StoreUnavailableException if no connection can be obtained
   */
  public <T, E extends Exception> T runScoped(final ScopedWork<T, E> work) throws E {
    final var joined = current();
    if (joined.isPresent()) {
      logger.log(DEBUG, "Joining unit of work already bound to {0}", joined.get().owner());
      return work.execute(joined.get());
    }

    final var previous = bound.get();
    final var unitOfWork = open();
    bound.set(unitOfWork);
    try {
      final var result = work.execute(unitOfWork);
      unitOfWork.commit();
      return result;
    } catch (final RuntimeException | Error e) {
      rollbackAfterFailure(unitOfWork);
      throw e;
    } catch (final Exception e) {
      rollbackAfterFailure(unitOfWork);
      @SuppressWarnings("unchecked")
      final E typedException = (E) e;
      throw typedException;
    } finally {
      try {
        unitOfWork.close();
      } finally {
        if (previous == null) bound.remove();
        else bound.set(previous);
      }
    }
  }

  /**
   * Commits the unit of work bound to the calling thread.
   *
   * @throws StoreException if the store rejects the commit
   */
  public void commit() {
    acquire().commit();
  }

  /**
   * Rolls back the unit of work bound to the calling thread.
   *
   * @throws StoreException if the rollback fails
   */
  public void rollback() {
    acquire().rollback();
  }

  /** Closes and unbinds the unit of work bound to the calling thread. Safe to call repeatedly. */
  public void close() {
    final var unitOfWork = bound.get();
    if (unitOfWork == null) return;

    try {
      unitOfWork.close();
    } finally {
      bound.remove();
    }
  }

  /**
   * Checks whether the store answers a trivial query.
   *
   * @return true if {@code SELECT 1} succeeds
   */
  public boolean ping() {
    try (final var conn = dataSource.getConnection();
        final var st = conn.createStatement();
        final var rs = st.executeQuery("SELECT 1")) {
      return rs.next();
    } catch (final SQLException e) {
      logger.log(DEBUG, "Store ping failed: {0}", e.getMessage());
      return false;
    }
  }

  /**
   * Verifies the store is reachable.
   *
   * @throws StoreUnavailableException if {@link #ping()} fails
   */
  public void ensureConnection() {
    if (!ping()) throw new StoreUnavailableException("Store connection check failed", null);
  }

  /** Closes the underlying data source when it supports closing (connection pools do). */
  public void shutdown() {
    if (dataSource instanceof AutoCloseable ac) {
      try {
        ac.close();
        logger.log(INFO, "Closed store data source");
      } catch (final Exception e) {
        logger.log(WARNING, "Failed to close data source", e);
      }
    }
  }

  private UnitOfWork open() {
    try {
      final var conn = dataSource.getConnection();
      try {
        conn.setAutoCommit(false);
      } catch (final SQLException e) {
        conn.close();
        throw e;
      }
      logger.log(DEBUG, "Opened unit of work for {0}", Thread.currentThread().getName());
      return new UnitOfWork(conn, Thread.currentThread());
    } catch (final SQLException e) {
      throw new StoreUnavailableException("Backing store is unavailable", e);
    }
  }

  private void rollbackAfterFailure(final UnitOfWork unitOfWork) {
    try {
      unitOfWork.rollback();
    } catch (final StoreException e) {
      logger.log(WARNING, "Rollback after failed scope did not complete", e);
    }
  }
}
