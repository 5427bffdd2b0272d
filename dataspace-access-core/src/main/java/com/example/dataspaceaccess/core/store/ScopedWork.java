package com.example.dataspaceaccess.core.store;

/**
 * Body executed by {@link UnitOfWorkManager#runScoped(ScopedWork)} against the unit of work bound
 * to the calling thread.
 *
 * @param <T> result type
 * @param <E> checked exception the body may raise
 */
@FunctionalInterface
public interface ScopedWork<T, E extends Exception> {

  /**
   * Executes the body.
   *
   * @param unitOfWork the unit of work bound to the calling thread
   * @return body result
   * @throws E when the body fails; the scope rolls back and rethrows it unchanged
   */
  T execute(final UnitOfWork unitOfWork) throws E;
}
