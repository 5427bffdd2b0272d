package com.example.dataspaceaccess.core.transfer;

import static java.lang.System.Logger.Level.DEBUG;

import java.io.IOException;
import java.io.InputStream;
import java.lang.System.Logger;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Lets another thread abort a running download.
 *
 * <p>{@link #abort()} closes the response stream currently being read and wakes a download waiting
 * between retries. The download then fails with {@link TransferFailedException} without drawing on
 * its retry budget.
 */
public final class TransferControl {

  private static final Logger logger = System.getLogger(TransferControl.class.getName());

  private final AtomicBoolean aborted = new AtomicBoolean(false);
  private final AtomicReference<InputStream> body = new AtomicReference<>();
  private final CountDownLatch abortSignal = new CountDownLatch(1);

  /** Aborts the download. Safe to call from any thread and more than once. */
  public void abort() {
    if (!aborted.compareAndSet(false, true)) return;
    abortSignal.countDown();
    closeQuietly(body.getAndSet(null));
  }

  public boolean isAborted() {
    return aborted.get();
  }

  /**
   * Waits up to {@code duration}, returning early once the download is aborted.
   *
   * @param duration longest wait
   * @return true if the download was aborted
   * @throws InterruptedException if the waiting thread is interrupted
   */
  public boolean await(final Duration duration) throws InterruptedException {
    return abortSignal.await(duration.toMillis(), TimeUnit.MILLISECONDS);
  }

  void attach(final InputStream in) {
    body.set(in);
    if (aborted.get()) closeQuietly(body.getAndSet(null));
  }

  void detach(final InputStream in) {
    body.compareAndSet(in, null);
  }

  private static void closeQuietly(final InputStream in) {
    if (in == null) return;
    try {
      in.close();
    } catch (final IOException e) {
      logger.log(DEBUG, "Closing aborted response stream failed: {0}", e.getMessage());
    }
  }
}
