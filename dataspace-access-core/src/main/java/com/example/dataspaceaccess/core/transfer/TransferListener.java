package com.example.dataspaceaccess.core.transfer;

/** Receives byte counts while a download streams to disk. */
@FunctionalInterface
public interface TransferListener {

  /**
   * Called when the body starts streaming and after each chunk is written.
   *
   * @param transferred bytes in the part file so far
   * @param expected total size if the server announced one, otherwise -1
   */
  void onProgress(final long transferred, final long expected);

  static TransferListener none() {
    return (transferred, expected) -> {};
  }
}
