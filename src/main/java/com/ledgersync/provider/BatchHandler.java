package com.ledgersync.provider;

/**
 * Consumes each batch as soon as it is fetched. Throwing aborts the fetch loop; no further rounds
 * are requested.
 */
@FunctionalInterface
public interface BatchHandler {
  void handle(SyncBatch batch);
}
