package com.ledgersync.service;

/** Running sums over the batches of one sync run. */
public class SyncTotals {
  private int upserted;
  private int promoted;
  private int removed;
  private int skipped;
  private int batches;

  void add(ReconcileResult result) {
    upserted += result.upserted();
    promoted += result.promoted();
    removed += result.removed();
    skipped += result.skippedInvalid() + result.skippedUnmapped();
    batches++;
  }

  public int upserted() {
    return upserted;
  }

  public int promoted() {
    return promoted;
  }

  public int removed() {
    return removed;
  }

  public int skipped() {
    return skipped;
  }

  public int batches() {
    return batches;
  }
}
