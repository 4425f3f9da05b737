package com.ledgersync.service;

import com.ledgersync.model.FetchMode;
import java.util.UUID;

/**
 * Result of one sync run. Failures are reported here rather than thrown; {@code code} is null on
 * success.
 */
public record SyncOutcome(
    UUID connectionId,
    boolean success,
    SyncErrorCode code,
    String error,
    FetchMode mode,
    int transactionsSynced,
    int pendingTransactionsUpdated,
    int transactionsRemoved,
    int accountsUpdated,
    String cursor
) {
  public static SyncOutcome success(UUID connectionId, FetchMode mode, SyncTotals totals,
                                    int accountsUpdated, String cursor) {
    return new SyncOutcome(connectionId, true, null, null, mode, totals.upserted(), totals.promoted(),
        totals.removed(), accountsUpdated, cursor);
  }

  public static SyncOutcome failure(UUID connectionId, SyncErrorCode code, String error) {
    return new SyncOutcome(connectionId, false, code, error, null, 0, 0, 0, 0, null);
  }
}
