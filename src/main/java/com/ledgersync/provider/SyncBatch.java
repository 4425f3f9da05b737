package com.ledgersync.provider;

import com.ledgersync.provider.plaid.PlaidAccount;
import com.ledgersync.provider.plaid.PlaidTransaction;
import com.ledgersync.provider.plaid.TransactionsSyncResponse;
import java.util.List;
import java.util.Objects;

/**
 * Records returned by one fetch round. {@code nextCursor} is the position to persist once this
 * batch is reconciled; it is always {@code null} in snapshot mode.
 */
public record SyncBatch(
    List<PlaidTransaction> added,
    List<PlaidTransaction> modified,
    List<String> removed,
    List<PlaidAccount> accounts,
    String nextCursor,
    boolean hasMore
) {
  public SyncBatch {
    added = added == null ? List.of() : added;
    modified = modified == null ? List.of() : modified;
    removed = removed == null ? List.of() : removed;
    accounts = accounts == null ? List.of() : accounts;
  }

  public static SyncBatch snapshot(List<PlaidTransaction> transactions, List<PlaidAccount> accounts) {
    return new SyncBatch(transactions, List.of(), List.of(), accounts, null, false);
  }

  static SyncBatch fromSyncPage(TransactionsSyncResponse page, String effectiveCursor) {
    List<String> removedIds = page.removed() == null
        ? List.of()
        : page.removed().stream()
            .filter(Objects::nonNull)
            .map(TransactionsSyncResponse.RemovedTransaction::transactionId)
            .filter(Objects::nonNull)
            .toList();
    return new SyncBatch(page.added(), page.modified(), removedIds, page.accounts(), effectiveCursor, page.hasMore());
  }

  public int size() {
    return added.size() + modified.size() + removed.size();
  }
}
