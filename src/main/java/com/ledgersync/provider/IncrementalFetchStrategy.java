package com.ledgersync.provider;

import com.ledgersync.config.SyncProperties;
import com.ledgersync.model.FetchMode;
import com.ledgersync.provider.plaid.PlaidClient;
import com.ledgersync.provider.plaid.TransactionsSyncResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Follows {@code next_cursor} until {@code has_more} is false. Each page is handed over before the
 * next one is requested, so a failing round stops the loop with earlier rounds intact.
 */
@Component
public class IncrementalFetchStrategy implements TransactionFetchStrategy {
  private static final Logger log = LoggerFactory.getLogger(IncrementalFetchStrategy.class);
  private static final int DEFAULT_PAGE_SIZE = 500;
  private static final int DEFAULT_MAX_ROUNDS = 100;
  private static final int DEFAULT_MAX_TRANSACTIONS = 10_000;

  private final PlaidClient client;
  private final SyncProperties properties;

  public IncrementalFetchStrategy(PlaidClient client, SyncProperties properties) {
    this.client = client;
    this.properties = properties;
  }

  @Override
  public FetchMode mode() {
    return FetchMode.INCREMENTAL;
  }

  @Override
  public FetchSummary fetch(FetchRequest request, BatchHandler handler) {
    int pageSize = properties.pageSize() > 0 ? properties.pageSize() : DEFAULT_PAGE_SIZE;
    int maxRounds = properties.maxRounds() > 0 ? properties.maxRounds() : DEFAULT_MAX_ROUNDS;
    int maxTransactions = properties.maxTransactions() > 0 ? properties.maxTransactions() : DEFAULT_MAX_TRANSACTIONS;

    String cursor = request.cursor();
    int rounds = 0;
    int records = 0;
    boolean hasMore;
    do {
      if (rounds >= maxRounds) {
        throw new SyncLimitExceededException(
            "Upstream still reports more data after " + rounds + " rounds", rounds, records);
      }
      TransactionsSyncResponse page = client.syncTransactions(request.accessToken(), cursor, pageSize);
      rounds++;
      String nextCursor = isBlank(page.nextCursor()) ? cursor : page.nextCursor();
      SyncBatch batch = SyncBatch.fromSyncPage(page, nextCursor);
      records += batch.size();
      if (records > maxTransactions) {
        throw new SyncLimitExceededException(
            "Sync accumulated " + records + " transactions, limit is " + maxTransactions, rounds, records);
      }
      log.debug("Round {}: added={} modified={} removed={} hasMore={}",
          rounds, batch.added().size(), batch.modified().size(), batch.removed().size(), batch.hasMore());
      handler.handle(batch);
      cursor = nextCursor;
      hasMore = page.hasMore();
    } while (hasMore);
    return new FetchSummary(FetchMode.INCREMENTAL, rounds, records, cursor);
  }

  private static boolean isBlank(String value) {
    return value == null || value.isBlank();
  }
}
