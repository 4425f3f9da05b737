package com.ledgersync.provider;

import com.ledgersync.config.SyncProperties;
import com.ledgersync.model.FetchMode;
import com.ledgersync.provider.plaid.PlaidClient;
import com.ledgersync.provider.plaid.TransactionsGetResponse;
import java.time.LocalDate;
import java.time.ZoneOffset;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class SnapshotFetchStrategy implements TransactionFetchStrategy {
  private static final Logger log = LoggerFactory.getLogger(SnapshotFetchStrategy.class);
  private static final int DEFAULT_WINDOW_DAYS = 30;
  private static final int DEFAULT_COUNT = 500;

  private final PlaidClient client;
  private final SyncProperties properties;

  public SnapshotFetchStrategy(PlaidClient client, SyncProperties properties) {
    this.client = client;
    this.properties = properties;
  }

  @Override
  public FetchMode mode() {
    return FetchMode.SNAPSHOT;
  }

  @Override
  public FetchSummary fetch(FetchRequest request, BatchHandler handler) {
    int windowDays = properties.snapshotWindowDays() > 0 ? properties.snapshotWindowDays() : DEFAULT_WINDOW_DAYS;
    int count = properties.pageSize() > 0 ? properties.pageSize() : DEFAULT_COUNT;
    LocalDate endDate = LocalDate.now(ZoneOffset.UTC);
    LocalDate startDate = endDate.minusDays(windowDays);

    TransactionsGetResponse response = client.getTransactions(request.accessToken(), startDate, endDate, count);
    SyncBatch batch = SyncBatch.snapshot(response.transactions(), response.accounts());
    if (properties.maxTransactions() > 0 && batch.size() > properties.maxTransactions()) {
      throw new SyncLimitExceededException(
          "Snapshot returned " + batch.size() + " transactions, limit is " + properties.maxTransactions(),
          1, batch.size());
    }
    log.debug("Snapshot {}..{} returned {} transactions", startDate, endDate, batch.size());
    handler.handle(batch);
    return new FetchSummary(FetchMode.SNAPSHOT, 1, batch.size(), null);
  }
}
