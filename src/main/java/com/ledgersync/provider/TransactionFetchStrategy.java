package com.ledgersync.provider;

import com.ledgersync.model.FetchMode;

public interface TransactionFetchStrategy {
  FetchMode mode();
  FetchSummary fetch(FetchRequest request, BatchHandler handler);
}
