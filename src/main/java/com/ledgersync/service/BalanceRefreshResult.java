package com.ledgersync.service;

public record BalanceRefreshResult(int updated, int failed) {
  static BalanceRefreshResult none() {
    return new BalanceRefreshResult(0, 0);
  }
}
