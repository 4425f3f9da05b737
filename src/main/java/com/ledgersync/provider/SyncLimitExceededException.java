package com.ledgersync.provider;

public class SyncLimitExceededException extends RuntimeException {
  private final int rounds;
  private final int records;

  public SyncLimitExceededException(String message, int rounds, int records) {
    super(message);
    this.rounds = rounds;
    this.records = records;
  }

  public int getRounds() {
    return rounds;
  }

  public int getRecords() {
    return records;
  }
}
