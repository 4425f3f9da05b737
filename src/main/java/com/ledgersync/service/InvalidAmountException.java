package com.ledgersync.service;

/** Raised for a single upstream record whose amount is missing or not a finite number. */
public class InvalidAmountException extends RuntimeException {
  private final String upstreamTransactionId;

  public InvalidAmountException(String upstreamTransactionId, String message) {
    super(message);
    this.upstreamTransactionId = upstreamTransactionId;
  }

  public String getUpstreamTransactionId() {
    return upstreamTransactionId;
  }
}
