package com.ledgersync.service;

/**
 * Signals a rejected webhook. The message is the same for every failed check; the reason is only
 * logged server side.
 */
public class WebhookVerificationException extends RuntimeException {
  static final String MESSAGE = "Webhook verification failed";

  public WebhookVerificationException() {
    super(MESSAGE);
  }

  public WebhookVerificationException(Throwable cause) {
    super(MESSAGE, cause);
  }
}
