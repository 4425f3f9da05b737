package com.ledgersync.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ledgersync.dto.WebhookEvent;
import com.ledgersync.model.Connection;
import com.ledgersync.model.ConnectionStatus;
import com.ledgersync.repository.ConnectionRepository;
import java.time.Instant;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Service;

/**
 * Verifies and dispatches aggregator webhooks. Nothing thrown here reaches the caller: every
 * failure is logged and reported as an action so the endpoint can always acknowledge.
 */
@Service
public class WebhookService {
  private static final Logger log = LoggerFactory.getLogger(WebhookService.class);
  private static final String TRANSACTIONS = "TRANSACTIONS";
  private static final String ITEM = "ITEM";

  private final WebhookVerifier verifier;
  private final ObjectMapper objectMapper;
  private final ConnectionRepository connectionRepository;
  private final SyncService syncService;
  private final ReconciliationService reconciliationService;
  private final AccountService accountService;
  private final CredentialVault credentialVault;

  public WebhookService(WebhookVerifier verifier,
                        ObjectMapper objectMapper,
                        ConnectionRepository connectionRepository,
                        SyncService syncService,
                        ReconciliationService reconciliationService,
                        AccountService accountService,
                        CredentialVault credentialVault) {
    this.verifier = verifier;
    this.objectMapper = objectMapper;
    this.connectionRepository = connectionRepository;
    this.syncService = syncService;
    this.reconciliationService = reconciliationService;
    this.accountService = accountService;
    this.credentialVault = credentialVault;
  }

  public WebhookAction receive(HttpHeaders headers, String rawBody) {
    try {
      verifier.verify(headers, rawBody);
    } catch (WebhookVerificationException ex) {
      log.warn("Rejected webhook: {}", ex.getMessage());
      return WebhookAction.REJECTED;
    }
    WebhookEvent event;
    try {
      event = objectMapper.readValue(rawBody, WebhookEvent.class);
    } catch (JsonProcessingException ex) {
      log.warn("Ignoring webhook with unreadable body: {}", ex.getOriginalMessage());
      return WebhookAction.IGNORED;
    }
    try {
      return dispatch(event);
    } catch (RuntimeException ex) {
      log.error("Webhook {}/{} for item {} failed", event.webhookType(), event.webhookCode(), event.itemId(), ex);
      return WebhookAction.IGNORED;
    }
  }

  WebhookAction dispatch(WebhookEvent event) {
    log.info("Webhook {}/{} for item {}", event.webhookType(), event.webhookCode(), event.itemId());
    if (!TRANSACTIONS.equals(event.webhookType()) && !ITEM.equals(event.webhookType())) {
      log.info("Unhandled webhook type {}", event.webhookType());
      return WebhookAction.IGNORED;
    }
    Optional<Connection> connection = event.itemId() == null
        ? Optional.empty()
        : connectionRepository.findByExternalId(event.itemId());
    if (connection.isEmpty()) {
      log.warn("No connection for webhook item {}", event.itemId());
      return WebhookAction.IGNORED;
    }
    return TRANSACTIONS.equals(event.webhookType())
        ? handleTransactions(event, connection.get())
        : handleItem(event, connection.get());
  }

  private WebhookAction handleTransactions(WebhookEvent event, Connection connection) {
    String code = event.webhookCode() == null ? "" : event.webhookCode();
    switch (code) {
      case "INITIAL_UPDATE":
      case "HISTORICAL_UPDATE":
      case "DEFAULT_UPDATE":
      case "SYNC_UPDATES_AVAILABLE":
        syncService.syncInBackground(connection.getId());
        return WebhookAction.SYNC_TRIGGERED;
      case "TRANSACTIONS_REMOVED":
        reconciliationService.removeTransactions(connection, event.removedTransactions());
        return WebhookAction.TRANSACTIONS_REMOVED;
      default:
        log.info("Unhandled transactions webhook code {}", code);
        return WebhookAction.IGNORED;
    }
  }

  private WebhookAction handleItem(WebhookEvent event, Connection connection) {
    String code = event.webhookCode() == null ? "" : event.webhookCode();
    Instant now = Instant.now();
    switch (code) {
      case "ERROR":
        String message = event.error() == null || event.error().errorMessage() == null
            ? "Unknown error"
            : event.error().errorMessage();
        connectionRepository.updateStatus(connection.getId(), ConnectionStatus.ERROR, message, now);
        log.warn("Connection {} reported an item error: {}", connection.getId(), message);
        return WebhookAction.CONNECTION_UPDATED;
      case "PENDING_EXPIRATION":
        connectionRepository.updateStatus(connection.getId(), ConnectionStatus.PENDING_EXPIRATION,
            "Access consent expires soon", now);
        log.info("Connection {} consent is about to expire", connection.getId());
        return WebhookAction.CONNECTION_UPDATED;
      case "USER_PERMISSION_REVOKED":
        connectionRepository.revoke(connection.getId(), now);
        log.info("Connection {} revoked by the user", connection.getId());
        return WebhookAction.CONNECTION_UPDATED;
      case "NEW_ACCOUNTS_AVAILABLE":
        String accessToken = credentialVault.open(connection.getId(), connection.getEncryptedAccessToken());
        int created = accountService.refreshAccounts(connection, accessToken).created();
        log.info("Connection {} gained {} accounts", connection.getId(), created);
        return WebhookAction.ACCOUNTS_REFRESHED;
      default:
        log.info("Unhandled item webhook code {}", code);
        return WebhookAction.IGNORED;
    }
  }
}
