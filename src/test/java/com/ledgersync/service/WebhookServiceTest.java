package com.ledgersync.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ledgersync.model.Connection;
import com.ledgersync.model.ConnectionStatus;
import com.ledgersync.repository.ConnectionRepository;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpHeaders;

@ExtendWith(MockitoExtension.class)
class WebhookServiceTest {
  private final ObjectMapper objectMapper = new ObjectMapper();

  @Mock
  private WebhookVerifier verifier;
  @Mock
  private ConnectionRepository connectionRepository;
  @Mock
  private SyncService syncService;
  @Mock
  private ReconciliationService reconciliationService;
  @Mock
  private AccountService accountService;
  @Mock
  private CredentialVault credentialVault;

  private WebhookService webhookService;
  private Connection connection;

  @BeforeEach
  void setUp() {
    webhookService = new WebhookService(verifier, objectMapper, connectionRepository, syncService,
        reconciliationService, accountService, credentialVault);
    connection = new Connection();
    connection.setId(UUID.randomUUID());
    connection.setExternalId("item-1");
    connection.setEncryptedAccessToken("v1:sealed");
  }

  private String body(Map<String, Object> event) throws Exception {
    return objectMapper.writeValueAsString(event);
  }

  @Test
  @DisplayName("Should not dispatch anything when verification fails")
  void shouldStopOnVerificationFailure() throws Exception {
    // Given
    String payload = body(Map.of("webhook_type", "TRANSACTIONS", "webhook_code", "SYNC_UPDATES_AVAILABLE", "item_id", "item-1"));
    doThrow(new WebhookVerificationException()).when(verifier).verify(any(), eq(payload));

    // When
    WebhookAction action = webhookService.receive(new HttpHeaders(), payload);

    // Then
    assertThat(action).isEqualTo(WebhookAction.REJECTED);
    verifyNoInteractions(syncService, reconciliationService, connectionRepository);
  }

  @Nested
  @DisplayName("Transactions events")
  class TransactionsEvents {

    @ParameterizedTest
    @ValueSource(strings = {"INITIAL_UPDATE", "HISTORICAL_UPDATE", "DEFAULT_UPDATE", "SYNC_UPDATES_AVAILABLE"})
    @DisplayName("Should trigger a background sync for every update code")
    void shouldTriggerSync(String code) throws Exception {
      when(connectionRepository.findByExternalId("item-1")).thenReturn(Optional.of(connection));

      WebhookAction action = webhookService.receive(new HttpHeaders(),
          body(Map.of("webhook_type", "TRANSACTIONS", "webhook_code", code, "item_id", "item-1")));

      assertThat(action).isEqualTo(WebhookAction.SYNC_TRIGGERED);
      verify(syncService).syncInBackground(connection.getId());
    }

    @Test
    @DisplayName("Should delete removed transactions without a sync")
    void shouldRemoveDirectly() throws Exception {
      when(connectionRepository.findByExternalId("item-1")).thenReturn(Optional.of(connection));

      WebhookAction action = webhookService.receive(new HttpHeaders(), body(Map.of(
          "webhook_type", "TRANSACTIONS", "webhook_code", "TRANSACTIONS_REMOVED", "item_id", "item-1",
          "removed_transactions", List.of("t1", "t2"))));

      assertThat(action).isEqualTo(WebhookAction.TRANSACTIONS_REMOVED);
      verify(reconciliationService).removeTransactions(connection, List.of("t1", "t2"));
      verify(syncService, never()).syncInBackground(any());
    }

    @Test
    @DisplayName("Should ignore events for unknown items")
    void shouldIgnoreUnknownItem() throws Exception {
      when(connectionRepository.findByExternalId("item-9")).thenReturn(Optional.empty());

      WebhookAction action = webhookService.receive(new HttpHeaders(),
          body(Map.of("webhook_type", "TRANSACTIONS", "webhook_code", "DEFAULT_UPDATE", "item_id", "item-9")));

      assertThat(action).isEqualTo(WebhookAction.IGNORED);
      verifyNoInteractions(syncService);
    }
  }

  @Nested
  @DisplayName("Item events")
  class ItemEvents {

    @BeforeEach
    void setUp() {
      when(connectionRepository.findByExternalId("item-1")).thenReturn(Optional.of(connection));
    }

    @Test
    @DisplayName("Should flag the connection on item errors")
    void shouldFlagError() throws Exception {
      WebhookAction action = webhookService.receive(new HttpHeaders(), body(Map.of(
          "webhook_type", "ITEM", "webhook_code", "ERROR", "item_id", "item-1",
          "error", Map.of("error_code", "ITEM_LOGIN_REQUIRED", "error_message", "login required"))));

      assertThat(action).isEqualTo(WebhookAction.CONNECTION_UPDATED);
      verify(connectionRepository).updateStatus(eq(connection.getId()), eq(ConnectionStatus.ERROR),
          eq("login required"), any());
      verifyNoInteractions(syncService);
    }

    @Test
    @DisplayName("Should flag pending expiration")
    void shouldFlagPendingExpiration() throws Exception {
      webhookService.receive(new HttpHeaders(),
          body(Map.of("webhook_type", "ITEM", "webhook_code", "PENDING_EXPIRATION", "item_id", "item-1")));

      verify(connectionRepository).updateStatus(eq(connection.getId()), eq(ConnectionStatus.PENDING_EXPIRATION),
          anyString(), any());
    }

    @Test
    @DisplayName("Should revoke the connection when the user withdraws consent")
    void shouldRevoke() throws Exception {
      webhookService.receive(new HttpHeaders(),
          body(Map.of("webhook_type", "ITEM", "webhook_code", "USER_PERMISSION_REVOKED", "item_id", "item-1")));

      verify(connectionRepository).revoke(eq(connection.getId()), any());
      verifyNoInteractions(syncService);
    }

    @Test
    @DisplayName("Should discover new accounts")
    void shouldRefreshAccounts() throws Exception {
      when(credentialVault.open(connection.getId(), "v1:sealed")).thenReturn("access-token");
      when(accountService.refreshAccounts(connection, "access-token"))
          .thenReturn(new AccountService.AccountUpsertResult(Map.of(), 2));

      WebhookAction action = webhookService.receive(new HttpHeaders(),
          body(Map.of("webhook_type", "ITEM", "webhook_code", "NEW_ACCOUNTS_AVAILABLE", "item_id", "item-1")));

      assertThat(action).isEqualTo(WebhookAction.ACCOUNTS_REFRESHED);
      verifyNoInteractions(syncService);
    }

    @Test
    @DisplayName("Should swallow handler failures so the webhook is still acknowledged")
    void shouldContainFailures() throws Exception {
      when(credentialVault.open(connection.getId(), "v1:sealed")).thenThrow(new IllegalStateException("bad key"));

      WebhookAction action = webhookService.receive(new HttpHeaders(),
          body(Map.of("webhook_type", "ITEM", "webhook_code", "NEW_ACCOUNTS_AVAILABLE", "item_id", "item-1")));

      assertThat(action).isEqualTo(WebhookAction.IGNORED);
    }
  }

  @Test
  @DisplayName("Should ignore unknown webhook types and unreadable bodies")
  void shouldIgnoreUnknown() throws Exception {
    assertThat(webhookService.receive(new HttpHeaders(),
        body(Map.of("webhook_type", "HOLDINGS", "webhook_code", "DEFAULT_UPDATE", "item_id", "item-1"))))
        .isEqualTo(WebhookAction.IGNORED);
    assertThat(webhookService.receive(new HttpHeaders(), "{not json")).isEqualTo(WebhookAction.IGNORED);
    verifyNoInteractions(connectionRepository, syncService);
  }
}
