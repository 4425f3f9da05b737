package com.ledgersync.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.ledgersync.config.SyncProperties;
import com.ledgersync.model.AggregatorEnvironment;
import com.ledgersync.model.Connection;
import com.ledgersync.model.ConnectionStatus;
import com.ledgersync.model.FetchMode;
import com.ledgersync.provider.BatchHandler;
import com.ledgersync.provider.FetchRequest;
import com.ledgersync.provider.FetchStrategyRegistry;
import com.ledgersync.provider.FetchSummary;
import com.ledgersync.provider.SyncBatch;
import com.ledgersync.provider.SyncLimitExceededException;
import com.ledgersync.provider.TransactionFetchStrategy;
import com.ledgersync.provider.plaid.PlaidApiException;
import com.ledgersync.repository.ConnectionRepository;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;

@ExtendWith(MockitoExtension.class)
class SyncServiceTest {
  private static final SyncBatch BATCH = new SyncBatch(List.of(), List.of(), List.of("t0"), List.of(), "c1", false);

  @Mock
  private ConnectionRepository connectionRepository;
  @Mock
  private FetchStrategyRegistry strategyRegistry;
  @Mock
  private TransactionFetchStrategy strategy;
  @Mock
  private ReconciliationService reconciliationService;
  @Mock
  private BalanceRefreshService balanceRefreshService;
  @Mock
  private CredentialVault credentialVault;

  private SyncService syncService;
  private Connection connection;

  @BeforeEach
  void setUp() {
    syncService = new SyncService(connectionRepository, strategyRegistry, reconciliationService,
        balanceRefreshService, credentialVault, new SyncProperties(true, 0, 30, 500, 10_000, 10, true, 30));
    connection = new Connection();
    connection.setId(UUID.randomUUID());
    connection.setUserId(UUID.randomUUID());
    connection.setEnvironment(AggregatorEnvironment.PRODUCTION);
    connection.setEncryptedAccessToken("v1:sealed");
    connection.setCursor("c0");
  }

  private void givenClaimed() {
    when(connectionRepository.claimSync(eq(connection.getId()), any(), any())).thenReturn(1);
    when(credentialVault.open(connection.getId(), "v1:sealed")).thenReturn("token");
  }

  private void givenStrategy(FetchMode mode) {
    when(strategyRegistry.forEnvironment(connection.getEnvironment())).thenReturn(strategy);
    when(strategy.mode()).thenReturn(mode);
  }

  private void givenFetchDelivers(SyncBatch batch, FetchSummary summary) {
    when(strategy.fetch(any(), any())).thenAnswer(invocation -> {
      BatchHandler handler = invocation.getArgument(1);
      handler.handle(batch);
      return summary;
    });
  }

  @Nested
  @DisplayName("Successful runs")
  class SuccessfulRuns {

    @Test
    @DisplayName("Should reconcile every batch, complete and refresh balances in incremental mode")
    void shouldCompleteIncrementalRun() {
      // Given
      givenClaimed();
      givenStrategy(FetchMode.INCREMENTAL);
      givenFetchDelivers(BATCH, new FetchSummary(FetchMode.INCREMENTAL, 1, 1, "c1"));
      when(reconciliationService.reconcile(connection, BATCH)).thenReturn(new ReconcileResult(2, 1, 1, 0, 0, 0));
      when(balanceRefreshService.refresh(connection, "token")).thenReturn(new BalanceRefreshResult(3, 0));

      // When
      SyncOutcome outcome = syncService.syncConnection(connection, false);

      // Then
      assertThat(outcome.success()).isTrue();
      assertThat(outcome.transactionsSynced()).isEqualTo(2);
      assertThat(outcome.pendingTransactionsUpdated()).isEqualTo(1);
      assertThat(outcome.accountsUpdated()).isEqualTo(3);
      assertThat(outcome.cursor()).isEqualTo("c1");
      ArgumentCaptor<FetchRequest> request = ArgumentCaptor.forClass(FetchRequest.class);
      verify(strategy).fetch(request.capture(), any());
      assertThat(request.getValue().cursor()).isEqualTo("c0");
      verify(connectionRepository).completeSyncWithCursor(eq(connection.getId()), eq("c1"), any());
      verify(connectionRepository, never()).failSync(any(), anyString(), any());
    }

    @Test
    @DisplayName("Should neither read nor advance the cursor in snapshot mode")
    void shouldRunSnapshot() {
      SyncBatch snapshot = SyncBatch.snapshot(List.of(), List.of());
      givenClaimed();
      givenStrategy(FetchMode.SNAPSHOT);
      givenFetchDelivers(snapshot, new FetchSummary(FetchMode.SNAPSHOT, 1, 0, null));
      when(reconciliationService.reconcile(connection, snapshot)).thenReturn(new ReconcileResult(0, 0, 0, 0, 0, 0));

      SyncOutcome outcome = syncService.syncConnection(connection, false);

      assertThat(outcome.success()).isTrue();
      assertThat(outcome.cursor()).isNull();
      ArgumentCaptor<FetchRequest> request = ArgumentCaptor.forClass(FetchRequest.class);
      verify(strategy).fetch(request.capture(), any());
      assertThat(request.getValue().cursor()).isNull();
      verifyNoInteractions(balanceRefreshService);
      verify(connectionRepository).completeSync(eq(connection.getId()), any());
      verify(connectionRepository, never()).completeSyncWithCursor(any(), any(), any());
    }

    @Test
    @DisplayName("Should claim unconditionally when forced")
    void shouldForceClaim() {
      when(connectionRepository.forceClaimSync(eq(connection.getId()), any())).thenReturn(1);
      when(credentialVault.open(connection.getId(), "v1:sealed")).thenReturn("token");
      givenStrategy(FetchMode.INCREMENTAL);
      when(strategy.fetch(any(), any())).thenReturn(new FetchSummary(FetchMode.INCREMENTAL, 1, 0, "c0"));
      when(balanceRefreshService.refresh(connection, "token")).thenReturn(new BalanceRefreshResult(0, 0));

      SyncOutcome outcome = syncService.syncConnection(connection, true);

      assertThat(outcome.success()).isTrue();
      verify(connectionRepository, never()).claimSync(any(), any(), any());
    }
  }

  @Nested
  @DisplayName("Refused runs")
  class RefusedRuns {

    @Test
    @DisplayName("Should refuse when another run holds the connection")
    void shouldRefuseWhenSyncing() {
      when(connectionRepository.claimSync(eq(connection.getId()), any(), any())).thenReturn(0);

      SyncOutcome outcome = syncService.syncConnection(connection, false);

      assertThat(outcome.success()).isFalse();
      assertThat(outcome.code()).isEqualTo(SyncErrorCode.ALREADY_SYNCING);
      verifyNoInteractions(strategyRegistry, reconciliationService);
      verify(connectionRepository, never()).failSync(any(), anyString(), any());
    }

    @Test
    @DisplayName("Should refuse revoked connections without claiming")
    void shouldRefuseInactive() {
      connection.setStatus(ConnectionStatus.REVOKED);

      SyncOutcome outcome = syncService.syncConnection(connection, true);

      assertThat(outcome.code()).isEqualTo(SyncErrorCode.CONNECTION_INACTIVE);
      verifyNoInteractions(connectionRepository);
    }

    @Test
    @DisplayName("Should report unknown connections")
    void shouldReportNotFound() {
      UUID connectionId = UUID.randomUUID();
      UUID userId = UUID.randomUUID();
      when(connectionRepository.findByIdAndUserId(connectionId, userId)).thenReturn(Optional.empty());

      SyncOutcome outcome = syncService.sync(connectionId, userId, false);

      assertThat(outcome.code()).isEqualTo(SyncErrorCode.NOT_FOUND);
    }
  }

  @Nested
  @DisplayName("Failed runs")
  class FailedRuns {

    @BeforeEach
    void setUp() {
      givenClaimed();
      givenStrategy(FetchMode.INCREMENTAL);
    }

    @Test
    @DisplayName("Should report the safety cap with its own code")
    void shouldReportLimit() {
      when(strategy.fetch(any(), any())).thenThrow(new SyncLimitExceededException("too much", 10, 20_000));

      SyncOutcome outcome = syncService.syncConnection(connection, false);

      assertThat(outcome.code()).isEqualTo(SyncErrorCode.SYNC_LIMIT_EXCEEDED);
      verify(connectionRepository).failSync(eq(connection.getId()), eq("too much"), any());
      verify(connectionRepository, never()).completeSync(any(), any());
      verify(connectionRepository, never()).completeSyncWithCursor(any(), any(), any());
    }

    @Test
    @DisplayName("Should flag the connection on item errors from upstream")
    void shouldReportUpstreamError() {
      when(strategy.fetch(any(), any())).thenThrow(
          new PlaidApiException("/transactions/sync", 400, "ITEM_ERROR", "ITEM_LOGIN_REQUIRED", "login required"));

      SyncOutcome outcome = syncService.syncConnection(connection, false);

      assertThat(outcome.code()).isEqualTo(SyncErrorCode.UPSTREAM_ERROR);
      verify(connectionRepository).updateStatus(eq(connection.getId()), eq(ConnectionStatus.ERROR),
          contains("login required"), any());
      verify(connectionRepository).failSync(eq(connection.getId()), anyString(), any());
    }

    @Test
    @DisplayName("Should report storage failures and never complete")
    void shouldReportStorageError() {
      givenFetchDelivers(BATCH, new FetchSummary(FetchMode.INCREMENTAL, 1, 1, "c1"));
      when(reconciliationService.reconcile(connection, BATCH))
          .thenThrow(new DataIntegrityViolationException("value too long"));

      SyncOutcome outcome = syncService.syncConnection(connection, false);

      assertThat(outcome.code()).isEqualTo(SyncErrorCode.STORAGE_ERROR);
      verify(connectionRepository, never()).completeSync(any(), any());
      verify(connectionRepository, never()).completeSyncWithCursor(any(), any(), any());
      verifyNoInteractions(balanceRefreshService);
    }

    @Test
    @DisplayName("Should still return an outcome when recording the failure fails")
    void shouldSurviveFailSyncError() {
      when(strategy.fetch(any(), any())).thenThrow(new IllegalStateException("boom"));
      when(connectionRepository.failSync(any(), anyString(), any()))
          .thenThrow(new DataIntegrityViolationException("db gone"));

      SyncOutcome outcome = syncService.syncConnection(connection, false);

      assertThat(outcome.code()).isEqualTo(SyncErrorCode.INTERNAL_ERROR);
    }
  }
}
