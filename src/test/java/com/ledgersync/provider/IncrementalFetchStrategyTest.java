package com.ledgersync.provider;

import static com.ledgersync.provider.plaid.PlaidFixtures.syncPage;
import static com.ledgersync.provider.plaid.PlaidFixtures.transaction;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.ledgersync.config.SyncProperties;
import com.ledgersync.model.FetchMode;
import com.ledgersync.provider.plaid.PlaidApiException;
import com.ledgersync.provider.plaid.PlaidClient;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class IncrementalFetchStrategyTest {

  @Mock
  private PlaidClient client;

  private IncrementalFetchStrategy strategy;
  private final List<SyncBatch> handled = new ArrayList<>();

  @BeforeEach
  void setUp() {
    strategy = new IncrementalFetchStrategy(client, properties(5, 3));
  }

  private static SyncProperties properties(int maxTransactions, int maxRounds) {
    return new SyncProperties(false, 0, 30, 2, maxTransactions, maxRounds, false, 30);
  }

  @Test
  @DisplayName("Should follow next_cursor until has_more is false")
  void shouldPaginate() {
    // Given
    when(client.syncTransactions("token", null, 2))
        .thenReturn(syncPage(List.of(transaction("t1", "acc-1", "1")), List.of(), "c1", true));
    when(client.syncTransactions("token", "c1", 2))
        .thenReturn(syncPage(List.of(transaction("t2", "acc-1", "2")), List.of("t0"), "c2", false));

    // When
    FetchSummary summary = strategy.fetch(new FetchRequest("token", null), handled::add);

    // Then
    assertThat(summary.mode()).isEqualTo(FetchMode.INCREMENTAL);
    assertThat(summary.rounds()).isEqualTo(2);
    assertThat(summary.records()).isEqualTo(3);
    assertThat(summary.cursor()).isEqualTo("c2");
    assertThat(handled).extracting(SyncBatch::nextCursor).containsExactly("c1", "c2");
    assertThat(handled.get(1).removed()).containsExactly("t0");
  }

  @Test
  @DisplayName("Should resume from the stored cursor")
  void shouldResumeFromCursor() {
    when(client.syncTransactions("token", "stored", 2))
        .thenReturn(syncPage(List.of(), List.of(), "next", false));

    FetchSummary summary = strategy.fetch(new FetchRequest("token", "stored"), handled::add);

    assertThat(summary.cursor()).isEqualTo("next");
    verify(client, never()).syncTransactions(eq("token"), isNull(), anyInt());
  }

  @Test
  @DisplayName("Should keep the previous cursor when a page omits next_cursor")
  void shouldKeepCursorWhenMissing() {
    when(client.syncTransactions("token", "stored", 2))
        .thenReturn(syncPage(List.of(), List.of(), null, false));

    FetchSummary summary = strategy.fetch(new FetchRequest("token", "stored"), handled::add);

    assertThat(summary.cursor()).isEqualTo("stored");
    assertThat(handled.get(0).nextCursor()).isEqualTo("stored");
  }

  @Nested
  @DisplayName("Safety caps")
  class SafetyCaps {

    @Test
    @DisplayName("Should stop after the maximum number of rounds")
    void shouldCapRounds() {
      when(client.syncTransactions(eq("token"), any(), eq(2)))
          .thenReturn(syncPage(List.of(), List.of(), "again", true));

      assertThatThrownBy(() -> strategy.fetch(new FetchRequest("token", null), handled::add))
          .isInstanceOf(SyncLimitExceededException.class)
          .satisfies(ex -> assertThat(((SyncLimitExceededException) ex).getRounds()).isEqualTo(3));
      assertThat(handled).hasSize(3);
    }

    @Test
    @DisplayName("Should refuse the page that pushes the total over the cap")
    void shouldCapTransactions() {
      when(client.syncTransactions("token", null, 2)).thenReturn(syncPage(
          List.of(transaction("t1", "acc-1", "1"), transaction("t2", "acc-1", "1"), transaction("t3", "acc-1", "1")),
          List.of(), "c1", true));
      when(client.syncTransactions("token", "c1", 2)).thenReturn(syncPage(
          List.of(transaction("t4", "acc-1", "1"), transaction("t5", "acc-1", "1")),
          List.of("t6"), "c2", true));

      assertThatThrownBy(() -> strategy.fetch(new FetchRequest("token", null), handled::add))
          .isInstanceOf(SyncLimitExceededException.class);
      assertThat(handled).extracting(SyncBatch::nextCursor).containsExactly("c1");
    }
  }

  @Test
  @DisplayName("Should stop the loop when the handler fails")
  void shouldStopOnHandlerFailure() {
    when(client.syncTransactions("token", null, 2))
        .thenReturn(syncPage(List.of(transaction("t1", "acc-1", "1")), List.of(), "c1", true));

    assertThatThrownBy(() -> strategy.fetch(new FetchRequest("token", null), batch -> {
      throw new IllegalStateException("storage down");
    })).isInstanceOf(IllegalStateException.class);
    verify(client, never()).syncTransactions(anyString(), eq("c1"), anyInt());
  }

  @Test
  @DisplayName("Should surface upstream errors unchanged")
  void shouldPropagateUpstreamError() {
    when(client.syncTransactions("token", null, 2))
        .thenThrow(new PlaidApiException("/transactions/sync", 400, "ITEM_ERROR", "ITEM_LOGIN_REQUIRED", "login"));

    assertThatThrownBy(() -> strategy.fetch(new FetchRequest("token", null), handled::add))
        .isInstanceOf(PlaidApiException.class);
    assertThat(handled).isEmpty();
  }
}
