package com.ledgersync.service;

import com.ledgersync.model.AccountTransaction;
import com.ledgersync.model.Connection;
import com.ledgersync.model.FinancialAccount;
import com.ledgersync.provider.SyncBatch;
import com.ledgersync.provider.plaid.PlaidTransaction;
import com.ledgersync.repository.AccountTransactionRepository;
import com.ledgersync.repository.ConnectionRepository;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Applies one fetched batch to the ledger inside a single transaction. Deletions, both explicit
 * removals and pending rows superseded by a posted record, run before any upsert. The cursor is
 * not touched here; the caller stores it once the whole run has been reconciled.
 */
@Service
public class ReconciliationService {
  private static final Logger log = LoggerFactory.getLogger(ReconciliationService.class);

  private final TransactionNormalizer normalizer;
  private final AccountService accountService;
  private final AccountTransactionRepository transactionRepository;
  private final ConnectionRepository connectionRepository;

  public ReconciliationService(TransactionNormalizer normalizer,
                               AccountService accountService,
                               AccountTransactionRepository transactionRepository,
                               ConnectionRepository connectionRepository) {
    this.normalizer = normalizer;
    this.accountService = accountService;
    this.transactionRepository = transactionRepository;
    this.connectionRepository = connectionRepository;
  }

  @Transactional
  public ReconcileResult reconcile(Connection connection, SyncBatch batch) {
    int skippedInvalid = 0;
    List<NormalizedTransaction> upserts = new ArrayList<>();
    Set<String> supersededPendingIds = new LinkedHashSet<>();

    for (PlaidTransaction record : batch.added()) {
      NormalizedTransaction normalized = normalizeOrNull(connection, record);
      if (normalized == null) {
        skippedInvalid++;
        continue;
      }
      if (normalized.supersedesPending()) {
        supersededPendingIds.add(normalized.pendingUpstreamId());
      }
      upserts.add(normalized);
    }
    for (PlaidTransaction record : batch.modified()) {
      NormalizedTransaction normalized = normalizeOrNull(connection, record);
      if (normalized == null) {
        skippedInvalid++;
        continue;
      }
      upserts.add(normalized);
    }

    Set<String> deleteKeys = new LinkedHashSet<>(batch.removed());
    deleteKeys.addAll(supersededPendingIds);
    int removed = deleteKeys.isEmpty()
        ? 0
        : transactionRepository.deleteByConnectionIdAndUpstreamIds(connection.getId(), deleteKeys);

    Connection managed = connectionRepository.getReferenceById(connection.getId());
    AccountService.AccountUpsertResult accounts = accountService.upsertAccounts(managed, batch.accounts(), false);

    int upserted = 0;
    int skippedUnmapped = 0;
    for (NormalizedTransaction normalized : upserts) {
      FinancialAccount account = accounts.accounts().get(normalized.upstreamAccountId());
      if (account == null) {
        skippedUnmapped++;
        log.warn("Skipping transaction {} for connection {}: account {} is not mapped",
            normalized.upstreamTransactionId(), connection.getId(), normalized.upstreamAccountId());
        continue;
      }
      upsert(account, normalized);
      upserted++;
    }
    transactionRepository.flush();

    ReconcileResult result = new ReconcileResult(upserted, supersededPendingIds.size(), removed,
        skippedInvalid, skippedUnmapped, accounts.created());
    log.debug("Reconciled batch for connection {}: {}", connection.getId(), result);
    return result;
  }

  /** Deletes rows named by a removal notice without running a full sync. */
  @Transactional
  public int removeTransactions(Connection connection, Collection<String> upstreamIds) {
    if (upstreamIds == null || upstreamIds.isEmpty()) {
      return 0;
    }
    int removed = transactionRepository.deleteByConnectionIdAndUpstreamIds(connection.getId(), new LinkedHashSet<>(upstreamIds));
    log.info("Removed {} of {} transactions for connection {}", removed, upstreamIds.size(), connection.getId());
    return removed;
  }

  private NormalizedTransaction normalizeOrNull(Connection connection, PlaidTransaction record) {
    if (record == null || isBlank(record.transactionId()) || isBlank(record.accountId())) {
      log.warn("Skipping transaction without identity for connection {}", connection.getId());
      return null;
    }
    try {
      return normalizer.normalize(record);
    } catch (InvalidAmountException ex) {
      log.warn("Skipping transaction {} for connection {}: {}",
          ex.getUpstreamTransactionId(), connection.getId(), ex.getMessage());
      return null;
    }
  }

  private void upsert(FinancialAccount account, NormalizedTransaction normalized) {
    AccountTransaction transaction = transactionRepository
        .findByAccountIdAndUpstreamTransactionId(account.getId(), normalized.upstreamTransactionId())
        .orElseGet(AccountTransaction::new);
    transaction.setAccount(account);
    transaction.setUpstreamTransactionId(normalized.upstreamTransactionId());
    transaction.setPendingUpstreamId(normalized.pendingUpstreamId());
    transaction.setAmount(normalized.amount());
    transaction.setCurrency(normalized.currency());
    transaction.setPending(normalized.pending());
    transaction.setDescription(normalized.description());
    transaction.setMerchantName(normalized.merchantName());
    transaction.setCategoryKey(normalized.categoryKey());
    transaction.setOccurredAt(normalized.occurredAt());
    transaction.setTransactionDate(normalized.transactionDate());
    transaction.setIconUrl(normalized.iconUrl());
    transaction.setPaymentChannel(normalized.paymentChannel());
    transaction.setWebsite(normalized.website());
    transactionRepository.save(transaction);
  }

  private static boolean isBlank(String value) {
    return value == null || value.isBlank();
  }
}
