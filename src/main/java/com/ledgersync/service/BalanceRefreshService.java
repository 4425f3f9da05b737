package com.ledgersync.service;

import com.ledgersync.model.Connection;
import com.ledgersync.model.FinancialAccount;
import com.ledgersync.provider.plaid.AccountsResponse;
import com.ledgersync.provider.plaid.PlaidAccount;
import com.ledgersync.provider.plaid.PlaidClient;
import com.ledgersync.repository.FinancialAccountRepository;
import java.time.Instant;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Writes fresh balances after a sync. Each account is saved on its own, so one failing account
 * leaves its siblings and the already committed transactions untouched. Failures are logged and
 * counted, never thrown.
 */
@Service
public class BalanceRefreshService {
  private static final Logger log = LoggerFactory.getLogger(BalanceRefreshService.class);

  private final PlaidClient plaidClient;
  private final FinancialAccountRepository accountRepository;

  public BalanceRefreshService(PlaidClient plaidClient, FinancialAccountRepository accountRepository) {
    this.plaidClient = plaidClient;
    this.accountRepository = accountRepository;
  }

  public BalanceRefreshResult refresh(Connection connection, String accessToken) {
    AccountsResponse response;
    try {
      response = plaidClient.getBalances(accessToken);
    } catch (RuntimeException ex) {
      log.warn("Balance refresh for connection {} failed: {}", connection.getId(), ex.getMessage());
      return BalanceRefreshResult.none();
    }
    if (response.accounts() == null || response.accounts().isEmpty()) {
      return BalanceRefreshResult.none();
    }
    Instant now = Instant.now();
    int updated = 0;
    int failed = 0;
    for (PlaidAccount upstream : response.accounts()) {
      try {
        if (updateAccount(connection, upstream, now)) {
          updated++;
        }
      } catch (RuntimeException ex) {
        failed++;
        log.warn("Balance refresh for account {} of connection {} failed: {}",
            upstream == null ? null : upstream.accountId(), connection.getId(), ex.getMessage());
      }
    }
    if (failed > 0) {
      log.warn("Balance refresh for connection {} finished with {} failures, {} updated",
          connection.getId(), failed, updated);
    } else {
      log.debug("Balance refresh for connection {} updated {} accounts", connection.getId(), updated);
    }
    return new BalanceRefreshResult(updated, failed);
  }

  private boolean updateAccount(Connection connection, PlaidAccount upstream, Instant now) {
    if (upstream == null || upstream.accountId() == null) {
      return false;
    }
    Optional<FinancialAccount> existing =
        accountRepository.findByConnectionIdAndExternalId(connection.getId(), upstream.accountId());
    if (existing.isEmpty()) {
      log.debug("Balance for unknown account {} ignored", upstream.accountId());
      return false;
    }
    FinancialAccount account = existing.get();
    AccountService.applyBalances(account, upstream.balances(), now);
    accountRepository.save(account);
    return true;
  }
}
