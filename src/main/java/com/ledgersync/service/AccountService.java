package com.ledgersync.service;

import com.ledgersync.model.Connection;
import com.ledgersync.model.FinancialAccount;
import com.ledgersync.provider.plaid.AccountsResponse;
import com.ledgersync.provider.plaid.PlaidAccount;
import com.ledgersync.provider.plaid.PlaidClient;
import com.ledgersync.repository.FinancialAccountRepository;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class AccountService {
  private static final Logger log = LoggerFactory.getLogger(AccountService.class);

  private final FinancialAccountRepository accountRepository;
  private final PlaidClient plaidClient;

  public AccountService(FinancialAccountRepository accountRepository, PlaidClient plaidClient) {
    this.accountRepository = accountRepository;
    this.plaidClient = plaidClient;
  }

  /**
   * Creates accounts seen for the first time and refreshes the metadata of known ones. Balances are
   * written for new accounts, and for known ones only when {@code applyBalances} is set.
   *
   * @return every account of the connection keyed by upstream account id, plus how many were new
   */
  @Transactional
  public AccountUpsertResult upsertAccounts(Connection connection, List<PlaidAccount> upstreamAccounts, boolean applyBalances) {
    Map<String, FinancialAccount> byExternalId = new HashMap<>();
    for (FinancialAccount account : accountRepository.findByConnectionId(connection.getId())) {
      byExternalId.put(account.getExternalId(), account);
    }
    if (upstreamAccounts == null || upstreamAccounts.isEmpty()) {
      return new AccountUpsertResult(byExternalId, 0);
    }
    Instant now = Instant.now();
    int created = 0;
    for (PlaidAccount upstream : upstreamAccounts) {
      if (upstream == null || upstream.accountId() == null || upstream.accountId().isBlank()) {
        continue;
      }
      FinancialAccount account = byExternalId.get(upstream.accountId());
      boolean isNew = account == null;
      if (isNew) {
        account = new FinancialAccount();
        account.setConnection(connection);
        account.setUserId(connection.getUserId());
        account.setExternalId(upstream.accountId());
        account.setInstitutionId(connection.getInstitutionId());
        created++;
      }
      account.setName(upstream.name() == null || upstream.name().isBlank() ? "Account" : upstream.name());
      account.setOfficialName(upstream.officialName());
      account.setMask(upstream.mask());
      account.setType(upstream.type());
      account.setSubtype(upstream.subtype());
      if (isNew || applyBalances) {
        applyBalances(account, upstream.balances(), now);
      }
      byExternalId.put(upstream.accountId(), accountRepository.save(account));
    }
    if (created > 0) {
      log.info("Discovered {} new accounts for connection {}", created, connection.getId());
    }
    return new AccountUpsertResult(byExternalId, created);
  }

  /** Pulls the account list again, for example after the upstream announced new accounts. */
  public AccountUpsertResult refreshAccounts(Connection connection, String accessToken) {
    AccountsResponse response = plaidClient.getAccounts(accessToken);
    return upsertAccounts(connection, response.accounts(), true);
  }

  static void applyBalances(FinancialAccount account, PlaidAccount.Balances balances, Instant now) {
    if (balances == null) {
      return;
    }
    account.setCurrentBalance(balances.current());
    account.setAvailableBalance(balances.available());
    account.setCreditLimit(balances.limit());
    if (balances.currency() != null) {
      account.setCurrency(balances.currency());
    }
    account.setBalanceUpdatedAt(now);
  }

  public record AccountUpsertResult(Map<String, FinancialAccount> accounts, int created) {}
}
