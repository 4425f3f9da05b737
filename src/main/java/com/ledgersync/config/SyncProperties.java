package com.ledgersync.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Tuning for sync runs.
 *
 * @param enabled           whether the auto-sync scheduler runs
 * @param intervalMs        minimum time between two scheduled syncs of one connection
 * @param snapshotWindowDays trailing window requested in snapshot mode
 * @param pageSize          records requested per incremental round
 * @param maxTransactions   safety cap on records accumulated by one incremental run
 * @param maxRounds         safety cap on rounds issued by one incremental run
 * @param refreshBalances   refresh balances after a successful incremental run
 * @param staleLockMinutes  age after which a {@code SYNCING} flag may be re-claimed
 */
@ConfigurationProperties(prefix = "ledgersync.sync")
public record SyncProperties(
    boolean enabled,
    long intervalMs,
    int snapshotWindowDays,
    int pageSize,
    int maxTransactions,
    int maxRounds,
    boolean refreshBalances,
    long staleLockMinutes
) {}
