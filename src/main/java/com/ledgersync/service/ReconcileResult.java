package com.ledgersync.service;

/**
 * Counts for one reconciled batch.
 *
 * @param upserted        rows inserted or replaced
 * @param promoted        pending rows superseded by a posted record in this batch
 * @param removed         rows actually deleted, whether listed as removed or superseded
 * @param skippedInvalid  records without an id or with an unusable amount
 * @param skippedUnmapped records whose account is unknown to the connection
 * @param accountsCreated accounts discovered in this batch
 */
public record ReconcileResult(
    int upserted,
    int promoted,
    int removed,
    int skippedInvalid,
    int skippedUnmapped,
    int accountsCreated
) {}
