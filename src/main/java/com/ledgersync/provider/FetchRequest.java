package com.ledgersync.provider;

/**
 * @param accessToken decrypted upstream credential
 * @param cursor      last persisted cursor, {@code null} when never synced
 */
public record FetchRequest(String accessToken, String cursor) {}
