package com.accountvault.account;

import reactor.core.publisher.Mono;

/**
 * Conditional writes backed by Cassandra lightweight transactions.
 * Every method emits {@code true} when the write was applied and {@code false}
 * when its condition did not hold. Creation and update timestamps are stamped here.
 */
public interface AccountWriteOperations {

    /** {@code INSERT ... IF NOT EXISTS}; {@code false} means the identity is taken. */
    Mono<Boolean> insertIfAbsent(Account account);

    /**
     * Replaces every whitelisted profile column with the given values (nulls clear
     * the column) and marks the profile completed. {@code UPDATE ... IF EXISTS}.
     */
    Mono<Boolean> replaceProfile(String identity, ProfileFields fields);

    /** Replaces the credential hash only. {@code UPDATE ... IF EXISTS}. */
    Mono<Boolean> replaceCredentialHash(String identity, String credentialHash);
}
