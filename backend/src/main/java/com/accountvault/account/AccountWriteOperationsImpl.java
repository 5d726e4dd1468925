package com.accountvault.account;

import org.springframework.data.cassandra.core.EntityWriteResult;
import org.springframework.data.cassandra.core.InsertOptions;
import org.springframework.data.cassandra.core.ReactiveCassandraOperations;
import org.springframework.data.cassandra.core.UpdateOptions;
import org.springframework.data.cassandra.core.query.Criteria;
import org.springframework.data.cassandra.core.query.Query;
import org.springframework.data.cassandra.core.query.Update;
import reactor.core.publisher.Mono;

import java.time.Instant;

/**
 * Repository fragment picked up by Spring Data through the {@code Impl} suffix.
 */
class AccountWriteOperationsImpl implements AccountWriteOperations {

    private static final InsertOptions IF_NOT_EXISTS = InsertOptions.builder().withIfNotExists().build();
    private static final UpdateOptions IF_EXISTS = UpdateOptions.builder().withIfExists().build();

    private final ReactiveCassandraOperations operations;

    AccountWriteOperationsImpl(ReactiveCassandraOperations operations) {
        this.operations = operations;
    }

    @Override
    public Mono<Boolean> insertIfAbsent(Account account) {
        Instant now = Instant.now();
        account.createdAt = now;
        account.updatedAt = now;
        return operations.insert(account, IF_NOT_EXISTS)
                .map(EntityWriteResult::wasApplied);
    }

    @Override
    public Mono<Boolean> replaceProfile(String identity, ProfileFields fields) {
        Update update = Update.empty()
                .set("display_name", fields.displayName())
                .set("full_name", fields.fullName())
                .set("date_of_birth", fields.dateOfBirth())
                .set("gender", fields.gender())
                .set("avatar_type", fields.avatarType())
                .set("company", fields.company())
                .set("university", fields.university())
                .set("profession", fields.profession())
                .set("profile_completed", true)
                .set("updated_at", Instant.now());
        return operations.update(byIdentity(identity), update, Account.class);
    }

    @Override
    public Mono<Boolean> replaceCredentialHash(String identity, String credentialHash) {
        Update update = Update.empty()
                .set("credential_hash", credentialHash)
                .set("updated_at", Instant.now());
        return operations.update(byIdentity(identity), update, Account.class);
    }

    private static Query byIdentity(String identity) {
        return Query.query(Criteria.where("identity").is(identity))
                .queryOptions(IF_EXISTS);
    }
}
