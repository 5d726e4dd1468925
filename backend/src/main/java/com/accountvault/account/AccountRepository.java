package com.accountvault.account;

import org.springframework.data.cassandra.repository.ReactiveCassandraRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface AccountRepository extends ReactiveCassandraRepository<Account, String>, AccountWriteOperations {
    // Inherits: findById(identity), existsById(identity), etc.
}
