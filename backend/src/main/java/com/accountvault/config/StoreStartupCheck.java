package com.accountvault.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.cassandra.CassandraProperties;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.core.annotation.Order;
import org.springframework.data.cassandra.core.ReactiveCassandraOperations;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Refuses to run without a reachable store. Once the context is up, this queries the
 * node's release version within the configured timeout. Missing contact points are
 * caught earlier, by {@link StoreContactPointsGuard}, while the driver session is built.
 *
 * A failure propagates out of {@link #run}, so Spring Boot stops the context and the
 * process exits non-zero.
 */
@Component
@Order(1)
@ConditionalOnProperty(name = "accounts.store.verify-on-startup", havingValue = "true", matchIfMissing = true)
public class StoreStartupCheck implements ApplicationRunner {

    private static final Logger logger = LoggerFactory.getLogger(StoreStartupCheck.class);

    static final String RELEASE_VERSION_QUERY = "SELECT release_version FROM system.local";

    private final ReactiveCassandraOperations operations;
    private final CassandraProperties cassandraProperties;
    private final AccountProperties accountProperties;

    public StoreStartupCheck(ReactiveCassandraOperations operations,
                             CassandraProperties cassandraProperties,
                             AccountProperties accountProperties) {
        this.operations = operations;
        this.cassandraProperties = cassandraProperties;
        this.accountProperties = accountProperties;
    }

    @Override
    public void run(ApplicationArguments args) {
        List<String> contactPoints = cassandraProperties.getContactPoints();
        logger.info("Checking account store: contactPoints={}, keyspace={}",
                contactPoints, cassandraProperties.getKeyspaceName());
        try {
            String version = operations.getReactiveCqlOperations()
                    .queryForObject(RELEASE_VERSION_QUERY, String.class)
                    .block(accountProperties.store().startupTimeout());
            logger.info("Account store reachable: Cassandra {}", version);
        } catch (RuntimeException e) {
            logger.error("Account store unreachable: contactPoints={}", contactPoints, e);
            throw new IllegalStateException("Account store unreachable", e);
        }
    }
}
