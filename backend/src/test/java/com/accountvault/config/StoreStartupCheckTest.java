package com.accountvault.config;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.boot.DefaultApplicationArguments;
import org.springframework.boot.autoconfigure.cassandra.CassandraProperties;
import org.springframework.data.cassandra.core.ReactiveCassandraOperations;
import org.springframework.data.cassandra.core.cql.ReactiveCqlOperations;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class StoreStartupCheckTest {

    @Mock
    private ReactiveCassandraOperations operations;

    @Mock
    private ReactiveCqlOperations cqlOperations;

    private final CassandraProperties cassandraProperties = new CassandraProperties();

    private StoreStartupCheck check;

    @BeforeEach
    void setup() {
        AccountProperties accountProperties = new AccountProperties(
                new AccountProperties.Password(4),
                new AccountProperties.Store(true, Duration.ofSeconds(1)),
                new AccountProperties.Cors(List.of("*")));
        check = new StoreStartupCheck(operations, cassandraProperties, accountProperties);
    }

    @Test
    void run_reachableStore_shouldPass() {
        cassandraProperties.setContactPoints(List.of("db-1:9042"));
        when(operations.getReactiveCqlOperations()).thenReturn(cqlOperations);
        when(cqlOperations.queryForObject(StoreStartupCheck.RELEASE_VERSION_QUERY, String.class))
                .thenReturn(Mono.just("4.1.3"));

        assertDoesNotThrow(() -> check.run(new DefaultApplicationArguments()));
    }

    @Test
    void run_unreachableStore_shouldAbort() {
        cassandraProperties.setContactPoints(List.of("db-1:9042"));
        when(operations.getReactiveCqlOperations()).thenReturn(cqlOperations);
        when(cqlOperations.queryForObject(StoreStartupCheck.RELEASE_VERSION_QUERY, String.class))
                .thenReturn(Mono.error(new IllegalStateException("All host(s) tried for query failed")));

        IllegalStateException ex = assertThrows(IllegalStateException.class,
                () -> check.run(new DefaultApplicationArguments()));
        assertEquals("Account store unreachable", ex.getMessage());
        assertNotNull(ex.getCause());
    }
}
