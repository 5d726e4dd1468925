package com.accountvault.config;

import com.datastax.oss.driver.api.core.CqlSession;
import org.junit.jupiter.api.Test;
import org.springframework.mock.env.MockEnvironment;

import static org.junit.jupiter.api.Assertions.*;

class StoreContactPointsGuardTest {

    @Test
    void customize_withContactPoints_shouldPass() {
        MockEnvironment environment = new MockEnvironment()
                .withProperty(StoreContactPointsGuard.CONTACT_POINTS_PROPERTY, "db-1:9042,db-2:9042");

        assertDoesNotThrow(() -> new StoreContactPointsGuard(environment).customize(CqlSession.builder()));
    }

    @Test
    void customize_withEmptyContactPoints_shouldAbortSessionBuild() {
        // What application.yml resolves to when CASSANDRA_CONTACT_POINTS is unset
        MockEnvironment environment = new MockEnvironment()
                .withProperty(StoreContactPointsGuard.CONTACT_POINTS_PROPERTY, "");

        IllegalStateException ex = assertThrows(IllegalStateException.class,
                () -> new StoreContactPointsGuard(environment).customize(CqlSession.builder()));
        assertTrue(ex.getMessage().contains("contact-points"));
    }

    @Test
    void customize_withPropertyAbsent_shouldAbortSessionBuild() {
        assertThrows(IllegalStateException.class,
                () -> new StoreContactPointsGuard(new MockEnvironment()).customize(CqlSession.builder()));
    }
}
