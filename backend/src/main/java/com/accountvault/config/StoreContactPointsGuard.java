package com.accountvault.config;

import com.datastax.oss.driver.api.core.CqlSessionBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.cassandra.CqlSessionBuilderCustomizer;
import org.springframework.boot.context.properties.bind.Bindable;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Fails the driver session build when no contact points are configured. Without this the
 * driver silently falls back to {@code 127.0.0.1:9042}.
 */
@Component
public class StoreContactPointsGuard implements CqlSessionBuilderCustomizer {

    private static final Logger logger = LoggerFactory.getLogger(StoreContactPointsGuard.class);

    static final String CONTACT_POINTS_PROPERTY = "spring.cassandra.contact-points";

    private final Environment environment;

    public StoreContactPointsGuard(Environment environment) {
        this.environment = environment;
    }

    @Override
    public void customize(CqlSessionBuilder builder) {
        List<String> contactPoints = Binder.get(environment)
                .bind(CONTACT_POINTS_PROPERTY, Bindable.listOf(String.class))
                .orElse(List.of());
        if (contactPoints.stream().noneMatch(point -> point != null && !point.isBlank())) {
            logger.error("Account store is not configured. Set CASSANDRA_CONTACT_POINTS.");
            throw new IllegalStateException(CONTACT_POINTS_PROPERTY + " is not set");
        }
    }
}
