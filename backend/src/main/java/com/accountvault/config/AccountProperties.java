package com.accountvault.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;
import java.util.List;

/**
 * Settings under {@code accounts.*}. Store connection settings stay under Spring Boot's
 * own {@code spring.cassandra.*}.
 */
@ConfigurationProperties("accounts")
public record AccountProperties(
        @DefaultValue Password password,
        @DefaultValue Store store,
        @DefaultValue Cors cors
) {

    /**
     * @param cost BCrypt log rounds, 4 to 31
     */
    public record Password(@DefaultValue("10") int cost) {
        public Password {
            if (cost < 4 || cost > 31) {
                throw new IllegalArgumentException("accounts.password.cost must be between 4 and 31, was " + cost);
            }
        }
    }

    /**
     * @param verifyOnStartup query the store once at startup and abort if it does not answer
     * @param startupTimeout  how long that query may take
     */
    public record Store(
            @DefaultValue("true") boolean verifyOnStartup,
            @DefaultValue("30s") Duration startupTimeout
    ) {}

    public record Cors(@DefaultValue("*") List<String> allowedOrigins) {}
}
