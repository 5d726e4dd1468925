package com.accountvault;

import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ContextConfiguration;
import org.testcontainers.junit.jupiter.Testcontainers;

/**
 * Boots the full application against a real Cassandra, so the startup store check runs.
 */
@SpringBootTest
@Testcontainers(disabledWithoutDocker = true)
@ContextConfiguration(initializers = CassandraContainerInitializer.class)
class AccountVaultApplicationTests {

	@Test
	void contextLoads() {
	}

}
