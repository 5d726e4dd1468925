package com.accountvault;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class AccountVaultApplication {

    public static void main(String[] args) {
        SpringApplication.run(AccountVaultApplication.class, args);
    }
}
