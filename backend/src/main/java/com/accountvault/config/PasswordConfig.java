package com.accountvault.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;

@Configuration
public class PasswordConfig {

    private static final Logger logger = LoggerFactory.getLogger(PasswordConfig.class);

    @Bean
    public PasswordEncoder passwordEncoder(AccountProperties properties) {
        int cost = properties.password().cost();
        logger.info("Hashing secrets with BCrypt: cost={}", cost);
        return new BCryptPasswordEncoder(cost);
    }
}
