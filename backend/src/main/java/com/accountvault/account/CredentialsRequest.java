package com.accountvault.account;

import com.fasterxml.jackson.annotation.JsonAlias;

/**
 * Body of signup and login. The original frontend posts {@code username}/{@code password}.
 */
public record CredentialsRequest(
        @JsonAlias("username") String identity,
        @JsonAlias("password") String secret
) {}
