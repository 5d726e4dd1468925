package com.accountvault.account;

import com.fasterxml.jackson.annotation.JsonAlias;

public record ChangePasswordRequest(
        @JsonAlias("username") String identity,
        String currentSecret,
        String newSecret
) {}
