package com.accountvault.account;

/**
 * The identity is already registered.
 */
public class AccountConflictException extends AccountException {
    public AccountConflictException() {
        super("Username already exists");
    }
}
