package com.accountvault.account;

/**
 * No account matches the identity.
 */
public class AccountNotFoundException extends AccountException {
    public AccountNotFoundException() {
        super("User not found");
    }
}
