package com.accountvault.account;

/**
 * Base of the expected account failures. Anything that is not an
 * {@code AccountException} is treated as a server error.
 */
public abstract class AccountException extends RuntimeException {

    protected AccountException(String message) {
        super(message);
    }
}
