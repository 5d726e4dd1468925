package com.accountvault.account;

/**
 * The secret did not verify. Unknown identities raise this too, with the same
 * message, so a caller cannot probe which accounts exist.
 */
public class InvalidCredentialsException extends AccountException {

    public static final String MESSAGE = "Invalid username or password";

    public InvalidCredentialsException() {
        super(MESSAGE);
    }
}
