package com.accountvault.account;

/**
 * A required request field is missing or blank.
 */
public class InvalidInputException extends AccountException {
    public InvalidInputException(String message) {
        super(message);
    }
}
