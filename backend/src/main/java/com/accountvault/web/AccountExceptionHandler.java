package com.accountvault.web;

import com.accountvault.account.AccountConflictException;
import com.accountvault.account.AccountNotFoundException;
import com.accountvault.account.InvalidCredentialsException;
import com.accountvault.account.InvalidInputException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.server.ServerWebInputException;

/**
 * Maps failures to HTTP statuses. Expected account failures carry their own message;
 * anything else is logged here and answered with a generic 500.
 */
@RestControllerAdvice
public class AccountExceptionHandler {

    private static final Logger logger = LoggerFactory.getLogger(AccountExceptionHandler.class);

    static final String SERVER_ERROR = "Server error";

    @ExceptionHandler(InvalidInputException.class)
    public ResponseEntity<ApiResponse> handleInvalidInput(InvalidInputException e) {
        return respond(HttpStatus.BAD_REQUEST, e.getMessage());
    }

    @ExceptionHandler(AccountConflictException.class)
    public ResponseEntity<ApiResponse> handleConflict(AccountConflictException e) {
        return respond(HttpStatus.CONFLICT, e.getMessage());
    }

    @ExceptionHandler(AccountNotFoundException.class)
    public ResponseEntity<ApiResponse> handleNotFound(AccountNotFoundException e) {
        return respond(HttpStatus.NOT_FOUND, e.getMessage());
    }

    /**
     * Login turns this into a soft failure itself; reaching here means a password change
     * whose current secret did not verify.
     */
    @ExceptionHandler(InvalidCredentialsException.class)
    public ResponseEntity<ApiResponse> handleInvalidCredentials(InvalidCredentialsException e) {
        return respond(HttpStatus.BAD_REQUEST, e.getMessage());
    }

    /**
     * Missing or unreadable request body.
     */
    @ExceptionHandler(ServerWebInputException.class)
    public ResponseEntity<ApiResponse> handleUnreadableInput(ServerWebInputException e) {
        logger.warn("Rejected malformed request: {}", e.getReason());
        return respond(HttpStatus.BAD_REQUEST, "Malformed request");
    }

    /**
     * Framework-level statuses such as unknown routes and unsupported methods.
     */
    @ExceptionHandler(ResponseStatusException.class)
    public ResponseEntity<ApiResponse> handleResponseStatus(ResponseStatusException e) {
        HttpStatus status = HttpStatus.resolve(e.getStatusCode().value());
        return respond(e.getStatusCode().value(),
                status != null ? status.getReasonPhrase() : SERVER_ERROR);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiResponse> handleUnexpected(Exception e) {
        logger.error("Unexpected failure: {}", e.getMessage(), e);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, SERVER_ERROR);
    }

    private static ResponseEntity<ApiResponse> respond(HttpStatus status, String message) {
        return respond(status.value(), message);
    }

    private static ResponseEntity<ApiResponse> respond(int status, String message) {
        return ResponseEntity.status(status).body(ApiResponse.failure(message));
    }
}
