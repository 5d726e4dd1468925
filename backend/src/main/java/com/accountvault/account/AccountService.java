package com.accountvault.account;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.nio.charset.StandardCharsets;

/**
 * Credential and profile management.
 *
 * <p>Every operation is one stateless request against the store. The service holds no
 * locks: check-then-write sequences (exists-then-insert on signup, verify-then-update on
 * password change) are not atomic here, and the store's lightweight transactions are the
 * only guard against concurrent writers. Hashing is CPU-bound, so it runs on the
 * bounded-elastic scheduler instead of the event loop.
 */
@Service
public class AccountService {

    private static final Logger logger = LoggerFactory.getLogger(AccountService.class);

    /** BCrypt only reads the first 72 bytes of a secret; the encoder refuses longer ones. */
    static final int MAX_SECRET_BYTES = 72;

    static final String SECRET_TOO_LONG = "Password must be at most " + MAX_SECRET_BYTES + " bytes";

    private final AccountRepository accountRepository;
    private final PasswordEncoder passwordEncoder;

    public AccountService(AccountRepository accountRepository, PasswordEncoder passwordEncoder) {
        this.accountRepository = accountRepository;
        this.passwordEncoder = passwordEncoder;
    }

    /**
     * Creates an account with an empty profile. A taken identity fails with
     * {@link AccountConflictException}, whether the existence lookup sees it or the
     * {@code IF NOT EXISTS} insert loses a race.
     */
    public Mono<Void> register(String identity, String secret) {
        if (!StringUtils.hasText(identity) || !StringUtils.hasText(secret)) {
            return Mono.error(new InvalidInputException("Missing username or password"));
        }
        if (tooLong(secret)) {
            return Mono.error(new InvalidInputException(SECRET_TOO_LONG));
        }
        return accountRepository.existsById(identity)
                .flatMap(exists -> {
                    if (exists) {
                        logger.warn("Registration rejected - identity already exists: {}", identity);
                        return Mono.<String>error(new AccountConflictException());
                    }
                    return hash(secret);
                })
                .flatMap(credentialHash -> accountRepository.insertIfAbsent(Account.create(identity, credentialHash)))
                .flatMap(inserted -> {
                    if (!inserted) {
                        logger.warn("Registration rejected - identity claimed concurrently: {}", identity);
                        return Mono.<Void>error(new AccountConflictException());
                    }
                    logger.info("Account registered: identity={}", identity);
                    return Mono.<Void>empty();
                });
    }

    /**
     * Verifies a secret. Completes empty on success; no token or session is issued.
     */
    public Mono<Void> authenticate(String identity, String secret) {
        if (!StringUtils.hasText(identity) || !StringUtils.hasText(secret)) {
            return Mono.error(new InvalidInputException("Missing username or password"));
        }
        return accountRepository.findById(identity)
                .switchIfEmpty(Mono.defer(() -> {
                    logger.warn("Login failed - unknown identity: {}", identity);
                    return Mono.error(new InvalidCredentialsException());
                }))
                .flatMap(account -> verify(secret, account.credentialHash))
                .flatMap(matches -> {
                    if (!matches) {
                        logger.warn("Login failed - wrong secret: identity={}", identity);
                        return Mono.<Void>error(new InvalidCredentialsException());
                    }
                    logger.info("Login successful: identity={}", identity);
                    return Mono.<Void>empty();
                });
    }

    public Mono<ProfileView> getProfile(String identity) {
        if (!StringUtils.hasText(identity)) {
            return Mono.error(new InvalidInputException("Missing username (email)"));
        }
        return accountRepository.findById(identity)
                .switchIfEmpty(Mono.error(AccountNotFoundException::new))
                .map(ProfileView::of);
    }

    /**
     * Full replace: each whitelisted field takes the supplied value and an omitted one is
     * cleared, so callers must resend the whole profile. Marks the profile completed.
     */
    public Mono<Void> updateProfile(String identity, ProfileFields fields) {
        if (!StringUtils.hasText(identity)) {
            return Mono.error(new InvalidInputException("Missing username (email)"));
        }
        return accountRepository.replaceProfile(identity, fields)
                .flatMap(applied -> {
                    if (!applied) {
                        logger.warn("Profile update failed - account not found: {}", identity);
                        return Mono.<Void>error(new AccountNotFoundException());
                    }
                    logger.info("Profile updated: identity={}", identity);
                    return Mono.<Void>empty();
                });
    }

    /**
     * Replaces the credential hash after verifying the current secret. Prior hashes are
     * not kept.
     */
    public Mono<Void> changePassword(String identity, String currentSecret, String newSecret) {
        if (!StringUtils.hasText(identity) || !StringUtils.hasText(currentSecret)
                || !StringUtils.hasText(newSecret)) {
            return Mono.error(new InvalidInputException("Missing username, current password or new password"));
        }
        if (tooLong(newSecret)) {
            return Mono.error(new InvalidInputException(SECRET_TOO_LONG));
        }
        return accountRepository.findById(identity)
                .switchIfEmpty(Mono.error(AccountNotFoundException::new))
                .flatMap(account -> verify(currentSecret, account.credentialHash))
                .flatMap(matches -> {
                    if (!matches) {
                        logger.warn("Password change rejected - wrong current secret: identity={}", identity);
                        return Mono.<String>error(new InvalidCredentialsException());
                    }
                    return hash(newSecret);
                })
                .flatMap(credentialHash -> accountRepository.replaceCredentialHash(identity, credentialHash))
                .flatMap(applied -> {
                    if (!applied) {
                        return Mono.<Void>error(new AccountNotFoundException());
                    }
                    logger.info("Password changed: identity={}", identity);
                    return Mono.<Void>empty();
                });
    }

    private static boolean tooLong(String secret) {
        return secret.getBytes(StandardCharsets.UTF_8).length > MAX_SECRET_BYTES;
    }

    private Mono<String> hash(String secret) {
        return Mono.fromCallable(() -> passwordEncoder.encode(secret))
                .subscribeOn(Schedulers.boundedElastic());
    }

    private Mono<Boolean> verify(String secret, String credentialHash) {
        return Mono.fromCallable(() -> passwordEncoder.matches(secret, credentialHash))
                .subscribeOn(Schedulers.boundedElastic());
    }
}
