package com.accountvault.account;

import com.accountvault.web.ApiResponse;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/api")
public class AccountController {

    private final AccountService accountService;

    public AccountController(AccountService accountService) {
        this.accountService = accountService;
    }

    @PostMapping("/signup")
    @ResponseStatus(HttpStatus.CREATED)
    public Mono<ApiResponse> signUp(@RequestBody CredentialsRequest request) {
        return accountService.register(request.identity(), request.secret())
                .thenReturn(ApiResponse.ok());
    }

    /**
     * A failed verification is a 200 with {@code success:false}, the same body for an
     * unknown identity and a wrong secret.
     */
    @PostMapping("/login")
    public Mono<ApiResponse> login(@RequestBody CredentialsRequest request) {
        return accountService.authenticate(request.identity(), request.secret())
                .thenReturn(ApiResponse.ok())
                .onErrorResume(InvalidCredentialsException.class,
                        ex -> Mono.just(ApiResponse.failure(ex.getMessage())));
    }

    @GetMapping("/profile")
    public Mono<ApiResponse> getProfile(
            @RequestParam(value = "identity", required = false) String identity,
            @RequestParam(value = "username", required = false) String username) {
        return accountService.getProfile(identity != null ? identity : username)
                .map(ApiResponse::ok);
    }

    @PostMapping("/profile")
    public Mono<ApiResponse> updateProfile(@RequestBody UpdateProfileRequest request) {
        return accountService.updateProfile(request.identity(), request.fields())
                .thenReturn(ApiResponse.ok());
    }

    @PostMapping("/change-password")
    public Mono<ApiResponse> changePassword(@RequestBody ChangePasswordRequest request) {
        return accountService.changePassword(request.identity(), request.currentSecret(), request.newSecret())
                .thenReturn(ApiResponse.ok());
    }
}
