package com.accountvault.web;

import com.accountvault.account.ProfileView;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * The JSON envelope of every API response. Null members are left out of the body.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ApiResponse(
        boolean success,
        String message,
        ProfileView profile
) {

    public static ApiResponse ok() {
        return new ApiResponse(true, null, null);
    }

    public static ApiResponse ok(ProfileView profile) {
        return new ApiResponse(true, null, profile);
    }

    public static ApiResponse failure(String message) {
        return new ApiResponse(false, message, null);
    }
}
