package com.accountvault.account;

import com.fasterxml.jackson.annotation.JsonAlias;

/**
 * Body of a profile update. Keys outside the whitelist are dropped by Jackson
 * before they reach the service; omitted whitelisted keys arrive as null.
 */
public record UpdateProfileRequest(
        @JsonAlias("username") String identity,
        String displayName,
        String fullName,
        String dateOfBirth,
        String gender,
        String avatarType,
        String company,
        String university,
        String profession
) {

    public ProfileFields fields() {
        return new ProfileFields(displayName, fullName, dateOfBirth, gender, avatarType,
                company, university, profession);
    }
}
