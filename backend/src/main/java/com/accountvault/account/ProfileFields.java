package com.accountvault.account;

/**
 * The whitelisted, client-editable profile fields. A null member means
 * "not supplied" and clears the stored value on update.
 */
public record ProfileFields(
        String displayName,
        String fullName,
        String dateOfBirth,   // "YYYY-MM-DD", stored verbatim
        String gender,
        String avatarType,    // mirrors gender on the current frontend
        String company,
        String university,
        String profession
) {}
