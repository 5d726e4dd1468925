package com.accountvault.account;

/**
 * What a client may see of an account. Unset fields read as empty strings,
 * an unset gender reads as {@value #UNSPECIFIED_GENDER}. The credential hash
 * has no member here, so it cannot leak through serialization.
 */
public record ProfileView(
        String identity,
        String displayName,
        String fullName,
        String dateOfBirth,
        String gender,
        String avatarType,
        String company,
        String university,
        String profession,
        boolean profileCompleted
) {

    public static final String UNSPECIFIED_GENDER = "unspecified";

    public static ProfileView of(Account account) {
        return new ProfileView(
                account.identity,
                orEmpty(account.displayName),
                orEmpty(account.fullName),
                orEmpty(account.dateOfBirth),
                account.gender == null || account.gender.isEmpty() ? UNSPECIFIED_GENDER : account.gender,
                orEmpty(account.avatarType),
                orEmpty(account.company),
                orEmpty(account.university),
                orEmpty(account.profession),
                account.profileCompleted
        );
    }

    private static String orEmpty(String value) {
        return value == null ? "" : value;
    }
}
