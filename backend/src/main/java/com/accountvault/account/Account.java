package com.accountvault.account;

import org.springframework.data.cassandra.core.mapping.Column;
import org.springframework.data.cassandra.core.mapping.PrimaryKey;
import org.springframework.data.cassandra.core.mapping.Table;

import java.time.Instant;

/**
 * A registered account.
 * The identity is the partition key, so one row exists per identity and the
 * store itself rejects a second insert of the same key under {@code IF NOT EXISTS}.
 * Only the BCrypt hash of the secret is ever stored.
 */
@Table("accounts")
public class Account {

    @PrimaryKey
    public String identity; // e.g., "ann@example.com"

    /** BCrypt hash of the current secret. Never empty once the row exists. */
    @Column("credential_hash")
    public String credentialHash;

    @Column("display_name")
    public String displayName;

    @Column("full_name")
    public String fullName;

    /** Kept as the literal "YYYY-MM-DD" the client sent; never parsed. */
    @Column("date_of_birth")
    public String dateOfBirth;

    /** "male", "female", "nonbinary" or "unspecified". */
    @Column("gender")
    public String gender;

    @Column("avatar_type")
    public String avatarType;

    @Column("company")
    public String company;

    @Column("university")
    public String university;

    @Column("profession")
    public String profession;

    @Column("profile_completed")
    public boolean profileCompleted;

    @Column("created_at")
    public Instant createdAt;

    @Column("updated_at")
    public Instant updatedAt;

    /** A fresh account: no profile fields, profile not completed. */
    public static Account create(String identity, String credentialHash) {
        Account account = new Account();
        account.identity = identity;
        account.credentialHash = credentialHash;
        account.profileCompleted = false;
        return account;
    }
}
