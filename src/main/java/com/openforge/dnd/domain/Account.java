package com.openforge.dnd.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.Setter;

import java.time.LocalDateTime;

/**
 * A login account.
 *
 * The username is case-sensitive and never changes after insertion. The password is kept
 * only as an Argon2id PHC string; do not log it.
 */
@Getter
@Setter
@Entity
@Table(name = "accounts")
public class Account extends BaseEntity {

    @Column(nullable = false, length = 64, unique = true, updatable = false)
    private String username;

    @Column(name = "password_hash", nullable = false, length = 255)
    private String passwordHash;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private Role role = Role.USER;

    @Column(name = "last_login_time")
    private LocalDateTime lastLoginTime;

    /**
     * Roles known to the server, ordered from least to most powerful.
     */
    public enum Role {
        USER,
        ROOT;

        /** Spring Security authority name, e.g. {@code ROLE_ROOT}. */
        public String authority() {
            return "ROLE_" + name();
        }
    }

    @Override
    public String toString() {
        return "Account(username=" + username + ", role=" + role + ")";
    }
}
