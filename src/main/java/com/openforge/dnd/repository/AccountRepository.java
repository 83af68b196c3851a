package com.openforge.dnd.repository;

import com.openforge.dnd.domain.Account;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

/**
 * Raw table access. Only {@link com.openforge.dnd.account.CredentialStore} may use this.
 */
@Repository
public interface AccountRepository extends JpaRepository<Account, Long> {

    boolean existsByUsername(String username);

    Optional<Account> findByUsername(String username);

    boolean existsByRole(Account.Role role);
}
