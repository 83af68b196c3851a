package com.openforge.dnd.bootstrap;

import com.fasterxml.jackson.core.JacksonException;
import com.fasterxml.jackson.dataformat.toml.TomlMapper;
import com.openforge.dnd.account.AccountConflictException;
import com.openforge.dnd.account.CredentialStore;
import com.openforge.dnd.account.StorageUnavailableException;
import com.openforge.dnd.auth.PasswordHasher;
import com.openforge.dnd.domain.Account.Role;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.SmartInitializingSingleton;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermission;
import java.util.Set;

/**
 * Seeds the root account on first start.
 *
 * Runs once all singletons exist but before the web server starts, so a failure here
 * aborts startup before any connection is accepted. If a ROOT account is already stored
 * the descriptor is not needed and its absence is only a warning.
 */
@Slf4j
@Component
public class RootCredentialLoader implements SmartInitializingSingleton {

    public static final String ROOT_NAME = "root";

    public enum Outcome {
        CREATED,
        ALREADY_PRESENT
    }

    private final CredentialStore     credentialStore;
    private final PasswordHasher      passwordHasher;
    private final TomlMapper          tomlMapper;
    private final BootstrapProperties props;

    public RootCredentialLoader(CredentialStore credentialStore,
                                PasswordHasher passwordHasher,
                                TomlMapper tomlMapper,
                                BootstrapProperties props) {
        this.credentialStore = credentialStore;
        this.passwordHasher  = passwordHasher;
        this.tomlMapper      = tomlMapper;
        this.props           = props;
    }

    @Override
    public void afterSingletonsInstantiated() {
        bootstrap();
    }

    /**
     * Create the root account from the descriptor unless one exists already.
     *
     * @throws BootstrapException if no root account exists and the descriptor is missing,
     *                            unreadable or malformed, or the account cannot be stored
     */
    public Outcome bootstrap() {
        Path path = props.descriptorPath();

        boolean rootPresent;
        try {
            rootPresent = credentialStore.existsWithRole(Role.ROOT);
        } catch (StorageUnavailableException e) {
            throw new BootstrapException("Cannot check for an existing root account", e);
        }

        if (rootPresent) {
            if (!Files.isReadable(path)) {
                log.warn("[Bootstrap] Root descriptor '{}' is missing or unreadable; root account already exists, continuing", path);
            } else {
                log.info("[Bootstrap] Root account already exists, ignoring descriptor '{}'", path);
            }
            return Outcome.ALREADY_PRESENT;
        }

        RootCredentialDescriptor.Credentials credentials = read(path);
        if (!ROOT_NAME.equals(credentials.name())) {
            log.warn("[Bootstrap] Descriptor names root user '{}' instead of '{}'", credentials.name(), ROOT_NAME);
        }
        warnIfExposed(path);

        try {
            credentialStore.createAccount(credentials.name(), passwordHasher.hash(credentials.pass()), Role.ROOT);
        } catch (AccountConflictException e) {
            throw new BootstrapException("Account '" + credentials.name() + "' exists but is not a root account", e);
        } catch (StorageUnavailableException e) {
            throw new BootstrapException("Failed to store root account '" + credentials.name() + "'", e);
        }
        log.info("[Bootstrap] Created root account '{}' from '{}'", credentials.name(), path);

        if (props.deleteDescriptorAfterUse()) {
            deleteDescriptor(path);
        } else {
            log.warn("[Bootstrap] '{}' holds a plaintext password and is no longer needed; delete it", path);
        }
        return Outcome.CREATED;
    }

    // ── Helpers ──────────────────────────────────────────────────────────────

    private RootCredentialDescriptor.Credentials read(Path path) {
        RootCredentialDescriptor descriptor;
        try {
            descriptor = tomlMapper.readValue(path.toFile(), RootCredentialDescriptor.class);
        } catch (JacksonException e) {
            throw new BootstrapException("Root descriptor '" + path + "' is not valid TOML: " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new BootstrapException("Cannot read root descriptor '" + path + "' and no root account exists", e);
        }

        if (descriptor == null || descriptor.credentials() == null) {
            throw new BootstrapException("Root descriptor '" + path + "' has no [credentials] table");
        }
        RootCredentialDescriptor.Credentials credentials = descriptor.credentials();
        if (credentials.name() == null || credentials.name().isBlank()) {
            throw new BootstrapException("Root descriptor '" + path + "' has no credentials.name");
        }
        if (credentials.pass() == null || credentials.pass().isBlank()) {
            throw new BootstrapException("Root descriptor '" + path + "' has no credentials.pass");
        }
        return credentials;
    }

    private static void warnIfExposed(Path path) {
        try {
            Set<PosixFilePermission> perms = Files.getPosixFilePermissions(path);
            if (perms.contains(PosixFilePermission.GROUP_READ) || perms.contains(PosixFilePermission.OTHERS_READ)) {
                log.warn("[Bootstrap] Root descriptor '{}' is readable by other users; restrict it to the owner (chmod 600)", path);
            }
        } catch (UnsupportedOperationException | IOException e) {
            log.debug("[Bootstrap] Cannot inspect permissions of '{}': {}", path, e.getMessage());
        }
    }

    private static void deleteDescriptor(Path path) {
        try {
            Files.deleteIfExists(path);
            log.info("[Bootstrap] Deleted root descriptor '{}'", path);
        } catch (IOException e) {
            log.warn("[Bootstrap] Could not delete root descriptor '{}'", path, e);
        }
    }
}
