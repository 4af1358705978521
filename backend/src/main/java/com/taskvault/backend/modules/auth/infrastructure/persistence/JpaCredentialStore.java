package com.taskvault.backend.modules.auth.infrastructure.persistence;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.Optional;
import java.util.UUID;

import com.taskvault.backend.global.error.ErrorKind;
import com.taskvault.backend.global.error.ProblemException;
import com.taskvault.backend.global.error.RetryableProblemException;
import com.taskvault.backend.modules.auth.application.CredentialStore;
import com.taskvault.backend.modules.auth.domain.AppUser;
import com.taskvault.backend.modules.auth.domain.UserRole;

import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

@Component
public class JpaCredentialStore implements CredentialStore {

    static final String STORE_NAME = "Credential store";

    private final AppUserRepository appUserRepository;
    private final Clock clock;

    public JpaCredentialStore(AppUserRepository appUserRepository, Clock clock) {
        this.appUserRepository = appUserRepository;
        this.clock = clock;
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<AppUser> findByEmail(String normalizedEmail) {
        try {
            return appUserRepository.findByEmailIgnoreCase(normalizedEmail);
        } catch (DataAccessResourceFailureException | TransientDataAccessException ex) {
            throw RetryableProblemException.storeUnavailable(STORE_NAME, ex);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<AppUser> findById(UUID userId) {
        try {
            return appUserRepository.findById(userId);
        } catch (DataAccessResourceFailureException | TransientDataAccessException ex) {
            throw RetryableProblemException.storeUnavailable(STORE_NAME, ex);
        }
    }

    @Override
    @Transactional
    public AppUser insert(String normalizedEmail, String passwordHash, UserRole role) {
        AppUser user = new AppUser();
        user.setEmail(normalizedEmail);
        user.setPasswordHash(passwordHash);
        user.setRole(role);
        user.setActive(true);
        try {
            return appUserRepository.saveAndFlush(user);
        } catch (DataIntegrityViolationException ex) {
            // lost the race against a concurrent registration; the unique index decided
            throw new ProblemException(ErrorKind.DUPLICATE_RESOURCE, "EMAIL_ALREADY_REGISTERED",
                    "Email already exists", ex);
        } catch (DataAccessResourceFailureException | TransientDataAccessException ex) {
            throw RetryableProblemException.storeUnavailable(STORE_NAME, ex);
        }
    }

    @Override
    @Transactional
    public boolean updatePassword(UUID userId, String passwordHash) {
        try {
            return appUserRepository.updatePasswordHash(userId, passwordHash, OffsetDateTime.now(clock)) > 0;
        } catch (DataAccessResourceFailureException | TransientDataAccessException ex) {
            throw RetryableProblemException.storeUnavailable(STORE_NAME, ex);
        }
    }

    @Override
    @Transactional
    public boolean setActive(UUID userId, boolean active) {
        OffsetDateTime now = OffsetDateTime.now(clock);
        try {
            return appUserRepository.updateActive(userId, active, active ? null : now, now) > 0;
        } catch (DataAccessResourceFailureException | TransientDataAccessException ex) {
            throw RetryableProblemException.storeUnavailable(STORE_NAME, ex);
        }
    }
}
