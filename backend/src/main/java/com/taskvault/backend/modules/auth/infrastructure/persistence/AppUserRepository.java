package com.taskvault.backend.modules.auth.infrastructure.persistence;

import java.time.OffsetDateTime;
import java.util.Optional;
import java.util.UUID;

import com.taskvault.backend.modules.auth.domain.AppUser;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface AppUserRepository extends JpaRepository<AppUser, UUID> {

    @Query("select u from AppUser u where lower(u.email) = lower(:email)")
    Optional<AppUser> findByEmailIgnoreCase(@Param("email") String email);

    @Modifying(clearAutomatically = true)
    @Query("""
            update AppUser u
               set u.passwordHash = :passwordHash,
                   u.updatedAt = :now
             where u.id = :userId
            """)
    int updatePasswordHash(@Param("userId") UUID userId,
                           @Param("passwordHash") String passwordHash,
                           @Param("now") OffsetDateTime now);

    @Modifying(clearAutomatically = true)
    @Query("""
            update AppUser u
               set u.active = :active,
                   u.deactivatedAt = :deactivatedAt,
                   u.updatedAt = :now
             where u.id = :userId
            """)
    int updateActive(@Param("userId") UUID userId,
                     @Param("active") boolean active,
                     @Param("deactivatedAt") OffsetDateTime deactivatedAt,
                     @Param("now") OffsetDateTime now);
}
