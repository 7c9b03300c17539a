package com.walkerbrain.portal.modules.auth.infrastructure.persistence;

import java.util.Optional;
import java.util.UUID;

import com.walkerbrain.portal.modules.auth.domain.AppUser;

import org.springframework.data.jpa.repository.JpaRepository;

public interface AppUserRepository extends JpaRepository<AppUser, UUID> {

    Optional<AppUser> findByEmailIgnoreCase(String email);

    boolean existsByEmailIgnoreCase(String email);
}
