package com.walkerbrain.portal.modules.auth.infrastructure.persistence;

import java.time.OffsetDateTime;
import java.util.Optional;
import java.util.UUID;

import com.walkerbrain.portal.modules.auth.domain.UserSession;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface UserSessionRepository extends JpaRepository<UserSession, UUID> {

    @Query("""
            select us
              from UserSession us
              join fetch us.user u
             where us.tokenHash = :tokenHash
            """)
    Optional<UserSession> findByTokenHash(@Param("tokenHash") String tokenHash);

    @Modifying
    @Query("delete from UserSession us where us.tokenHash = :tokenHash")
    int deleteByTokenHash(@Param("tokenHash") String tokenHash);

    @Modifying
    @Query("delete from UserSession us where us.expiresAt <= :now")
    int deleteExpired(@Param("now") OffsetDateTime now);

    @Modifying
    @Query("delete from UserSession us where us.user.id = :userId and us.expiresAt <= :now")
    int deleteExpiredForUser(@Param("userId") UUID userId, @Param("now") OffsetDateTime now);
}
