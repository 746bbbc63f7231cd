package com.knowledgecenter.backend.modules.auth.infrastructure.persistence;

import java.time.OffsetDateTime;
import java.util.Optional;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface UserTokenRepository extends JpaRepository<UserTokenEntity, Long> {

    Optional<UserTokenEntity> findFirstByTokenHashOrderByIdDesc(String tokenHash);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            update UserTokenEntity t
               set t.revoked = true,
                   t.updatedAt = :now
             where t.id = :tokenId
            """)
    int revokeById(@Param("tokenId") Long tokenId, @Param("now") OffsetDateTime now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            update UserTokenEntity t
               set t.revoked = true,
                   t.updatedAt = :now
             where t.user.id = :userId
               and t.revoked = false
            """)
    int revokeAllActiveByUserId(@Param("userId") Long userId, @Param("now") OffsetDateTime now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            update UserTokenEntity t
               set t.replacedByTokenId = :newTokenId,
                   t.revoked = true,
                   t.updatedAt = :now
             where t.id = :oldTokenId
            """)
    int markReplaced(@Param("oldTokenId") Long oldTokenId,
                     @Param("newTokenId") Long newTokenId,
                     @Param("now") OffsetDateTime now);
}
