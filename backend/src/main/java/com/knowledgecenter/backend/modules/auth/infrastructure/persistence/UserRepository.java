package com.knowledgecenter.backend.modules.auth.infrastructure.persistence;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import org.springframework.data.jpa.repository.JpaRepository;

public interface UserRepository extends JpaRepository<UserEntity, Long> {

    Optional<UserEntity> findByLoginIdAndDeletedFalse(String loginId);

    Optional<UserEntity> findByEmailAndDeletedFalse(String email);

    Optional<UserEntity> findByIdAndDeletedFalse(Long id);

    Optional<UserEntity> findByPublicIdAndDeletedFalse(UUID publicId);

    List<UserEntity> findByPublicIdInAndDeletedFalse(Collection<UUID> publicIds);
}
