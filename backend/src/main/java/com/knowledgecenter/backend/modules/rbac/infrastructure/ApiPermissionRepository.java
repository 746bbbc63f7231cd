package com.knowledgecenter.backend.modules.rbac.infrastructure;

import java.util.List;

import org.springframework.data.jpa.repository.JpaRepository;

public interface ApiPermissionRepository extends JpaRepository<ApiPermissionEntity, Long> {

    List<ApiPermissionEntity> findAllByOrderByIdAsc();
}
