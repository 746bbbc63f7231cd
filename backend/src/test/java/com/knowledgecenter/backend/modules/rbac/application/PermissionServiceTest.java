package com.knowledgecenter.backend.modules.rbac.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.when;

import java.util.List;
import java.util.Set;

import com.knowledgecenter.backend.modules.auth.application.IdentityStore;
import com.knowledgecenter.backend.modules.rbac.domain.PermissionRule;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

@ExtendWith(MockitoExtension.class)
class PermissionServiceTest {

    @Mock
    private IdentityStore identityStore;

    private final PermissionTable table = new PermissionTable();

    @Test
    void reloadLoadsStoredRules() {
        when(identityStore.findAllPermissionRules()).thenReturn(List.of(
                new PermissionRule(1, "GET", "/users", List.of("user"))));
        PermissionService service = new PermissionService(identityStore, table);

        assertThat(service.reload()).isEqualTo(1);
        assertThat(table.findRequiredRoles("GET", "/users")).contains(Set.of("user"));
    }

    @Test
    void failedReloadKeepsThePreviousTable() {
        table.load(List.of(new PermissionRule(1, "GET", "/users", List.of("user"))));
        when(identityStore.findAllPermissionRules()).thenThrow(new DataAccessResourceFailureException("down"));
        PermissionService service = new PermissionService(identityStore, table);

        assertThatThrownBy(service::reload).isInstanceOf(DataAccessResourceFailureException.class);
        assertThat(table.findRequiredRoles("GET", "/users")).contains(Set.of("user"));
    }

    @Test
    void startupLoadSurvivesStoreFailure() {
        when(identityStore.findAllPermissionRules()).thenThrow(new DataAccessResourceFailureException("down"));
        PermissionService service = new PermissionService(identityStore, table);

        service.loadOnStartup();

        assertThat(table.size()).isZero();
    }
}
