package com.knowledgecenter.backend.modules.rbac.application;

import java.util.List;

import com.knowledgecenter.backend.modules.auth.application.IdentityStore;
import com.knowledgecenter.backend.modules.rbac.domain.PermissionRule;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

/**
 * Fills the permission table from the identity store, at startup and on demand.
 */
@Service
public class PermissionService {

    private static final Logger log = LoggerFactory.getLogger(PermissionService.class);

    private final IdentityStore identityStore;
    private final PermissionTable permissionTable;

    public PermissionService(IdentityStore identityStore, PermissionTable permissionTable) {
        this.identityStore = identityStore;
        this.permissionTable = permissionTable;
    }

    /**
     * Replaces the table with the stored rules. On failure the previous table stays in place.
     *
     * @return number of rules loaded
     */
    public int reload() {
        List<PermissionRule> rules = identityStore.findAllPermissionRules();
        permissionTable.load(rules);
        log.info("Loaded {} API permission rules", rules.size());
        return rules.size();
    }

    @EventListener(ApplicationReadyEvent.class)
    public void loadOnStartup() {
        try {
            reload();
        } catch (DataAccessException ex) {
            log.warn("Failed to load API permissions at startup; all routes stay open until the next refresh", ex);
        }
    }
}
