package com.skilllens.readiness.catalog;

import com.skilllens.readiness.domain.DomainModels.RoleRequirement;
import com.skilllens.readiness.error.UnknownRoleException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

@Service
public class RoleCatalogService {
    private static final Logger log = LoggerFactory.getLogger(RoleCatalogService.class);

    private final RoleRequirementProvider provider;
    private final Map<String, RoleRequirement> roles = new ConcurrentHashMap<>();

    public RoleCatalogService(RoleRequirementProvider provider) {
        this.provider = provider;
        reload();
    }

    public void reload() {
        List<RoleRequirement> loaded = provider.loadRoles();
        loaded.forEach(r -> roles.put(r.title(), r));
        roles.keySet().retainAll(loaded.stream().map(RoleRequirement::title).toList());
        log.info("Loaded {} role requirements", loaded.size());
    }

    public RoleRequirement role(String title) {
        RoleRequirement role = title == null ? null : roles.get(title);
        if (role == null) {
            throw new UnknownRoleException(title);
        }
        return role;
    }

    public List<String> titles() {
        return roles.keySet().stream().sorted().toList();
    }
}
