package com.skilllens.readiness.catalog;

import com.skilllens.readiness.domain.DomainModels.RoleRequirement;

import java.util.List;

public interface RoleRequirementProvider {
    List<RoleRequirement> loadRoles();
}
