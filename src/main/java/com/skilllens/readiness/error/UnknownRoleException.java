package com.skilllens.readiness.error;

public class UnknownRoleException extends ReadinessException {
    public UnknownRoleException(String role) {
        super("UNKNOWN_ROLE", "Role '" + role + "' not found");
    }
}
