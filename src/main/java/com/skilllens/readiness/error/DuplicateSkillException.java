package com.skilllens.readiness.error;

public class DuplicateSkillException extends ReadinessException {
    public DuplicateSkillException(String skill) {
        super("DUPLICATE_SKILL", "Skill already registered: '" + skill + "'");
    }
}
