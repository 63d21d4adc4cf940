package com.skilllens.readiness.error;

public class UnknownSkillException extends ReadinessException {
    public UnknownSkillException(String skill) {
        super("UNKNOWN_SKILL", "No skill registered with name: '" + skill + "'");
    }
}
