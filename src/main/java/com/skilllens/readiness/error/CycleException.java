package com.skilllens.readiness.error;

public class CycleException extends ReadinessException {
    public CycleException(String message) {
        super("CYCLE_DETECTED", message);
    }
}
