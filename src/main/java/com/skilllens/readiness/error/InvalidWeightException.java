package com.skilllens.readiness.error;

public class InvalidWeightException extends ReadinessException {
    public InvalidWeightException(String message) {
        super("INVALID_WEIGHT", message);
    }
}
