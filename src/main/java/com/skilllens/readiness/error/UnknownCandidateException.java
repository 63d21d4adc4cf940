package com.skilllens.readiness.error;

public class UnknownCandidateException extends ReadinessException {
    public UnknownCandidateException(String candidateId) {
        super("UNKNOWN_CANDIDATE", "Candidate '" + candidateId + "' not found");
    }
}
