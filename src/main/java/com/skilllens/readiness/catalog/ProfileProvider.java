package com.skilllens.readiness.catalog;

import com.skilllens.readiness.domain.DomainModels.CandidateProfile;

import java.util.Optional;

public interface ProfileProvider {
    Optional<CandidateProfile> findProfile(String candidateId);
}
