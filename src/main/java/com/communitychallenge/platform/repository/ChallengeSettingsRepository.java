package com.communitychallenge.platform.repository;

import com.communitychallenge.platform.model.ChallengeSettings;

import java.util.Optional;

public interface ChallengeSettingsRepository {
    ChallengeSettings save(ChallengeSettings settings);
    Optional<ChallengeSettings> findSettings();
}
