package com.communitychallenge.platform.repository.impl;

import com.communitychallenge.platform.model.ChallengeSettings;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface ChallengeSettingsJpaRepository extends JpaRepository<ChallengeSettings, Integer> {
}
