package com.communitychallenge.platform.repository.impl;

import com.communitychallenge.platform.model.ChallengeSettings;
import com.communitychallenge.platform.repository.ChallengeSettingsRepository;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public class JpaChallengeSettingsRepository implements ChallengeSettingsRepository {
    
    private final ChallengeSettingsJpaRepository jpaRepository;
    
    @Autowired
    public JpaChallengeSettingsRepository(ChallengeSettingsJpaRepository jpaRepository) {
        this.jpaRepository = jpaRepository;
    }
    
    @Override
    public ChallengeSettings save(ChallengeSettings settings) {
        settings.setSettingsId(ChallengeSettings.SINGLETON_ID);
        return jpaRepository.save(settings);
    }
    
    @Override
    public Optional<ChallengeSettings> findSettings() {
        return jpaRepository.findById(ChallengeSettings.SINGLETON_ID);
    }
}
