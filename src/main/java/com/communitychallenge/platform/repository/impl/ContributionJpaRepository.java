package com.communitychallenge.platform.repository.impl;

import com.communitychallenge.platform.model.ContributionEntry;
import com.communitychallenge.platform.model.ContributionEntryId;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface ContributionJpaRepository extends JpaRepository<ContributionEntry, ContributionEntryId> {
    Optional<ContributionEntry> findByChallengeIdAndContributorId(Long challengeId, String contributorId);

    List<ContributionEntry> findByChallengeIdOrderByAmountContributedDescFirstContributedAtAscContributorIdAsc(
            Long challengeId);

    @Modifying
    @Query("delete from ContributionEntry e where e.challengeId = :challengeId")
    int deleteAllByChallengeId(@Param("challengeId") Long challengeId);
}
