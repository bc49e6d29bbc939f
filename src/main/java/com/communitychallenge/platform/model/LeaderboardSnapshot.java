package com.communitychallenge.platform.model;

import lombok.AllArgsConstructor;
import lombok.Data;

import java.util.List;

/**
 * A challenge row and its ledger entries read from one database snapshot.
 */
@Data
@AllArgsConstructor
public class LeaderboardSnapshot {
    private Challenge challenge;
    private List<ContributionEntry> contributions;
}
