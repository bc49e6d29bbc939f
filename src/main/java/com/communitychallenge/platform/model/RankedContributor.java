package com.communitychallenge.platform.model;

import com.fasterxml.jackson.annotation.JsonFormat;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Comparator;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RankedContributor {

    /**
     * Highest amount first; equal amounts rank by earliest first contribution, then contributor id.
     */
    public static final Comparator<RankedContributor> LEADERBOARD_ORDER = Comparator
        .comparingLong(RankedContributor::getAmountContributed).reversed()
        .thenComparing(RankedContributor::getFirstContributedAt, Comparator.nullsLast(Comparator.naturalOrder()))
        .thenComparing(RankedContributor::getContributorId);

    private Integer rank;
    private String contributorId;
    private long amountContributed;

    @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = "yyyy-MM-dd'T'HH:mm:ss.SSS'Z'", timezone = "UTC")
    private Instant firstContributedAt;
}
