package com.communitychallenge.platform.model;

import com.fasterxml.jackson.annotation.JsonFormat;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Entity
@Table(name = "challenge_contributions", indexes = {
    @Index(name = "idx_contribution_challenge_amount",
        columnList = "challenge_id,amount_contributed DESC,first_contributed_at ASC")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@IdClass(ContributionEntryId.class)
public class ContributionEntry {
    @Id
    @Column(name = "challenge_id", nullable = false)
    private Long challengeId;

    @Id
    @Column(name = "contributor_id", nullable = false, length = 64)
    private String contributorId;

    @Column(name = "amount_contributed", nullable = false)
    private long amountContributed;

    @Column(name = "first_contributed_at", nullable = false)
    @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = "yyyy-MM-dd'T'HH:mm:ss.SSS'Z'", timezone = "UTC")
    private Instant firstContributedAt;

    @Column(name = "last_contributed_at", nullable = false)
    @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = "yyyy-MM-dd'T'HH:mm:ss.SSS'Z'", timezone = "UTC")
    private Instant lastContributedAt;
}
