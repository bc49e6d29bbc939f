package com.communitychallenge.platform.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ContributionEntryId implements Serializable {
    private Long challengeId;
    private String contributorId;
}
