package com.communitychallenge.platform.controller;

import com.communitychallenge.platform.dto.ActiveChallengesResponse;
import com.communitychallenge.platform.dto.LeaderboardResponse;
import com.communitychallenge.platform.dto.ReportProgressByTypeRequest;
import com.communitychallenge.platform.dto.ReportProgressRequest;
import com.communitychallenge.platform.dto.ReportProgressResponse;
import com.communitychallenge.platform.model.LeaderboardView;
import com.communitychallenge.platform.model.ProgressResult;
import com.communitychallenge.platform.model.ProgressSnapshot;
import com.communitychallenge.platform.service.AggregationEngine;
import com.communitychallenge.platform.service.QueryService;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.List;

@RestController
@RequestMapping("/api/v1/challenges")
public class ChallengeController {

    private static final Logger logger = LoggerFactory.getLogger(ChallengeController.class);

    private final AggregationEngine aggregationEngine;
    private final QueryService queryService;

    @Autowired
    public ChallengeController(AggregationEngine aggregationEngine, QueryService queryService) {
        this.aggregationEngine = aggregationEngine;
        this.queryService = queryService;
    }

    /**
     * Report progress towards one challenge.
     * POST /api/v1/challenges/{challengeId}/progress
     */
    @PostMapping("/{challengeId}/progress")
    public ResponseEntity<ReportProgressResponse> reportProgress(
            @PathVariable Long challengeId,
            @Valid @RequestBody ReportProgressRequest request) {

        logger.info("Received POST request to report progress - challengeId: {}, contributorId: {}, amount: {}",
            challengeId, request.getContributorId(), request.getAmount());

        try {
            ProgressResult result = aggregationEngine.reportProgress(
                challengeId, request.getContributorId(), request.getAmount(), request.getIdempotencyKey());
            return ResponseEntity.ok(ReportProgressResponse.from(result));
        } catch (Exception e) {
            logger.error("Error reporting progress - challengeId: {}, contributorId: {}, error: {}",
                challengeId, request.getContributorId(), e.getMessage());
            throw e;
        }
    }

    /**
     * Report progress towards every active challenge of a type.
     * POST /api/v1/challenges/progress
     */
    @PostMapping("/progress")
    public ResponseEntity<List<ReportProgressResponse>> reportProgressByType(
            @Valid @RequestBody ReportProgressByTypeRequest request) {

        logger.info("Received POST request to report progress by type - type: {}, contributorId: {}, amount: {}",
            request.getChallengeType(), request.getContributorId(), request.getAmount());

        try {
            List<ReportProgressResponse> responses = aggregationEngine.reportProgressByType(
                    request.getChallengeType(), request.getContributorId(),
                    request.getAmount(), request.getIdempotencyKey())
                .stream()
                .map(ReportProgressResponse::from)
                .toList();
            return ResponseEntity.ok(responses);
        } catch (Exception e) {
            logger.error("Error reporting progress by type - type: {}, contributorId: {}, error: {}",
                request.getChallengeType(), request.getContributorId(), e.getMessage());
            throw e;
        }
    }

    /**
     * GET /api/v1/challenges/active
     */
    @GetMapping("/active")
    public ResponseEntity<ActiveChallengesResponse> listActiveChallenges() {
        List<ProgressSnapshot> challenges = queryService.listActiveChallenges();
        logger.debug("Listing {} active challenges", challenges.size());
        return ResponseEntity.ok(ActiveChallengesResponse.builder()
            .challenges(challenges)
            .retrievedAt(Instant.now())
            .build());
    }

    /**
     * GET /api/v1/challenges/{challengeId}/progress
     */
    @GetMapping("/{challengeId}/progress")
    public ResponseEntity<ProgressSnapshot> getProgress(@PathVariable Long challengeId) {
        return ResponseEntity.ok(queryService.getProgress(challengeId));
    }

    /**
     * Top contributors of a challenge.
     * GET /api/v1/challenges/{challengeId}/leaderboard?limit=N
     */
    @GetMapping("/{challengeId}/leaderboard")
    public ResponseEntity<LeaderboardResponse> getLeaderboard(
            @PathVariable Long challengeId,
            @RequestParam(required = false) Integer limit) {

        logger.info("Received GET request for leaderboard - challengeId: {}, limit: {}", challengeId, limit);

        try {
            LeaderboardView view = queryService.getLeaderboard(challengeId, limit);

            LeaderboardResponse response = LeaderboardResponse.builder()
                .challengeId(view.getChallengeId())
                .name(view.getName())
                .currentAmount(view.getCurrentAmount())
                .targetAmount(view.getTargetAmount())
                .status(view.getStatus())
                .contributors(view.getContributors())
                .totalContributors(view.getTotalContributors())
                .retrievedAt(Instant.now())
                .build();

            logger.info("Successfully retrieved leaderboard - challengeId: {}, totalContributors: {}, returned: {}",
                challengeId, view.getTotalContributors(), view.getContributors().size());

            return ResponseEntity.ok(response);
        } catch (Exception e) {
            logger.error("Error retrieving leaderboard - challengeId: {}, limit: {}, error: {}",
                challengeId, limit, e.getMessage());
            throw e;
        }
    }
}
