package com.communitychallenge.platform.controller;

import com.communitychallenge.platform.dto.CreateChallengeRequest;
import com.communitychallenge.platform.dto.SetEnabledRequest;
import com.communitychallenge.platform.dto.UpdateChallengeRequest;
import com.communitychallenge.platform.dto.UpdateSettingsRequest;
import com.communitychallenge.platform.model.Challenge;
import com.communitychallenge.platform.model.ChallengeSettings;
import com.communitychallenge.platform.model.RewardGrant;
import com.communitychallenge.platform.service.ChallengeAdminService;
import com.communitychallenge.platform.service.QueryService;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * Administrative surface for configuring challenges and the global settings.
 */
@RestController
@RequestMapping("/api/v1/admin")
public class ChallengeAdminController {

    private static final Logger logger = LoggerFactory.getLogger(ChallengeAdminController.class);

    private final ChallengeAdminService adminService;
    private final QueryService queryService;

    @Autowired
    public ChallengeAdminController(ChallengeAdminService adminService, QueryService queryService) {
        this.adminService = adminService;
        this.queryService = queryService;
    }

    /**
     * POST /api/v1/admin/challenges
     */
    @PostMapping("/challenges")
    public ResponseEntity<Challenge> createChallenge(@Valid @RequestBody CreateChallengeRequest request) {
        logger.info("Received POST request to create challenge - name: {}, type: {}, target: {}",
            request.getName(), request.getChallengeType(), request.getTargetAmount());

        try {
            Challenge challenge = adminService.createChallenge(request);
            return ResponseEntity.status(HttpStatus.CREATED).body(challenge);
        } catch (Exception e) {
            logger.error("Error creating challenge - name: {}, error: {}", request.getName(), e.getMessage());
            throw e;
        }
    }

    /**
     * PATCH /api/v1/admin/challenges/{challengeId}
     */
    @PatchMapping("/challenges/{challengeId}")
    public ResponseEntity<Challenge> updateChallenge(
            @PathVariable Long challengeId,
            @Valid @RequestBody UpdateChallengeRequest request) {
        logger.info("Received PATCH request to update challenge {}", challengeId);

        try {
            return ResponseEntity.ok(adminService.updateChallenge(challengeId, request));
        } catch (Exception e) {
            logger.error("Error updating challenge {} - error: {}", challengeId, e.getMessage());
            throw e;
        }
    }

    /**
     * PUT /api/v1/admin/challenges/{challengeId}/enabled
     */
    @PutMapping("/challenges/{challengeId}/enabled")
    public ResponseEntity<Challenge> setEnabled(
            @PathVariable Long challengeId,
            @Valid @RequestBody SetEnabledRequest request) {
        logger.info("Received PUT request to set challenge {} enabled: {}", challengeId, request.getEnabled());
        return ResponseEntity.ok(adminService.setEnabled(challengeId, request.getEnabled()));
    }

    /**
     * POST /api/v1/admin/challenges/{challengeId}/reset
     */
    @PostMapping("/challenges/{challengeId}/reset")
    public ResponseEntity<Challenge> resetChallenge(@PathVariable Long challengeId) {
        logger.info("Received POST request to reset challenge {}", challengeId);

        try {
            return ResponseEntity.ok(adminService.resetChallenge(challengeId));
        } catch (Exception e) {
            logger.error("Error resetting challenge {} - error: {}", challengeId, e.getMessage());
            throw e;
        }
    }

    /**
     * DELETE /api/v1/admin/challenges/{challengeId}
     */
    @DeleteMapping("/challenges/{challengeId}")
    public ResponseEntity<Void> deleteChallenge(@PathVariable Long challengeId) {
        logger.info("Received DELETE request for challenge {}", challengeId);
        adminService.deleteChallenge(challengeId);
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/settings")
    public ResponseEntity<ChallengeSettings> getSettings() {
        return ResponseEntity.ok(adminService.getSettings());
    }

    @PutMapping("/settings")
    public ResponseEntity<ChallengeSettings> updateSettings(@RequestBody UpdateSettingsRequest request) {
        logger.info("Received PUT request to update settings - enabled: {}, announcementChannelId: {}",
            request.getEnabled(), request.getAnnouncementChannelId());
        return ResponseEntity.ok(adminService.updateSettings(request));
    }

    /**
     * Rewards that could not be delivered.
     * GET /api/v1/admin/challenges/{challengeId}/reward-failures
     */
    @GetMapping("/challenges/{challengeId}/reward-failures")
    public ResponseEntity<List<RewardGrant>> getRewardFailures(@PathVariable Long challengeId) {
        return ResponseEntity.ok(queryService.getRewardFailures(challengeId));
    }

    /**
     * POST /api/v1/admin/challenges/{challengeId}/reward-failures/retry
     */
    @PostMapping("/challenges/{challengeId}/reward-failures/retry")
    public ResponseEntity<List<RewardGrant>> retryFailedRewards(@PathVariable Long challengeId) {
        logger.info("Received POST request to retry failed rewards of challenge {}", challengeId);

        try {
            return ResponseEntity.ok(adminService.retryFailedRewards(challengeId));
        } catch (Exception e) {
            logger.error("Error retrying failed rewards of challenge {} - error: {}", challengeId, e.getMessage());
            throw e;
        }
    }
}
